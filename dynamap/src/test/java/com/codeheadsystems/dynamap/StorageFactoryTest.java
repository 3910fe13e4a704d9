package com.codeheadsystems.dynamap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import com.codeheadsystems.dynamap.api.BatchResult;
import com.codeheadsystems.dynamap.api.Limit;
import com.codeheadsystems.dynamap.api.Page;
import com.codeheadsystems.dynamap.api.exception.InvalidKeyException;
import com.codeheadsystems.dynamap.api.exception.NotFoundException;
import com.codeheadsystems.dynamap.converter.CursorCodec;
import com.codeheadsystems.dynamap.fixture.Document;
import com.codeheadsystems.dynamap.fixture.InMemoryDynamoDbClient;
import com.codeheadsystems.dynamap.fixture.Person;
import com.codeheadsystems.dynamap.model.Configuration;
import com.codeheadsystems.dynamap.model.ImmutableConfiguration;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StorageFactoryTest {

  private InMemoryDynamoDbClient client;
  private KeyVal<Person> keyVal;

  @BeforeEach
  void setup() {
    final Configuration configuration = ImmutableConfiguration.builder().table("things").build();
    client = new InMemoryDynamoDbClient(configuration.hashKey(), configuration.sortKey());
    keyVal = new StorageFactory(client, configuration).create(Person.SCHEMA);
  }

  @Test
  void putGetRemove() {
    final Person joe = Person.of("person:joe", "", "Joe").withAge(42).withTags("admin");
    keyVal.put(joe);

    assertThat(keyVal.get(Person.key("person:joe", ""))).isEqualTo(joe);
    assertThat(keyVal.remove(Person.key("person:joe", ""))).contains(joe);
    assertThat(keyVal.remove(Person.key("person:joe", ""))).isEmpty();
    assertThatExceptionOfType(NotFoundException.class).isThrownBy(() -> keyVal.get(joe));
  }

  @Test
  void get_emptyHashKey_fails() {
    assertThatExceptionOfType(InvalidKeyException.class).isThrownBy(() -> keyVal.get(Person.key("", "x")));
  }

  @Test
  void batchThenMatch() {
    final List<Person> addresses = IntStream.range(0, 7)
        .mapToObj(i -> Person.of("person:joe", "address:" + i, "Address " + i))
        .collect(Collectors.toList());
    assertThat(keyVal.batchPut(addresses).orThrow()).isEmpty();
    keyVal.put(Person.of("person:joe", "", "Joe"));

    final Page<Person> first = keyVal.match(Person.key("person:joe", "address:"), Limit.of(5));
    assertThat(first.items()).hasSize(5);
    assertThat(first.cursor()).isPresent();

    final CursorCodec cursorCodec = new CursorCodec(new ObjectMapper());
    final String token = cursorCodec.encode(first.cursor().get());
    final Page<Person> second = keyVal.matchKey(Person.key("person:joe", "address:"),
        Limit.of(5), cursorCodec.decode(token));
    assertThat(second.items()).extracting(Person::name).containsExactly("Address 5", "Address 6");
    assertThat(second.hasMore()).isFalse();

    assertThat(keyVal.stream(Person.key("person:joe", ""), 3).count()).isEqualTo(8);
  }

  @Test
  void batchGetAndRemove() {
    final List<Person> people = List.of(Person.of("person:a", "", "A"), Person.of("person:b", "", "B"));
    keyVal.batchPut(people);

    final BatchResult<Person> read = keyVal.batchGet(List.of(Person.key("person:a", ""),
        Person.key("person:b", ""), Person.key("person:c", "")));
    assertThat(read.items()).containsExactlyInAnyOrderElementsOf(people);
    assertThat(read.isComplete()).isTrue();

    assertThat(keyVal.batchRemove(people).isComplete()).isTrue();
    assertThat(client.size()).isZero();
  }

  @Test
  void entityWithoutSortKeyField_readsBackThroughProjection() {
    final KeyVal<Document> documents = new StorageFactory(client,
        ImmutableConfiguration.builder().table("things").build()).create(Document.SCHEMA);
    final Document first = Document.of("doc:1", "First", "copy");
    final Document second = Document.of("doc:2", "Second", null);
    documents.put(first);
    documents.put(second);

    assertThat(documents.get(Document.of("doc:1", null, null))).isEqualTo(first);
    assertThat(documents.match(Document.of("doc:2", null, null)).items()).containsExactly(second);
    assertThat(documents.batchGet(List.of(Document.of("doc:1", null, null), Document.of("doc:2", null, null)))
        .items()).containsExactlyInAnyOrder(first, second);
  }
}
