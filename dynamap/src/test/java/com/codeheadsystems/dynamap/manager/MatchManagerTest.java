package com.codeheadsystems.dynamap.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.dynamap.api.Cursor;
import com.codeheadsystems.dynamap.api.Limit;
import com.codeheadsystems.dynamap.api.MatchOption;
import com.codeheadsystems.dynamap.api.Page;
import com.codeheadsystems.dynamap.api.exception.InvalidEntityException;
import com.codeheadsystems.dynamap.api.exception.InvalidKeyException;
import com.codeheadsystems.dynamap.api.exception.ServiceIoException;
import com.codeheadsystems.dynamap.converter.EntityCodec;
import com.codeheadsystems.dynamap.fixture.InMemoryDynamoDbClient;
import com.codeheadsystems.dynamap.fixture.Person;
import com.codeheadsystems.dynamap.model.Configuration;
import com.codeheadsystems.dynamap.model.ImmutableConfiguration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;

@ExtendWith(MockitoExtension.class)
class MatchManagerTest {

  private final Configuration configuration = ImmutableConfiguration.builder().table("things").build();
  private final EntityCodec<Person> codec = new EntityCodec<>(Person.SCHEMA, "prefix", "suffix", false);

  @Mock private DynamoDbClient client;

  private InMemoryDynamoDbClient memory;
  private MatchManager<Person> manager;

  @BeforeEach
  void setup() {
    memory = new InMemoryDynamoDbClient("prefix", "suffix");
    manager = new MatchManager<>(memory, configuration, codec);
    for (int i = 0; i < 5; i++) {
      store(Person.of("person:joe", "address:" + i, "Joe " + i));
    }
    store(Person.of("person:joe", "phone:1", "Joe phone"));
    store(Person.of("person:ann", "address:1", "Ann"));
  }

  private void store(final Person person) {
    memory.putItem(PutItemRequest.builder().tableName("things").item(codec.encode(person)).build());
  }

  @Test
  void match_hashOnly_returnsPartition() {
    final Page<Person> page = manager.match(Person.key("person:joe", ""));
    assertThat(page.items()).hasSize(6);
    assertThat(page.hasMore()).isFalse();
    assertThat(page.cursor()).isEmpty();
  }

  @Test
  void match_sortPrefix() {
    final Page<Person> page = manager.match(Person.key("person:joe", "address:"));
    assertThat(page.items()).extracting(Person::name)
        .containsExactly("Joe 0", "Joe 1", "Joe 2", "Joe 3", "Joe 4");
  }

  @Test
  void match_pagesUntilExhausted() {
    final List<Person> all = new ArrayList<>();
    Optional<Cursor> cursor = Optional.empty();
    int calls = 0;
    do {
      final List<MatchOption> options = new ArrayList<>(List.of(Limit.of(2)));
      cursor.ifPresent(options::add);
      final Page<Person> page = manager.match(Person.key("person:joe", "address:"),
          options.toArray(new MatchOption[0]));
      assertThat(page.items().size()).isLessThanOrEqualTo(2);
      all.addAll(page.items());
      cursor = page.cursor();
      calls++;
    } while (cursor.isPresent());

    assertThat(calls).isEqualTo(3);
    assertThat(all).extracting(Person::name).containsExactly("Joe 0", "Joe 1", "Joe 2", "Joe 3", "Joe 4");
  }

  @Test
  void match_trailingSlash_excludesSiblingBranches() {
    store(Person.of("person:kim", "order/1", "First order"));
    store(Person.of("person:kim", "order/2", "Second order"));
    store(Person.of("person:kim", "orders/9", "Orders summary"));

    assertThat(manager.match(Person.key("person:kim", "order/")).items()).extracting(Person::name)
        .containsExactly("First order", "Second order");
    assertThat(manager.match(Person.key("person:kim", "order")).items()).hasSize(3);
  }

  @Test
  void match_cursorWithEmptyHashKey_fails() {
    assertThatExceptionOfType(InvalidKeyException.class)
        .isThrownBy(() -> manager.match(Person.key("person:joe", ""), Cursor.of("", "address:1")));
    assertThat(memory.queries()).isZero();
  }

  @Test
  void match_cursorHoldsRawKey() {
    final Page<Person> page = manager.match(Person.key("person:joe", "address:"), Limit.of(1));
    assertThat(page.cursor()).contains(Cursor.of("person:joe", "address:0"));
  }

  @Test
  void stream_readsEveryPageLazily() {
    assertThat(manager.stream(Person.key("person:joe", ""), 4).map(Person::name).collect(Collectors.toList()))
        .hasSize(6)
        .startsWith("Joe 0")
        .endsWith("Joe phone");
    assertThat(memory.queries()).isEqualTo(2);
  }

  @Test
  void stream_stopsWhenConsumerDoes() {
    assertThat(manager.stream(Person.key("person:joe", ""), 2).findFirst()).isPresent();
    assertThat(memory.queries()).isEqualTo(1);
  }

  @Test
  void match_emptyHashKey_fails() {
    assertThatExceptionOfType(InvalidKeyException.class).isThrownBy(() -> manager.match(Person.key("", "x")));
  }

  @Test
  void match_request() {
    final MatchManager<Person> mocked = new MatchManager<>(client,
        ImmutableConfiguration.builder().from(configuration).index("byOwner").build(), codec);
    when(client.query(any(QueryRequest.class))).thenReturn(QueryResponse.builder().build());

    mocked.match(Person.key("person:joe", "address:"), Limit.of(10), Cursor.of("person:joe", ""));

    final ArgumentCaptor<QueryRequest> captor = ArgumentCaptor.forClass(QueryRequest.class);
    verify(client).query(captor.capture());
    final QueryRequest request = captor.getValue();
    assertThat(request.tableName()).isEqualTo("things");
    assertThat(request.indexName()).isEqualTo("byOwner");
    assertThat(request.keyConditionExpression())
        .isEqualTo("#__prefix__ = :__prefix__ and begins_with(#__suffix__, :__suffix__)");
    assertThat(request.expressionAttributeValues())
        .containsEntry(":__prefix__", AttributeValue.fromS("person:joe"))
        .containsEntry(":__suffix__", AttributeValue.fromS("address:"));
    assertThat(request.projectionExpression()).isEqualTo(codec.projection());
    assertThat(request.limit()).isEqualTo(10);
    assertThat(request.exclusiveStartKey())
        .containsEntry("prefix", AttributeValue.fromS("person:joe"))
        .containsEntry("suffix", AttributeValue.fromS("_"));
  }

  @Test
  void match_hashOnlyRequest_hasNoSortCondition() {
    final MatchManager<Person> mocked = new MatchManager<>(client, configuration, codec);
    when(client.query(any(QueryRequest.class))).thenReturn(QueryResponse.builder().build());

    mocked.match(Person.key("person:joe", ""));

    final ArgumentCaptor<QueryRequest> captor = ArgumentCaptor.forClass(QueryRequest.class);
    verify(client).query(captor.capture());
    assertThat(captor.getValue().keyConditionExpression()).isEqualTo("#__prefix__ = :__prefix__");
    assertThat(captor.getValue().expressionAttributeValues()).doesNotContainKey(":__suffix__");
    assertThat(captor.getValue().hasExclusiveStartKey()).isFalse();
    assertThat(captor.getValue().indexName()).isNull();
  }

  @Test
  void match_undecodableItem_failsWholePage() {
    final MatchManager<Person> mocked = new MatchManager<>(client, configuration, codec);
    when(client.query(any(QueryRequest.class))).thenReturn(QueryResponse.builder()
        .items(codec.encode(Person.of("person:joe", "a", "Joe")), Map.of("prefix", AttributeValue.fromS("x")))
        .build());

    assertThatExceptionOfType(InvalidEntityException.class)
        .isThrownBy(() -> mocked.match(Person.key("person:joe", "")));
  }

  @Test
  void match_backendFailure() {
    final MatchManager<Person> mocked = new MatchManager<>(client, configuration, codec);
    when(client.query(any(QueryRequest.class))).thenThrow(DynamoDbException.builder().message("boom").build());

    assertThatExceptionOfType(ServiceIoException.class)
        .isThrownBy(() -> mocked.match(Person.key("person:joe", "")))
        .withCauseInstanceOf(DynamoDbException.class);
  }
}
