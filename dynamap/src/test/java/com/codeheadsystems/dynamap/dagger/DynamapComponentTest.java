package com.codeheadsystems.dynamap.dagger;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.dynamap.KeyVal;
import com.codeheadsystems.dynamap.fixture.InMemoryDynamoDbClient;
import com.codeheadsystems.dynamap.fixture.Person;
import com.codeheadsystems.dynamap.model.ImmutableConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DynamapComponentTest {

  private DynamapComponent component;

  @BeforeEach
  void setup() {
    component = DynamapComponent.instance(
        ImmutableConfiguration.builder().table("things").build(),
        new InMemoryDynamoDbClient("prefix", "suffix"));
  }

  @Test
  void testStorageFactory() {
    assertThat(component.storageFactory()).isSameAs(component.storageFactory());
    final KeyVal<Person> keyVal = component.storageFactory().create(Person.SCHEMA);
    keyVal.put(Person.of("person:joe", "", "Joe"));
    assertThat(keyVal.get(Person.key("person:joe", "")).name()).isEqualTo("Joe");
  }

  @Test
  void testCodecs() {
    assertThat(component.cursorCodec()).isNotNull();
    assertThat(component.connectionUrlConverter().convert("ddb:///things").table()).isEqualTo("things");
    assertThat(component.objectMapper()).isSameAs(component.objectMapper());
  }
}
