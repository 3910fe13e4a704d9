package com.codeheadsystems.dynamap.fixture;

import com.codeheadsystems.dynamap.api.Identity;
import com.codeheadsystems.dynamap.api.Thing;
import com.codeheadsystems.dynamap.converter.ValueCodecs;
import com.codeheadsystems.dynamap.schema.EntitySchema;
import com.codeheadsystems.dynamap.schema.Field;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Entity used across the tests.
 */
public final class Person implements Thing {

  public static final Field<Person, Identity> HASH_KEY =
      Field.of("hashKey", "prefix", ValueCodecs.identity(), Person::hashKey);
  public static final Field<Person, Identity> SORT_KEY =
      Field.of("sortKey", "suffix", ValueCodecs.identity(), Person::sortKey);
  public static final Field<Person, String> NAME =
      Field.of("name", "anothername", ValueCodecs.string(), Person::name);
  public static final Field<Person, Integer> AGE =
      Field.of("age", "age,omitempty", ValueCodecs.integer(), Person::age);
  public static final Field<Person, Set<String>> TAGS =
      Field.of("tags", "tags,stringset", ValueCodecs.stringSet(), Person::tags);
  public static final Field<Person, String> NOTE =
      Field.of("note", "anothernone,omitempty", ValueCodecs.string(), Person::note);

  public static final EntitySchema<Person> SCHEMA = EntitySchema.builder(Person.class)
      .field(HASH_KEY)
      .field(SORT_KEY)
      .field(NAME)
      .field(AGE)
      .field(TAGS)
      .field(NOTE)
      .decoder(reader -> new Person(
          reader.get(HASH_KEY),
          reader.get(SORT_KEY),
          reader.get(NAME),
          reader.get(AGE),
          reader.get(TAGS),
          reader.get(NOTE)))
      .build();

  private final Identity hashKey;
  private final Identity sortKey;
  private final String name;
  private final Integer age;
  private final Set<String> tags;
  private final String note;

  public Person(final Identity hashKey,
                final Identity sortKey,
                final String name,
                final Integer age,
                final Set<String> tags,
                final String note) {
    this.hashKey = hashKey;
    this.sortKey = sortKey == null ? Identity.EMPTY : sortKey;
    this.name = name;
    this.age = age;
    this.tags = tags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
    this.note = note;
  }

  public static Person of(final String hashKey, final String sortKey, final String name) {
    return new Person(Identity.of(hashKey), Identity.of(sortKey), name, null, null, null);
  }

  public static Person key(final String hashKey, final String sortKey) {
    return of(hashKey, sortKey, null);
  }

  @Override
  public Identity hashKey() {
    return hashKey;
  }

  @Override
  public Identity sortKey() {
    return sortKey;
  }

  public String name() {
    return name;
  }

  public Integer age() {
    return age;
  }

  public Set<String> tags() {
    return tags;
  }

  public String note() {
    return note;
  }

  public Person withAge(final Integer age) {
    return new Person(hashKey, sortKey, name, age, tags, note);
  }

  public Person withTags(final String... tags) {
    return new Person(hashKey, sortKey, name, age, new LinkedHashSet<>(Set.of(tags)), note);
  }

  public Person withNote(final String note) {
    return new Person(hashKey, sortKey, name, age, tags, note);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Person)) {
      return false;
    }
    final Person other = (Person) o;
    return Objects.equals(hashKey, other.hashKey) && Objects.equals(sortKey, other.sortKey)
        && Objects.equals(name, other.name) && Objects.equals(age, other.age)
        && Objects.equals(tags, other.tags) && Objects.equals(note, other.note);
  }

  @Override
  public int hashCode() {
    return Objects.hash(hashKey, sortKey, name, age, tags, note);
  }

  @Override
  public String toString() {
    return "Person{" + hashKey + ", " + sortKey + ", " + name + ", " + age + ", " + tags + ", " + note + "}";
  }
}
