package com.codeheadsystems.dynamap.fixture;

import com.codeheadsystems.dynamap.api.Identity;
import com.codeheadsystems.dynamap.api.Thing;
import com.codeheadsystems.dynamap.converter.ValueCodecs;
import com.codeheadsystems.dynamap.schema.EntitySchema;
import com.codeheadsystems.dynamap.schema.Field;
import java.util.Objects;

/**
 * Entity keyed by its hash key alone. It declares no sort key field, and one of its attributes is stored under a
 * name that starts like the scope of update conditions.
 */
public final class Document implements Thing {

  public static final Field<Document, Identity> HASH_KEY =
      Field.of("hashKey", "prefix", ValueCodecs.identity(), Document::hashKey);
  public static final Field<Document, String> TITLE =
      Field.of("title", "x", ValueCodecs.string(), Document::title);
  public static final Field<Document, String> COPY =
      Field.of("copy", "c_x,omitempty", ValueCodecs.string(), Document::copy);

  public static final EntitySchema<Document> SCHEMA = EntitySchema.builder(Document.class)
      .field(HASH_KEY)
      .field(TITLE)
      .field(COPY)
      .decoder(reader -> new Document(reader.get(HASH_KEY), reader.get(TITLE), reader.get(COPY)))
      .build();

  private final Identity hashKey;
  private final String title;
  private final String copy;

  public Document(final Identity hashKey, final String title, final String copy) {
    this.hashKey = hashKey;
    this.title = title;
    this.copy = copy;
  }

  public static Document of(final String hashKey, final String title, final String copy) {
    return new Document(Identity.of(hashKey), title, copy);
  }

  @Override
  public Identity hashKey() {
    return hashKey;
  }

  public String title() {
    return title;
  }

  public String copy() {
    return copy;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Document)) {
      return false;
    }
    final Document other = (Document) o;
    return Objects.equals(hashKey, other.hashKey) && Objects.equals(title, other.title)
        && Objects.equals(copy, other.copy);
  }

  @Override
  public int hashCode() {
    return Objects.hash(hashKey, title, copy);
  }

  @Override
  public String toString() {
    return "Document{" + hashKey + ", " + title + ", " + copy + "}";
  }
}
