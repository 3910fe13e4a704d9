package com.codeheadsystems.dynamap.schema;

import com.codeheadsystems.dynamap.api.Thing;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Static description of how an entity type is stored: its fields and how to rebuild it from an item.
 *
 * <p>Resolved once when built. Storage names never change afterwards, so a schema is safe to share between threads.
 *
 * @param <T> the entity type
 */
public final class EntitySchema<T extends Thing> {

  private final Class<T> type;
  private final List<Field<T, ?>> fields;
  private final Map<String, Field<T, ?>> byName;
  private final Map<String, Field<T, ?>> byStorageName;
  private final Function<ItemReader<T>, T> decoder;

  private EntitySchema(final Builder<T> builder) {
    this.type = builder.type;
    this.fields = List.copyOf(builder.fields);
    this.decoder = builder.decoder;
    final Map<String, Field<T, ?>> names = new LinkedHashMap<>();
    final Map<String, Field<T, ?>> storageNames = new LinkedHashMap<>();
    for (Field<T, ?> field : fields) {
      if (names.put(field.name(), field) != null) {
        throw new IllegalArgumentException("Duplicate field " + field.name() + " in schema of " + type.getName());
      }
      if (storageNames.put(field.storageName(), field) != null) {
        throw new IllegalArgumentException(
            "Duplicate storage name " + field.storageName() + " in schema of " + type.getName());
      }
    }
    this.byName = Collections.unmodifiableMap(names);
    this.byStorageName = Collections.unmodifiableMap(storageNames);
  }

  /**
   * Builder builder.
   *
   * @param type the entity type
   * @param <T>  the entity type
   * @return the builder
   */
  public static <T extends Thing> Builder<T> builder(final Class<T> type) {
    return new Builder<>(type);
  }

  /**
   * Type class.
   *
   * @return the class
   */
  public Class<T> type() {
    return type;
  }

  /**
   * Fields in declaration order.
   *
   * @return the list
   */
  public List<Field<T, ?>> fields() {
    return fields;
  }

  /**
   * Field by in-memory name.
   *
   * @param name the name
   * @return the optional
   */
  public Optional<Field<T, ?>> field(final String name) {
    return Optional.ofNullable(byName.get(name));
  }

  /**
   * Field by storage name.
   *
   * @param storageName the storage name
   * @return the optional
   */
  public Optional<Field<T, ?>> fieldByStorageName(final String storageName) {
    return Optional.ofNullable(byStorageName.get(storageName));
  }

  /**
   * Storage names set.
   *
   * @return the set
   */
  public Set<String> storageNames() {
    return byStorageName.keySet();
  }

  /**
   * Rebuilds an entity from an item.
   *
   * @param reader the reader
   * @return the entity
   */
  public T decode(final ItemReader<T> reader) {
    return decoder.apply(reader);
  }

  @Override
  public String toString() {
    return "EntitySchema{" + type.getSimpleName() + ": "
        + fields.stream().map(Field::toString).collect(Collectors.joining(", ")) + "}";
  }

  /**
   * Builder of an entity schema.
   *
   * @param <T> the entity type
   */
  public static final class Builder<T extends Thing> {

    private final Class<T> type;
    private final List<Field<T, ?>> fields = new ArrayList<>();
    private Function<ItemReader<T>, T> decoder;

    private Builder(final Class<T> type) {
      this.type = type;
    }

    /**
     * Adds a field.
     *
     * @param field the field
     * @return the builder
     */
    public Builder<T> field(final Field<T, ?> field) {
      fields.add(field);
      return this;
    }

    /**
     * Adds fields.
     *
     * @param fields the fields
     * @return the builder
     */
    public Builder<T> fields(final List<? extends Field<T, ?>> fields) {
      this.fields.addAll(fields);
      return this;
    }

    /**
     * Sets how an entity is rebuilt from an item.
     *
     * @param decoder the decoder
     * @return the builder
     */
    public Builder<T> decoder(final Function<ItemReader<T>, T> decoder) {
      this.decoder = decoder;
      return this;
    }

    /**
     * Build entity schema.
     *
     * @return the entity schema
     * @throws IllegalArgumentException when the schema is incomplete or names collide
     */
    public EntitySchema<T> build() {
      if (type == null) {
        throw new IllegalArgumentException("Entity type is required");
      }
      if (fields.isEmpty()) {
        throw new IllegalArgumentException("Schema of " + type.getName() + " declares no fields");
      }
      if (decoder == null) {
        throw new IllegalArgumentException("Schema of " + type.getName() + " declares no decoder");
      }
      return new EntitySchema<>(this);
    }
  }
}
