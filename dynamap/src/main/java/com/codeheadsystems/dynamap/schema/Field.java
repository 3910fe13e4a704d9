package com.codeheadsystems.dynamap.schema;

import com.codeheadsystems.dynamap.converter.ValueCodec;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * A persisted field of entity type {@code T} holding values of type {@code A}.
 *
 * <p>Binds the in-memory field name to its storage attribute name, the codec for its values and the getter that
 * reads it from an entity. Declared once per entity type, usually as a constant next to the type.
 *
 * @param <T> the entity type
 * @param <A> the value type
 */
public final class Field<T, A> {

  private final String name;
  private final FieldTag tag;
  private final ValueCodec<A> codec;
  private final Function<T, A> getter;
  private final Optional<SetKind> setKind;

  private Field(final String name,
                final FieldTag tag,
                final ValueCodec<A> codec,
                final Function<T, A> getter) {
    this.name = name;
    this.tag = tag;
    this.codec = codec;
    this.getter = getter;
    this.setKind = resolveSetKind(name, tag, codec);
  }

  /**
   * Declares a field.
   *
   * @param name   the in-memory field name
   * @param tag    the storage tag, {@code name[,omitempty][,kind]}
   * @param codec  the value codec
   * @param getter reads the value from an entity
   * @param <T>    the entity type
   * @param <A>    the value type
   * @return the field
   * @throws IllegalArgumentException if the tag is invalid or contradicts the codec
   */
  public static <T, A> Field<T, A> of(final String name,
                                      final String tag,
                                      final ValueCodec<A> codec,
                                      final Function<T, A> getter) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Field name is required");
    }
    if (codec == null || getter == null) {
      throw new IllegalArgumentException("Field " + name + " requires a codec and a getter");
    }
    return new Field<>(name, FieldTag.parse(tag), codec, getter);
  }

  private static Optional<SetKind> resolveSetKind(final String name,
                                                  final FieldTag tag,
                                                  final ValueCodec<?> codec) {
    if (tag.setKind().isPresent() && !tag.setKind().equals(codec.setKind())) {
      throw new IllegalArgumentException("Field " + name + " is tagged " + tag.setKind().get().tag()
          + " but its codec does not encode that set type");
    }
    return codec.setKind();
  }

  /**
   * In-memory field name.
   *
   * @return the string
   */
  public String name() {
    return name;
  }

  /**
   * Storage attribute name.
   *
   * @return the string
   */
  public String storageName() {
    return tag.storageName();
  }

  /**
   * Tag field tag.
   *
   * @return the field tag
   */
  public FieldTag tag() {
    return tag;
  }

  /**
   * Set kind, present for set typed fields.
   *
   * @return the optional
   */
  public Optional<SetKind> setKind() {
    return setKind;
  }

  /**
   * Codec value codec.
   *
   * @return the value codec
   */
  public ValueCodec<A> codec() {
    return codec;
  }

  /**
   * Reads the field from an entity.
   *
   * @param entity the entity
   * @return the value
   */
  public A get(final T entity) {
    return getter.apply(entity);
  }

  /**
   * Encodes a value of this field. Null becomes the NULL attribute.
   *
   * @param value the value
   * @return the attribute value
   */
  public AttributeValue encodeValue(final A value) {
    if (value == null) {
      return AttributeValue.fromNul(true);
    }
    return codec.encode(value);
  }

  /**
   * Encodes the field of an entity. Empty when the value is omitted from storage: empty values of
   * {@code omitempty} fields and empty sets, which the storage cannot hold.
   *
   * @param entity the entity
   * @return the attribute value
   */
  public Optional<AttributeValue> encodeFrom(final T entity) {
    final A value = get(entity);
    if ((tag.omitEmpty() || setKind.isPresent()) && codec.isEmpty(value)) {
      return Optional.empty();
    }
    return Optional.of(encodeValue(value));
  }

  /**
   * Decodes the field from an item. Null when the attribute is absent or NULL, so an empty value of an
   * {@code omitempty} field, which was never written, reads back as null rather than empty.
   *
   * @param item the item
   * @return the value
   */
  public A decodeFrom(final Map<String, AttributeValue> item) {
    final AttributeValue value = item.get(storageName());
    if (value == null || Boolean.TRUE.equals(value.nul())) {
      return null;
    }
    return codec.decode(value);
  }

  @Override
  public String toString() {
    return "Field{" + name + " -> " + tag + "}";
  }
}
