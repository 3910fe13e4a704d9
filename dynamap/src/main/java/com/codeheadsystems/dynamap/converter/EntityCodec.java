package com.codeheadsystems.dynamap.converter;

import com.codeheadsystems.dynamap.api.Thing;
import com.codeheadsystems.dynamap.api.exception.InvalidEntityException;
import com.codeheadsystems.dynamap.api.exception.InvalidKeyException;
import com.codeheadsystems.dynamap.schema.EntitySchema;
import com.codeheadsystems.dynamap.schema.Field;
import com.codeheadsystems.dynamap.schema.ItemReader;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Converts entities of one schema to and from stored items.
 *
 * <p>Every stored item carries its hash and sort key as string attributes under the configured key names. An
 * empty sort key is stored as the sentinel {@value #SORT_KEY_SENTINEL} and read back as empty.
 *
 * @param <T> the entity type
 */
public class EntityCodec<T extends Thing> {

  /**
   * Stored in place of an empty sort key.
   */
  public static final String SORT_KEY_SENTINEL = "_";

  private static final Logger log = LoggerFactory.getLogger(EntityCodec.class);

  private final EntitySchema<T> schema;
  private final String hashKey;
  private final String sortKey;
  private final boolean strictType;
  private final Map<String, String> projectionNames;
  private final String projection;

  /**
   * Instantiates a new Entity codec.
   *
   * @param schema     the schema
   * @param hashKey    the hash key attribute name
   * @param sortKey    the sort key attribute name
   * @param strictType if items with attributes unknown to the schema are rejected
   */
  public EntityCodec(final EntitySchema<T> schema,
                     final String hashKey,
                     final String sortKey,
                     final boolean strictType) {
    this.schema = schema;
    this.hashKey = hashKey;
    this.sortKey = sortKey;
    this.strictType = strictType;
    final Map<String, String> names = new LinkedHashMap<>();
    Stream.concat(Stream.of(hashKey, sortKey), schema.storageNames().stream())
        .forEach(name -> names.put("#__" + name + "__", name));
    this.projectionNames = Collections.unmodifiableMap(names);
    this.projection = String.join(", ", names.keySet());
    log.info("EntityCodec({},{},{},{})", schema.type().getSimpleName(), hashKey, sortKey, strictType);
  }

  /**
   * Schema entity schema.
   *
   * @return the entity schema
   */
  public EntitySchema<T> schema() {
    return schema;
  }

  /**
   * Hash key attribute name.
   *
   * @return the string
   */
  public String hashKey() {
    return hashKey;
  }

  /**
   * Sort key attribute name.
   *
   * @return the string
   */
  public String sortKey() {
    return sortKey;
  }

  /**
   * Projection expression over both key attributes and every storage name of the schema, {@code #__a__, #__b__}.
   * The key attributes are listed even when the schema declares no field for them, as decoding requires both.
   *
   * @return the string
   */
  public String projection() {
    return projection;
  }

  /**
   * Placeholder names used by {@link #projection()}.
   *
   * @return the map
   */
  public Map<String, String> projectionNames() {
    return projectionNames;
  }

  /**
   * Encodes the primary key of a thing.
   *
   * @param key the key
   * @return a map holding exactly the hash and sort key attributes
   * @throws InvalidKeyException if the hash key is empty
   */
  public Map<String, AttributeValue> encodeKey(final Thing key) {
    if (key == null || key.hashKey() == null || key.hashKey().isEmpty()) {
      throw new InvalidKeyException("Invalid key: hash key is empty: " + key);
    }
    final Map<String, AttributeValue> result = new HashMap<>();
    result.put(hashKey, AttributeValue.fromS(key.hashKey().toString()));
    result.put(sortKey, AttributeValue.fromS(sortKeyOf(key)));
    return Collections.unmodifiableMap(result);
  }

  /**
   * Encodes an entity.
   *
   * @param entity the entity
   * @return the item
   * @throws InvalidEntityException if a field cannot be encoded or the hash key is missing
   */
  public Map<String, AttributeValue> encode(final T entity) {
    if (entity == null) {
      throw new InvalidEntityException("Invalid entity: null");
    }
    final Map<String, AttributeValue> item = new LinkedHashMap<>();
    for (Field<T, ?> field : schema.fields()) {
      try {
        field.encodeFrom(entity).ifPresent(value -> item.put(field.storageName(), value));
      } catch (RuntimeException e) {
        throw new InvalidEntityException("Invalid entity: unable to encode " + field.name(), e);
      }
    }
    final AttributeValue hash = item.get(hashKey);
    if (hash == null || hash.s() == null || hash.s().isEmpty()) {
      throw new InvalidEntityException("Invalid entity: no hash key attribute " + hashKey);
    }
    final AttributeValue sort = item.get(sortKey);
    if (sort == null || sort.s() == null || sort.s().isEmpty()) {
      item.put(sortKey, AttributeValue.fromS(SORT_KEY_SENTINEL));
    }
    return Collections.unmodifiableMap(item);
  }

  /**
   * Decodes an item.
   *
   * @param item the item
   * @return the entity
   * @throws InvalidEntityException if a key attribute is missing or a field cannot be decoded
   */
  public T decode(final Map<String, AttributeValue> item) {
    if (item == null || !item.containsKey(hashKey) || !item.containsKey(sortKey)) {
      throw new InvalidEntityException("Invalid entity: missing " + hashKey + " or " + sortKey);
    }
    if (strictType) {
      final Set<String> unknown = item.keySet().stream()
          .filter(name -> !name.equals(hashKey) && !name.equals(sortKey))
          .filter(name -> !schema.storageNames().contains(name))
          .collect(Collectors.toSet());
      if (!unknown.isEmpty()) {
        throw new InvalidEntityException("Invalid entity: unknown attributes " + unknown);
      }
    }
    final Map<String, AttributeValue> normalized;
    if (SORT_KEY_SENTINEL.equals(item.get(sortKey).s())) {
      normalized = new HashMap<>(item);
      normalized.put(sortKey, AttributeValue.fromS(""));
    } else {
      normalized = item;
    }
    try {
      return schema.decode(new ItemReader<>(normalized));
    } catch (RuntimeException e) {
      throw new InvalidEntityException("Invalid entity: unable to decode " + schema.type().getSimpleName(), e);
    }
  }

  /**
   * Projects the key attributes of an item.
   *
   * @param item the item
   * @return the key
   */
  public Map<String, AttributeValue> keyOnly(final Map<String, AttributeValue> item) {
    final Map<String, AttributeValue> key = new HashMap<>();
    Optional.ofNullable(item.get(hashKey)).ifPresent(value -> key.put(hashKey, value));
    Optional.ofNullable(item.get(sortKey)).ifPresent(value -> key.put(sortKey, value));
    return Collections.unmodifiableMap(key);
  }

  /**
   * Is key attribute boolean.
   *
   * @param storageName the storage name
   * @return true for the hash or sort key attribute
   */
  public boolean isKeyAttribute(final String storageName) {
    return hashKey.equals(storageName) || sortKey.equals(storageName);
  }

  private String sortKeyOf(final Thing key) {
    if (key.sortKey() == null || key.sortKey().isEmpty()) {
      return SORT_KEY_SENTINEL;
    }
    return key.sortKey().toString();
  }
}
