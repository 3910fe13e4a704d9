package com.codeheadsystems.dynamap.converter;

import com.codeheadsystems.dynamap.api.Identity;
import com.codeheadsystems.dynamap.schema.SetKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Codecs for the value types fields are usually made of.
 */
public final class ValueCodecs {

  private static final ValueCodec<String> STRING = new Simple<>(
      AttributeValue::fromS, value -> required(value.s(), "S", value), v -> v == null || v.isEmpty());
  private static final ValueCodec<Integer> INTEGER = number(Integer::valueOf);
  private static final ValueCodec<Long> LONG = number(Long::valueOf);
  private static final ValueCodec<Double> DOUBLE = number(Double::valueOf);
  private static final ValueCodec<BigDecimal> DECIMAL = new Simple<>(
      v -> AttributeValue.fromN(v.toPlainString()),
      value -> new BigDecimal(required(value.n(), "N", value)),
      v -> v == null);
  private static final ValueCodec<Boolean> BOOLEAN = new Simple<>(
      AttributeValue::fromBool, value -> required(value.bool(), "BOOL", value), v -> v == null);
  private static final ValueCodec<byte[]> BINARY = new Simple<>(
      v -> AttributeValue.fromB(SdkBytes.fromByteArray(v)),
      value -> required(value.b(), "B", value).asByteArray(),
      v -> v == null || v.length == 0);
  private static final ValueCodec<Identity> IDENTITY = new Simple<>(
      v -> AttributeValue.fromS(v.toString()),
      value -> Identity.of(required(value.s(), "S", value)),
      v -> v == null || v.isEmpty());
  private static final ValueCodec<Set<String>> STRING_SET = new SetCodec<>(SetKind.STRING_SET,
      v -> AttributeValue.fromSs(List.copyOf(v)),
      value -> new LinkedHashSet<>(value.ss()));
  private static final ValueCodec<Set<Long>> NUMBER_SET = new SetCodec<>(SetKind.NUMBER_SET,
      v -> AttributeValue.fromNs(v.stream().map(String::valueOf).toList()),
      value -> new LinkedHashSet<>(value.ns().stream().map(Long::valueOf).toList()));
  private static final ValueCodec<Set<SdkBytes>> BINARY_SET = new SetCodec<>(SetKind.BINARY_SET,
      v -> AttributeValue.fromBs(List.copyOf(v)),
      value -> new LinkedHashSet<>(value.bs()));

  private ValueCodecs() {
  }

  /**
   * String codec, stored as S.
   *
   * @return the value codec
   */
  public static ValueCodec<String> string() {
    return STRING;
  }

  /**
   * Integer codec, stored as N.
   *
   * @return the value codec
   */
  public static ValueCodec<Integer> integer() {
    return INTEGER;
  }

  /**
   * Long codec, stored as N.
   *
   * @return the value codec
   */
  public static ValueCodec<Long> longs() {
    return LONG;
  }

  /**
   * Double codec, stored as N.
   *
   * @return the value codec
   */
  public static ValueCodec<Double> doubles() {
    return DOUBLE;
  }

  /**
   * Decimal codec, stored as N.
   *
   * @return the value codec
   */
  public static ValueCodec<BigDecimal> decimal() {
    return DECIMAL;
  }

  /**
   * Boolean codec, stored as BOOL.
   *
   * @return the value codec
   */
  public static ValueCodec<Boolean> bool() {
    return BOOLEAN;
  }

  /**
   * Binary codec, stored as B.
   *
   * @return the value codec
   */
  public static ValueCodec<byte[]> binary() {
    return BINARY;
  }

  /**
   * Identity codec, stored as S.
   *
   * @return the value codec
   */
  public static ValueCodec<Identity> identity() {
    return IDENTITY;
  }

  /**
   * String set codec, stored as SS.
   *
   * @return the value codec
   */
  public static ValueCodec<Set<String>> stringSet() {
    return STRING_SET;
  }

  /**
   * Number set codec, stored as NS.
   *
   * @return the value codec
   */
  public static ValueCodec<Set<Long>> numberSet() {
    return NUMBER_SET;
  }

  /**
   * Binary set codec, stored as BS.
   *
   * @return the value codec
   */
  public static ValueCodec<Set<SdkBytes>> binarySet() {
    return BINARY_SET;
  }

  /**
   * List codec, stored as L.
   *
   * @param element the element codec
   * @param <E>     the element type
   * @return the value codec
   */
  public static <E> ValueCodec<List<E>> list(final ValueCodec<E> element) {
    return new Simple<>(
        v -> AttributeValue.fromL(v.stream().map(element::encode).toList()),
        value -> required(value.hasL() ? value.l() : null, "L", value).stream().map(element::decode).toList(),
        v -> v == null || v.isEmpty());
  }

  /**
   * Map codec with string keys, stored as M.
   *
   * @param element the value codec
   * @param <E>     the value type
   * @return the value codec
   */
  public static <E> ValueCodec<Map<String, E>> map(final ValueCodec<E> element) {
    return new Simple<>(
        v -> {
          final Map<String, AttributeValue> map = new LinkedHashMap<>();
          v.forEach((key, entry) -> map.put(key, element.encode(entry)));
          return AttributeValue.fromM(map);
        },
        value -> {
          final Map<String, E> map = new LinkedHashMap<>();
          required(value.hasM() ? value.m() : null, "M", value)
              .forEach((key, entry) -> map.put(key, element.decode(entry)));
          return map;
        },
        v -> v == null || v.isEmpty());
  }

  /**
   * Document codec, stored as an S holding the JSON form of the value.
   *
   * @param mapper the object mapper
   * @param type   the value type
   * @param <A>    the value type
   * @return the value codec
   */
  public static <A> ValueCodec<A> json(final ObjectMapper mapper, final Class<A> type) {
    return new Simple<>(
        v -> {
          try {
            return AttributeValue.fromS(mapper.writeValueAsString(v));
          } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to write " + type.getSimpleName() + " as json", e);
          }
        },
        value -> {
          try {
            return mapper.readValue(required(value.s(), "S", value), type);
          } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to read " + type.getSimpleName() + " from json", e);
          }
        },
        v -> v == null);
  }

  private static <A extends Number> ValueCodec<A> number(final Function<String, A> parser) {
    return new Simple<>(
        v -> AttributeValue.fromN(v.toString()),
        value -> {
          final String n = required(value.n(), "N", value);
          try {
            return parser.apply(n);
          } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number: " + n, e);
          }
        },
        v -> v == null);
  }

  private static <V> V required(final V value, final String type, final AttributeValue attribute) {
    if (value == null) {
      throw new IllegalArgumentException("Expected " + type + " attribute, found " + attribute);
    }
    return value;
  }

  private static class Simple<A> implements ValueCodec<A> {

    private final Function<A, AttributeValue> encoder;
    private final Function<AttributeValue, A> decoder;
    private final Predicate<A> empty;

    Simple(final Function<A, AttributeValue> encoder,
           final Function<AttributeValue, A> decoder,
           final Predicate<A> empty) {
      this.encoder = encoder;
      this.decoder = decoder;
      this.empty = empty;
    }

    @Override
    public AttributeValue encode(final A value) {
      return encoder.apply(value);
    }

    @Override
    public A decode(final AttributeValue value) {
      return decoder.apply(value);
    }

    @Override
    public boolean isEmpty(final A value) {
      return empty.test(value);
    }
  }

  private static class SetCodec<A extends Collection<?>> extends Simple<A> {

    private final SetKind kind;

    SetCodec(final SetKind kind,
             final Function<A, AttributeValue> encoder,
             final Function<AttributeValue, A> decoder) {
      super(encoder, value -> {
        if (value.type() != kind.attributeType()) {
          throw new IllegalArgumentException("Expected " + kind.tag() + " attribute, found " + value);
        }
        return decoder.apply(value);
      }, v -> v == null || v.isEmpty());
      this.kind = kind;
    }

    @Override
    public Optional<SetKind> setKind() {
      return Optional.of(kind);
    }
  }
}
