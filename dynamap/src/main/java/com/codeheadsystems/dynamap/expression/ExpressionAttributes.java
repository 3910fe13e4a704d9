package com.codeheadsystems.dynamap.expression;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Collects the placeholder names and values an expression refers to.
 *
 * <p>Names are written {@code #__name__} and values {@code :__name__}. A scope prefix keeps the placeholders of
 * conditions apart from those of the update they guard. When a placeholder is already taken by another attribute
 * name or another value, the later one gets a numbered placeholder instead, so {@code #__c_x__} of a condition on
 * {@code x} never shadows the update of an attribute stored as {@code c_x}.
 */
public final class ExpressionAttributes {

  private final String prefix;
  private final Map<String, String> names;
  private final Map<String, AttributeValue> values;

  /**
   * Instantiates a new Expression attributes.
   */
  public ExpressionAttributes() {
    this("", new LinkedHashMap<>(), new LinkedHashMap<>());
  }

  private ExpressionAttributes(final String prefix,
                               final Map<String, String> names,
                               final Map<String, AttributeValue> values) {
    this.prefix = prefix;
    this.names = names;
    this.values = values;
  }

  /**
   * A view writing to the same placeholders under another prefix.
   *
   * @param scope the prefix
   * @return the expression attributes
   */
  public ExpressionAttributes scoped(final String scope) {
    return new ExpressionAttributes(scope, names, values);
  }

  /**
   * Copy expression attributes.
   *
   * @return an independent copy
   */
  public ExpressionAttributes copy() {
    return new ExpressionAttributes(prefix, new LinkedHashMap<>(names), new LinkedHashMap<>(values));
  }

  /**
   * Registers an attribute name.
   *
   * @param storageName the storage name
   * @return the placeholder
   */
  public String name(final String storageName) {
    String placeholder = "#__" + prefix + storageName + "__";
    int n = 1;
    while (names.containsKey(placeholder) && !names.get(placeholder).equals(storageName)) {
      placeholder = "#__" + prefix + storageName + "_" + n++ + "__";
    }
    names.put(placeholder, storageName);
    return placeholder;
  }

  /**
   * Registers a value.
   *
   * @param key   placeholder stem, usually the storage name
   * @param value the value
   * @return the placeholder
   */
  public String value(final String key, final AttributeValue value) {
    String placeholder = ":__" + prefix + key + "__";
    int n = 1;
    while (values.containsKey(placeholder) && !values.get(placeholder).equals(value)) {
      placeholder = ":__" + prefix + key + "_" + n++ + "__";
    }
    values.put(placeholder, value);
    return placeholder;
  }

  /**
   * Names map.
   *
   * @return the map
   */
  public Map<String, String> names() {
    return Collections.unmodifiableMap(names);
  }

  /**
   * Values map.
   *
   * @return the map
   */
  public Map<String, AttributeValue> values() {
    return Collections.unmodifiableMap(values);
  }

  /**
   * Names, or null when there are none, as the request builders expect.
   *
   * @return the map
   */
  public Map<String, String> namesOrNull() {
    return names.isEmpty() ? null : names();
  }

  /**
   * Values, or null when there are none, as the request builders expect.
   *
   * @return the map
   */
  public Map<String, AttributeValue> valuesOrNull() {
    return values.isEmpty() ? null : values();
  }
}
