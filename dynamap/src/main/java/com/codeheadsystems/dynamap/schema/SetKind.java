package com.codeheadsystems.dynamap.schema;

import java.util.Arrays;
import java.util.Optional;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * DynamoDB set types a field can be stored as.
 */
public enum SetKind {
  STRING_SET("stringset", AttributeValue.Type.SS),
  NUMBER_SET("numberset", AttributeValue.Type.NS),
  BINARY_SET("binaryset", AttributeValue.Type.BS);

  private final String tag;
  private final AttributeValue.Type attributeType;

  SetKind(final String tag, final AttributeValue.Type attributeType) {
    this.tag = tag;
    this.attributeType = attributeType;
  }

  /**
   * Attribute type holding the set.
   *
   * @return the type
   */
  public AttributeValue.Type attributeType() {
    return attributeType;
  }

  /**
   * Name used in a field tag.
   *
   * @return the tag
   */
  public String tag() {
    return tag;
  }

  /**
   * From tag optional.
   *
   * @param tag the tag option
   * @return the set kind
   */
  public static Optional<SetKind> fromTag(final String tag) {
    return Arrays.stream(values()).filter(kind -> kind.tag.equals(tag)).findFirst();
  }
}
