package com.splitlab.sdk;

/**
 * Describes the type of an {@link AttributeValue}. User attributes are restricted to this closed set of
 * types; there is no implicit conversion between them.
 */
public enum AttributeValueType {
  /**
   * The attribute was not provided, or was provided with a null value.
   */
  ABSENT,
  /**
   * The value is a boolean.
   */
  BOOLEAN,
  /**
   * The value is numeric. Integers and floating-point values are not distinguished.
   */
  NUMBER,
  /**
   * The value is a string.
   */
  STRING
}
