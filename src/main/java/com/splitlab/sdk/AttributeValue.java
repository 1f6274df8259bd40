package com.splitlab.sdk;

/**
 * An immutable value for a user attribute, or for the expected value of an audience condition.
 * <p>
 * Unlike a plain {@code Object}, an {@code AttributeValue} can only be a string, a boolean, a number,
 * or "absent", so evaluation code can compare values with exact per-type rules. Instances are created
 * with the {@code of} factory methods; {@code of(null)} and {@link #absent()} both return the absent value.
 */
public abstract class AttributeValue {
  AttributeValue() {}

  /**
   * Returns the value that represents a missing attribute.
   *
   * @return the absent value
   */
  public static AttributeValue absent() {
    return AttributeValueAbsent.INSTANCE;
  }

  /**
   * Returns a string value.
   *
   * @param value the string; null produces {@link #absent()}
   * @return an AttributeValue
   */
  public static AttributeValue of(String value) {
    return value == null ? absent() : AttributeValueString.fromString(value);
  }

  /**
   * Returns a boolean value.
   *
   * @param value the boolean
   * @return an AttributeValue
   */
  public static AttributeValue of(boolean value) {
    return AttributeValueBool.fromBoolean(value);
  }

  /**
   * Returns a numeric value.
   *
   * @param value the number
   * @return an AttributeValue
   */
  public static AttributeValue of(int value) {
    return AttributeValueNumber.fromDouble(value);
  }

  /**
   * Returns a numeric value. Values larger than 2^53 cannot be compared by audience conditions.
   *
   * @param value the number
   * @return an AttributeValue
   */
  public static AttributeValue of(long value) {
    return AttributeValueNumber.fromDouble(value);
  }

  /**
   * Returns a numeric value.
   *
   * @param value the number
   * @return an AttributeValue
   */
  public static AttributeValue of(double value) {
    return AttributeValueNumber.fromDouble(value);
  }

  /**
   * Converts an arbitrary Java object to an AttributeValue. Strings, booleans and any {@link Number}
   * are converted; null and every other type produce {@link #absent()}.
   *
   * @param value a Java object
   * @return an AttributeValue
   */
  public static AttributeValue fromObject(Object value) {
    if (value instanceof AttributeValue) {
      return (AttributeValue)value;
    }
    if (value instanceof String) {
      return of((String)value);
    }
    if (value instanceof Boolean) {
      return of(((Boolean)value).booleanValue());
    }
    if (value instanceof Number) {
      return of(((Number)value).doubleValue());
    }
    return absent();
  }

  /**
   * Returns the type of this value.
   *
   * @return the value type
   */
  public abstract AttributeValueType getType();

  /**
   * Tests whether this is the absent value.
   *
   * @return true if absent
   */
  public boolean isAbsent() {
    return false;
  }

  /**
   * Tests whether this is a string value.
   *
   * @return true if a string
   */
  public boolean isString() {
    return false;
  }

  /**
   * Tests whether this is a boolean value.
   *
   * @return true if a boolean
   */
  public boolean isBoolean() {
    return false;
  }

  /**
   * Tests whether this is a numeric value.
   *
   * @return true if a number
   */
  public boolean isNumber() {
    return false;
  }

  /**
   * Returns the string value, or null if this is not a string.
   *
   * @return the string value
   */
  public String stringValue() {
    return null;
  }

  /**
   * Returns the boolean value, or false if this is not a boolean.
   *
   * @return the boolean value
   */
  public boolean booleanValue() {
    return false;
  }

  /**
   * Returns the numeric value, or zero if this is not a number.
   *
   * @return the numeric value
   */
  public double doubleValue() {
    return 0;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AttributeValue)) {
      return false;
    }
    AttributeValue other = (AttributeValue)o;
    if (getType() != other.getType()) {
      return false;
    }
    switch (getType()) {
    case ABSENT:
      return true;
    case BOOLEAN:
      return booleanValue() == other.booleanValue();
    case NUMBER:
      return doubleValue() == other.doubleValue();
    case STRING:
      return stringValue().equals(other.stringValue());
    default:
      return false;
    }
  }

  @Override
  public int hashCode() {
    switch (getType()) {
    case BOOLEAN:
      return Boolean.hashCode(booleanValue());
    case NUMBER:
      return Double.hashCode(doubleValue());
    case STRING:
      return stringValue().hashCode();
    default:
      return 0;
    }
  }
}
