package com.splitlab.sdk.server;

/**
 * The declared type of a feature variable. The datafile stores every variable value as a string; the
 * type says how the string is converted when an application reads it.
 */
public enum FeatureVariableType {
  /**
   * The value is returned as is.
   */
  STRING("string"),
  /**
   * The value is true if it is the string "true" in any case, and false otherwise.
   */
  BOOLEAN("boolean"),
  /**
   * The value is a decimal integer.
   */
  INTEGER("integer"),
  /**
   * The value is a decimal floating-point number.
   */
  DOUBLE("double");

  private final String wireName;

  private FeatureVariableType(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Returns the name used for this type in the datafile.
   *
   * @return the type name
   */
  public String getWireName() {
    return wireName;
  }

  /**
   * Looks up a type by its datafile name.
   *
   * @param name the type name
   * @return the type, or null if the name is unknown
   */
  public static FeatureVariableType forName(String name) {
    if (name != null) {
      for (FeatureVariableType t: values()) {
        if (t.wireName.equals(name)) {
          return t;
        }
      }
    }
    return null;
  }

  /**
   * Converts a datafile value to this type.
   *
   * @param value the raw value
   * @return a {@link String}, {@link Boolean}, {@link Integer} or {@link Double}
   * @throws NumberFormatException if the value is not a valid number for a numeric type
   */
  Object parse(String value) {
    switch (this) {
    case BOOLEAN:
      return Boolean.valueOf(Boolean.parseBoolean(value));
    case INTEGER:
      return Integer.valueOf(Integer.parseInt(value));
    case DOUBLE:
      return Double.valueOf(Double.parseDouble(value));
    default:
      return value;
    }
  }
}
