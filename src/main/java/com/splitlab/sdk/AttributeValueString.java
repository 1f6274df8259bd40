package com.splitlab.sdk;

final class AttributeValueString extends AttributeValue {
  private static final AttributeValueString EMPTY = new AttributeValueString("");
  private final String value;

  static AttributeValueString fromString(String value) {
    return value.isEmpty() ? EMPTY : new AttributeValueString(value);
  }

  private AttributeValueString(String value) {
    this.value = value;
  }

  public AttributeValueType getType() {
    return AttributeValueType.STRING;
  }

  @Override
  public boolean isString() {
    return true;
  }

  @Override
  public String stringValue() {
    return value;
  }

  @Override
  public String toString() {
    return "\"" + value + "\"";
  }
}
