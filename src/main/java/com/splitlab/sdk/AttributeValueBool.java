package com.splitlab.sdk;

final class AttributeValueBool extends AttributeValue {
  private static final AttributeValueBool TRUE = new AttributeValueBool(true);
  private static final AttributeValueBool FALSE = new AttributeValueBool(false);

  private final boolean value;

  static AttributeValueBool fromBoolean(boolean value) {
    return value ? TRUE : FALSE;
  }

  private AttributeValueBool(boolean value) {
    this.value = value;
  }

  public AttributeValueType getType() {
    return AttributeValueType.BOOLEAN;
  }

  @Override
  public boolean isBoolean() {
    return true;
  }

  @Override
  public boolean booleanValue() {
    return value;
  }

  @Override
  public String toString() {
    return value ? "true" : "false";
  }
}
