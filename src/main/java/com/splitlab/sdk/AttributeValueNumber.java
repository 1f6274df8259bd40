package com.splitlab.sdk;

final class AttributeValueNumber extends AttributeValue {
  private static final AttributeValueNumber ZERO = new AttributeValueNumber(0);
  private final double value;

  static AttributeValueNumber fromDouble(double value) {
    return value == 0 ? ZERO : new AttributeValueNumber(value);
  }

  private AttributeValueNumber(double value) {
    this.value = value;
  }

  public AttributeValueType getType() {
    return AttributeValueType.NUMBER;
  }

  @Override
  public boolean isNumber() {
    return true;
  }

  @Override
  public double doubleValue() {
    return value;
  }

  @Override
  public String toString() {
    return value == (long)value ? String.valueOf((long)value) : String.valueOf(value);
  }
}
