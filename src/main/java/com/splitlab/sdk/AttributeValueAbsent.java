package com.splitlab.sdk;

final class AttributeValueAbsent extends AttributeValue {
  static final AttributeValueAbsent INSTANCE = new AttributeValueAbsent();

  private AttributeValueAbsent() {}

  public AttributeValueType getType() {
    return AttributeValueType.ABSENT;
  }

  @Override
  public boolean isAbsent() {
    return true;
  }

  @Override
  public String toString() {
    return "absent";
  }
}
