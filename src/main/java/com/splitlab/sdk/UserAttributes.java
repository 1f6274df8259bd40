package com.splitlab.sdk;

import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * An immutable set of named attributes describing a user, used to evaluate audience conditions.
 * <p>
 * Attribute names that are not present are legal; looking one up returns {@link AttributeValue#absent()}.
 * Create instances with {@link #builder()}, {@link #fromMap(Map)}, or {@link #empty()}.
 */
public final class UserAttributes {
  private static final UserAttributes EMPTY = new UserAttributes(ImmutableMap.<String, AttributeValue>of());

  private final ImmutableMap<String, AttributeValue> values;

  private UserAttributes(ImmutableMap<String, AttributeValue> values) {
    this.values = values;
  }

  /**
   * Returns an instance with no attributes.
   *
   * @return an empty attribute set
   */
  public static UserAttributes empty() {
    return EMPTY;
  }

  /**
   * Returns a new builder.
   *
   * @return a builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Converts a map of plain Java values. Each value is converted with {@link AttributeValue#fromObject(Object)},
   * so values of unsupported types are treated as absent.
   *
   * @param attributes a map of attribute names to values; may be null
   * @return an attribute set
   */
  public static UserAttributes fromMap(Map<String, ?> attributes) {
    if (attributes == null || attributes.isEmpty()) {
      return EMPTY;
    }
    Builder b = builder();
    for (Map.Entry<String, ?> e: attributes.entrySet()) {
      if (e.getKey() != null) {
        b.set(e.getKey(), AttributeValue.fromObject(e.getValue()));
      }
    }
    return b.build();
  }

  /**
   * Returns the value of an attribute.
   *
   * @param name the attribute name
   * @return the value, or {@link AttributeValue#absent()} if there is no such attribute; never null
   */
  public AttributeValue get(String name) {
    AttributeValue v = name == null ? null : values.get(name);
    return v == null ? AttributeValue.absent() : v;
  }

  /**
   * Tests whether an attribute has a non-absent value.
   *
   * @param name the attribute name
   * @return true if the attribute is present
   */
  public boolean contains(String name) {
    return !get(name).isAbsent();
  }

  /**
   * Returns the names of all attributes that have values.
   *
   * @return the attribute names
   */
  public Set<String> getNames() {
    return values.keySet();
  }

  /**
   * Returns true if there are no attributes.
   *
   * @return true if empty
   */
  public boolean isEmpty() {
    return values.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof UserAttributes && values.equals(((UserAttributes)o).values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return values.toString();
  }

  /**
   * A mutable builder for {@link UserAttributes}. Setting an attribute that was already set replaces it;
   * setting it to an absent value removes it.
   */
  public static final class Builder {
    private final Map<String, AttributeValue> values = new LinkedHashMap<>();

    private Builder() {}

    /**
     * Sets an attribute.
     *
     * @param name the attribute name
     * @param value the value
     * @return the builder
     */
    public Builder set(String name, AttributeValue value) {
      if (value == null || value.isAbsent()) {
        values.remove(name);
      } else {
        values.put(name, value);
      }
      return this;
    }

    /**
     * Sets a string attribute.
     *
     * @param name the attribute name
     * @param value the value
     * @return the builder
     */
    public Builder set(String name, String value) {
      return set(name, AttributeValue.of(value));
    }

    /**
     * Sets a boolean attribute.
     *
     * @param name the attribute name
     * @param value the value
     * @return the builder
     */
    public Builder set(String name, boolean value) {
      return set(name, AttributeValue.of(value));
    }

    /**
     * Sets a numeric attribute.
     *
     * @param name the attribute name
     * @param value the value
     * @return the builder
     */
    public Builder set(String name, int value) {
      return set(name, AttributeValue.of(value));
    }

    /**
     * Sets a numeric attribute.
     *
     * @param name the attribute name
     * @param value the value
     * @return the builder
     */
    public Builder set(String name, double value) {
      return set(name, AttributeValue.of(value));
    }

    /**
     * Creates the immutable attribute set.
     *
     * @return a {@link UserAttributes}
     */
    public UserAttributes build() {
      return values.isEmpty() ? EMPTY : new UserAttributes(ImmutableMap.copyOf(values));
    }
  }
}
