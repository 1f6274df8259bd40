package com.splitlab.sdk.server;

import com.splitlab.sdk.AttributeValue;
import com.splitlab.sdk.UserAttributes;
import com.splitlab.sdk.server.ConditionTree.Leaf;
import com.splitlab.sdk.server.ConditionTree.MatchType;

import java.util.EnumMap;
import java.util.Map;

/**
 * Defines the behavior of every match type that can be used in an audience condition leaf.
 * <p>
 * Values are compared with exact per-type rules: there is no coercion between strings and numbers, and
 * booleans are never numbers. Any comparison that cannot be made returns {@link Tristate#UNKNOWN}.
 */
abstract class ConditionMatchers {
  private ConditionMatchers() {}

  /**
   * Numbers beyond this magnitude cannot be represented exactly as doubles, so comparing them is unreliable.
   */
  static final double MAX_COMPARABLE_NUMBER = Math.pow(2, 53);

  private static interface MatcherFn {
    Tristate match(AttributeValue userValue, AttributeValue conditionValue);
  }

  private static final Map<MatchType, MatcherFn> MATCHERS = new EnumMap<>(MatchType.class);
  static {
    MATCHERS.put(MatchType.EXACT, ConditionMatchers::applyExact);
    MATCHERS.put(MatchType.SUBSTRING, ConditionMatchers::applySubstring);
    MATCHERS.put(MatchType.GREATER_THAN, numericComparison(delta -> delta > 0));
    MATCHERS.put(MatchType.LESS_THAN, numericComparison(delta -> delta < 0));
    // MatchType.EXISTS is handled in match() because it is the only one that accepts a missing attribute.
  }

  /**
   * Evaluates a single leaf against the user's attributes.
   *
   * @param leaf the condition
   * @param attributes the user's attributes
   * @return the result
   */
  static Tristate match(Leaf leaf, UserAttributes attributes) {
    if (!Leaf.CUSTOM_ATTRIBUTE_TYPE.equals(leaf.getType()) || leaf.getMatchType() == null ||
        leaf.getAttributeName() == null) {
      return Tristate.UNKNOWN;
    }
    AttributeValue userValue = attributes.get(leaf.getAttributeName());
    if (leaf.getMatchType() == MatchType.EXISTS) {
      return Tristate.of(!userValue.isAbsent());
    }
    AttributeValue conditionValue = leaf.getExpectedValue();
    if (conditionValue == null || !isComparable(conditionValue) || userValue.isAbsent()) {
      return Tristate.UNKNOWN;
    }
    MatcherFn fn = MATCHERS.get(leaf.getMatchType());
    return fn == null ? Tristate.UNKNOWN : fn.match(userValue, conditionValue);
  }

  /**
   * Returns true if a value can take part in a comparison: a string, a boolean, or a finite number
   * whose magnitude is no greater than 2^53.
   */
  static boolean isComparable(AttributeValue value) {
    switch (value.getType()) {
    case STRING:
    case BOOLEAN:
      return true;
    case NUMBER:
      double d = value.doubleValue();
      return !Double.isNaN(d) && !Double.isInfinite(d) && Math.abs(d) <= MAX_COMPARABLE_NUMBER;
    default:
      return false;
    }
  }

  static Tristate applyExact(AttributeValue userValue, AttributeValue conditionValue) {
    if (userValue.getType() != conditionValue.getType() || !isComparable(userValue)) {
      return Tristate.UNKNOWN;
    }
    return Tristate.of(userValue.equals(conditionValue));
  }

  static Tristate applySubstring(AttributeValue userValue, AttributeValue conditionValue) {
    if (!userValue.isString() || !conditionValue.isString()) {
      return Tristate.UNKNOWN;
    }
    return Tristate.of(userValue.stringValue().contains(conditionValue.stringValue()));
  }

  private static interface DeltaTest {
    boolean test(int delta);
  }

  private static MatcherFn numericComparison(DeltaTest deltaTest) {
    return (userValue, conditionValue) -> {
      if (!userValue.isNumber() || !conditionValue.isNumber() || !isComparable(userValue)) {
        return Tristate.UNKNOWN;
      }
      double u = userValue.doubleValue(), c = conditionValue.doubleValue();
      return Tristate.of(deltaTest.test(u < c ? -1 : (u > c ? 1 : 0)));
    };
  }
}
