package com.splitlab.sdk.server;

import com.splitlab.sdk.AttributeValue;

import java.util.List;

import static java.util.Collections.emptyList;

/**
 * A boolean condition expression over user attributes, parsed once from the datafile's loosely-typed
 * condition arrays. Evaluation never looks at raw JSON; see {@link AudienceEvaluator}.
 * <p>
 * A tree is one of {@link And}, {@link Or}, {@link Not}, {@link Leaf} (a single attribute comparison) or
 * {@link AudienceReference} (a reference by id to another audience's tree, used only in experiments'
 * audience conditions).
 */
abstract class ConditionTree {
  enum Kind {
    AND,
    OR,
    NOT,
    LEAF,
    AUDIENCE_REFERENCE
  }

  private ConditionTree() {}

  abstract Kind getKind();

  static final class And extends ConditionTree {
    private final List<ConditionTree> children;

    And(List<ConditionTree> children) {
      this.children = children == null ? emptyList() : children;
    }

    @Override
    Kind getKind() {
      return Kind.AND;
    }

    // Guaranteed non-null
    List<ConditionTree> getChildren() {
      return children;
    }

    @Override
    public String toString() {
      return "and" + children;
    }
  }

  static final class Or extends ConditionTree {
    private final List<ConditionTree> children;

    Or(List<ConditionTree> children) {
      this.children = children == null ? emptyList() : children;
    }

    @Override
    Kind getKind() {
      return Kind.OR;
    }

    // Guaranteed non-null
    List<ConditionTree> getChildren() {
      return children;
    }

    @Override
    public String toString() {
      return "or" + children;
    }
  }

  static final class Not extends ConditionTree {
    private final ConditionTree operand; // null if the datafile gave "not" no operand

    Not(ConditionTree operand) {
      this.operand = operand;
    }

    @Override
    Kind getKind() {
      return Kind.NOT;
    }

    ConditionTree getOperand() {
      return operand;
    }

    @Override
    public String toString() {
      return "not[" + operand + "]";
    }
  }

  /**
   * The comparison performed by a {@link Leaf}.
   */
  enum MatchType {
    EXACT("exact"),
    EXISTS("exists"),
    SUBSTRING("substring"),
    GREATER_THAN("gt"),
    LESS_THAN("lt");

    private final String wireName;

    private MatchType(String wireName) {
      this.wireName = wireName;
    }

    String getWireName() {
      return wireName;
    }

    /**
     * Looks up a match type by its datafile name. A missing name means {@link #EXACT}, as in legacy
     * datafiles; an unrecognized name returns null.
     */
    static MatchType forName(String name) {
      if (name == null) {
        return EXACT;
      }
      switch (name) {
      case "exact":
        return EXACT;
      case "exists":
        return EXISTS;
      case "substring":
        return SUBSTRING;
      case "gt":
      case "greater_than":
        return GREATER_THAN;
      case "lt":
      case "less_than":
        return LESS_THAN;
      default:
        return null;
      }
    }
  }

  static final class Leaf extends ConditionTree {
    static final String CUSTOM_ATTRIBUTE_TYPE = "custom_attribute";

    private final String attributeName;
    private final String type;
    private final MatchType matchType; // null if the datafile used an unknown match type
    private final AttributeValue expectedValue; // null if the datafile value was not a string, boolean, number or null

    Leaf(String attributeName, String type, MatchType matchType, AttributeValue expectedValue) {
      this.attributeName = attributeName;
      this.type = type;
      this.matchType = matchType;
      this.expectedValue = expectedValue;
    }

    String getAttributeName() {
      return attributeName;
    }

    String getType() {
      return type;
    }

    MatchType getMatchType() {
      return matchType;
    }

    AttributeValue getExpectedValue() {
      return expectedValue;
    }

    @Override
    Kind getKind() {
      return Kind.LEAF;
    }

    @Override
    public String toString() {
      return "{name=" + attributeName + ", type=" + type + ", match=" +
          (matchType == null ? null : matchType.getWireName()) + ", value=" + expectedValue + "}";
    }
  }

  static final class AudienceReference extends ConditionTree {
    private final String audienceId;

    AudienceReference(String audienceId) {
      this.audienceId = audienceId;
    }

    String getAudienceId() {
      return audienceId;
    }

    @Override
    Kind getKind() {
      return Kind.AUDIENCE_REFERENCE;
    }

    @Override
    public String toString() {
      return "audience(" + audienceId + ")";
    }
  }
}
