package com.splitlab.sdk.server;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.splitlab.sdk.AttributeValue;
import com.splitlab.sdk.server.ConditionTree.And;
import com.splitlab.sdk.server.ConditionTree.AudienceReference;
import com.splitlab.sdk.server.ConditionTree.Leaf;
import com.splitlab.sdk.server.ConditionTree.MatchType;
import com.splitlab.sdk.server.ConditionTree.Not;
import com.splitlab.sdk.server.ConditionTree.Or;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON conversion logic specifically for condition trees, which the datafile represents as nested arrays
 * rather than as objects with a fixed shape.
 * <p>
 * A condition array may start with an operator string ({@code "and"}, {@code "or"} or {@code "not"});
 * if it does not, the operator is {@code "or"}. The remaining elements are nested arrays, leaf objects,
 * or (in an experiment's audience conditions only) audience id strings. Parsing is lenient: anything that
 * cannot be understood becomes a leaf that always evaluates to unknown, so a bad condition can only ever
 * exclude users rather than make the whole datafile unusable.
 */
abstract class DataModelSerialization {
  private DataModelSerialization() {}

  private static final String OPERATOR_AND = "and";
  private static final String OPERATOR_OR = "or";
  private static final String OPERATOR_NOT = "not";

  /**
   * Parses a condition tree.
   *
   * @param json the condition JSON; may be null
   * @param allowAudienceReferences true if string elements are audience ids (experiment audience
   *   conditions), false if the tree contains only attribute leaves (audience definitions)
   * @return the parsed tree, or null if the JSON was null
   */
  static ConditionTree parseConditionTree(JsonElement json, boolean allowAudienceReferences) {
    if (json == null || json.isJsonNull()) {
      return null;
    }
    if (json.isJsonArray()) {
      return parseConditionList(json.getAsJsonArray(), allowAudienceReferences);
    }
    if (json.isJsonObject()) {
      return parseLeaf(json.getAsJsonObject());
    }
    if (allowAudienceReferences && isString(json)) {
      return new AudienceReference(json.getAsString());
    }
    return invalidLeaf();
  }

  /**
   * Parses an audience's conditions, which legacy datafiles store as a JSON document inside a string.
   *
   * @param json the audience's "conditions" property
   * @return the parsed tree, or null if there were no conditions
   */
  static ConditionTree parseAudienceConditions(JsonElement json) {
    if (json != null && isString(json)) {
      JsonElement embedded;
      try {
        embedded = JsonHelpers.parseTree(json.getAsString());
      } catch (RuntimeException e) {
        return invalidLeaf();
      }
      return parseConditionTree(embedded, false);
    }
    return parseConditionTree(json, false);
  }

  private static ConditionTree parseConditionList(JsonArray array, boolean allowAudienceReferences) {
    String operator = OPERATOR_OR;
    int start = 0;
    if (array.size() > 0 && isOperator(array.get(0))) {
      operator = array.get(0).getAsString();
      start = 1;
    }
    List<ConditionTree> children = new ArrayList<>(array.size() - start);
    for (int i = start; i < array.size(); i++) {
      ConditionTree child = parseConditionTree(array.get(i), allowAudienceReferences);
      children.add(child == null ? invalidLeaf() : child);
    }
    switch (operator) {
    case OPERATOR_AND:
      return new And(children);
    case OPERATOR_NOT:
      return new Not(children.isEmpty() ? null : children.get(0));
    default:
      return new Or(children);
    }
  }

  private static Leaf parseLeaf(JsonObject o) {
    String match = stringProperty(o, "match");
    return new Leaf(
        stringProperty(o, "name"),
        stringProperty(o, "type"),
        match == null && o.has("match") && !o.get("match").isJsonNull() ? null : MatchType.forName(match),
        leafValue(o.get("value"))
        );
  }

  private static AttributeValue leafValue(JsonElement value) {
    if (value == null || value.isJsonNull()) {
      return AttributeValue.absent();
    }
    if (!value.isJsonPrimitive()) {
      return null;
    }
    JsonPrimitive p = value.getAsJsonPrimitive();
    if (p.isBoolean()) {
      return AttributeValue.of(p.getAsBoolean());
    }
    if (p.isNumber()) {
      return AttributeValue.of(p.getAsDouble());
    }
    return AttributeValue.of(p.getAsString());
  }

  private static String stringProperty(JsonObject o, String name) {
    JsonElement e = o.get(name);
    return e != null && isString(e) ? e.getAsString() : null;
  }

  private static boolean isOperator(JsonElement e) {
    if (!isString(e)) {
      return false;
    }
    String s = e.getAsString();
    return s.equals(OPERATOR_AND) || s.equals(OPERATOR_OR) || s.equals(OPERATOR_NOT);
  }

  private static boolean isString(JsonElement e) {
    return e.isJsonPrimitive() && e.getAsJsonPrimitive().isString();
  }

  private static Leaf invalidLeaf() {
    return new Leaf(null, null, null, null);
  }
}
