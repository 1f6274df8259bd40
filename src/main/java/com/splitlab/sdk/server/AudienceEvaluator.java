package com.splitlab.sdk.server;

import com.launchdarkly.logging.LDLogger;
import com.splitlab.sdk.UserAttributes;
import com.splitlab.sdk.server.ConditionTree.AudienceReference;
import com.splitlab.sdk.server.ConditionTree.Leaf;
import com.splitlab.sdk.server.ConditionTree.MatchType;
import com.splitlab.sdk.server.DataModel.Audience;
import com.splitlab.sdk.server.DataModel.Experiment;

import java.util.List;

/**
 * Evaluates condition trees against a user's attributes with three-valued logic.
 * <p>
 * {@code And} is false if any child is false, otherwise unknown if any child is unknown, otherwise true.
 * {@code Or} is true if any child is true, otherwise unknown if any child is unknown, otherwise false.
 * {@code Not} inverts true and false and leaves unknown alone. Both list operators stop at the first
 * child that decides the result. Unknown is only collapsed to "not matched" by
 * {@link #matchesExperimentAudience(ConfigIndex, Experiment, UserAttributes)}.
 */
class AudienceEvaluator {
  private final LDLogger logger;

  AudienceEvaluator(LDLogger logger) {
    this.logger = logger;
  }

  /**
   * Decides whether a user is in an experiment's (or rollout rule's) audience. An experiment with no
   * audience conditions targets everyone.
   *
   * @param config the snapshot used to resolve audience references
   * @param experiment the experiment or rollout rule
   * @param attributes the user's attributes
   * @return true only if the conditions evaluate to true
   */
  boolean matchesExperimentAudience(ConfigIndex config, Experiment experiment, UserAttributes attributes) {
    ConditionTree conditions = experiment.preprocessed.audienceConditions;
    if (conditions == null) {
      return true;
    }
    Tristate result = evaluate(conditions, attributes, config);
    logger.debug("Audiences for experiment \"{}\" collectively evaluated to {}", experiment.getKey(), result);
    return result.isTrue();
  }

  /**
   * Evaluates a condition tree.
   *
   * @param tree the tree; null evaluates to true
   * @param attributes the user's attributes
   * @param config the snapshot used to resolve audience references; may be null if the tree has none
   * @return the three-valued result
   */
  Tristate evaluate(ConditionTree tree, UserAttributes attributes, ConfigIndex config) {
    if (tree == null) {
      return Tristate.TRUE;
    }
    switch (tree.getKind()) {
    case AND:
      return evaluateAnd(((ConditionTree.And)tree).getChildren(), attributes, config);
    case OR:
      return evaluateOr(((ConditionTree.Or)tree).getChildren(), attributes, config);
    case NOT:
      ConditionTree operand = ((ConditionTree.Not)tree).getOperand();
      return operand == null ? Tristate.UNKNOWN : evaluate(operand, attributes, config).not();
    case LEAF:
      return evaluateLeaf((Leaf)tree, attributes);
    case AUDIENCE_REFERENCE:
      return evaluateAudience(((AudienceReference)tree).getAudienceId(), attributes, config);
    default:
      return Tristate.UNKNOWN;
    }
  }

  private Tristate evaluateAnd(List<ConditionTree> children, UserAttributes attributes, ConfigIndex config) {
    boolean sawUnknown = false;
    for (int i = 0; i < children.size(); i++) {
      Tristate r = evaluate(children.get(i), attributes, config);
      if (r == Tristate.FALSE) {
        return Tristate.FALSE;
      }
      if (r == Tristate.UNKNOWN) {
        sawUnknown = true;
      }
    }
    return sawUnknown ? Tristate.UNKNOWN : Tristate.TRUE;
  }

  private Tristate evaluateOr(List<ConditionTree> children, UserAttributes attributes, ConfigIndex config) {
    boolean sawUnknown = false;
    for (int i = 0; i < children.size(); i++) {
      Tristate r = evaluate(children.get(i), attributes, config);
      if (r == Tristate.TRUE) {
        return Tristate.TRUE;
      }
      if (r == Tristate.UNKNOWN) {
        sawUnknown = true;
      }
    }
    return sawUnknown ? Tristate.UNKNOWN : Tristate.FALSE;
  }

  private Tristate evaluateAudience(String audienceId, UserAttributes attributes, ConfigIndex config) {
    Audience audience = config == null ? null : config.getAudience(audienceId);
    if (audience == null) {
      logger.warn("Audience \"{}\" is not in the datafile", audienceId);
      return Tristate.UNKNOWN;
    }
    Tristate result = evaluate(audience.preprocessed.conditions, attributes, config);
    logger.debug("Audience \"{}\" evaluated to {}", audienceId, result);
    return result;
  }

  private Tristate evaluateLeaf(Leaf leaf, UserAttributes attributes) {
    Tristate result = ConditionMatchers.match(leaf, attributes);
    if (result == Tristate.UNKNOWN) {
      logUnknownLeaf(leaf, attributes);
    }
    return result;
  }

  private void logUnknownLeaf(Leaf leaf, UserAttributes attributes) {
    if (!Leaf.CUSTOM_ATTRIBUTE_TYPE.equals(leaf.getType())) {
      logger.warn("Audience condition {} uses an unknown condition type", leaf);
    } else if (leaf.getMatchType() == null) {
      logger.warn("Audience condition {} uses an unknown match type", leaf);
    } else if (leaf.getExpectedValue() == null || !ConditionMatchers.isComparable(leaf.getExpectedValue())) {
      logger.warn("Audience condition {} has an unsupported condition value", leaf);
    } else if (!attributes.contains(leaf.getAttributeName())) {
      logger.debug("Audience condition {} evaluated to UNKNOWN because no value was passed for user attribute \"{}\"",
          leaf, leaf.getAttributeName());
    } else if (leaf.getMatchType() != MatchType.EXISTS) {
      logger.warn("Audience condition {} evaluated to UNKNOWN because a value of type {} was passed for user attribute \"{}\"",
          leaf, attributes.get(leaf.getAttributeName()).getType(), leaf.getAttributeName());
    }
  }
}
