package com.splitlab.sdk.server;

import com.launchdarkly.logging.LDLogLevel;
import com.splitlab.sdk.AttributeValue;
import com.splitlab.sdk.UserAttributes;
import com.splitlab.sdk.server.ConditionTree.And;
import com.splitlab.sdk.server.ConditionTree.Leaf;
import com.splitlab.sdk.server.ConditionTree.MatchType;
import com.splitlab.sdk.server.ConditionTree.Not;
import com.splitlab.sdk.server.ConditionTree.Or;
import com.splitlab.sdk.server.DataModel.Experiment;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.splitlab.sdk.server.ModelBuilders.allocation;
import static com.splitlab.sdk.server.ModelBuilders.audience;
import static com.splitlab.sdk.server.ModelBuilders.experimentBuilder;
import static com.splitlab.sdk.server.ModelBuilders.projectBuilder;
import static com.splitlab.sdk.server.ModelBuilders.variation;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

@SuppressWarnings("javadoc")
public class AudienceEvaluatorTest extends BaseTest {
  private static final UserAttributes NO_ATTRS = UserAttributes.empty();

  // Fixed-result operands built from leaves: "t" is present and true, "f" is present and false,
  // and "missing" is never set, so an exact match on it is unknown.
  private static final UserAttributes ATTRS = UserAttributes.builder().set("t", true).set("f", true).build();
  private static final ConditionTree TRUE = new Leaf("t", Leaf.CUSTOM_ATTRIBUTE_TYPE, MatchType.EXACT,
      AttributeValue.of(true));
  private static final ConditionTree FALSE = new Leaf("f", Leaf.CUSTOM_ATTRIBUTE_TYPE, MatchType.EXACT,
      AttributeValue.of(false));
  private static final ConditionTree UNKNOWN = new Leaf("missing", Leaf.CUSTOM_ATTRIBUTE_TYPE, MatchType.EXACT,
      AttributeValue.of(true));

  private final AudienceEvaluator evaluator = new AudienceEvaluator(testLogger);

  private Tristate eval(ConditionTree tree) {
    return evaluator.evaluate(tree, ATTRS, null);
  }

  private static List<ConditionTree> list(ConditionTree... trees) {
    return Arrays.asList(trees);
  }

  @Test
  public void andTruthTable() {
    assertEquals(Tristate.TRUE, eval(new And(list(TRUE, TRUE))));
    assertEquals(Tristate.UNKNOWN, eval(new And(list(TRUE, UNKNOWN))));
    assertEquals(Tristate.FALSE, eval(new And(list(FALSE, UNKNOWN))));
    assertEquals(Tristate.FALSE, eval(new And(list(UNKNOWN, FALSE))));
    assertEquals(Tristate.FALSE, eval(new And(list(TRUE, FALSE))));
    assertEquals(Tristate.UNKNOWN, eval(new And(list(UNKNOWN, UNKNOWN))));
  }

  @Test
  public void orTruthTable() {
    assertEquals(Tristate.TRUE, eval(new Or(list(TRUE, UNKNOWN))));
    assertEquals(Tristate.TRUE, eval(new Or(list(UNKNOWN, TRUE))));
    assertEquals(Tristate.UNKNOWN, eval(new Or(list(FALSE, UNKNOWN))));
    assertEquals(Tristate.FALSE, eval(new Or(list(FALSE, FALSE))));
    assertEquals(Tristate.TRUE, eval(new Or(list(FALSE, TRUE))));
  }

  @Test
  public void andStopsAtFirstFalse() {
    ConditionTree missing = new ConditionTree.AudienceReference("missing_audience");
    assertEquals(Tristate.FALSE, eval(new And(list(FALSE, missing))));
    assertFalse(hasLogMessage(LDLogLevel.WARN, "\"missing_audience\" is not in the datafile"));

    assertEquals(Tristate.UNKNOWN, eval(new And(list(TRUE, missing))));
    assertTrue(hasLogMessage(LDLogLevel.WARN, "\"missing_audience\" is not in the datafile"));
  }

  @Test
  public void orStopsAtFirstTrue() {
    ConditionTree missing = new ConditionTree.AudienceReference("missing_audience");
    assertEquals(Tristate.TRUE, eval(new Or(list(TRUE, missing))));
    assertFalse(hasLogMessage(LDLogLevel.WARN, "\"missing_audience\" is not in the datafile"));

    assertEquals(Tristate.UNKNOWN, eval(new Or(list(FALSE, missing))));
    assertTrue(hasLogMessage(LDLogLevel.WARN, "\"missing_audience\" is not in the datafile"));
  }

  @Test
  public void notTruthTable() {
    assertEquals(Tristate.FALSE, eval(new Not(TRUE)));
    assertEquals(Tristate.TRUE, eval(new Not(FALSE)));
    assertEquals(Tristate.UNKNOWN, eval(new Not(UNKNOWN)));
  }

  @Test
  public void emptyOperators() {
    assertEquals(Tristate.TRUE, eval(new And(Collections.<ConditionTree>emptyList())));
    assertEquals(Tristate.FALSE, eval(new Or(Collections.<ConditionTree>emptyList())));
    assertEquals(Tristate.UNKNOWN, eval(new Not(null)));
  }

  @Test
  public void unknownIsNotCollapsedBeforeNot() {
    // If unknown were collapsed to false inside the And, the Not would turn it into true.
    assertEquals(Tristate.UNKNOWN, eval(new Not(new And(list(TRUE, UNKNOWN)))));
    assertEquals(Tristate.UNKNOWN, eval(new Not(new Or(list(FALSE, UNKNOWN)))));
  }

  @Test
  public void nullTreeIsTrue() {
    assertEquals(Tristate.TRUE, evaluator.evaluate(null, NO_ATTRS, null));
  }

  @Test
  public void leafWithUnknownConditionTypeIsUnknown() {
    Leaf leaf = new Leaf("t", "some_other_type", MatchType.EXISTS, null);
    assertEquals(Tristate.UNKNOWN, eval(leaf));
    assertTrue(hasLogMessage(LDLogLevel.WARN, "unknown condition type"));
  }

  @Test
  public void leafWithUnknownMatchTypeIsUnknown() {
    Leaf leaf = new Leaf("t", Leaf.CUSTOM_ATTRIBUTE_TYPE, null, AttributeValue.of(true));
    assertEquals(Tristate.UNKNOWN, eval(leaf));
    assertTrue(hasLogMessage(LDLogLevel.WARN, "unknown match type"));
  }

  @Test
  public void typeMismatchIsLoggedAsWarning() {
    Leaf leaf = new Leaf("t", Leaf.CUSTOM_ATTRIBUTE_TYPE, MatchType.EXACT, AttributeValue.of("yes"));
    assertEquals(Tristate.UNKNOWN, eval(leaf));
    assertTrue(hasLogMessage(LDLogLevel.WARN, "a value of type BOOLEAN was passed"));
  }

  @Test
  public void audienceReferenceIsResolvedInConfig() {
    ConfigIndex config = projectBuilder()
        .audiences(audience("100", "[\"and\", {\"name\": \"age\", \"type\": \"custom_attribute\", \"match\": \"gt\", \"value\": 20}]"))
        .build();
    ConditionTree ref = new ConditionTree.AudienceReference("100");
    assertEquals(Tristate.TRUE, evaluator.evaluate(ref, UserAttributes.builder().set("age", 21).build(), config));
    assertEquals(Tristate.FALSE, evaluator.evaluate(ref, UserAttributes.builder().set("age", 20).build(), config));
    assertEquals(Tristate.UNKNOWN, evaluator.evaluate(ref, NO_ATTRS, config));
  }

  @Test
  public void missingAudienceIsUnknown() {
    ConfigIndex config = projectBuilder().build();
    assertEquals(Tristate.UNKNOWN, evaluator.evaluate(new ConditionTree.AudienceReference("nope"), NO_ATTRS, config));
    assertTrue(hasLogMessage(LDLogLevel.WARN, "\"nope\" is not in the datafile"));
  }

  @Test
  public void experimentWithNoAudiencesMatchesEveryone() {
    Experiment e = experimentBuilder("1", "e").variations(variation("v", "v")).trafficAllocation(allocation("v", 10000)).build();
    ConfigIndex config = projectBuilder().experiments(e).build();
    assertTrue(evaluator.matchesExperimentAudience(config, e, NO_ATTRS));
  }

  @Test
  public void experimentWithEmptyAudienceConditionsMatchesEveryone() {
    Experiment e = experimentBuilder("1", "e").audienceIds("100").audienceConditions("[]").build();
    ConfigIndex config = projectBuilder().experiments(e).build();
    assertTrue(evaluator.matchesExperimentAudience(config, e, NO_ATTRS));
  }

  @Test
  public void experimentAudienceIdsAreOred() {
    ConfigIndex config = projectBuilder()
        .audiences(
            audience("100", "[\"or\", {\"name\": \"a\", \"type\": \"custom_attribute\", \"value\": \"x\"}]"),
            audience("101", "[\"or\", {\"name\": \"b\", \"type\": \"custom_attribute\", \"value\": \"y\"}]"))
        .build();
    Experiment e = experimentBuilder("1", "e").audienceIds("100", "101").build();
    assertTrue(evaluator.matchesExperimentAudience(config, e, UserAttributes.builder().set("b", "y").build()));
    assertFalse(evaluator.matchesExperimentAudience(config, e, UserAttributes.builder().set("a", "z").set("b", "z").build()));
  }

  @Test
  public void unknownExperimentAudienceResultDoesNotMatch() {
    ConfigIndex config = projectBuilder()
        .audiences(audience("100", "[\"or\", {\"name\": \"a\", \"type\": \"custom_attribute\", \"value\": \"x\"}]"))
        .build();
    Experiment e = experimentBuilder("1", "e").audienceIds("100").build();
    assertFalse(evaluator.matchesExperimentAudience(config, e, NO_ATTRS));
  }

  @Test
  public void audienceConditionsTakePrecedenceOverAudienceIds() {
    ConfigIndex config = projectBuilder()
        .audiences(
            audience("100", "[\"or\", {\"name\": \"a\", \"type\": \"custom_attribute\", \"value\": \"x\"}]"),
            audience("101", "[\"or\", {\"name\": \"b\", \"type\": \"custom_attribute\", \"value\": \"y\"}]"))
        .build();
    Experiment e = experimentBuilder("1", "e").audienceIds("100").audienceConditions("[\"and\", \"100\", \"101\"]").build();
    assertFalse(evaluator.matchesExperimentAudience(config, e, UserAttributes.builder().set("a", "x").build()));
    assertTrue(evaluator.matchesExperimentAudience(config, e, UserAttributes.builder().set("a", "x").set("b", "y").build()));
  }
}
