package com.splitlab.sdk.server;

import com.launchdarkly.logging.LDLogLevel;

import org.junit.Test;

import static com.splitlab.sdk.server.TestUtil.DECISION_DATAFILE;
import static com.splitlab.sdk.server.TestUtil.datafile;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

@SuppressWarnings("javadoc")
public class InMemoryForcedVariationStoreTest extends BaseTest {
  private final ConfigHolder holder = new ConfigHolder(testLogger);
  private final InMemoryForcedVariationStore store = new InMemoryForcedVariationStore(holder, testLogger);

  public InMemoryForcedVariationStoreTest() {
    holder.set(datafile(DECISION_DATAFILE));
  }

  @Test
  public void setAndGet() {
    assertTrue(store.setForcedVariation("exp_basic", "u1", "B"));
    assertEquals("B", store.getForcedVariation("exp_basic", "u1"));
    assertNull(store.getForcedVariation("exp_basic", "u2"));
    assertNull(store.getForcedVariation("exp_full", "u1"));
  }

  @Test
  public void laterValueReplacesEarlierValue() {
    assertTrue(store.setForcedVariation("exp_basic", "u1", "B"));
    assertTrue(store.setForcedVariation("exp_basic", "u1", "A"));
    assertEquals("A", store.getForcedVariation("exp_basic", "u1"));
  }

  @Test
  public void nullVariationClears() {
    assertTrue(store.setForcedVariation("exp_basic", "u1", "B"));
    assertTrue(store.setForcedVariation("exp_basic", "u1", null));
    assertNull(store.getForcedVariation("exp_basic", "u1"));
    // clearing something that was never set is not an error
    assertTrue(store.setForcedVariation("exp_full", "u1", null));
  }

  @Test
  public void unknownExperimentIsRejected() {
    assertFalse(store.setForcedVariation("nope", "u1", "A"));
    assertTrue(hasLogMessage(LDLogLevel.ERROR, "Experiment key \"nope\" is not in the datafile"));
  }

  @Test
  public void unknownVariationIsRejected() {
    assertTrue(store.setForcedVariation("exp_basic", "u1", "B"));
    assertFalse(store.setForcedVariation("exp_basic", "u1", "Z"));
    assertEquals("B", store.getForcedVariation("exp_basic", "u1"));
    assertTrue(hasLogMessage(LDLogLevel.ERROR, "Variation key \"Z\" is not in experiment \"exp_basic\""));
  }

  @Test
  public void invalidArgumentsAreRejected() {
    assertFalse(store.setForcedVariation("exp_basic", null, "A"));
    assertFalse(store.setForcedVariation("", "u1", "A"));
    assertFalse(store.setForcedVariation(null, "u1", "A"));
    assertNull(store.getForcedVariation(null, "u1"));
    assertNull(store.getForcedVariation("exp_basic", null));
  }

  @Test
  public void emptyUserIdIsAllowed() {
    assertTrue(store.setForcedVariation("exp_basic", "", "A"));
    assertEquals("A", store.getForcedVariation("exp_basic", ""));
  }

  @Test
  public void nothingCanBeSetWithoutDatafile() {
    InMemoryForcedVariationStore empty = new InMemoryForcedVariationStore(new ConfigHolder(testLogger), testLogger);
    assertFalse(empty.setForcedVariation("exp_basic", "u1", "A"));
  }

  @Test
  public void usersAreIndependent() {
    assertTrue(store.setForcedVariation("exp_basic", "u1", "A"));
    assertTrue(store.setForcedVariation("exp_basic", "u2", "B"));
    assertEquals("A", store.getForcedVariation("exp_basic", "u1"));
    assertEquals("B", store.getForcedVariation("exp_basic", "u2"));
  }
}
