package com.splitlab.sdk.server;

import com.launchdarkly.logging.LDLogLevel;
import com.splitlab.sdk.UserAttributes;
import com.splitlab.sdk.server.DataModel.Experiment;
import com.splitlab.sdk.server.TestUtil.FixedBucketer;
import com.splitlab.sdk.server.interfaces.ForcedVariationStore;
import com.splitlab.sdk.server.interfaces.UserProfile;
import com.splitlab.sdk.server.interfaces.UserProfileService;

import com.google.common.collect.ImmutableMap;

import org.junit.Test;

import static com.splitlab.sdk.server.ModelBuilders.allocation;
import static com.splitlab.sdk.server.ModelBuilders.experimentBuilder;
import static com.splitlab.sdk.server.ModelBuilders.projectBuilder;
import static com.splitlab.sdk.server.ModelBuilders.variation;
import static com.splitlab.sdk.server.TestUtil.DECISION_DATAFILE;
import static com.splitlab.sdk.server.TestUtil.datafile;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.strictMock;
import static org.easymock.EasyMock.verify;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

@SuppressWarnings("javadoc")
public class DecisionServiceTest extends BaseTest {
  private static final String USER = "user";
  private static final UserAttributes NO_ATTRS = UserAttributes.empty();
  private static final UserAttributes CHROME = UserAttributes.builder().set("browser_type", "chrome").build();

  private final ConfigIndex config = datafile(DECISION_DATAFILE);
  private final ConfigHolder configHolder = new ConfigHolder(testLogger);
  private final InMemoryForcedVariationStore forcedStore;

  public DecisionServiceTest() {
    configHolder.set(config);
    forcedStore = new InMemoryForcedVariationStore(configHolder, testLogger);
  }

  private DecisionService service(FixedBucketer bucketer) {
    return service(bucketer, forcedStore);
  }

  private DecisionService service(FixedBucketer bucketer, ForcedVariationStore store) {
    return new DecisionService(bucketer, new AudienceEvaluator(testLogger), store, testLogger, testLogger);
  }

  private static String variationKey(Decision d) {
    return d == null ? null : d.getVariationKey();
  }

  @Test
  public void bucketValueSelectsVariationFromAllocation() {
    assertEquals("A", variationKey(service(new FixedBucketer(3000)).decideExperiment(config, "exp_basic", USER, NO_ATTRS, null)));
    assertEquals("B", variationKey(service(new FixedBucketer(7000)).decideExperiment(config, "exp_basic", USER, NO_ATTRS, null)));
  }

  @Test
  public void allocationBoundariesAreExclusive() {
    assertEquals("A", variationKey(service(new FixedBucketer(4999)).decideExperiment(config, "exp_basic", USER, NO_ATTRS, null)));
    assertEquals("B", variationKey(service(new FixedBucketer(5000)).decideExperiment(config, "exp_basic", USER, NO_ATTRS, null)));
  }

  @Test
  public void decisionCarriesExperimentAndSource() {
    Decision d = service(new FixedBucketer(3000)).decideExperiment(config, "exp_basic", USER, NO_ATTRS, null);
    assertEquals(DecisionSource.EXPERIMENT, d.getSource());
    assertEquals("exp_basic", d.getExperimentKey());
    assertEquals("1001", d.getExperimentId());
    assertEquals("1", d.getVariationId());
  }

  @Test
  public void unallocatedTrafficIsNoDecision() {
    Experiment e = experimentBuilder("100", "capped")
        .variations(variation("1", "A"), variation("2", "B"))
        .trafficAllocation(allocation("1", 4000), allocation("2", 8000))
        .build();
    ConfigIndex capped = projectBuilder().experiments(e).build();
    assertNull(service(new FixedBucketer(9000)).decideExperiment(capped, "capped", USER, NO_ATTRS, null));
    assertEquals("B", variationKey(service(new FixedBucketer(7999)).decideExperiment(capped, "capped", USER, NO_ATTRS, null)));
  }

  @Test
  public void emptyEntityIdInAllocationIsNoDecision() {
    Experiment e = experimentBuilder("100", "holdback")
        .variations(variation("1", "A"))
        .trafficAllocation(allocation("", 5000), allocation("1", 10000))
        .build();
    ConfigIndex holdback = projectBuilder().experiments(e).build();
    assertNull(service(new FixedBucketer(100)).decideExperiment(holdback, "holdback", USER, NO_ATTRS, null));
  }

  @Test
  public void allocationToUnknownVariationIsNoDecision() {
    Experiment e = experimentBuilder("100", "dangling")
        .variations(variation("1", "A"))
        .trafficAllocation(allocation("99", 10000))
        .build();
    ConfigIndex dangling = projectBuilder().experiments(e).build();
    assertNull(service(new FixedBucketer(100)).decideExperiment(dangling, "dangling", USER, NO_ATTRS, null));
    assertTrue(hasLogMessage(LDLogLevel.WARN, "allocates traffic to unknown variation \"99\""));
  }

  @Test
  public void unknownExperimentIsNoDecision() {
    assertNull(service(new FixedBucketer(0)).decideExperiment(config, "nope", USER, NO_ATTRS, null));
    assertTrue(hasLogMessage(LDLogLevel.WARN, "Experiment key \"nope\" is not in the datafile"));
  }

  @Test
  public void experimentThatIsNotRunningIsNoDecisionEvenForWhitelistedOrForcedUsers() {
    DecisionService service = service(new FixedBucketer(0));
    assertNull(service.decideExperiment(config, "exp_paused", "forced_user", NO_ATTRS, null));
    assertTrue(forcedStore.setForcedVariation("exp_paused", USER, "p"));
    assertNull(service.decideExperiment(config, "exp_paused", USER, NO_ATTRS, null));
  }

  @Test
  public void whitelistBeatsBucketing() {
    assertEquals("B", variationKey(service(new FixedBucketer(1000)).decideExperiment(config, "exp_basic", "whitelisted_user", NO_ATTRS, null)));
  }

  @Test
  public void forcedVariationBeatsWhitelist() {
    DecisionService service = service(new FixedBucketer(9000));
    assertTrue(forcedStore.setForcedVariation("exp_basic", "whitelisted_user", "A"));
    assertEquals("A", variationKey(service.decideExperiment(config, "exp_basic", "whitelisted_user", NO_ATTRS, null)));

    assertTrue(forcedStore.setForcedVariation("exp_basic", "whitelisted_user", null));
    assertEquals("B", variationKey(service.decideExperiment(config, "exp_basic", "whitelisted_user", NO_ATTRS, null)));
  }

  @Test
  public void forcedVariationBypassesAudience() {
    DecisionService service = service(new FixedBucketer(0));
    assertNull(service.decideExperiment(config, "exp_full", USER, NO_ATTRS, null));
    assertTrue(forcedStore.setForcedVariation("exp_full", USER, "only"));
    assertEquals("only", variationKey(service.decideExperiment(config, "exp_full", USER, NO_ATTRS, null)));
  }

  @Test
  public void forcedVariationBypassesGroupExclusion() {
    // bucket 1000 in group 19000 selects group_exp_1
    DecisionService service = service(new FixedBucketer(1000));
    assertNull(service.decideExperiment(config, "group_exp_2", USER, NO_ATTRS, null));
    assertTrue(forcedStore.setForcedVariation("group_exp_2", USER, "g2"));
    assertEquals("g2", variationKey(service.decideExperiment(config, "group_exp_2", USER, NO_ATTRS, null)));
  }

  @Test
  public void forcedVariationThatNoLongerExistsIsIgnored() {
    ForcedVariationStore store = strictMock(ForcedVariationStore.class);
    expect(store.getForcedVariation("exp_basic", USER)).andReturn("Z");
    replay(store);

    assertEquals("A", variationKey(service(new FixedBucketer(1000), store).decideExperiment(config, "exp_basic", USER, NO_ATTRS, null)));
    assertTrue(hasLogMessage(LDLogLevel.WARN, "Forced variation \"Z\" no longer exists"));
    verify(store);
  }

  @Test
  public void forcedVariationStoreErrorIsLoggedAndIgnored() {
    ForcedVariationStore store = strictMock(ForcedVariationStore.class);
    expect(store.getForcedVariation("exp_basic", USER)).andThrow(new IllegalStateException("store is broken"));
    replay(store);

    assertEquals("A", variationKey(service(new FixedBucketer(1000), store).decideExperiment(config, "exp_basic", USER, NO_ATTRS, null)));
    assertTrue(hasLogMessage(LDLogLevel.ERROR, "store is broken"));
    verify(store);
  }

  @Test
  public void randomGroupAdmitsOnlyTheSelectedExperiment() {
    FixedBucketer bucketer = new FixedBucketer(1000).value(USER, "19000", 7000);
    DecisionService service = service(bucketer);
    assertNull(service.decideExperiment(config, "group_exp_1", USER, NO_ATTRS, null));
    assertEquals("g2", variationKey(service.decideExperiment(config, "group_exp_2", USER, NO_ATTRS, null)));
  }

  @Test
  public void overlappingGroupDoesNotBucketByGroup() {
    FixedBucketer bucketer = new FixedBucketer(1000);
    assertEquals("o", variationKey(service(bucketer).decideExperiment(config, "overlap_exp", USER, NO_ATTRS, null)));
    assertEquals(0, bucketer.callCount("19001"));
    assertEquals(1, bucketer.callCount("1201"));
  }

  @Test
  public void audienceMustMatch() {
    DecisionService service = service(new FixedBucketer(0));
    assertEquals("only", variationKey(service.decideExperiment(config, "exp_full", USER, CHROME, null)));
    assertNull(service.decideExperiment(config, "exp_full", USER,
        UserAttributes.builder().set("browser_type", "firefox").build(), null));
    assertNull(service.decideExperiment(config, "exp_full", USER, NO_ATTRS, null));
  }

  @Test
  public void audienceConditionsCombineAudiences() {
    DecisionService service = service(new FixedBucketer(0));
    UserAttributes chromeAdult = UserAttributes.builder().set("browser_type", "chrome").set("age", 18).build();
    UserAttributes chromeChild = UserAttributes.builder().set("browser_type", "chrome").set("age", 12).build();
    assertEquals("t", variationKey(service.decideExperiment(config, "exp_typed", USER, chromeAdult, null)));
    assertNull(service.decideExperiment(config, "exp_typed", USER, chromeChild, null));
    assertNull(service.decideExperiment(config, "exp_typed", USER, CHROME, null));
  }

  @Test
  public void audienceIsCheckedBeforeBucketing() {
    FixedBucketer bucketer = new FixedBucketer(0);
    assertNull(service(bucketer).decideExperiment(config, "exp_full", USER, NO_ATTRS, null));
    assertEquals(0, bucketer.callCount("1002"));
  }

  @Test
  public void bucketingIdAttributeReplacesUserId() {
    FixedBucketer bucketer = new FixedBucketer(1000).value("bucket-me", "1001", 7000);
    UserAttributes attrs = UserAttributes.builder().set(DecisionService.BUCKETING_ID_ATTRIBUTE, "bucket-me").build();
    assertEquals("B", variationKey(service(bucketer).decideExperiment(config, "exp_basic", USER, attrs, null)));
  }

  @Test
  public void nonStringBucketingIdAttributeIsIgnored() {
    FixedBucketer bucketer = new FixedBucketer(1000).value("5", "1001", 7000);
    UserAttributes attrs = UserAttributes.builder().set(DecisionService.BUCKETING_ID_ATTRIBUTE, 5).build();
    assertEquals("A", variationKey(service(bucketer).decideExperiment(config, "exp_basic", USER, attrs, null)));
    assertTrue(hasLogMessage(LDLogLevel.WARN, "Bucketing ID attribute is not a string"));
  }

  @Test
  public void savedVariationIsReused() throws Exception {
    UserProfileService profiles = strictMock(UserProfileService.class);
    expect(profiles.lookup(USER)).andReturn(new UserProfile(USER, ImmutableMap.of("1001", "2")));
    replay(profiles);

    assertEquals("B", variationKey(service(new FixedBucketer(1000)).decideExperiment(config, "exp_basic", USER, NO_ATTRS, profiles)));
    verify(profiles);
  }

  @Test
  public void savedVariationSurvivesAllocationChange() throws Exception {
    UserProfileService profiles = strictMock(UserProfileService.class);
    expect(profiles.lookup(USER)).andReturn(new UserProfile(USER, ImmutableMap.of("1001", "2")));
    replay(profiles);

    // in the updated datafile, variation 2 still exists but gets no traffic
    ConfigIndex updated = datafile(TestUtil.UPDATED_DATAFILE);
    assertEquals("B", variationKey(service(new FixedBucketer(1000)).decideExperiment(updated, "exp_basic", USER, NO_ATTRS, profiles)));
    verify(profiles);
  }

  @Test
  public void savedVariationThatNoLongerExistsIsReplaced() throws Exception {
    UserProfileService profiles = strictMock(UserProfileService.class);
    expect(profiles.lookup(USER)).andReturn(new UserProfile(USER, ImmutableMap.of("1001", "99")));
    expect(profiles.save(USER, "1001", "1")).andReturn(true);
    replay(profiles);

    assertEquals("A", variationKey(service(new FixedBucketer(1000)).decideExperiment(config, "exp_basic", USER, NO_ATTRS, profiles)));
    verify(profiles);
  }

  @Test
  public void newAssignmentIsSaved() throws Exception {
    UserProfileService profiles = strictMock(UserProfileService.class);
    expect(profiles.lookup(USER)).andReturn(null);
    expect(profiles.save(USER, "1001", "2")).andReturn(true);
    replay(profiles);

    assertEquals("B", variationKey(service(new FixedBucketer(7000)).decideExperiment(config, "exp_basic", USER, NO_ATTRS, profiles)));
    verify(profiles);
  }

  @Test
  public void noDecisionIsNotSaved() throws Exception {
    Experiment e = experimentBuilder("100", "half")
        .variations(variation("1", "A"))
        .trafficAllocation(allocation("1", 5000))
        .build();
    ConfigIndex half = projectBuilder().experiments(e).build();
    UserProfileService profiles = strictMock(UserProfileService.class);
    expect(profiles.lookup(USER)).andReturn(null);
    replay(profiles);

    assertNull(service(new FixedBucketer(7000)).decideExperiment(half, "half", USER, NO_ATTRS, profiles));
    verify(profiles);
  }

  @Test
  public void profileServiceIsNotConsultedForWhitelistedUsersOrAudienceMisses() throws Exception {
    UserProfileService profiles = strictMock(UserProfileService.class);
    replay(profiles);

    DecisionService service = service(new FixedBucketer(0));
    assertEquals("B", variationKey(service.decideExperiment(config, "exp_basic", "whitelisted_user", NO_ATTRS, profiles)));
    assertNull(service.decideExperiment(config, "exp_full", USER, NO_ATTRS, profiles));
    verify(profiles);
  }

  @Test
  public void lookupFailureIsLoggedAndDecisionContinues() throws Exception {
    UserProfileService profiles = strictMock(UserProfileService.class);
    expect(profiles.lookup(USER)).andThrow(new Exception("lookup is broken"));
    expect(profiles.save(USER, "1001", "1")).andReturn(true);
    replay(profiles);

    assertEquals("A", variationKey(service(new FixedBucketer(1000)).decideExperiment(config, "exp_basic", USER, NO_ATTRS, profiles)));
    assertTrue(hasLogMessage(LDLogLevel.ERROR, "User profile lookup for user \"user\" failed"));
    verify(profiles);
  }

  @Test
  public void saveFailureIsLoggedAndDecisionIsReturned() throws Exception {
    UserProfileService profiles = strictMock(UserProfileService.class);
    expect(profiles.lookup(USER)).andReturn(null);
    expect(profiles.save(USER, "1001", "1")).andThrow(new Exception("save is broken"));
    replay(profiles);

    assertEquals("A", variationKey(service(new FixedBucketer(1000)).decideExperiment(config, "exp_basic", USER, NO_ATTRS, profiles)));
    assertTrue(hasLogMessage(LDLogLevel.ERROR, "User profile save for user \"user\" failed"));
    verify(profiles);
  }

  @Test
  public void unsuccessfulSaveIsLogged() throws Exception {
    UserProfileService profiles = strictMock(UserProfileService.class);
    expect(profiles.lookup(USER)).andReturn(null);
    expect(profiles.save(USER, "1001", "1")).andReturn(false);
    replay(profiles);

    assertEquals("A", variationKey(service(new FixedBucketer(1000)).decideExperiment(config, "exp_basic", USER, NO_ATTRS, profiles)));
    assertTrue(hasLogMessage(LDLogLevel.WARN, "did not save variation"));
    verify(profiles);
  }

  @Test
  public void decisionsAreDeterministic() {
    DecisionService service = new DecisionService(new Bucketer(testLogger), new AudienceEvaluator(testLogger),
        forcedStore, testLogger, testLogger);
    for (int i = 0; i < 50; i++) {
      String user = "user" + i;
      Decision first = service.decideExperiment(config, "exp_basic", user, NO_ATTRS, null);
      Decision second = service.decideExperiment(config, "exp_basic", user, NO_ATTRS, null);
      assertEquals(first, second);
    }
  }
}
