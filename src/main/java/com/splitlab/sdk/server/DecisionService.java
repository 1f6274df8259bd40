package com.splitlab.sdk.server;

import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;
import com.splitlab.sdk.AttributeValue;
import com.splitlab.sdk.UserAttributes;
import com.splitlab.sdk.server.DataModel.Experiment;
import com.splitlab.sdk.server.DataModel.FeatureFlag;
import com.splitlab.sdk.server.DataModel.Group;
import com.splitlab.sdk.server.DataModel.GroupPolicy;
import com.splitlab.sdk.server.DataModel.Rollout;
import com.splitlab.sdk.server.DataModel.Variation;
import com.splitlab.sdk.server.interfaces.ForcedVariationStore;
import com.splitlab.sdk.server.interfaces.UserProfile;
import com.splitlab.sdk.server.interfaces.UserProfileService;

import javax.annotation.Nullable;
import java.util.List;

/**
 * Decides which variation of an experiment, or of a feature, a user gets.
 * <p>
 * Every decision is made against a single {@link ConfigIndex} snapshot passed in by the caller. Missing
 * experiments, features, variations or audiences never cause an exception: they are logged and produce
 * a null ("no decision") result. The only side effects are the optional reads and writes of the
 * {@link UserProfileService}, whose failures are logged and otherwise ignored.
 */
class DecisionService {
  /**
   * A user attribute that, if it is a string, replaces the user id as the input to bucketing.
   */
  static final String BUCKETING_ID_ATTRIBUTE = "$opt_bucketing_id";

  private final Bucketer bucketer;
  private final AudienceEvaluator audienceEvaluator;
  private final ForcedVariationStore forcedVariations;
  private final LDLogger logger;
  private final LDLogger collaboratorsLogger;

  DecisionService(
      Bucketer bucketer,
      AudienceEvaluator audienceEvaluator,
      ForcedVariationStore forcedVariations,
      LDLogger logger,
      LDLogger collaboratorsLogger
      ) {
    this.bucketer = bucketer;
    this.audienceEvaluator = audienceEvaluator;
    this.forcedVariations = forcedVariations;
    this.logger = logger;
    this.collaboratorsLogger = collaboratorsLogger;
  }

  /**
   * Decides a user's variation for an experiment.
   * <p>
   * The steps are, in order: the experiment must exist and be running; a runtime forced variation wins;
   * then the datafile's whitelist; then, for an experiment in a random-policy group, the user must bucket
   * into this experiment within the group; then the audience conditions must evaluate to true; then a
   * saved assignment from the profile service is reused if its variation still exists; otherwise the user
   * is bucketed, and a fresh assignment is saved.
   *
   * @param config the current snapshot
   * @param experimentKey the experiment key
   * @param userId the user id
   * @param attributes the user's attributes
   * @param profileService the sticky bucketing store, or null for none
   * @return the decision, or null
   */
  @Nullable
  Decision decideExperiment(
      ConfigIndex config,
      String experimentKey,
      String userId,
      UserAttributes attributes,
      @Nullable UserProfileService profileService
      ) {
    Experiment experiment = config.getExperimentForKey(experimentKey);
    if (experiment == null) {
      logger.warn("Experiment key \"{}\" is not in the datafile", experimentKey);
      return null;
    }
    return decideExperiment(config, experiment, userId, attributes, profileService);
  }

  @Nullable
  Decision decideExperiment(
      ConfigIndex config,
      Experiment experiment,
      String userId,
      UserAttributes attributes,
      @Nullable UserProfileService profileService
      ) {
    if (!experiment.isRunning()) {
      logger.info("Experiment \"{}\" is not running", experiment.getKey());
      return null;
    }

    Variation variation = getForcedVariation(config, experiment, userId);
    if (variation != null) {
      return new Decision(experiment, variation, DecisionSource.EXPERIMENT);
    }

    variation = getWhitelistedVariation(config, experiment, userId);
    if (variation != null) {
      return new Decision(experiment, variation, DecisionSource.EXPERIMENT);
    }

    String bucketingId = getBucketingId(userId, attributes);

    if (!isInExperimentGroupSlot(config, experiment, userId, bucketingId)) {
      return null;
    }

    if (!audienceEvaluator.matchesExperimentAudience(config, experiment, attributes)) {
      logger.info("User \"{}\" does not meet the conditions to be in experiment \"{}\"", userId, experiment.getKey());
      return null;
    }

    UserProfile profile = profileService == null ? null : lookupProfile(profileService, userId);
    if (profile != null) {
      variation = getSavedVariation(config, experiment, profile);
      if (variation != null) {
        return new Decision(experiment, variation, DecisionSource.EXPERIMENT);
      }
    }

    String variationId = bucketer.bucket(bucketingId, experiment.getId(), experiment.getTrafficAllocation());
    variation = config.getVariationForId(experiment, variationId);
    if (variation == null) {
      if (variationId != null) {
        logger.warn("Experiment \"{}\" allocates traffic to unknown variation \"{}\"", experiment.getKey(), variationId);
      }
      logger.info("User \"{}\" is in no variation of experiment \"{}\"", userId, experiment.getKey());
      return null;
    }
    logger.info("User \"{}\" is in variation \"{}\" of experiment \"{}\"", userId, variation.getKey(), experiment.getKey());

    if (profileService != null) {
      saveAssignment(profileService, userId, experiment, variation);
    }
    return new Decision(experiment, variation, DecisionSource.EXPERIMENT);
  }

  /**
   * Decides whether a feature is enabled for a user, and which variation supplies its variable values.
   * <p>
   * The feature's experiments are tried first, in the order the datafile lists them; the first one that
   * produces a decision wins. Otherwise the rollout's rules are evaluated in order: a rule whose audience
   * does not match is skipped, but a user who matches a rule's audience and then buckets into none of its
   * variations is excluded from the feature. The last rule is the catch-all; if its audience does not
   * match, there is no decision.
   *
   * @param config the current snapshot
   * @param featureKey the feature key
   * @param userId the user id
   * @param attributes the user's attributes
   * @param profileService the sticky bucketing store, or null for none
   * @return the decision, or null
   */
  @Nullable
  Decision decideFeature(
      ConfigIndex config,
      String featureKey,
      String userId,
      UserAttributes attributes,
      @Nullable UserProfileService profileService
      ) {
    FeatureFlag flag = config.getFeatureFlag(featureKey);
    if (flag == null) {
      logger.error("Feature key \"{}\" is not in the datafile", featureKey);
      return null;
    }
    return decideFeature(config, flag, userId, attributes, profileService);
  }

  @Nullable
  Decision decideFeature(
      ConfigIndex config,
      FeatureFlag flag,
      String userId,
      UserAttributes attributes,
      @Nullable UserProfileService profileService
      ) {
    for (String experimentId: flag.getExperimentIds()) {
      Experiment experiment = config.getExperimentForId(experimentId);
      if (experiment == null) {
        logger.warn("Feature \"{}\" refers to unknown experiment \"{}\"", flag.getKey(), experimentId);
        continue;
      }
      Decision decision = decideExperiment(config, experiment, userId, attributes, profileService);
      if (decision != null) {
        logger.info("User \"{}\" is in experiment \"{}\" of feature \"{}\"", userId, experiment.getKey(), flag.getKey());
        return decision;
      }
    }

    Decision decision = decideRollout(config, flag, userId, attributes);
    if (decision == null) {
      logger.info("User \"{}\" is not in any experiment or rollout rule of feature \"{}\"", userId, flag.getKey());
    }
    return decision;
  }

  @Nullable
  private Decision decideRollout(ConfigIndex config, FeatureFlag flag, String userId, UserAttributes attributes) {
    String rolloutId = flag.getRolloutId();
    if (rolloutId == null) {
      return null;
    }
    Rollout rollout = config.getRollout(rolloutId);
    if (rollout == null) {
      logger.warn("Feature \"{}\" refers to unknown rollout \"{}\"", flag.getKey(), rolloutId);
      return null;
    }
    List<Experiment> rules = rollout.getRules();
    if (rules.isEmpty()) {
      return null;
    }
    String bucketingId = getBucketingId(userId, attributes);
    int lastIndex = rules.size() - 1;
    for (int i = 0; i <= lastIndex; i++) {
      Experiment rule = rules.get(i);
      if (!audienceEvaluator.matchesExperimentAudience(config, rule, attributes)) {
        if (i == lastIndex) {
          logger.debug("User \"{}\" does not meet the conditions of the catch-all rule of rollout \"{}\"", userId, rolloutId);
          return null;
        }
        logger.debug("User \"{}\" does not meet the conditions of rule {} of rollout \"{}\"", userId, i + 1, rolloutId);
        continue;
      }
      String variationId = bucketer.bucket(bucketingId, rule.getId(), rule.getTrafficAllocation());
      Variation variation = config.getVariationForId(rule, variationId);
      if (variation == null) {
        // Matching a rule's audience but missing its traffic allocation excludes the user from the
        // rollout; later rules are not consulted.
        logger.debug("User \"{}\" is excluded from rollout \"{}\" by the traffic allocation of rule {}",
            userId, rolloutId, i + 1);
        return null;
      }
      logger.debug("User \"{}\" is in variation \"{}\" of rule {} of rollout \"{}\"", userId, variation.getKey(), i + 1, rolloutId);
      return new Decision(null, variation, DecisionSource.ROLLOUT);
    }
    return null;
  }

  /**
   * Returns the id used as input to bucketing: the {@code $opt_bucketing_id} attribute if it is a
   * string, otherwise the user id.
   */
  String getBucketingId(String userId, UserAttributes attributes) {
    AttributeValue value = attributes.get(BUCKETING_ID_ATTRIBUTE);
    if (value.isString()) {
      return value.stringValue();
    }
    if (!value.isAbsent()) {
      logger.warn("Bucketing ID attribute is not a string; defaulting to user ID");
    }
    return userId;
  }

  @Nullable
  private Variation getForcedVariation(ConfigIndex config, Experiment experiment, String userId) {
    if (forcedVariations == null) {
      return null;
    }
    String variationKey;
    try {
      variationKey = forcedVariations.getForcedVariation(experiment.getKey(), userId);
    } catch (RuntimeException e) {
      collaboratorsLogger.error("Forced variation lookup for user \"{}\" failed: {}", userId, LogValues.exceptionSummary(e));
      return null;
    }
    if (variationKey == null) {
      return null;
    }
    Variation variation = config.getVariationForKey(experiment, variationKey);
    if (variation == null) {
      logger.warn("Forced variation \"{}\" no longer exists in experiment \"{}\"; ignoring it",
          variationKey, experiment.getKey());
      return null;
    }
    logger.info("User \"{}\" is forced into variation \"{}\" of experiment \"{}\"", userId, variationKey, experiment.getKey());
    return variation;
  }

  @Nullable
  private Variation getWhitelistedVariation(ConfigIndex config, Experiment experiment, String userId) {
    String variationKey = userId == null ? null : experiment.getForcedVariations().get(userId);
    if (variationKey == null) {
      return null;
    }
    Variation variation = config.getVariationForKey(experiment, variationKey);
    if (variation == null) {
      logger.error("Whitelisted variation \"{}\" is not in experiment \"{}\"", variationKey, experiment.getKey());
      return null;
    }
    logger.info("User \"{}\" is whitelisted into variation \"{}\" of experiment \"{}\"", userId, variationKey, experiment.getKey());
    return variation;
  }

  private boolean isInExperimentGroupSlot(ConfigIndex config, Experiment experiment, String userId, String bucketingId) {
    String groupId = experiment.getGroupId();
    if (groupId == null) {
      return true;
    }
    Group group = config.getGroup(groupId);
    if (group == null || group.getPolicy() != GroupPolicy.RANDOM) {
      return true;
    }
    String bucketedExperimentId = bucketer.bucket(bucketingId, group.getId(), group.getTrafficAllocation());
    if (bucketedExperimentId == null) {
      logger.info("User \"{}\" is not in any experiment of group \"{}\"", userId, groupId);
      return false;
    }
    if (!bucketedExperimentId.equals(experiment.getId())) {
      logger.info("User \"{}\" is not in experiment \"{}\" of group \"{}\"", userId, experiment.getKey(), groupId);
      return false;
    }
    return true;
  }

  @Nullable
  private UserProfile lookupProfile(UserProfileService profileService, String userId) {
    try {
      return profileService.lookup(userId);
    } catch (Exception e) {
      collaboratorsLogger.error("User profile lookup for user \"{}\" failed: {}", userId, LogValues.exceptionSummary(e));
      collaboratorsLogger.debug("{}", LogValues.exceptionTrace(e));
      return null;
    }
  }

  @Nullable
  private Variation getSavedVariation(ConfigIndex config, Experiment experiment, UserProfile profile) {
    String variationId = profile.getVariationId(experiment.getId());
    if (variationId == null) {
      return null;
    }
    Variation variation = config.getVariationForId(experiment, variationId);
    if (variation == null) {
      logger.info("Saved variation \"{}\" of experiment \"{}\" no longer exists; user \"{}\" will be re-bucketed",
          variationId, experiment.getKey(), profile.getUserId());
      return null;
    }
    logger.info("Returning saved variation \"{}\" of experiment \"{}\" for user \"{}\"",
        variation.getKey(), experiment.getKey(), profile.getUserId());
    return variation;
  }

  private void saveAssignment(UserProfileService profileService, String userId, Experiment experiment, Variation variation) {
    try {
      if (profileService.save(userId, experiment.getId(), variation.getId())) {
        collaboratorsLogger.debug("Saved variation \"{}\" of experiment \"{}\" for user \"{}\"",
            variation.getId(), experiment.getId(), userId);
      } else {
        collaboratorsLogger.warn("User profile service did not save variation \"{}\" of experiment \"{}\" for user \"{}\"",
            variation.getId(), experiment.getId(), userId);
      }
    } catch (Exception e) {
      collaboratorsLogger.error("User profile save for user \"{}\" failed: {}", userId, LogValues.exceptionSummary(e));
      collaboratorsLogger.debug("{}", LogValues.exceptionTrace(e));
    }
  }
}
