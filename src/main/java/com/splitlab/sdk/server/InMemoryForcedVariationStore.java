package com.splitlab.sdk.server;

import com.launchdarkly.logging.LDLogger;
import com.splitlab.sdk.server.DataModel.Experiment;
import com.splitlab.sdk.server.interfaces.ForcedVariationStore;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The default {@link ForcedVariationStore}: forced variations live in memory for the lifetime of the
 * client, and are validated against the client's current datafile when they are set.
 */
final class InMemoryForcedVariationStore implements ForcedVariationStore {
  private final ConfigHolder configHolder;
  private final LDLogger logger;
  // user ID -> (experiment key -> variation key)
  private final Map<String, Map<String, String>> forcedVariations = new ConcurrentHashMap<>();

  InMemoryForcedVariationStore(ConfigHolder configHolder, LDLogger logger) {
    this.configHolder = configHolder;
    this.logger = logger;
  }

  @Override
  public boolean setForcedVariation(String experimentKey, String userId, String variationKey) {
    if (userId == null) {
      logger.error("User ID must not be null");
      return false;
    }
    if (experimentKey == null || experimentKey.isEmpty()) {
      logger.error("Experiment key must not be empty");
      return false;
    }
    ConfigIndex config = configHolder.get();
    Experiment experiment = config == null ? null : config.getExperimentForKey(experimentKey);
    if (experiment == null) {
      logger.error("Experiment key \"{}\" is not in the datafile", experimentKey);
      return false;
    }

    if (variationKey == null) {
      Map<String, String> forUser = forcedVariations.get(userId);
      if (forUser != null && forUser.remove(experimentKey) != null) {
        logger.debug("Cleared forced variation of experiment \"{}\" for user \"{}\"", experimentKey, userId);
      }
      return true;
    }
    if (config.getVariationForKey(experiment, variationKey) == null) {
      logger.error("Variation key \"{}\" is not in experiment \"{}\"", variationKey, experimentKey);
      return false;
    }
    forcedVariations.computeIfAbsent(userId, k -> new ConcurrentHashMap<>()).put(experimentKey, variationKey);
    logger.debug("Set forced variation \"{}\" of experiment \"{}\" for user \"{}\"", variationKey, experimentKey, userId);
    return true;
  }

  @Override
  public String getForcedVariation(String experimentKey, String userId) {
    if (userId == null || experimentKey == null) {
      return null;
    }
    Map<String, String> forUser = forcedVariations.get(userId);
    return forUser == null ? null : forUser.get(experimentKey);
  }
}
