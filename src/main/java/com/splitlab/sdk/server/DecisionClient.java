package com.splitlab.sdk.server;

import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;
import com.splitlab.sdk.UserAttributes;
import com.splitlab.sdk.server.DataModel.Experiment;
import com.splitlab.sdk.server.DataModel.FeatureFlag;
import com.splitlab.sdk.server.DataModel.FeatureVariable;
import com.splitlab.sdk.server.interfaces.DecisionClientInterface;
import com.splitlab.sdk.server.interfaces.ForcedVariationStore;
import com.splitlab.sdk.server.interfaces.UserProfileService;
import com.splitlab.sdk.server.subsystems.LoggingConfiguration;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A client for making experiment and feature decisions from a datafile. Applications should instantiate
 * a single {@code DecisionClient} for the lifetime of their application, and replace its datafile with
 * {@link #updateDatafile(String)} when a new one is available.
 * <p>
 * The client makes no network calls and sends no events. Every method can be called concurrently.
 */
public final class DecisionClient implements DecisionClientInterface {
  private final ConfigHolder configHolder;
  private final DecisionService decisionService;
  private final FeatureVariableValues featureVariables;
  private final ForcedVariationStore forcedVariationStore;
  private final UserProfileService userProfileService;
  final LDLogger baseLogger;
  private final LDLogger evaluationLogger;

  /**
   * Creates a new client with the default configuration.
   * <p>
   * If the datafile is not valid, the client is still created, but {@link #isInitialized()} returns false
   * and every decision method returns its "no result" value until a valid datafile is supplied with
   * {@link #updateDatafile(String)}.
   *
   * @param datafileJson the datafile JSON
   */
  public DecisionClient(String datafileJson) {
    this(datafileJson, DecisionConfig.DEFAULT);
  }

  /**
   * Creates a new client with a custom configuration.
   *
   * @param datafileJson the datafile JSON
   * @param config a client configuration object
   * @see #DecisionClient(String)
   */
  public DecisionClient(String datafileJson, DecisionConfig config) {
    checkNotNull(config, "config must not be null");

    LoggingConfiguration logging = config.logging.build();
    this.baseLogger = LDLogger.withAdapter(logging.getLogAdapter(), logging.getBaseLoggerName());
    this.evaluationLogger = baseLogger.subLogger(Loggers.EVALUATION_LOGGER_NAME);
    LDLogger collaboratorsLogger = baseLogger.subLogger(Loggers.COLLABORATORS_LOGGER_NAME);

    this.configHolder = new ConfigHolder(baseLogger.subLogger(Loggers.DATAFILE_LOGGER_NAME));
    this.forcedVariationStore = config.forcedVariationStore != null ? config.forcedVariationStore :
      new InMemoryForcedVariationStore(configHolder, collaboratorsLogger);
    this.userProfileService = config.userProfileService;
    this.decisionService = new DecisionService(
        new Bucketer(evaluationLogger),
        new AudienceEvaluator(evaluationLogger),
        forcedVariationStore,
        evaluationLogger,
        collaboratorsLogger
        );
    this.featureVariables = new FeatureVariableValues(evaluationLogger);

    if (!configHolder.update(datafileJson)) {
      baseLogger.error("Client was created without a valid datafile; decisions will not be available until one is supplied");
    }
  }

  @Override
  public boolean isInitialized() {
    return configHolder.get() != null;
  }

  @Override
  public boolean updateDatafile(String datafileJson) {
    return configHolder.update(datafileJson);
  }

  @Override
  public String getDatafileRevision() {
    ConfigIndex config = configHolder.get();
    return config == null ? null : config.getRevision();
  }

  @Override
  public Decision decideExperiment(String experimentKey, String userId, UserAttributes attributes) {
    ConfigIndex config = getConfig("decideExperiment");
    if (config == null || !keyAndUserValid("decideExperiment", experimentKey, userId)) {
      return null;
    }
    return decisionService.decideExperiment(config, experimentKey, userId, orEmpty(attributes), userProfileService);
  }

  @Override
  public String getVariation(String experimentKey, String userId, UserAttributes attributes) {
    Decision decision = decideExperiment(experimentKey, userId, attributes);
    return decision == null ? null : decision.getVariationKey();
  }

  @Override
  public boolean setForcedVariation(String experimentKey, String userId, String variationKey) {
    if (getConfig("setForcedVariation") == null) {
      return false;
    }
    try {
      return forcedVariationStore.setForcedVariation(experimentKey, userId, variationKey);
    } catch (RuntimeException e) {
      evaluationLogger.error("Unexpected error from forced variation store: {}", LogValues.exceptionSummary(e));
      evaluationLogger.debug("{}", LogValues.exceptionTrace(e));
      return false;
    }
  }

  @Override
  public String getForcedVariation(String experimentKey, String userId) {
    ConfigIndex config = getConfig("getForcedVariation");
    if (config == null || !keyAndUserValid("getForcedVariation", experimentKey, userId)) {
      return null;
    }
    Experiment experiment = config.getExperimentForKey(experimentKey);
    if (experiment == null) {
      evaluationLogger.warn("Experiment key \"{}\" is not in the datafile", experimentKey);
      return null;
    }
    String variationKey;
    try {
      variationKey = forcedVariationStore.getForcedVariation(experimentKey, userId);
    } catch (RuntimeException e) {
      evaluationLogger.error("Unexpected error from forced variation store: {}", LogValues.exceptionSummary(e));
      evaluationLogger.debug("{}", LogValues.exceptionTrace(e));
      return null;
    }
    return config.getVariationForKey(experiment, variationKey) == null ? null : variationKey;
  }

  @Override
  public Decision decideFeature(String featureKey, String userId, UserAttributes attributes) {
    ConfigIndex config = getConfig("decideFeature");
    if (config == null || !keyAndUserValid("decideFeature", featureKey, userId)) {
      return null;
    }
    return decisionService.decideFeature(config, featureKey, userId, orEmpty(attributes), userProfileService);
  }

  @Override
  public boolean isFeatureEnabled(String featureKey, String userId, UserAttributes attributes) {
    Decision decision = decideFeature(featureKey, userId, attributes);
    boolean enabled = decision != null && decision.isFeatureEnabled();
    evaluationLogger.info("Feature \"{}\" is {} for user \"{}\"", featureKey, enabled ? "enabled" : "not enabled", userId);
    return enabled;
  }

  @Override
  public List<String> getEnabledFeatures(String userId, UserAttributes attributes) {
    List<String> enabled = new ArrayList<>();
    ConfigIndex config = getConfig("getEnabledFeatures");
    if (config == null) {
      return enabled;
    }
    if (userId == null) {
      evaluationLogger.error("getEnabledFeatures was called with a null user ID");
      return enabled;
    }
    UserAttributes attrs = orEmpty(attributes);
    for (FeatureFlag flag: config.getFeatureFlags()) {
      Decision decision = decisionService.decideFeature(config, flag, userId, attrs, userProfileService);
      if (decision != null && decision.isFeatureEnabled()) {
        enabled.add(flag.getKey());
      }
    }
    return enabled;
  }

  @Override
  public String getFeatureVariableString(String featureKey, String variableKey, String userId, UserAttributes attributes) {
    return (String)getFeatureVariable(featureKey, variableKey, FeatureVariableType.STRING, userId, attributes);
  }

  @Override
  public Boolean getFeatureVariableBoolean(String featureKey, String variableKey, String userId, UserAttributes attributes) {
    return (Boolean)getFeatureVariable(featureKey, variableKey, FeatureVariableType.BOOLEAN, userId, attributes);
  }

  @Override
  public Integer getFeatureVariableInteger(String featureKey, String variableKey, String userId, UserAttributes attributes) {
    return (Integer)getFeatureVariable(featureKey, variableKey, FeatureVariableType.INTEGER, userId, attributes);
  }

  @Override
  public Double getFeatureVariableDouble(String featureKey, String variableKey, String userId, UserAttributes attributes) {
    return (Double)getFeatureVariable(featureKey, variableKey, FeatureVariableType.DOUBLE, userId, attributes);
  }

  private Object getFeatureVariable(String featureKey, String variableKey, FeatureVariableType type,
      String userId, UserAttributes attributes) {
    String method = "getFeatureVariable" + type.name().charAt(0) + type.name().substring(1).toLowerCase();
    ConfigIndex config = getConfig(method);
    if (config == null || !keyAndUserValid(method, featureKey, userId)) {
      return null;
    }
    if (variableKey == null || variableKey.isEmpty()) {
      evaluationLogger.error("{} was called with an empty variable key", method);
      return null;
    }
    FeatureFlag flag = config.getFeatureFlag(featureKey);
    if (flag == null) {
      evaluationLogger.error("No feature flag was found for key \"{}\"", featureKey);
      return null;
    }
    FeatureVariable variable = featureVariables.resolve(config, flag, variableKey, type);
    if (variable == null) {
      return null;
    }
    Decision decision = decisionService.decideFeature(config, flag, userId, orEmpty(attributes), userProfileService);
    return featureVariables.getValue(config, flag, variable, decision);
  }

  /**
   * Closes the client. The client makes no network connections and starts no threads, so this only
   * logs that the client is no longer in use.
   *
   * @throws IOException never
   */
  @Override
  public void close() throws IOException {
    baseLogger.info("Closing decision client");
  }

  private ConfigIndex getConfig(String method) {
    ConfigIndex config = configHolder.get();
    if (config == null) {
      evaluationLogger.error("{} was called before the client had a valid datafile", method);
    }
    return config;
  }

  private boolean keyAndUserValid(String method, String key, String userId) {
    if (key == null || key.isEmpty()) {
      evaluationLogger.error("{} was called with an empty key", method);
      return false;
    }
    if (userId == null) {
      evaluationLogger.error("{} was called with a null user ID", method);
      return false;
    }
    return true;
  }

  private static UserAttributes orEmpty(UserAttributes attributes) {
    return attributes == null ? UserAttributes.empty() : attributes;
  }
}
