package com.splitlab.sdk.server;

import com.launchdarkly.logging.LDLogger;
import com.splitlab.sdk.server.DataModel.FeatureFlag;
import com.splitlab.sdk.server.DataModel.FeatureVariable;

import javax.annotation.Nullable;

/**
 * Resolves the value of a feature variable for a feature decision, and converts it to the variable's
 * declared type.
 */
final class FeatureVariableValues {
  private final LDLogger logger;

  FeatureVariableValues(LDLogger logger) {
    this.logger = logger;
  }

  /**
   * Looks up a variable and checks that it has the type the application asked for. This is done before
   * the user is bucketed, so a request that can only return null does not touch the user profile service.
   *
   * @param config the current snapshot
   * @param flag the feature
   * @param variableKey the variable key
   * @param requestedType the type the application asked for
   * @return the variable, or null if it does not exist or has a different type
   */
  @Nullable
  FeatureVariable resolve(ConfigIndex config, FeatureFlag flag, String variableKey, FeatureVariableType requestedType) {
    FeatureVariable variable = config.getFeatureVariable(flag, variableKey);
    if (variable == null) {
      logger.error("No variable with key \"{}\" in feature \"{}\"", variableKey, flag.getKey());
      return null;
    }
    if (variable.getType() != requestedType) {
      logger.warn("Requested variable \"{}\" as type {} but it is of type {}", variableKey, requestedType, variable.getType());
      return null;
    }
    return variable;
  }

  /**
   * Returns a variable's value for a user.
   * <p>
   * If the user was assigned a variation and that variation overrides the variable, the override is used;
   * otherwise the variable's default value is used.
   *
   * @param config the snapshot that produced the decision
   * @param flag the feature
   * @param variable a variable returned by {@link #resolve}
   * @param decision the feature decision for the user, or null
   * @return the converted value, or null if the value cannot be converted
   */
  @Nullable
  Object getValue(ConfigIndex config, FeatureFlag flag, FeatureVariable variable, @Nullable Decision decision) {
    String variableKey = variable.getKey();
    String rawValue = variable.getDefaultValue();
    if (decision == null) {
      logger.info("User was not assigned a variation of feature \"{}\"; returning the default value of variable \"{}\"",
          flag.getKey(), variableKey);
    } else {
      String override = config.getVariableValues(decision.getVariationId()).get(variable.getId());
      if (override != null) {
        rawValue = override;
        logger.info("Got value \"{}\" for variable \"{}\" of feature \"{}\"", rawValue, variableKey, flag.getKey());
      } else {
        logger.debug("Variable \"{}\" is not used in variation \"{}\"; returning the default value",
            variableKey, decision.getVariationKey());
      }
    }
    if (rawValue == null) {
      return null;
    }
    try {
      return variable.getType().parse(rawValue);
    } catch (NumberFormatException e) {
      logger.error("Value \"{}\" of variable \"{}\" is not a valid {}", rawValue, variableKey, variable.getType());
      return null;
    }
  }
}
