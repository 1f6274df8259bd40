package com.splitlab.sdk.server.interfaces;

import com.splitlab.sdk.UserAttributes;
import com.splitlab.sdk.server.Decision;
import com.splitlab.sdk.server.DecisionClient;

import java.io.Closeable;
import java.util.List;

/**
 * This interface defines the public methods of {@link DecisionClient}.
 * <p>
 * Applications will normally interact directly with {@link DecisionClient}, and must use its constructor to
 * initialize the SDK, but being able to refer to it indirectly via an interface may be helpful in test
 * scenarios (mocking) or for some dependency injection frameworks.
 * <p>
 * None of these methods throw exceptions. Invalid arguments, and keys that are not in the datafile,
 * are logged at {@code ERROR} or {@code WARN} level and produce the method's "no result" value.
 * In every method, null attributes are the same as {@link UserAttributes#empty()}.
 */
public interface DecisionClientInterface extends Closeable {
  /**
   * Tests whether the client has a usable datafile.
   *
   * @return true if a datafile has been successfully loaded
   */
  boolean isInitialized();

  /**
   * Replaces the client's datafile. Decisions already in progress finish with the previous datafile.
   *
   * @param datafileJson the new datafile JSON
   * @return true if the datafile was valid and is now in use; false if the previous datafile is still in use
   */
  boolean updateDatafile(String datafileJson);

  /**
   * Returns the revision of the datafile currently in use.
   *
   * @return the revision, or null if the client is not initialized
   */
  String getDatafileRevision();

  /**
   * Decides which variation of an experiment a user is in.
   *
   * @param experimentKey the experiment key
   * @param userId the user id
   * @param attributes the user's attributes
   * @return the decision, or null if the user is not in the experiment
   */
  Decision decideExperiment(String experimentKey, String userId, UserAttributes attributes);

  /**
   * Returns the key of the variation of an experiment that a user is in.
   *
   * @param experimentKey the experiment key
   * @param userId the user id
   * @param attributes the user's attributes
   * @return the variation key, or null if the user is not in the experiment
   */
  String getVariation(String experimentKey, String userId, UserAttributes attributes);

  /**
   * Forces a user into a variation of an experiment, or clears such an override. The override takes
   * precedence over every other rule, including audience conditions and mutual exclusion.
   *
   * @param experimentKey the experiment key
   * @param userId the user id
   * @param variationKey the variation key, or null to clear the override
   * @return true if the override was stored or cleared; false if the experiment or variation is unknown
   */
  boolean setForcedVariation(String experimentKey, String userId, String variationKey);

  /**
   * Returns a variation set with {@link #setForcedVariation(String, String, String)}.
   *
   * @param experimentKey the experiment key
   * @param userId the user id
   * @return the variation key, or null if there is no override or its variation no longer exists
   */
  String getForcedVariation(String experimentKey, String userId);

  /**
   * Decides which variation of a feature a user gets.
   *
   * @param featureKey the feature key
   * @param userId the user id
   * @param attributes the user's attributes
   * @return the decision, or null if no experiment or rollout rule of the feature applies to the user
   */
  Decision decideFeature(String featureKey, String userId, UserAttributes attributes);

  /**
   * Tests whether a feature is enabled for a user.
   *
   * @param featureKey the feature key
   * @param userId the user id
   * @param attributes the user's attributes
   * @return true if the user was assigned a variation that enables the feature
   */
  boolean isFeatureEnabled(String featureKey, String userId, UserAttributes attributes);

  /**
   * Returns the keys of all features that are enabled for a user, in datafile order.
   *
   * @param userId the user id
   * @param attributes the user's attributes
   * @return a list of feature keys; never null
   */
  List<String> getEnabledFeatures(String userId, UserAttributes attributes);

  /**
   * Returns the value of a string feature variable for a user.
   *
   * @param featureKey the feature key
   * @param variableKey the variable key
   * @param userId the user id
   * @param attributes the user's attributes
   * @return the value, or null if the variable is unknown or is not a string variable
   */
  String getFeatureVariableString(String featureKey, String variableKey, String userId, UserAttributes attributes);

  /**
   * Returns the value of a boolean feature variable for a user.
   *
   * @param featureKey the feature key
   * @param variableKey the variable key
   * @param userId the user id
   * @param attributes the user's attributes
   * @return the value, or null if the variable is unknown or is not a boolean variable
   */
  Boolean getFeatureVariableBoolean(String featureKey, String variableKey, String userId, UserAttributes attributes);

  /**
   * Returns the value of an integer feature variable for a user.
   *
   * @param featureKey the feature key
   * @param variableKey the variable key
   * @param userId the user id
   * @param attributes the user's attributes
   * @return the value, or null if the variable is unknown, is not an integer variable, or its value is
   *   not a valid integer
   */
  Integer getFeatureVariableInteger(String featureKey, String variableKey, String userId, UserAttributes attributes);

  /**
   * Returns the value of a double feature variable for a user.
   *
   * @param featureKey the feature key
   * @param variableKey the variable key
   * @param userId the user id
   * @param attributes the user's attributes
   * @return the value, or null if the variable is unknown, is not a double variable, or its value is
   *   not a valid number
   */
  Double getFeatureVariableDouble(String featureKey, String variableKey, String userId, UserAttributes attributes);
}
