package com.splitlab.sdk.server.interfaces;

import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.Objects;

/**
 * A user's saved experiment assignments, as returned by {@link UserProfileService#lookup(String)}.
 * <p>
 * Instances are immutable.
 */
public final class UserProfile {
  private final String userId;
  private final ImmutableMap<String, String> variationIdsByExperimentId;

  /**
   * Creates an instance.
   *
   * @param userId the user id
   * @param variationIdsByExperimentId a map of experiment ids to the variation ids the user was assigned;
   *   null is the same as an empty map
   */
  public UserProfile(String userId, Map<String, String> variationIdsByExperimentId) {
    this.userId = userId;
    this.variationIdsByExperimentId = variationIdsByExperimentId == null ? ImmutableMap.<String, String>of() :
      ImmutableMap.copyOf(variationIdsByExperimentId);
  }

  /**
   * Returns the user id.
   *
   * @return the user id
   */
  public String getUserId() {
    return userId;
  }

  /**
   * Returns the saved variation id for an experiment.
   *
   * @param experimentId the experiment id
   * @return the variation id, or null if none was saved
   */
  public String getVariationId(String experimentId) {
    return experimentId == null ? null : variationIdsByExperimentId.get(experimentId);
  }

  /**
   * Returns all saved assignments.
   *
   * @return an immutable map of experiment ids to variation ids
   */
  public Map<String, String> getVariationIdsByExperimentId() {
    return variationIdsByExperimentId;
  }

  @Override
  public boolean equals(Object o) {
    if (o instanceof UserProfile) {
      UserProfile other = (UserProfile)o;
      return Objects.equals(userId, other.userId) && variationIdsByExperimentId.equals(other.variationIdsByExperimentId);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(userId, variationIdsByExperimentId);
  }

  @Override
  public String toString() {
    return "UserProfile(" + userId + "," + variationIdsByExperimentId + ")";
  }
}
