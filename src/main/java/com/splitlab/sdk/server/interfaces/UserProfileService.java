package com.splitlab.sdk.server.interfaces;

/**
 * Interface for a component that persists users' experiment assignments ("sticky bucketing"), so that a
 * user keeps the variation they were first given even if the experiment's traffic allocation changes.
 * <p>
 * The SDK does not provide an implementation. If one is configured, the SDK calls {@link #lookup(String)}
 * before bucketing a user into an experiment, and {@link #save(String, String, String)} after a fresh
 * assignment. Implementations may be called concurrently. Exceptions thrown by either method are logged
 * and otherwise ignored: a failed lookup means fresh bucketing, and a failed save does not change the
 * decision.
 */
public interface UserProfileService {
  /**
   * Retrieves a user's saved assignments.
   *
   * @param userId the user id
   * @return the profile, or null if nothing has been saved for this user
   * @throws Exception if the underlying store could not be read
   */
  UserProfile lookup(String userId) throws Exception;

  /**
   * Saves one assignment, replacing any earlier assignment for the same user and experiment.
   *
   * @param userId the user id
   * @param experimentId the experiment id
   * @param variationId the variation id
   * @return true if the assignment was saved
   * @throws Exception if the underlying store could not be written
   */
  boolean save(String userId, String experimentId, String variationId) throws Exception;
}
