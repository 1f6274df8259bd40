package com.splitlab.sdk.server.interfaces;

/**
 * Interface for a component that holds runtime forced variations: explicit per-user overrides that
 * bypass audience conditions, mutual exclusion and bucketing for one experiment.
 * <p>
 * By default the client uses an in-memory store that validates keys against its current datafile. A
 * forced variation is stored by key, so if a datafile update removes the variation, the override is
 * ignored until it is changed or cleared.
 */
public interface ForcedVariationStore {
  /**
   * Sets or clears a forced variation.
   *
   * @param experimentKey the experiment key
   * @param userId the user id
   * @param variationKey the variation key, or null to clear the override
   * @return true if the override was stored or cleared, false if it was rejected
   */
  boolean setForcedVariation(String experimentKey, String userId, String variationKey);

  /**
   * Returns a forced variation.
   *
   * @param experimentKey the experiment key
   * @param userId the user id
   * @return the forced variation key, or null if there is none
   */
  String getForcedVariation(String experimentKey, String userId);
}
