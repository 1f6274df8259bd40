package com.splitlab.sdk.server;

/**
 * Describes where a {@link Decision} came from.
 */
public enum DecisionSource {
  /**
   * The user was assigned a variation of an A/B experiment (for a feature, one of the feature's
   * associated experiments).
   */
  EXPERIMENT,

  /**
   * The user matched a targeting rule of a feature's rollout.
   */
  ROLLOUT
}
