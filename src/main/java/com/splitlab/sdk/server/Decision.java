package com.splitlab.sdk.server;

import com.splitlab.sdk.server.DataModel.Experiment;
import com.splitlab.sdk.server.DataModel.Variation;

import java.util.Objects;

/**
 * The result of a successful experiment or feature decision: the variation the user was assigned and
 * where the assignment came from.
 * <p>
 * Instances are immutable. "No decision" is always represented by a null reference rather than by an
 * instance of this class.
 */
public final class Decision {
  private final Experiment experiment;
  private final Variation variation;
  private final DecisionSource source;

  Decision(Experiment experiment, Variation variation, DecisionSource source) {
    this.experiment = experiment;
    this.variation = variation;
    this.source = source;
  }

  Experiment getExperiment() {
    return experiment;
  }

  Variation getVariation() {
    return variation;
  }

  /**
   * Returns the source of the decision.
   *
   * @return {@link DecisionSource#EXPERIMENT} or {@link DecisionSource#ROLLOUT}
   */
  public DecisionSource getSource() {
    return source;
  }

  /**
   * Returns the key of the experiment that produced the decision.
   *
   * @return the experiment key, or null for a rollout decision
   */
  public String getExperimentKey() {
    return experiment == null ? null : experiment.getKey();
  }

  /**
   * Returns the id of the experiment that produced the decision.
   *
   * @return the experiment id, or null for a rollout decision
   */
  public String getExperimentId() {
    return experiment == null ? null : experiment.getId();
  }

  /**
   * Returns the key of the assigned variation.
   *
   * @return the variation key
   */
  public String getVariationKey() {
    return variation.getKey();
  }

  /**
   * Returns the id of the assigned variation.
   *
   * @return the variation id
   */
  public String getVariationId() {
    return variation.getId();
  }

  /**
   * Returns the assigned variation's feature switch. Only meaningful for feature decisions.
   *
   * @return true if the variation enables its feature
   */
  public boolean isFeatureEnabled() {
    return variation.isFeatureEnabled();
  }

  @Override
  public boolean equals(Object o) {
    if (o instanceof Decision) {
      Decision other = (Decision)o;
      return source == other.source && Objects.equals(getExperimentId(), other.getExperimentId()) &&
          Objects.equals(getVariationId(), other.getVariationId());
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(source, getExperimentId(), getVariationId());
  }

  @Override
  public String toString() {
    return "Decision(" + source + "," + getExperimentKey() + "," + getVariationKey() + ")";
  }
}
