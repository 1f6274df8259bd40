package com.splitlab.sdk.server;

import com.splitlab.sdk.server.integrations.LoggingConfigurationBuilder;
import com.splitlab.sdk.server.interfaces.ForcedVariationStore;
import com.splitlab.sdk.server.interfaces.UserProfileService;

/**
 * This class exposes advanced configuration options for the {@link DecisionClient}. Instances of this class
 * must be constructed with a {@link com.splitlab.sdk.server.DecisionConfig.Builder}.
 */
public final class DecisionConfig {
  static final DecisionConfig DEFAULT = new Builder().build();

  final LoggingConfigurationBuilder logging;
  final UserProfileService userProfileService;
  final ForcedVariationStore forcedVariationStore;

  DecisionConfig(Builder builder) {
    this.logging = builder.logging == null ? Components.logging() : builder.logging;
    this.userProfileService = builder.userProfileService;
    this.forcedVariationStore = builder.forcedVariationStore;
  }

  /**
   * A <a href="http://en.wikipedia.org/wiki/Builder_pattern">builder</a> that helps construct
   * {@link com.splitlab.sdk.server.DecisionConfig} objects. Builder calls can be chained, enabling the
   * following pattern:
   * <pre>
   * DecisionConfig config = new DecisionConfig.Builder()
   *      .userProfileService(myProfileService)
   *      .build()
   * </pre>
   */
  public static class Builder {
    private LoggingConfigurationBuilder logging = null;
    private UserProfileService userProfileService = null;
    private ForcedVariationStore forcedVariationStore = null;

    /**
     * Creates a builder with all configuration parameters set to the default.
     */
    public Builder() {
    }

    /**
     * Sets the SDK's logging configuration, using a builder from {@link Components#logging()}.
     *
     * @param logging the logging configuration builder
     * @return the builder
     */
    public Builder logging(LoggingConfigurationBuilder logging) {
      this.logging = logging;
      return this;
    }

    /**
     * Sets the component that persists users' experiment assignments. By default there is none, and
     * users are bucketed afresh on every call.
     *
     * @param userProfileService a {@link UserProfileService}, or null
     * @return the builder
     */
    public Builder userProfileService(UserProfileService userProfileService) {
      this.userProfileService = userProfileService;
      return this;
    }

    /**
     * Sets the component that holds runtime forced variations. By default the client keeps them in
     * memory and validates them against its current datafile.
     *
     * @param forcedVariationStore a {@link ForcedVariationStore}, or null for the default
     * @return the builder
     */
    public Builder forcedVariationStore(ForcedVariationStore forcedVariationStore) {
      this.forcedVariationStore = forcedVariationStore;
      return this;
    }

    /**
     * Builds the configured {@link com.splitlab.sdk.server.DecisionConfig} object.
     *
     * @return the {@link com.splitlab.sdk.server.DecisionConfig} configured by this builder
     */
    public DecisionConfig build() {
      return new DecisionConfig(this);
    }
  }
}
