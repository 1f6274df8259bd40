package com.splitlab.sdk.server;

import com.launchdarkly.logging.LDLogAdapter;
import com.launchdarkly.logging.Logs;
import com.splitlab.sdk.server.ComponentsImpl.LoggingConfigurationBuilderImpl;
import com.splitlab.sdk.server.integrations.LoggingConfigurationBuilder;

/**
 * Provides configurable factories for the standard implementations of SDK components.
 * <p>
 * Some of the configuration options in {@link DecisionConfig.Builder} affect the entire SDK, but others are
 * specific to one area of functionality. For the latter, the builder takes an object that is created
 * with a method of this class.
 */
public abstract class Components {
  private Components() {}

  /**
   * Returns a configuration builder for the SDK's logging configuration.
   * <p>
   * Passing this to {@link DecisionConfig.Builder#logging(LoggingConfigurationBuilder)},
   * after setting any desired properties on the builder, applies this configuration to the SDK.
   * <pre><code>
   *     DecisionConfig config = new DecisionConfig.Builder()
   *         .logging(
   *              Components.logging()
   *                  .baseLoggerName("experiments")
   *         )
   *         .build();
   * </code></pre>
   *
   * @return a configuration builder
   * @see DecisionConfig.Builder#logging(LoggingConfigurationBuilder)
   */
  public static LoggingConfigurationBuilder logging() {
    return new LoggingConfigurationBuilderImpl();
  }

  /**
   * Returns a configuration builder for the SDK's logging configuration, specifying the
   * implementation of logging to use.
   * <p>
   * This is a shortcut for <code>Components.logging().adapter(logAdapter)</code>.
   *
   * @param logAdapter the log adapter
   * @return a configuration builder
   * @see LoggingConfigurationBuilder#adapter(LDLogAdapter)
   */
  public static LoggingConfigurationBuilder logging(LDLogAdapter logAdapter) {
    return logging().adapter(logAdapter);
  }

  /**
   * Returns a configuration builder that turns off SDK logging.
   * <p>
   * It is equivalent to <code>Components.logging(com.launchdarkly.logging.Logs.none())</code>.
   *
   * @return a configuration builder
   */
  public static LoggingConfigurationBuilder noLogging() {
    return logging().adapter(Logs.none());
  }
}
