package com.splitlab.sdk.server.integrations;

import com.launchdarkly.logging.LDLogAdapter;
import com.launchdarkly.logging.LDLogLevel;
import com.launchdarkly.logging.Logs;
import com.splitlab.sdk.server.Components;
import com.splitlab.sdk.server.subsystems.LoggingConfiguration;

/**
 * Contains methods for configuring the SDK's logging behavior.
 * <p>
 * If you want to set non-default values for any of these properties, create a builder with
 * {@link Components#logging()}, change its properties with the methods of this class, and pass it
 * to {@link com.splitlab.sdk.server.DecisionConfig.Builder#logging(LoggingConfigurationBuilder)}:
 * <pre><code>
 *     DecisionConfig config = new DecisionConfig.Builder()
 *         .logging(
 *           Components.logging()
 *             .level(LDLogLevel.DEBUG)
 *          )
 *         .build();
 * </code></pre>
 * <p>
 * Note that this class is abstract; the actual implementation is created by calling {@link Components#logging()}.
 */
public abstract class LoggingConfigurationBuilder {
  protected String baseName = null;
  protected LDLogAdapter logAdapter = null;
  protected LDLogLevel minimumLevel = null;

  /**
   * Specifies the implementation of logging to use.
   * <p>
   * The <code>com.launchdarkly.logging</code> API defines the {@link LDLogAdapter} interface to specify
   * where log output should be sent.
   * <p>
   * The default logging destination, if no adapter is specified, depends on whether
   * <a href="https://www.slf4j.org/">SLF4J</a> is present in the classpath. If it is, then the SDK uses
   * {@link com.launchdarkly.logging.LDSLF4J#adapter()}, causing output to go to SLF4J; what happens to
   * the output then is determined by the SLF4J configuration. If SLF4J is not present in the classpath,
   * the SDK uses {@link Logs#toConsole()} instead, causing output to go to the {@code System.err} stream.
   * <p>
   * If you don't need to customize any options other than the adapter, you can call
   * {@link Components#logging(LDLogAdapter)} as a shortcut rather than using
   * {@link LoggingConfigurationBuilder}.
   *
   * @param logAdapter an {@link LDLogAdapter} for the desired logging implementation
   * @return the builder
   */
  public LoggingConfigurationBuilder adapter(LDLogAdapter logAdapter) {
    this.logAdapter = logAdapter;
    return this;
  }

  /**
   * Specifies a custom base logger name.
   * <p>
   * By default, the SDK uses a base logger name of <code>com.splitlab.sdk.server.DecisionClient</code>.
   * Messages will be logged either under this name, or with a suffix to indicate what
   * general area of functionality is involved:
   * <ul>
   * <li> <code>.Datafile</code>: problems or status messages regarding loading and replacing the
   * datafile. </li>
   * <li> <code>.Evaluation</code>: how experiment and feature decisions were made, and problems caused
   * by invalid datafile contents or incorrect usage of the SDK. </li>
   * <li> <code>.Collaborators</code>: failures of the user profile service or the forced variation
   * store. </li>
   * </ul>
   * <p>
   * Setting {@link #baseLoggerName(String)} to a non-null value overrides the default. The
   * SDK still adds the same suffixes to the name.
   *
   * @param name the base logger name
   * @return the builder
   */
  public LoggingConfigurationBuilder baseLoggerName(String name) {
    this.baseName = name;
    return this;
  }

  /**
   * Specifies the lowest level of logging to enable.
   * <p>
   * This is only applicable when using an implementation of logging that does not have its own
   * external configuration mechanism, such as {@link Logs#toConsole()}. If not specified, the default
   * minimum level is {@link LDLogLevel#INFO}. When using SLF4J, use its configuration instead.
   *
   * @param minimumLevel the lowest level of logging to enable
   * @return the builder
   */
  public LoggingConfigurationBuilder level(LDLogLevel minimumLevel) {
    this.minimumLevel = minimumLevel;
    return this;
  }

  /**
   * Creates the logging configuration.
   *
   * @return a {@link LoggingConfiguration}
   */
  public abstract LoggingConfiguration build();
}
