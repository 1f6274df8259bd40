package com.splitlab.sdk.server;

/**
 * Static logger names to be shared by implementation code in the main {@code com.splitlab.sdk.server}
 * package.
 * <p>
 * Most class names in the SDK are package-private implementation details that are not meaningful to
 * users, so rather than naming loggers after classes we use the base logger name plus one of these
 * stable suffixes, which also makes it convenient to define SLF4J logger name filters.
 */
abstract class Loggers {
  private Loggers() {}

  static final String BASE_LOGGER_NAME = DecisionClient.class.getName();
  static final String COLLABORATORS_LOGGER_NAME = "Collaborators";
  static final String DATAFILE_LOGGER_NAME = "Datafile";
  static final String EVALUATION_LOGGER_NAME = "Evaluation";
}
