package com.splitlab.sdk.server.subsystems;

/**
 * Thrown when a datafile cannot be turned into a configuration snapshot, either because it is not
 * valid JSON for the data model or because its version is not supported.
 * <p>
 * The SDK uses this class to avoid depending on exception types from the underlying JSON framework
 * that it uses (currently Gson). Client methods never throw it; it is only relevant when building a
 * configuration snapshot directly.
 */
@SuppressWarnings("serial")
public class DatafileException extends RuntimeException {
  /**
   * Creates an instance.
   * @param message a description of the problem
   */
  public DatafileException(String message) {
    super(message);
  }

  /**
   * Creates an instance.
   * @param cause the underlying exception
   */
  public DatafileException(Throwable cause) {
    super(cause);
  }
}
