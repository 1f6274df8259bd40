package com.splitlab.sdk.server;

/**
 * The result of evaluating a condition: true, false, or unknown when the user's attributes do not
 * allow the condition to be decided (a missing attribute, or a value of the wrong type).
 */
enum Tristate {
  TRUE,
  FALSE,
  UNKNOWN;

  static Tristate of(boolean value) {
    return value ? TRUE : FALSE;
  }

  Tristate not() {
    switch (this) {
    case TRUE:
      return FALSE;
    case FALSE:
      return TRUE;
    default:
      return UNKNOWN;
    }
  }

  /**
   * Collapses the result for a caller that needs a yes/no answer; unknown counts as no.
   */
  boolean isTrue() {
    return this == TRUE;
  }
}
