package com.splitlab.sdk.server;

import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;
import com.splitlab.sdk.server.subsystems.DatafileException;

/**
 * Holds the current {@link ConfigIndex} snapshot. A reload builds a complete new snapshot and then
 * publishes it with a single reference assignment; a decision that read the old reference finishes
 * against the old snapshot.
 */
final class ConfigHolder {
  private final Object writeLock = new Object();
  private final LDLogger logger;
  private volatile ConfigIndex current;

  ConfigHolder(LDLogger logger) {
    this.logger = logger;
  }

  /**
   * Returns the current snapshot.
   *
   * @return the snapshot, or null if no datafile has been successfully loaded
   */
  ConfigIndex get() {
    return current;
  }

  /**
   * Parses a datafile and, if that succeeds, makes it the current snapshot.
   *
   * @param datafileJson the datafile JSON
   * @return true if the snapshot was replaced; false if the datafile was invalid and the previous
   *   snapshot is still in use
   */
  boolean update(String datafileJson) {
    if (datafileJson == null) {
      logger.error("Datafile must not be null");
      return false;
    }
    ConfigIndex next;
    try {
      next = ConfigIndex.fromJson(datafileJson);
    } catch (DatafileException e) {
      logger.error("Invalid datafile, keeping the previous configuration: {}", LogValues.exceptionSummary(e));
      logger.debug("{}", LogValues.exceptionTrace(e));
      return false;
    }
    set(next);
    return true;
  }

  void set(ConfigIndex next) {
    synchronized (writeLock) {
      ConfigIndex previous = current;
      current = next;
      if (previous == null) {
        logger.info("Loaded datafile revision \"{}\"", next.getRevision());
      } else {
        logger.info("Replaced datafile revision \"{}\" with revision \"{}\"", previous.getRevision(), next.getRevision());
      }
    }
  }
}
