package com.splitlab.sdk.server;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.launchdarkly.logging.LDLogger;
import com.splitlab.sdk.server.DataModel.TrafficAllocation;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Encapsulates the logic for assigning users to a slot of the bucket space, and for finding the entity
 * that a slot is allocated to.
 * <p>
 * Bucket values must be identical in every SDK that reads the same datafile, so the hash (MurmurHash3
 * x86 32-bit, seed 1, over the UTF-8 bytes of bucketing id followed by entity id) and the reduction
 * arithmetic are fixed.
 */
class Bucketer {
  /**
   * Bucket values are in the range [0, MAX_TRAFFIC_VALUE).
   */
  static final int MAX_TRAFFIC_VALUE = 10000;

  private static final int HASH_SEED = 1;
  private static final double MAX_HASH_VALUE = Math.pow(2, 32);
  private static final HashFunction HASH_FUNCTION = Hashing.murmur3_32_fixed(HASH_SEED);

  private final LDLogger logger;

  Bucketer(LDLogger logger) {
    this.logger = logger;
  }

  /**
   * Computes the bucket value for a user and an entity (an experiment, a rollout rule, or a group).
   *
   * @param bucketingId the user's bucketing id
   * @param entityId the id of the entity being bucketed into
   * @return a value in [0, 10000)
   */
  int bucketValue(String bucketingId, String entityId) {
    String key = bucketingId + entityId;
    int hash = HASH_FUNCTION.hashString(key, StandardCharsets.UTF_8).asInt();
    double ratio = (hash & 0xFFFFFFFFL) / MAX_HASH_VALUE;
    return (int)Math.floor(ratio * MAX_TRAFFIC_VALUE);
  }

  /**
   * Finds the entity that a bucket value is allocated to.
   *
   * @param bucketValue a bucket value
   * @param trafficAllocation the allocation table, sorted by end of range
   * @return the entity id, or null if the value is in an unallocated range
   */
  String resolve(int bucketValue, List<TrafficAllocation> trafficAllocation) {
    for (int i = 0; i < trafficAllocation.size(); i++) {
      TrafficAllocation ta = trafficAllocation.get(i);
      if (bucketValue < ta.getEndOfRange()) {
        String entityId = ta.getEntityId();
        return entityId == null || entityId.isEmpty() ? null : entityId;
      }
    }
    return null;
  }

  /**
   * Computes a bucket value and resolves it against an allocation table.
   *
   * @param bucketingId the user's bucketing id
   * @param entityId the id of the entity being bucketed into
   * @param trafficAllocation the entity's allocation table
   * @return the allocated entity id, or null
   */
  String bucket(String bucketingId, String entityId, List<TrafficAllocation> trafficAllocation) {
    int value = bucketValue(bucketingId, entityId);
    logger.debug("Assigned bucket {} to user with bucketing ID \"{}\"", value, bucketingId);
    return resolve(value, trafficAllocation);
  }
}
