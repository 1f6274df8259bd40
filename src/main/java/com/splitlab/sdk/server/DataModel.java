package com.splitlab.sdk.server;

import com.google.gson.JsonElement;
import com.google.gson.annotations.JsonAdapter;
import com.google.gson.annotations.SerializedName;
import com.splitlab.sdk.server.DataModelPreprocessing.AudiencePreprocessed;
import com.splitlab.sdk.server.DataModelPreprocessing.ExperimentPreprocessed;
import com.splitlab.sdk.server.DataModelPreprocessing.VariationPreprocessed;

import java.util.List;
import java.util.Map;

import static java.util.Collections.emptyList;
import static java.util.Collections.emptyMap;

// IMPLEMENTATION NOTES:
//
// - All of the data model classes are package-private. Application code sees decisions through Decision and
// DecisionClient, so we are free to change the details of these classes without breaking applications.
//
// - These classes are deserialized by Gson's reflective behavior, so there must be an empty constructor and
// the fields cannot be final. There is also a constructor that takes all the fields; tests and any other code
// that creates these objects programmatically should use that one.
//
// - For properties that have a collection type such as List, a null is always changed to an empty collection
// in the getter. Semantically there is no difference in the data model between an empty list and a missing one.
//
// - Some classes have a "preprocessed" field containing types defined in DataModelPreprocessing. These fields
// must always be marked transient. They are populated by the afterDeserialized() methods, or by the
// DataModelPreprocessing methods when an object is constructed directly.

/**
 * Contains the internal data model for the datafile: experiments, mutual exclusion groups, audiences,
 * feature flags and rollouts.
 */
abstract class DataModel {
  private DataModel() {}

  /**
   * The top-level datafile object.
   */
  static final class ProjectData {
    private String version;
    private String projectId;
    private String accountId;
    private String revision;
    private List<Experiment> experiments;
    private List<Group> groups;
    private List<Audience> audiences;
    private List<Audience> typedAudiences;
    private List<FeatureFlag> featureFlags;
    private List<Rollout> rollouts;

    ProjectData() {}

    ProjectData(String version, String projectId, String accountId, String revision,
        List<Experiment> experiments, List<Group> groups, List<Audience> audiences, List<Audience> typedAudiences,
        List<FeatureFlag> featureFlags, List<Rollout> rollouts) {
      this.version = version;
      this.projectId = projectId;
      this.accountId = accountId;
      this.revision = revision;
      this.experiments = experiments;
      this.groups = groups;
      this.audiences = audiences;
      this.typedAudiences = typedAudiences;
      this.featureFlags = featureFlags;
      this.rollouts = rollouts;
    }

    String getVersion() {
      return version;
    }

    String getProjectId() {
      return projectId;
    }

    String getAccountId() {
      return accountId;
    }

    String getRevision() {
      return revision;
    }

    // Guaranteed non-null
    List<Experiment> getExperiments() {
      return experiments == null ? emptyList() : experiments;
    }

    // Guaranteed non-null
    List<Group> getGroups() {
      return groups == null ? emptyList() : groups;
    }

    // Guaranteed non-null
    List<Audience> getAudiences() {
      return audiences == null ? emptyList() : audiences;
    }

    // Guaranteed non-null
    List<Audience> getTypedAudiences() {
      return typedAudiences == null ? emptyList() : typedAudiences;
    }

    // Guaranteed non-null
    List<FeatureFlag> getFeatureFlags() {
      return featureFlags == null ? emptyList() : featureFlags;
    }

    // Guaranteed non-null
    List<Rollout> getRollouts() {
      return rollouts == null ? emptyList() : rollouts;
    }
  }

  /**
   * An A/B experiment, or one targeting rule of a rollout (rollout rules have the same shape).
   */
  @JsonAdapter(JsonHelpers.PostProcessingDeserializableTypeAdapterFactory.class)
  static final class Experiment implements JsonHelpers.PostProcessingDeserializable {
    static final String STATUS_RUNNING = "Running";

    private String id;
    private String key;
    private String status;
    private String layerId;
    private List<String> audienceIds;
    private JsonElement audienceConditions; // optional; takes precedence over audienceIds
    private List<Variation> variations;
    private List<TrafficAllocation> trafficAllocation;
    private Map<String, String> forcedVariations; // user ID -> variation key

    transient ExperimentPreprocessed preprocessed;

    // We need this so Gson doesn't complain in certain java environments that restrict unsafe allocation
    Experiment() {}

    Experiment(String id, String key, String status, String layerId, List<String> audienceIds,
        JsonElement audienceConditions, List<Variation> variations, List<TrafficAllocation> trafficAllocation,
        Map<String, String> forcedVariations) {
      this.id = id;
      this.key = key;
      this.status = status;
      this.layerId = layerId;
      this.audienceIds = audienceIds;
      this.audienceConditions = audienceConditions;
      this.variations = variations;
      this.trafficAllocation = trafficAllocation;
      this.forcedVariations = forcedVariations;
    }

    String getId() {
      return id;
    }

    String getKey() {
      return key;
    }

    String getStatus() {
      return status;
    }

    boolean isRunning() {
      return STATUS_RUNNING.equals(status);
    }

    String getLayerId() {
      return layerId;
    }

    // Guaranteed non-null
    List<String> getAudienceIds() {
      return audienceIds == null ? emptyList() : audienceIds;
    }

    JsonElement getAudienceConditions() {
      return audienceConditions;
    }

    // Guaranteed non-null
    List<Variation> getVariations() {
      return variations == null ? emptyList() : variations;
    }

    // Guaranteed non-null
    List<TrafficAllocation> getTrafficAllocation() {
      return trafficAllocation == null ? emptyList() : trafficAllocation;
    }

    // Guaranteed non-null
    Map<String, String> getForcedVariations() {
      return forcedVariations == null ? emptyMap() : forcedVariations;
    }

    /**
     * The id of the mutual exclusion group containing this experiment, or null. This is not a datafile
     * property; it is assigned when the experiment is read from a group's experiment list.
     */
    String getGroupId() {
      return preprocessed == null ? null : preprocessed.groupId;
    }

    public void afterDeserialized() {
      DataModelPreprocessing.preprocessExperiment(this, null);
    }
  }

  @JsonAdapter(JsonHelpers.PostProcessingDeserializableTypeAdapterFactory.class)
  static final class Variation implements JsonHelpers.PostProcessingDeserializable {
    private String id;
    private String key;
    private Boolean featureEnabled;
    private List<VariableUsage> variables;

    transient VariationPreprocessed preprocessed;

    Variation() {}

    Variation(String id, String key, Boolean featureEnabled, List<VariableUsage> variables) {
      this.id = id;
      this.key = key;
      this.featureEnabled = featureEnabled;
      this.variables = variables;
    }

    String getId() {
      return id;
    }

    String getKey() {
      return key;
    }

    boolean isFeatureEnabled() {
      return featureEnabled != null && featureEnabled.booleanValue();
    }

    // Guaranteed non-null
    List<VariableUsage> getVariables() {
      return variables == null ? emptyList() : variables;
    }

    public void afterDeserialized() {
      DataModelPreprocessing.preprocessVariation(this);
    }
  }

  /**
   * A variation's override value for one feature variable.
   */
  static final class VariableUsage {
    private String id;
    private String value;

    VariableUsage() {}

    VariableUsage(String id, String value) {
      this.id = id;
      this.value = value;
    }

    String getId() {
      return id;
    }

    String getValue() {
      return value;
    }
  }

  /**
   * One entry of a traffic allocation table. Ranges are half-open and cumulative: an entry covers bucket
   * values from the previous entry's end (or zero) up to but not including its own end.
   * A table is sorted ascending by endOfRange and never exceeds 10000.
   */
  static final class TrafficAllocation {
    private String entityId;
    private int endOfRange;

    TrafficAllocation() {}

    TrafficAllocation(String entityId, int endOfRange) {
      this.entityId = entityId;
      this.endOfRange = endOfRange;
    }

    /**
     * A variation id, or an experiment id for a group's table. An empty string marks a deliberately
     * unallocated range.
     */
    String getEntityId() {
      return entityId;
    }

    int getEndOfRange() {
      return endOfRange;
    }
  }

  enum GroupPolicy {
    @SerializedName("random") RANDOM,
    @SerializedName("overlapping") OVERLAPPING
  }

  @JsonAdapter(JsonHelpers.PostProcessingDeserializableTypeAdapterFactory.class)
  static final class Group implements JsonHelpers.PostProcessingDeserializable {
    private String id;
    private GroupPolicy policy;
    private List<Experiment> experiments;
    private List<TrafficAllocation> trafficAllocation;

    Group() {}

    Group(String id, GroupPolicy policy, List<Experiment> experiments, List<TrafficAllocation> trafficAllocation) {
      this.id = id;
      this.policy = policy;
      this.experiments = experiments;
      this.trafficAllocation = trafficAllocation;
    }

    String getId() {
      return id;
    }

    GroupPolicy getPolicy() {
      return policy;
    }

    // Guaranteed non-null
    List<Experiment> getExperiments() {
      return experiments == null ? emptyList() : experiments;
    }

    // Guaranteed non-null
    List<TrafficAllocation> getTrafficAllocation() {
      return trafficAllocation == null ? emptyList() : trafficAllocation;
    }

    public void afterDeserialized() {
      DataModelPreprocessing.preprocessGroup(this);
    }
  }

  @JsonAdapter(JsonHelpers.PostProcessingDeserializableTypeAdapterFactory.class)
  static final class Audience implements JsonHelpers.PostProcessingDeserializable {
    private String id;
    private String name;
    private JsonElement conditions; // either a condition array, or (in legacy datafiles) a string containing one

    transient AudiencePreprocessed preprocessed;

    Audience() {}

    Audience(String id, String name, JsonElement conditions) {
      this.id = id;
      this.name = name;
      this.conditions = conditions;
    }

    String getId() {
      return id;
    }

    String getName() {
      return name;
    }

    JsonElement getConditions() {
      return conditions;
    }

    public void afterDeserialized() {
      DataModelPreprocessing.preprocessAudience(this);
    }
  }

  static final class FeatureFlag {
    private String id;
    private String key;
    private List<String> experimentIds;
    private String rolloutId;
    private List<FeatureVariable> variables;

    FeatureFlag() {}

    FeatureFlag(String id, String key, List<String> experimentIds, String rolloutId, List<FeatureVariable> variables) {
      this.id = id;
      this.key = key;
      this.experimentIds = experimentIds;
      this.rolloutId = rolloutId;
      this.variables = variables;
    }

    String getId() {
      return id;
    }

    String getKey() {
      return key;
    }

    // Guaranteed non-null
    List<String> getExperimentIds() {
      return experimentIds == null ? emptyList() : experimentIds;
    }

    /**
     * The rollout id, or null; the datafile uses an empty string for "no rollout".
     */
    String getRolloutId() {
      return rolloutId == null || rolloutId.isEmpty() ? null : rolloutId;
    }

    // Guaranteed non-null
    List<FeatureVariable> getVariables() {
      return variables == null ? emptyList() : variables;
    }
  }

  static final class FeatureVariable {
    private String id;
    private String key;
    private String type;
    private String defaultValue;

    FeatureVariable() {}

    FeatureVariable(String id, String key, String type, String defaultValue) {
      this.id = id;
      this.key = key;
      this.type = type;
      this.defaultValue = defaultValue;
    }

    String getId() {
      return id;
    }

    String getKey() {
      return key;
    }

    /**
     * The declared type, or null if the datafile used a type name this SDK does not know.
     */
    FeatureVariableType getType() {
      return FeatureVariableType.forName(type);
    }

    String getDefaultValue() {
      return defaultValue;
    }
  }

  /**
   * An ordered list of targeting rules for a feature. The last rule conventionally targets everyone.
   */
  static final class Rollout {
    private String id;
    private List<Experiment> experiments;

    Rollout() {}

    Rollout(String id, List<Experiment> experiments) {
      this.id = id;
      this.experiments = experiments;
    }

    String getId() {
      return id;
    }

    // Guaranteed non-null
    List<Experiment> getRules() {
      return experiments == null ? emptyList() : experiments;
    }
  }
}
