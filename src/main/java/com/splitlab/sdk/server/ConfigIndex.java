package com.splitlab.sdk.server;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.splitlab.sdk.server.DataModel.Audience;
import com.splitlab.sdk.server.DataModel.Experiment;
import com.splitlab.sdk.server.DataModel.FeatureFlag;
import com.splitlab.sdk.server.DataModel.FeatureVariable;
import com.splitlab.sdk.server.DataModel.Group;
import com.splitlab.sdk.server.DataModel.ProjectData;
import com.splitlab.sdk.server.DataModel.Rollout;
import com.splitlab.sdk.server.DataModel.Variation;
import com.splitlab.sdk.server.subsystems.DatafileException;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An immutable, indexed snapshot of one datafile.
 * <p>
 * All parsing happens once, when the snapshot is created: condition trees and traffic allocation tables
 * are turned into typed structures, and every entity is indexed by key and/or id. Lookups never fail;
 * a reference that cannot be resolved returns null, and it is up to the caller to treat that as "no
 * decision". A new datafile produces a new snapshot; an existing snapshot is never modified, so it can be
 * shared by any number of threads without locking.
 */
public final class ConfigIndex {
  /**
   * The datafile versions that this SDK understands.
   */
  public static final Set<String> SUPPORTED_VERSIONS = ImmutableSet.of("2", "3", "4");

  private final String version;
  private final String projectId;
  private final String accountId;
  private final String revision;
  private final ImmutableMap<String, Experiment> experimentsByKey;
  private final ImmutableMap<String, Experiment> experimentsById;
  private final ImmutableMap<String, Group> groupsById;
  private final ImmutableMap<String, Audience> audiencesById;
  private final ImmutableList<FeatureFlag> featureFlags;
  private final ImmutableMap<String, FeatureFlag> featureFlagsByKey;
  private final ImmutableMap<String, Rollout> rolloutsById;
  private final ImmutableMap<String, Map<String, String>> variableValuesByVariationId;

  /**
   * Parses a datafile and builds a snapshot from it.
   *
   * @param datafileJson the datafile JSON
   * @return a new snapshot
   * @throws DatafileException if the JSON could not be parsed, or the datafile version is not supported
   */
  public static ConfigIndex fromJson(String datafileJson) throws DatafileException {
    checkNotNull(datafileJson, "datafileJson must not be null");
    ProjectData data = JsonHelpers.deserialize(datafileJson, ProjectData.class);
    if (data == null) {
      throw new DatafileException("datafile was empty");
    }
    if (!SUPPORTED_VERSIONS.contains(data.getVersion())) {
      throw new DatafileException("unsupported datafile version \"" + data.getVersion() + "\"");
    }
    return new ConfigIndex(data);
  }

  ConfigIndex(ProjectData data) {
    this.version = data.getVersion();
    this.projectId = data.getProjectId();
    this.accountId = data.getAccountId();
    this.revision = data.getRevision();

    ImmutableMap.Builder<String, Experiment> expByKey = ImmutableMap.builder();
    ImmutableMap.Builder<String, Experiment> expById = ImmutableMap.builder();
    ImmutableMap.Builder<String, Map<String, String>> variableValues = ImmutableMap.builder();
    for (Experiment e: data.getExperiments()) {
      indexExperiment(e, expByKey, expById, variableValues);
    }
    ImmutableMap.Builder<String, Group> groups = ImmutableMap.builder();
    for (Group g: data.getGroups()) {
      if (g.getId() != null) {
        groups.put(g.getId(), g);
      }
      for (Experiment e: g.getExperiments()) {
        indexExperiment(e, expByKey, expById, variableValues);
      }
    }
    ImmutableMap.Builder<String, Rollout> rollouts = ImmutableMap.builder();
    for (Rollout r: data.getRollouts()) {
      if (r.getId() != null) {
        rollouts.put(r.getId(), r);
      }
      for (Experiment rule: r.getRules()) {
        // Rollout rules are not experiments that can be looked up by key, but their variations can
        // carry feature variable values.
        indexVariableValues(rule, variableValues);
      }
    }
    this.experimentsByKey = expByKey.buildKeepingLast();
    this.experimentsById = expById.buildKeepingLast();
    this.groupsById = groups.buildKeepingLast();
    this.rolloutsById = rollouts.buildKeepingLast();
    this.variableValuesByVariationId = variableValues.buildKeepingLast();

    // typedAudiences are listed last so that they replace any legacy audience with the same id
    ImmutableMap.Builder<String, Audience> audiences = ImmutableMap.builder();
    for (Audience a: data.getAudiences()) {
      if (a.getId() != null) {
        audiences.put(a.getId(), a);
      }
    }
    for (Audience a: data.getTypedAudiences()) {
      if (a.getId() != null) {
        audiences.put(a.getId(), a);
      }
    }
    this.audiencesById = audiences.buildKeepingLast();

    ImmutableList.Builder<FeatureFlag> flags = ImmutableList.builder();
    ImmutableMap.Builder<String, FeatureFlag> flagsByKey = ImmutableMap.builder();
    for (FeatureFlag f: data.getFeatureFlags()) {
      if (f.getKey() != null) {
        flags.add(f);
        flagsByKey.put(f.getKey(), f);
      }
    }
    this.featureFlags = flags.build();
    this.featureFlagsByKey = flagsByKey.buildKeepingLast();
  }

  private static void indexExperiment(
      Experiment e,
      ImmutableMap.Builder<String, Experiment> byKey,
      ImmutableMap.Builder<String, Experiment> byId,
      ImmutableMap.Builder<String, Map<String, String>> variableValues
      ) {
    if (e.preprocessed == null) {
      DataModelPreprocessing.preprocessExperiment(e, null);
    }
    if (e.getKey() != null) {
      byKey.put(e.getKey(), e);
    }
    if (e.getId() != null) {
      byId.put(e.getId(), e);
    }
    indexVariableValues(e, variableValues);
  }

  private static void indexVariableValues(Experiment e, ImmutableMap.Builder<String, Map<String, String>> variableValues) {
    if (e.preprocessed == null) {
      DataModelPreprocessing.preprocessExperiment(e, null);
    }
    for (Variation v: e.getVariations()) {
      if (v.getId() != null) {
        variableValues.put(v.getId(), v.preprocessed.variableValuesById);
      }
    }
  }

  /**
   * Returns the datafile version.
   *
   * @return the version string
   */
  public String getVersion() {
    return version;
  }

  /**
   * Returns the project id from the datafile.
   *
   * @return the project id, or null
   */
  public String getProjectId() {
    return projectId;
  }

  /**
   * Returns the account id from the datafile.
   *
   * @return the account id, or null
   */
  public String getAccountId() {
    return accountId;
  }

  /**
   * Returns the datafile revision.
   *
   * @return the revision, or null
   */
  public String getRevision() {
    return revision;
  }

  @Nullable
  Experiment getExperimentForKey(String key) {
    return key == null ? null : experimentsByKey.get(key);
  }

  @Nullable
  Experiment getExperimentForId(String id) {
    return id == null ? null : experimentsById.get(id);
  }

  @Nullable
  Group getGroup(String id) {
    return id == null ? null : groupsById.get(id);
  }

  @Nullable
  Audience getAudience(String id) {
    return id == null ? null : audiencesById.get(id);
  }

  @Nullable
  FeatureFlag getFeatureFlag(String key) {
    return key == null ? null : featureFlagsByKey.get(key);
  }

  // Guaranteed non-null; in datafile order
  List<FeatureFlag> getFeatureFlags() {
    return featureFlags;
  }

  @Nullable
  Rollout getRollout(String id) {
    return id == null ? null : rolloutsById.get(id);
  }

  @Nullable
  Variation getVariationForId(Experiment experiment, String variationId) {
    if (experiment == null || variationId == null) {
      return null;
    }
    return experiment.preprocessed.variationsById.get(variationId);
  }

  @Nullable
  Variation getVariationForKey(Experiment experiment, String variationKey) {
    if (experiment == null || variationKey == null) {
      return null;
    }
    return experiment.preprocessed.variationsByKey.get(variationKey);
  }

  /**
   * Returns the feature variable values that a variation overrides, keyed by variable id.
   */
  // Guaranteed non-null
  Map<String, String> getVariableValues(String variationId) {
    Map<String, String> values = variationId == null ? null : variableValuesByVariationId.get(variationId);
    return values == null ? ImmutableMap.<String, String>of() : values;
  }

  @Nullable
  FeatureVariable getFeatureVariable(FeatureFlag flag, String variableKey) {
    if (flag == null || variableKey == null) {
      return null;
    }
    for (FeatureVariable v: flag.getVariables()) {
      if (variableKey.equals(v.getKey())) {
        return v;
      }
    }
    return null;
  }
}
