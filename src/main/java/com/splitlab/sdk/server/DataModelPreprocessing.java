package com.splitlab.sdk.server;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonElement;
import com.splitlab.sdk.server.ConditionTree.AudienceReference;
import com.splitlab.sdk.server.ConditionTree.Or;
import com.splitlab.sdk.server.DataModel.Audience;
import com.splitlab.sdk.server.DataModel.Experiment;
import com.splitlab.sdk.server.DataModel.Group;
import com.splitlab.sdk.server.DataModel.VariableUsage;
import com.splitlab.sdk.server.DataModel.Variation;

import java.util.List;
import java.util.Map;

/**
 * Additional information that we attach to our data model so that decisions never have to re-parse or
 * search anything. The methods that create these objects are called by the afterDeserialized() methods
 * of the model classes, after those objects have been deserialized from JSON but before they have been
 * made available to any other code (so these methods do not need to be thread-safe).
 * <p>
 * Code that constructs model objects directly (such as tests) must call the same methods, since decisions
 * rely on the preprocessed data.
 */
abstract class DataModelPreprocessing {
  private DataModelPreprocessing() {}

  static final class ExperimentPreprocessed {
    final String groupId;
    final ConditionTree audienceConditions; // null means the experiment targets everyone
    final Map<String, Variation> variationsById;
    final Map<String, Variation> variationsByKey;

    ExperimentPreprocessed(String groupId, ConditionTree audienceConditions,
        Map<String, Variation> variationsById, Map<String, Variation> variationsByKey) {
      this.groupId = groupId;
      this.audienceConditions = audienceConditions;
      this.variationsById = variationsById;
      this.variationsByKey = variationsByKey;
    }
  }

  static final class VariationPreprocessed {
    final Map<String, String> variableValuesById;

    VariationPreprocessed(Map<String, String> variableValuesById) {
      this.variableValuesById = variableValuesById;
    }
  }

  static final class AudiencePreprocessed {
    final ConditionTree conditions;

    AudiencePreprocessed(ConditionTree conditions) {
      this.conditions = conditions;
    }
  }

  static void preprocessExperiment(Experiment e, String groupId) {
    ImmutableMap.Builder<String, Variation> byId = ImmutableMap.builder();
    ImmutableMap.Builder<String, Variation> byKey = ImmutableMap.builder();
    for (Variation v: e.getVariations()) {
      if (v.preprocessed == null) {
        preprocessVariation(v);
      }
      if (v.getId() != null) {
        byId.put(v.getId(), v);
      }
      if (v.getKey() != null) {
        byKey.put(v.getKey(), v);
      }
    }
    e.preprocessed = new ExperimentPreprocessed(
        groupId,
        experimentAudienceConditions(e),
        byId.buildKeepingLast(),
        byKey.buildKeepingLast()
        );
  }

  static void preprocessGroup(Group g) {
    // Group membership isn't part of each experiment's JSON, so we redo the experiments' preprocessing
    // now that we know which group they are in.
    for (Experiment e: g.getExperiments()) {
      preprocessExperiment(e, g.getId());
    }
  }

  static void preprocessVariation(Variation v) {
    ImmutableMap.Builder<String, String> values = ImmutableMap.builder();
    for (VariableUsage u: v.getVariables()) {
      if (u.getId() != null && u.getValue() != null) {
        values.put(u.getId(), u.getValue());
      }
    }
    v.preprocessed = new VariationPreprocessed(values.buildKeepingLast());
  }

  static void preprocessAudience(Audience a) {
    a.preprocessed = new AudiencePreprocessed(DataModelSerialization.parseAudienceConditions(a.getConditions()));
  }

  // An experiment's audienceConditions, if present, take precedence over its list of audience ids; a list of
  // ids means "any of these audiences". An empty list or array of either kind means everyone.
  private static ConditionTree experimentAudienceConditions(Experiment e) {
    JsonElement conditions = e.getAudienceConditions();
    if (conditions != null && !conditions.isJsonNull()) {
      if (conditions.isJsonArray() && conditions.getAsJsonArray().size() == 0) {
        return null;
      }
      return DataModelSerialization.parseConditionTree(conditions, true);
    }
    List<String> audienceIds = e.getAudienceIds();
    if (audienceIds.isEmpty()) {
      return null;
    }
    ImmutableList.Builder<ConditionTree> refs = ImmutableList.builder();
    for (String id: audienceIds) {
      refs.add(new AudienceReference(id));
    }
    return new Or(refs.build());
  }
}
