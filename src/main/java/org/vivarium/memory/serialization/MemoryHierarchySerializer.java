package org.vivarium.memory.serialization;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.ToNumberPolicy;
import com.google.gson.reflect.TypeToken;
import org.vivarium.memory.procedural.ActionStep;
import org.vivarium.memory.procedural.DecisionPattern;
import org.vivarium.memory.procedural.ProceduralPattern;
import org.vivarium.memory.procedural.ProceduralStore;
import org.vivarium.memory.semantic.SemanticAssociation;
import org.vivarium.memory.semantic.SemanticConcept;
import org.vivarium.memory.semantic.SemanticStore;

/**
 * Converts the semantic and procedural stores to and from a JSON tree:
 * <pre>
 * {
 *   "semantic_store":   { "concepts": { id: {...} }, "associations": [ {...} ] },
 *   "procedural_store": { "patterns": { id: {...} }, "decision_patterns": { id: {...} } }
 * }
 * </pre>
 * Entities keep their store order, so serializing an unchanged store twice yields identical
 * output. Integral numbers in condition and property maps come back as {@link Long}, all other
 * numbers as {@link Double}.
 */
public final class MemoryHierarchySerializer {

    private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() { }.getType();

    private final Gson gson = new GsonBuilder()
        .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
        .serializeNulls()
        .create();

    /**
     * @param semantic   The semantic store, or {@code null} to omit it.
     * @param procedural The procedural store, or {@code null} to omit it.
     * @return A fresh JSON tree.
     */
    public JsonObject serialize(SemanticStore semantic, ProceduralStore procedural) {
        JsonObject root = new JsonObject();
        if (semantic != null) {
            JsonObject concepts = new JsonObject();
            for (SemanticConcept concept : semantic.getConcepts()) {
                concepts.add(concept.getConceptId(), writeConcept(concept));
            }
            JsonArray associations = new JsonArray();
            for (SemanticAssociation association : semantic.getAssociations()) {
                associations.add(writeAssociation(association));
            }
            JsonObject store = new JsonObject();
            store.add("concepts", concepts);
            store.add("associations", associations);
            root.add("semantic_store", store);
        }
        if (procedural != null) {
            JsonObject patterns = new JsonObject();
            for (ProceduralPattern pattern : procedural.getPatterns()) {
                patterns.add(pattern.getPatternId(), writePattern(pattern));
            }
            JsonObject decisions = new JsonObject();
            for (DecisionPattern decision : procedural.getDecisionPatterns()) {
                decisions.add(decision.getPatternId(), writeDecision(decision));
            }
            JsonObject store = new JsonObject();
            store.add("patterns", patterns);
            store.add("decision_patterns", decisions);
            root.add("procedural_store", store);
        }
        return root;
    }

    /**
     * Replaces the content of the given stores with the serialized one. A store whose section is
     * missing is left untouched.
     *
     * @param root       A tree produced by {@link #serialize(SemanticStore, ProceduralStore)}.
     * @param semantic   Target semantic store, or {@code null}.
     * @param procedural Target procedural store, or {@code null}.
     * @throws IllegalArgumentException if the tree is malformed; the stores are then unchanged.
     */
    public void restore(JsonObject root, SemanticStore semantic, ProceduralStore procedural) {
        List<SemanticConcept> concepts = new ArrayList<>();
        List<SemanticAssociation> associations = new ArrayList<>();
        List<ProceduralPattern> patterns = new ArrayList<>();
        List<DecisionPattern> decisions = new ArrayList<>();
        boolean hasSemantic = root.has("semantic_store");
        boolean hasProcedural = root.has("procedural_store");
        try {
            if (hasSemantic) {
                JsonObject store = root.getAsJsonObject("semantic_store");
                for (Map.Entry<String, JsonElement> e : store.getAsJsonObject("concepts").entrySet()) {
                    concepts.add(readConcept(e.getValue().getAsJsonObject()));
                }
                for (JsonElement element : store.getAsJsonArray("associations")) {
                    associations.add(readAssociation(element.getAsJsonObject()));
                }
            }
            if (hasProcedural) {
                JsonObject store = root.getAsJsonObject("procedural_store");
                for (Map.Entry<String, JsonElement> e : store.getAsJsonObject("patterns").entrySet()) {
                    patterns.add(readPattern(e.getValue().getAsJsonObject()));
                }
                for (Map.Entry<String, JsonElement> e : store.getAsJsonObject("decision_patterns").entrySet()) {
                    decisions.add(readDecision(e.getValue().getAsJsonObject()));
                }
            }
        } catch (JsonParseException | IllegalStateException | ClassCastException | NullPointerException e) {
            throw new IllegalArgumentException("Malformed memory hierarchy: " + e.getMessage(), e);
        }
        if (hasSemantic && semantic != null) {
            semantic.restore(concepts, associations);
        }
        if (hasProcedural && procedural != null) {
            procedural.restore(patterns, decisions);
        }
    }

    public String toJson(JsonObject tree) {
        return gson.toJson(tree);
    }

    /**
     * @throws IllegalArgumentException if the text is not a JSON object.
     */
    public JsonObject parse(String json) {
        try {
            return JsonParser.parseString(json).getAsJsonObject();
        } catch (JsonParseException | IllegalStateException e) {
            throw new IllegalArgumentException("Not a JSON object: " + e.getMessage(), e);
        }
    }

    private JsonObject writeConcept(SemanticConcept concept) {
        JsonObject o = new JsonObject();
        o.addProperty("concept_id", concept.getConceptId());
        o.addProperty("name", concept.getName());
        o.addProperty("description", concept.getDescription());
        o.addProperty("confidence", concept.getConfidence());
        o.addProperty("activation_count", concept.getActivationCount());
        o.addProperty("last_activation", concept.getLastActivation());
        o.addProperty("created_at", concept.getCreatedAt());
        JsonArray related = new JsonArray();
        concept.getRelatedConcepts().forEach(related::add);
        o.add("related_concepts", related);
        o.add("properties", gson.toJsonTree(concept.getProperties()));
        return o;
    }

    private SemanticConcept readConcept(JsonObject o) {
        SemanticConcept concept = new SemanticConcept(
            o.get("concept_id").getAsString(),
            o.get("name").getAsString(),
            o.get("description").getAsString(),
            o.get("confidence").getAsDouble(),
            o.get("activation_count").getAsLong(),
            o.get("last_activation").getAsDouble(),
            o.get("created_at").getAsDouble());
        for (JsonElement related : o.getAsJsonArray("related_concepts")) {
            concept.addRelation(related.getAsString());
        }
        Map<String, Object> properties = gson.fromJson(o.get("properties"), MAP_TYPE);
        properties.forEach(concept::putProperty);
        return concept;
    }

    private static JsonObject writeAssociation(SemanticAssociation association) {
        JsonObject o = new JsonObject();
        o.addProperty("source_id", association.getSourceId());
        o.addProperty("target_id", association.getTargetId());
        o.addProperty("association_type", association.getAssociationType());
        o.addProperty("strength", association.getStrength());
        o.addProperty("evidence_count", association.getEvidenceCount());
        o.addProperty("last_updated", association.getLastUpdated());
        return o;
    }

    private static SemanticAssociation readAssociation(JsonObject o) {
        return new SemanticAssociation(
            o.get("source_id").getAsString(),
            o.get("target_id").getAsString(),
            o.get("association_type").getAsString(),
            o.get("strength").getAsDouble(),
            o.get("evidence_count").getAsLong(),
            o.get("last_updated").getAsDouble());
    }

    private JsonObject writePattern(ProceduralPattern pattern) {
        JsonObject o = new JsonObject();
        o.addProperty("pattern_id", pattern.getPatternId());
        o.addProperty("name", pattern.getName());
        o.addProperty("description", pattern.getDescription());
        JsonArray actions = new JsonArray();
        for (ActionStep step : pattern.getActionSequence()) {
            JsonObject a = new JsonObject();
            a.addProperty("action_type", step.actionType());
            a.add("parameters", gson.toJsonTree(step.parameters()));
            actions.add(a);
        }
        o.add("action_sequence", actions);
        o.add("trigger_conditions", gson.toJsonTree(pattern.getTriggerConditions()));
        o.addProperty("success_count", pattern.getSuccessCount());
        o.addProperty("failure_count", pattern.getFailureCount());
        o.addProperty("total_executions", pattern.getTotalExecutions());
        o.addProperty("average_execution_time", pattern.getAverageExecutionTime());
        o.addProperty("automation_level", pattern.getAutomationLevel());
        o.addProperty("min_automation_threshold", pattern.getMinAutomationThreshold());
        o.addProperty("created_at", pattern.getCreatedAt());
        o.addProperty("last_execution", pattern.getLastExecution());
        o.addProperty("last_success", pattern.getLastSuccess());
        o.addProperty("recent_window", pattern.getRecentWindow());
        JsonArray outcomes = new JsonArray();
        pattern.getRecentOutcomes().forEach(outcomes::add);
        o.add("recent_outcomes", outcomes);
        return o;
    }

    private ProceduralPattern readPattern(JsonObject o) {
        List<ActionStep> actions = new ArrayList<>();
        for (JsonElement element : o.getAsJsonArray("action_sequence")) {
            JsonObject a = element.getAsJsonObject();
            Map<String, Object> parameters = gson.fromJson(a.get("parameters"), MAP_TYPE);
            actions.add(new ActionStep(a.get("action_type").getAsString(), parameters));
        }
        List<Boolean> outcomes = new ArrayList<>();
        for (JsonElement element : o.getAsJsonArray("recent_outcomes")) {
            outcomes.add(element.getAsBoolean());
        }
        Map<String, Object> conditions = gson.fromJson(o.get("trigger_conditions"), MAP_TYPE);
        return ProceduralPattern.builder(o.get("pattern_id").getAsString())
            .name(o.get("name").getAsString())
            .description(o.get("description").getAsString())
            .actionSequence(actions)
            .triggerConditions(conditions)
            .successCount(o.get("success_count").getAsLong())
            .failureCount(o.get("failure_count").getAsLong())
            .totalExecutions(o.get("total_executions").getAsLong())
            .averageExecutionTime(o.get("average_execution_time").getAsDouble())
            .automationLevel(o.get("automation_level").getAsDouble())
            .minAutomationThreshold(o.get("min_automation_threshold").getAsDouble())
            .createdAt(o.get("created_at").getAsDouble())
            .lastExecution(o.get("last_execution").getAsDouble())
            .lastSuccess(o.get("last_success").getAsDouble())
            .recentWindow(o.get("recent_window").getAsInt())
            .recentOutcomes(outcomes)
            .build();
    }

    private JsonObject writeDecision(DecisionPattern decision) {
        JsonObject o = new JsonObject();
        o.addProperty("pattern_id", decision.getPatternId());
        o.add("conditions", gson.toJsonTree(decision.getConditions()));
        o.addProperty("decision", decision.getDecision());
        o.addProperty("outcome", decision.getOutcome());
        o.addProperty("confidence", decision.getConfidence());
        o.addProperty("usage_count", decision.getUsageCount());
        return o;
    }

    private DecisionPattern readDecision(JsonObject o) {
        Map<String, Object> conditions = gson.fromJson(o.get("conditions"), MAP_TYPE);
        return new DecisionPattern(
            o.get("pattern_id").getAsString(),
            conditions,
            o.get("decision").getAsString(),
            o.get("outcome").getAsString(),
            o.get("confidence").getAsDouble(),
            o.get("usage_count").getAsLong());
    }
}
