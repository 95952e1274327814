package org.vivarium.datapipeline.resources.storage;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.vivarium.runtime.model.BehaviourParameters;
import org.vivarium.runtime.model.LifeSnapshot;
import org.vivarium.runtime.model.MemoryEntry;
import org.vivarium.runtime.model.PendingAction;
import org.vivarium.runtime.model.ResponsePattern;
import org.vivarium.runtime.model.StateVector;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.ToNumberPolicy;
import com.google.gson.reflect.TypeToken;

/**
 * JSON form of a {@link LifeSnapshot}. Keys use snake case; the serialized memory hierarchy is
 * embedded unchanged under {@code hierarchy}.
 */
public final class LifeSnapshotCodec {

    private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() { }.getType();

    private final Gson gson;

    public LifeSnapshotCodec(boolean prettyPrinting) {
        GsonBuilder builder = new GsonBuilder().setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE);
        if (prettyPrinting) {
            builder.setPrettyPrinting();
        }
        this.gson = builder.create();
    }

    public String encode(LifeSnapshot snapshot) {
        return gson.toJson(toJson(snapshot));
    }

    /**
     * @throws IllegalArgumentException if the text is not a valid snapshot.
     */
    public LifeSnapshot decode(String json) {
        try {
            return fromJson(JsonParser.parseString(json).getAsJsonObject());
        } catch (JsonParseException | IllegalStateException | ClassCastException | NullPointerException e) {
            throw new IllegalArgumentException("Malformed snapshot: " + e.getMessage(), e);
        }
    }

    public JsonObject toJson(LifeSnapshot snapshot) {
        JsonObject o = new JsonObject();
        o.addProperty("tick", snapshot.tick());
        o.addProperty("captured_at", snapshot.capturedAt());
        o.add("vital", vector(snapshot.vital()));
        o.addProperty("age", snapshot.age());
        o.addProperty("subjective_time", snapshot.subjectiveTime());
        o.addProperty("last_event_intensity", snapshot.lastEventIntensity());

        JsonArray memory = new JsonArray();
        for (MemoryEntry entry : snapshot.memory()) {
            JsonObject e = new JsonObject();
            e.addProperty("event_type", entry.eventType());
            e.addProperty("meaning_significance", entry.meaningSignificance());
            e.addProperty("timestamp", entry.timestamp());
            e.addProperty("weight", entry.weight());
            e.addProperty("subjective_timestamp", entry.subjectiveTimestamp());
            if (!entry.feedbackData().isEmpty()) {
                e.add("feedback_data", gson.toJsonTree(entry.feedbackData()));
            }
            memory.add(e);
        }
        o.add("memory", memory);

        JsonArray pending = new JsonArray();
        for (PendingAction action : snapshot.pendingActions()) {
            JsonObject a = new JsonObject();
            a.addProperty("action_id", action.getActionId());
            a.addProperty("action_pattern", action.getActionPattern().id());
            a.add("state_before", vector(action.getStateBefore()));
            a.addProperty("timestamp", action.getTimestamp());
            a.addProperty("check_after_ticks", action.getCheckAfterTicks());
            a.add("associated_events", gson.toJsonTree(action.getAssociatedEvents()));
            a.addProperty("ticks_waited", action.getTicksWaited());
            pending.add(a);
        }
        o.add("pending_actions", pending);
        o.add("adaptation_history", gson.toJsonTree(snapshot.adaptationHistory()));
        o.add("learning_params", gson.toJsonTree(snapshot.learningParams().toMap()));
        o.add("adaptation_params", gson.toJsonTree(snapshot.adaptationParams().toMap()));
        if (snapshot.hierarchy() != null) {
            o.add("hierarchy", snapshot.hierarchy().deepCopy());
        }
        return o;
    }

    public LifeSnapshot fromJson(JsonObject o) {
        List<MemoryEntry> memory = new ArrayList<>();
        for (JsonElement element : o.getAsJsonArray("memory")) {
            JsonObject e = element.getAsJsonObject();
            Map<String, Object> feedback = e.has("feedback_data") ? gson.fromJson(e.get("feedback_data"), MAP_TYPE) : Map.of();
            memory.add(new MemoryEntry(
                e.get("event_type").getAsString(),
                e.get("meaning_significance").getAsDouble(),
                e.get("timestamp").getAsDouble(),
                e.get("weight").getAsDouble(),
                e.get("subjective_timestamp").getAsDouble(),
                feedback));
        }

        List<PendingAction> pending = new ArrayList<>();
        for (JsonElement element : o.getAsJsonArray("pending_actions")) {
            JsonObject a = element.getAsJsonObject();
            String patternId = a.get("action_pattern").getAsString();
            ResponsePattern pattern = ResponsePattern.fromId(patternId)
                .orElseThrow(() -> new JsonParseException("Unknown action pattern: " + patternId));
            List<String> associated = new ArrayList<>();
            for (JsonElement type : a.getAsJsonArray("associated_events")) {
                associated.add(type.getAsString());
            }
            pending.add(new PendingAction(
                a.get("action_id").getAsString(),
                pattern,
                readVector(a.getAsJsonObject("state_before")),
                a.get("timestamp").getAsDouble(),
                a.get("check_after_ticks").getAsInt(),
                associated,
                a.get("ticks_waited").getAsInt()));
        }

        List<Map<String, Object>> history = new ArrayList<>();
        for (JsonElement element : o.getAsJsonArray("adaptation_history")) {
            history.add(gson.fromJson(element, MAP_TYPE));
        }

        return new LifeSnapshot(
            o.get("tick").getAsLong(),
            o.get("captured_at").getAsDouble(),
            readVector(o.getAsJsonObject("vital")),
            o.get("age").getAsDouble(),
            o.get("subjective_time").getAsDouble(),
            o.get("last_event_intensity").getAsDouble(),
            memory,
            pending,
            history,
            o.has("hierarchy") ? o.getAsJsonObject("hierarchy") : null,
            readParams(o, "learning_params"),
            readParams(o, "adaptation_params"));
    }

    // Older snapshots carry no parameters
    private BehaviourParameters readParams(JsonObject o, String key) {
        if (!o.has(key)) {
            return BehaviourParameters.defaults();
        }
        return BehaviourParameters.fromMap(gson.fromJson(o.get(key), MAP_TYPE));
    }

    private static JsonObject vector(StateVector v) {
        JsonObject o = new JsonObject();
        o.addProperty(StateVector.ENERGY, v.energy());
        o.addProperty(StateVector.STABILITY, v.stability());
        o.addProperty(StateVector.INTEGRITY, v.integrity());
        return o;
    }

    private static StateVector readVector(JsonObject o) {
        return new StateVector(
            o.get(StateVector.ENERGY).getAsDouble(),
            o.get(StateVector.STABILITY).getAsDouble(),
            o.get(StateVector.INTEGRITY).getAsDouble());
    }

    public String toPrettyJson(JsonElement element) {
        return gson.toJson(element);
    }
}
