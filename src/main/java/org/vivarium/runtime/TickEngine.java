package org.vivarium.runtime;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.vivarium.memory.ConsolidationResult;
import org.vivarium.memory.MemoryHierarchyManager;
import org.vivarium.memory.procedural.ActionStep;
import org.vivarium.memory.procedural.PatternExecution;
import org.vivarium.memory.procedural.ProceduralStore;
import org.vivarium.runtime.feedback.FeedbackTracker;
import org.vivarium.runtime.learning.AdaptationManager;
import org.vivarium.runtime.learning.LearningEngine;
import org.vivarium.runtime.model.BehaviourParameters;
import org.vivarium.runtime.model.Event;
import org.vivarium.runtime.model.FeedbackRecord;
import org.vivarium.runtime.model.Meaning;
import org.vivarium.runtime.model.MemoryEntry;
import org.vivarium.runtime.model.ResponsePattern;
import org.vivarium.runtime.model.SelfState;
import org.vivarium.runtime.model.StateVector;
import org.vivarium.runtime.spi.IMeaningEngine;
import org.vivarium.runtime.spi.IStructuredLogSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Advances one organism by discrete ticks.
 * <p>
 * A tick:
 * <ol>
 *   <li>advances the clocks;</li>
 *   <li>resolves due feedback, stores it as {@code feedback} memories and lets the procedural
 *       store learn from it;</li>
 *   <li>processes the given events in order: sensory buffering, interpretation, optional
 *       override by an automated pattern, scaled impact, feedback registration and an episodic
 *       memory;</li>
 *   <li>applies the weakness penalty;</li>
 *   <li>consolidates the memory hierarchy every {@code consolidationInterval} ticks;</li>
 *   <li>runs a learning step every {@code learningInterval} ticks and an adaptation step every
 *       {@code adaptationInterval} ticks.</li>
 * </ol>
 * Any exception escaping a tick costs integrity and is reported in the {@link TickReport}; the
 * engine stays usable.
 * <p>
 * Not thread-safe: one thread owns the engine and its {@link SelfState}.
 */
public class TickEngine {

    private static final Logger LOG = LoggerFactory.getLogger(TickEngine.class);

    private final SelfState state;
    private final IMeaningEngine meaningEngine;
    private final FeedbackTracker feedbackTracker;
    private final MemoryHierarchyManager memory;
    private final IStructuredLogSink structuredLog;
    private final TickEngineSettings settings;
    private final Clock clock;
    private final IntensityHistory intensityHistory;
    private final LearningEngine learningEngine = new LearningEngine();
    private final AdaptationManager adaptationManager;

    /**
     * @param state           The organism, owned by this engine from now on.
     * @param meaningEngine   Interprets events.
     * @param feedbackTracker Attributes delayed consequences.
     * @param memory          The memory hierarchy, or {@code null} to run without one.
     * @param structuredLog   Receives runtime records.
     * @param settings        Engine tunables.
     * @param clock           Wall-clock source for timestamps.
     */
    public TickEngine(SelfState state, IMeaningEngine meaningEngine, FeedbackTracker feedbackTracker,
                      MemoryHierarchyManager memory, IStructuredLogSink structuredLog,
                      TickEngineSettings settings, Clock clock) {
        this.state = Objects.requireNonNull(state, "state");
        this.meaningEngine = Objects.requireNonNull(meaningEngine, "meaningEngine");
        this.feedbackTracker = Objects.requireNonNull(feedbackTracker, "feedbackTracker");
        this.memory = memory;
        this.structuredLog = structuredLog == null ? IStructuredLogSink.NO_OP : structuredLog;
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.intensityHistory = new IntensityHistory(settings.intensityHistoryCapacity(), settings.intensitySmoothing());
        this.adaptationManager = new AdaptationManager(clock);
        if (memory != null) {
            memory.attachEpisodicMemory(state.getMemory());
        }
    }

    /**
     * Runs one tick.
     *
     * @param dt     Seconds elapsed since the previous tick.
     * @param events Events to process, in arrival order.
     * @return What happened. A failed tick carries its error instead of throwing.
     */
    public TickReport tick(double dt, List<Event> events) {
        try {
            return runTick(dt, events);
        } catch (RuntimeException e) {
            state.setIntegrity(state.getIntegrity() - settings.fatalIntegrityPenalty());
            LOG.error("Tick {} failed: {}", state.getTicks(), e.getMessage());
            LOG.debug("Tick failure details:", e);
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("tick", state.getTicks());
            fields.put("error", String.valueOf(e.getMessage()));
            fields.put("integrity", state.getIntegrity());
            emit("tick_error", fields);
            return new TickReport(state.getTicks(), 0, List.of(), 0, null,
                e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private TickReport runTick(double dt, List<Event> events) {
        state.advance(dt);
        long tick = state.getTicks();

        List<FeedbackRecord> feedback = feedbackTracker.observeConsequences(state);
        for (FeedbackRecord record : feedback) {
            absorbFeedback(record);
        }

        double peak = 0.0;
        int automated = 0;
        for (int i = 0; i < events.size(); i++) {
            Event event = events.get(i);
            peak = Math.max(peak, event.magnitude());
            if (processEvent(event, tick, i)) {
                automated++;
            }
        }
        intensityHistory.record(peak);
        state.setLastEventIntensity(intensityHistory.smoothed());

        StateVector penalty = settings.lifePolicy().penalty(state, dt);
        if (penalty.maxAbsComponent() > 0.0) {
            state.applyDelta(penalty);
            LOG.debug("Weakness penalty at tick {}: {}", tick, penalty);
        }

        ConsolidationResult consolidation = null;
        if (memory != null && tick % settings.consolidationInterval() == 0) {
            consolidation = memory.consolidateMemory(state);
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("tick", tick);
            fields.put("sensory_to_episodic", consolidation.sensoryToEpisodicTransfers());
            fields.put("episodic_to_semantic", consolidation.episodicToSemanticTransfers());
            fields.put("semantic_consolidations", consolidation.semanticConsolidations());
            fields.put("procedural_optimizations", consolidation.proceduralOptimizations());
            fields.put("success", consolidation.success());
            emit("consolidation", fields);
        }
        if (due(tick, settings.learningInterval())) {
            BehaviourParameters learned = learningEngine.learn(state);
            Map<String, Object> fields = new LinkedHashMap<>(learned.toMap());
            fields.put("tick", tick);
            emit("learning", fields);
        }
        if (due(tick, settings.adaptationInterval())) {
            Map<String, Object> changes = adaptationManager.adapt(state);
            if (!changes.isEmpty()) {
                Map<String, Object> fields = new LinkedHashMap<>();
                fields.put("tick", tick);
                fields.put("changes", changes);
                emit("adaptation", fields);
            }
        }
        return new TickReport(tick, events.size(), feedback, automated, consolidation, null);
    }

    private void absorbFeedback(FeedbackRecord record) {
        state.getMemory().append(new MemoryEntry(MemoryEntry.FEEDBACK_TYPE, 0.0, record.timestamp(), 1.0,
            state.getSubjectiveTime(), record.toFeedbackData()));

        Map<String, Object> fields = new LinkedHashMap<>(record.toFeedbackData());
        fields.put("tick", state.getTicks());
        emit("feedback", fields);

        ProceduralStore procedural = proceduralStore();
        if (procedural != null) {
            double net = record.netOutcome();
            procedural.learnFromExperience(
                BehaviourContext.of(record.triggerEventType(), record.stateBefore()),
                List.of(new ActionStep(record.actionPattern().id())),
                String.format(Locale.ROOT, "net %+.4f after %d ticks", net, record.delayTicks()),
                net >= 0.0);
        }
    }

    /**
     * @return {@code true} if a learned pattern chose the response.
     */
    private boolean processEvent(Event event, long tick, int index) {
        if (memory != null) {
            memory.addSensoryEvent(event);
        }
        state.rememberRecent(event);

        Meaning meaning = meaningEngine.interpret(event, state);
        ResponsePattern pattern = meaning.pattern();
        boolean automated = false;

        ProceduralStore procedural = proceduralStore();
        if (procedural != null) {
            Optional<PatternExecution> execution =
                procedural.executeBestPattern(BehaviourContext.of(event.type(), state.vector()));
            if (execution.isPresent()) {
                Optional<ResponsePattern> learned = ResponsePattern.fromId(execution.get().firstActionType());
                if (learned.isPresent()) {
                    pattern = learned.get();
                    automated = true;
                    Map<String, Object> adaptation = new LinkedHashMap<>();
                    adaptation.put("tick", tick);
                    adaptation.put("event_type", event.type());
                    adaptation.put("pattern_id", execution.get().patternId());
                    adaptation.put("response", pattern.id());
                    adaptation.put("replaced", meaning.pattern().id());
                    state.recordAdaptation(adaptation);
                }
            }
        }
        state.recordResponse(pattern, meaning.significance());

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("tick", tick);
        fields.put("event_type", event.type());
        fields.put("intensity", event.intensity());
        fields.put("significance", meaning.significance());
        fields.put("pattern", pattern.id());
        fields.put("automated", automated);
        emit("event", fields);

        if (pattern == ResponsePattern.IGNORE) {
            return automated;
        }

        StateVector before = state.vector();
        double scale = Math.max(0.0, pattern.impactScale() + state.getAdaptationParams().coefficientDrift(pattern.id()));
        StateVector impact = meaning.impact();
        state.applyDelta(new StateVector(impact.energy() * scale, impact.stability() * scale, impact.integrity() * scale));

        double now = clock.millis() / 1000.0;
        String actionId = "action_" + tick + "_" + pattern.id() + "_" + clock.millis() + "_" + index;
        feedbackTracker.registerAction(actionId, pattern, before, now, List.of(event.type()));
        state.getMemory().append(new MemoryEntry(event.type(), meaning.significance(), now, state.getSubjectiveTime()));
        return automated;
    }

    private static boolean due(long tick, int interval) {
        return interval > 0 && tick % interval == 0;
    }

    private ProceduralStore proceduralStore() {
        if (memory == null || !settings.proceduralIntegration()) {
            return null;
        }
        return memory.availableProceduralStore();
    }

    private void emit(String type, Map<String, Object> fields) {
        try {
            structuredLog.log(type, fields);
        } catch (RuntimeException e) {
            LOG.warn("Structured log sink rejected a '{}' record: {}", type, e.getMessage());
        }
    }

    public SelfState getState() {
        return state;
    }

    public FeedbackTracker getFeedbackTracker() {
        return feedbackTracker;
    }

    public MemoryHierarchyManager getMemory() {
        return memory;
    }

    public IntensityHistory getIntensityHistory() {
        return intensityHistory;
    }

    public TickEngineSettings getSettings() {
        return settings;
    }
}
