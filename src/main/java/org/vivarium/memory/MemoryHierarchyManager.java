package org.vivarium.memory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.google.gson.JsonObject;
import org.vivarium.memory.episodic.EpisodicStore;
import org.vivarium.memory.procedural.ProceduralStore;
import org.vivarium.memory.semantic.SemanticStore;
import org.vivarium.memory.serialization.MemoryHierarchySerializer;
import org.vivarium.memory.sensory.PromotionBatch;
import org.vivarium.memory.sensory.SensoryBuffer;
import org.vivarium.runtime.model.EpisodicMemory;
import org.vivarium.runtime.model.Event;
import org.vivarium.runtime.model.MemoryEntry;
import org.vivarium.runtime.model.SelfState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrates the four memory levels.
 * <p>
 * <b>Slots:</b> every store slot may be empty, and a present store may report itself
 * unavailable. Consolidation skips such levels and queries against them fail softly.
 * <p>
 * <b>Consolidation</b> runs four stages in order:
 * <ol>
 *   <li>sensory to episodic: high-salience and habituated events are promoted;</li>
 *   <li>episodic to semantic: recurring event types in the recent window form or reinforce
 *       concepts, and consecutive types are related;</li>
 *   <li>semantic knowledge consolidation: stale associations weaken;</li>
 *   <li>procedural optimization.</li>
 * </ol>
 * A failing stage is recorded in {@link ConsolidationResult#details()} and the remaining stages
 * still run. Consolidations are serialized; a concurrent caller blocks until the running one
 * completes.
 * <p>
 * <b>Threading:</b> queries may run from any thread concurrently with consolidation; the stores
 * guard themselves.
 */
public class MemoryHierarchyManager {

    private static final Logger LOG = LoggerFactory.getLogger(MemoryHierarchyManager.class);

    public static final String STAGE_SENSORY_TO_EPISODIC = "sensory_to_episodic";
    public static final String STAGE_EPISODIC_TO_SEMANTIC = "episodic_to_semantic";
    public static final String STAGE_SEMANTIC_CONSOLIDATION = "semantic_consolidation";
    public static final String STAGE_PROCEDURAL_OPTIMIZATION = "procedural_optimization";

    private static final String STATUS_KEY = "status";

    @FunctionalInterface
    private interface Stage {
        int run();
    }

    private final MemoryHierarchySettings settings;
    private final Clock clock;
    private final SensoryBuffer sensoryBuffer;
    private final SemanticStore semanticStore;
    private final ProceduralStore proceduralStore;
    private volatile EpisodicStore episodicStore;

    private final MemoryHierarchySerializer serializer = new MemoryHierarchySerializer();
    private final ReentrantLock consolidationLock = new ReentrantLock();
    private final Cache<String, Map<String, Object>> statusCache;
    private volatile ConsolidationResult lastConsolidation;
    private volatile long consolidationCount;

    /**
     * @param settings        Hierarchy configuration.
     * @param sensoryBuffer   Sensory level, or {@code null} if absent.
     * @param semanticStore   Semantic level, or {@code null} if absent.
     * @param proceduralStore Procedural level, or {@code null} if absent.
     * @param clock           Time source for timestamps and the status cache.
     */
    public MemoryHierarchyManager(MemoryHierarchySettings settings, SensoryBuffer sensoryBuffer,
                                  SemanticStore semanticStore, ProceduralStore proceduralStore, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sensoryBuffer = sensoryBuffer;
        this.semanticStore = semanticStore;
        this.proceduralStore = proceduralStore;
        // Expiry follows the injected clock
        this.statusCache = Caffeine.newBuilder()
            .maximumSize(1)
            .expireAfterWrite(Duration.ofMillis(settings.statusCacheTtlMillis()))
            .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
            .build();
    }

    /**
     * Creates a manager with every store built from its settings.
     *
     * @param settings Hierarchy configuration.
     * @param clock    Time source shared by all stores.
     * @return The manager; call {@link #attachEpisodicMemory(EpisodicMemory)} before consolidating.
     */
    public static MemoryHierarchyManager create(MemoryHierarchySettings settings, Clock clock) {
        return new MemoryHierarchyManager(settings,
            new SensoryBuffer(settings.sensory(), clock),
            new SemanticStore(settings.semantic(), clock),
            new ProceduralStore(settings.procedural(), clock),
            clock);
    }

    /**
     * Exposes an organism's episodic memory as the episodic level.
     * @param memory The memory owned by the organism's {@link SelfState}.
     */
    public void attachEpisodicMemory(EpisodicMemory memory) {
        this.episodicStore = new EpisodicStore(memory, settings.episodicEnabled());
        statusCache.invalidateAll();
    }

    /**
     * Buffers a raw event if the sensory level is available.
     *
     * @param event The event.
     * @return {@code true} if the event was buffered.
     */
    public boolean addSensoryEvent(Event event) {
        if (!isAvailable(sensoryBuffer)) {
            return false;
        }
        sensoryBuffer.push(event);
        return true;
    }

    /**
     * Runs one consolidation pass over the hierarchy.
     *
     * @param state The organism whose episodic memory receives promotions and feeds the semantic level.
     * @return The per-stage outcome. Never throws for stage failures.
     */
    public ConsolidationResult consolidateMemory(SelfState state) {
        Objects.requireNonNull(state, "state");
        consolidationLock.lock();
        try {
            double startedAt = clock.millis() / 1000.0;
            long started = System.nanoTime();
            Map<String, String> details = new LinkedHashMap<>();
            List<String> failures = new ArrayList<>();
            int[] executed = new int[1];

            EpisodicMemory episodic = state.getMemory();
            int sensoryTransfers = runStage(STAGE_SENSORY_TO_EPISODIC, sensoryBuffer,
                () -> promoteSensory(episodic, state.getSubjectiveTime()), details, failures, executed);
            int semanticTransfers = runStage(STAGE_EPISODIC_TO_SEMANTIC, semanticStore,
                () -> promoteEpisodic(episodic), details, failures, executed);
            int semanticConsolidations = runStage(STAGE_SEMANTIC_CONSOLIDATION, semanticStore,
                semanticStore == null ? () -> 0 : semanticStore::consolidateKnowledge, details, failures, executed);
            int proceduralOptimizations = runStage(STAGE_PROCEDURAL_OPTIMIZATION, proceduralStore,
                proceduralStore == null ? () -> 0 : proceduralStore::optimizePatterns, details, failures, executed);

            boolean success = executed[0] == 0 || failures.size() < executed[0];
            String errorMessage = failures.isEmpty() ? null : String.join("; ", failures);
            ConsolidationResult result = new ConsolidationResult(sensoryTransfers, semanticTransfers,
                semanticConsolidations, proceduralOptimizations, startedAt,
                (System.nanoTime() - started) / 1_000_000_000.0, success, errorMessage, details);

            lastConsolidation = result;
            consolidationCount++;
            statusCache.invalidateAll();
            if (result.totalTransfers() > 0 || !failures.isEmpty()) {
                LOG.debug("Consolidation: {} sensory->episodic, {} episodic->semantic, {} semantic, {} procedural, failures={}",
                    sensoryTransfers, semanticTransfers, semanticConsolidations, proceduralOptimizations, failures.size());
            }
            return result;
        } finally {
            consolidationLock.unlock();
        }
    }

    private int runStage(String name, IMemoryStore store, Stage stage, Map<String, String> details,
                         List<String> failures, int[] executed) {
        if (store == null) {
            details.put(name, "skipped: store absent");
            return 0;
        }
        if (!store.isAvailable()) {
            details.put(name, "skipped: store unavailable");
            return 0;
        }
        executed[0]++;
        try {
            int count = stage.run();
            details.put(name, "ok: " + count);
            return count;
        } catch (RuntimeException e) {
            LOG.warn("Consolidation stage '{}' failed: {}", name, e.getMessage());
            LOG.debug("Consolidation stage failure details:", e);
            details.put(name, "failed: " + e.getMessage());
            failures.add(name + ": " + e.getMessage());
            return 0;
        }
    }

    private int promoteSensory(EpisodicMemory episodic, double subjectiveTime) {
        // Entries leave the buffer only after every append succeeded
        try (PromotionBatch batch = sensoryBuffer.drainPromotable()) {
            List<MemoryEntry> entries = new ArrayList<>(batch.size());
            for (Event event : batch) {
                entries.add(new MemoryEntry(event.type(), Math.min(1.0, event.magnitude()),
                    event.timestamp(), subjectiveTime));
            }
            for (MemoryEntry entry : entries) {
                episodic.append(entry);
            }
            batch.commit();
            return batch.size();
        }
    }

    private int promoteEpisodic(EpisodicMemory episodic) {
        int window = semanticStore.getSettings().recentWindow();
        List<MemoryEntry> recent = new ArrayList<>();
        for (MemoryEntry entry : episodic.recent(window)) {
            if (!entry.isFeedback()) {
                recent.add(entry);
            }
        }
        if (recent.isEmpty()) {
            return 0;
        }

        Map<String, Integer> counts = new LinkedHashMap<>();
        for (MemoryEntry entry : recent) {
            counts.merge(entry.eventType(), 1, Integer::sum);
        }
        Set<String> reinforced = new HashSet<>();
        for (Map.Entry<String, Integer> group : counts.entrySet()) {
            if (group.getValue() >= semanticStore.getSettings().occurrenceThreshold()) {
                semanticStore.reinforce(group.getKey(), group.getValue(), (double) group.getValue() / recent.size());
                reinforced.add(group.getKey());
            }
        }

        Set<String> related = new HashSet<>();
        for (int i = 1; i < recent.size(); i++) {
            String previous = recent.get(i - 1).eventType();
            String current = recent.get(i).eventType();
            if (!previous.equals(current) && reinforced.contains(previous) && reinforced.contains(current)
                && related.add(previous + "->" + current)) {
                semanticStore.relate(SemanticStore.conceptIdFor(previous), SemanticStore.conceptIdFor(current));
            }
        }
        return reinforced.size();
    }

    /**
     * Queries one level.
     *
     * @param level  Level name, one of {@code sensory}, {@code episodic}, {@code semantic} or {@code procedural}.
     * @param params Query parameters, or {@code null} for none.
     * @return The result; {@code success} is false if the level is absent, unavailable or failed.
     * @throws InvalidMemoryQueryException if the level is unknown or a parameter is malformed.
     */
    public MemoryQueryResult queryMemory(String level, MemoryQueryParams params) {
        MemoryLevel memoryLevel = MemoryLevel.parse(level);
        MemoryQueryParams effective = params == null ? MemoryQueryParams.empty() : params;
        effective.validate();

        long started = System.nanoTime();
        IMemoryStore store = storeFor(memoryLevel);
        if (store == null || !store.isAvailable()) {
            return MemoryQueryResult.failure(memoryLevel, effective, elapsedSince(started),
                memoryLevel.id() + " memory is not available");
        }
        try {
            List<?> matches = store.query(effective);
            Integer limit = effective.limit();
            if (limit == null && memoryLevel == MemoryLevel.SEMANTIC) {
                limit = settings.defaultSemanticLimit();
            }
            int from = Math.min(effective.offset(), matches.size());
            int to = limit == null ? matches.size() : (int) Math.min((long) from + limit, matches.size());
            return MemoryQueryResult.success(memoryLevel, matches.subList(from, to), matches.size(),
                effective, elapsedSince(started));
        } catch (RuntimeException e) {
            LOG.warn("Query on {} memory failed: {}", memoryLevel.id(), e.getMessage());
            LOG.debug("Query failure details:", e);
            return MemoryQueryResult.failure(memoryLevel, effective, elapsedSince(started), e.getMessage());
        }
    }

    /**
     * @return per-level availability and statistics plus consolidation bookkeeping. Cached for the
     *         configured time-to-live.
     */
    public Map<String, Object> getHierarchyStatus() {
        return statusCache.get(STATUS_KEY, key -> computeStatus());
    }

    private Map<String, Object> computeStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        for (MemoryLevel level : MemoryLevel.values()) {
            IMemoryStore store = storeFor(level);
            Map<String, Object> levelStatus = new LinkedHashMap<>();
            levelStatus.put("present", store != null);
            levelStatus.put("available", store != null && store.isAvailable());
            if (store != null) {
                try {
                    levelStatus.put("statistics", store.getStatistics());
                } catch (RuntimeException e) {
                    LOG.warn("Statistics of {} memory unavailable: {}", level.id(), e.getMessage());
                    levelStatus.put("error", e.getMessage());
                }
            }
            status.put(level.id(), levelStatus);
        }
        ConsolidationResult last = lastConsolidation;
        status.put("consolidations", consolidationCount);
        status.put("last_consolidation", last == null ? null : last.timestamp());
        status.put("last_consolidation_success", last == null ? null : last.success());
        return status;
    }

    /**
     * Clears every present store, including the attached episodic memory.
     */
    public void resetHierarchy() {
        consolidationLock.lock();
        try {
            for (MemoryLevel level : MemoryLevel.values()) {
                IMemoryStore store = storeFor(level);
                if (store != null) {
                    store.clear();
                }
            }
            lastConsolidation = null;
            consolidationCount = 0;
            statusCache.invalidateAll();
            LOG.info("Memory hierarchy reset");
        } finally {
            consolidationLock.unlock();
        }
    }

    /**
     * @return the semantic and procedural stores as a JSON tree; absent stores are omitted.
     */
    public JsonObject serialize() {
        consolidationLock.lock();
        try {
            return serializer.serialize(semanticStore, proceduralStore);
        } finally {
            consolidationLock.unlock();
        }
    }

    /**
     * Replaces the semantic and procedural content with a serialized one.
     *
     * @param tree A tree produced by {@link #serialize()}.
     * @throws IllegalArgumentException if the tree is malformed.
     */
    public void restore(JsonObject tree) {
        consolidationLock.lock();
        try {
            serializer.restore(tree, semanticStore, proceduralStore);
            statusCache.invalidateAll();
        } finally {
            consolidationLock.unlock();
        }
    }

    private IMemoryStore storeFor(MemoryLevel level) {
        return switch (level) {
            case SENSORY -> sensoryBuffer;
            case EPISODIC -> episodicStore;
            case SEMANTIC -> semanticStore;
            case PROCEDURAL -> proceduralStore;
        };
    }

    private static boolean isAvailable(IMemoryStore store) {
        return store != null && store.isAvailable();
    }

    private static double elapsedSince(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000_000.0;
    }

    public SensoryBuffer getSensoryBuffer() {
        return sensoryBuffer;
    }

    public EpisodicStore getEpisodicStore() {
        return episodicStore;
    }

    public SemanticStore getSemanticStore() {
        return semanticStore;
    }

    public ProceduralStore getProceduralStore() {
        return proceduralStore;
    }

    /**
     * @return the procedural store if present and available, otherwise {@code null}.
     */
    public ProceduralStore availableProceduralStore() {
        return isAvailable(proceduralStore) ? proceduralStore : null;
    }

    public ConsolidationResult getLastConsolidation() {
        return lastConsolidation;
    }

    public MemoryHierarchySettings getSettings() {
        return settings;
    }
}
