package org.vivarium.memory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.vivarium.memory.procedural.ActionStep;
import org.vivarium.memory.procedural.ProceduralStore;
import org.vivarium.memory.procedural.ProceduralStoreSettings;
import org.vivarium.memory.procedural.ScoredPattern;
import org.vivarium.memory.semantic.SemanticConcept;
import org.vivarium.memory.semantic.SemanticStore;
import org.vivarium.memory.semantic.SemanticStoreSettings;
import org.vivarium.memory.sensory.SensoryBuffer;
import org.vivarium.memory.sensory.SensoryBufferSettings;
import org.vivarium.runtime.model.Event;
import org.vivarium.runtime.model.MemoryEntry;
import org.vivarium.runtime.model.SelfState;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class MemoryHierarchyManagerTest {

    private static final long NOW = 1_700_000_000L;
    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC);

    @Mock
    private SemanticStore failingSemantic;

    private SelfState state;
    private MemoryHierarchyManager manager;

    @BeforeEach
    void setUp() {
        state = new SelfState();
        manager = MemoryHierarchyManager.create(MemoryHierarchySettings.defaults(), CLOCK);
        manager.attachEpisodicMemory(state.getMemory());
    }

    @Test
    @DisplayName("A single high-intensity event is transferred to episodic memory exactly once")
    void promotesHighIntensityEventOnce() {
        manager.addSensoryEvent(new Event("shock", 0.95, NOW));

        ConsolidationResult first = manager.consolidateMemory(state);
        ConsolidationResult second = manager.consolidateMemory(state);

        assertThat(first.sensoryToEpisodicTransfers()).isEqualTo(1);
        assertThat(second.sensoryToEpisodicTransfers()).isZero();
        assertThat(state.getMemory().snapshot()).singleElement().satisfies(entry -> {
            assertThat(entry.eventType()).isEqualTo("shock");
            assertThat(entry.meaningSignificance()).isEqualTo(0.95);
        });
    }

    @Test
    @DisplayName("Low-intensity events transfer once the repetition threshold is reached")
    void promotesRepeatedEventsAtThreshold() {
        for (int i = 0; i < 4; i++) {
            manager.addSensoryEvent(new Event("noise", 0.3, NOW));
        }
        assertThat(manager.consolidateMemory(state).sensoryToEpisodicTransfers()).isZero();

        manager.addSensoryEvent(new Event("noise", 0.3, NOW));
        assertThat(manager.consolidateMemory(state).sensoryToEpisodicTransfers()).isEqualTo(1);
        assertThat(state.getMemory().size()).isEqualTo(1);
    }

    @Test
    void formsConceptsAndAssociationsFromRecurringEpisodes() {
        for (int i = 0; i < 10; i++) {
            state.getMemory().append(new MemoryEntry("decay", 0.4, NOW + 2 * i, 0.0));
            state.getMemory().append(new MemoryEntry("recovery", 0.4, NOW + 2 * i + 1, 0.0));
        }
        state.getMemory().append(new MemoryEntry(MemoryEntry.FEEDBACK_TYPE, 0.0, NOW + 30, 0.0));

        ConsolidationResult result = manager.consolidateMemory(state);

        assertThat(result.episodicToSemanticTransfers()).isEqualTo(2);
        SemanticConcept decay = manager.getSemanticStore().getConcept("concept_decay").orElseThrow();
        assertThat(decay.getConfidence()).isEqualTo(0.3 * 0.5);
        assertThat(decay.getRelatedConcepts()).containsExactly("concept_recovery");
        assertThat(manager.getSemanticStore().getConcept("concept_feedback")).isEmpty();
    }

    @Test
    @DisplayName("A failing stage does not stop the other stages")
    void isolatesStageFailures() {
        when(failingSemantic.isAvailable()).thenReturn(true);
        when(failingSemantic.getSettings()).thenReturn(SemanticStoreSettings.defaults());
        when(failingSemantic.consolidateKnowledge()).thenThrow(new IllegalStateException("index corrupted"));
        MemoryHierarchyManager partial = new MemoryHierarchyManager(MemoryHierarchySettings.defaults(),
            new SensoryBuffer(SensoryBufferSettings.defaults(), CLOCK), failingSemantic,
            new ProceduralStore(ProceduralStoreSettings.defaults(), CLOCK), CLOCK);
        partial.attachEpisodicMemory(state.getMemory());
        partial.addSensoryEvent(new Event("shock", -1.0, NOW));

        ConsolidationResult result = partial.consolidateMemory(state);

        assertThat(result.success()).isTrue();
        assertThat(result.sensoryToEpisodicTransfers()).isEqualTo(1);
        assertThat(result.errorMessage()).contains("semantic_consolidation").contains("index corrupted");
        assertThat(result.details())
            .containsEntry(MemoryHierarchyManager.STAGE_SENSORY_TO_EPISODIC, "ok: 1")
            .containsEntry(MemoryHierarchyManager.STAGE_EPISODIC_TO_SEMANTIC, "ok: 0")
            .containsEntry(MemoryHierarchyManager.STAGE_SEMANTIC_CONSOLIDATION, "failed: index corrupted")
            .containsEntry(MemoryHierarchyManager.STAGE_PROCEDURAL_OPTIMIZATION, "ok: 0");
    }

    @Test
    void reportsFailureOnlyWhenEveryExecutedStageFails() {
        when(failingSemantic.isAvailable()).thenReturn(true);
        when(failingSemantic.getSettings()).thenThrow(new IllegalStateException("offline"));
        when(failingSemantic.consolidateKnowledge()).thenThrow(new IllegalStateException("offline"));
        MemoryHierarchyManager onlySemantic = new MemoryHierarchyManager(MemoryHierarchySettings.defaults(),
            null, failingSemantic, null, CLOCK);

        ConsolidationResult result = onlySemantic.consolidateMemory(state);

        assertThat(result.success()).isFalse();
        assertThat(result.details())
            .containsEntry(MemoryHierarchyManager.STAGE_SENSORY_TO_EPISODIC, "skipped: store absent")
            .containsEntry(MemoryHierarchyManager.STAGE_PROCEDURAL_OPTIMIZATION, "skipped: store absent");
    }

    @Test
    @DisplayName("Disabled stores are skipped and report unavailable queries")
    void skipsUnavailableStores() {
        SemanticStoreSettings disabled = new SemanticStoreSettings(false, 10, 50, 0.3, 60.0, 604800.0, 0.9, 0.05, 0.1);
        MemoryHierarchyManager degraded = new MemoryHierarchyManager(MemoryHierarchySettings.defaults(),
            new SensoryBuffer(SensoryBufferSettings.defaults(), CLOCK), new SemanticStore(disabled, CLOCK), null, CLOCK);
        degraded.attachEpisodicMemory(state.getMemory());

        ConsolidationResult result = degraded.consolidateMemory(state);
        MemoryQueryResult query = degraded.queryMemory("semantic", MemoryQueryParams.empty());

        assertThat(result.success()).isTrue();
        assertThat(result.details()).containsEntry(MemoryHierarchyManager.STAGE_EPISODIC_TO_SEMANTIC, "skipped: store unavailable");
        assertThat(query.success()).isFalse();
        assertThat(query.results()).isEmpty();
        assertThat(query.errorMessage()).contains("semantic");
        assertThat(degraded.queryMemory("procedural", null).success()).isFalse();
        assertThat(degraded.availableProceduralStore()).isNull();
    }

    @Test
    void rejectsUnknownLevel() {
        assertThatThrownBy(() -> manager.queryMemory("working", MemoryQueryParams.empty()))
            .isInstanceOf(InvalidMemoryQueryException.class)
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("working");
        assertThatThrownBy(() -> manager.queryMemory(null, null))
            .isInstanceOf(InvalidMemoryQueryException.class);
    }

    @Test
    void rejectsMalformedParameters() {
        MemoryQueryParams negative = MemoryQueryParams.builder().limit(-1).build();
        MemoryQueryParams notANumber = MemoryQueryParams.builder().confidenceThreshold(Double.NaN).build();

        assertThatThrownBy(() -> manager.queryMemory("episodic", negative))
            .isInstanceOf(InvalidMemoryQueryException.class);
        assertThatThrownBy(() -> manager.queryMemory("semantic", notANumber))
            .isInstanceOf(InvalidMemoryQueryException.class)
            .hasMessageContaining("confidenceThreshold");
    }

    @Test
    void appliesDefaultSemanticLimitAndPaging() {
        for (int i = 0; i < 12; i++) {
            manager.getSemanticStore().reinforce("type" + i, 10, 0.5);
        }

        MemoryQueryResult firstPage = manager.queryMemory("semantic", MemoryQueryParams.empty());
        MemoryQueryResult lastPage = manager.queryMemory("SEMANTIC",
            MemoryQueryParams.builder().offset(10).limit(5).build());

        assertThat(firstPage.success()).isTrue();
        assertThat(firstPage.results()).hasSize(10);
        assertThat(firstPage.totalCount()).isEqualTo(12);
        assertThat(lastPage.results()).hasSize(2);
    }

    @Test
    void filtersEpisodicMemoryByTypeAndTime() {
        state.getMemory().append(new MemoryEntry("shock", 0.9, NOW - 100, 0.0));
        state.getMemory().append(new MemoryEntry("noise", 0.1, NOW - 50, 0.0));
        state.getMemory().append(new MemoryEntry("shock", 0.8, NOW, 0.0));

        MemoryQueryResult result = manager.queryMemory("episodic", MemoryQueryParams.builder()
            .eventTypes(List.of("shock"))
            .timeRange(NOW - 60, NOW)
            .build());

        assertThat(result.results()).singleElement()
            .isInstanceOfSatisfying(MemoryEntry.class, e -> assertThat(e.timestamp()).isEqualTo((double) NOW));
    }

    @Test
    void statusIsCachedUntilTheNextConsolidation() {
        Map<String, Object> before = manager.getHierarchyStatus();
        manager.addSensoryEvent(new Event("noise", 0.1, NOW));

        assertThat(manager.getHierarchyStatus()).isSameAs(before);

        manager.consolidateMemory(state);
        Map<String, Object> after = manager.getHierarchyStatus();
        assertThat(after).isNotSameAs(before);
        assertThat(after).containsEntry("consolidations", 1L);
        assertThat(after.get("sensory")).isInstanceOfSatisfying(Map.class,
            level -> assertThat(level).containsEntry("available", true));
    }

    @Test
    void resetClearsEveryLevel() {
        manager.addSensoryEvent(new Event("noise", 0.1, NOW));
        state.getMemory().append(new MemoryEntry("noise", 0.1, NOW, 0.0));
        manager.getSemanticStore().reinforce("noise", 10, 0.5);

        manager.resetHierarchy();

        assertThat(manager.getSensoryBuffer().size()).isZero();
        assertThat(state.getMemory().size()).isZero();
        assertThat(manager.getSemanticStore().size()).isZero();
        assertThat(manager.getLastConsolidation()).isNull();
    }

    @Test
    void statusExpiresAfterItsTimeToLive() {
        MutableClock clock = new MutableClock(NOW);
        MemoryHierarchyManager timed = MemoryHierarchyManager.create(MemoryHierarchySettings.defaults(), clock);
        Map<String, Object> first = timed.getHierarchyStatus();

        clock.advanceMillis(500);
        assertThat(timed.getHierarchyStatus()).isSameAs(first);

        clock.advanceMillis(1_000);
        assertThat(timed.getHierarchyStatus()).isNotSameAs(first);
    }

    @Test
    @DisplayName("A second consolidation waits until the running one completes")
    void consolidationsAreSerialized() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        SemanticStore blocking = new SemanticStore(SemanticStoreSettings.defaults(), CLOCK) {
            @Override
            public int consolidateKnowledge() {
                calls.incrementAndGet();
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return super.consolidateKnowledge();
            }
        };
        MemoryHierarchyManager serialized = new MemoryHierarchyManager(MemoryHierarchySettings.defaults(),
            new SensoryBuffer(SensoryBufferSettings.defaults(), CLOCK), blocking,
            new ProceduralStore(ProceduralStoreSettings.defaults(), CLOCK), CLOCK);
        serialized.attachEpisodicMemory(state.getMemory());

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<ConsolidationResult> first = executor.submit(() -> serialized.consolidateMemory(state));
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
            Future<ConsolidationResult> second = executor.submit(() -> serialized.consolidateMemory(state));

            await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(2)).until(() -> !second.isDone());
            assertThat(calls).hasValue(1);
            assertThat(serialized.getLastConsolidation()).isNull();

            release.countDown();
            assertThat(first.get(5, TimeUnit.SECONDS).success()).isTrue();
            assertThat(second.get(5, TimeUnit.SECONDS).success()).isTrue();
            assertThat(calls).hasValue(2);
            assertThat(serialized.getHierarchyStatus()).containsEntry("consolidations", 2L);
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Queries on every level succeed while the tick thread learns and consolidates")
    void queriesSucceedDuringConcurrentWrites() throws Exception {
        AtomicBoolean running = new AtomicBoolean(true);
        AtomicInteger passes = new AtomicInteger();
        List<Throwable> errors = new CopyOnWriteArrayList<>();
        Thread reader = new Thread(() -> {
            while (running.get()) {
                try {
                    for (MemoryLevel level : MemoryLevel.values()) {
                        MemoryQueryResult result = manager.queryMemory(level.id(), null);
                        if (!result.success()) {
                            errors.add(new AssertionError(level.id() + ": " + result.errorMessage()));
                        }
                        for (Object item : result.results()) {
                            if (item instanceof ScoredPattern) {
                                ScoredPattern scored = (ScoredPattern) item;
                                scored.pattern().getRecentOutcomes();
                                scored.pattern().successRate();
                            }
                        }
                    }
                    manager.getHierarchyStatus();
                    passes.incrementAndGet();
                } catch (Throwable t) {
                    errors.add(t);
                }
            }
        }, "memory-reader");
        reader.start();

        Map<String, Object> context = Map.of("event_type", "shock");
        ProceduralStore procedural = manager.getProceduralStore();
        try {
            for (int i = 0; i < 300; i++) {
                manager.addSensoryEvent(new Event("shock", 0.9, NOW));
                state.getMemory().append(new MemoryEntry(i % 2 == 0 ? "shock" : "noise", 0.5, NOW, i));
                procedural.learnFromExperience(context, List.of(new ActionStep("dampen")), "ok", i % 3 != 0);
                procedural.executeBestPattern(context);
                if (i % 10 == 0) {
                    manager.consolidateMemory(state);
                }
            }
            await().atMost(Duration.ofSeconds(5)).until(() -> passes.get() > 0);
        } finally {
            running.set(false);
            reader.join(5_000);
        }

        assertThat(errors).isEmpty();
    }
}
