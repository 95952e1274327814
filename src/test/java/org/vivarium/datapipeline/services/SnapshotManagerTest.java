package org.vivarium.datapipeline.services;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.vivarium.memory.MemoryHierarchyManager;
import org.vivarium.memory.MemoryHierarchySettings;
import org.vivarium.runtime.TickEngine;
import org.vivarium.runtime.TickEngineSettings;
import org.vivarium.runtime.feedback.FeedbackSettings;
import org.vivarium.runtime.feedback.FeedbackTracker;
import org.vivarium.runtime.internal.services.SeededRandomProvider;
import org.vivarium.runtime.meaning.MeaningEngine;
import org.vivarium.runtime.model.LifeSnapshot;
import org.vivarium.runtime.model.SelfState;
import org.vivarium.runtime.spi.ISnapshotStore;
import org.vivarium.runtime.spi.IStructuredLogSink;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class SnapshotManagerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC);

    @Mock
    private ISnapshotStore store;

    private TickEngine engine;
    private SnapshotManager manager;

    @BeforeEach
    void setUp() {
        MemoryHierarchyManager memory = MemoryHierarchyManager.create(MemoryHierarchySettings.defaults(), CLOCK);
        engine = new TickEngine(new SelfState(), new MeaningEngine(),
            new FeedbackTracker(new SeededRandomProvider(3L), FeedbackSettings.defaults(), CLOCK),
            memory, IStructuredLogSink.NO_OP, TickEngineSettings.defaults(), CLOCK);
        manager = new SnapshotManager(store, 5, CLOCK);
    }

    @Test
    void snapshotsOnlyOnPeriodBoundaries() {
        assertThat(manager.shouldSnapshot(0)).isFalse();
        assertThat(manager.shouldSnapshot(4)).isFalse();
        assertThat(manager.shouldSnapshot(5)).isTrue();
        assertThat(manager.shouldSnapshot(10)).isTrue();
    }

    @Test
    void capturesTheEngineWhenDue() throws IOException {
        for (int i = 0; i < 4; i++) {
            engine.tick(1.0, List.of());
            assertThat(manager.maybeSnapshot(engine)).isFalse();
        }
        verify(store, never()).save(any());

        engine.tick(1.0, List.of());
        assertThat(manager.maybeSnapshot(engine)).isTrue();

        ArgumentCaptor<LifeSnapshot> captor = ArgumentCaptor.forClass(LifeSnapshot.class);
        verify(store).save(captor.capture());
        assertThat(captor.getValue().tick()).isEqualTo(5);
        assertThat(captor.getValue().capturedAt()).isEqualTo(1_700_000_000.0);
        assertThat(captor.getValue().hierarchy()).isNotNull();
        assertThat(manager.getSnapshotCount()).isEqualTo(1);
        assertThat(manager.isLastOperationSuccess()).isTrue();
    }

    @Test
    void storeFailureIsRecordedNotThrown() throws IOException {
        doThrow(new IOException("disk full")).when(store).save(any());

        boolean written = manager.snapshot(engine);

        assertThat(written).isFalse();
        assertThat(manager.isLastOperationSuccess()).isFalse();
        assertThat(manager.getLastOperationError()).isEqualTo("IOException: disk full");
        assertThat(manager.getLastOperationTimestamp()).isEqualTo(1_700_000_000.0);
        assertThat(manager.getFailureCount()).isEqualTo(1);
        assertThat(manager.getSnapshotCount()).isZero();
    }

    @Test
    void rejectsNonPositivePeriod() {
        assertThatThrownBy(() -> new SnapshotManager(store, 0, CLOCK))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
