package org.vivarium.datapipeline.resume;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.vivarium.datapipeline.resources.storage.FileSystemSnapshotStore;
import org.vivarium.memory.MemoryHierarchyManager;
import org.vivarium.memory.MemoryHierarchySettings;
import org.vivarium.memory.procedural.ActionStep;
import org.vivarium.runtime.feedback.FeedbackSettings;
import org.vivarium.runtime.feedback.FeedbackTracker;
import org.vivarium.runtime.internal.services.SeededRandomProvider;
import org.vivarium.runtime.model.LifeSnapshot;
import org.vivarium.runtime.model.MemoryEntry;
import org.vivarium.runtime.model.ResponsePattern;
import org.vivarium.runtime.model.SelfState;
import org.vivarium.runtime.model.StateVector;

import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class SnapshotLoaderTest {

    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    @Test
    void failsWithoutSnapshot() {
        SnapshotLoader loader = new SnapshotLoader(new FileSystemSnapshotStore(tempDir, 10));

        assertThatThrownBy(loader::loadLatest)
            .isInstanceOf(ResumeException.class)
            .hasMessageContaining("No snapshot");
    }

    @Test
    void corruptSnapshotIsAResumeFailure() throws IOException {
        Files.writeString(tempDir.resolve(FileSystemSnapshotStore.fileNameFor(3)), "garbage");
        SnapshotLoader loader = new SnapshotLoader(new FileSystemSnapshotStore(tempDir, 10));

        assertThatThrownBy(loader::loadLatest)
            .isInstanceOf(ResumeException.class)
            .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void restoresStatePendingActionsAndMemory() throws IOException {
        FileSystemSnapshotStore store = new FileSystemSnapshotStore(tempDir, 10);
        SelfState original = new SelfState();
        original.restoreClocks(40, 40.0, 38.5);
        original.setEnergy(62.5);
        original.setStability(0.55);
        original.getMemory().append(new MemoryEntry("shock", 0.7, 1_699_999_990.0, 30.0));
        FeedbackTracker originalFeedback = feedback();
        originalFeedback.registerAction("action_39_absorb", ResponsePattern.ABSORB,
            new StateVector(70.0, 0.6, 1.0), 1_699_999_999.0, List.of("shock"), 4);
        MemoryHierarchyManager originalMemory = memory();
        originalMemory.getSemanticStore().reinforce("shock", 10, 0.5);
        originalMemory.getProceduralStore().learnFromExperience(Map.of("event_type", "shock"),
            List.of(new ActionStep("absorb")), "net -0.1", false);
        store.save(LifeSnapshot.capture(original, originalFeedback.getPendingActions(),
            originalMemory.serialize(), 1_700_000_000.0));

        SelfState state = new SelfState();
        FeedbackTracker feedback = feedback();
        MemoryHierarchyManager memory = memory();
        LifeSnapshot restored = new SnapshotLoader(store).restore(state, feedback, memory);

        assertThat(restored.tick()).isEqualTo(40);
        assertThat(state.getTicks()).isEqualTo(40);
        assertThat(state.getSubjectiveTime()).isEqualTo(38.5);
        assertThat(state.vector()).isEqualTo(new StateVector(62.5, 0.55, 1.0));
        assertThat(state.getMemory().snapshot()).isEqualTo(original.getMemory().snapshot());
        assertThat(feedback.isPending("action_39_absorb")).isTrue();
        assertThat(memory.getSemanticStore().getConcept("concept_shock")).isPresent();
        assertThat(memory.getProceduralStore().getPattern("pattern_0")).isPresent();
    }

    @Test
    void unreadableHierarchyLeavesTheStateUntouched() throws IOException {
        FileSystemSnapshotStore store = new FileSystemSnapshotStore(tempDir, 10);
        SelfState original = new SelfState();
        original.restoreClocks(12, 12.0, 12.0);
        JsonObject broken = new JsonObject();
        broken.add("semantic_store", new JsonPrimitive(7));
        store.save(LifeSnapshot.capture(original, List.of(), broken, 1_700_000_000.0));

        SelfState state = new SelfState();
        assertThatThrownBy(() -> new SnapshotLoader(store).restore(state, feedback(), memory()))
            .isInstanceOf(ResumeException.class)
            .hasMessageContaining("tick 12");
        assertThat(state.getTicks()).isZero();
    }

    private static FeedbackTracker feedback() {
        return new FeedbackTracker(new SeededRandomProvider(11L), FeedbackSettings.defaults(), CLOCK);
    }

    private static MemoryHierarchyManager memory() {
        return MemoryHierarchyManager.create(MemoryHierarchySettings.defaults(), CLOCK);
    }
}
