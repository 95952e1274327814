package org.vivarium.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.vivarium.cli.CommandLineInterface;
import org.vivarium.datapipeline.resources.storage.FileSystemSnapshotStore;
import org.vivarium.memory.procedural.ActionStep;
import org.vivarium.memory.procedural.ProceduralStore;
import org.vivarium.memory.procedural.ProceduralStoreSettings;
import org.vivarium.memory.semantic.SemanticStore;
import org.vivarium.memory.semantic.SemanticStoreSettings;
import org.vivarium.memory.serialization.MemoryHierarchySerializer;
import org.vivarium.runtime.model.LifeSnapshot;
import org.vivarium.runtime.model.MemoryEntry;
import org.vivarium.runtime.model.SelfState;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
class InspectCommandTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        commandLine = CommandLineInterface.createCommandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
    }

    @Test
    void summarizesTheLatestSnapshot() throws IOException {
        saveSnapshot(tempDir, 20);
        saveSnapshot(tempDir, 30);

        int exitCode = commandLine.execute("inspect", "-d", tempDir.toString());

        assertEquals(0, exitCode);
        JsonObject summary = JsonParser.parseString(out.toString()).getAsJsonObject();
        assertThat(summary.get("tick").getAsLong()).isEqualTo(30);
        assertThat(summary.get("memory_entries").getAsInt()).isEqualTo(2);
        assertThat(summary.get("feedback_entries").getAsInt()).isEqualTo(1);
        assertThat(summary.get("concepts").getAsInt()).isEqualTo(2);
        assertThat(summary.get("associations").getAsInt()).isEqualTo(1);
        assertThat(summary.get("patterns").getAsInt()).isEqualTo(1);
        assertThat(summary.get("decision_patterns").getAsInt()).isEqualTo(1);
    }

    @Test
    void printsTheWholeSnapshotWithFull() throws IOException {
        saveSnapshot(tempDir, 10);

        int exitCode = commandLine.execute("inspect", "--directory", tempDir.toString(), "--full");

        assertEquals(0, exitCode);
        JsonObject snapshot = JsonParser.parseString(out.toString()).getAsJsonObject();
        assertThat(snapshot.getAsJsonArray("memory")).hasSize(2);
        assertThat(snapshot.has("hierarchy")).isTrue();
    }

    @Test
    void reportsMissingSnapshots() {
        int missingDir = commandLine.execute("inspect", "-d", tempDir.resolve("absent").toString());
        int emptyDir = commandLine.execute("inspect", "-d", tempDir.toString());

        assertEquals(1, missingDir);
        assertEquals(1, emptyDir);
        assertThat(out.toString()).contains("No snapshots found");
        assertThat(tempDir.resolve("absent")).doesNotExist();
    }

    private static void saveSnapshot(Path dir, long tick) throws IOException {
        SelfState state = new SelfState();
        state.restoreClocks(tick, tick, tick);
        state.getMemory().append(new MemoryEntry("shock", 0.8, 1_700_000_000.0, 1.0));
        state.getMemory().append(new MemoryEntry(MemoryEntry.FEEDBACK_TYPE, 0.0, 1_700_000_004.0, 1.0, 5.0,
            Map.of("action_pattern", "absorb")));

        SemanticStore semantic = new SemanticStore(SemanticStoreSettings.defaults());
        semantic.reinforce("shock", 10, 0.5);
        semantic.reinforce("recovery", 10, 0.5);
        semantic.relate("concept_shock", "concept_recovery");
        ProceduralStore procedural = new ProceduralStore(ProceduralStoreSettings.defaults());
        procedural.learnFromExperience(Map.of("event_type", "shock"), List.of(new ActionStep("absorb")), "ok", true);
        JsonObject hierarchy = new MemoryHierarchySerializer().serialize(semantic, procedural);

        new FileSystemSnapshotStore(dir, 0).save(LifeSnapshot.capture(state, List.of(), hierarchy, 1_700_000_010.0));
    }
}
