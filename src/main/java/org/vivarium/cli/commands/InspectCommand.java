package org.vivarium.cli.commands;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.concurrent.Callable;

import org.vivarium.cli.CommandLineInterface;
import org.vivarium.cli.config.ConfigLoader;
import org.vivarium.datapipeline.resources.storage.FileSystemSnapshotStore;
import org.vivarium.datapipeline.resources.storage.LifeSnapshotCodec;
import org.vivarium.runtime.model.LifeSnapshot;
import org.vivarium.runtime.model.MemoryEntry;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.typesafe.config.Config;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(
    name = "inspect",
    description = "Print a summary of the latest snapshot"
)
public class InspectCommand implements Callable<Integer> {

    @Option(
        names = {"-d", "--directory"},
        description = "Snapshot directory (default: vivarium.snapshots.directory)"
    )
    private Path directory;

    @Option(
        names = {"--full"},
        description = "Print the whole snapshot instead of a summary"
    )
    private boolean full;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        Path dir = directory != null ? directory : configuredDirectory();
        if (dir == null) {
            spec.commandLine().getErr().println("No snapshot directory given and none configured");
            return 1;
        }

        if (!Files.isDirectory(dir)) {
            spec.commandLine().getOut().println("No snapshots found in " + dir);
            return 1;
        }

        Optional<LifeSnapshot> latest;
        try {
            latest = new FileSystemSnapshotStore(dir, 0).loadLatest();
        } catch (IOException e) {
            spec.commandLine().getErr().println("Failed to read snapshots from " + dir + ": " + e.getMessage());
            return 1;
        }
        if (latest.isEmpty()) {
            spec.commandLine().getOut().println("No snapshots found in " + dir);
            return 1;
        }

        LifeSnapshotCodec codec = new LifeSnapshotCodec(true);
        LifeSnapshot snapshot = latest.get();
        spec.commandLine().getOut().println(full ? codec.toPrettyJson(codec.toJson(snapshot)) : codec.toPrettyJson(summarize(snapshot)));
        return 0;
    }

    private Path configuredDirectory() {
        Config config = parent.getConfig();
        String path = ConfigLoader.ROOT + ".snapshots.directory";
        return config.hasPath(path) ? Paths.get(config.getString(path)) : null;
    }

    static JsonObject summarize(LifeSnapshot snapshot) {
        JsonObject summary = new JsonObject();
        summary.addProperty("tick", snapshot.tick());
        summary.addProperty("captured_at", snapshot.capturedAt());
        summary.addProperty("age", snapshot.age());
        summary.addProperty("energy", snapshot.vital().energy());
        summary.addProperty("stability", snapshot.vital().stability());
        summary.addProperty("integrity", snapshot.vital().integrity());
        summary.addProperty("memory_entries", snapshot.memory().size());
        summary.addProperty("feedback_entries", snapshot.memory().stream().filter(MemoryEntry::isFeedback).count());
        summary.addProperty("pending_actions", snapshot.pendingActions().size());
        summary.addProperty("adaptations", snapshot.adaptationHistory().size());
        JsonObject hierarchy = snapshot.hierarchy();
        if (hierarchy != null) {
            summary.addProperty("concepts", count(hierarchy, "semantic_store", "concepts"));
            summary.addProperty("associations", count(hierarchy, "semantic_store", "associations"));
            summary.addProperty("patterns", count(hierarchy, "procedural_store", "patterns"));
            summary.addProperty("decision_patterns", count(hierarchy, "procedural_store", "decision_patterns"));
        }
        return summary;
    }

    // Sections are keyed objects except for the association list
    private static int count(JsonObject hierarchy, String store, String section) {
        if (!hierarchy.has(store) || !hierarchy.get(store).isJsonObject()) {
            return 0;
        }
        JsonElement values = hierarchy.getAsJsonObject(store).get(section);
        if (values == null) {
            return 0;
        }
        if (values.isJsonArray()) {
            return values.getAsJsonArray().size();
        }
        return values.isJsonObject() ? values.getAsJsonObject().size() : 0;
    }
}
