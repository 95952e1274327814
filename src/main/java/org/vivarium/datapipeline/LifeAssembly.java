package org.vivarium.datapipeline;

import java.time.Clock;

import org.vivarium.datapipeline.resources.logging.AsyncStructuredLogger;
import org.vivarium.datapipeline.resources.queues.EventQueue;
import org.vivarium.datapipeline.resources.storage.FileSystemSnapshotStore;
import org.vivarium.datapipeline.resume.SnapshotLoader;
import org.vivarium.datapipeline.services.LifeEngine;
import org.vivarium.datapipeline.services.SnapshotManager;
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
import org.vivarium.runtime.spi.IRandomProvider;
import org.vivarium.runtime.spi.IStructuredLogSink;
import org.vivarium.runtime.worldgen.RandomEventGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Wires a runnable organism from the {@code vivarium} configuration block.
 *
 * @param service          The life loop service, not yet started.
 * @param structuredLogger The structured log sink, or {@code null} when disabled. Close it after
 *                         the service has stopped.
 * @param snapshots        The snapshot policy, or {@code null} when disabled.
 * @param resumedFrom      The snapshot the organism was restored from, or {@code null}.
 */
public record LifeAssembly(
    LifeEngine service,
    AsyncStructuredLogger structuredLogger,
    SnapshotManager snapshots,
    LifeSnapshot resumedFrom
) {

    private static final Logger LOG = LoggerFactory.getLogger(LifeAssembly.class);

    /**
     * @param vivarium The {@code vivarium} block.
     * @param resume   Restore from the latest snapshot before running.
     * @param clock    Wall clock for timestamps.
     * @return The assembled components.
     * @throws IllegalArgumentException if the configuration is invalid.
     * @throws org.vivarium.datapipeline.resume.ResumeException if {@code resume} is set and no
     *         usable snapshot exists.
     */
    public static LifeAssembly build(Config vivarium, boolean resume, Clock clock) {
        long seed = vivarium.hasPath("seed") ? vivarium.getLong("seed") : 42L;
        IRandomProvider random = new SeededRandomProvider(seed);

        SelfState state = new SelfState();
        FeedbackTracker feedback = new FeedbackTracker(random.deriveFor("feedback", 0),
            FeedbackSettings.fromConfig(block(vivarium, "feedback")), clock);
        MemoryHierarchyManager memory = MemoryHierarchyManager.create(
            MemoryHierarchySettings.fromConfig(block(vivarium, "memory")), clock);

        FileSystemSnapshotStore store = null;
        Config snapshotConfig = block(vivarium, "snapshots");
        if (!snapshotConfig.hasPath("enabled") || snapshotConfig.getBoolean("enabled")) {
            store = new FileSystemSnapshotStore(snapshotConfig);
        }

        LifeSnapshot resumedFrom = null;
        if (resume) {
            if (store == null) {
                throw new IllegalArgumentException("Cannot resume with vivarium.snapshots.enabled = false");
            }
            resumedFrom = new SnapshotLoader(store).restore(state, feedback, memory);
        }

        AsyncStructuredLogger structuredLogger = null;
        Config logging = block(vivarium, "logging.structured");
        if (!logging.hasPath("enabled") || logging.getBoolean("enabled")) {
            structuredLogger = new AsyncStructuredLogger(logging);
        }

        TickEngine engine = new TickEngine(state, new MeaningEngine(block(vivarium, "meaning")), feedback, memory,
            structuredLogger == null ? IStructuredLogSink.NO_OP : structuredLogger,
            TickEngineSettings.fromConfig(block(vivarium, "runtime")), clock);

        SnapshotManager snapshots = null;
        if (store != null) {
            int period = snapshotConfig.hasPath("periodTicks") ? snapshotConfig.getInt("periodTicks") : 10;
            snapshots = new SnapshotManager(store, period, clock);
        }

        RandomEventGenerator generator = new RandomEventGenerator(random.deriveFor("generator", 0),
            block(vivarium, "generator"), clock);
        EventQueue queue = new EventQueue("events", block(vivarium, "queue"));
        LifeEngine service = new LifeEngine("life-engine", block(vivarium, "service"), engine, queue, generator, snapshots);

        LOG.debug("Assembled organism with seed {} (resume={})", seed, resume);
        return new LifeAssembly(service, structuredLogger, snapshots, resumedFrom);
    }

    private static Config block(Config root, String path) {
        return root.hasPath(path) ? root.getConfig(path) : ConfigFactory.empty();
    }
}
