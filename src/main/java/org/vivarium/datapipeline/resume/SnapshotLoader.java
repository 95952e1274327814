package org.vivarium.datapipeline.resume;

import java.io.IOException;
import java.util.Objects;

import org.vivarium.memory.MemoryHierarchyManager;
import org.vivarium.runtime.feedback.FeedbackTracker;
import org.vivarium.runtime.model.LifeSnapshot;
import org.vivarium.runtime.model.SelfState;
import org.vivarium.runtime.spi.ISnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Restores an organism from the latest snapshot in a store.
 * <p>
 * <b>Resume algorithm:</b>
 * <ol>
 *   <li>Load the snapshot with the highest tick</li>
 *   <li>Restore the memory hierarchy first, so a corrupt hierarchy leaves the state untouched</li>
 *   <li>Write clocks, vital values, episodic memory and adaptation history into the state</li>
 *   <li>Re-register the pending actions with the feedback tracker</li>
 * </ol>
 */
public class SnapshotLoader {

    private static final Logger log = LoggerFactory.getLogger(SnapshotLoader.class);

    private final ISnapshotStore store;

    public SnapshotLoader(ISnapshotStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * @return the latest snapshot.
     * @throws ResumeException if there is none or it cannot be read.
     */
    public LifeSnapshot loadLatest() {
        try {
            return store.loadLatest()
                .orElseThrow(() -> new ResumeException("No snapshot found to resume from"));
        } catch (IOException e) {
            throw new ResumeException("Failed to read latest snapshot: " + e.getMessage(), e);
        }
    }

    /**
     * Loads the latest snapshot and restores it into the given components.
     *
     * @param state    Fresh organism state to overwrite.
     * @param feedback Tracker to receive the pending actions.
     * @param memory   Hierarchy to restore, or {@code null}.
     * @return The snapshot that was restored.
     * @throws ResumeException if no usable snapshot exists.
     */
    public LifeSnapshot restore(SelfState state, FeedbackTracker feedback, MemoryHierarchyManager memory) {
        LifeSnapshot snapshot = loadLatest();
        if (memory != null && snapshot.hierarchy() != null) {
            try {
                memory.restore(snapshot.hierarchy());
            } catch (IllegalArgumentException e) {
                throw new ResumeException("Snapshot at tick " + snapshot.tick()
                    + " has an unreadable memory hierarchy: " + e.getMessage(), e);
            }
        }
        snapshot.restoreInto(state);
        feedback.restore(snapshot.pendingActions());
        log.info("Resumed from tick {} ({} memories, {} pending actions)",
            snapshot.tick(), snapshot.memory().size(), snapshot.pendingActions().size());
        return snapshot;
    }
}
