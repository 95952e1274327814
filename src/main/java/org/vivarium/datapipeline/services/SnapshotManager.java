package org.vivarium.datapipeline.services;

import java.time.Clock;
import java.util.Objects;

import org.vivarium.memory.MemoryHierarchyManager;
import org.vivarium.runtime.TickEngine;
import org.vivarium.runtime.model.LifeSnapshot;
import org.vivarium.runtime.spi.ISnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Takes a snapshot of the engine every {@code periodTicks} ticks. Store failures are logged and
 * recorded as the last operation status; they never reach the tick loop.
 * <p>
 * Must be called on the tick thread.
 */
public class SnapshotManager {

    private static final Logger LOG = LoggerFactory.getLogger(SnapshotManager.class);

    private final ISnapshotStore store;
    private final int periodTicks;
    private final Clock clock;

    private long snapshotCount;
    private long failureCount;
    private boolean lastOperationSuccess = true;
    private String lastOperationError;
    private double lastOperationTimestamp;

    public SnapshotManager(ISnapshotStore store, int periodTicks, Clock clock) {
        if (periodTicks <= 0) {
            throw new IllegalArgumentException("periodTicks must be > 0, got " + periodTicks);
        }
        this.store = Objects.requireNonNull(store, "store");
        this.periodTicks = periodTicks;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public boolean shouldSnapshot(long tick) {
        return tick > 0 && tick % periodTicks == 0;
    }

    /**
     * @return {@code true} if a snapshot was due and written.
     */
    public boolean maybeSnapshot(TickEngine engine) {
        if (!shouldSnapshot(engine.getState().getTicks())) {
            return false;
        }
        return snapshot(engine);
    }

    /**
     * Writes a snapshot now, regardless of the period.
     *
     * @return {@code true} on success.
     */
    public boolean snapshot(TickEngine engine) {
        double now = clock.millis() / 1000.0;
        lastOperationTimestamp = now;
        try {
            MemoryHierarchyManager memory = engine.getMemory();
            LifeSnapshot snapshot = LifeSnapshot.capture(
                engine.getState(),
                engine.getFeedbackTracker().getPendingActions(),
                memory == null ? null : memory.serialize(),
                now);
            store.save(snapshot);
            snapshotCount++;
            lastOperationSuccess = true;
            lastOperationError = null;
            LOG.debug("Snapshot written at tick {}", snapshot.tick());
            return true;
        } catch (Exception e) {
            failureCount++;
            lastOperationSuccess = false;
            lastOperationError = e.getClass().getSimpleName() + ": " + e.getMessage();
            LOG.warn("Snapshot at tick {} failed: {}", engine.getState().getTicks(), e.getMessage());
            LOG.debug("Snapshot failure details:", e);
            return false;
        }
    }

    public int getPeriodTicks() {
        return periodTicks;
    }

    public long getSnapshotCount() {
        return snapshotCount;
    }

    public long getFailureCount() {
        return failureCount;
    }

    public boolean isLastOperationSuccess() {
        return lastOperationSuccess;
    }

    public String getLastOperationError() {
        return lastOperationError;
    }

    public double getLastOperationTimestamp() {
        return lastOperationTimestamp;
    }
}
