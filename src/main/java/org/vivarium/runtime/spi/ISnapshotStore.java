package org.vivarium.runtime.spi;

import java.io.IOException;
import java.util.Optional;

import org.vivarium.runtime.model.LifeSnapshot;

/**
 * Persists periodic snapshots of the organism.
 */
public interface ISnapshotStore {

    /**
     * @param snapshot The snapshot to persist.
     * @throws IOException if the snapshot cannot be written.
     */
    void save(LifeSnapshot snapshot) throws IOException;

    /**
     * @return the snapshot with the highest tick, or empty if none exists.
     * @throws IOException if the store cannot be read or the latest snapshot is corrupt.
     */
    Optional<LifeSnapshot> loadLatest() throws IOException;
}
