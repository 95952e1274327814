package org.vivarium.memory.sensory;

import java.util.Iterator;
import java.util.List;
import java.util.Set;

import org.vivarium.runtime.model.Event;

/**
 * Events selected for promotion out of a {@link SensoryBuffer}, held until the caller has
 * handed them off.
 * <p>
 * The buffer keeps the underlying entries until {@link #commit()}. Closing an uncommitted
 * batch leaves the buffer unchanged, so a failed hand-off can be retried:
 * <pre>
 * try (PromotionBatch batch = buffer.drainPromotable(0.8, 5)) {
 *     for (Event event : batch) {
 *         episodic.append(toEntry(event));
 *     }
 *     batch.commit();
 * }
 * </pre>
 * <p>
 * <strong>Thread safety:</strong> not thread-safe; use from the thread that drained it.
 */
public final class PromotionBatch implements Iterable<Event>, AutoCloseable {

    private final SensoryBuffer owner;
    private final List<Event> promoted;
    private final Set<Long> consumedSequences;
    private boolean committed;

    PromotionBatch(SensoryBuffer owner, List<Event> promoted, Set<Long> consumedSequences) {
        this.owner = owner;
        this.promoted = List.copyOf(promoted);
        this.consumedSequences = Set.copyOf(consumedSequences);
    }

    /**
     * @return the number of promoted events. Grouped promotions count once.
     */
    public int size() {
        return promoted.size();
    }

    public List<Event> events() {
        return promoted;
    }

    /**
     * @return the number of buffer entries consumed on commit.
     */
    public int consumedEntries() {
        return consumedSequences.size();
    }

    @Override
    public Iterator<Event> iterator() {
        return promoted.iterator();
    }

    /**
     * Removes the consumed entries from the buffer. Calling it twice has no further effect.
     */
    public void commit() {
        if (committed) {
            return;
        }
        owner.remove(consumedSequences, promoted.size());
        committed = true;
    }

    public boolean isCommitted() {
        return committed;
    }

    @Override
    public void close() {
        // Uncommitted entries stay in the buffer
    }
}
