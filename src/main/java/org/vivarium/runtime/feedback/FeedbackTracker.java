package org.vivarium.runtime.feedback;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.vivarium.runtime.model.FeedbackRecord;
import org.vivarium.runtime.model.PendingAction;
import org.vivarium.runtime.model.ResponsePattern;
import org.vivarium.runtime.model.SelfState;
import org.vivarium.runtime.model.StateVector;
import org.vivarium.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Attributes delayed consequences to the actions that caused them.
 * <p>
 * Each registered action waits a randomly sampled number of ticks. Once due, the change of
 * the vital state since registration becomes a {@link FeedbackRecord}, unless the change is
 * below the noise floor. Actions that are never resolved are dropped after the timeout.
 * <p>
 * <b>Threading:</b> not thread-safe. Owned by the tick thread, like {@link SelfState}.
 */
public class FeedbackTracker {

    private static final Logger LOG = LoggerFactory.getLogger(FeedbackTracker.class);

    private final IRandomProvider random;
    private final FeedbackSettings settings;
    private final Clock clock;

    // Insertion order is registration order
    private final Map<String, PendingAction> pending = new LinkedHashMap<>();

    private long emittedCount;
    private long suppressedCount;
    private long timedOutCount;

    public FeedbackTracker(IRandomProvider random, FeedbackSettings settings) {
        this(random, settings, Clock.systemUTC());
    }

    public FeedbackTracker(IRandomProvider random, FeedbackSettings settings, Clock clock) {
        this.random = Objects.requireNonNull(random, "random");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Registers an action with a sampled attribution delay.
     *
     * @param actionId      Unique id of the action.
     * @param actionPattern The response taken.
     * @param stateBefore   Vital state before the action's impact.
     * @param timestamp     Registration time in epoch seconds.
     * @return {@code true} if registered, {@code false} if the id is already pending.
     */
    public boolean registerAction(String actionId, ResponsePattern actionPattern, StateVector stateBefore, double timestamp) {
        return registerAction(actionId, actionPattern, stateBefore, timestamp, List.of());
    }

    /**
     * Registers an action with a sampled attribution delay and the event types that triggered it.
     *
     * @param actionId         Unique id of the action.
     * @param actionPattern    The response taken.
     * @param stateBefore      Vital state before the action's impact.
     * @param timestamp        Registration time in epoch seconds.
     * @param associatedEvents Event types that triggered the action.
     * @return {@code true} if registered, {@code false} if the id is already pending.
     */
    public boolean registerAction(String actionId, ResponsePattern actionPattern, StateVector stateBefore,
                                  double timestamp, List<String> associatedEvents) {
        int span = settings.maxDelayTicks() - settings.minDelayTicks() + 1;
        int delay = settings.minDelayTicks() + random.nextInt(span);
        return registerAction(actionId, actionPattern, stateBefore, timestamp, associatedEvents, delay);
    }

    /**
     * Registers an action with an explicit attribution delay.
     *
     * @param actionId         Unique id of the action.
     * @param actionPattern    The response taken.
     * @param stateBefore      Vital state before the action's impact.
     * @param timestamp        Registration time in epoch seconds.
     * @param associatedEvents Event types that triggered the action.
     * @param checkAfterTicks  Ticks to wait before attribution.
     * @return {@code true} if registered, {@code false} if the id is already pending.
     */
    public boolean registerAction(String actionId, ResponsePattern actionPattern, StateVector stateBefore,
                                  double timestamp, List<String> associatedEvents, int checkAfterTicks) {
        if (pending.containsKey(actionId)) {
            LOG.debug("Action '{}' is already pending, ignoring duplicate registration", actionId);
            return false;
        }
        pending.put(actionId, new PendingAction(actionId, actionPattern, stateBefore, timestamp, checkAfterTicks, associatedEvents));
        return true;
    }

    /**
     * Advances every pending action by one tick and resolves the due ones.
     *
     * @param state The current organism state.
     * @return Records emitted this tick, in registration order.
     */
    public List<FeedbackRecord> observeConsequences(SelfState state) {
        return observeConsequences(state.vector());
    }

    /**
     * Advances every pending action by one tick and resolves the due ones.
     *
     * @param current The current vital state.
     * @return Records emitted this tick, in registration order.
     */
    public List<FeedbackRecord> observeConsequences(StateVector current) {
        if (pending.isEmpty()) {
            return List.of();
        }
        double now = clock.millis() / 1000.0;
        List<FeedbackRecord> records = new ArrayList<>();
        Iterator<PendingAction> it = pending.values().iterator();
        while (it.hasNext()) {
            PendingAction action = it.next();
            int waited = action.incrementTicksWaited();

            if (action.isDue()) {
                it.remove();
                StateVector delta = current.minus(action.getStateBefore());
                if (delta.maxAbsComponent() < settings.noiseFloor()) {
                    suppressedCount++;
                    LOG.debug("Action '{}' resolved below noise floor, no feedback", action.getActionId());
                    continue;
                }
                records.add(new FeedbackRecord(
                    action.getActionId(),
                    action.getActionPattern(),
                    action.getStateBefore(),
                    delta,
                    waited,
                    action.getAssociatedEvents(),
                    now));
                emittedCount++;
            } else if (waited > settings.timeoutTicks()) {
                it.remove();
                timedOutCount++;
                LOG.debug("Action '{}' timed out after {} ticks", action.getActionId(), waited);
            }
        }
        return records;
    }

    /**
     * @return the pending actions in registration order. The elements are the live entries
     *         and must not be modified.
     */
    public List<PendingAction> getPendingActions() {
        return List.copyOf(pending.values());
    }

    public int getPendingCount() {
        return pending.size();
    }

    public boolean isPending(String actionId) {
        return pending.containsKey(actionId);
    }

    /**
     * Replaces all pending actions, used when resuming from a snapshot.
     * @param restored Actions in registration order.
     */
    public void restore(List<PendingAction> restored) {
        pending.clear();
        for (PendingAction action : restored) {
            pending.putIfAbsent(action.getActionId(), action);
        }
    }

    public void clear() {
        pending.clear();
    }

    public long getEmittedCount() {
        return emittedCount;
    }

    public long getSuppressedCount() {
        return suppressedCount;
    }

    public long getTimedOutCount() {
        return timedOutCount;
    }

    public FeedbackSettings getSettings() {
        return settings;
    }
}
