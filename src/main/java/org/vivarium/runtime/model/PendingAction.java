package org.vivarium.runtime.model;

import java.util.List;
import java.util.Objects;

/**
 * An action awaiting attribution of its consequences. Only {@link #getTicksWaited()} changes
 * after construction.
 */
public final class PendingAction {

    private final String actionId;
    private final ResponsePattern actionPattern;
    private final StateVector stateBefore;
    private final double timestamp;
    private final int checkAfterTicks;
    private final List<String> associatedEvents;
    private int ticksWaited;

    public PendingAction(String actionId, ResponsePattern actionPattern, StateVector stateBefore,
                         double timestamp, int checkAfterTicks, List<String> associatedEvents) {
        this(actionId, actionPattern, stateBefore, timestamp, checkAfterTicks, associatedEvents, 0);
    }

    public PendingAction(String actionId, ResponsePattern actionPattern, StateVector stateBefore,
                         double timestamp, int checkAfterTicks, List<String> associatedEvents, int ticksWaited) {
        this.actionId = Objects.requireNonNull(actionId, "actionId");
        this.actionPattern = Objects.requireNonNull(actionPattern, "actionPattern");
        this.stateBefore = Objects.requireNonNull(stateBefore, "stateBefore");
        this.timestamp = timestamp;
        if (checkAfterTicks < 1) {
            throw new IllegalArgumentException("checkAfterTicks must be >= 1, got " + checkAfterTicks);
        }
        this.checkAfterTicks = checkAfterTicks;
        this.associatedEvents = associatedEvents == null ? List.of() : List.copyOf(associatedEvents);
        this.ticksWaited = ticksWaited;
    }

    public String getActionId() {
        return actionId;
    }

    public ResponsePattern getActionPattern() {
        return actionPattern;
    }

    public StateVector getStateBefore() {
        return stateBefore;
    }

    public double getTimestamp() {
        return timestamp;
    }

    public int getCheckAfterTicks() {
        return checkAfterTicks;
    }

    public List<String> getAssociatedEvents() {
        return associatedEvents;
    }

    public int getTicksWaited() {
        return ticksWaited;
    }

    /**
     * @return the new number of ticks waited.
     */
    public int incrementTicksWaited() {
        return ++ticksWaited;
    }

    public boolean isDue() {
        return ticksWaited >= checkAfterTicks;
    }
}
