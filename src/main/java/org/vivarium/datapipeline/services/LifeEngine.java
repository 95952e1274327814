package org.vivarium.datapipeline.services;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import org.vivarium.datapipeline.resources.queues.EventQueue;
import org.vivarium.runtime.TickEngine;
import org.vivarium.runtime.TickReport;
import org.vivarium.runtime.model.Event;
import org.vivarium.runtime.model.SelfState;
import org.vivarium.runtime.spi.IEventSource;

import com.typesafe.config.Config;

/**
 * Runs a {@link TickEngine} on the service thread.
 * <p>
 * Each iteration pulls {@code eventsPerTick} events from the event source into the queue,
 * drains the queue, runs one tick as a {@link ShutdownPhase#PROCESSING} unit, takes a snapshot
 * when one is due and then sleeps for the rest of {@code tickIntervalMs}. A stop request is
 * therefore honoured between ticks only.
 * <p>
 * Options: {@code tickSeconds} (simulated seconds per tick, default 1.0), {@code tickIntervalMs}
 * (wall-clock pacing, default 1000, 0 disables pacing), {@code eventsPerTick} (default 1),
 * {@code maxTicks} (0 runs until stopped), {@code stopWhenInactive} (default true),
 * {@code metricsWindowSeconds} (default 5).
 */
public class LifeEngine extends AbstractService {

    private final TickEngine engine;
    private final EventQueue queue;
    private final IEventSource eventSource;
    private final SnapshotManager snapshots;

    private final double tickSeconds;
    private final long tickIntervalMs;
    private final int eventsPerTick;
    private final long maxTicks;
    private final boolean stopWhenInactive;
    private final int metricsWindowSeconds;

    private final AtomicLong ticksRun = new AtomicLong();
    private final AtomicLong failedTicks = new AtomicLong();
    private final AtomicLong automatedActions = new AtomicLong();
    private volatile double energy;
    private volatile double stability;
    private volatile double integrity;
    private long lastMetricTime = System.currentTimeMillis();
    private long lastTickCount;
    private double ticksPerSecond;

    /**
     * @param name        Service name.
     * @param options     Service options, see class docs.
     * @param engine      The engine; owned by the service thread once started.
     * @param queue       Input queue shared with other producers.
     * @param eventSource Source polled every tick, or {@code null}.
     * @param snapshots   Snapshot policy, or {@code null} to run without snapshots.
     * @throws IllegalArgumentException if an option is out of range.
     */
    public LifeEngine(String name, Config options, TickEngine engine, EventQueue queue,
                      IEventSource eventSource, SnapshotManager snapshots) {
        super(name, options);
        this.engine = Objects.requireNonNull(engine, "engine");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.eventSource = eventSource;
        this.snapshots = snapshots;

        this.tickSeconds = options.hasPath("tickSeconds") ? options.getDouble("tickSeconds") : 1.0;
        this.tickIntervalMs = options.hasPath("tickIntervalMs") ? options.getLong("tickIntervalMs") : 1000L;
        this.eventsPerTick = options.hasPath("eventsPerTick") ? options.getInt("eventsPerTick") : 1;
        this.maxTicks = options.hasPath("maxTicks") ? options.getLong("maxTicks") : 0L;
        this.stopWhenInactive = !options.hasPath("stopWhenInactive") || options.getBoolean("stopWhenInactive");
        this.metricsWindowSeconds = options.hasPath("metricsWindowSeconds") ? options.getInt("metricsWindowSeconds") : 5;

        if (tickSeconds <= 0.0) {
            throw new IllegalArgumentException("tickSeconds must be > 0");
        }
        if (tickIntervalMs < 0 || eventsPerTick < 0 || maxTicks < 0) {
            throw new IllegalArgumentException("tickIntervalMs, eventsPerTick and maxTicks must be >= 0");
        }
        publishVitals(engine.getState());
    }

    @Override
    protected void logStarted() {
        log.info("LifeEngine started: tick={}s, interval={}ms, eventsPerTick={}, maxTicks={}, snapshots={}",
            tickSeconds, tickIntervalMs, eventsPerTick, maxTicks == 0 ? "unbounded" : maxTicks,
            snapshots == null ? "off" : "every " + snapshots.getPeriodTicks() + " ticks");
    }

    @Override
    protected void run() throws InterruptedException {
        while ((getCurrentState() == State.RUNNING || getCurrentState() == State.PAUSED)
                && !isStopRequested() && !Thread.currentThread().isInterrupted()) {
            checkPause();
            if (isStopRequested()) {
                break;
            }

            setShutdownPhase(ShutdownPhase.PROCESSING);
            Thread.interrupted();
            long started = System.currentTimeMillis();
            try {
                runOneTick();
            } finally {
                setShutdownPhase(ShutdownPhase.WAITING);
            }

            SelfState state = engine.getState();
            if (maxTicks > 0 && ticksRun.get() >= maxTicks) {
                log.info("{} reached maxTicks ({}) at tick {}", serviceName, maxTicks, state.getTicks());
                break;
            }
            if (stopWhenInactive && !state.isActive()) {
                log.info("Organism is no longer active at tick {}, stopping", state.getTicks());
                break;
            }

            long remaining = tickIntervalMs - (System.currentTimeMillis() - started);
            if (remaining > 0) {
                Thread.sleep(remaining);
            }
        }
        log.info("Life loop finished after {} ticks.", ticksRun.get());
    }

    private void runOneTick() {
        for (int i = 0; i < eventsPerTick && eventSource != null; i++) {
            Optional<Event> event = pollSource();
            event.ifPresent(queue::offer);
        }
        List<Event> events = queue.drainAll();

        TickReport report = engine.tick(tickSeconds, events);
        ticksRun.incrementAndGet();
        automatedActions.addAndGet(report.automatedActions());
        if (report.failed()) {
            failedTicks.incrementAndGet();
            log.warn("Tick {} failed: {}", report.tick(), report.error());
            recordError("TICK_FAILED", "Tick failed", String.format("Tick: %d, Error: %s", report.tick(), report.error()));
        }

        if (snapshots != null && snapshots.shouldSnapshot(engine.getState().getTicks())
                && !snapshots.maybeSnapshot(engine)) {
            recordError("SNAPSHOT_FAILED", "Snapshot failed",
                String.format("Tick: %d, Error: %s", report.tick(), snapshots.getLastOperationError()));
        }
        publishVitals(engine.getState());
    }

    private Optional<Event> pollSource() {
        try {
            return eventSource.next();
        } catch (RuntimeException e) {
            log.warn("Event source failed: {}", e.getMessage());
            recordError("EVENT_SOURCE_FAILED", "Event source failed", String.valueOf(e.getMessage()));
            return Optional.empty();
        }
    }

    private void publishVitals(SelfState state) {
        energy = state.getEnergy();
        stability = state.getStability();
        integrity = state.getIntegrity();
    }

    /**
     * Takes a final snapshot. Call only after the service has stopped.
     *
     * @return {@code true} if a snapshot was written.
     * @throws IllegalStateException if the service is still running.
     */
    public boolean snapshotNow() {
        State state = getCurrentState();
        if (state == State.RUNNING || state == State.PAUSED) {
            throw new IllegalStateException("Cannot snapshot while " + serviceName + " is " + state);
        }
        return snapshots != null && snapshots.snapshot(engine);
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);

        long now = System.currentTimeMillis();
        long windowMs = metricsWindowSeconds * 1000L;
        if (now - lastMetricTime > windowMs) {
            ticksPerSecond = (double) (ticksRun.get() - lastTickCount) * 1000.0 / (now - lastMetricTime);
            lastMetricTime = now;
            lastTickCount = ticksRun.get();
        }

        metrics.put("ticks_run", ticksRun.get());
        metrics.put("ticks_per_second", ticksPerSecond);
        metrics.put("failed_ticks", failedTicks.get());
        metrics.put("automated_actions", automatedActions.get());
        metrics.put("energy", energy);
        metrics.put("stability", stability);
        metrics.put("integrity", integrity);
        metrics.put("queue_size", queue.size());
        metrics.put("queue_dropped", queue.getDroppedCount());
        if (snapshots != null) {
            metrics.put("snapshots_written", snapshots.getSnapshotCount());
            metrics.put("snapshot_failures", snapshots.getFailureCount());
        }
    }

    public TickEngine getEngine() {
        return engine;
    }

    public EventQueue getQueue() {
        return queue;
    }

    public long getTicksRun() {
        return ticksRun.get();
    }
}
