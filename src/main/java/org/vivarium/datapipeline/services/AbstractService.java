package org.vivarium.datapipeline.services;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.vivarium.datapipeline.api.resources.IMonitorable;
import org.vivarium.datapipeline.api.resources.OperationalError;
import org.vivarium.datapipeline.api.services.IService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Base class for services running on a dedicated thread, with lifecycle management and
 * error tracking. Subclasses implement {@link #run()}.
 * <p>
 * <b>Shutdown:</b> {@link #stop()} sets the stop flag and, while the service is in
 * {@link ShutdownPhase#WAITING}, interrupts its thread. A service in
 * {@link ShutdownPhase#PROCESSING} is given the shutdown timeout to finish the current unit of
 * work before it is interrupted.
 * <p>
 * <b>Errors:</b> transient failures go to {@link #recordError(String, String, String)} and make
 * the service unhealthy; an exception escaping {@link #run()} moves it to {@link State#ERROR}.
 */
public abstract class AbstractService implements IService, IMonitorable {

    protected final Logger log = LoggerFactory.getLogger(this.getClass());
    protected final String serviceName;
    protected final Config options;
    private final AtomicReference<State> currentState = new AtomicReference<>(State.STOPPED);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final Object pauseLock = new Object();
    private final int shutdownTimeoutSeconds;
    private volatile ShutdownPhase currentShutdownPhase = ShutdownPhase.WAITING;
    private Thread serviceThread;

    // Bounded by getMaxErrors(); oldest entries are dropped
    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();

    /**
     * @param name    Service name, also used as the thread name.
     * @param options Service configuration; {@code shutdownTimeout} (seconds, default 5) is read here.
     */
    protected AbstractService(String name, Config options) {
        this.serviceName = name;
        this.options = options;
        this.shutdownTimeoutSeconds = options.hasPath("shutdownTimeout")
            ? options.getInt("shutdownTimeout")
            : 5;
    }

    protected int getMaxErrors() {
        return 1000;
    }

    @Override
    public final void start() {
        if (!currentState.compareAndSet(State.STOPPED, State.RUNNING)) {
            throw new IllegalStateException(String.format("Cannot start service '%s' as it is already in state %s", serviceName, getCurrentState()));
        }
        stopRequested.set(false);
        serviceThread = new Thread(this::runService);
        serviceThread.setName(serviceName);
        serviceThread.start();
        logStarted();
    }

    /**
     * Logs the startup. Services override this to report their configuration.
     */
    protected void logStarted() {
        log.info("{} started", this.getClass().getSimpleName());
    }

    @Override
    public final void stop() {
        State state = getCurrentState();
        if (state != State.RUNNING && state != State.PAUSED) {
            throw new IllegalStateException(String.format("Cannot stop service '%s' as it is in state %s", serviceName, state));
        }
        stopRequested.set(true);
        if (state == State.PAUSED) {
            synchronized (pauseLock) {
                pauseLock.notifyAll();
            }
        }

        if (serviceThread != null) {
            try {
                if (getShutdownPhase() == ShutdownPhase.WAITING) {
                    serviceThread.interrupt();
                }
                long deadline = System.currentTimeMillis() + shutdownTimeoutSeconds * 1000L;
                while (serviceThread.isAlive() && System.currentTimeMillis() < deadline) {
                    serviceThread.join(50);
                }
                if (serviceThread.isAlive()) {
                    log.warn("{} did not stop within {}s, forcing interrupt",
                        this.getClass().getSimpleName(), shutdownTimeoutSeconds);
                    serviceThread.interrupt();
                    serviceThread.join(1000);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("{} interrupted while waiting for service shutdown", this.getClass().getSimpleName());
            }

            if (serviceThread.isAlive()) {
                log.error("{} thread did not stop within {} seconds! Forcing ERROR state.",
                    this.getClass().getSimpleName(), shutdownTimeoutSeconds);
                currentState.set(State.ERROR);
                return;
            }
        }

        if (getCurrentState() != State.STOPPED && getCurrentState() != State.ERROR) {
            currentState.set(State.STOPPED);
        }
        log.info("{} stopped", this.getClass().getSimpleName());
    }

    @Override
    public final void pause() {
        if (!currentState.compareAndSet(State.RUNNING, State.PAUSED)) {
            throw new IllegalStateException(String.format("Cannot pause service '%s' as it is in state %s", serviceName, getCurrentState()));
        }
        log.info("{} paused", this.getClass().getSimpleName());
    }

    @Override
    public final void resume() {
        if (!currentState.compareAndSet(State.PAUSED, State.RUNNING)) {
            throw new IllegalStateException(String.format("Cannot resume service '%s' as it is in state %s", serviceName, getCurrentState()));
        }
        log.info("{} resumed", this.getClass().getSimpleName());
        synchronized (pauseLock) {
            pauseLock.notifyAll();
        }
    }

    @Override
    public State getCurrentState() {
        return currentState.get();
    }

    private void runService() {
        try {
            run();
        } catch (InterruptedException e) {
            log.debug("Service thread interrupted, shutting down.");
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error("{} stopped with ERROR due to {}",
                this.getClass().getSimpleName(),
                e.getClass().getSimpleName());
            log.debug("Exception details:", e);
            currentState.set(State.ERROR);
        } finally {
            if (getCurrentState() != State.ERROR) {
                currentState.set(State.STOPPED);
            }
            log.debug("Service thread for {} has terminated.", this.getClass().getSimpleName());
        }
    }

    /**
     * The service loop, executed on the service thread. It should return once
     * {@link #isStopRequested()} is set, call {@link #checkPause()} regularly, and bracket work
     * that must not be interrupted with {@link #setShutdownPhase(ShutdownPhase)}.
     * <p>
     * Transient errors: {@code log.warn} without the exception plus {@link #recordError}.
     * Fatal errors: throw; the service moves to {@link State#ERROR} and the stack trace is
     * logged at DEBUG.
     *
     * @throws InterruptedException if the service thread is interrupted.
     */
    protected abstract void run() throws InterruptedException;

    /**
     * Blocks while the service is paused.
     *
     * @throws InterruptedException if interrupted while waiting.
     */
    protected void checkPause() throws InterruptedException {
        synchronized (pauseLock) {
            while (getCurrentState() == State.PAUSED && !isStopRequested()) {
                log.debug("Service is paused, waiting...");
                pauseLock.wait();
            }
        }
    }

    protected boolean isStopRequested() {
        return stopRequested.get();
    }

    @Override
    public ShutdownPhase getShutdownPhase() {
        return currentShutdownPhase;
    }

    /**
     * Marks the start or end of work that must not be interrupted. When entering
     * {@link ShutdownPhase#PROCESSING}, clear a pending interrupt with {@code Thread.interrupted()}.
     *
     * @param phase The new phase.
     */
    protected void setShutdownPhase(ShutdownPhase phase) {
        this.currentShutdownPhase = phase;
    }

    /**
     * Records a transient error. Only for errors the service survives.
     *
     * @param code    Category, e.g. {@code "TICK_FAILED"}.
     * @param message Human-readable summary.
     * @param details Additional context.
     */
    protected void recordError(String code, String message, String details) {
        errors.add(new OperationalError(Instant.now(), code, message, details));
        int maxErrors = getMaxErrors();
        while (errors.size() > maxErrors) {
            errors.pollFirst();
        }
    }

    @Override
    public List<OperationalError> getErrors() {
        return new ArrayList<>(errors);
    }

    @Override
    public void clearErrors() {
        errors.clear();
    }

    /**
     * @return {@code false} in {@link State#ERROR} or while any error is recorded.
     */
    @Override
    public boolean isHealthy() {
        if (getCurrentState() == State.ERROR) {
            return false;
        }
        return errors.isEmpty();
    }

    /**
     * @return {@code error_count} followed by the metrics of {@link #addCustomMetrics(Map)}.
     */
    @Override
    public final Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("error_count", errors.size());
        addCustomMetrics(metrics);
        return metrics;
    }

    /**
     * Adds service-specific metrics. Overrides call {@code super.addCustomMetrics(metrics)} first.
     *
     * @param metrics Mutable map already holding the base metrics.
     */
    protected void addCustomMetrics(Map<String, Number> metrics) {
        // No custom metrics by default
    }
}
