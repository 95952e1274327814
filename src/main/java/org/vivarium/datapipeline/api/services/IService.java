package org.vivarium.datapipeline.api.services;

/**
 * A long-running component with its own thread and a start/pause/resume/stop lifecycle.
 */
public interface IService {

    enum State {
        STOPPED,
        RUNNING,
        PAUSED,
        ERROR
    }

    /**
     * Whether the service thread may be interrupted right now.
     */
    enum ShutdownPhase {
        /** Idle or waiting; an interrupt is harmless. */
        WAITING,
        /** Inside a unit of work that must complete; stop waits for it. */
        PROCESSING
    }

    /**
     * @throws IllegalStateException if the service is not stopped.
     */
    void start();

    /**
     * Requests a graceful stop and waits for the service thread up to the shutdown timeout.
     * @throws IllegalStateException if the service is neither running nor paused.
     */
    void stop();

    /**
     * @throws IllegalStateException if the service is not running.
     */
    void pause();

    /**
     * @throws IllegalStateException if the service is not paused.
     */
    void resume();

    State getCurrentState();

    ShutdownPhase getShutdownPhase();
}
