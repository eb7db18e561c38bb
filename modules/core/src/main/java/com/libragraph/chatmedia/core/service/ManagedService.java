package com.libragraph.chatmedia.core.service;

/**
 * Contract for pipeline components with a managed lifecycle.
 * State transitions are reported as {@link ServiceStateChangedEvent}s.
 */
public interface ManagedService {

    enum State { STOPPED, STARTING, RUNNING, STOPPING, FAILED }

    String serviceId();

    State state();

    void start() throws Exception;

    void stop() throws Exception;

    void fail(Throwable cause);

    default boolean isRunning() {
        return state() == State.RUNNING;
    }
}
