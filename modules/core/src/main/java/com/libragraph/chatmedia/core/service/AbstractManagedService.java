package com.libragraph.chatmedia.core.service;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import org.jboss.logging.Logger;

/**
 * Base class for {@link ManagedService} implementations. Provides:
 * <ul>
 *   <li>Thread-safe state machine via {@link AtomicReference}</li>
 *   <li>A state listener notified on every transition</li>
 * </ul>
 * Services are plain objects owned by the pipeline facade; the CDI producer
 * bridges the listener to CDI events.
 * <p>
 * Subclasses implement {@link #doStart()} and {@link #doStop()}.
 */
public abstract class AbstractManagedService implements ManagedService {

    private final AtomicReference<State> state = new AtomicReference<>(State.STOPPED);

    private volatile Consumer<ServiceStateChangedEvent> stateListener = event -> { };

    protected final Logger log = Logger.getLogger(getClass());

    // -- template methods for subclasses --

    protected abstract void doStart() throws Exception;

    protected abstract void doStop() throws Exception;

    // -- ManagedService contract --

    @Override
    public State state() {
        return state.get();
    }

    public void setStateListener(Consumer<ServiceStateChangedEvent> listener) {
        this.stateListener = Objects.requireNonNull(listener);
    }

    @Override
    public void start() throws Exception {
        if (state.get() == State.RUNNING) {
            return; // idempotent
        }

        transition(State.STARTING);
        try {
            doStart();
            transition(State.RUNNING);
        } catch (Exception e) {
            fail(e);
            throw e;
        }
    }

    @Override
    public void stop() throws Exception {
        if (state.get() == State.STOPPED) {
            return; // idempotent
        }

        transition(State.STOPPING);
        try {
            doStop();
            transition(State.STOPPED);
        } catch (Exception e) {
            fail(e);
            throw e;
        }
    }

    @Override
    public void fail(Throwable cause) {
        State old = state.get();
        if (old == State.FAILED) {
            return; // already failed
        }
        log.errorf("Service '%s' failed (was %s): %s", serviceId(), old, cause.getMessage());
        transition(State.FAILED);
    }

    /**
     * Throws unless the service is running.
     */
    protected void requireRunning() {
        State current = state.get();
        if (current != State.RUNNING) {
            throw new IllegalStateException("Service '" + serviceId() + "' is " + current);
        }
    }

    // -- internals --

    private void transition(State newState) {
        State old = state.getAndSet(newState);
        log.infof("Service '%s': %s -> %s", serviceId(), old, newState);
        stateListener.accept(new ServiceStateChangedEvent(
                serviceId(), old, newState, Instant.now()));
    }
}
