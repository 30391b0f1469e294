package com.phillippitts.podscribe.service.scheduling;

import com.phillippitts.podscribe.domain.PassSummary;
import com.phillippitts.podscribe.exception.StateStoreException;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Outer loop around {@link PipelineService}: at most one pass in flight, ever.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * IDLE → RUNNING (first trigger)
 * RUNNING → SLEEPING (pass finished or failed)
 * SLEEPING → RUNNING (next trigger)
 * any → STOPPED (shutdown or fatal state store error)
 * </pre>
 *
 * <p>Triggers arriving while a pass runs are rejected, not queued.
 */
@Component
public class PassScheduler {

    private static final Logger LOG = LogManager.getLogger(PassScheduler.class);

    public enum State { IDLE, RUNNING, SLEEPING, STOPPED }

    private final PipelineService pipeline;
    private final FatalErrorHandler fatalErrorHandler;

    private final AtomicBoolean passInFlight = new AtomicBoolean(false);
    private final Lock stateLock = new ReentrantLock();
    private State state = State.IDLE;
    private volatile PassSummary lastSummary;
    private volatile long passCount;

    public PassScheduler(PipelineService pipeline, FatalErrorHandler fatalErrorHandler) {
        this.pipeline = pipeline;
        this.fatalErrorHandler = fatalErrorHandler;
    }

    /**
     * Runs one pass unless another is in flight or the scheduler is stopped.
     *
     * @return the pass summary, or empty when the trigger was rejected or the pass aborted
     */
    public Optional<PassSummary> trigger() {
        if (getState() == State.STOPPED) {
            LOG.debug("Scheduler stopped; ignoring trigger");
            return Optional.empty();
        }
        if (!passInFlight.compareAndSet(false, true)) {
            LOG.warn("Previous pass still running; skipping this trigger");
            return Optional.empty();
        }
        String passId = UUID.randomUUID().toString().substring(0, 8);
        transition(State.RUNNING);
        try {
            PassSummary summary = pipeline.runPass(passId);
            lastSummary = summary;
            passCount++;
            return Optional.of(summary);
        } catch (StateStoreException e) {
            LOG.fatal("State store failure in pass {}; stopping to avoid duplicate processing", passId, e);
            transition(State.STOPPED);
            fatalErrorHandler.onFatalError(e);
            return Optional.empty();
        } catch (RuntimeException e) {
            LOG.error("Pass {} aborted by unexpected error; retrying next interval", passId, e);
            return Optional.empty();
        } finally {
            passInFlight.set(false);
            transitionUnlessStopped(State.SLEEPING);
        }
    }

    @PreDestroy
    public void stop() {
        transition(State.STOPPED);
        LOG.info("Pass scheduler stopped after {} pass(es)", passCount);
    }

    public State getState() {
        stateLock.lock();
        try {
            return state;
        } finally {
            stateLock.unlock();
        }
    }

    public Optional<PassSummary> getLastSummary() {
        return Optional.ofNullable(lastSummary);
    }

    public long getPassCount() {
        return passCount;
    }

    public boolean isPassInFlight() {
        return passInFlight.get();
    }

    private void transition(State next) {
        stateLock.lock();
        try {
            LOG.debug("Scheduler {} -> {}", state, next);
            state = next;
        } finally {
            stateLock.unlock();
        }
    }

    private void transitionUnlessStopped(State next) {
        stateLock.lock();
        try {
            if (state != State.STOPPED) {
                state = next;
            }
        } finally {
            stateLock.unlock();
        }
    }
}
