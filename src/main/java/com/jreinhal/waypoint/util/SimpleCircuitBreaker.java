package com.jreinhal.waypoint.util;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimal CLOSED / OPEN / HALF_OPEN breaker for model calls. After {@code failureThreshold}
 * consecutive failures calls are refused for {@code openDuration}; then up to
 * {@code halfOpenMaxCalls} trial calls decide whether it closes again.
 */
public class SimpleCircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(SimpleCircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String name;
    private final int failureThreshold;
    private final int halfOpenMaxCalls;
    private final Duration openDuration;
    private final Clock clock;
    private final AtomicInteger failureCount = new AtomicInteger(0);
    private final AtomicInteger halfOpenCalls = new AtomicInteger(0);
    private volatile long openUntilEpochMs = 0L;
    private volatile State state = State.CLOSED;

    public SimpleCircuitBreaker(String name, int failureThreshold, Duration openDuration, int halfOpenMaxCalls,
            Clock clock) {
        this.name = name == null ? "llm" : name;
        this.failureThreshold = Math.max(1, failureThreshold);
        this.openDuration = openDuration == null ? Duration.ofSeconds(30) : openDuration;
        this.halfOpenMaxCalls = Math.max(1, halfOpenMaxCalls);
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public boolean allowRequest() {
        if (this.state == State.CLOSED) {
            return true;
        }
        long now = this.clock.millis();
        if (this.state == State.OPEN) {
            if (now < this.openUntilEpochMs) {
                return false;
            }
            synchronized (this) {
                if (this.state == State.OPEN && now >= this.openUntilEpochMs) {
                    this.state = State.HALF_OPEN;
                    this.halfOpenCalls.set(0);
                    log.info("Circuit '{}' half-open, allowing {} trial call(s)", this.name, this.halfOpenMaxCalls);
                }
            }
        }
        return this.halfOpenCalls.incrementAndGet() <= this.halfOpenMaxCalls;
    }

    public void recordSuccess() {
        if (this.state == State.CLOSED) {
            this.failureCount.set(0);
            return;
        }
        synchronized (this) {
            if (this.state != State.CLOSED) {
                log.info("Circuit '{}' closed after successful trial call", this.name);
            }
            this.state = State.CLOSED;
            this.failureCount.set(0);
            this.halfOpenCalls.set(0);
            this.openUntilEpochMs = 0L;
        }
    }

    public void recordFailure(Throwable error) {
        if (this.state == State.HALF_OPEN) {
            openCircuit(error);
            return;
        }
        if (this.failureCount.incrementAndGet() >= this.failureThreshold) {
            openCircuit(error);
        }
    }

    public State getState() {
        return this.state;
    }

    private void openCircuit(Throwable error) {
        synchronized (this) {
            this.state = State.OPEN;
            this.openUntilEpochMs = this.clock.millis() + this.openDuration.toMillis();
            this.failureCount.set(0);
            this.halfOpenCalls.set(0);
        }
        log.warn("Circuit '{}' opened for {}ms after: {}", this.name, this.openDuration.toMillis(),
                error == null ? "unknown" : error.getClass().getSimpleName());
    }
}
