package com.elementanchor.core;

import java.time.Duration;

/**
 * Raised by {@link Synchronizer} when every attempt within the wait budget failed with a
 * transient error. The last transient error is available as {@link #getCause()}.
 */
public class ElementTimeoutException extends AnchorException {

    private final Duration waited;
    private final int attempts;

    public ElementTimeoutException(Duration waited, int attempts, RuntimeException lastFailure) {
        super(String.format("Gave up after %d attempt(s) in %d ms: %s",
            attempts, waited.toMillis(), lastFailure.getMessage()), lastFailure);
        this.waited = waited;
        this.attempts = attempts;
    }

    public Duration getWaited() { return waited; }
    public int getAttempts()    { return attempts; }
}
