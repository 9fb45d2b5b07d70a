package com.elementanchor.core;

import com.elementanchor.driver.Driver;
import com.elementanchor.driver.DriverException;
import org.openqa.selenium.support.ui.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Runs an action against the remote document, retrying transient failures until it
 * succeeds or the wait budget is spent.
 *
 * ## Retry policy
 *
 *   1. Transient failures are {@link ElementNotFoundException} and any
 *      {@link DriverException} whose kind the active driver lists in
 *      {@link Driver#invalidElementErrors()}. Everything else propagates at once.
 *   2. On a waiting driver the action is retried, after a pause of the configured
 *      retry interval and a refresh of the stale binding, until the deadline passes.
 *      The last transient failure is then surfaced as the cause of an
 *      {@link ElementTimeoutException}.
 *   3. On a non-waiting driver nothing can change by itself, so the action is retried
 *      only when the refresh actually replaced the binding and the deadline has not
 *      passed; otherwise the transient failure is rethrown as-is.
 *   4. Calls made while the same session is already synchronizing run the action once,
 *      directly. The outermost call owns the deadline.
 *
 * Not thread-safe: one Synchronizer serves one session's single flow of control.
 */
public class Synchronizer {

    private static final Logger log = LoggerFactory.getLogger(Synchronizer.class);

    private final Driver driver;
    private final AnchorConfig config;
    private final Clock clock;
    private final Sleeper sleeper;

    private boolean synchronizing = false;

    public Synchronizer(Driver driver, AnchorConfig config) {
        this(driver, config, Clock.systemUTC(), Sleeper.SYSTEM_SLEEPER);
    }

    public Synchronizer(Driver driver, AnchorConfig config, Clock clock, Sleeper sleeper) {
        this.driver  = Objects.requireNonNull(driver, "driver must not be null");
        this.config  = Objects.requireNonNull(config, "config must not be null");
        this.clock   = Objects.requireNonNull(clock, "clock must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    /** Synchronizes with the configured default wait time. */
    public <T> T synchronize(BooleanSupplier refresher, Supplier<T> action) {
        return synchronize(null, refresher, action);
    }

    /**
     * @param wait      wait budget; {@code null} means the configured default
     * @param refresher re-resolves the target's binding and reports whether it changed
     * @param action    the operation to run
     * @return the action's result, unchanged
     */
    public <T> T synchronize(Duration wait, BooleanSupplier refresher, Supplier<T> action) {
        if (synchronizing) {
            return action.get();
        }

        Duration budget = wait != null ? wait : config.getDefaultWaitTime();
        Instant start = clock.instant();
        Instant deadline = start.plus(budget);
        int attempts = 0;

        synchronizing = true;
        try {
            while (true) {
                attempts++;
                try {
                    return action.get();
                } catch (AnchorException e) {
                    if (!isTransient(e)) throw e;

                    if (driver.needsWaiting()) {
                        Instant now = clock.instant();
                        if (!now.isBefore(deadline)) {
                            Duration waited = Duration.between(start, now);
                            log.warn("Synchronizer: giving up after {} attempt(s) in {} ms — {}",
                                attempts, waited.toMillis(), e.getMessage());
                            throw new ElementTimeoutException(waited, attempts, e);
                        }
                        pause(Duration.between(now, deadline), start, attempts, e);
                        if (config.isAutomaticReload()) {
                            refresher.getAsBoolean();
                        }
                    } else {
                        boolean replaced = config.isAutomaticReload() && refresher.getAsBoolean();
                        if (!replaced) throw e;
                        if (!clock.instant().isBefore(deadline)) {
                            log.warn("Synchronizer: binding keeps being replaced; giving up after {} attempt(s) — {}",
                                attempts, e.getMessage());
                            throw e;
                        }
                    }
                    log.debug("Synchronizer: retrying after transient failure (attempt {}) — {}",
                        attempts, e.getMessage());
                }
            }
        } finally {
            synchronizing = false;
        }
    }

    /** Whether this synchronizer is currently inside a synchronize call. */
    public boolean isSynchronizing() {
        return synchronizing;
    }

    /**
     * True for the failures a retry can fix: lookups that found nothing yet, and driver
     * errors the active driver classifies as invalid element references.
     */
    public boolean isTransient(AnchorException e) {
        if (e instanceof ElementNotFoundException) return true;
        return e instanceof DriverException
            && driver.invalidElementErrors().contains(((DriverException) e).getKind());
    }

    private void pause(Duration remaining, Instant start, int attempts, AnchorException last) {
        Duration interval = config.getRetryInterval();
        Duration sleepFor = remaining.compareTo(interval) < 0 ? remaining : interval;
        try {
            sleeper.sleep(sleepFor);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ElementTimeoutException(Duration.between(start, clock.instant()), attempts, last);
        }
    }
}
