package com.elementanchor.support;

import org.openqa.selenium.support.ui.Sleeper;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * A clock that only moves when told to. Its {@link #sleeper()} advances the clock by
 * the requested duration instead of blocking, and remembers every pause.
 */
public class ManualClock extends Clock {

    private Instant now = Instant.parse("2024-01-01T00:00:00Z");
    private final List<Duration> sleeps = new ArrayList<>();

    public void advance(Duration d) {
        now = now.plus(d);
    }

    public Sleeper sleeper() {
        return d -> {
            sleeps.add(d);
            advance(d);
        };
    }

    public List<Duration> sleeps() {
        return sleeps;
    }

    public Duration totalSlept() {
        return sleeps.stream().reduce(Duration.ZERO, Duration::plus);
    }

    @Override public Instant instant()            { return now; }
    @Override public ZoneId getZone()             { return ZoneOffset.UTC; }
    @Override public Clock withZone(ZoneId zone)  { return this; }
}
