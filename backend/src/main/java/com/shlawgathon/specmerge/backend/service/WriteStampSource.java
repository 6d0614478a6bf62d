package com.shlawgathon.specmerge.backend.service;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Strictly increasing millisecond stamps for override writes.
 * Mongo keeps dates at millisecond precision, so two saves inside the same
 * millisecond must still get distinct, ordered stamps.
 */
@Component
public class WriteStampSource {

    private final Clock clock;
    private final AtomicLong lastMillis = new AtomicLong();

    public WriteStampSource(Clock clock) {
        this.clock = clock;
    }

    public Instant next() {
        long now = clock.millis();
        return Instant.ofEpochMilli(lastMillis.updateAndGet(last -> Math.max(now, last + 1)));
    }
}
