package com.example.khaznati_backend.backend;

import com.example.khaznati_backend.exception.ThrottledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Flood-control window of one backend instance. Once tripped, {@link #checkOpen()} fails fast until the
 * advertised wait has passed.
 */
public class Cooldown {
    private static final Logger LOGGER = LoggerFactory.getLogger(Cooldown.class);

    private final String backendName;
    private final Clock clock;
    private volatile Instant until = Instant.EPOCH;

    public Cooldown(String backendName, Clock clock) {
        this.backendName = backendName;
        this.clock = clock;
    }

    public void checkOpen() {
        Duration remaining = remaining();
        if (!remaining.isZero()) {
            throw new ThrottledException(backendName, remaining);
        }
    }

    /** Opens (or extends) the window and returns the exception callers should see. */
    public ThrottledException trip(Duration wait) {
        Instant candidate = clock.instant().plus(wait);
        synchronized (this) {
            if (candidate.isAfter(until)) {
                until = candidate;
            }
        }
        LOGGER.warn("Backend cooldown backend={} wait={}s", backendName, wait.toSeconds());
        return new ThrottledException(backendName, wait);
    }

    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), until);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean isActive() {
        return !remaining().isZero();
    }
}
