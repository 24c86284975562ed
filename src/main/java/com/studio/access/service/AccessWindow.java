package com.studio.access.service;

import java.time.Duration;
import java.time.Instant;

/**
 * Closed interval {@code [start, end]}. An {@code end} before {@code start} is an empty
 * window that contains nothing.
 */
public record AccessWindow(Instant start, Instant end) {

    public AccessWindow widen(Duration grace) {
        return new AccessWindow(start.minus(grace), end.plus(grace));
    }

    public boolean isEmpty() {
        return end.isBefore(start);
    }

    public boolean contains(Instant instant) {
        return !isEmpty() && !instant.isBefore(start) && !instant.isAfter(end);
    }
}
