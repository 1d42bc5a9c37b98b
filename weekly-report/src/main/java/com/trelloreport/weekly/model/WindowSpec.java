package com.trelloreport.weekly.model;

import com.trelloreport.weekly.exception.InvalidWindowException;

import java.time.Instant;
import java.util.Objects;

/**
 * Reporting window in UTC, inclusive at both ends.
 */
public record WindowSpec(Instant startInstant, Instant endInstant) {

    public WindowSpec {
        Objects.requireNonNull(startInstant, "startInstant");
        Objects.requireNonNull(endInstant, "endInstant");
        if (startInstant.isAfter(endInstant)) {
            throw new InvalidWindowException(
                    "Window start " + startInstant + " is after window end " + endInstant);
        }
    }

    public boolean contains(Instant instant) {
        return instant != null && !instant.isBefore(startInstant) && !instant.isAfter(endInstant);
    }
}
