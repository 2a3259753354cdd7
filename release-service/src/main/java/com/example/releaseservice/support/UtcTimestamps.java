package com.example.releaseservice.support;

import com.example.releaseservice.exception.InvalidTimestampException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;

/**
 * Conversion of timestamps at the store boundary.
 *
 * <p>Everything written is converted to a UTC instant truncated to the
 * microsecond precision of the timestamp columns; everything read is handed
 * back as an {@link OffsetDateTime} at {@link ZoneOffset#UTC}. Timestamps
 * without zone information are rejected rather than guessed.
 */
public final class UtcTimestamps {

    private UtcTimestamps() {
    }

    public static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MICROS);
    }

    public static Instant normalize(Instant instant) {
        requireValue(instant);
        return instant.truncatedTo(ChronoUnit.MICROS);
    }

    public static Instant normalize(OffsetDateTime timestamp) {
        requireValue(timestamp);
        return normalize(timestamp.toInstant());
    }

    public static Instant normalize(ZonedDateTime timestamp) {
        requireValue(timestamp);
        return normalize(timestamp.toInstant());
    }

    /**
     * Naive timestamps carry no zone, so the instant they denote is unknown.
     *
     * @throws InvalidTimestampException always
     */
    public static Instant normalize(LocalDateTime timestamp) {
        throw new InvalidTimestampException(
            "Timestamp " + timestamp + " has no time zone; supply an offset or zone");
    }

    /**
     * Parses ISO-8601 text that carries an offset or zone,
     * e.g. {@code 2025-03-01T10:15:30+05:30} or {@code 2025-03-01T04:45:30Z}.
     */
    public static Instant normalize(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidTimestampException("Timestamp text is empty");
        }
        TemporalAccessor parsed;
        try {
            parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(
                text.trim(), ZonedDateTime::from, OffsetDateTime::from, LocalDateTime::from);
        } catch (DateTimeParseException ex) {
            throw new InvalidTimestampException("Cannot parse timestamp: " + text, ex);
        }
        if (parsed instanceof ZonedDateTime zoned) {
            return normalize(zoned);
        }
        if (parsed instanceof OffsetDateTime offset) {
            return normalize(offset);
        }
        return normalize((LocalDateTime) parsed);
    }

    public static OffsetDateTime denormalize(Instant raw) {
        if (raw == null) {
            return null;
        }
        return raw.atOffset(ZoneOffset.UTC);
    }

    public static OffsetDateTime denormalize(String raw) {
        if (raw == null) {
            return null;
        }
        return denormalize(normalize(raw));
    }

    private static void requireValue(Object timestamp) {
        if (timestamp == null) {
            throw new InvalidTimestampException("Timestamp is null");
        }
    }
}
