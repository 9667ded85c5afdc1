package com.keyhaven.store;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Timestamps are stored as ISO-8601 strings. */
public final class Timestamps {

    private static final Logger log = LoggerFactory.getLogger(Timestamps.class);

    private Timestamps() {
    }

    /**
     * Accepts ISO-8601 instants and offset-less local date-times, the latter read as UTC.
     * Returns {@code null} for {@code null} and for text in neither form.
     */
    public static Instant parse(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return parseLocal(value);
        }
    }

    private static Instant parseLocal(String value) {
        try {
            return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            log.warn("Ignoring unparseable timestamp '{}'", value);
            return null;
        }
    }
}
