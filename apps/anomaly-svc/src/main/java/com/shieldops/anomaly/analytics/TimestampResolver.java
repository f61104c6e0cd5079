package com.shieldops.anomaly.analytics;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the timestamp of a point from the optional list sent alongside the
 * values. Entries are ISO-8601, with either {@code T} or a single space between
 * date and time; zoneless date-times and bare dates are read as UTC. A missing or unparseable entry resolves to the current time.
 */
class TimestampResolver {

    private static final Logger log = LoggerFactory.getLogger(TimestampResolver.class);

    private final Clock clock;

    TimestampResolver(Clock clock) {
        this.clock = clock;
    }

    Instant resolve(List<String> timestamps, int index) {
        if (index >= timestamps.size()) {
            return clock.instant();
        }
        String raw = timestamps.get(index);
        if (raw == null || raw.isBlank()) {
            return clock.instant();
        }
        try {
            return parse(raw.trim());
        } catch (DateTimeParseException ex) {
            log.debug("Timestamp '{}' at index {} is not parseable, using current time", raw, index);
            return clock.instant();
        }
    }

    private static Instant parse(String value) {
        if (value.length() == 10) {
            return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        if (value.length() > 10 && value.charAt(10) == ' ') {
            value = value.substring(0, 10) + 'T' + value.substring(11);
        }
        TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(value, OffsetDateTime::from, LocalDateTime::from);
        if (parsed instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.toInstant();
        }
        return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
    }
}
