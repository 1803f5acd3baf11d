package com.helios.transform.core.action;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.time.temporal.Temporal;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Optional;

/**
 * formatDate and offsetDate over string values, backed by {@code java.time}.
 * Any parse, format or arithmetic failure is a no-op.
 */
public final class DateOperations {

    /**
     * ISO-8601 representations recognised when offsetDate has no explicit pattern,
     * tried in this order. The value is written back in the representation it was
     * recognised as.
     */
    private static final List<DateTimeFormatter> ISO_FORMATS = List.of(
            DateTimeFormatter.ISO_OFFSET_DATE_TIME,
            DateTimeFormatter.ISO_ZONED_DATE_TIME,
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ISO_LOCAL_DATE
    );

    private DateOperations() {
    }

    /**
     * Parses the value with {@code from} and writes it with {@code to}.
     */
    public static Optional<JsonNode> format(JsonNode value, DateTimeFormatter from, DateTimeFormatter to) {
        if (!value.isTextual()) {
            return Optional.empty();
        }
        Optional<Temporal> parsed = parse(value.textValue(), from);
        if (parsed.isEmpty()) {
            return Optional.empty();
        }
        return write(parsed.get(), to);
    }

    /**
     * Shifts a date or date-time by a signed amount. With a null {@code format} the
     * value must be one of the ISO-8601 representations.
     */
    public static Optional<JsonNode> offset(JsonNode value, long amount, ChronoUnit unit, DateTimeFormatter format) {
        if (!value.isTextual()) {
            return Optional.empty();
        }
        String text = value.textValue();
        if (format != null) {
            return parse(text, format).flatMap(t -> plus(t, amount, unit)).flatMap(t -> write(t, format));
        }
        for (DateTimeFormatter iso : ISO_FORMATS) {
            Optional<Temporal> parsed = parse(text, iso);
            if (parsed.isPresent()) {
                return plus(parsed.get(), amount, unit).flatMap(t -> write(t, iso));
            }
        }
        return Optional.empty();
    }

    static Optional<Temporal> parse(String text, DateTimeFormatter formatter) {
        try {
            TemporalAccessor parsed = formatter.parseBest(text,
                    ZonedDateTime::from,
                    OffsetDateTime::from,
                    LocalDateTime::from,
                    LocalDate::from,
                    Instant::from,
                    LocalTime::from);
            if (parsed instanceof Instant instant) {
                // Instants carry no calendar fields; pin them to UTC for formatting
                return Optional.of(instant.atOffset(ZoneOffset.UTC));
            }
            return Optional.of((Temporal) parsed);
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    private static Optional<Temporal> plus(Temporal temporal, long amount, ChronoUnit unit) {
        try {
            return Optional.of(temporal.plus(amount, unit));
        } catch (DateTimeException | ArithmeticException e) {
            // e.g. hours on a LocalDate
            return Optional.empty();
        }
    }

    private static Optional<JsonNode> write(Temporal temporal, DateTimeFormatter formatter) {
        try {
            return Optional.of(TextNode.valueOf(formatter.format(temporal)));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }
}
