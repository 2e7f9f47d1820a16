package io.agentcron.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.Optional;

/**
 * Evaluates job time-specs against local date-times.
 * <p>
 * Format: {@code "<hour> <day> <month> <weekday>"}, separated by whitespace. Each field is one of:
 * <ul>
 *   <li>{@code *}: any value</li>
 *   <li>{@code 6,8,10}: one of the listed values</li>
 *   <li>{@code 1-5}: inclusive range</li>
 *   <li>{@code 9}: exact value</li>
 * </ul>
 * Weekday is numbered 0=Sunday through 6=Saturday.
 * <p>
 * Note: a field mixing list and range syntax (e.g. {@code "1-3,5"}) is evaluated as a list, whose
 * {@code "1-3"} element is not a number, so the field never matches. The same holds for any list
 * with an empty or non-numeric element ({@code "5,"}, {@code "0,abc"}), whatever its other elements.
 * <p>
 * Examples:
 * <ul>
 *   <li>{@code "6,8 * * *"}: every day at 06 and 08</li>
 *   <li>{@code "20 * * 0"}: Sundays at 20</li>
 *   <li>{@code "9 1 * *"}: 09 on the first day of each month</li>
 *   <li>{@code "14 * * 1-5"}: weekdays at 14</li>
 * </ul>
 */
public final class TimeSpecMatcher {
    private static final Logger log = LoggerFactory.getLogger(TimeSpecMatcher.class);

    private TimeSpecMatcher() {
    }

    /**
     * Split a raw spec into its four fields.
     *
     * @throws IllegalArgumentException when the spec is blank or does not have exactly four fields
     */
    public static TimeSpec parse(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new IllegalArgumentException("time-spec must not be blank");
        }
        String[] parts = spec.trim().split("\\s+");
        if (parts.length != 4) {
            throw new IllegalArgumentException("time-spec must have 4 fields (hour day month weekday): " + spec);
        }
        return new TimeSpec(parts[0], parts[1], parts[2], parts[3]);
    }

    /**
     * Returns true if the spec matches {@code at}. Malformed specs never match and never throw.
     */
    public static boolean matches(String spec, LocalDateTime at) {
        try {
            return matches(parse(spec), at);
        } catch (IllegalArgumentException e) {
            log.warn("invalid time-spec, treating as non-matching spec={} msg={}", spec, e.getMessage());
            return false;
        }
    }

    /**
     * @throws NumberFormatException when a field holds a non-numeric value
     */
    public static boolean matches(TimeSpec spec, LocalDateTime at) {
        return matchField(spec.hour(), at.getHour())
                && matchField(spec.day(), at.getDayOfMonth())
                && matchField(spec.month(), at.getMonthValue())
                && matchField(spec.weekday(), weekdayOf(at));
    }

    public static boolean matchField(String field, int value) {
        if ("*".equals(field)) {
            return true;
        }

        if (field.contains(",")) {
            // every element is parsed before membership is checked, so one bad element fails the field
            int[] values = Arrays.stream(field.split(",", -1))
                    .map(String::trim)
                    .mapToInt(Integer::parseInt)
                    .toArray();
            return Arrays.stream(values).anyMatch(v -> v == value);
        }

        if (field.contains("-")) {
            String[] bounds = field.split("-", -1);
            if (bounds.length != 2) {
                throw new NumberFormatException("invalid range: " + field);
            }
            int start = Integer.parseInt(bounds[0].trim());
            int end = Integer.parseInt(bounds[1].trim());
            return start <= value && value <= end;
        }

        return Integer.parseInt(field.trim()) == value;
    }

    /**
     * Day of week numbered 0=Sunday .. 6=Saturday.
     */
    public static int weekdayOf(LocalDateTime at) {
        return at.getDayOfWeek().getValue() % 7;
    }

    /**
     * Returns true if the spec has four fields and every integer in every field parses.
     */
    public static boolean isValid(String spec) {
        try {
            TimeSpec ts = parse(spec);
            checkField(ts.hour());
            checkField(ts.day());
            checkField(ts.month());
            checkField(ts.weekday());
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Parses every integer of a field without evaluating it.
     *
     * @throws NumberFormatException when an element, bound or value is not an integer
     */
    static void checkField(String field) {
        if ("*".equals(field)) {
            return;
        }
        if (field.contains(",")) {
            for (String v : field.split(",", -1)) {
                Integer.parseInt(v.trim());
            }
            return;
        }
        if (field.contains("-")) {
            String[] bounds = field.split("-", -1);
            if (bounds.length != 2) {
                throw new NumberFormatException("invalid range: " + field);
            }
            Integer.parseInt(bounds[0].trim());
            Integer.parseInt(bounds[1].trim());
            return;
        }
        Integer.parseInt(field.trim());
    }

    /**
     * First top of the hour at or after {@code from} that the spec matches, searching at most
     * {@code horizonHours} hours ahead.
     */
    public static Optional<LocalDateTime> nextMatch(String spec, LocalDateTime from, int horizonHours) {
        if (!isValid(spec)) {
            return Optional.empty();
        }
        TimeSpec ts = parse(spec);

        LocalDateTime candidate = from.truncatedTo(ChronoUnit.HOURS);
        if (candidate.isBefore(from)) {
            candidate = candidate.plusHours(1);
        }
        for (int i = 0; i < horizonHours; i++) {
            if (matches(ts, candidate)) {
                return Optional.of(candidate);
            }
            candidate = candidate.plusHours(1);
        }
        return Optional.empty();
    }
}
