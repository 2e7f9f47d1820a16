package io.agentcron.utils;

/**
 * Parsed 4-field time-spec: {@code "<hour> <day> <month> <weekday>"}.
 * Fields keep their raw text and are evaluated by {@link TimeSpecMatcher#matchField}.
 */
public record TimeSpec(
        String hour,
        String day,
        String month,
        String weekday
) {
}
