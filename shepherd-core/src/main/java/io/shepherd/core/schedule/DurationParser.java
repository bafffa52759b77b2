package io.shepherd.core.schedule;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses compact duration strings such as {@code 24h}, {@code 5m}, {@code 1h30m},
 * {@code 1.5h} or {@code 500ms}. Units are {@code h}, {@code m}, {@code s}, {@code ms},
 * {@code us} (or {@code µs}) and {@code ns}; fractions finer than a nanosecond are truncated.
 */
final class DurationParser {

    private static final Pattern SEGMENT = Pattern.compile("(\\d+(?:\\.\\d*)?|\\.\\d+)(ns|us|µs|ms|h|m|s)");

    private DurationParser() {}

    static Duration parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Duration must not be blank");
        }
        String trimmed = text.trim();
        Matcher matcher = SEGMENT.matcher(trimmed);
        BigDecimal nanos = BigDecimal.ZERO;
        int position = 0;
        while (matcher.lookingAt()) {
            BigDecimal amount = new BigDecimal(matcher.group(1));
            nanos = nanos.add(amount.multiply(BigDecimal.valueOf(nanosPerUnit(matcher.group(2)))));
            position = matcher.end();
            matcher.region(position, matcher.regionEnd());
        }
        if (position == 0 || position != trimmed.length()) {
            throw new IllegalArgumentException("Invalid duration: " + text);
        }

        long total;
        try {
            total = nanos.toBigInteger().longValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Invalid duration: " + text + " (out of range)", e);
        }
        if (total <= 0) {
            throw new IllegalArgumentException("Duration must be positive: " + text);
        }
        return Duration.ofNanos(total);
    }

    private static long nanosPerUnit(String unit) {
        return switch (unit) {
            case "h" -> 3_600_000_000_000L;
            case "m" -> 60_000_000_000L;
            case "s" -> 1_000_000_000L;
            case "ms" -> 1_000_000L;
            case "us", "µs" -> 1_000L;
            default -> 1L;
        };
    }
}
