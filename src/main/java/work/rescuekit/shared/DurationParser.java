package work.rescuekit.shared;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses module timeouts written as {@code 1500}, {@code 1500ms}, {@code 30s}, {@code 5m}, {@code 1h}
 * or ISO-8601 ({@code PT30S}). A bare number is milliseconds.
 */
public final class DurationParser {
    private static final Pattern SIMPLE = Pattern.compile("(\\d+)\\s*(ms|s|m|h)?");

    private DurationParser() {}

    /**
     * @return empty for {@code null} or blank input
     * @throws IllegalArgumentException when the value is not a non-negative duration
     */
    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        if (trimmed.startsWith("pt")) {
            try {
                Duration parsed = Duration.parse(trimmed.toUpperCase(Locale.ROOT));
                if (parsed.isNegative()) {
                    throw new IllegalArgumentException("Duration must not be negative: " + raw);
                }
                return Optional.of(parsed);
            } catch (DateTimeParseException ex) {
                throw new IllegalArgumentException("Invalid duration: " + raw, ex);
            }
        }
        Matcher matcher = SIMPLE.matcher(trimmed);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid duration: " + raw + " (expected e.g. 30s, 5m, 1h)");
        }
        long value = Long.parseLong(matcher.group(1));
        String unit = matcher.group(2) == null ? "ms" : matcher.group(2);
        switch (unit) {
            case "s":
                return Optional.of(Duration.ofSeconds(value));
            case "m":
                return Optional.of(Duration.ofMinutes(value));
            case "h":
                return Optional.of(Duration.ofHours(value));
            default:
                return Optional.of(Duration.ofMillis(value));
        }
    }

    /**
     * Like {@link #parse} but a zero duration also means "no limit".
     */
    public static Optional<Duration> parseLimit(String raw) {
        return parse(raw).filter(duration -> !duration.isZero());
    }
}
