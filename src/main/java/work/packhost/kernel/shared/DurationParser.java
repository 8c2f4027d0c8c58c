package work.packhost.kernel.shared;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses durations written in configuration files and workflow steps ({@code 250ms}, {@code 30s},
 * {@code 2m}, {@code 1h}). A bare number is read as milliseconds.
 */
public final class DurationParser {
    private static final Pattern FORMAT = Pattern.compile("^(\\d+)(ms|s|m|h)?$");

    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        var trimmed = raw.trim().toLowerCase(Locale.ROOT);
        var matcher = FORMAT.matcher(trimmed);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid duration: " + raw);
        }
        long amount;
        try {
            amount = Long.parseLong(matcher.group(1));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Duration out of range: " + raw, ex);
        }
        var unit = matcher.group(2) == null ? "ms" : matcher.group(2);
        return Optional.of(switch (unit) {
            case "s" -> Duration.ofSeconds(amount);
            case "m" -> Duration.ofMinutes(amount);
            case "h" -> Duration.ofHours(amount);
            default -> Duration.ofMillis(amount);
        });
    }

    public static Duration parseOrDefault(String raw, Duration fallback) {
        return parse(raw).orElse(fallback);
    }
}
