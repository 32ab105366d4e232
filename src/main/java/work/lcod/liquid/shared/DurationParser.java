package work.lcod.liquid.shared;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses render timeouts written as {@code 250ms}, {@code 30s}, {@code 2m} or {@code 1h}; a bare
 * number is read as milliseconds.
 */
public final class DurationParser {
    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        long unit;
        if (value.endsWith("ms")) {
            unit = 1L;
            value = value.substring(0, value.length() - 2);
        } else if (value.endsWith("s")) {
            unit = 1_000L;
            value = value.substring(0, value.length() - 1);
        } else if (value.endsWith("m")) {
            unit = 60_000L;
            value = value.substring(0, value.length() - 1);
        } else if (value.endsWith("h")) {
            unit = 3_600_000L;
            value = value.substring(0, value.length() - 1);
        } else {
            unit = 1L;
        }
        long amount;
        try {
            amount = Long.parseLong(value.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid duration: " + raw, ex);
        }
        if (amount < 0) {
            throw new IllegalArgumentException("Duration must not be negative: " + raw);
        }
        return Optional.of(Duration.ofMillis(Math.multiplyExact(amount, unit)));
    }
}
