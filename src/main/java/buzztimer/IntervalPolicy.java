package buzztimer;
import org.jspecify.annotations.Nullable;

public final class IntervalPolicy {

    static final String ZERO_TIME_MESSAGE = "Time cannot be zero.";
    static final String NEGATIVE_TIME_MESSAGE = "Time cannot be negative.";
    static final String INVALID_TIME_MESSAGE = "Invalid time.";

    private IntervalPolicy() {}

    public static Interval validate(final int minutes, final int seconds, final @Nullable String name)
            throws Violation {
        if (minutes < 0 || seconds < 0) {
            throw new Violation(NEGATIVE_TIME_MESSAGE);
        }
        if (minutes == 0 && seconds == 0) {
            throw new Violation(ZERO_TIME_MESSAGE);
        }
        final String trimmed = name == null ? null : name.trim();
        return Interval.of(minutes, seconds, trimmed == null || trimmed.isEmpty() ? null : trimmed);
    }

    public static Interval parse(final String minutes, final String seconds, final @Nullable String name)
            throws Violation {
        final int parsedMinutes;
        final int parsedSeconds;
        try {
            parsedMinutes = minutes.trim().isEmpty() ? 0 : Integer.parseInt(minutes.trim());
            parsedSeconds = seconds.trim().isEmpty() ? 0 : Integer.parseInt(seconds.trim());
        } catch (final NumberFormatException e) {
            throw new Violation(INVALID_TIME_MESSAGE);
        }
        return validate(parsedMinutes, parsedSeconds, name);
    }

    public static class Violation extends Exception {
        private static final long serialVersionUID = 1L;

        public Violation(final String message) {
            super(message);
        }
    }
}
