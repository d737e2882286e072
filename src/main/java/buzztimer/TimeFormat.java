package buzztimer;
import java.util.concurrent.TimeUnit;

public final class TimeFormat {

    private TimeFormat() {}

    // Rounds to the nearest second so a countdown shows 00:01 until the last half second.
    public static String format(final long remainingMillis) {
        final long rounded = Math.max(0, remainingMillis) + 500;
        final long minutes = TimeUnit.MILLISECONDS.toMinutes(rounded);
        final long seconds = TimeUnit.MILLISECONDS.toSeconds(rounded) % 60;
        return String.format("%02d:%02d", minutes, seconds);
    }
}
