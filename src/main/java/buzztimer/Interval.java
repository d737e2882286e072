package buzztimer;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.jspecify.annotations.Nullable;

public final class Interval {

    private final long durationMillis;
    private final @Nullable String name;

    private Interval(final long durationMillis, final @Nullable String name) {
        if (durationMillis < 0) {
            throw new IllegalArgumentException("Interval duration cannot be negative.");
        }
        this.durationMillis = durationMillis;
        this.name = name;
    }

    public static Interval ofMillis(final long durationMillis) {
        return new Interval(durationMillis, null);
    }

    public static Interval ofMillis(final long durationMillis, final @Nullable String name) {
        return new Interval(durationMillis, name);
    }

    public static Interval of(final int minutes, final int seconds, final @Nullable String name) {
        if (minutes < 0 || seconds < 0) {
            throw new IllegalArgumentException("Interval duration cannot be negative.");
        }
        return new Interval(
                TimeUnit.MINUTES.toMillis(minutes) + TimeUnit.SECONDS.toMillis(seconds), name);
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    public @Nullable String getName() {
        return name;
    }

    public boolean hasName() {
        return name != null && !name.trim().isEmpty();
    }

    public String displayString() {
        final long totalSeconds = TimeUnit.MILLISECONDS.toSeconds(durationMillis);
        final String time = String.format("%dm %ds", totalSeconds / 60, totalSeconds % 60);
        return hasName() ? String.format("%s (%s)", name, time) : time;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Interval)) {
            return false;
        }
        final Interval other = (Interval) o;
        return durationMillis == other.durationMillis && Objects.equals(name, other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(durationMillis, name);
    }

    @Override
    public String toString() {
        return displayString();
    }
}
