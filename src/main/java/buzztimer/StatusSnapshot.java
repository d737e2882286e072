package buzztimer;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

public final class StatusSnapshot {

    static final String PAUSED_TITLE = "Paused";
    static final String DEFAULT_TITLE = "BuzzTimer";

    private final boolean paused;
    private final @Nullable String intervalName;
    private final long remainingMillis;

    public StatusSnapshot(final boolean paused, final @Nullable String intervalName, final long remainingMillis) {
        this.paused = paused;
        this.intervalName = intervalName;
        this.remainingMillis = remainingMillis;
    }

    public boolean isPaused() {
        return paused;
    }

    public @Nullable String getIntervalName() {
        return intervalName;
    }

    public long getRemainingMillis() {
        return remainingMillis;
    }

    public String title() {
        if (paused) {
            return PAUSED_TITLE;
        }
        return intervalName == null || intervalName.trim().isEmpty() ? DEFAULT_TITLE : intervalName;
    }

    public String text() {
        final String time = TimeFormat.format(remainingMillis);
        return paused ? time : String.format("%s remaining", time);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StatusSnapshot)) {
            return false;
        }
        final StatusSnapshot other = (StatusSnapshot) o;
        return paused == other.paused
                && remainingMillis == other.remainingMillis
                && Objects.equals(intervalName, other.intervalName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(paused, intervalName, remainingMillis);
    }

    @Override
    public String toString() {
        return String.format("%s: %s", title(), text());
    }
}
