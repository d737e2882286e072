package buzztimer;

public final class NotificationThrottle {

    public static final long NEVER = Long.MIN_VALUE;

    private final long minIntervalMillis;

    public NotificationThrottle(final long minIntervalMillis) {
        if (minIntervalMillis < 0) {
            throw new IllegalArgumentException("minIntervalMillis: illegal value.");
        }
        this.minIntervalMillis = minIntervalMillis;
    }

    public boolean shouldRefresh(final long now, final long lastNotifyAt) {
        if (lastNotifyAt == NEVER) {
            return true;
        }
        return now - lastNotifyAt >= minIntervalMillis;
    }
}
