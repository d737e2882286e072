package buzztimer;

public interface TickScheduler {

    ScheduledTick schedule(final Runnable task, final long delayMillis);

    interface ScheduledTick {
        void cancel();
    }
}
