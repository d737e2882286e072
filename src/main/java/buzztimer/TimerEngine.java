package buzztimer;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

public interface TimerEngine {

    public enum Status {
        IDLE,
        RUNNING,
        PAUSED,
        COMPLETED
    }

    void setSequence(final IntervalSequence sequence);
    void setObserver(final EngineObserver observer);
    void start();
    void pause();
    void resume();
    void stop();
    void reset();

    Status getStatus();
    boolean isRunning();
    IntervalSequence getSequence();
    int getCurrentIndex();
    Optional<Interval> getCurrentInterval();
    long getRemainingMillis();
    int getLapCount();

    void shutdown();

    public interface Builder {
        Builder tickPeriod(final long tickPeriod, final TimeUnit timeUnit);
        Builder notifyInterval(final long notifyInterval, final TimeUnit timeUnit);
        Builder clock(final Clock clock);
        Builder tickScheduler(final TickScheduler tickScheduler);
        Builder callbackExecutor(final Executor callbackExecutor);
        Builder observer(final EngineObserver observer);
        Builder hapticAction(final HapticAction hapticAction);
        Builder statusDisplay(final StatusDisplay statusDisplay);
        Builder backgroundGuarantee(final BackgroundGuarantee backgroundGuarantee);
        TimerEngine build();
    }
}
