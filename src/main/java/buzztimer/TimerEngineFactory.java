package buzztimer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class TimerEngineFactory {

    private static final Logger LOG = LoggerFactory.getLogger(TimerEngineFactory.class);

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder implements TimerEngine.Builder {
        private static final long DEFAULT_TICK_PERIOD_MILLIS = 100;
        private static final long DEFAULT_NOTIFY_INTERVAL_MILLIS = 1000;

        private long tickPeriodMillis = DEFAULT_TICK_PERIOD_MILLIS;
        private long notifyIntervalMillis = DEFAULT_NOTIFY_INTERVAL_MILLIS;
        private Clock clock;
        private TickScheduler tickScheduler;
        private Executor callbackExecutor;
        private EngineObserver observer = EngineObserver.NONE;
        private HapticAction hapticAction = HapticAction.NONE;
        private StatusDisplay statusDisplay = StatusDisplay.NONE;
        private BackgroundGuarantee backgroundGuarantee = BackgroundGuarantee.NONE;

        @Override
        public Builder tickPeriod(final long tickPeriod, final TimeUnit timeUnit) {
            if (timeUnit == null || tickPeriod <= 0 || timeUnit.toMillis(tickPeriod) <= 0) {
                throw new IllegalArgumentException("tickPeriod: illegal value.");
            }
            this.tickPeriodMillis = timeUnit.toMillis(tickPeriod);
            return this;
        }

        @Override
        public Builder notifyInterval(final long notifyInterval, final TimeUnit timeUnit) {
            if (timeUnit == null || notifyInterval < 0) {
                throw new IllegalArgumentException("notifyInterval: illegal value.");
            }
            this.notifyIntervalMillis = timeUnit.toMillis(notifyInterval);
            return this;
        }

        @Override
        public Builder clock(final Clock clock) {
            this.clock = requireNonNull(clock, "Clock");
            return this;
        }

        @Override
        public Builder tickScheduler(final TickScheduler tickScheduler) {
            this.tickScheduler = requireNonNull(tickScheduler, "Tick scheduler");
            return this;
        }

        @Override
        public Builder callbackExecutor(final Executor callbackExecutor) {
            this.callbackExecutor = requireNonNull(callbackExecutor, "Callback executor");
            return this;
        }

        @Override
        public Builder observer(final EngineObserver observer) {
            this.observer = requireNonNull(observer, "Observer");
            return this;
        }

        @Override
        public Builder hapticAction(final HapticAction hapticAction) {
            this.hapticAction = requireNonNull(hapticAction, "Haptic action");
            return this;
        }

        @Override
        public Builder statusDisplay(final StatusDisplay statusDisplay) {
            this.statusDisplay = requireNonNull(statusDisplay, "Status display");
            return this;
        }

        @Override
        public Builder backgroundGuarantee(final BackgroundGuarantee backgroundGuarantee) {
            this.backgroundGuarantee = requireNonNull(backgroundGuarantee, "Background guarantee");
            return this;
        }

        @Override
        public TimerEngine build() {
            final List<ExecutorService> ownedExecutors = new ArrayList<>();
            TickScheduler scheduler = tickScheduler;
            if (scheduler == null) {
                final ExecutorTickScheduler executorTickScheduler = new ExecutorTickScheduler();
                ownedExecutors.add(executorTickScheduler.executor());
                scheduler = executorTickScheduler;
            }
            Executor executor = callbackExecutor;
            if (executor == null) {
                final ExecutorService callbacks = Executors.newSingleThreadExecutor(runnable -> {
                    final Thread thread = new Thread(runnable, "buzztimer-callbacks");
                    thread.setDaemon(true);
                    return thread;
                });
                ownedExecutors.add(callbacks);
                executor = callbacks;
            }
            return new TimerEngineImpl(
                    clock != null ? clock : Clock.system(),
                    scheduler,
                    tickPeriodMillis,
                    new NotificationThrottle(notifyIntervalMillis),
                    new CallbackDispatcher(
                            executor, observer, hapticAction, statusDisplay, backgroundGuarantee),
                    ownedExecutors);
        }

        private static <T> T requireNonNull(final T value, final String what) {
            if (value == null) {
                throw new IllegalArgumentException(what + " cannot be null.");
            }
            return value;
        }
    }

    private final static class TimerEngineImpl implements TimerEngine {

        private final Clock clock;
        private final TickScheduler tickScheduler;
        private final long tickPeriodMillis;
        private final NotificationThrottle throttle;
        private final CallbackDispatcher dispatcher;
        private final List<ExecutorService> ownedExecutors;

        private final Object lock = new Object();

        private IntervalSequence sequence = IntervalSequence.empty();
        private Status status = Status.IDLE;
        private int currentIndex = -1;
        private long remainingMillis = 0;
        private long deadline = 0;
        private int lapCount = 0;
        private long lastNotifyAt = NotificationThrottle.NEVER;
        private long generation = 0;
        private boolean shutdown = false;
        private TickScheduler.ScheduledTick scheduledTick;

        private TimerEngineImpl(
                final Clock clock,
                final TickScheduler tickScheduler,
                final long tickPeriodMillis,
                final NotificationThrottle throttle,
                final CallbackDispatcher dispatcher,
                final List<ExecutorService> ownedExecutors) {
            this.clock = clock;
            this.tickScheduler = tickScheduler;
            this.tickPeriodMillis = tickPeriodMillis;
            this.throttle = throttle;
            this.dispatcher = dispatcher;
            this.ownedExecutors = Collections.unmodifiableList(ownedExecutors);
        }

        @Override
        public void setSequence(final IntervalSequence sequence) {
            if (sequence == null) {
                throw new IllegalArgumentException("Sequence cannot be null.");
            }
            synchronized (lock) {
                if (status == Status.RUNNING || status == Status.PAUSED) {
                    LOG.debug("Sequence change ignored while {}", status);
                    return;
                }
                this.sequence = sequence;
            }
        }

        @Override
        public void setObserver(final EngineObserver observer) {
            dispatcher.setObserver(observer);
        }

        @Override
        public void start() {
            synchronized (lock) {
                if (shutdown) {
                    LOG.debug("Start ignored, engine is shut down");
                    return;
                }
                if (status == Status.RUNNING) {
                    LOG.debug("Start ignored, already running");
                    return;
                }
                if (sequence.isEmpty()) {
                    LOG.debug("Start ignored, sequence is empty");
                    return;
                }
                disarm();
                final long startGeneration = generation;
                dispatcher.acquireBackgroundGuarantee();
                status = Status.RUNNING;
                lapCount = 0;
                lastNotifyAt = NotificationThrottle.NEVER;
                LOG.debug("Starting sequence {}", sequence);
                dispatcher.observe("onLapCountChanged", o -> o.onLapCountChanged(0));
                if (startGeneration != generation || status != Status.RUNNING) {
                    return;
                }
                enterInterval(0, clock.millis());
            }
        }

        @Override
        public void pause() {
            synchronized (lock) {
                if (status != Status.RUNNING) {
                    return;
                }
                final long now = clock.millis();
                disarm();
                remainingMillis = Math.max(0, deadline - now);
                status = Status.PAUSED;
                LOG.debug("Paused interval {} with {}ms left", currentIndex, remainingMillis);
                forceStatusRefresh(now);
                dispatcher.observe("onPaused", EngineObserver::onPaused);
            }
        }

        @Override
        public void resume() {
            synchronized (lock) {
                if (shutdown || status != Status.PAUSED || remainingMillis <= 0) {
                    return;
                }
                final long now = clock.millis();
                deadline = now + remainingMillis;
                status = Status.RUNNING;
                LOG.debug("Resumed interval {} with {}ms left", currentIndex, remainingMillis);
                arm();
                forceStatusRefresh(now);
                dispatcher.observe("onResumed", EngineObserver::onResumed);
            }
        }

        @Override
        public void stop() {
            synchronized (lock) {
                if (status == Status.IDLE) {
                    return;
                }
                if (status == Status.COMPLETED) {
                    status = Status.IDLE;
                    return;
                }
                disarm();
                status = Status.IDLE;
                currentIndex = -1;
                remainingMillis = 0;
                deadline = 0;
                LOG.debug("Stopped");
                tearDown();
            }
        }

        @Override
        public void reset() {
            synchronized (lock) {
                final boolean changed = status != Status.IDLE || lapCount != 0;
                stop();
                lastNotifyAt = NotificationThrottle.NEVER;
                if (!changed) {
                    return;
                }
                lapCount = 0;
                currentIndex = -1;
                LOG.debug("Reset");
                dispatcher.observe("onLapCountChanged", o -> o.onLapCountChanged(0));
                dispatcher.observe("onCurrentIntervalChanged", o -> o.onCurrentIntervalChanged(-1));
            }
        }

        @Override
        public Status getStatus() {
            synchronized (lock) {
                return status;
            }
        }

        @Override
        public boolean isRunning() {
            return getStatus() == Status.RUNNING;
        }

        @Override
        public IntervalSequence getSequence() {
            synchronized (lock) {
                return sequence;
            }
        }

        @Override
        public int getCurrentIndex() {
            synchronized (lock) {
                return currentIndex;
            }
        }

        @Override
        public Optional<Interval> getCurrentInterval() {
            synchronized (lock) {
                return currentInterval();
            }
        }

        @Override
        public long getRemainingMillis() {
            synchronized (lock) {
                if (status == Status.RUNNING) {
                    return Math.max(0, deadline - clock.millis());
                }
                return remainingMillis;
            }
        }

        @Override
        public int getLapCount() {
            synchronized (lock) {
                return lapCount;
            }
        }

        @Override
        public void shutdown() {
            synchronized (lock) {
                shutdown = true;
                stop();
            }
            for (final ExecutorService executor : ownedExecutors) {
                if (!awaitFullTermination(executor)) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }

        private void tick(final long armedGeneration) {
            synchronized (lock) {
                if (armedGeneration != generation || status != Status.RUNNING) {
                    return;
                }
                scheduledTick = null;
                final long now = clock.millis();
                remainingMillis = deadline - now;
                if (remainingMillis > 0) {
                    final long remaining = remainingMillis;
                    dispatcher.observe("onTick", o -> o.onTick(remaining));
                    if (armedGeneration != generation || status != Status.RUNNING) {
                        return;
                    }
                    if (throttle.shouldRefresh(now, lastNotifyAt)) {
                        dispatcher.refreshStatus(snapshot(), false);
                        lastNotifyAt = now;
                    }
                    arm();
                    return;
                }
                remainingMillis = 0;
                final int completed = currentIndex;
                LOG.debug("Interval {} complete, {}ms late", completed, now - deadline);
                dispatcher.pulse();
                dispatcher.observe("onIntervalComplete", o -> o.onIntervalComplete(completed));
                // Observers running inline may stop, pause or restart the engine from any callback.
                if (armedGeneration != generation || status != Status.RUNNING) {
                    return;
                }
                if (completed + 1 < sequence.size()) {
                    enterInterval(completed + 1, now);
                } else if (sequence.isCircular()) {
                    lapCount++;
                    final int laps = lapCount;
                    LOG.debug("Lap {} complete", laps);
                    dispatcher.observe("onLapCountChanged", o -> o.onLapCountChanged(laps));
                    if (armedGeneration != generation || status != Status.RUNNING) {
                        return;
                    }
                    enterInterval(0, now);
                } else {
                    complete();
                }
            }
        }

        private void enterInterval(final int index, final long now) {
            final Interval interval = sequence.get(index);
            currentIndex = index;
            remainingMillis = interval.getDurationMillis();
            deadline = now + remainingMillis;
            arm();
            final long armedGeneration = generation;
            forceStatusRefresh(now);
            if (armedGeneration != generation || status != Status.RUNNING) {
                return;
            }
            dispatcher.observe("onCurrentIntervalChanged", o -> o.onCurrentIntervalChanged(index));
        }

        private void complete() {
            LOG.debug("Sequence complete");
            disarm();
            status = Status.COMPLETED;
            currentIndex = -1;
            remainingMillis = 0;
            deadline = 0;
            final long completedGeneration = generation;
            dispatcher.observe("onSequenceComplete", EngineObserver::onSequenceComplete);
            if (completedGeneration != generation) {
                return;
            }
            tearDown();
        }

        private void tearDown() {
            dispatcher.releaseBackgroundGuarantee();
            dispatcher.clearStatus();
            dispatcher.observe("onStopped", EngineObserver::onStopped);
        }

        private void forceStatusRefresh(final long now) {
            dispatcher.refreshStatus(snapshot(), true);
            lastNotifyAt = now;
        }

        private StatusSnapshot snapshot() {
            return new StatusSnapshot(
                    status == Status.PAUSED,
                    currentInterval().map(Interval::getName).orElse(null),
                    remainingMillis);
        }

        private Optional<Interval> currentInterval() {
            if (currentIndex < 0 || currentIndex >= sequence.size()) {
                return Optional.empty();
            }
            return Optional.of(sequence.get(currentIndex));
        }

        private void arm() {
            cancelScheduledTick();
            final long armedGeneration = ++generation;
            scheduledTick = tickScheduler.schedule(() -> tick(armedGeneration), tickPeriodMillis);
        }

        private void disarm() {
            cancelScheduledTick();
            generation++;
        }

        private void cancelScheduledTick() {
            if (scheduledTick != null) {
                scheduledTick.cancel();
                scheduledTick = null;
            }
        }

        private boolean awaitFullTermination(final ExecutorService executor) {
            executor.shutdown();
            try {
                awaitTermination(executor);
            } catch (InterruptedException e) {
                executor.shutdownNow();
                return false;
            }
            return true;
        }

        private void awaitTermination(final ExecutorService executor) throws InterruptedException {
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                    executor.awaitTermination(60, TimeUnit.SECONDS);
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                throw e;
            }
        }
    }
}
