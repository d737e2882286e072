package buzztimer;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import buzztimer.TimerEngine.Status;

class TimerEngineCollaboratorsTest {

    private ManualClock clock;
    private ManualTickScheduler scheduler;
    private RecordingObserver observer;
    private RecordingStatusDisplay display;
    private CountingGuarantee guarantee;
    private AtomicInteger pulses;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        scheduler = new ManualTickScheduler(clock);
        observer = new RecordingObserver();
        display = new RecordingStatusDisplay();
        guarantee = new CountingGuarantee();
        pulses = new AtomicInteger();
    }

    private TimerEngine engine(final Interval... intervals) {
        final TimerEngine engine = TimerEngineFactory.builder()
                .clock(clock)
                .tickScheduler(scheduler)
                .callbackExecutor(Runnable::run)
                .notifyInterval(1, TimeUnit.SECONDS)
                .observer(observer)
                .hapticAction(pulses::incrementAndGet)
                .statusDisplay(display)
                .backgroundGuarantee(guarantee)
                .build();
        engine.setSequence(IntervalSequence.of(Arrays.asList(intervals), false));
        return engine;
    }

    @Test
    void periodicStatusRefreshIsThrottled() {
        final TimerEngine engine = engine(Interval.ofMillis(10_000, "Work"));
        engine.start();
        assertThat(display.refreshes).containsExactly("forced:Work: 00:10 remaining");

        scheduler.advanceTo(3500);
        assertThat(display.periodic()).hasSize(3);
        assertThat(display.refreshTimes).containsExactly(0L, 1000L, 2000L, 3000L);
    }

    @Test
    void transitionsForceStatusRefresh() {
        final TimerEngine engine = engine(Interval.ofMillis(10_000, "Work"), Interval.ofMillis(5000));
        engine.start();
        scheduler.advanceTo(3500);
        display.clearRecords();

        engine.pause();
        assertThat(display.refreshes).containsExactly("forced:Paused: 00:07");

        clock.advance(60_000);
        engine.resume();
        assertThat(display.refreshes).endsWith("forced:Work: 00:07 remaining");

        display.clearRecords();
        scheduler.advanceBy(900);
        assertThat(display.refreshes).isEmpty();
        scheduler.advanceBy(100);
        assertThat(display.refreshes).hasSize(1);

        display.clearRecords();
        scheduler.advanceBy(6500);
        assertThat(display.refreshes).contains("forced:BuzzTimer: 00:05 remaining");

        engine.stop();
        assertThat(display.clears).isEqualTo(1);
    }

    @Test
    void hapticPulseOncePerIntervalCompletion() {
        final TimerEngine engine = engine(
                Interval.ofMillis(1000), Interval.ofMillis(1000), Interval.ofMillis(1000));
        engine.start();
        scheduler.advanceTo(10_000);

        assertThat(pulses.get()).isEqualTo(3);
    }

    @Test
    void backgroundGuaranteeHeldWhileActive() {
        final TimerEngine engine = engine(Interval.ofMillis(1000));
        engine.start();
        engine.start();
        assertThat(guarantee.acquired.get()).isEqualTo(1);

        engine.pause();
        engine.resume();
        assertThat(guarantee.released.get()).isZero();

        engine.stop();
        assertThat(guarantee.released.get()).isEqualTo(1);

        engine.start();
        scheduler.advanceTo(5000);
        assertThat(engine.getStatus()).isEqualTo(Status.COMPLETED);
        assertThat(guarantee.acquired.get()).isEqualTo(2);
        assertThat(guarantee.released.get()).isEqualTo(2);
        assertThat(display.clears).isEqualTo(2);
    }

    @Test
    void failingCollaboratorsNeverStopTheCountdown() {
        guarantee.failOnAcquire = true;
        final TimerEngine engine = TimerEngineFactory.builder()
                .clock(clock)
                .tickScheduler(scheduler)
                .callbackExecutor(Runnable::run)
                .observer(observer)
                .hapticAction(() -> {
                    throw new IllegalStateException("no vibrator");
                })
                .statusDisplay(new StatusDisplay() {
                    @Override
                    public void refresh(final StatusSnapshot snapshot, final boolean forced) {
                        throw new IllegalStateException("no notification manager");
                    }
                    @Override
                    public void clear() {
                        throw new IllegalStateException("no notification manager");
                    }
                })
                .backgroundGuarantee(guarantee)
                .build();
        engine.setSequence(IntervalSequence.of(
                Arrays.asList(Interval.ofMillis(1000), Interval.ofMillis(1000)), false));
        engine.start();
        scheduler.advanceTo(5000);

        assertThat(engine.getStatus()).isEqualTo(Status.COMPLETED);
        assertThat(observer.named("onIntervalComplete")).containsExactly(
                "onIntervalComplete:0", "onIntervalComplete:1");
        assertThat(observer.named("onSequenceComplete")).hasSize(1);
        assertThat(guarantee.released.get()).isZero();
    }

    private final class RecordingStatusDisplay implements StatusDisplay {
        private final List<String> refreshes = new ArrayList<>();
        private final List<Long> refreshTimes = new ArrayList<>();
        private int clears = 0;

        @Override
        public void refresh(final StatusSnapshot snapshot, final boolean forced) {
            refreshes.add(String.format("%s:%s", forced ? "forced" : "periodic", snapshot));
            refreshTimes.add(clock.millis());
        }

        @Override
        public void clear() {
            clears++;
        }

        private List<String> periodic() {
            final List<String> periodic = new ArrayList<>();
            for (final String refresh : refreshes) {
                if (refresh.startsWith("periodic:")) {
                    periodic.add(refresh);
                }
            }
            return periodic;
        }

        private void clearRecords() {
            refreshes.clear();
            refreshTimes.clear();
        }
    }

    private static final class CountingGuarantee implements BackgroundGuarantee {
        private final AtomicInteger acquired = new AtomicInteger();
        private final AtomicInteger released = new AtomicInteger();
        private boolean failOnAcquire = false;

        @Override
        public void acquire() {
            if (failOnAcquire) {
                throw new IllegalStateException("wake lock denied");
            }
            acquired.incrementAndGet();
        }

        @Override
        public void release() {
            released.incrementAndGet();
        }
    }
}
