package buzztimer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Fires scheduled ticks as simulated time advances. Every firing can be made
 * late by a fixed delay to model a host that throttles periodic callbacks.
 */
public final class ManualTickScheduler implements TickScheduler {

    private final ManualClock clock;
    private final List<Pending> pending = new ArrayList<>();
    private long lateness = 0;
    private boolean honourCancel = true;

    public ManualTickScheduler(final ManualClock clock) {
        this.clock = clock;
    }

    public ManualTickScheduler lateness(final long lateness) {
        this.lateness = lateness;
        return this;
    }

    // A tick that is already running cannot be cancelled; this keeps cancelled ticks firing.
    public ManualTickScheduler ignoreCancel() {
        this.honourCancel = false;
        return this;
    }

    @Override
    public ScheduledTick schedule(final Runnable task, final long delayMillis) {
        final Pending tick = new Pending(task, clock.millis() + delayMillis + lateness);
        pending.add(tick);
        return () -> {
            if (honourCancel) {
                pending.remove(tick);
            }
        };
    }

    public int pendingCount() {
        return pending.size();
    }

    /** Fires the earliest pending tick without moving the clock. */
    public boolean runNextTick() {
        final Optional<Pending> next = earliest();
        if (!next.isPresent()) {
            return false;
        }
        pending.remove(next.get());
        next.get().task.run();
        return true;
    }

    public void advanceTo(final long target) {
        while (true) {
            final Optional<Pending> next = earliest().filter(p -> p.dueAt <= target);
            if (!next.isPresent()) {
                break;
            }
            pending.remove(next.get());
            if (next.get().dueAt > clock.millis()) {
                clock.set(next.get().dueAt);
            }
            next.get().task.run();
        }
        if (target > clock.millis()) {
            clock.set(target);
        }
    }

    public void advanceBy(final long millis) {
        advanceTo(clock.millis() + millis);
    }

    private Optional<Pending> earliest() {
        return pending.stream().min(Comparator.comparingLong(p -> p.dueAt));
    }

    private static final class Pending {
        private final Runnable task;
        private final long dueAt;

        private Pending(final Runnable task, final long dueAt) {
            this.task = task;
            this.dueAt = dueAt;
        }
    }
}
