package buzztimer;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// The executor must run tasks one at a time.
final class CallbackDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(CallbackDispatcher.class);

    private final Executor executor;
    private final HapticAction hapticAction;
    private final StatusDisplay statusDisplay;
    private final BackgroundGuarantee backgroundGuarantee;
    private final AtomicBoolean guaranteeHeld = new AtomicBoolean();

    private volatile EngineObserver observer;

    CallbackDispatcher(
            final Executor executor,
            final EngineObserver observer,
            final HapticAction hapticAction,
            final StatusDisplay statusDisplay,
            final BackgroundGuarantee backgroundGuarantee) {
        this.executor = executor;
        this.observer = observer;
        this.hapticAction = hapticAction;
        this.statusDisplay = statusDisplay;
        this.backgroundGuarantee = backgroundGuarantee;
    }

    void setObserver(final EngineObserver observer) {
        this.observer = observer == null ? EngineObserver.NONE : observer;
    }

    // The target is bound now: events already posted stay with the observer they were meant for.
    void observe(final String event, final Consumer<EngineObserver> notification) {
        final EngineObserver target = observer;
        post(event, () -> notification.accept(target));
    }

    void pulse() {
        post("haptic pulse", hapticAction::pulse);
    }

    void refreshStatus(final StatusSnapshot snapshot, final boolean forced) {
        post("status refresh", () -> statusDisplay.refresh(snapshot, forced));
    }

    void clearStatus() {
        post("status clear", statusDisplay::clear);
    }

    void acquireBackgroundGuarantee() {
        post("background guarantee acquire", () -> {
            if (guaranteeHeld.get()) {
                return;
            }
            backgroundGuarantee.acquire();
            guaranteeHeld.set(true);
        });
    }

    void releaseBackgroundGuarantee() {
        post("background guarantee release", () -> {
            if (guaranteeHeld.compareAndSet(true, false)) {
                backgroundGuarantee.release();
            }
        });
    }

    private void post(final String what, final Runnable call) {
        try {
            executor.execute(() -> {
                try {
                    call.run();
                } catch (final RuntimeException e) {
                    LOG.warn("{} failed, continuing without it", what, e);
                }
            });
        } catch (final RejectedExecutionException e) {
            LOG.debug("{} dropped, callback executor is shut down", what);
        }
    }
}
