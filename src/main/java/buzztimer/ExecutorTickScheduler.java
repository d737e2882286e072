package buzztimer;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ExecutorTickScheduler implements TickScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(ExecutorTickScheduler.class);
    private static final ScheduledTick NOT_SCHEDULED = () -> {};

    private final ScheduledExecutorService executor;

    public ExecutorTickScheduler() {
        this(Executors.newSingleThreadScheduledExecutor(runnable -> {
            final Thread thread = new Thread(runnable, "buzztimer-tick");
            thread.setDaemon(true);
            return thread;
        }));
    }

    public ExecutorTickScheduler(final ScheduledExecutorService executor) {
        if (executor == null) {
            throw new IllegalArgumentException("Executor cannot be null.");
        }
        this.executor = executor;
    }

    @Override
    public ScheduledTick schedule(final Runnable task, final long delayMillis) {
        final ScheduledFuture<?> future;
        try {
            future = executor.schedule(task, Math.max(0, delayMillis), TimeUnit.MILLISECONDS);
        } catch (final RejectedExecutionException e) {
            LOG.debug("Tick not scheduled, scheduler is shut down");
            return NOT_SCHEDULED;
        }
        return () -> future.cancel(false);
    }

    public ScheduledExecutorService executor() {
        return executor;
    }
}
