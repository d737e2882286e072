package buzztimer;
import java.util.concurrent.TimeUnit;

// Monotonic milliseconds, unaffected by wall-clock changes.
public interface Clock {

    long millis();

    static Clock system() {
        return () -> TimeUnit.NANOSECONDS.toMillis(System.nanoTime());
    }
}
