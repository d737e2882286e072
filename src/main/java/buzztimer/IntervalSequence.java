package buzztimer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class IntervalSequence {

    private static final IntervalSequence EMPTY = new IntervalSequence(Collections.emptyList(), false);

    private final List<Interval> intervals;
    private final boolean circular;

    private IntervalSequence(final List<Interval> intervals, final boolean circular) {
        this.intervals = intervals;
        this.circular = circular;
    }

    public static IntervalSequence of(final List<Interval> intervals, final boolean circular) {
        if (intervals == null) {
            throw new IllegalArgumentException("Intervals cannot be null.");
        }
        final List<Interval> copy = new ArrayList<>(intervals.size());
        for (final Interval interval : intervals) {
            if (interval == null) {
                throw new IllegalArgumentException("Intervals cannot contain null.");
            }
            copy.add(interval);
        }
        return new IntervalSequence(Collections.unmodifiableList(copy), circular);
    }

    public static IntervalSequence empty() {
        return EMPTY;
    }

    public List<Interval> getIntervals() {
        return intervals;
    }

    public boolean isCircular() {
        return circular;
    }

    public boolean isEmpty() {
        return intervals.isEmpty();
    }

    public int size() {
        return intervals.size();
    }

    public Interval get(final int index) {
        return intervals.get(index);
    }

    public long totalMillis() {
        return intervals.stream().mapToLong(Interval::getDurationMillis).sum();
    }

    @Override
    public String toString() {
        return String.format("%s%s", intervals, circular ? " (circular)" : "");
    }
}
