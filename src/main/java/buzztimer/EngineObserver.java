package buzztimer;

public interface EngineObserver {

    EngineObserver NONE = new EngineObserver() {};

    default void onTick(final long remainingMillis) {}

    default void onIntervalComplete(final int index) {}

    default void onSequenceComplete() {}

    default void onLapCountChanged(final int lapCount) {}

    default void onCurrentIntervalChanged(final int index) {}

    default void onPaused() {}

    default void onResumed() {}

    default void onStopped() {}
}
