package buzztimer;

public interface HapticAction {

    HapticAction NONE = () -> {};

    void pulse();
}
