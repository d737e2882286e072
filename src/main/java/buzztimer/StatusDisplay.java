package buzztimer;

public interface StatusDisplay {

    StatusDisplay NONE = new StatusDisplay() {
        @Override
        public void refresh(final StatusSnapshot snapshot, final boolean forced) {}

        @Override
        public void clear() {}
    };

    void refresh(final StatusSnapshot snapshot, final boolean forced);

    void clear();
}
