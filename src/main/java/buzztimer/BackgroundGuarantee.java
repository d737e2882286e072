package buzztimer;

public interface BackgroundGuarantee {

    BackgroundGuarantee NONE = new BackgroundGuarantee() {
        @Override
        public void acquire() {}

        @Override
        public void release() {}
    };

    void acquire();

    void release();
}
