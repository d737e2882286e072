package buzztimer;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class StatusSnapshotTest {

    @Test
    void runningSnapshotShowsIntervalName() {
        final StatusSnapshot snapshot = new StatusSnapshot(false, "Stretch", 61_400);
        assertThat(snapshot.title()).isEqualTo("Stretch");
        assertThat(snapshot.text()).isEqualTo("01:01 remaining");
    }

    @Test
    void unnamedIntervalFallsBackToApplicationName() {
        assertThat(new StatusSnapshot(false, null, 0).title()).isEqualTo(StatusSnapshot.DEFAULT_TITLE);
        assertThat(new StatusSnapshot(false, " ", 0).title()).isEqualTo(StatusSnapshot.DEFAULT_TITLE);
    }

    @Test
    void pausedSnapshotShowsFrozenTime() {
        final StatusSnapshot snapshot = new StatusSnapshot(true, "Stretch", 500);
        assertThat(snapshot.title()).isEqualTo(StatusSnapshot.PAUSED_TITLE);
        assertThat(snapshot.text()).isEqualTo("00:01");
    }
}
