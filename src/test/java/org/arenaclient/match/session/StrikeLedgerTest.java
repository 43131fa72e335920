package org.arenaclient.match.session;

import static org.assertj.core.api.Assertions.assertThat;

import org.arenaclient.match.model.PlayerSlot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class StrikeLedgerTest {

    @Test
    @DisplayName("Counts strikes per slot and remembers their steps")
    void countsPerSlot() {
        StrikeLedger ledger = new StrikeLedger(3);

        assertThat(ledger.record(PlayerSlot.PLAYER_2, 4)).isEqualTo(1);
        assertThat(ledger.record(PlayerSlot.PLAYER_2, 9)).isEqualTo(2);

        assertThat(ledger.count(PlayerSlot.PLAYER_1)).isZero();
        assertThat(ledger.steps(PlayerSlot.PLAYER_2)).containsExactly(4L, 9L);
        assertThat(ledger.hasReachedThreshold(PlayerSlot.PLAYER_2)).isFalse();

        ledger.record(PlayerSlot.PLAYER_2, 12);
        assertThat(ledger.hasReachedThreshold(PlayerSlot.PLAYER_2)).isTrue();
    }

    @Test
    @DisplayName("A zero threshold never forfeits")
    void zeroThreshold() {
        StrikeLedger ledger = new StrikeLedger(0);
        for (int step = 1; step <= 50; step++) {
            ledger.record(PlayerSlot.PLAYER_1, step);
        }

        assertThat(ledger.count(PlayerSlot.PLAYER_1)).isEqualTo(50);
        assertThat(ledger.hasReachedThreshold(PlayerSlot.PLAYER_1)).isFalse();
    }

    @Test
    @DisplayName("Returned step lists are snapshots")
    void stepsAreSnapshots() {
        StrikeLedger ledger = new StrikeLedger(2);
        var before = ledger.steps(PlayerSlot.PLAYER_1);

        ledger.record(PlayerSlot.PLAYER_1, 1);

        assertThat(before).isEmpty();
    }
}
