package org.arenaclient.match.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

@Tag("unit")
class SessionStateTest {

    @Test
    @DisplayName("States advance strictly in order")
    void forwardOnly() {
        assertThat(SessionState.IDLE.canTransitionTo(SessionState.AWAITING_PLAYERS)).isTrue();
        assertThat(SessionState.AWAITING_PLAYERS.canTransitionTo(SessionState.LAUNCHING)).isTrue();
        assertThat(SessionState.LAUNCHING.canTransitionTo(SessionState.IN_PROGRESS)).isTrue();
        assertThat(SessionState.IN_PROGRESS.canTransitionTo(SessionState.ENDING)).isTrue();
        assertThat(SessionState.ENDING.canTransitionTo(SessionState.CLOSED)).isTrue();

        assertThat(SessionState.IDLE.canTransitionTo(SessionState.IN_PROGRESS)).isFalse();
        assertThat(SessionState.IN_PROGRESS.canTransitionTo(SessionState.LAUNCHING)).isFalse();
        assertThat(SessionState.CLOSED.canTransitionTo(SessionState.IDLE)).isFalse();
    }

    @ParameterizedTest
    @EnumSource(value = SessionState.class, names = {"CLOSED", "FAILED"}, mode = EnumSource.Mode.EXCLUDE)
    @DisplayName("Every non-terminal state may fail")
    void anyLiveStateMayFail(SessionState state) {
        assertThat(state.canTransitionTo(SessionState.FAILED)).isTrue();
        assertThat(state.isTerminal()).isFalse();
    }

    @Test
    @DisplayName("Terminal states are final")
    void terminalStates() {
        assertThat(SessionState.CLOSED.canTransitionTo(SessionState.FAILED)).isFalse();
        assertThat(SessionState.FAILED.canTransitionTo(SessionState.FAILED)).isFalse();
        assertThat(SessionState.CLOSED.isTerminal()).isTrue();
        assertThat(SessionState.FAILED.isTerminal()).isTrue();
    }

    @Test
    @DisplayName("Only started, unfinished sessions count as live")
    void liveStates() {
        assertThat(SessionState.IDLE.isLive()).isFalse();
        assertThat(SessionState.AWAITING_PLAYERS.isLive()).isTrue();
        assertThat(SessionState.ENDING.isLive()).isTrue();
        assertThat(SessionState.CLOSED.isLive()).isFalse();
    }
}
