package org.arenaclient.match.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class MatchConfigTest {

    @Test
    @DisplayName("Parses the supervisor's field names")
    void parsesSupervisorJson() {
        MatchConfig config = MatchConfig.fromJson("""
            {"Map": "AcropolisLE", "MaxGameTime": 1000, "Player1": "alpha", "Player2": "beta",
             "ReplayPath": "/tmp/out.SC2Replay", "MatchID": "42", "DisableDebug": false,
             "MaxFrameTime": 250, "Strikes": 5, "RealTime": true, "Visualize": true}
            """);

        assertThat(config.getMapName()).isEqualTo("AcropolisLE");
        assertThat(config.getMaxGameTime()).isEqualTo(1000);
        assertThat(config.getPlayer(PlayerSlot.PLAYER_1)).isEqualTo("alpha");
        assertThat(config.getPlayer(PlayerSlot.PLAYER_2)).isEqualTo("beta");
        assertThat(config.isReplayRequested()).isTrue();
        assertThat(config.getMatchId()).isEqualTo("42");
        assertThat(config.isDisableDebug()).isFalse();
        assertThat(config.getMaxFrameTime()).isEqualTo(Duration.ofMillis(250));
        assertThat(config.getStrikes()).isEqualTo(5);
        assertThat(config.isRealTime()).isTrue();
        assertThat(config.isVisualize()).isTrue();
    }

    @Test
    @DisplayName("Map file drops spaces and gains the map extension once")
    void mapFile() {
        MatchConfig spaced = MatchConfig.builder().map("Abyssal Reef LE").players("a", "b").build();
        MatchConfig withExtension = MatchConfig.builder().map("AcropolisLE.SC2Map").players("a", "b").build();

        assertThat(spaced.getMapFile()).isEqualTo("AbyssalReefLE.SC2Map");
        assertThat(withExtension.getMapFile()).isEqualTo("AcropolisLE.SC2Map");
    }

    @Test
    @DisplayName("Absent keys keep their defaults")
    void defaults() {
        MatchConfig config = MatchConfig.fromJson("{\"map\": \"M\", \"player1\": \"a\", \"player2\": \"b\"}");

        assertThat(config.getMaxGameTime()).isEqualTo(MatchConfig.DEFAULT_MAX_GAME_TIME);
        assertThat(config.getMaxFrameTime()).isEqualTo(Duration.ofMillis(MatchConfig.DEFAULT_MAX_FRAME_TIME_MS));
        assertThat(config.getStrikes()).isEqualTo(MatchConfig.DEFAULT_STRIKES);
        assertThat(config.isDisableDebug()).isTrue();
        assertThat(config.isRealTime()).isFalse();
        assertThat(config.isReplayRequested()).isFalse();
        assertThat(config.getMatchId()).isEmpty();
    }

    @Test
    @DisplayName("Rejects payloads that are not JSON objects")
    void rejectsInvalidJson() {
        assertThatThrownBy(() -> MatchConfig.fromJson("{not json"))
            .isInstanceOf(MatchConfigException.class)
            .hasMessageContaining("not valid JSON");
        assertThatThrownBy(() -> MatchConfig.fromJson(""))
            .isInstanceOf(MatchConfigException.class);
    }

    @Test
    @DisplayName("Requires a map and two distinct players")
    void requiresMapAndPlayers() {
        assertThatThrownBy(() -> MatchConfig.fromJson("{\"Player1\": \"a\", \"Player2\": \"b\"}"))
            .hasMessageContaining("Map");
        assertThatThrownBy(() -> MatchConfig.fromJson("{\"Map\": \"M\", \"Player1\": \"a\"}"))
            .hasMessageContaining("Player2");
        assertThatThrownBy(() -> MatchConfig.fromJson("{\"Map\": \"M\", \"Player1\": \"a\", \"Player2\": \"a\"}"))
            .hasMessageContaining("must differ");
    }

    @Test
    @DisplayName("Rejects out-of-range limits")
    void rejectsBadLimits() {
        assertThatThrownBy(() -> base().maxGameTime(-1).build()).hasMessageContaining("MaxGameTime");
        assertThatThrownBy(() -> base().maxFrameTime(Duration.ZERO).build()).hasMessageContaining("MaxFrameTime");
        assertThatThrownBy(() -> base().strikes(-1).build()).hasMessageContaining("Strikes");
    }

    @Test
    @DisplayName("Zero step limit and zero strikes are valid")
    void zeroLimitsAllowed() {
        MatchConfig config = base().maxGameTime(0).strikes(0).build();

        assertThat(config.getMaxGameTime()).isZero();
        assertThat(config.getStrikes()).isZero();
    }

    private static MatchConfig.Builder base() {
        return MatchConfig.builder().map("M").players("a", "b");
    }
}
