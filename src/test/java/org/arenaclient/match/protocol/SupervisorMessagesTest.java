package org.arenaclient.match.protocol;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import org.arenaclient.match.model.EndReason;
import org.arenaclient.match.model.MatchOutcome;
import org.arenaclient.match.model.MatchResult;
import org.arenaclient.match.model.PlayerResult;
import org.arenaclient.match.model.PlayerSlot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

@Tag("unit")
class SupervisorMessagesTest {

    @Test
    @DisplayName("Result payload lists outcome, per-player results and timing")
    void resultPayload() {
        MatchResult result = new MatchResult("m-7", "AcropolisLE",
            Map.of(PlayerSlot.PLAYER_1, "alpha", PlayerSlot.PLAYER_2, "beta"),
            MatchOutcome.PLAYER1_WIN, EndReason.TIMEOUT_LIMIT_EXCEEDED, PlayerSlot.PLAYER_2,
            Map.of(PlayerSlot.PLAYER_1, PlayerResult.VICTORY, PlayerSlot.PLAYER_2, PlayerResult.TIMEOUT),
            1344, 1344, Duration.ofSeconds(70), Instant.now(),
            Map.of(PlayerSlot.PLAYER_2, 10), Map.of(PlayerSlot.PLAYER_1, 12.5), "/replays/m-7.SC2Replay");

        JsonObject json = JsonParser.parseString(SupervisorMessages.result(result, 22.4)).getAsJsonObject();

        assertThat(json.get("MatchID").getAsString()).isEqualTo("m-7");
        assertThat(json.get("Status").getAsString()).isEqualTo("Complete");
        assertThat(json.get("Outcome").getAsString()).isEqualTo("Player1Win");
        assertThat(json.get("Reason").getAsString()).isEqualTo("TimeoutLimitExceeded");
        assertThat(json.get("Loser").getAsString()).isEqualTo("beta");
        assertThat(json.getAsJsonObject("Result").get("alpha").getAsString()).isEqualTo("Victory");
        assertThat(json.getAsJsonObject("Result").get("beta").getAsString()).isEqualTo("Timeout");
        assertThat(json.get("GameTime").getAsLong()).isEqualTo(1344);
        assertThat(json.get("GameTimeFormatted").getAsString()).isEqualTo("01:00");
        assertThat(json.get("ElapsedMs").getAsLong()).isEqualTo(70_000);
        assertThat(json.getAsJsonObject("Strikes").get("beta").getAsInt()).isEqualTo(10);
        assertThat(json.getAsJsonObject("Strikes").get("alpha").getAsInt()).isZero();
        assertThat(json.getAsJsonObject("AverageFrameTime").get("alpha").getAsDouble()).isEqualTo(12.5);
        assertThat(json.getAsJsonObject("Bots").get("2").getAsString()).isEqualTo("beta");
        assertThat(json.get("ReplayPath").getAsString()).isEqualTo("/replays/m-7.SC2Replay");
    }

    @Test
    @DisplayName("A tie has a null loser")
    void tieHasNoLoser() {
        MatchResult tie = new MatchResult("", "M", Map.of(PlayerSlot.PLAYER_1, "a", PlayerSlot.PLAYER_2, "b"),
            MatchOutcome.TIE, EndReason.MAX_STEPS_REACHED, null, Map.of(), 0, 0, Duration.ZERO, Instant.now(),
            Map.of(), Map.of(), null);

        JsonObject json = JsonParser.parseString(SupervisorMessages.result(tie, 22.4)).getAsJsonObject();

        assertThat(json.get("Loser").isJsonNull()).isTrue();
        assertThat(json.get("GameTimeFormatted").getAsString()).isEqualTo("00:00");
    }

    @Test
    @DisplayName("Notifications use the supervisor's field names")
    void notifications() {
        assertThat(SupervisorMessages.connected()).isEqualTo("{\"Status\":\"Connected\"}");
        assertThat(SupervisorMessages.configReceived()).isEqualTo("{\"Config\":\"Received\"}");
        assertThat(SupervisorMessages.queued(2)).isEqualTo("{\"Status\":\"Queued\",\"Position\":2}");
        assertThat(SupervisorMessages.botConnected(PlayerSlot.PLAYER_2)).isEqualTo("{\"Bot\":\"Connected\",\"Slot\":2}");
        assertThat(SupervisorMessages.rejected("No free port"))
            .isEqualTo("{\"Status\":\"Rejected\",\"Error\":\"No free port\"}");
        assertThat(SupervisorMessages.error("oops")).isEqualTo("{\"Error\":\"oops\"}");
    }

    @Test
    @DisplayName("Game time is formatted as minutes and seconds")
    void formatGameTime() {
        assertThat(SupervisorMessages.formatGameTime(0)).isEqualTo("00:00");
        assertThat(SupervisorMessages.formatGameTime(61.9)).isEqualTo("01:01");
        assertThat(SupervisorMessages.formatGameTime(3600)).isEqualTo("60:00");
    }
}
