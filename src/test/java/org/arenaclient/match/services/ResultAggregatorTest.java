package org.arenaclient.match.services;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import org.arenaclient.match.api.results.IResultLog;
import org.arenaclient.match.api.results.ResultLogException;
import org.arenaclient.match.model.EndReason;
import org.arenaclient.match.model.MatchConfig;
import org.arenaclient.match.model.MatchOutcome;
import org.arenaclient.match.model.MatchResult;
import org.arenaclient.match.model.PlayerSlot;
import org.arenaclient.match.resources.results.ReplayWriter;
import org.arenaclient.match.session.MatchRequest;
import org.arenaclient.match.testing.FakeConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class ResultAggregatorTest {

    @TempDir
    Path tempDir;

    @Mock
    private IResultLog resultLog;

    @Mock
    private ResultAggregator.ErrorSink errorSink;

    private FakeConnection supervisor;
    private ResultAggregator aggregator;

    @BeforeEach
    void setUp() {
        supervisor = new FakeConnection("supervisor");
        aggregator = new ResultAggregator(resultLog, new ReplayWriter(tempDir.resolve("fallback")), 22.4, errorSink);
    }

    @Test
    @DisplayName("Writes the replay, logs the result and delivers it with the replay path")
    void completesWithReplay() throws Exception {
        Path replay = tempDir.resolve("m-1.SC2Replay");
        MatchRequest request = request(replay.toString());

        MatchResult delivered = aggregator.complete(request, result(), new byte[] {5, 6});

        assertThat(delivered.replayPath()).isEqualTo(replay.toString());
        assertThat(Files.readAllBytes(replay)).containsExactly(5, 6);
        ArgumentCaptor<MatchResult> logged = ArgumentCaptor.forClass(MatchResult.class);
        verify(resultLog).append(logged.capture());
        assertThat(logged.getValue().replayPath()).isEqualTo(replay.toString());

        JsonObject payload = JsonParser.parseString(supervisor.lastText()).getAsJsonObject();
        assertThat(payload.get("ReplayPath").getAsString()).isEqualTo(replay.toString());
        assertThat(request.isAnswered()).isTrue();
    }

    @Test
    @DisplayName("A missing replay leaves the replay path empty")
    void missingReplay() {
        MatchResult delivered = aggregator.complete(request(tempDir.resolve("x.SC2Replay").toString()), result(), null);

        assertThat(delivered.replayPath()).isEmpty();
    }

    @Test
    @DisplayName("A persistence failure is recorded and the result is still delivered")
    void persistFailureIsNotFatal() {
        doThrow(new ResultLogException("disk full")).when(resultLog).append(any());

        aggregator.complete(request(""), result(), null);

        verify(errorSink).record(eq("RESULT_PERSIST_FAILED"), eq("disk full"), contains("m-1"));
        assertThat(supervisor.texts()).hasSize(1);
        assertThat(supervisor.lastText()).contains("\"Outcome\":\"Player2Win\"");
    }

    @Test
    @DisplayName("An already answered request is not answered again")
    void alreadyAnswered() {
        MatchRequest request = request("");
        request.respond("{\"Status\":\"Rejected\"}");

        aggregator.complete(request, result(), null);

        verify(resultLog).append(any());
        verify(errorSink, never()).record(anyString(), anyString(), anyString());
        assertThat(supervisor.texts()).containsExactly("{\"Status\":\"Rejected\"}");
    }

    private MatchRequest request(String replayPath) {
        MatchConfig config = MatchConfig.builder().map("M").players("alpha", "beta").matchId("m-1")
            .replayPath(replayPath).build();
        return new MatchRequest(1, config, supervisor);
    }

    private static MatchResult result() {
        return new MatchResult("m-1", "M", Map.of(PlayerSlot.PLAYER_1, "alpha", PlayerSlot.PLAYER_2, "beta"),
            MatchOutcome.PLAYER2_WIN, EndReason.SURRENDER, PlayerSlot.PLAYER_1,
            MatchResult.derivePlayerResults(MatchOutcome.PLAYER2_WIN, EndReason.SURRENDER, PlayerSlot.PLAYER_1),
            100, 100, Duration.ofSeconds(2), Instant.now(), Map.of(), Map.of(), null);
    }
}
