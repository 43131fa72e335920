package org.arenaclient.match.protocol;

import java.util.List;
import java.util.Map;

/**
 * Classification of an engine response, limited to what session control needs.
 *
 * @param kind          The response member.
 * @param id            The echoed request id, or 0.
 * @param status        The engine status, or {@code null} if absent.
 * @param errors        Error strings of the envelope.
 * @param playerId      {@code join_game.player_id}, or 0.
 * @param gameLoop      {@code observation.observation.game_loop}, or -1 if absent.
 * @param playerResults Game-over results keyed by engine player id; empty while the game runs.
 * @param replayData    {@code save_replay.data}, or {@code null}.
 */
public record ResponseFrame(
    MessageKind kind,
    int id,
    EngineStatus status,
    List<String> errors,
    int playerId,
    long gameLoop,
    Map<Integer, GameResult> playerResults,
    byte[] replayData
) {

    /**
     * @return {@code true} if the engine reported the end of the game.
     */
    public boolean isGameOver() {
        return !playerResults.isEmpty();
    }
}
