package org.arenaclient.match.model;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable outcome of one match. Written once to the result log and delivered once to the
 * supervisor.
 *
 * @param matchId            Opaque match identifier from the configuration.
 * @param mapName            Map the match was played on.
 * @param players            Player identifier per slot.
 * @param outcome            Outcome tag.
 * @param reason             Why the match ended.
 * @param loser              Losing or erroring slot, or {@code null} if there is none.
 * @param playerResults      Result label per slot.
 * @param steps              Completed steps.
 * @param gameLoop           Last game loop reported by the engine, 0 if none was seen.
 * @param elapsed            Wall time from launch request to the end of the match.
 * @param endedAt            When the match ended.
 * @param strikes            Strike count per slot.
 * @param averageFrameTimeMs Average bot response time per slot, in milliseconds.
 * @param replayPath         Replay file actually written, empty if none.
 */
public record MatchResult(
    String matchId,
    String mapName,
    Map<PlayerSlot, String> players,
    MatchOutcome outcome,
    EndReason reason,
    PlayerSlot loser,
    Map<PlayerSlot, PlayerResult> playerResults,
    long steps,
    long gameLoop,
    Duration elapsed,
    Instant endedAt,
    Map<PlayerSlot, Integer> strikes,
    Map<PlayerSlot, Double> averageFrameTimeMs,
    String replayPath
) {

    public MatchResult {
        players = immutableCopy(players);
        playerResults = immutableCopy(playerResults);
        strikes = immutableCopy(strikes);
        averageFrameTimeMs = immutableCopy(averageFrameTimeMs);
        replayPath = replayPath == null ? "" : replayPath;
    }

    /**
     * @param path The replay file actually written.
     * @return a copy of this result carrying the given replay path.
     */
    public MatchResult withReplayPath(String path) {
        return new MatchResult(matchId, mapName, players, outcome, reason, loser, playerResults, steps, gameLoop,
            elapsed, endedAt, strikes, averageFrameTimeMs, path);
    }

    /**
     * @return the player identifier of the losing or erroring bot, if any.
     */
    public Optional<String> loserId() {
        return loser == null ? Optional.empty() : Optional.ofNullable(players.get(loser));
    }

    /**
     * @return the winning slot, empty for ties, errors and crashes.
     */
    public Optional<PlayerSlot> winner() {
        return switch (outcome) {
            case PLAYER1_WIN -> Optional.of(PlayerSlot.PLAYER_1);
            case PLAYER2_WIN -> Optional.of(PlayerSlot.PLAYER_2);
            default -> Optional.empty();
        };
    }

    public int strikesOf(PlayerSlot slot) {
        return strikes.getOrDefault(slot, 0);
    }

    /**
     * Derives the per-player result labels from the outcome.
     *
     * @param outcome The outcome tag.
     * @param reason  The end reason.
     * @param loser   The losing slot, or {@code null}.
     * @return the label for each slot.
     */
    public static Map<PlayerSlot, PlayerResult> derivePlayerResults(MatchOutcome outcome, EndReason reason, PlayerSlot loser) {
        Map<PlayerSlot, PlayerResult> results = new EnumMap<>(PlayerSlot.class);
        switch (outcome) {
            case PLAYER1_WIN, PLAYER2_WIN -> {
                PlayerSlot winner = outcome == MatchOutcome.PLAYER1_WIN ? PlayerSlot.PLAYER_1 : PlayerSlot.PLAYER_2;
                results.put(winner, PlayerResult.VICTORY);
                results.put(winner.opponent(), switch (reason) {
                    case DISCONNECT, PROTOCOL_ERROR -> PlayerResult.CRASH;
                    case TIMEOUT_LIMIT_EXCEEDED -> PlayerResult.TIMEOUT;
                    default -> PlayerResult.DEFEAT;
                });
            }
            case TIE -> {
                PlayerResult label = reason == EndReason.DOUBLE_TIMEOUT ? PlayerResult.TIMEOUT : PlayerResult.TIE;
                results.put(PlayerSlot.PLAYER_1, label);
                results.put(PlayerSlot.PLAYER_2, label);
            }
            case CRASH -> {
                results.put(PlayerSlot.PLAYER_1, PlayerResult.SC2_CRASH);
                results.put(PlayerSlot.PLAYER_2, PlayerResult.SC2_CRASH);
            }
            case ERROR -> {
                PlayerResult label = switch (reason) {
                    case ENGINE_UNRESPONSIVE -> PlayerResult.SC2_CRASH;
                    case ABORTED -> PlayerResult.TIE;
                    default -> PlayerResult.INITIALIZATION_ERROR;
                };
                for (PlayerSlot slot : PlayerSlot.values()) {
                    results.put(slot, slot == loser || loser == null ? label : PlayerResult.TIE);
                }
            }
        }
        return results;
    }

    private static <V> Map<PlayerSlot, V> immutableCopy(Map<PlayerSlot, V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Map.copyOf(new EnumMap<>(source));
    }
}
