package org.arenaclient.match.api.results;

import java.time.Instant;

/**
 * One row of the result log.
 */
public record ResultRecord(
    long rowId,
    Instant recordedAt,
    String matchId,
    String mapName,
    String player1,
    String player2,
    String outcome,
    String reason,
    String loser,
    long steps,
    long durationMs,
    int player1Strikes,
    int player2Strikes,
    String replayPath
) {
}
