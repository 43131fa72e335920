package org.arenaclient.match.model;

/**
 * Final outcome tag of a match as reported to the supervisor.
 */
public enum MatchOutcome {
    PLAYER1_WIN("Player1Win"),
    PLAYER2_WIN("Player2Win"),
    TIE("Tie"),
    ERROR("Error"),
    CRASH("Crash");

    private final String wireName;

    MatchOutcome(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * @param winner The winning slot.
     * @return the win outcome for that slot.
     */
    public static MatchOutcome winFor(PlayerSlot winner) {
        return winner == PlayerSlot.PLAYER_1 ? PLAYER1_WIN : PLAYER2_WIN;
    }
}
