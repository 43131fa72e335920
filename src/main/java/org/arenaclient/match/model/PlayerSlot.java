package org.arenaclient.match.model;

/**
 * One of the two player seats of a match. Player 1 is the first configured player.
 */
public enum PlayerSlot {
    PLAYER_1,
    PLAYER_2;

    /**
     * @return 0 for player 1, 1 for player 2.
     */
    public int index() {
        return ordinal();
    }

    /**
     * @return 1 for player 1, 2 for player 2, matching the engine's default player ids.
     */
    public int number() {
        return ordinal() + 1;
    }

    public PlayerSlot opponent() {
        return this == PLAYER_1 ? PLAYER_2 : PLAYER_1;
    }

    public static PlayerSlot ofIndex(int index) {
        return switch (index) {
            case 0 -> PLAYER_1;
            case 1 -> PLAYER_2;
            default -> throw new IllegalArgumentException("No player slot with index " + index);
        };
    }
}
