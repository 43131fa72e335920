package org.arenaclient.match.protocol;

/**
 * Per-player game-over result as reported by the engine.
 */
public enum GameResult {
    VICTORY(1),
    DEFEAT(2),
    TIE(3),
    UNDECIDED(4);

    private final int number;

    GameResult(int number) {
        this.number = number;
    }

    public int number() {
        return number;
    }

    static GameResult ofNumber(int number) {
        for (GameResult result : values()) {
            if (result.number == number) {
                return result;
            }
        }
        return UNDECIDED;
    }
}
