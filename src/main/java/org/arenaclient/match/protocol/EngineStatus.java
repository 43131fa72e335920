package org.arenaclient.match.protocol;

/**
 * Engine status carried in every response envelope.
 */
public enum EngineStatus {
    LAUNCHED(1),
    INIT_GAME(2),
    IN_GAME(3),
    IN_REPLAY(4),
    ENDED(5),
    QUIT(6),
    UNKNOWN(99);

    private final int number;

    EngineStatus(int number) {
        this.number = number;
    }

    public int number() {
        return number;
    }

    static EngineStatus ofNumber(int number) {
        for (EngineStatus status : values()) {
            if (status.number == number) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
