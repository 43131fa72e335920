package org.arenaclient.match.protocol;

/**
 * The {@code oneof} member carried by a request or response envelope, keyed by its protobuf
 * field number. Requests and responses share the numbering.
 */
public enum MessageKind {
    NONE(0),
    CREATE_GAME(1),
    JOIN_GAME(2),
    RESTART_GAME(3),
    START_REPLAY(4),
    LEAVE_GAME(5),
    QUICK_SAVE(6),
    QUICK_LOAD(7),
    QUIT(8),
    GAME_INFO(9),
    OBSERVATION(10),
    ACTION(11),
    STEP(12),
    DATA(13),
    QUERY(14),
    SAVE_REPLAY(15),
    REPLAY_INFO(16),
    AVAILABLE_MAPS(17),
    SAVE_MAP(18),
    PING(19),
    DEBUG(20),
    OBS_ACTION(21),
    MAP_COMMAND(22);

    private static final MessageKind[] BY_FIELD = new MessageKind[23];

    static {
        for (MessageKind kind : values()) {
            BY_FIELD[kind.fieldNumber] = kind;
        }
    }

    private final int fieldNumber;

    MessageKind(int fieldNumber) {
        this.fieldNumber = fieldNumber;
    }

    public int fieldNumber() {
        return fieldNumber;
    }

    /**
     * @return {@code true} for the debug-command category filtered when debug is disabled.
     */
    public boolean isDebug() {
        return this == DEBUG;
    }

    /**
     * @return {@code true} for requests that end the bot's participation.
     */
    public boolean isSurrender() {
        return this == LEAVE_GAME || this == QUIT;
    }

    /**
     * @param fieldNumber A protobuf field number of the envelope.
     * @return the kind, or {@code null} if the field is not a {@code oneof} member.
     */
    static MessageKind ofField(int fieldNumber) {
        if (fieldNumber <= 0 || fieldNumber >= BY_FIELD.length) {
            return null;
        }
        return BY_FIELD[fieldNumber];
    }
}
