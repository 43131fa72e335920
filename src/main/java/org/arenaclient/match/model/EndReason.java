package org.arenaclient.match.model;

/**
 * Why a match ended.
 */
public enum EndReason {
    NORMAL("Normal"),
    MAX_STEPS_REACHED("MaxStepsReached"),
    TIMEOUT_LIMIT_EXCEEDED("TimeoutLimitExceeded"),
    DOUBLE_TIMEOUT("DoubleTimeout"),
    DISCONNECT("Disconnect"),
    SURRENDER("Surrender"),
    PROTOCOL_ERROR("ProtocolError"),
    ENGINE_CRASH("EngineCrash"),
    ENGINE_UNRESPONSIVE("EngineUnresponsive"),
    ENGINE_LAUNCH_FAILED("EngineLaunchFailed"),
    PLAYER_CONNECT_TIMEOUT("PlayerConnectTimeout"),
    ABORTED("Aborted");

    private final String wireName;

    EndReason(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
