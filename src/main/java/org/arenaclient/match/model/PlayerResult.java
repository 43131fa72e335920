package org.arenaclient.match.model;

/**
 * Per-player result label, as listed under {@code Result} in the supervisor payload.
 */
public enum PlayerResult {
    VICTORY("Victory"),
    DEFEAT("Defeat"),
    TIE("Tie"),
    CRASH("Crash"),
    SC2_CRASH("SC2Crash"),
    TIMEOUT("Timeout"),
    INITIALIZATION_ERROR("InitializationError");

    private final String wireName;

    PlayerResult(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
