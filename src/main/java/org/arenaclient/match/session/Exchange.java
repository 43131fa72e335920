package org.arenaclient.match.session;

import org.arenaclient.match.model.PlayerSlot;
import org.arenaclient.match.protocol.RequestFrame;
import org.arenaclient.match.protocol.ResponseFrame;

/**
 * Outcome of one bot exchange within a step.
 *
 * @param slot     The bot's slot.
 * @param type     What happened.
 * @param request  The bot's request, if one was decoded.
 * @param response The engine's response, if one was relayed and could be classified.
 * @param detail   Diagnostic text for failures.
 */
record Exchange(PlayerSlot slot, Type type, RequestFrame request, ResponseFrame response, String detail) {

    enum Type {
        /** The request reached the engine and its response was forwarded. */
        RELAYED,
        /** A debug request was answered locally. */
        FILTERED,
        /** The bot sent leave_game or quit. */
        SURRENDERED,
        /** The bot's frame could not be decoded. */
        DECODE_ERROR,
        /** The bot did not send a frame within its budget. */
        TIMED_OUT,
        /** The bot's connection is gone. */
        DISCONNECTED,
        /** The engine failed to take or answer the request. */
        ENGINE_FAILURE
    }

    static Exchange relayed(PlayerSlot slot, RequestFrame request, ResponseFrame response) {
        return new Exchange(slot, Type.RELAYED, request, response, null);
    }

    static Exchange filtered(PlayerSlot slot, RequestFrame request) {
        return new Exchange(slot, Type.FILTERED, request, null, null);
    }

    static Exchange surrendered(PlayerSlot slot, RequestFrame request) {
        return new Exchange(slot, Type.SURRENDERED, request, null, null);
    }

    static Exchange decodeError(PlayerSlot slot, String detail) {
        return new Exchange(slot, Type.DECODE_ERROR, null, null, detail);
    }

    static Exchange timedOut(PlayerSlot slot) {
        return new Exchange(slot, Type.TIMED_OUT, null, null, null);
    }

    static Exchange disconnected(PlayerSlot slot) {
        return new Exchange(slot, Type.DISCONNECTED, null, null, null);
    }

    static Exchange engineFailure(PlayerSlot slot, RequestFrame request, String detail) {
        return new Exchange(slot, Type.ENGINE_FAILURE, request, null, detail);
    }

    /**
     * @return {@code true} if no further exchange can follow on this bot's channel.
     */
    boolean isTerminal() {
        return type == Type.SURRENDERED || type == Type.DISCONNECTED || type == Type.ENGINE_FAILURE;
    }
}
