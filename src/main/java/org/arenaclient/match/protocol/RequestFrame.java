package org.arenaclient.match.protocol;

/**
 * Classification of a bot request. The raw bytes are kept so that the frame can be forwarded
 * verbatim.
 *
 * @param kind       The request member.
 * @param id         The request id, or 0 if absent.
 * @param playerName {@code join_game.player_name}, or {@code null}.
 * @param raw        The original frame.
 */
public record RequestFrame(MessageKind kind, int id, String playerName, byte[] raw) {
}
