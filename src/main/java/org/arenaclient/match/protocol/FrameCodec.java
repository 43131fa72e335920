package org.arenaclient.match.protocol;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.arenaclient.match.model.GamePorts;

import com.google.protobuf.ByteString;
import com.google.protobuf.CodedInputStream;
import com.google.protobuf.CodedOutputStream;
import com.google.protobuf.WireFormat;

/**
 * Classifies and builds control-protocol frames at the wire level.
 * <p>
 * The engine speaks protobuf {@code Request}/{@code Response} envelopes whose payload is a
 * {@code oneof} (see {@link MessageKind}) plus {@code id = 97}, {@code error = 98} and
 * {@code status = 99}. Only the handful of nested fields needed for session control are read;
 * everything else is skipped, so frames are never re-encoded and can be relayed verbatim. The
 * exceptions are the frames the session itself originates: {@code create_game}, the port
 * configuration added to each join request, and the local answers to filtered requests.
 */
public final class FrameCodec {

    static final int FIELD_ID = 97;
    static final int FIELD_ERROR = 98;
    static final int FIELD_STATUS = 99;

    private static final int CREATE_GAME_LOCAL_MAP = 1;
    private static final int CREATE_GAME_PLAYER_SETUP = 3;
    private static final int CREATE_GAME_REALTIME = 6;
    private static final int LOCAL_MAP_PATH = 1;
    private static final int PLAYER_SETUP_TYPE = 1;
    private static final int PLAYER_TYPE_PARTICIPANT = 1;
    private static final int CREATE_GAME_RESPONSE_ERROR = 1;
    private static final int CREATE_GAME_RESPONSE_ERROR_DETAILS = 2;
    private static final int JOIN_REQUEST_SERVER_PORTS = 4;
    private static final int JOIN_REQUEST_CLIENT_PORTS = 5;
    private static final int JOIN_REQUEST_SHARED_PORT = 6;
    private static final int JOIN_REQUEST_PLAYER_NAME = 7;
    private static final int PORT_SET_GAME_PORT = 1;
    private static final int PORT_SET_BASE_PORT = 2;
    private static final int JOIN_RESPONSE_PLAYER_ID = 1;
    private static final int JOIN_RESPONSE_ERROR = 2;
    private static final int JOIN_RESPONSE_ERROR_DETAILS = 3;
    private static final int OBSERVATION_RESPONSE_OBSERVATION = 3;
    private static final int OBSERVATION_RESPONSE_PLAYER_RESULT = 4;
    private static final int OBSERVATION_GAME_LOOP = 9;
    private static final int PLAYER_RESULT_PLAYER_ID = 1;
    private static final int PLAYER_RESULT_RESULT = 2;
    private static final int SAVE_REPLAY_DATA = 1;

    private FrameCodec() {
    }

    /**
     * Classifies a bot request.
     *
     * @param frame The raw frame.
     * @return the classification, holding a reference to {@code frame}.
     * @throws ProtocolDecodeException if the frame is not a well-formed envelope.
     */
    public static RequestFrame decodeRequest(byte[] frame) {
        try {
            CodedInputStream in = CodedInputStream.newInstance(frame);
            MessageKind kind = MessageKind.NONE;
            int id = 0;
            String playerName = null;
            for (int tag = in.readTag(); tag != 0; tag = in.readTag()) {
                int field = WireFormat.getTagFieldNumber(tag);
                int wireType = WireFormat.getTagWireType(tag);
                MessageKind member = MessageKind.ofField(field);
                if (field == FIELD_ID && wireType == WireFormat.WIRETYPE_VARINT) {
                    id = in.readUInt32();
                } else if (member != null && wireType == WireFormat.WIRETYPE_LENGTH_DELIMITED) {
                    ByteString body = in.readBytes();
                    kind = member;
                    if (member == MessageKind.JOIN_GAME) {
                        playerName = readJoinPlayerName(body);
                    }
                } else if (!in.skipField(tag)) {
                    break;
                }
            }
            return new RequestFrame(kind, id, playerName, frame);
        } catch (IOException e) {
            throw new ProtocolDecodeException("Malformed request frame: " + e.getMessage(), e);
        }
    }

    /**
     * Classifies an engine response.
     *
     * @param frame The raw frame.
     * @return the classification.
     * @throws ProtocolDecodeException if the frame is not a well-formed envelope.
     */
    public static ResponseFrame decodeResponse(byte[] frame) {
        try {
            CodedInputStream in = CodedInputStream.newInstance(frame);
            MessageKind kind = MessageKind.NONE;
            int id = 0;
            EngineStatus status = null;
            List<String> errors = new ArrayList<>();
            int playerId = 0;
            long gameLoop = -1;
            Map<Integer, GameResult> playerResults = new LinkedHashMap<>();
            byte[] replayData = null;

            for (int tag = in.readTag(); tag != 0; tag = in.readTag()) {
                int field = WireFormat.getTagFieldNumber(tag);
                int wireType = WireFormat.getTagWireType(tag);
                MessageKind member = MessageKind.ofField(field);
                if (field == FIELD_ID && wireType == WireFormat.WIRETYPE_VARINT) {
                    id = in.readUInt32();
                } else if (field == FIELD_STATUS && wireType == WireFormat.WIRETYPE_VARINT) {
                    status = EngineStatus.ofNumber(in.readEnum());
                } else if (field == FIELD_ERROR && wireType == WireFormat.WIRETYPE_LENGTH_DELIMITED) {
                    errors.add(in.readString());
                } else if (member != null && wireType == WireFormat.WIRETYPE_LENGTH_DELIMITED) {
                    ByteString body = in.readBytes();
                    kind = member;
                    switch (member) {
                        case CREATE_GAME -> readMemberError(body, CREATE_GAME_RESPONSE_ERROR,
                            CREATE_GAME_RESPONSE_ERROR_DETAILS, errors);
                        case JOIN_GAME -> {
                            playerId = readJoinPlayerId(body);
                            readMemberError(body, JOIN_RESPONSE_ERROR, JOIN_RESPONSE_ERROR_DETAILS, errors);
                        }
                        case OBSERVATION -> gameLoop = readObservation(body, playerResults);
                        case SAVE_REPLAY -> replayData = readReplayData(body);
                        default -> {
                            // payload is opaque to session control
                        }
                    }
                } else if (!in.skipField(tag)) {
                    break;
                }
            }
            return new ResponseFrame(kind, id, status, List.copyOf(errors), playerId, gameLoop,
                Map.copyOf(playerResults), replayData);
        } catch (IOException e) {
            throw new ProtocolDecodeException("Malformed response frame: " + e.getMessage(), e);
        }
    }

    /**
     * Builds the reply to a filtered debug request: the request id and status {@code in_game},
     * without a payload.
     *
     * @param requestId The id of the filtered request, 0 if it had none.
     * @return the encoded response.
     */
    public static byte[] debugRejection(int requestId) {
        return encode(out -> {
            writeId(out, requestId);
            out.writeEnum(FIELD_STATUS, EngineStatus.IN_GAME.number());
        });
    }

    /**
     * Builds an error response for a request that could not be decoded.
     *
     * @param message The error text.
     * @return the encoded response.
     */
    public static byte[] errorResponse(String message) {
        return encode(out -> out.writeString(FIELD_ERROR, message));
    }

    /**
     * Builds a local answer to a request that is handled without the engine
     * ({@code ping}, {@code leave_game}, {@code quit}): an empty member of the same kind.
     *
     * @param kind      The request kind.
     * @param requestId The request id, 0 if it had none.
     * @param status    The status to report.
     * @return the encoded response.
     */
    public static byte[] emptyResponse(MessageKind kind, int requestId, EngineStatus status) {
        return encode(out -> {
            out.writeBytes(kind.fieldNumber(), ByteString.EMPTY);
            writeId(out, requestId);
            out.writeEnum(FIELD_STATUS, status.number());
        });
    }

    /**
     * Builds an empty request of the given kind, such as {@code save_replay}.
     *
     * @param kind The request kind.
     * @return the encoded request.
     */
    public static byte[] emptyRequest(MessageKind kind) {
        return encode(out -> out.writeBytes(kind.fieldNumber(), ByteString.EMPTY));
    }

    /**
     * Builds the request that creates a game on the local engine with every player a participant.
     *
     * @param mapPath      Map file, relative to the engine's map directory.
     * @param realTime     Whether the game runs in real time.
     * @param participants Number of participant players.
     * @return the encoded request.
     */
    public static byte[] createGameRequest(String mapPath, boolean realTime, int participants) {
        return encode(out -> {
            ByteString localMap = message(map -> map.writeString(LOCAL_MAP_PATH, mapPath));
            ByteString participant = message(setup -> setup.writeEnum(PLAYER_SETUP_TYPE, PLAYER_TYPE_PARTICIPANT));
            out.writeBytes(MessageKind.CREATE_GAME.fieldNumber(), message(create -> {
                create.writeBytes(CREATE_GAME_LOCAL_MAP, localMap);
                for (int i = 0; i < participants; i++) {
                    create.writeBytes(CREATE_GAME_PLAYER_SETUP, participant);
                }
                create.writeBool(CREATE_GAME_REALTIME, realTime);
            }));
        });
    }

    /**
     * Rewrites a bot's join request to carry the match's port configuration. Any ports the bot
     * set itself are replaced; every other field is kept as sent.
     *
     * @param joinRequest The bot's join request.
     * @param ports       The match's ports.
     * @return the rewritten request.
     * @throws ProtocolDecodeException if the request is not a well-formed envelope.
     */
    public static byte[] withGamePorts(byte[] joinRequest, GamePorts ports) {
        try {
            CodedInputStream in = CodedInputStream.newInstance(joinRequest);
            ByteString.Output buffer = ByteString.newOutput();
            CodedOutputStream out = CodedOutputStream.newInstance(buffer);
            for (int tag = in.readTag(); tag != 0; tag = in.readTag()) {
                if (WireFormat.getTagFieldNumber(tag) == MessageKind.JOIN_GAME.fieldNumber()
                    && WireFormat.getTagWireType(tag) == WireFormat.WIRETYPE_LENGTH_DELIMITED) {
                    out.writeBytes(MessageKind.JOIN_GAME.fieldNumber(), joinWithPorts(in.readBytes(), ports));
                } else if (!in.skipField(tag, out)) {
                    break;
                }
            }
            out.flush();
            return buffer.toByteString().toByteArray();
        } catch (IOException e) {
            throw new ProtocolDecodeException("Malformed join request: " + e.getMessage(), e);
        }
    }

    private static ByteString joinWithPorts(ByteString body, GamePorts ports) throws IOException {
        CodedInputStream in = body.newCodedInput();
        return message(out -> {
            for (int tag = in.readTag(); tag != 0; tag = in.readTag()) {
                int field = WireFormat.getTagFieldNumber(tag);
                if (field == JOIN_REQUEST_SERVER_PORTS || field == JOIN_REQUEST_CLIENT_PORTS
                    || field == JOIN_REQUEST_SHARED_PORT) {
                    in.skipField(tag);
                } else if (!in.skipField(tag, out)) {
                    break;
                }
            }
            out.writeBytes(JOIN_REQUEST_SERVER_PORTS, portSet(ports.serverGame(), ports.serverBase()));
            out.writeBytes(JOIN_REQUEST_CLIENT_PORTS, portSet(ports.clientGame(), ports.clientBase()));
            out.writeInt32(JOIN_REQUEST_SHARED_PORT, ports.shared());
        });
    }

    private static ByteString portSet(int gamePort, int basePort) throws IOException {
        return message(out -> {
            out.writeInt32(PORT_SET_GAME_PORT, gamePort);
            out.writeInt32(PORT_SET_BASE_PORT, basePort);
        });
    }

    private static void readMemberError(ByteString body, int errorField, int detailsField, List<String> errors)
        throws IOException {
        CodedInputStream in = body.newCodedInput();
        int code = 0;
        String details = null;
        for (int tag = in.readTag(); tag != 0; tag = in.readTag()) {
            int field = WireFormat.getTagFieldNumber(tag);
            int wireType = WireFormat.getTagWireType(tag);
            if (field == errorField && wireType == WireFormat.WIRETYPE_VARINT) {
                code = in.readEnum();
            } else if (field == detailsField && wireType == WireFormat.WIRETYPE_LENGTH_DELIMITED) {
                details = in.readString();
            } else if (!in.skipField(tag)) {
                break;
            }
        }
        if (code != 0 || details != null) {
            errors.add(details != null ? details : "error code " + code);
        }
    }

    private static String readJoinPlayerName(ByteString body) throws IOException {
        CodedInputStream in = body.newCodedInput();
        String name = null;
        for (int tag = in.readTag(); tag != 0; tag = in.readTag()) {
            if (WireFormat.getTagFieldNumber(tag) == JOIN_REQUEST_PLAYER_NAME
                && WireFormat.getTagWireType(tag) == WireFormat.WIRETYPE_LENGTH_DELIMITED) {
                name = in.readString();
            } else if (!in.skipField(tag)) {
                break;
            }
        }
        return name;
    }

    private static int readJoinPlayerId(ByteString body) throws IOException {
        CodedInputStream in = body.newCodedInput();
        int playerId = 0;
        for (int tag = in.readTag(); tag != 0; tag = in.readTag()) {
            if (WireFormat.getTagFieldNumber(tag) == JOIN_RESPONSE_PLAYER_ID
                && WireFormat.getTagWireType(tag) == WireFormat.WIRETYPE_VARINT) {
                playerId = in.readUInt32();
            } else if (!in.skipField(tag)) {
                break;
            }
        }
        return playerId;
    }

    private static long readObservation(ByteString body, Map<Integer, GameResult> playerResults) throws IOException {
        CodedInputStream in = body.newCodedInput();
        long gameLoop = -1;
        for (int tag = in.readTag(); tag != 0; tag = in.readTag()) {
            int field = WireFormat.getTagFieldNumber(tag);
            boolean delimited = WireFormat.getTagWireType(tag) == WireFormat.WIRETYPE_LENGTH_DELIMITED;
            if (field == OBSERVATION_RESPONSE_OBSERVATION && delimited) {
                gameLoop = readGameLoop(in.readBytes());
            } else if (field == OBSERVATION_RESPONSE_PLAYER_RESULT && delimited) {
                readPlayerResult(in.readBytes(), playerResults);
            } else if (!in.skipField(tag)) {
                break;
            }
        }
        return gameLoop;
    }

    private static long readGameLoop(ByteString observation) throws IOException {
        CodedInputStream in = observation.newCodedInput();
        long gameLoop = -1;
        for (int tag = in.readTag(); tag != 0; tag = in.readTag()) {
            if (WireFormat.getTagFieldNumber(tag) == OBSERVATION_GAME_LOOP
                && WireFormat.getTagWireType(tag) == WireFormat.WIRETYPE_VARINT) {
                gameLoop = Integer.toUnsignedLong(in.readUInt32());
            } else if (!in.skipField(tag)) {
                break;
            }
        }
        return gameLoop;
    }

    private static void readPlayerResult(ByteString body, Map<Integer, GameResult> playerResults) throws IOException {
        CodedInputStream in = body.newCodedInput();
        int playerId = 0;
        GameResult result = GameResult.UNDECIDED;
        for (int tag = in.readTag(); tag != 0; tag = in.readTag()) {
            int field = WireFormat.getTagFieldNumber(tag);
            boolean varint = WireFormat.getTagWireType(tag) == WireFormat.WIRETYPE_VARINT;
            if (field == PLAYER_RESULT_PLAYER_ID && varint) {
                playerId = in.readUInt32();
            } else if (field == PLAYER_RESULT_RESULT && varint) {
                result = GameResult.ofNumber(in.readEnum());
            } else if (!in.skipField(tag)) {
                break;
            }
        }
        playerResults.put(playerId, result);
    }

    private static byte[] readReplayData(ByteString body) throws IOException {
        CodedInputStream in = body.newCodedInput();
        byte[] data = new byte[0];
        for (int tag = in.readTag(); tag != 0; tag = in.readTag()) {
            if (WireFormat.getTagFieldNumber(tag) == SAVE_REPLAY_DATA
                && WireFormat.getTagWireType(tag) == WireFormat.WIRETYPE_LENGTH_DELIMITED) {
                data = in.readByteArray();
            } else if (!in.skipField(tag)) {
                break;
            }
        }
        return data;
    }

    private static void writeId(CodedOutputStream out, int requestId) throws IOException {
        if (requestId != 0) {
            out.writeUInt32(FIELD_ID, requestId);
        }
    }

    private static byte[] encode(FieldWriter writer) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        CodedOutputStream out = CodedOutputStream.newInstance(buffer);
        try {
            writer.write(out);
            out.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to encode frame", e);
        }
        return buffer.toByteArray();
    }

    private static ByteString message(FieldWriter writer) throws IOException {
        ByteString.Output buffer = ByteString.newOutput();
        CodedOutputStream out = CodedOutputStream.newInstance(buffer);
        writer.write(out);
        out.flush();
        return buffer.toByteString();
    }

    @FunctionalInterface
    private interface FieldWriter {
        void write(CodedOutputStream out) throws IOException;
    }
}
