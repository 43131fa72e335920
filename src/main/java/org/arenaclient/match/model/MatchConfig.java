package org.arenaclient.match.model;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

/**
 * Immutable match configuration supplied by the supervisor at session start.
 * <p>
 * Parsed from the supervisor's JSON request via {@link #fromJson(String)}; JSON keys follow the
 * supervisor protocol ({@code Map}, {@code MaxGameTime}, {@code Player1}, ...). Absent keys keep
 * their defaults. {@link #validate()} enforces the invariants the session relies on.
 */
public final class MatchConfig {

    /** Default game length in engine steps, about 45 minutes at 22.4 steps per second. */
    public static final long DEFAULT_MAX_GAME_TIME = 60486;
    public static final long DEFAULT_MAX_FRAME_TIME_MS = 1000;
    public static final int DEFAULT_STRIKES = 10;

    private static final Gson GSON = new Gson();

    @SerializedName(value = "Map", alternate = {"map", "map_name"})
    private String mapName = "";

    @SerializedName(value = "MaxGameTime", alternate = {"max_game_time"})
    private long maxGameTime = DEFAULT_MAX_GAME_TIME;

    @SerializedName(value = "Player1", alternate = {"player1"})
    private String player1 = "";

    @SerializedName(value = "Player2", alternate = {"player2"})
    private String player2 = "";

    @SerializedName(value = "ReplayPath", alternate = {"replay_path"})
    private String replayPath = "";

    @SerializedName(value = "ReplayName", alternate = {"replay_name"})
    private String replayName = "";

    @SerializedName(value = "MatchID", alternate = {"match_id"})
    private String matchId = "";

    @SerializedName(value = "DisableDebug", alternate = {"disable_debug"})
    private boolean disableDebug = true;

    @SerializedName(value = "MaxFrameTime", alternate = {"max_frame_time"})
    private long maxFrameTimeMs = DEFAULT_MAX_FRAME_TIME_MS;

    @SerializedName(value = "Strikes", alternate = {"strikes"})
    private int strikes = DEFAULT_STRIKES;

    @SerializedName(value = "RealTime", alternate = {"real_time"})
    private boolean realTime = false;

    // Accepted for compatibility; visualization is not implemented.
    @SerializedName(value = "Visualize", alternate = {"visualize"})
    private boolean visualize = false;

    private MatchConfig() {
    }

    /**
     * Parses and validates a supervisor request.
     *
     * @param json The JSON payload.
     * @return the validated configuration.
     * @throws MatchConfigException if the payload is not a JSON object or fails validation.
     */
    public static MatchConfig fromJson(String json) {
        MatchConfig config;
        try {
            config = GSON.fromJson(json, MatchConfig.class);
        } catch (JsonParseException e) {
            throw new MatchConfigException("Match configuration is not valid JSON: " + e.getMessage(), e);
        }
        if (config == null) {
            throw new MatchConfigException("Match configuration is empty");
        }
        config.normalize();
        config.validate();
        return config;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Checks the configuration invariants.
     *
     * @throws MatchConfigException if a field is missing or out of range.
     */
    public void validate() {
        if (mapName.isBlank()) {
            throw new MatchConfigException("Map must be set");
        }
        if (player1.isBlank() || player2.isBlank()) {
            throw new MatchConfigException("Both Player1 and Player2 must be set");
        }
        if (player1.equals(player2)) {
            throw new MatchConfigException("Player1 and Player2 must differ, both are '" + player1 + "'");
        }
        if (maxGameTime < 0) {
            throw new MatchConfigException("MaxGameTime must not be negative: " + maxGameTime);
        }
        if (maxFrameTimeMs <= 0) {
            throw new MatchConfigException("MaxFrameTime must be positive: " + maxFrameTimeMs);
        }
        if (strikes < 0) {
            throw new MatchConfigException("Strikes must not be negative: " + strikes);
        }
    }

    private void normalize() {
        mapName = Objects.requireNonNullElse(mapName, "");
        player1 = Objects.requireNonNullElse(player1, "");
        player2 = Objects.requireNonNullElse(player2, "");
        replayPath = Objects.requireNonNullElse(replayPath, "");
        replayName = Objects.requireNonNullElse(replayName, "");
        matchId = Objects.requireNonNullElse(matchId, "");
    }

    public String getMapName() {
        return mapName;
    }

    /**
     * @return the map file the engine loads, relative to its map directory: the map name without
     *         spaces, with the {@code .SC2Map} extension added if missing.
     */
    public String getMapFile() {
        String file = mapName.replace(" ", "");
        return file.toLowerCase(Locale.ROOT).endsWith(".sc2map") ? file : file + ".SC2Map";
    }

    /**
     * @return the maximum number of steps; {@code 0} means unlimited.
     */
    public long getMaxGameTime() {
        return maxGameTime;
    }

    public String getPlayer1() {
        return player1;
    }

    public String getPlayer2() {
        return player2;
    }

    /**
     * @param slot The slot.
     * @return the configured player identifier for the slot.
     */
    public String getPlayer(PlayerSlot slot) {
        return slot == PlayerSlot.PLAYER_1 ? player1 : player2;
    }

    public String getReplayPath() {
        return replayPath;
    }

    public boolean isReplayRequested() {
        return !replayPath.isBlank();
    }

    public String getReplayName() {
        return replayName;
    }

    public String getMatchId() {
        return matchId;
    }

    public boolean isDisableDebug() {
        return disableDebug;
    }

    public Duration getMaxFrameTime() {
        return Duration.ofMillis(maxFrameTimeMs);
    }

    /**
     * @return the strike threshold; {@code 0} disables forfeits.
     */
    public int getStrikes() {
        return strikes;
    }

    public boolean isRealTime() {
        return realTime;
    }

    public boolean isVisualize() {
        return visualize;
    }

    @Override
    public String toString() {
        return "MatchConfig{matchId=" + matchId + ", map=" + mapName + ", players=" + player1 + " vs " + player2
            + ", maxGameTime=" + maxGameTime + ", maxFrameTime=" + maxFrameTimeMs + "ms, strikes=" + strikes
            + ", realTime=" + realTime + ", disableDebug=" + disableDebug + "}";
    }

    /**
     * Programmatic construction, used by tests and tools.
     */
    public static final class Builder {
        private final MatchConfig config = new MatchConfig();

        private Builder() {
        }

        public Builder map(String mapName) {
            config.mapName = mapName;
            return this;
        }

        public Builder maxGameTime(long steps) {
            config.maxGameTime = steps;
            return this;
        }

        public Builder players(String player1, String player2) {
            config.player1 = player1;
            config.player2 = player2;
            return this;
        }

        public Builder replayPath(String replayPath) {
            config.replayPath = replayPath;
            return this;
        }

        public Builder replayName(String replayName) {
            config.replayName = replayName;
            return this;
        }

        public Builder matchId(String matchId) {
            config.matchId = matchId;
            return this;
        }

        public Builder disableDebug(boolean disableDebug) {
            config.disableDebug = disableDebug;
            return this;
        }

        public Builder maxFrameTime(Duration maxFrameTime) {
            config.maxFrameTimeMs = maxFrameTime.toMillis();
            return this;
        }

        public Builder strikes(int strikes) {
            config.strikes = strikes;
            return this;
        }

        public Builder realTime(boolean realTime) {
            config.realTime = realTime;
            return this;
        }

        /**
         * @return the validated configuration.
         * @throws MatchConfigException if validation fails.
         */
        public MatchConfig build() {
            config.normalize();
            config.validate();
            return config;
        }
    }
}
