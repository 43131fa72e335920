package org.arenaclient.match.protocol;

import java.util.Locale;

import org.arenaclient.match.model.MatchResult;
import org.arenaclient.match.model.PlayerSlot;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;

/**
 * JSON text messages of the supervisor protocol.
 */
public final class SupervisorMessages {

    public static final String PING = "Ping";
    public static final String PONG = "Pong";
    public static final String QUIT = "Quit";
    public static final String RESET = "Reset";

    private static final Gson GSON = new GsonBuilder().serializeNulls().create();

    private SupervisorMessages() {
    }

    public static String connected() {
        return status("Connected");
    }

    /**
     * @param position 1-based position in the admission queue.
     * @return the queue notification.
     */
    public static String queued(int position) {
        JsonObject json = new JsonObject();
        json.addProperty("Status", "Queued");
        json.addProperty("Position", position);
        return GSON.toJson(json);
    }

    public static String configReceived() {
        JsonObject json = new JsonObject();
        json.addProperty("Config", "Received");
        return GSON.toJson(json);
    }

    /**
     * @param slot The slot the bot was attached to.
     * @return the attach notification.
     */
    public static String botConnected(PlayerSlot slot) {
        JsonObject json = new JsonObject();
        json.addProperty("Bot", "Connected");
        json.addProperty("Slot", slot.number());
        return GSON.toJson(json);
    }

    /**
     * Terminal response for a request that was refused before a session could run.
     *
     * @param reason Why the request was refused.
     * @return the rejection.
     */
    public static String rejected(String reason) {
        JsonObject json = new JsonObject();
        json.addProperty("Status", "Rejected");
        json.addProperty("Error", reason);
        return GSON.toJson(json);
    }

    /**
     * Non-terminal error about a single supervisor message.
     *
     * @param message The error.
     * @return the error message.
     */
    public static String error(String message) {
        JsonObject json = new JsonObject();
        json.addProperty("Error", message);
        return GSON.toJson(json);
    }

    /**
     * Terminal response carrying a match result.
     *
     * @param result         The result.
     * @param stepsPerSecond Engine steps per game second, used for the game-time fields.
     * @return the result payload.
     */
    public static String result(MatchResult result, double stepsPerSecond) {
        JsonObject json = new JsonObject();
        json.addProperty("MatchID", result.matchId());
        json.addProperty("Status", "Complete");
        json.addProperty("Outcome", result.outcome().wireName());
        json.addProperty("Reason", result.reason().wireName());
        json.addProperty("Loser", result.loserId().orElse(null));

        JsonObject results = new JsonObject();
        JsonObject frameTimes = new JsonObject();
        JsonObject strikes = new JsonObject();
        JsonObject bots = new JsonObject();
        for (PlayerSlot slot : PlayerSlot.values()) {
            String player = result.players().getOrDefault(slot, "");
            bots.addProperty(String.valueOf(slot.number()), player);
            if (result.playerResults().containsKey(slot)) {
                results.addProperty(player, result.playerResults().get(slot).wireName());
            }
            frameTimes.addProperty(player, result.averageFrameTimeMs().getOrDefault(slot, 0.0));
            strikes.addProperty(player, result.strikesOf(slot));
        }
        json.add("Result", results);

        double seconds = stepsPerSecond > 0 ? result.steps() / stepsPerSecond : 0;
        json.addProperty("GameTime", result.steps());
        json.addProperty("GameLoop", result.gameLoop());
        json.addProperty("GameTimeSeconds", seconds);
        json.addProperty("GameTimeFormatted", formatGameTime(seconds));
        json.addProperty("ElapsedMs", result.elapsed().toMillis());
        json.add("AverageFrameTime", frameTimes);
        json.add("Strikes", strikes);
        json.add("Bots", bots);
        json.addProperty("Map", result.mapName());
        json.addProperty("ReplayPath", result.replayPath());
        return GSON.toJson(json);
    }

    static String formatGameTime(double seconds) {
        long total = (long) seconds;
        return String.format(Locale.ROOT, "%02d:%02d", total / 60, total % 60);
    }

    private static String status(String value) {
        JsonObject json = new JsonObject();
        json.addProperty("Status", value);
        return GSON.toJson(json);
    }
}
