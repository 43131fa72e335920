package org.arenaclient.match.session;

import java.nio.file.Path;
import java.time.Duration;

import com.typesafe.config.Config;

/**
 * Node-wide timing and tolerance settings shared by all match sessions.
 *
 * @param playerConnectTimeout  How long a session waits for both bots to attach.
 * @param joinTimeout           How long the join handshake with a started engine may take.
 * @param engineResponseTimeout How long one engine exchange may take before the engine counts
 *                              as unresponsive.
 * @param terminationGrace      Time between the graceful and the forced engine termination.
 * @param realTimeStepInterval  Tick length in real-time mode.
 * @param maxDecodeErrors       Malformed frames tolerated per bot; the next one forfeits.
 * @param stepsPerSecond        Engine steps per game second, for reporting.
 * @param workDirectory         Parent directory of the per-session working directories.
 */
public record SessionSettings(
    Duration playerConnectTimeout,
    Duration joinTimeout,
    Duration engineResponseTimeout,
    Duration terminationGrace,
    Duration realTimeStepInterval,
    int maxDecodeErrors,
    double stepsPerSecond,
    Path workDirectory
) {

    /**
     * Reads the {@code session} block of the coordinator options. Missing keys use defaults.
     *
     * @param options The {@code session} block.
     * @return the settings.
     */
    public static SessionSettings fromConfig(Config options) {
        return new SessionSettings(
            duration(options, "playerConnectTimeout", Duration.ofMinutes(2)),
            duration(options, "joinTimeout", Duration.ofMinutes(2)),
            duration(options, "engineResponseTimeout", Duration.ofSeconds(60)),
            duration(options, "terminationGrace", Duration.ofSeconds(5)),
            duration(options, "realTimeStepInterval", Duration.ofMillis(45)),
            options.hasPath("maxDecodeErrors") ? options.getInt("maxDecodeErrors") : 3,
            options.hasPath("stepsPerSecond") ? options.getDouble("stepsPerSecond") : 22.4,
            Path.of(options.hasPath("workDirectory") ? options.getString("workDirectory") : "sessions"));
    }

    private static Duration duration(Config options, String path, Duration fallback) {
        return options.hasPath(path) ? options.getDuration(path) : fallback;
    }
}
