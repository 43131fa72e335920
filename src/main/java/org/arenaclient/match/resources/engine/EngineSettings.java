package org.arenaclient.match.resources.engine;

import java.time.Duration;
import java.util.List;

import com.typesafe.config.Config;

/**
 * How engine processes are launched and reached.
 *
 * @param command              Command line template, see {@link EngineProcessLauncher}.
 * @param endpointPath         Path of the engine's control endpoint.
 * @param startupTimeout       How long the control endpoint may take to become reachable.
 * @param connectRetryInterval Pause between connection attempts during startup.
 * @param maxFrameSize         Largest frame accepted from the engine, in bytes.
 */
public record EngineSettings(
    List<String> command,
    String endpointPath,
    Duration startupTimeout,
    Duration connectRetryInterval,
    int maxFrameSize
) {

    public EngineSettings {
        command = List.copyOf(command);
        if (command.isEmpty()) {
            throw new IllegalArgumentException("Engine command must not be empty");
        }
    }

    /**
     * Reads the {@code engine} block of the coordinator options.
     *
     * @param options The {@code engine} block.
     * @return the settings.
     */
    public static EngineSettings fromConfig(Config options) {
        if (!options.hasPath("command")) {
            throw new IllegalArgumentException("'command' must be configured for the engine.");
        }
        return new EngineSettings(
            options.getStringList("command"),
            options.hasPath("endpointPath") ? options.getString("endpointPath") : "/sc2api",
            options.hasPath("startupTimeout") ? options.getDuration("startupTimeout") : Duration.ofSeconds(60),
            options.hasPath("connectRetryInterval") ? options.getDuration("connectRetryInterval") : Duration.ofMillis(500),
            maxFrameSize(options));
    }

    private static int maxFrameSize(Config options) {
        if (!options.hasPath("maxFrameSize")) {
            return 64 * 1024 * 1024;
        }
        return (int) Math.min(Integer.MAX_VALUE, options.getMemorySize("maxFrameSize").toBytes());
    }
}
