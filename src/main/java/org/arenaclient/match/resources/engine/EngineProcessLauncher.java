package org.arenaclient.match.resources.engine;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.arenaclient.match.api.engine.EngineLaunchException;
import org.arenaclient.match.model.MatchConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Spawns engine processes from a command line template and stops them.
 * <p>
 * Each template element may contain the placeholders {@code {host}}, {@code {port}},
 * {@code {workDir}}, {@code {map}}, {@code {matchId}} and {@code {realTime}}. The process runs in
 * the session's working directory with stdout and stderr appended to {@code engine.log} there.
 */
public class EngineProcessLauncher {

    static final String ENGINE_LOG = "engine.log";

    private static final Logger log = LoggerFactory.getLogger(EngineProcessLauncher.class);

    private final List<String> commandTemplate;

    /**
     * @param commandTemplate The command line template.
     */
    public EngineProcessLauncher(List<String> commandTemplate) {
        this.commandTemplate = List.copyOf(commandTemplate);
    }

    /**
     * Starts an engine process.
     *
     * @param config        The match the engine is for.
     * @param host          Host the engine binds.
     * @param port          Port the engine binds.
     * @param workDirectory The session's working directory, which must exist.
     * @return the running process.
     * @throws EngineLaunchException if the process cannot be spawned.
     */
    public Process launch(MatchConfig config, String host, int port, Path workDirectory) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("host", host);
        values.put("port", String.valueOf(port));
        values.put("workDir", workDirectory.toAbsolutePath().toString());
        values.put("map", config.getMapName());
        values.put("matchId", config.getMatchId());
        values.put("realTime", String.valueOf(config.isRealTime()));
        List<String> command = render(commandTemplate, values);

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(workDirectory.toFile());
        pb.redirectErrorStream(true);
        pb.redirectOutput(ProcessBuilder.Redirect.appendTo(workDirectory.resolve(ENGINE_LOG).toFile()));
        try {
            Process process = pb.start();
            log.debug("Engine started with pid {}: {}", process.pid(), command);
            return process;
        } catch (IOException e) {
            throw new EngineLaunchException("Failed to start engine '" + command.get(0) + "': " + e.getMessage(), e);
        }
    }

    /**
     * Substitutes placeholders in every template element.
     *
     * @param template The template.
     * @param values   Placeholder values by name.
     * @return the command line.
     */
    static List<String> render(List<String> template, Map<String, String> values) {
        List<String> command = new ArrayList<>(template.size());
        for (String element : template) {
            String rendered = element;
            for (Map.Entry<String, String> value : values.entrySet()) {
                rendered = rendered.replace("{" + value.getKey() + "}", value.getValue());
            }
            command.add(rendered);
        }
        return command;
    }

    /**
     * Stops a process and its descendants: graceful signal first, forced kill once the grace
     * period has passed.
     *
     * @param process The process.
     * @param grace   Time allowed for a graceful exit.
     */
    public static void terminate(Process process, Duration grace) {
        if (!process.isAlive()) {
            return;
        }
        process.descendants().forEach(ProcessHandle::destroy);
        process.destroy();
        try {
            if (!process.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Engine pid {} did not exit within {} ms, killing it", process.pid(), grace.toMillis());
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
                process.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
        }
    }
}
