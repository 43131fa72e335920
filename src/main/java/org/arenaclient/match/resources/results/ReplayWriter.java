package org.arenaclient.match.resources.results;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

import org.arenaclient.match.model.MatchConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes replay data produced by the engine to the requested location.
 * <p>
 * Data is written to a temporary file in the target directory and moved into place atomically,
 * so a reader never sees a partial replay. If the requested location cannot be written, the
 * replay goes to the fallback directory instead.
 */
public class ReplayWriter {

    static final String REPLAY_EXTENSION = ".SC2Replay";

    private static final Logger log = LoggerFactory.getLogger(ReplayWriter.class);

    private final Path fallbackDirectory;

    /**
     * @param fallbackDirectory Directory used when the requested path is unwritable.
     */
    public ReplayWriter(Path fallbackDirectory) {
        this.fallbackDirectory = fallbackDirectory;
    }

    /**
     * Writes a replay.
     *
     * @param config The match configuration holding the requested path.
     * @param data   The replay bytes.
     * @return the path actually written, or empty if no replay was requested or nothing could
     *         be written.
     */
    public Optional<Path> write(MatchConfig config, byte[] data) {
        if (!config.isReplayRequested() || data == null || data.length == 0) {
            return Optional.empty();
        }
        String fileName = fileName(config);
        try {
            Path requested = resolveTarget(config);
            fileName = requested.getFileName() != null ? requested.getFileName().toString() : fileName;
            writeAtomically(requested, data);
            log.info("Replay of match '{}' saved to {}", config.getMatchId(), requested);
            return Optional.of(requested);
        } catch (IOException | RuntimeException e) {
            log.warn("Cannot write replay to '{}': {}. Using fallback directory {}",
                config.getReplayPath(), e.getMessage(), fallbackDirectory);
        }

        Path fallback = fallbackDirectory.resolve(fileName);
        try {
            writeAtomically(fallback, data);
            log.info("Replay of match '{}' saved to {}", config.getMatchId(), fallback);
            return Optional.of(fallback);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to write replay of match '{}' to fallback {}: {}", config.getMatchId(), fallback, e.getMessage());
            return Optional.empty();
        }
    }

    static Path resolveTarget(MatchConfig config) {
        String requestedPath = config.getReplayPath();
        Path requested = Path.of(requestedPath);
        boolean directory = Files.isDirectory(requested) || requestedPath.endsWith("/") || requestedPath.endsWith("\\");
        return directory ? requested.resolve(fileName(config)) : requested;
    }

    static String fileName(MatchConfig config) {
        String base = !config.getReplayName().isBlank() ? config.getReplayName()
            : !config.getMatchId().isBlank() ? config.getMatchId()
            : config.getPlayer1() + "_vs_" + config.getPlayer2();
        return base.endsWith(REPLAY_EXTENSION) ? base : base + REPLAY_EXTENSION;
    }

    private static void writeAtomically(Path target, byte[] data) throws IOException {
        Path absolute = target.toAbsolutePath();
        Path directory = absolute.getParent();
        Files.createDirectories(directory);
        Path temp = Files.createTempFile(directory, ".replay-", ".tmp");
        try {
            Files.write(temp, data);
            Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
