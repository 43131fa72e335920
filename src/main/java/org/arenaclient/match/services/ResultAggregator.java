package org.arenaclient.match.services;

import java.nio.file.Path;
import java.util.Optional;

import org.arenaclient.match.api.results.IResultLog;
import org.arenaclient.match.api.results.ResultLogException;
import org.arenaclient.match.model.MatchResult;
import org.arenaclient.match.protocol.SupervisorMessages;
import org.arenaclient.match.resources.results.ReplayWriter;
import org.arenaclient.match.session.MatchRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finalizes a match: writes the replay, appends the result to the durable log and delivers the
 * result to the requesting supervisor.
 * <p>
 * A failure to persist the result is not fatal. It is logged, reported to the error sink and the
 * result is delivered anyway.
 */
public class ResultAggregator {

    private static final Logger log = LoggerFactory.getLogger(ResultAggregator.class);

    private final IResultLog resultLog;
    private final ReplayWriter replayWriter;
    private final double stepsPerSecond;
    private final ErrorSink errorSink;

    /**
     * Receives non-fatal errors, typically {@code AbstractService#recordError}.
     */
    @FunctionalInterface
    public interface ErrorSink {
        void record(String code, String message, String details);
    }

    /**
     * @param resultLog      The durable result log.
     * @param replayWriter   Writer for replay files.
     * @param stepsPerSecond Engine steps per game second, for the game-time fields.
     * @param errorSink      Sink for persistence failures.
     */
    public ResultAggregator(IResultLog resultLog, ReplayWriter replayWriter, double stepsPerSecond, ErrorSink errorSink) {
        this.resultLog = resultLog;
        this.replayWriter = replayWriter;
        this.stepsPerSecond = stepsPerSecond;
        this.errorSink = errorSink;
    }

    /**
     * Records and delivers a match result.
     *
     * @param request    The request the result answers.
     * @param result     The result, without replay path.
     * @param replayData Replay bytes from the engine, or {@code null}.
     * @return the final result as delivered.
     */
    public MatchResult complete(MatchRequest request, MatchResult result, byte[] replayData) {
        MatchResult finalResult = result;
        if (request.getConfig().isReplayRequested()) {
            Optional<Path> written = replayWriter.write(request.getConfig(), replayData);
            if (written.isPresent()) {
                finalResult = result.withReplayPath(written.get().toString());
            } else if (replayData == null || replayData.length == 0) {
                log.warn("Replay requested for match '{}' but the engine produced none", result.matchId());
            }
        }

        try {
            resultLog.append(finalResult);
        } catch (ResultLogException e) {
            log.warn("Failed to persist result of match '{}': {}", finalResult.matchId(), e.getMessage());
            errorSink.record("RESULT_PERSIST_FAILED", e.getMessage(),
                "Match: " + finalResult.matchId() + ", outcome: " + finalResult.outcome().wireName());
        }

        if (!request.respond(SupervisorMessages.result(finalResult, stepsPerSecond))) {
            log.warn("Request {} was already answered, dropping result of match '{}'",
                request.getSequence(), finalResult.matchId());
        }
        return finalResult;
    }
}
