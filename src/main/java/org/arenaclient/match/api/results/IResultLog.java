package org.arenaclient.match.api.results;

import java.util.List;

import org.arenaclient.match.model.MatchResult;

/**
 * Append-only durable log of completed matches.
 */
public interface IResultLog extends AutoCloseable {

    /**
     * Appends one row for a completed match.
     *
     * @param result The result.
     * @throws ResultLogException if the row cannot be written.
     */
    void append(MatchResult result);

    /**
     * Reads the most recent rows, newest first.
     *
     * @param limit Maximum number of rows.
     * @return the rows.
     * @throws ResultLogException if the log cannot be read.
     */
    List<ResultRecord> recent(int limit);

    @Override
    void close();
}
