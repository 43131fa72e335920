package org.arenaclient.match.api.resources;

import java.time.Instant;

/**
 * A transient error that did not stop the component reporting it.
 *
 * @param timestamp When the error occurred.
 * @param code      Error code for categorization (e.g. {@code RESULT_PERSIST_FAILED}).
 * @param message   Human-readable message.
 * @param details   Additional context.
 */
public record OperationalError(Instant timestamp, String code, String message, String details) {
}
