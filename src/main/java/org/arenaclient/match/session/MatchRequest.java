package org.arenaclient.match.session;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

import org.arenaclient.match.api.connection.IConnection;
import org.arenaclient.match.model.MatchConfig;

/**
 * A supervisor's accepted match request and the channel its responses go to.
 * <p>
 * Any number of progress notifications may be sent, but exactly one terminal response: the
 * first {@link #respond(String)} wins and later calls are ignored.
 */
public final class MatchRequest {

    private final long sequence;
    private final MatchConfig config;
    private final IConnection supervisor;
    private final Instant receivedAt;
    private final AtomicBoolean answered = new AtomicBoolean();

    /**
     * @param sequence   Arrival number assigned by the coordinator.
     * @param config     The validated configuration.
     * @param supervisor The requesting supervisor.
     */
    public MatchRequest(long sequence, MatchConfig config, IConnection supervisor) {
        this.sequence = sequence;
        this.config = config;
        this.supervisor = supervisor;
        this.receivedAt = Instant.now();
    }

    /**
     * Sends a non-terminal message, unless the request is already answered.
     *
     * @param message JSON text.
     */
    public void progress(String message) {
        if (!answered.get()) {
            supervisor.sendText(message);
        }
    }

    /**
     * Sends the terminal response.
     *
     * @param message JSON text.
     * @return {@code true} if this call delivered the terminal response.
     */
    public boolean respond(String message) {
        if (!answered.compareAndSet(false, true)) {
            return false;
        }
        supervisor.sendText(message);
        return true;
    }

    public boolean isAnswered() {
        return answered.get();
    }

    public long getSequence() {
        return sequence;
    }

    public MatchConfig getConfig() {
        return config;
    }

    public IConnection getSupervisor() {
        return supervisor;
    }

    public Instant getReceivedAt() {
        return receivedAt;
    }
}
