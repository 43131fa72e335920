package org.arenaclient.match.model;

/**
 * Lifecycle states of a match session.
 * <pre>
 * IDLE -&gt; AWAITING_PLAYERS -&gt; LAUNCHING -&gt; IN_PROGRESS -&gt; ENDING -&gt; CLOSED
 *   any non-CLOSED state -&gt; FAILED
 * </pre>
 */
public enum SessionState {
    IDLE,
    AWAITING_PLAYERS,
    LAUNCHING,
    IN_PROGRESS,
    ENDING,
    CLOSED,
    FAILED;

    public boolean isTerminal() {
        return this == CLOSED || this == FAILED;
    }

    /**
     * @return {@code true} for states that count against the coordinator's concurrency bound.
     */
    public boolean isLive() {
        return this == AWAITING_PLAYERS || this == LAUNCHING || this == IN_PROGRESS || this == ENDING;
    }

    /**
     * Checks whether a transition from this state to {@code next} is allowed.
     *
     * @param next The target state.
     * @return {@code true} if the state machine permits the transition.
     */
    public boolean canTransitionTo(SessionState next) {
        if (next == FAILED) {
            return this != CLOSED && this != FAILED;
        }
        return switch (this) {
            case IDLE -> next == AWAITING_PLAYERS;
            case AWAITING_PLAYERS -> next == LAUNCHING;
            case LAUNCHING -> next == IN_PROGRESS;
            case IN_PROGRESS -> next == ENDING;
            case ENDING -> next == CLOSED;
            case CLOSED, FAILED -> false;
        };
    }
}
