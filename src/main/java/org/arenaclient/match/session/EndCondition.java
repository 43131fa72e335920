package org.arenaclient.match.session;

import org.arenaclient.match.model.EndReason;
import org.arenaclient.match.model.MatchOutcome;
import org.arenaclient.match.model.PlayerSlot;

/**
 * Why and how a session ended, before it is turned into a {@link org.arenaclient.match.model.MatchResult}.
 *
 * @param outcome The outcome tag.
 * @param reason  The end reason.
 * @param loser   The losing or erroring slot, or {@code null}.
 * @param detail  Diagnostic text for logs.
 */
public record EndCondition(MatchOutcome outcome, EndReason reason, PlayerSlot loser, String detail) {

    /**
     * The given slot loses, its opponent wins.
     */
    public static EndCondition forfeit(PlayerSlot loser, EndReason reason, String detail) {
        return new EndCondition(MatchOutcome.winFor(loser.opponent()), reason, loser, detail);
    }

    public static EndCondition win(PlayerSlot winner, EndReason reason) {
        return new EndCondition(MatchOutcome.winFor(winner), reason, winner.opponent(), null);
    }

    public static EndCondition tie(EndReason reason, String detail) {
        return new EndCondition(MatchOutcome.TIE, reason, null, detail);
    }

    public static EndCondition crash(EndReason reason, String detail) {
        return new EndCondition(MatchOutcome.CRASH, reason, null, detail);
    }

    public static EndCondition error(EndReason reason, PlayerSlot culprit, String detail) {
        return new EndCondition(MatchOutcome.ERROR, reason, culprit, detail);
    }
}
