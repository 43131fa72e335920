package org.arenaclient.match.session;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.arenaclient.match.model.PlayerSlot;

/**
 * Per-session strike counts. Counts only ever increase.
 */
public final class StrikeLedger {

    private final int threshold;
    private final Map<PlayerSlot, List<Long>> strikeSteps = new EnumMap<>(PlayerSlot.class);

    /**
     * @param threshold Strike count that forfeits a bot; {@code 0} disables forfeits.
     */
    public StrikeLedger(int threshold) {
        this.threshold = threshold;
        for (PlayerSlot slot : PlayerSlot.values()) {
            strikeSteps.put(slot, new ArrayList<>());
        }
    }

    /**
     * Records one strike.
     *
     * @param slot The offending bot.
     * @param step The step the strike belongs to.
     * @return the bot's new strike count.
     */
    public synchronized int record(PlayerSlot slot, long step) {
        List<Long> steps = strikeSteps.get(slot);
        steps.add(step);
        return steps.size();
    }

    public synchronized int count(PlayerSlot slot) {
        return strikeSteps.get(slot).size();
    }

    /**
     * @param slot The bot.
     * @return the steps on which the bot was struck, in order.
     */
    public synchronized List<Long> steps(PlayerSlot slot) {
        return List.copyOf(strikeSteps.get(slot));
    }

    public synchronized boolean hasReachedThreshold(PlayerSlot slot) {
        return threshold > 0 && strikeSteps.get(slot).size() >= threshold;
    }

    public int threshold() {
        return threshold;
    }
}
