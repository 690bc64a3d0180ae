package net.stemmaweb.prep.model;

import java.util.ArrayList;
import java.util.List;

/**
 * The testimony of one witness within one parallel: the original hand and its correctors.
 */
public class TestimonyModel {

    // Hand 0 is the original scribe, the rest are successive correctors
    public static final int MAX_HANDS = 4;

    private final WitnessModel witness;
    private final ParallelModel parallel;
    private final List<HandModel> hands = new ArrayList<>();
    private boolean corrected = false;

    public TestimonyModel(WitnessModel witness, ParallelModel parallel) {
        this.witness = witness;
        this.parallel = parallel;
        for (int h = 0; h < MAX_HANDS; h++)
            hands.add(new HandModel(h));
    }

    public WitnessModel getWitness() { return witness; }
    public ParallelModel getParallel() { return parallel; }

    public HandModel getHand(int hand) { return hands.get(hand); }
    public List<HandModel> getHands() { return hands; }

    public HandModel getOriginal() { return hands.get(0); }

    /**
     * @return true if a corrector survives alongside the original hand
     */
    public boolean isCorrected() { return corrected; }
    public void setCorrected(boolean corrected) { this.corrected = corrected; }

    public boolean isWhollySuppressed() {
        return hands.stream().allMatch(HandModel::isSuppressed);
    }

    public void suppressAll() {
        hands.forEach(x -> x.setSuppressed(true));
    }

    public int survivingHands() {
        return (int) hands.stream().filter(x -> !x.isSuppressed()).count();
    }

    /**
     * Returns the nearest hand before the given one that has not been suppressed,
     * falling back on the original hand.
     *
     * @param hand - the hand number
     * @return the number of the nearest earlier surviving hand
     */
    public int nearestEarlierHand(int hand) {
        for (int h = hand - 1; h > 0; h--)
            if (!hands.get(h).isSuppressed())
                return h;
        return 0;
    }

    /**
     * Returns the reading in effect for the given hand at a piece, following the chain of
     * earlier hands for any piece the hand leaves unset.
     *
     * @param hand - the hand number
     * @param piece - the piece index
     * @return the reading-set, or null if no hand in the chain has data
     */
    public ReadingSet effectiveReading(int hand, int piece) {
        int h = hand;
        ReadingSet r = hands.get(h).getReading(piece);
        while (r == null && h > 0) {
            h = hands.get(h).getLastHand();
            r = hands.get(h).getReading(piece);
        }
        return r;
    }

    /**
     * Re-points every corrector at its nearest earlier surviving hand.
     */
    public void relinkHands() {
        for (int h = 1; h < MAX_HANDS; h++)
            hands.get(h).setLastHand(nearestEarlierHand(h));
    }
}
