package net.stemmaweb.prep.parser;

import net.stemmaweb.prep.model.CollationModel;
import net.stemmaweb.prep.model.ParallelModel;
import net.stemmaweb.prep.model.TestimonyModel;

/**
 * A witness named in the collation as name or name:h, resolved against one parallel.
 */
public class WitnessReference {

    public enum Status {
        FOUND,
        NOT_FOUND,      // no such witness, or the root
        BAD_HAND,       // hand number out of range
        SUPPRESSED,     // the hand is suppressed, or the token was struck out with '-'
    }

    private final String token;
    private final Status status;
    private final int witness;
    private final int hand;

    private WitnessReference(String token, Status status, int witness, int hand) {
        this.token = token;
        this.status = status;
        this.witness = witness;
        this.hand = hand;
    }

    /**
     * Resolves a witness token in the given parallel.
     *
     * @param collation - the collation with its declared witnesses
     * @param parallel - the parallel whose suppression flags apply
     * @param token - the token as written
     * @return the reference, whose status says whether a usable hand was found
     */
    public static WitnessReference resolve(CollationModel collation, ParallelModel parallel, String token) {
        String name = token;
        // ECM data uses the dot as a witness separator
        if (name.endsWith("."))
            name = name.substring(0, name.length() - 1);
        if (name.startsWith("-"))
            return new WitnessReference(token, Status.SUPPRESSED, -1, 0);

        int hand = 0;
        int colon = name.indexOf(':');
        if (colon >= 0) {
            try {
                hand = Integer.parseInt(name.substring(colon + 1));
            } catch (NumberFormatException e) {
                return new WitnessReference(token, Status.BAD_HAND, -1, 0);
            }
            if (hand < 0 || hand >= TestimonyModel.MAX_HANDS)
                return new WitnessReference(token, Status.BAD_HAND, -1, hand);
            name = name.substring(0, colon);
        }

        int ms = collation.findWitness(name);
        if (ms < 0 || collation.isRoot(ms))
            return new WitnessReference(token, Status.NOT_FOUND, -1, hand);
        if (parallel.getTestimony(ms).getHand(hand).isSuppressed())
            return new WitnessReference(token, Status.SUPPRESSED, ms, hand);
        return new WitnessReference(token, Status.FOUND, ms, hand);
    }

    public String getToken() { return token; }
    public Status getStatus() { return status; }
    public int getWitness() { return witness; }
    public int getHand() { return hand; }

    public boolean isFound() {
        return status == Status.FOUND;
    }

    /**
     * @return true if the token named a hand explicitly, as name:h
     */
    public boolean hasHandSuffix() {
        return token.indexOf(':') >= 0;
    }
}
