package net.stemmaweb.prep.model;

/**
 * The state string entered for one witness block, one character per variation unit
 * of the piece. Instances are shared by every hand the block assigns them to and are
 * never changed afterwards.
 *
 * NOTE: equals() is deliberately not overridden. Two witnesses count as identical
 * only when they hold the same instance, not when their states happen to match.
 */
public final class ReadingSet {

    public static final char MISSING = '?';
    public static final char LACUNOSE = '.';
    public static final char UNASSIGNED = ':';

    private final String states;

    public ReadingSet(String entered) {
        this.states = entered.replace(LACUNOSE, MISSING).replace(UNASSIGNED, MISSING);
    }

    public char stateAt(int unit) {
        return states.charAt(unit);
    }

    public int length() {
        return states.length();
    }

    public String getStates() {
        return states;
    }

    @Override
    public String toString() {
        return states;
    }
}
