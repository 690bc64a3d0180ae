package net.stemmaweb.prep.model;

import java.util.ArrayList;

/**
 * The testimony of one hand (the original scribe, or one corrector) of a witness
 * within one parallel.
 */
public class HandModel {

    // Latest bound for a hand with no chronology entry
    public static final int OPEN_DATE = Integer.MAX_VALUE;

    /**
     * The hand number; 0 is the original scribe
     */
    private final int index;
    /**
     * The reading-set assigned at each piece, or null where this hand has no data
     */
    private final ArrayList<ReadingSet> readings = new ArrayList<>();
    private boolean suppressed;
    private boolean mandated;
    private boolean inLacuna;
    /**
     * Priority of the assignment made in the current witness block
     */
    private Priority level = Priority.NONE;
    /**
     * The nearest earlier hand that survives, from which unset pieces are inherited
     */
    private int lastHand;

    private int earliest = 0;
    private int average = 0;
    private int latest = OPEN_DATE;
    private boolean chronologySet = false;
    private int stratum;

    public HandModel(int index) {
        this.index = index;
        this.lastHand = index > 0 ? index - 1 : 0;
    }

    public int getIndex() { return index; }

    public ReadingSet getReading(int piece) {
        return piece < readings.size() ? readings.get(piece) : null;
    }

    public void setReading(int piece, ReadingSet reading) {
        while (readings.size() <= piece)
            readings.add(null);
        readings.set(piece, reading);
    }

    public void clearReading(int piece) {
        if (piece < readings.size())
            readings.set(piece, null);
    }

    public boolean isSuppressed() { return suppressed; }
    public void setSuppressed(boolean suppressed) { this.suppressed = suppressed; }

    public boolean isMandated() { return mandated; }
    public void setMandated(boolean mandated) { this.mandated = mandated; }

    public boolean isInLacuna() { return inLacuna; }
    public void setInLacuna(boolean inLacuna) { this.inLacuna = inLacuna; }

    public Priority getLevel() { return level; }
    public void setLevel(Priority level) { this.level = level; }

    public int getLastHand() { return lastHand; }
    public void setLastHand(int lastHand) { this.lastHand = lastHand; }

    public int getEarliest() { return earliest; }
    public int getAverage() { return average; }
    public int getLatest() { return latest; }

    public void setChronology(int earliest, int average, int latest) {
        this.earliest = earliest;
        this.average = average;
        this.latest = latest;
    }

    public boolean hasChronologyEntry() { return chronologySet; }
    public void setChronologyEntry(boolean chronologySet) { this.chronologySet = chronologySet; }

    public boolean isLatestOpen() { return latest == OPEN_DATE; }

    public int getStratum() { return stratum; }
    public void setStratum(int stratum) { this.stratum = stratum; }
}
