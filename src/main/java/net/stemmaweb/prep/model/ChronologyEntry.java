package net.stemmaweb.prep.model;

/**
 * One line of a chronology file: a witness, by alternate name and possibly with a hand
 * number, and the earliest, average and latest dates of its writing.
 */
public class ChronologyEntry {

    private final String name;
    private final int earliest;
    private final int average;
    private final int latest;
    private final int line;

    public ChronologyEntry(String name, int earliest, int average, int latest, int line) {
        this.name = name;
        this.earliest = earliest;
        this.average = average;
        this.latest = latest;
        this.line = line;
    }

    public String getName() { return name; }
    public int getEarliest() { return earliest; }
    public int getAverage() { return average; }
    public int getLatest() { return latest; }
    public int getLine() { return line; }

    /**
     * @return the witness name without any :h suffix
     */
    public String getWitnessName() {
        int colon = name.indexOf(':');
        return colon < 0 ? name : name.substring(0, colon);
    }

    /**
     * @return the hand number given as :h, or 0; -1 if the suffix is not a number
     */
    public int getHand() {
        int colon = name.indexOf(':');
        if (colon < 0)
            return 0;
        try {
            return Integer.parseInt(name.substring(colon + 1));
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    @Override
    public String toString() {
        return String.format("%s %d %d %d", name, earliest, average, latest);
    }
}
