package net.stemmaweb.prep.model;

import org.checkerframework.checker.nullness.qual.NonNull;

/**
 * The priority with which a reading was assigned to a hand within one witness block.
 * Priorities are ordered first by rank, then by the creation sequence of the macro
 * that assigned the reading.
 */
public final class Priority implements Comparable<Priority> {

    public enum Rank {
        NONE,       // nothing assigned yet in this block
        ALL,        // the $* macro
        MACRO,      // a macro defined in the collation
        UNKNOWN,    // the $? macro
        EXPLICIT    // the witness was named directly
    }

    public static final Priority NONE = new Priority(Rank.NONE, 0);
    public static final Priority EXPLICIT = new Priority(Rank.EXPLICIT, 0);

    private final Rank rank;
    private final long sequence;

    public Priority(Rank rank, long sequence) {
        this.rank = rank;
        this.sequence = sequence;
    }

    public Rank getRank() { return rank; }
    public long getSequence() { return sequence; }

    public boolean isAbove(Priority other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(@NonNull Priority other) {
        int byRank = rank.compareTo(other.rank);
        return byRank != 0 ? byRank : Long.compare(sequence, other.sequence);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Priority)) return false;
        Priority p = (Priority) o;
        return rank == p.rank && sequence == p.sequence;
    }

    @Override
    public int hashCode() {
        return 31 * rank.hashCode() + Long.hashCode(sequence);
    }

    @Override
    public String toString() {
        return rank + "/" + sequence;
    }
}
