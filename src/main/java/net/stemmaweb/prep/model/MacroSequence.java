package net.stemmaweb.prep.model;

/**
 * The run-wide creation counter of macros. A macro created later outranks every macro
 * created before it, in whichever parallel.
 */
public class MacroSequence {

    private long next;

    public MacroSequence(long first) {
        this.next = first;
    }

    public long next() {
        return next++;
    }
}
