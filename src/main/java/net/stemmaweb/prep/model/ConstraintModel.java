package net.stemmaweb.prep.model;

import java.util.List;

/**
 * The chronological constraint on one surviving hand: its stratum, and every hand that
 * must have been written no later than it.
 */
public class ConstraintModel {

    private final String name;
    private final int stratum;
    private final List<String> predecessors;

    public ConstraintModel(String name, int stratum, List<String> predecessors) {
        this.name = name;
        this.stratum = stratum;
        this.predecessors = predecessors;
    }

    public String getName() { return name; }
    public int getStratum() { return stratum; }
    public List<String> getPredecessors() { return predecessors; }
}
