package net.stemmaweb.prep.model;

import java.util.ArrayList;
import java.util.List;

/**
 * One place in the text where witnesses may disagree.
 */
public class VariationUnitModel {

    /**
     * The index of the unit across the whole collation
     */
    private final int index;
    /**
     * How many matrix columns the unit contributes; 0 excludes it
     */
    private int weight;
    /**
     * The reading texts listed for the unit, in order
     */
    private final List<String> readings = new ArrayList<>();

    public VariationUnitModel(int index, int weight) {
        this.index = index;
        this.weight = weight;
    }

    public int getIndex() { return index; }

    public int getWeight() { return weight; }
    public void setWeight(int weight) { this.weight = weight; }

    public List<String> getReadings() { return readings; }
    public void addReading(String reading) { readings.add(reading); }
}
