package net.stemmaweb.prep.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A group of variation units whose states are entered together as one fixed-width
 * state string, so that readings depending on each other stay together.
 */
public class PieceModel {

    private final int index;
    private final String lemma;
    private final String position;
    private final List<VariationUnitModel> units = new ArrayList<>();

    public PieceModel(int index, String lemma, String position) {
        this.index = index;
        this.lemma = lemma;
        this.position = position;
    }

    public int getIndex() { return index; }
    public String getLemma() { return lemma; }
    public String getPosition() { return position; }

    public List<VariationUnitModel> getUnits() { return units; }
    public void addUnit(VariationUnitModel unit) { units.add(unit); }

    public int size() {
        return units.size();
    }
}
