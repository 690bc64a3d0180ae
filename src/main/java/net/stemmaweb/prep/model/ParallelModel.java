package net.stemmaweb.prep.model;

import java.util.ArrayList;
import java.util.List;

/**
 * An alternate textual tradition. Parallels share the witness list but each assigns
 * readings independently, under its own macros.
 */
public class ParallelModel {

    // Namespace code of the single parallel of a collation that declares none
    public static final char DEFAULT_CODE = '\0';

    private final int index;
    private final char code;
    private String position = "Beginning";
    private final MacroRegistry macros;
    private final List<TestimonyModel> testimonies = new ArrayList<>();

    public ParallelModel(int index, char code, List<WitnessModel> witnesses, MacroSequence macroSequence) {
        this.index = index;
        this.code = code;
        this.macros = new MacroRegistry(witnesses.size(), macroSequence);
        for (WitnessModel w : witnesses)
            testimonies.add(new TestimonyModel(w, this));
    }

    public int getIndex() { return index; }
    public char getCode() { return code; }

    public boolean hasCode() {
        return code != DEFAULT_CODE;
    }

    public String getPosition() { return position; }
    public void setPosition(String position) { this.position = position; }

    public MacroRegistry getMacros() { return macros; }

    public TestimonyModel getTestimony(int witness) { return testimonies.get(witness); }
    public List<TestimonyModel> getTestimonies() { return testimonies; }
}
