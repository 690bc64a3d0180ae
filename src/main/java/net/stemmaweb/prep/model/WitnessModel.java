package net.stemmaweb.prep.model;

import org.checkerframework.checker.nullness.qual.NonNull;

/**
 * This model holds a witness. The input name is the sigil used in the collation, the
 * alternate name is used to match chronology entries (e.g. a Gregory-Aland number), and
 * the display name is what the output files show.
 */
public class WitnessModel implements Comparable<WitnessModel> {

    // Separator for inline aliases in the witness declaration, e.g. 01~0001~Sinaiticus
    public static final char ALIAS_SEPARATOR = '~';

    private final int index;
    private final String name;
    private String alternateName;
    private String displayName;

    public WitnessModel(int index, String name, String alternateName, String displayName) {
        this.index = index;
        this.name = name;
        this.alternateName = alternateName;
        this.displayName = displayName;
    }

    /**
     * Creates a witness from its declaration token, honoring inline aliasing.
     *
     * @param index - the stable index of the witness in this run
     * @param declaration - the token, of the form name[~alternate[~display]]
     * @return the new witness
     */
    public static WitnessModel fromDeclaration(int index, String declaration) {
        String[] parts = declaration.split(String.valueOf(ALIAS_SEPARATOR), 3);
        String name = parts[0];
        String alternate = parts.length > 1 ? parts[1] : name;
        String display = parts.length > 2 ? parts[2] : name;
        return new WitnessModel(index, name, alternate, display);
    }

    public int getIndex() { return index; }
    public String getName() { return name; }

    public String getAlternateName() { return alternateName; }
    public void setAlternateName(String alternateName) { this.alternateName = alternateName; }

    public String getDisplayName() { return displayName; }
    public void setDisplayName(String displayName) { this.displayName = displayName; }

    @Override
    public int compareTo(@NonNull WitnessModel wm) {
        return Integer.compare(this.index, wm.index);
    }

    @Override
    public String toString() {
        return name;
    }
}
