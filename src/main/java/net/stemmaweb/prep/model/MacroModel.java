package net.stemmaweb.prep.model;

import java.util.BitSet;

/**
 * A named, prioritized set of witnesses within one parallel. Members are held by
 * witness index.
 */
public class MacroModel {

    public static final char ALL = '*';
    public static final char UNKNOWN = '?';

    private final char name;
    private final Priority priority;
    private final BitSet members = new BitSet();

    public MacroModel(char name, Priority priority) {
        this.name = name;
        this.priority = priority;
    }

    public char getName() { return name; }
    public Priority getPriority() { return priority; }

    public boolean contains(int witness) {
        return members.get(witness);
    }

    public void add(int witness) {
        members.set(witness);
    }

    public void remove(int witness) {
        members.clear(witness);
    }

    public void clear() {
        members.clear();
    }

    public void addAll(MacroModel other) {
        members.or(other.members);
    }

    public void removeAll(MacroModel other) {
        members.andNot(other.members);
    }

    /**
     * @return the member witness indices in ascending order
     */
    public int[] memberIndices() {
        return members.stream().toArray();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    @Override
    public String toString() {
        return "$" + name;
    }
}
