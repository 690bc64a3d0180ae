package net.stemmaweb.prep.model;

import java.util.BitSet;
import java.util.Map;
import java.util.TreeMap;

/**
 * The macros of one parallel, by one-character name. Every registry starts with the two
 * reserved macros: $* holding all witnesses at the lowest priority, and $? (witnesses
 * whose reading is unknown) which outranks every macro defined in the collation.
 */
public class MacroRegistry {

    private final Map<Character, MacroModel> macros = new TreeMap<>();
    private final MacroSequence sequence;

    /**
     * @param witnessCount - the number of declared witnesses, all of which join $*
     * @param sequence - the run-wide creation counter that breaks ties between macro priorities
     */
    public MacroRegistry(int witnessCount, MacroSequence sequence) {
        this.sequence = sequence;
        MacroModel all = new MacroModel(MacroModel.ALL,
                new Priority(Priority.Rank.ALL, sequence.next()));
        for (int ms = 0; ms < witnessCount; ms++)
            all.add(ms);
        macros.put(MacroModel.ALL, all);
        macros.put(MacroModel.UNKNOWN, new MacroModel(MacroModel.UNKNOWN,
                new Priority(Priority.Rank.UNKNOWN, 0)));
    }

    public MacroModel resolve(char name) {
        return macros.get(name);
    }

    public MacroModel getAll() {
        return macros.get(MacroModel.ALL);
    }

    public MacroModel getUnknown() {
        return macros.get(MacroModel.UNKNOWN);
    }

    // New macros rank above every macro created before them
    private MacroModel obtain(char name) {
        return macros.computeIfAbsent(name, x -> new MacroModel(x,
                new Priority(Priority.Rank.MACRO, sequence.next())));
    }

    /**
     * Replaces the membership of a macro, creating it if need be.
     *
     * @param name - the macro name
     * @param members - the witness indices of the new membership
     * @return the macro
     */
    public MacroModel define(char name, BitSet members) {
        MacroModel macro = obtain(name);
        macro.clear();
        members.stream().forEach(macro::add);
        return macro;
    }

    public MacroModel add(char name, BitSet members) {
        MacroModel macro = obtain(name);
        members.stream().forEach(macro::add);
        return macro;
    }

    public MacroModel subtract(char name, BitSet members) {
        MacroModel macro = obtain(name);
        members.stream().forEach(macro::remove);
        return macro;
    }

    /**
     * Checks membership without changing the macro.
     *
     * @param name - the macro name
     * @param members - the witness indices expected to be members
     * @return the indices that are not members, or null if there is no such macro
     */
    public BitSet check(char name, BitSet members) {
        MacroModel macro = macros.get(name);
        if (macro == null)
            return null;
        BitSet failing = new BitSet();
        members.stream().filter(ms -> !macro.contains(ms)).forEach(failing::set);
        return failing;
    }
}
