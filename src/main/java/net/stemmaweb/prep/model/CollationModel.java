package net.stemmaweb.prep.model;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The state of one run: the declared witnesses and parallels, the pieces and variation
 * units of the collation, and the testimony of every hand. It is built by the collation
 * parser and then passed through each later stage in turn.
 */
public class CollationModel {

    private final PrepConfig config;
    private final List<WitnessModel> witnesses = new ArrayList<>();
    private final List<ParallelModel> parallels = new ArrayList<>();
    private final List<PieceModel> pieces = new ArrayList<>();
    private final List<VariationUnitModel> units = new ArrayList<>();
    private final MacroSequence macroSequence = new MacroSequence(1);
    private boolean declared = false;
    private int currentParallel = 0;
    private int weightedTotal = 0;
    private int readingSetCount = 0;

    public CollationModel(PrepConfig config) {
        this.config = config;
    }

    public PrepConfig getConfig() { return config; }

    /**
     * Sets up witnesses and parallels from the declaration block. The configured root
     * witness, if any, takes index 0 and survives only as the original hand of the first
     * parallel, where it is mandated and dated to year 0.
     *
     * @param declarations - the witness tokens, in order, possibly with inline aliases
     * @param parallelCodes - the namespace codes of the parallels; empty for a single parallel
     */
    public void declare(List<String> declarations, List<Character> parallelCodes) {
        if (config.hasRoot())
            witnesses.add(WitnessModel.fromDeclaration(0, config.getRoot()));
        for (String d : declarations)
            witnesses.add(WitnessModel.fromDeclaration(witnesses.size(), d));

        List<Character> codes = parallelCodes.isEmpty()
                ? List.of(ParallelModel.DEFAULT_CODE) : parallelCodes;
        for (Character code : codes)
            parallels.add(new ParallelModel(parallels.size(), code, witnesses, macroSequence));

        if (config.hasRoot()) {
            for (ParallelModel p : parallels)
                p.getTestimony(0).suppressAll();
            HandModel rootHand = parallels.get(0).getTestimony(0).getOriginal();
            rootHand.setChronology(0, 0, 0);
            rootHand.setChronologyEntry(true);
            rootHand.setSuppressed(false);
            rootHand.setMandated(true);
        }
        declared = true;
    }

    public boolean isDeclared() { return declared; }

    public List<WitnessModel> getWitnesses() { return witnesses; }
    public WitnessModel getWitness(int index) { return witnesses.get(index); }

    /**
     * @param name - the input name of a witness
     * @return the witness index, or -1 if there is none by that name
     */
    public int findWitness(String name) {
        for (WitnessModel w : witnesses)
            if (w.getName().equals(name))
                return w.getIndex();
        return -1;
    }

    /**
     * @param alternateName - a cross-reference name, as used in chronology files
     * @return the indices of every witness carrying that alternate name
     */
    public List<Integer> findByAlternateName(String alternateName) {
        return witnesses.stream().filter(x -> x.getAlternateName().equals(alternateName))
                .map(WitnessModel::getIndex).collect(Collectors.toList());
    }

    public boolean isRoot(int witness) {
        return config.hasRoot() && witness == 0;
    }

    public List<ParallelModel> getParallels() { return parallels; }
    public ParallelModel getParallel(int index) { return parallels.get(index); }

    public ParallelModel getCurrentParallel() { return parallels.get(currentParallel); }
    public void setCurrentParallel(int index) { this.currentParallel = index; }

    /**
     * @param code - the namespace code
     * @return the index of the parallel, or -1 if no such parallel was declared
     */
    public int findParallel(char code) {
        for (ParallelModel p : parallels)
            if (p.getCode() == code)
                return p.getIndex();
        return -1;
    }

    public List<TestimonyModel> getAllTestimonies() {
        List<TestimonyModel> all = new ArrayList<>();
        parallels.forEach(x -> all.addAll(x.getTestimonies()));
        return all;
    }

    public PieceModel addPiece(String lemma, String position) {
        PieceModel piece = new PieceModel(pieces.size(), lemma, position);
        pieces.add(piece);
        return piece;
    }

    public List<PieceModel> getPieces() { return pieces; }

    public PieceModel getCurrentPiece() {
        return pieces.isEmpty() ? null : pieces.get(pieces.size() - 1);
    }

    public VariationUnitModel addUnit(PieceModel piece, int weight) {
        VariationUnitModel unit = new VariationUnitModel(units.size(), weight);
        units.add(unit);
        piece.addUnit(unit);
        weightedTotal += weight;
        return unit;
    }

    public List<VariationUnitModel> getUnits() { return units; }
    public VariationUnitModel getUnit(int index) { return units.get(index); }

    /**
     * Excludes a variation unit from the output, taking its weight off the total.
     *
     * @param unit - the unit to drop
     */
    public void eliminateUnit(VariationUnitModel unit) {
        weightedTotal -= unit.getWeight();
        unit.setWeight(0);
    }

    public int getWeightedTotal() { return weightedTotal; }

    public ReadingSet newReadingSet(String states) {
        readingSetCount++;
        return new ReadingSet(states);
    }

    public int getReadingSetCount() { return readingSetCount; }

    /**
     * The state shown for a hand that has no data at a unit: the root character for the
     * root in the first parallel, the missing marker otherwise.
     *
     * @param t - the testimony
     * @return the default state character
     */
    public char defaultState(TestimonyModel t) {
        return config.hasRoot() && t.getParallel().getIndex() == 0 && t.getWitness().getIndex() == 0
                ? config.getRootChar() : ReadingSet.MISSING;
    }

    /**
     * The state a hand shows at one unit of a piece, following inheritance from earlier hands.
     *
     * @param t - the testimony
     * @param hand - the hand number
     * @param piece - the piece
     * @param position - the position of the unit within the piece
     * @return the state character
     */
    public char stateOf(TestimonyModel t, int hand, PieceModel piece, int position) {
        ReadingSet r = t.effectiveReading(hand, piece.getIndex());
        return r == null ? defaultState(t) : r.stateAt(position);
    }

    public int activeHands() {
        return (int) getAllTestimonies().stream().mapToLong(TestimonyModel::survivingHands).sum();
    }

    /**
     * Names a hand the way the output files do: display name, then the hand number if the
     * witness has correctors, then the parallel code if there is more than one tradition.
     *
     * @param t - the testimony
     * @param hand - the hand number
     * @return the printable name
     */
    public static String handName(TestimonyModel t, int hand) {
        return qualifiedName(t, hand, t.getWitness().getDisplayName(), false);
    }

    /**
     * As handName(), but with the input name of the witness.
     *
     * @param t - the testimony
     * @param hand - the hand number
     * @return the name as it appears in the collation
     */
    public static String inputName(TestimonyModel t, int hand) {
        return qualifiedName(t, hand, t.getWitness().getName(), false);
    }

    /** Input name of a hand that always carries its hand number, as in {@code A:1/x}. */
    public static String correctorName(TestimonyModel t, int hand) {
        return qualifiedName(t, hand, t.getWitness().getName(), true);
    }

    private static String qualifiedName(TestimonyModel t, int hand, String base, boolean numbered) {
        StringBuilder sb = new StringBuilder(base);
        if (numbered || t.isCorrected())
            sb.append(':').append(hand);
        if (t.getParallel().hasCode())
            sb.append('/').append(t.getParallel().getCode());
        return sb.toString();
    }
}
