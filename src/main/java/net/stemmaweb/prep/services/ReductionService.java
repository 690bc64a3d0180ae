package net.stemmaweb.prep.services;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.stemmaweb.prep.model.CollationModel;
import net.stemmaweb.prep.model.HandModel;
import net.stemmaweb.prep.model.MacroModel;
import net.stemmaweb.prep.model.ParallelModel;
import net.stemmaweb.prep.model.PieceModel;
import net.stemmaweb.prep.model.PrepConfig;
import net.stemmaweb.prep.model.PrepConfigurationException;
import net.stemmaweb.prep.model.ReadingSet;
import net.stemmaweb.prep.model.TestimonyModel;
import net.stemmaweb.prep.model.VariationUnitModel;
import net.stemmaweb.prep.parser.WitnessReference;

/**
 * Decides which hands and variation units of an interpreted collation go into the output.
 * The passes run in a fixed order, since each later threshold depends on what the earlier
 * passes left standing:
 *
 * 1. hands named on the command line are mandated, and every other hand is dropped;
 * 2. constant variation units are dropped;
 * 3. fragmentary witnesses and insignificant correctors are dropped;
 * 4. constant variation units are dropped again;
 * 5. witnesses identical to an earlier witness are dropped;
 * 6. hands later than the year cutoff are dropped.
 */
public class ReductionService {

    private static final Logger logger = LoggerFactory.getLogger(ReductionService.class);

    // Collations with more units than this get a fixed correction threshold
    public static final int LARGE_COLLATION = 200;
    public static final int LARGE_CORRECTION_THRESHOLD = 100;

    private final CollationModel collation;
    private final PrepConfig config;
    private int fragmentThreshold;
    private int correctionThreshold;

    public ReductionService(CollationModel collation) {
        this.collation = collation;
        this.config = collation.getConfig();
    }

    /**
     * Runs every pass in order.
     *
     * @param mandatees - the witnesses and macros named on the command line, possibly empty
     * @throws PrepConfigurationException if a mandated name is unknown or already suppressed
     */
    public void reduce(List<String> mandatees) throws PrepConfigurationException {
        mandate(mandatees);
        relinkAll();
        suppressConstantVariants();
        suppressFragmentsAndCorrections();
        if (config.getIdenticalFirst()) {
            suppressIdentical();
            suppressConstantVariants();
        } else {
            suppressConstantVariants();
            suppressIdentical();
        }
        applyYearCutoff();

        for (TestimonyModel t : collation.getAllTestimonies()) {
            if (t.getOriginal().isSuppressed())
                t.suppressAll();
            t.relinkHands();
            t.setCorrected(t.survivingHands() > 1);
        }
    }

    public int getFragmentThreshold() {
        return fragmentThreshold;
    }

    public int getCorrectionThreshold() {
        return correctionThreshold;
    }

    /**
     * Marks the named hands as mandated and suppresses everything else. A name may be
     * qualified with /c to look it up in parallel c only; otherwise it is looked up in every
     * parallel. Mandating a corrector mandates its original hand too.
     *
     * @param mandatees - witness names, name:h, or macro names
     * @throws PrepConfigurationException if a name matches no unsuppressed hand
     */
    public void mandate(List<String> mandatees) throws PrepConfigurationException {
        if (mandatees.isEmpty())
            return;
        for (String mandatee : mandatees) {
            String name = mandatee;
            List<ParallelModel> parallels = collation.getParallels();
            int slash = name.lastIndexOf('/');
            if (slash > 0 && slash == name.length() - 2) {
                int pp = collation.findParallel(name.charAt(slash + 1));
                if (pp < 0)
                    throw new PrepConfigurationException("Unknown parallel: " + mandatee);
                parallels = List.of(collation.getParallel(pp));
                name = name.substring(0, slash);
            }
            if (name.startsWith("$"))
                mandateMacro(mandatee, name, parallels);
            else
                mandateWitness(mandatee, name, parallels);
        }

        for (TestimonyModel t : collation.getAllTestimonies())
            for (HandModel h : t.getHands())
                if (!h.isMandated())
                    h.setSuppressed(true);
    }

    private void mandateMacro(String mandatee, String name, List<ParallelModel> parallels)
            throws PrepConfigurationException {
        boolean found = false;
        for (ParallelModel p : parallels) {
            MacroModel macro = name.length() < 2 ? null : p.getMacros().resolve(name.charAt(1));
            if (macro == null)
                continue;
            found = true;
            for (int ms : macro.memberIndices())
                if (!collation.isRoot(ms))
                    p.getTestimony(ms).getOriginal().setMandated(true);
        }
        if (!found)
            throw new PrepConfigurationException("Unknown macro: " + mandatee);
        logger.info("Mandated {}", mandatee);
    }

    private void mandateWitness(String mandatee, String name, List<ParallelModel> parallels)
            throws PrepConfigurationException {
        boolean found = false;
        boolean suppressed = false;
        for (ParallelModel p : parallels) {
            WitnessReference ref = WitnessReference.resolve(collation, p, name);
            if (ref.getStatus() == WitnessReference.Status.SUPPRESSED && ref.getWitness() >= 0)
                suppressed = true;
            if (!ref.isFound())
                continue;
            found = true;
            TestimonyModel t = p.getTestimony(ref.getWitness());
            t.getHand(ref.getHand()).setMandated(true);
            t.getOriginal().setMandated(true);
        }
        if (!found)
            throw new PrepConfigurationException(
                    (suppressed ? "Already suppressed: " : "Unknown: ") + mandatee);
        logger.info("Mandated {}", mandatee);
    }

    private void relinkAll() {
        collation.getAllTestimonies().forEach(TestimonyModel::relinkHands);
    }

    /**
     * Drops every variation unit at which the surviving hands attest at most one state,
     * or, when singular readings are not wanted, at most one state twice or more.
     *
     * @return the number of units dropped
     */
    public int suppressConstantVariants() {
        int dropped = 0;
        List<TestimonyModel> testimonies = collation.getAllTestimonies();
        for (PieceModel piece : collation.getPieces()) {
            for (int u = 0; u < piece.size(); u++) {
                VariationUnitModel unit = piece.getUnits().get(u);
                if (unit.getWeight() == 0)
                    continue;
                Map<Character, Integer> counts = new HashMap<>();
                for (TestimonyModel t : testimonies) {
                    for (HandModel h : t.getHands()) {
                        if (h.isSuppressed())
                            continue;
                        char state = collation.stateOf(t, h.getIndex(), piece, u);
                        if (state != ReadingSet.MISSING)
                            counts.merge(state, 1, Integer::sum);
                    }
                }
                boolean constant = config.getNoSingular()
                        ? counts.values().stream().filter(x -> x >= 2).count() <= 1
                        : counts.size() <= 1;
                if (constant) {
                    collation.eliminateUnit(unit);
                    dropped++;
                }
            }
        }
        logger.debug("Dropped {} constant variation units, weighted total now {}",
                dropped, collation.getWeightedTotal());
        return dropped;
    }

    /**
     * Drops witnesses whose original hand has too few extant readings, and correctors
     * that differ too little from the hand they correct.
     */
    public void suppressFragmentsAndCorrections() {
        int total = collation.getWeightedTotal();
        fragmentThreshold = config.getFragmentThreshold() != null
                ? config.getFragmentThreshold() : (total + 1) / 2;
        if (config.getCorrectionThreshold() != null)
            correctionThreshold = config.getCorrectionThreshold();
        else if (collation.getUnits().size() > LARGE_COLLATION)
            correctionThreshold = LARGE_CORRECTION_THRESHOLD;
        else
            correctionThreshold = Math.max(1, (total + 9) / 10);

        List<String> adjustments = new ArrayList<>();
        for (TestimonyModel t : collation.getAllTestimonies()) {
            HandModel original = t.getOriginal();
            if (original.isSuppressed())
                continue;
            int extant = extantReadings(t);
            if (!collation.isRoot(t.getWitness().getIndex())
                    && extant < fragmentThreshold && !original.isMandated()) {
                t.suppressAll();
                adjustments.add(String.format("-%s(%d)", CollationModel.inputName(t, 0), extant));
                continue;
            }

            int lastHand = 0;
            for (int h = 1; h < TestimonyModel.MAX_HANDS; h++) {
                HandModel corrector = t.getHand(h);
                if (corrector.isSuppressed())
                    continue;
                corrector.setLastHand(lastHand);
                int corrections = corrections(t, h);
                if (corrections < correctionThreshold && !corrector.isMandated()) {
                    corrector.setSuppressed(true);
                } else {
                    lastHand = h;
                    adjustments.add(String.format("+%s(%d)", CollationModel.correctorName(t, h), corrections));
                }
            }
        }
        logger.info("Thresholds: frag={}, corr={}; adjustments: {}",
                fragmentThreshold, correctionThreshold, String.join(" ", adjustments));
        relinkAll();
    }

    // Weighted count of the non-missing states in the original hand's own cells
    private int extantReadings(TestimonyModel t) {
        int extant = 0;
        for (PieceModel piece : collation.getPieces()) {
            ReadingSet r = t.getOriginal().getReading(piece.getIndex());
            if (r == null)
                continue;
            for (int u = 0; u < piece.size(); u++)
                if (r.stateAt(u) != ReadingSet.MISSING)
                    extant += piece.getUnits().get(u).getWeight();
        }
        return extant;
    }

    // Weighted count of the cells where a corrector departs from the hand it corrects
    private int corrections(TestimonyModel t, int hand) {
        int lastHand = t.getHand(hand).getLastHand();
        int count = 0;
        for (PieceModel piece : collation.getPieces()) {
            ReadingSet own = t.getHand(hand).getReading(piece.getIndex());
            ReadingSet before = t.effectiveReading(lastHand, piece.getIndex());
            if (own == null || before == null)
                continue;
            for (int u = 0; u < piece.size(); u++)
                if (own.stateAt(u) != before.stateAt(u))
                    count += piece.getUnits().get(u).getWeight();
        }
        return count;
    }

    /**
     * Drops any witness whose original readings are the very same reading-sets
     * as those of an earlier surviving witness of the same parallel, at every piece.
     * Reading-sets are compared by reference: two blocks that happen to enter the same
     * states are different testimony.
     */
    public void suppressIdentical() {
        if (config.getIdenticalOk())
            return;
        List<String> dropped = new ArrayList<>();
        for (ParallelModel p : collation.getParallels()) {
            List<TestimonyModel> testimonies = p.getTestimonies();
            for (int ms = 0; ms < testimonies.size(); ms++) {
                TestimonyModel t = testimonies.get(ms);
                if (t.getOriginal().isSuppressed() || t.getOriginal().isMandated())
                    continue;
                for (int m2 = 0; m2 < ms; m2++) {
                    TestimonyModel t2 = testimonies.get(m2);
                    if (t2.getOriginal().isSuppressed())
                        continue;
                    if (sameReadings(t, t2)) {
                        t.suppressAll();
                        dropped.add(String.format("-%s=%s",
                                CollationModel.inputName(t, 0), CollationModel.inputName(t2, 0)));
                        break;
                    }
                }
            }
        }
        logger.info("Checking identical witnesses: {} Done", String.join(" ", dropped));
        relinkAll();
    }

    private boolean sameReadings(TestimonyModel t, TestimonyModel t2) {
        for (PieceModel piece : collation.getPieces())
            if (t.getOriginal().getReading(piece.getIndex()) != t2.getOriginal().getReading(piece.getIndex()))
                return false;
        return true;
    }

    /**
     * Drops the unmandated hands whose earliest date is after the configured cutoff year.
     * A dropped original hand takes its correctors with it.
     */
    public void applyYearCutoff() {
        Integer year = config.getYearCutoff();
        if (year == null)
            return;
        List<String> dropped = new ArrayList<>();
        for (TestimonyModel t : collation.getAllTestimonies()) {
            for (HandModel h : t.getHands()) {
                if (h.isSuppressed() || h.isMandated() || h.getEarliest() <= year)
                    continue;
                dropped.add(String.format("-%s(%d)", CollationModel.inputName(t, h.getIndex()), h.getEarliest()));
                if (h.getIndex() == 0) {
                    t.getHands().stream().filter(x -> !x.isMandated()).forEach(x -> x.setSuppressed(true));
                    break;
                }
                h.setSuppressed(true);
            }
        }
        logger.info("Year suppression at {}: {}", year, String.join(" ", dropped));
        relinkAll();
    }
}
