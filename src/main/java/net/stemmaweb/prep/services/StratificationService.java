package net.stemmaweb.prep.services;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.stemmaweb.prep.model.CollationModel;
import net.stemmaweb.prep.model.ConstraintModel;
import net.stemmaweb.prep.model.HandModel;
import net.stemmaweb.prep.model.PrepConfig;
import net.stemmaweb.prep.model.TestimonyModel;
import net.stemmaweb.prep.model.WitnessModel;
import net.stemmaweb.prep.parser.Diagnostics;

/**
 * Places every surviving hand in a chronological stratum and works out which hands
 * must precede it.
 */
public class StratificationService {

    private static final Logger logger = LoggerFactory.getLogger(StratificationService.class);

    // Upper bounds of the literary periods
    private static final int[] LITERARY_PERIODS =
            {100, 350, 450, 600, 775, 950, 1100, 1200, 1300, 1400, 1500, 1600, 9999};

    private final CollationModel collation;
    private final Diagnostics diagnostics;

    public StratificationService(CollationModel collation, Diagnostics diagnostics) {
        this.collation = collation;
        this.diagnostics = diagnostics;
    }

    /**
     * Sets the stratum of every surviving hand. Bucket keys are taken from the average
     * date according to the configured granularity, then renumbered consecutively in
     * time order.
     *
     * @return the number of distinct strata
     */
    public int stratify() {
        int granularity = collation.getConfig().getYearGranularity();
        TreeSet<Integer> keys = new TreeSet<>();
        Map<HandModel, Integer> keyOf = new HashMap<>();
        for (TestimonyModel t : collation.getAllTestimonies()) {
            for (HandModel h : t.getHands()) {
                if (h.isSuppressed())
                    continue;
                int key = bucketOf(h.getAverage(), granularity);
                keyOf.put(h, key);
                keys.add(key);
            }
        }
        List<Integer> ordered = new ArrayList<>(keys);
        keyOf.forEach((h, key) -> h.setStratum(ordered.indexOf(key)));
        logger.debug("{} strata at granularity {}", ordered.size(), granularity);
        return ordered.size();
    }

    /**
     * @param year - an average date
     * @param granularity - the configured year granularity
     * @return the bucket key of the year, before compaction
     */
    public static int bucketOf(int year, int granularity) {
        if (granularity == PrepConfig.LITERARY) {
            for (int i = 0; i < LITERARY_PERIODS.length; i++)
                if (year <= LITERARY_PERIODS[i])
                    return i;
            return LITERARY_PERIODS.length;
        }
        if (granularity > 0)
            return Math.floorDiv(year + granularity / 2, granularity);
        return year;
    }

    /**
     * Lists the constraints of every surviving hand, in parallel, witness and hand order.
     * Hand B precedes hand A when B's latest date is before A's earliest date, or when B is
     * the same or an earlier hand of the same testimony. Hands with no chronology of their
     * own are noted on the diagnostic stream.
     *
     * @return the constraint of each surviving hand
     */
    public List<ConstraintModel> constraints() {
        List<TestimonyModel> testimonies = collation.getAllTestimonies();
        List<ConstraintModel> result = new ArrayList<>();
        for (TestimonyModel t : testimonies) {
            for (HandModel h : t.getHands()) {
                if (h.isSuppressed())
                    continue;
                if (h.isLatestOpen())
                    noteMissingChronology(t, h.getIndex());
                List<String> predecessors = new ArrayList<>();
                for (TestimonyModel t2 : testimonies) {
                    for (HandModel h2 : t2.getHands()) {
                        if (h2.isSuppressed())
                            continue;
                        if (h2.getLatest() < h.getEarliest()
                                || (t2 == t && h2.getIndex() <= h.getIndex()))
                            predecessors.add(CollationModel.handName(t2, h2.getIndex()));
                    }
                }
                result.add(new ConstraintModel(CollationModel.handName(t, h.getIndex()),
                        h.getStratum(), predecessors));
            }
        }
        return result;
    }

    private void noteMissingChronology(TestimonyModel t, int hand) {
        WitnessModel w = t.getWitness();
        String code = t.getParallel().hasCode() ? "/" + t.getParallel().getCode() : "";
        diagnostics.note(String.format("No chron entry for %s ~ %s ~ %s",
                CollationModel.inputName(t, hand), w.getAlternateName() + code, w.getDisplayName() + code));
    }
}
