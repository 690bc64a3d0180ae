package net.stemmaweb.prep.parser;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiConsumer;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.stemmaweb.prep.model.ChronologyEntry;
import net.stemmaweb.prep.model.CollationModel;
import net.stemmaweb.prep.model.HandModel;
import net.stemmaweb.prep.model.ParallelModel;
import net.stemmaweb.prep.model.TestimonyModel;

/**
 * Reads chronology files, whose lines have the form
 *
 *     witness[:h] earliest average latest
 *
 * and applies the dates to the hands of a collation.
 */
public class ChronologyParser {

    private static final Logger logger = LoggerFactory.getLogger(ChronologyParser.class);

    private final BiConsumer<Integer, String> onMalformed;

    /**
     * @param onMalformed - called with the line number and text of each line that cannot be read
     */
    public ChronologyParser(BiConsumer<Integer, String> onMalformed) {
        this.onMalformed = onMalformed;
    }

    public List<ChronologyEntry> parse(File file) throws IOException {
        return parse(FileUtils.readLines(file, StandardCharsets.UTF_8));
    }

    public List<ChronologyEntry> parse(List<String> lines) {
        List<ChronologyEntry> entries = new ArrayList<>();
        int lineNo = 0;
        for (String line : lines) {
            lineNo++;
            String trimmed = line.trim();
            if (trimmed.isEmpty())
                continue;
            String[] fields = trimmed.split("\\s+");
            if (fields.length != 4) {
                onMalformed.accept(lineNo, trimmed);
                continue;
            }
            try {
                entries.add(new ChronologyEntry(fields[0], Integer.parseInt(fields[1]),
                        Integer.parseInt(fields[2]), Integer.parseInt(fields[3]), lineNo));
            } catch (NumberFormatException e) {
                onMalformed.accept(lineNo, trimmed);
            }
        }
        return entries;
    }

    /**
     * Sets the dates of every hand named in the entries, in every parallel. An entry for
     * the original hand also dates the correctors that have no entry of their own, with an
     * open latest bound.
     *
     * @param collation - the collation whose hands are dated
     * @param entries - the chronology entries, in file order
     * @return the number of entries that matched at least one witness
     */
    public int apply(CollationModel collation, List<ChronologyEntry> entries) {
        int matched = 0;
        for (ChronologyEntry e : entries) {
            int hand = e.getHand();
            List<Integer> found = collation.findByAlternateName(e.getWitnessName());
            if (found.isEmpty() || hand < 0 || hand >= TestimonyModel.MAX_HANDS) {
                logger.debug("No witness for chronology entry {} at line {}", e.getName(), e.getLine());
                continue;
            }
            matched++;
            for (Integer ms : found) {
                if (collation.isRoot(ms))
                    continue;
                for (ParallelModel p : collation.getParallels()) {
                    TestimonyModel t = p.getTestimony(ms);
                    HandModel h = t.getHand(hand);
                    h.setChronology(e.getEarliest(), e.getAverage(), e.getLatest());
                    h.setChronologyEntry(true);
                    if (hand != 0)
                        continue;
                    for (int c = 1; c < TestimonyModel.MAX_HANDS; c++) {
                        HandModel corrector = t.getHand(c);
                        if (!corrector.hasChronologyEntry())
                            corrector.setChronology(e.getEarliest(), e.getAverage(), HandModel.OPEN_DATE);
                    }
                }
            }
        }
        return matched;
    }
}
