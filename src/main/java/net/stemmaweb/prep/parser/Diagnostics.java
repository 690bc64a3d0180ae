package net.stemmaweb.prep.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the diagnostics of a run and reports each one on the diagnostic log as it
 * arrives.
 */
public class Diagnostics {

    public static final String LOGGER_NAME = "net.stemmaweb.prep.diagnostics";
    private static final Logger logger = LoggerFactory.getLogger(LOGGER_NAME);

    private final List<Diagnostic> reported = new ArrayList<>();
    private final List<String> notes = new ArrayList<>();
    private int warnings = 0;

    public void report(Diagnostic d) {
        reported.add(d);
        if (d.getSeverity() == Diagnostic.Severity.FATAL) {
            logger.error(d.format());
        } else {
            warnings++;
            logger.warn(d.format());
        }
    }

    /**
     * Reports a note that does not count as a warning, such as a hand without chronology.
     *
     * @param note - the text of the note
     */
    public void note(String note) {
        notes.add(note);
        logger.info(note);
    }

    public int getWarningCount() {
        return warnings;
    }

    public List<Diagnostic> getReported() {
        return reported;
    }

    public List<String> getNotes() {
        return notes;
    }

    public boolean hasFatal() {
        return reported.stream().anyMatch(x -> x.getSeverity() == Diagnostic.Severity.FATAL);
    }
}
