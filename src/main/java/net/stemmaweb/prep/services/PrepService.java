package net.stemmaweb.prep.services;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.stemmaweb.prep.exporter.ConstraintExporter;
import net.stemmaweb.prep.exporter.MatrixExporter;
import net.stemmaweb.prep.exporter.VariantListExporter;
import net.stemmaweb.prep.model.CollationModel;
import net.stemmaweb.prep.model.ConstraintModel;
import net.stemmaweb.prep.model.PrepConfig;
import net.stemmaweb.prep.model.PrepConfigurationException;
import net.stemmaweb.prep.parser.CollationException;
import net.stemmaweb.prep.parser.CollationParser;
import net.stemmaweb.prep.parser.Diagnostics;
import net.stemmaweb.prep.parser.TokenStream;

/**
 * Runs a collation file through every stage and writes its matrix, constraints and
 * variant listing next to it, as file.tx, file.no and file.vr.
 */
public class PrepService {

    private static final Logger logger = LoggerFactory.getLogger(PrepService.class);

    public static final int EXIT_CONFIGURATION = -2;
    public static final int EXIT_FATAL = -3;

    public static final String MATRIX_SUFFIX = ".tx";
    public static final String CONSTRAINT_SUFFIX = ".no";
    public static final String VARIANT_SUFFIX = ".vr";

    private final PrepConfig config;
    private final Diagnostics diagnostics = new Diagnostics();
    private CollationModel collation;

    public PrepService(PrepConfig config) {
        this.config = config;
    }

    public Diagnostics getDiagnostics() {
        return diagnostics;
    }

    /**
     * @return the collation of the last run, or null before any run
     */
    public CollationModel getCollation() {
        return collation;
    }

    /**
     * Prepares one collation.
     *
     * @param source - the collation file
     * @param mandatees - the witnesses and macros to keep, or an empty list to keep all
     * @return the number of warnings, or EXIT_CONFIGURATION or EXIT_FATAL
     */
    public int run(File source, List<String> mandatees) {
        String text;
        try {
            text = FileUtils.readFileToString(source, StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.error("Cannot open collation file: {}", source);
            return EXIT_CONFIGURATION;
        }

        TokenStream tokens = new TokenStream(text);
        collation = new CollationModel(config);
        int warnings;
        try {
            warnings = new CollationParser(collation, tokens, diagnostics).parse();
        } catch (CollationException e) {
            logger.error("Fatal error, terminating ...");
            return EXIT_FATAL;
        }
        if (warnings > config.getMaxWarnings()) {
            logger.error("Too many warnings, terminating ...");
            return warnings;
        }

        ReductionService reduction = new ReductionService(collation);
        try {
            reduction.reduce(mandatees);
        } catch (PrepConfigurationException e) {
            logger.error(e.getMessage());
            return EXIT_CONFIGURATION;
        }

        StratificationService stratification = new StratificationService(collation, diagnostics);
        int strata = stratification.stratify();
        List<ConstraintModel> constraints = stratification.constraints();

        String base = source.getPath();
        try {
            new MatrixExporter(collation).exportToFile(new File(base + MATRIX_SUFFIX));
            new ConstraintExporter(constraints).exportToFile(new File(base + CONSTRAINT_SUFFIX));
            new VariantListExporter(tokens, collation.getUnits()).exportToFile(new File(base + VARIANT_SUFFIX));
        } catch (IOException e) {
            logger.error("Cannot write output for {}: {}", source, e.getMessage());
            return EXIT_CONFIGURATION;
        }

        logger.info("Parallels: {}, witnesses: {}, units: {}, pieces: {}, sets: {}",
                collation.getParallels().size(), collation.getWitnesses().size(),
                collation.getUnits().size(), collation.getPieces().size(), collation.getReadingSetCount());
        logger.info("Thresholds: frag={}, corr={}; year granularity: {}, strata: {}",
                reduction.getFragmentThreshold(), reduction.getCorrectionThreshold(),
                config.getYearGranularity(), strata);
        logger.info("Active witnesses: {}, weighted variants: {}",
                collation.activeHands(), collation.getWeightedTotal());
        return warnings;
    }
}
