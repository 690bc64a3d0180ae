package net.stemmaweb.prep;

import java.io.File;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.stemmaweb.prep.model.PrepConfig;
import net.stemmaweb.prep.model.PrepConfigurationException;
import net.stemmaweb.prep.services.PrepService;

/**
 * Command-line entry point:
 *
 *     prep [options] collation-file {witness | $macro}*
 *
 * Settings come from the environment; the options override them.
 */
public class Prep {

    private static final Logger logger = LoggerFactory.getLogger(Prep.class);

    private static final String USAGE = "prep [options] collation-file {witness | $macro}*";

    // Option letter to the environment variable it overrides
    private static final String[][] SETTINGS = {
            {"g", "YEARGRAN", "year granularity: -1 literary periods (default), 0 per year, N for N-year buckets"},
            {"f", "FTHRESH", "fragment threshold"},
            {"c", "CTHRESH", "correction threshold"},
            {"y", "YEAR", "drop hands dated after this year"},
            {"r", "ROOT", "name of the root witness"},
            {"w", "WEIGHBYED", "edit distance divisor for unit weights"},
            {"m", "MAXWARN", "number of warnings tolerated"},
    };
    private static final String[][] FLAGS = {
            {"s", "NOSING", "also drop units with singular readings only"},
            {"i", "IDOK", "keep witnesses identical to an earlier one"},
    };

    static Options options() {
        Options options = new Options();
        options.addOption("h", "help", false, "print this message");
        for (String[] s : SETTINGS)
            options.addOption(s[0], true, s[2] + " (" + s[1] + ")");
        for (String[] f : FLAGS)
            options.addOption(f[0], false, f[2] + " (" + f[1] + ")");
        return options;
    }

    /**
     * Overlays the command-line options onto the environment.
     *
     * @param env - the environment variables
     * @param cmd - the parsed command line
     * @return the combined settings
     */
    static Map<String, String> settings(Map<String, String> env, CommandLine cmd) {
        Map<String, String> settings = new HashMap<>(env);
        for (String[] s : SETTINGS)
            if (cmd.hasOption(s[0]))
                settings.put(s[1], cmd.getOptionValue(s[0]));
        for (String[] f : FLAGS)
            if (cmd.hasOption(f[0]))
                settings.put(f[1], "1");
        return settings;
    }

    static int run(String[] args, Map<String, String> env) {
        Options options = options();
        CommandLine cmd;
        try {
            CommandLineParser parser = new DefaultParser();
            cmd = parser.parse(options, args);
        } catch (ParseException e) {
            logger.error(e.getMessage());
            new HelpFormatter().printHelp(USAGE, options);
            return PrepService.EXIT_CONFIGURATION;
        }
        if (cmd.hasOption("h") || cmd.getArgList().isEmpty()) {
            new HelpFormatter().printHelp(USAGE, options);
            return PrepService.EXIT_CONFIGURATION;
        }

        PrepConfig config;
        try {
            config = PrepConfig.fromEnvironment(settings(env, cmd));
        } catch (PrepConfigurationException e) {
            logger.error(e.getMessage());
            return PrepService.EXIT_CONFIGURATION;
        }

        List<String> arguments = cmd.getArgList();
        File collation = new File(arguments.get(0));
        List<String> mandatees = arguments.subList(1, arguments.size());
        logger.debug("Preparing {} with mandated {}", collation, Arrays.toString(mandatees.toArray()));
        return new PrepService(config).run(collation, mandatees);
    }

    public static void main(String[] args) {
        System.exit(run(args, System.getenv()));
    }
}
