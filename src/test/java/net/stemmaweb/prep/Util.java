package net.stemmaweb.prep;

import java.util.HashMap;
import java.util.Map;

import net.stemmaweb.prep.model.CollationModel;
import net.stemmaweb.prep.model.PrepConfig;
import net.stemmaweb.prep.model.PrepConfigurationException;
import net.stemmaweb.prep.model.TestimonyModel;
import net.stemmaweb.prep.parser.CollationException;
import net.stemmaweb.prep.parser.CollationParser;
import net.stemmaweb.prep.parser.Diagnostics;
import net.stemmaweb.prep.parser.TokenStream;

/**
 * Helpers shared by the tests.
 */
public class Util {

    public static final String TEST_FILES = "src/TestFiles";

    /**
     * Builds a configuration from alternating names and values, e.g.
     * config("FTHRESH", "0", "CTHRESH", "0").
     */
    public static PrepConfig config(String... settings) {
        Map<String, String> env = new HashMap<>();
        env.put("HOME", TEST_FILES);
        for (int i = 0; i + 1 < settings.length; i += 2)
            env.put(settings[i], settings[i + 1]);
        try {
            return PrepConfig.fromEnvironment(env);
        } catch (PrepConfigurationException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
    }

    public static CollationModel interpret(String text, PrepConfig config) throws CollationException {
        return interpret(text, config, new Diagnostics());
    }

    public static CollationModel interpret(String text, PrepConfig config, Diagnostics diagnostics)
            throws CollationException {
        CollationModel collation = new CollationModel(config);
        new CollationParser(collation, new TokenStream(text), diagnostics).parse();
        return collation;
    }

    public static TestimonyModel testimony(CollationModel collation, String witness) {
        return collation.getParallel(0).getTestimony(collation.findWitness(witness));
    }

    public static TestimonyModel testimony(CollationModel collation, char parallel, String witness) {
        return collation.getParallel(collation.findParallel(parallel)).getTestimony(collation.findWitness(witness));
    }
}
