package net.stemmaweb.prep.model;

import java.util.Map;

/**
 * The settings of one run, read from environment-style variables.
 */
public class PrepConfig {

    // Year granularity values with a special meaning
    public static final int PER_YEAR = 0;
    public static final int LITERARY = -1;

    public static final int DEFAULT_WEIGHT_DIVISOR = 6;
    public static final char DEFAULT_ROOT_CHAR = '0';

    private final int yearGranularity;
    private final Integer fragmentThreshold;
    private final Integer correctionThreshold;
    private final Integer yearCutoff;
    private final boolean noSingular;
    private final String root;
    private final char rootChar;
    private final int weightDivisor;
    private final boolean identicalOk;
    private final boolean identicalFirst;
    private final int maxWarnings;
    private final String home;

    private PrepConfig(Map<String, String> env) throws PrepConfigurationException {
        Integer gran = intSetting(env, "YEARGRAN");
        yearGranularity = gran == null ? LITERARY : gran;
        if (yearGranularity < LITERARY)
            throw new PrepConfigurationException("YEARGRAN must be -1, 0 or a positive number of years");
        fragmentThreshold = intSetting(env, "FTHRESH");
        correctionThreshold = intSetting(env, "CTHRESH");
        yearCutoff = intSetting(env, "YEAR");
        noSingular = flagSetting(env, "NOSING");
        String r = env.get("ROOT");
        root = r == null || r.isBlank() ? null : r.trim();
        String rc = env.get("ROOTCHAR");
        if (rc != null && rc.length() != 1)
            throw new PrepConfigurationException("ROOTCHAR must be a single character: " + rc);
        rootChar = rc == null ? DEFAULT_ROOT_CHAR : rc.charAt(0);
        Integer wd = intSetting(env, "WEIGHBYED");
        weightDivisor = wd == null ? DEFAULT_WEIGHT_DIVISOR : wd;
        if (weightDivisor < 0)
            throw new PrepConfigurationException("WEIGHBYED may not be negative");
        identicalOk = flagSetting(env, "IDOK");
        identicalFirst = flagSetting(env, "IDFIRST");
        Integer mw = intSetting(env, "MAXWARN");
        maxWarnings = mw == null ? 0 : mw;
        String h = env.get("HOME");
        home = h == null ? System.getProperty("user.home") : h;
    }

    /**
     * Reads the settings from a map of variables such as System.getenv().
     *
     * @param env - the variables
     * @return the configuration
     * @throws PrepConfigurationException if a numeric setting is malformed
     */
    public static PrepConfig fromEnvironment(Map<String, String> env) throws PrepConfigurationException {
        return new PrepConfig(env);
    }

    private static Integer intSetting(Map<String, String> env, String key) throws PrepConfigurationException {
        String value = env.get(key);
        if (value == null || value.isBlank())
            return null;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new PrepConfigurationException(String.format("%s must be a number, not '%s'", key, value));
        }
    }

    private static boolean flagSetting(Map<String, String> env, String key) {
        String value = env.get(key);
        return value != null && !value.equals("0") && !value.equalsIgnoreCase("false");
    }

    public int getYearGranularity() { return yearGranularity; }
    public Integer getFragmentThreshold() { return fragmentThreshold; }
    public Integer getCorrectionThreshold() { return correctionThreshold; }
    public Integer getYearCutoff() { return yearCutoff; }
    public boolean getNoSingular() { return noSingular; }
    public String getRoot() { return root; }
    public boolean hasRoot() { return root != null; }
    public char getRootChar() { return rootChar; }
    public int getWeightDivisor() { return weightDivisor; }
    public boolean getIdenticalOk() { return identicalOk; }
    public boolean getIdenticalFirst() { return identicalFirst; }
    public int getMaxWarnings() { return maxWarnings; }
    public String getHome() { return home; }
}
