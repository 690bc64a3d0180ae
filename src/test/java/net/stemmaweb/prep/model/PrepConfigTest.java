package net.stemmaweb.prep.model;

import java.util.HashMap;
import java.util.Map;

import junit.framework.TestCase;

public class PrepConfigTest extends TestCase {

    public void testDefaults() throws Exception {
        Map<String, String> env = new HashMap<>();
        env.put("HOME", "/home/scribe");
        PrepConfig config = PrepConfig.fromEnvironment(env);
        assertEquals(PrepConfig.LITERARY, config.getYearGranularity());
        assertNull(config.getFragmentThreshold());
        assertNull(config.getCorrectionThreshold());
        assertNull(config.getYearCutoff());
        assertFalse(config.getNoSingular());
        assertFalse(config.hasRoot());
        assertEquals('0', config.getRootChar());
        assertEquals(6, config.getWeightDivisor());
        assertFalse(config.getIdenticalOk());
        assertFalse(config.getIdenticalFirst());
        assertEquals(0, config.getMaxWarnings());
        assertEquals("/home/scribe", config.getHome());
    }

    public void testSettings() throws Exception {
        Map<String, String> env = new HashMap<>();
        env.put("YEARGRAN", "-1");
        env.put("FTHRESH", "12");
        env.put("CTHRESH", " 3 ");
        env.put("YEAR", "900");
        env.put("NOSING", "1");
        env.put("IDOK", "0");
        env.put("ROOT", "A ");
        env.put("ROOTCHAR", "x");
        env.put("WEIGHBYED", "0");
        PrepConfig config = PrepConfig.fromEnvironment(env);
        assertEquals(PrepConfig.LITERARY, config.getYearGranularity());
        assertEquals(Integer.valueOf(12), config.getFragmentThreshold());
        assertEquals(Integer.valueOf(3), config.getCorrectionThreshold());
        assertEquals(Integer.valueOf(900), config.getYearCutoff());
        assertTrue(config.getNoSingular());
        assertFalse(config.getIdenticalOk());
        assertEquals("A", config.getRoot());
        assertEquals('x', config.getRootChar());
        assertEquals(0, config.getWeightDivisor());
    }

    public void testMalformedNumber() {
        Map<String, String> env = new HashMap<>();
        env.put("FTHRESH", "ten");
        try {
            PrepConfig.fromEnvironment(env);
            fail("A non-numeric threshold should be rejected");
        } catch (PrepConfigurationException e) {
            assertTrue(e.getMessage().contains("FTHRESH"));
        }
    }

    public void testBadGranularity() {
        Map<String, String> env = new HashMap<>();
        env.put("YEARGRAN", "-5");
        try {
            PrepConfig.fromEnvironment(env);
            fail("Granularity below -1 should be rejected");
        } catch (PrepConfigurationException e) {
            assertTrue(e.getMessage().contains("YEARGRAN"));
        }
    }
}
