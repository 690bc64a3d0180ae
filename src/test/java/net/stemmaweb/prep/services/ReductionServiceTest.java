package net.stemmaweb.prep.services;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;

import net.stemmaweb.prep.Util;
import net.stemmaweb.prep.model.CollationModel;
import net.stemmaweb.prep.model.HandModel;
import net.stemmaweb.prep.model.PrepConfig;
import net.stemmaweb.prep.model.PrepConfigurationException;
import net.stemmaweb.prep.model.TestimonyModel;
import net.stemmaweb.prep.model.VariationUnitModel;

public class ReductionServiceTest {

    private Logger serviceLogger;
    private ListAppender<ILoggingEvent> appender;

    @Before
    public void setUp() {
        serviceLogger = (Logger) LoggerFactory.getLogger(ReductionService.class);
        serviceLogger.setLevel(Level.INFO);
        appender = new ListAppender<>();
        appender.start();
        serviceLogger.addAppender(appender);
    }

    @After
    public void tearDown() {
        serviceLogger.detachAppender(appender);
        serviceLogger.setLevel(null);
    }

    private static CollationModel reduce(String text, PrepConfig config, String... mandatees) throws Exception {
        CollationModel collation = Util.interpret(text, config);
        new ReductionService(collation).reduce(Arrays.asList(mandatees));
        return collation;
    }

    private List<String> logged() {
        return appender.list.stream().map(ILoggingEvent::getFormattedMessage).collect(Collectors.toList());
    }

    private static List<Integer> weights(CollationModel c) {
        return c.getUnits().stream().map(VariationUnitModel::getWeight).collect(Collectors.toList());
    }

    private static void assertLinksValid(CollationModel c) {
        for (TestimonyModel t : c.getAllTestimonies()) {
            for (HandModel h : t.getHands()) {
                if (h.isSuppressed() || h.getIndex() == 0)
                    continue;
                assertTrue(h.getLastHand() < h.getIndex());
                assertFalse(t.getHand(h.getLastHand()).isSuppressed());
            }
        }
    }

    @Test
    public void identicalWitnessTest() throws Exception {
        String text = "* A B C ; = $a A B ;\n[ x | a | b ] < 11 $a | 22 C >\n[ y | c ] < 1 $a | 2 C >";
        CollationModel c = reduce(text, Util.config());
        assertTrue(Util.testimony(c, "B").isWhollySuppressed());
        assertFalse(Util.testimony(c, "A").getOriginal().isSuppressed());
        assertFalse(Util.testimony(c, "C").getOriginal().isSuppressed());
        assertEquals(2, c.activeHands());
        assertTrue(logged().stream().anyMatch(x -> x.contains("-B=A")));

        c = reduce(text, Util.config("IDOK", "1"));
        assertFalse(Util.testimony(c, "B").getOriginal().isSuppressed());
        assertEquals(3, c.activeHands());
    }

    @Test
    public void mandatedIdenticalWitnessTest() throws Exception {
        String text = "* A B C ; = $a A B ;\n[ x | a | b ] < 11 $a | 22 C >\n[ y | c ] < 1 $a | 2 C >";
        CollationModel c = reduce(text, Util.config(), "A", "B");
        assertFalse(Util.testimony(c, "A").getOriginal().isSuppressed());
        assertFalse(Util.testimony(c, "B").getOriginal().isSuppressed());
        assertTrue(Util.testimony(c, "C").isWhollySuppressed());
        assertEquals(2, c.activeHands());
        assertFalse(logged().stream().anyMatch(x -> x.contains("-B=A")));
    }

    @Test
    public void textuallyEqualIsNotIdenticalTest() throws Exception {
        CollationModel c = reduce("* A B C ; [ x | a | b ] < 11 A | 11 B | 22 C >", Util.config());
        assertFalse(Util.testimony(c, "B").getOriginal().isSuppressed());
        assertEquals(3, c.activeHands());
    }

    @Test
    public void identicalFirstTest() throws Exception {
        String text = "* A B C D ; = $a A B ; [ x | a ] < 1 $a | 2 C | 2 D >";
        CollationModel c = reduce(text, Util.config("NOSING", "1"));
        assertTrue(Util.testimony(c, "B").isWhollySuppressed());
        assertEquals(List.of(1), weights(c));

        // Without B, state 1 is singular
        c = reduce(text, Util.config("NOSING", "1", "IDFIRST", "1"));
        assertTrue(Util.testimony(c, "B").isWhollySuppressed());
        assertEquals(List.of(0), weights(c));
    }

    @Test
    public void weightedUnitTest() throws Exception {
        CollationModel c = reduce("* A B C D ; [ x |*5 r ] < a A | a B | b C | ? D >", Util.config());
        assertEquals(5, c.getWeightedTotal());
        assertEquals(List.of(5), weights(c));
        assertTrue(Util.testimony(c, "D").isWhollySuppressed());
        assertEquals(3, c.activeHands());
    }

    @Test
    public void constantVariantTest() throws Exception {
        String text = "* A B C ; [ x | a | b | c ] < 112 A | 112 B | 122 C >";
        CollationModel c = reduce(text, Util.config());
        assertEquals(List.of(0, 1, 0), weights(c));
        assertEquals(1, c.getWeightedTotal());

        // Only one of the states at the middle unit is attested twice
        c = reduce(text, Util.config("NOSING", "1"));
        assertEquals(List.of(0, 0, 0), weights(c));
        assertEquals(0, c.getWeightedTotal());
    }

    @Test
    public void missingStatesDoNotCountTest() throws Exception {
        CollationModel c = reduce("* A B C ; [ x | a | b ] < 1? A | 12 B | ?2 C >", Util.config());
        assertEquals(List.of(0, 0), weights(c));
    }

    @Test
    public void fragmentTest() throws Exception {
        String text = "* A B C ; [ x |*4 a |*6 b ] < 12 A | 21 B | ?1 C >";
        CollationModel c = reduce(text, Util.config("FTHRESH", "10"));
        assertTrue(Util.testimony(c, "C").isWhollySuppressed());
        assertFalse(Util.testimony(c, "A").getOriginal().isSuppressed());
        assertTrue(logged().stream().anyMatch(x -> x.contains("-C(6)")));
        assertTrue(logged().stream().anyMatch(x -> x.startsWith("Thresholds: frag=10")));

        // Unless mandated
        c = reduce(text, Util.config("FTHRESH", "10"), "A", "B", "C");
        assertFalse(Util.testimony(c, "C").getOriginal().isSuppressed());
    }

    @Test
    public void defaultThresholdsTest() throws Exception {
        String text = "* A B C ; [ x | a | b | c ] < 121 A | 212 B | 11? C >";
        CollationModel c = Util.interpret(text, Util.config());
        ReductionService service = new ReductionService(c);
        service.reduce(Collections.emptyList());
        assertEquals(2, service.getFragmentThreshold());
        assertEquals(1, service.getCorrectionThreshold());
    }

    @Test
    public void constantCollationKeepsCorrectorsOutTest() throws Exception {
        String text = "* A B ; [ x | a | b ] < 11 A | 11 B >";
        CollationModel c = Util.interpret(text, Util.config());
        ReductionService service = new ReductionService(c);
        service.reduce(Collections.emptyList());
        assertEquals(List.of(0, 0), weights(c));
        assertEquals(1, service.getCorrectionThreshold());
        assertEquals(2, c.activeHands());
        assertFalse(Util.testimony(c, "A").isCorrected());
        assertLinksValid(c);
    }

    @Test
    public void correctorLogNameTest() throws Exception {
        String text = "* A B C /x ; [ x | a | b | c ] < 111 A | 222 B | 333 C | 211 A:1 >";
        CollationModel c = reduce(text, Util.config("CTHRESH", "1"));
        assertFalse(Util.testimony(c, 'x', "A").getHand(1).isSuppressed());
        assertTrue(logged().stream().anyMatch(x -> x.contains("+A:1/x(1)")));
    }

    @Test
    public void correctorTest() throws Exception {
        String text = "* A B C ; [ x | a | b | c ] < 111 A | 222 B | 333 C | 211 A:1 | 221 A:2 >";
        CollationModel c = reduce(text, Util.config("CTHRESH", "1"));
        TestimonyModel a = Util.testimony(c, "A");
        assertFalse(a.getHand(1).isSuppressed());
        assertFalse(a.getHand(2).isSuppressed());
        assertTrue(a.getHand(3).isSuppressed());
        assertEquals(1, a.getHand(2).getLastHand());
        assertTrue(a.isCorrected());
        assertFalse(Util.testimony(c, "B").isCorrected());
        assertEquals(1, Util.testimony(c, "B").survivingHands());
        assertLinksValid(c);
        assertEquals("A:2", CollationModel.handName(a, 2));

        // A:1 makes one correction, A:2 two against the original
        c = reduce(text, Util.config("CTHRESH", "2"));
        a = Util.testimony(c, "A");
        assertTrue(a.getHand(1).isSuppressed());
        assertFalse(a.getHand(2).isSuppressed());
        assertEquals(0, a.getHand(2).getLastHand());
        assertLinksValid(c);
    }

    @Test
    public void mandateTest() throws Exception {
        String text = "* A B C D ; = $m C D ; [ x | a | b ] < 12 A | 21 B | 11 C | 22 D >";
        CollationModel c = reduce(text, Util.config(), "A:1", "$m");
        TestimonyModel a = Util.testimony(c, "A");
        assertTrue(a.getHand(1).isMandated());
        assertTrue(a.getOriginal().isMandated());
        assertFalse(a.getHand(1).isSuppressed());
        assertTrue(a.getHand(2).isSuppressed());
        assertTrue(Util.testimony(c, "B").isWhollySuppressed());
        assertFalse(Util.testimony(c, "D").getOriginal().isSuppressed());
        assertLinksValid(c);
    }

    @Test
    public void mandateErrorsTest() throws Exception {
        String text = "* A B /x /y ; - B ; [ x | a ] < 1 A >";
        for (String bad : List.of("Q", "$z", "A/q", "A:7")) {
            CollationModel c = Util.interpret(text, Util.config());
            try {
                new ReductionService(c).reduce(List.of(bad));
                fail("Mandating " + bad + " should fail");
            } catch (PrepConfigurationException e) {
                assertTrue(e.getMessage().contains(bad));
                // Nothing is suppressed by a failed mandate
                assertFalse(Util.testimony(c, 'y', "A").getOriginal().isSuppressed());
            }
        }

        // B is suppressed in the first parallel only
        CollationModel c = Util.interpret(text, Util.config());
        try {
            new ReductionService(c).reduce(List.of("B/x"));
            fail("B is suppressed in parallel x");
        } catch (PrepConfigurationException e) {
            assertTrue(e.getMessage().startsWith("Already suppressed"));
        }
        c = Util.interpret(text, Util.config());
        new ReductionService(c).mandate(List.of("B"));
        assertTrue(Util.testimony(c, 'y', "B").getOriginal().isMandated());
        assertTrue(Util.testimony(c, 'x', "A").isWhollySuppressed());
    }

    @Test
    public void yearCutoffTest() throws Exception {
        String text = "* P46 01 A ; ^ ~/chron.txt [ x | a | b ] < 12 P46 | 21 01 | 11 A >";
        CollationModel c = reduce(text, Util.config("YEAR", "500"));
        assertTrue(Util.testimony(c, "A").isWhollySuppressed());
        assertFalse(Util.testimony(c, "P46").getOriginal().isSuppressed());
        assertFalse(Util.testimony(c, "01").getOriginal().isSuppressed());
        assertTrue(logged().stream().anyMatch(x -> x.contains("-A(800)")));

        c = reduce(text, Util.config("YEAR", "500"), "P46", "01", "A");
        assertFalse(Util.testimony(c, "A").getOriginal().isSuppressed());
    }

    @Test
    public void rootSurvivesTest() throws Exception {
        CollationModel c = reduce("* A B ; [ x | a | b ] < 12 A | 21 B >", Util.config("ROOT", "R", "FTHRESH", "5"));
        TestimonyModel root = c.getParallel(0).getTestimony(0);
        assertFalse(root.getOriginal().isSuppressed());
        assertTrue(Util.testimony(c, "A").isWhollySuppressed());
        assertEquals(1, c.activeHands());
    }
}
