package net.stemmaweb.prep.model;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Before;
import org.junit.Test;

public class TestimonyModelTest {

    private TestimonyModel testimony;

    @Before
    public void setUp() {
        List<WitnessModel> witnesses = List.of(WitnessModel.fromDeclaration(0, "P46~p46~P46x"));
        ParallelModel parallel = new ParallelModel(0, ParallelModel.DEFAULT_CODE, witnesses, new MacroSequence(1));
        testimony = parallel.getTestimony(0);
    }

    @Test
    public void declarationAliasTest() {
        WitnessModel w = testimony.getWitness();
        assertEquals("P46", w.getName());
        assertEquals("p46", w.getAlternateName());
        assertEquals("P46x", w.getDisplayName());
    }

    @Test
    public void correctorsInheritUnsetPiecesTest() {
        ReadingSet first = new ReadingSet("12");
        ReadingSet second = new ReadingSet("1.");
        testimony.getHand(0).setReading(0, first);
        testimony.getHand(0).setReading(1, second);
        ReadingSet corrected = new ReadingSet("21");
        testimony.getHand(2).setReading(1, corrected);

        assertSame(first, testimony.effectiveReading(2, 0));
        assertSame(corrected, testimony.effectiveReading(2, 1));
        assertSame(first, testimony.effectiveReading(3, 0));
        assertSame(corrected, testimony.effectiveReading(3, 1));
        assertNull(testimony.effectiveReading(1, 5));
        assertEquals('?', second.stateAt(1));
    }

    @Test
    public void relinkSkipsSuppressedHandsTest() {
        testimony.getHand(1).setSuppressed(true);
        testimony.getHand(2).setSuppressed(true);
        testimony.relinkHands();
        assertEquals(0, testimony.getHand(1).getLastHand());
        assertEquals(0, testimony.getHand(3).getLastHand());
        assertEquals(2, testimony.survivingHands());

        testimony.getHand(2).setSuppressed(false);
        testimony.relinkHands();
        assertEquals(2, testimony.getHand(3).getLastHand());
    }

    @Test
    public void suppressAllTest() {
        assertFalse(testimony.isWhollySuppressed());
        testimony.suppressAll();
        assertTrue(testimony.isWhollySuppressed());
        assertEquals(0, testimony.survivingHands());
    }
}
