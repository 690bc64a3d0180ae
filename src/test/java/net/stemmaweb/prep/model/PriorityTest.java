package net.stemmaweb.prep.model;

import junit.framework.TestCase;

public class PriorityTest extends TestCase {

    public void testRankOrder() {
        Priority all = new Priority(Priority.Rank.ALL, 1);
        Priority macro = new Priority(Priority.Rank.MACRO, 2);
        Priority unknown = new Priority(Priority.Rank.UNKNOWN, 0);

        assertTrue(all.isAbove(Priority.NONE));
        assertTrue(macro.isAbove(all));
        assertTrue(unknown.isAbove(macro));
        assertTrue(Priority.EXPLICIT.isAbove(unknown));
        assertFalse(all.isAbove(macro));
    }

    public void testSequenceBreaksTies() {
        Priority earlier = new Priority(Priority.Rank.MACRO, 3);
        Priority later = new Priority(Priority.Rank.MACRO, 7);
        assertTrue(later.isAbove(earlier));
        assertFalse(earlier.isAbove(later));
        assertFalse(later.isAbove(new Priority(Priority.Rank.MACRO, 7)));
    }

    public void testEquality() {
        assertEquals(new Priority(Priority.Rank.MACRO, 4), new Priority(Priority.Rank.MACRO, 4));
        assertFalse(new Priority(Priority.Rank.MACRO, 4).equals(new Priority(Priority.Rank.ALL, 4)));
        assertEquals(0, Priority.EXPLICIT.compareTo(new Priority(Priority.Rank.EXPLICIT, 0)));
    }
}
