package net.stemmaweb.prep.parser;

import junit.framework.TestCase;

public class DiagnosticTest extends TestCase {

    public void testColumns() {
        Diagnostic d = new Diagnostic(Diagnostic.Severity.WARNING, 12, 12, "<",
                "Unassigned:", "B", "Rom1:1", "en archē");
        String line = d.format();
        assertTrue(line.startsWith("  12: <"));
        assertEquals(8, line.indexOf("Unassigned: B"));
        assertEquals(31, line.indexOf("@ Rom1:1"));
        assertEquals(50, line.indexOf("[ en archē ]"));
        assertFalse(line.contains("from line"));
    }

    public void testLongFieldsStillSeparated() {
        Diagnostic d = new Diagnostic(Diagnostic.Severity.FATAL, 7, 3, "=",
                "Macro name must begin with $:", "averyveryverylongtoken", "Beginning", "");
        String line = d.format();
        assertTrue(line.contains("averyveryverylongtoken @ Beginning"));
        assertTrue(line.endsWith("(from line 3)"));
        assertFalse(line.contains("[ "));
    }

    public void testCounting() {
        Diagnostics diagnostics = new Diagnostics();
        diagnostics.report(new Diagnostic(Diagnostic.Severity.WARNING, 1, 1, "?", "Unknown token:", "x", "Beginning", ""));
        diagnostics.report(new Diagnostic(Diagnostic.Severity.WARNING, 2, 2, "?", "Unknown token:", "y", "Beginning", ""));
        assertEquals(2, diagnostics.getWarningCount());
        assertFalse(diagnostics.hasFatal());
        diagnostics.report(new Diagnostic(Diagnostic.Severity.FATAL, 3, 3, "/", "Unknown parallel:", "/q", "Beginning", ""));
        assertEquals(2, diagnostics.getWarningCount());
        assertTrue(diagnostics.hasFatal());
        assertEquals(3, diagnostics.getReported().size());
    }
}
