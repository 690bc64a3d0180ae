package net.stemmaweb.prep.parser;

/**
 * A fatal error in the collation. Interpretation stops where it is thrown.
 */
public class CollationException extends Exception {

    private final Diagnostic diagnostic;

    public CollationException(Diagnostic diagnostic) {
        super(diagnostic.getMessage() + (diagnostic.getArgument().isEmpty() ? "" : " " + diagnostic.getArgument()));
        this.diagnostic = diagnostic;
    }

    public Diagnostic getDiagnostic() {
        return diagnostic;
    }
}
