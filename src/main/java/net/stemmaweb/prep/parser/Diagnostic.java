package net.stemmaweb.prep.parser;

/**
 * One problem found in the collation, with enough context to find it in the source:
 * the line, the line where its command began, the command symbol, and the position
 * marker and lemma current at the time.
 */
public class Diagnostic {

    public enum Severity { WARNING, FATAL }

    private final Severity severity;
    private final int line;
    private final int commandLine;
    private final String command;
    private final String message;
    private final String argument;
    private final String position;
    private final String lemma;

    public Diagnostic(Severity severity, int line, int commandLine, String command,
                      String message, String argument, String position, String lemma) {
        this.severity = severity;
        this.line = line;
        this.commandLine = commandLine;
        this.command = command;
        this.message = message;
        this.argument = argument == null ? "" : argument;
        this.position = position;
        this.lemma = lemma == null ? "" : lemma;
    }

    public Severity getSeverity() { return severity; }
    public int getLine() { return line; }
    public int getCommandLine() { return commandLine; }
    public String getCommand() { return command; }
    public String getMessage() { return message; }
    public String getArgument() { return argument; }
    public String getPosition() { return position; }
    public String getLemma() { return lemma; }

    /**
     * Lays the diagnostic out in fixed columns:
     * line, command, message and argument, position marker, lemma.
     *
     * @return the formatted diagnostic
     */
    public String format() {
        StringBuilder sb = new StringBuilder(String.format("%4d: %s", line, command));
        padTo(sb, 6);
        sb.append(message);
        if (!argument.isEmpty())
            sb.append(' ').append(argument);
        padTo(sb, 31);
        sb.append("@ ").append(position);
        padTo(sb, 50);
        if (!lemma.isEmpty())
            sb.append("[ ").append(lemma).append(" ]");
        if (commandLine != line)
            sb.append(String.format(" (from line %d)", commandLine));
        return sb.toString();
    }

    // Always at least one space
    private static void padTo(StringBuilder sb, int column) {
        do {
            sb.append(' ');
        } while (sb.length() < column);
    }

    @Override
    public String toString() {
        return format();
    }
}
