package net.stemmaweb.prep.parser;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.stemmaweb.prep.model.ChronologyEntry;
import net.stemmaweb.prep.model.CollationModel;
import net.stemmaweb.prep.model.HandModel;
import net.stemmaweb.prep.model.MacroModel;
import net.stemmaweb.prep.model.MacroRegistry;
import net.stemmaweb.prep.model.ParallelModel;
import net.stemmaweb.prep.model.PieceModel;
import net.stemmaweb.prep.model.Priority;
import net.stemmaweb.prep.model.ReadingSet;
import net.stemmaweb.prep.model.TestimonyModel;
import net.stemmaweb.prep.model.VariationUnitModel;
import net.stemmaweb.prep.model.WitnessModel;

/**
 * Interprets the commands of a collation, building up the witnesses, pieces and
 * testimony of a CollationModel. Recoverable problems are reported as warnings and
 * interpretation goes on; anything else stops it with a CollationException.
 */
public class CollationParser {

    private static final Logger logger = LoggerFactory.getLogger(CollationParser.class);

    private enum LacunaMode { OPEN, CLOSE, CHECK }

    private final CollationModel collation;
    private final TokenStream tokens;
    private final Diagnostics diagnostics;

    // Context for diagnostics
    private String command = "";
    private int commandLine = 0;
    private String lemma = "";
    private String pendingPosition = "Beginning";

    public CollationParser(CollationModel collation, TokenStream tokens, Diagnostics diagnostics) {
        this.collation = collation;
        this.tokens = tokens;
        this.diagnostics = diagnostics;
    }

    public CollationModel getCollation() {
        return collation;
    }

    /**
     * Interprets the whole collation, from the beginning of the token stream up to its end
     * or to the first '!' command.
     *
     * @return the number of warnings reported
     * @throws CollationException on the first fatal error
     */
    public int parse() throws CollationException {
        int before = diagnostics.getWarningCount();
        tokens.restart();
        String token;
        while ((token = tokens.next()) != null) {
            CommandType type = CommandType.fromToken(token);
            if (type == CommandType.END)
                break;
            command = String.valueOf(type.getSymbol());
            commandLine = tokens.getLine();
            switch (type) {
                case DECLARE:
                    doDeclare();
                    break;
                case PARALLEL:
                    doParallel(token);
                    break;
                case MACRO:
                    doMacro(token);
                    break;
                case LACUNA_OPEN:
                    doLacuna(token.length() > 1 && token.charAt(1) == '?' ? LacunaMode.CHECK : LacunaMode.OPEN);
                    break;
                case LACUNA_CLOSE:
                    doLacuna(LacunaMode.CLOSE);
                    break;
                case POSITION:
                    doPosition();
                    break;
                case READINGS:
                    doReadings();
                    break;
                case WITNESSES:
                    doWitnesses();
                    break;
                case CHRONOLOGY:
                    doChronology();
                    break;
                case ALIAS:
                    doAlias();
                    break;
                case SUPPRESS:
                    doSuppress();
                    break;
                case COMMENT:
                    skipComment();
                    break;
                case DISCARD:
                    skipUntil(';');
                    break;
                case BRACE_OPEN:
                case BRACE_CLOSE:
                    break;
                default:
                    warn("Unknown token:", token);
            }
        }
        if (!collation.isDeclared()) {
            command = "*";
            throw fatal("No witnesses declared", "");
        }
        logger.debug("Interpreted {} pieces and {} variation units",
                collation.getPieces().size(), collation.getUnits().size());
        return diagnostics.getWarningCount() - before;
    }

    // Syntax: * {witness | /c}+ ;
    private void doDeclare() throws CollationException {
        if (collation.isDeclared())
            throw fatal("Already declared the witnesses.", "");
        List<String> declarations = new ArrayList<>();
        List<Character> codes = new ArrayList<>();
        Set<String> names = new HashSet<>();
        if (collation.getConfig().hasRoot())
            names.add(WitnessModel.fromDeclaration(0, collation.getConfig().getRoot()).getName());

        String token;
        while (!(token = next()).startsWith(";")) {
            switch (token.charAt(0)) {
                case '/':
                    if (token.length() < 2)
                        warn("Missing parallel code:", token);
                    else if (codes.contains(token.charAt(1)))
                        warn("Duplicate parallel:", token);
                    else
                        codes.add(token.charAt(1));
                    break;
                case '"':
                    skipComment();
                    break;
                default:
                    String name = WitnessModel.fromDeclaration(0, token).getName();
                    if (!names.add(name))
                        warn("Duplicate witness:", name);
                    else
                        declarations.add(token);
            }
        }
        collation.declare(declarations, codes);
        collation.getParallel(0).setPosition(pendingPosition);
        logger.debug("Declared {} witnesses in {} parallels",
                collation.getWitnesses().size(), collation.getParallels().size());
    }

    // Syntax: /c
    private void doParallel(String token) throws CollationException {
        requireDeclared();
        char code = token.length() > 1 ? token.charAt(1) : ParallelModel.DEFAULT_CODE;
        int index = collation.findParallel(code);
        if (index < 0)
            throw fatal("Unknown parallel:", token);
        collation.setCurrentParallel(index);
    }

    // Syntax: =[+-?] $m {witness | $n}* ;
    private void doMacro(String token) throws CollationException {
        requireDeclared();
        char op = token.length() > 1 ? token.charAt(1) : '=';
        String nameToken = next();
        if (!nameToken.startsWith("$") || nameToken.length() < 2)
            throw fatal("Macro name must begin with $:", nameToken);
        char name = nameToken.charAt(1);

        ParallelModel parallel = collation.getCurrentParallel();
        MacroRegistry registry = parallel.getMacros();
        BitSet members = new BitSet();
        String t;
        while (!(t = next()).startsWith(";")) {
            if (t.startsWith("\"")) {
                skipComment();
            } else if (t.startsWith("$")) {
                MacroModel other = resolveMacro(t);
                if (other == null)
                    unknown("Unknown macro:", t, t.contains(";"));
                else if (other.getName() == name)
                    warn("Recursive macro:", t);
                else
                    for (int ms : other.memberIndices())
                        members.set(ms);
            } else {
                WitnessReference ref = WitnessReference.resolve(collation, parallel, t);
                switch (ref.getStatus()) {
                    case NOT_FOUND:
                        unknown("Unknown:", t, t.contains(";"));
                        break;
                    case SUPPRESSED:
                        break;
                    case BAD_HAND:
                        warn("No macros with correctors:", t);
                        break;
                    default:
                        if (ref.getHand() > 0)
                            warn("No macros with correctors:", t);
                        else
                            members.set(ref.getWitness());
                }
            }
        }

        switch (op) {
            case '+':
                registry.add(name, members);
                break;
            case '-':
                registry.subtract(name, members);
                break;
            case '?':
                BitSet failing = registry.check(name, members);
                if (failing == null)
                    warn("Unknown macro:", nameToken);
                else
                    for (int ms : failing.stream().toArray())
                        warn("Not in macro:", collation.getWitness(ms).getName());
                break;
            default:
                registry.define(name, members);
        }
    }

    // Syntax: ( {witness[:h] | $m}* ;   ) {witness[:h] | $m}* ;   (? {witness[:h] | $m}* ;
    private void doLacuna(LacunaMode mode) throws CollationException {
        requireDeclared();
        ParallelModel parallel = collation.getCurrentParallel();
        String t;
        while (!(t = next()).startsWith(";")) {
            if (t.startsWith("\"")) {
                skipComment();
            } else if (t.startsWith("$")) {
                MacroModel macro = resolveMacro(t);
                if (macro == null) {
                    unknown("Unknown macro:", t, t.contains(";"));
                    continue;
                }
                // A macro opens the original only, but closes every hand
                int last = mode == LacunaMode.OPEN ? 0 : TestimonyModel.MAX_HANDS - 1;
                for (int ms : macro.memberIndices())
                    if (!collation.isRoot(ms))
                        markLacuna(parallel.getTestimony(ms), 0, last, mode);
            } else {
                WitnessReference ref = WitnessReference.resolve(collation, parallel, t);
                if (ref.getStatus() == WitnessReference.Status.SUPPRESSED)
                    continue;
                if (!ref.isFound()) {
                    unknown("Unknown:", t, t.contains(";"));
                    continue;
                }
                TestimonyModel testimony = parallel.getTestimony(ref.getWitness());
                if (ref.hasHandSuffix())
                    markLacuna(testimony, ref.getHand(), ref.getHand(), mode);
                else
                    markLacuna(testimony, 0, TestimonyModel.MAX_HANDS - 1, mode);
            }
        }
    }

    // The first hand of the range decides whether the change is legitimate
    private void markLacuna(TestimonyModel t, int from, int to, LacunaMode mode) {
        boolean lacunose = t.getHand(from).isInLacuna();
        String name = from == to && from > 0
                ? t.getWitness().getName() + ":" + from : t.getWitness().getName();
        switch (mode) {
            case OPEN:
                if (lacunose) {
                    warn("Already lacunose:", name);
                    return;
                }
                break;
            case CLOSE:
                if (!lacunose) {
                    warn("Not lacunose:", name);
                    return;
                }
                break;
            case CHECK:
                if (!lacunose)
                    warn("Not lacunose:", name);
                return;
        }
        for (int h = from; h <= to; h++)
            t.getHand(h).setInLacuna(mode == LacunaMode.OPEN);
    }

    // Syntax: @ verse
    private void doPosition() throws CollationException {
        String position = next();
        if (collation.isDeclared())
            collation.getCurrentParallel().setPosition(position);
        else
            pendingPosition = position;
    }

    // Syntax: [ lemma* { |[weight] reading* }+ ]
    private void doReadings() throws CollationException {
        StringBuilder lem = new StringBuilder();
        lemma = "";
        PieceModel piece = null;
        VariationUnitModel unit = null;
        String t;
        while (!(t = next()).startsWith("]")) {
            switch (t.charAt(0)) {
                case '|':
                    if (piece == null)
                        piece = collation.addPiece(lemma, position());
                    unit = collation.addUnit(piece, weightOf(t));
                    break;
                case '"':
                    skipComment();
                    break;
                default:
                    if (piece == null) {
                        if (lem.length() > 0)
                            lem.append(' ');
                        lem.append(t);
                        lemma = lem.toString();
                    } else {
                        unit.addReading(t);
                    }
            }
        }
        if (piece == null) {
            warn("No variation units", "");
            collation.addPiece(lemma, position());
        }
    }

    /**
     * Works out the weight of a variation unit from the suffix of its '|' token:
     * none for 1, *n for n, a number for an edit distance scaled down by the weight
     * divisor, anything else for 0.
     */
    private int weightOf(String token) {
        String suffix = token.substring(1);
        if (suffix.isEmpty())
            return 1;
        if (suffix.startsWith("*")) {
            try {
                int weight = Integer.parseInt(suffix.substring(1));
                if (weight >= 0)
                    return weight;
            } catch (NumberFormatException e) {
                logger.debug("Weight {} is not a number", suffix);
            }
            warn("Bad weight:", token);
            return 1;
        }
        if (!suffix.chars().allMatch(Character::isDigit))
            return 0;
        int distance;
        try {
            distance = Integer.parseInt(suffix);
        } catch (NumberFormatException e) {
            warn("Bad weight:", token);
            return 1;
        }
        int divisor = collation.getConfig().getWeightDivisor();
        if (distance == 0)
            return 0;
        if (divisor == 0)
            return 1;
        return (distance - 1) / divisor + 1;
    }

    // Syntax: < states {witness | $m}+ { | states {witness | $m}+ }* >
    private void doWitnesses() throws CollationException {
        requireDeclared();
        PieceModel piece = collation.getCurrentPiece();
        if (piece == null)
            throw fatal("No readings declared", "");
        ParallelModel parallel = collation.getCurrentParallel();
        for (TestimonyModel t : parallel.getTestimonies())
            t.getHands().forEach(x -> x.setLevel(Priority.NONE));

        boolean states = true;
        ReadingSet reading = null;
        String token;
        while (!(token = next()).startsWith(">")) {
            switch (token.charAt(0)) {
                case '|':
                    states = true;
                    break;
                case '"':
                    skipComment();
                    break;
                case '$':
                    if (reading == null) {
                        warn("No states for macro:", token);
                        break;
                    }
                    MacroModel macro = resolveMacro(token);
                    if (macro == null) {
                        unknown("Unknown macro:", token, token.contains(">"));
                        break;
                    }
                    assignMacro(parallel, piece, macro, reading, token);
                    break;
                default:
                    if (states) {
                        if (token.length() != piece.size())
                            throw fatal("Variant mismatch:", String.format("%s (%d) should have exactly %d",
                                    token, token.length(), piece.size()));
                        reading = collation.newReadingSet(token);
                        states = false;
                    } else {
                        assignWitness(parallel, piece, token, reading);
                    }
            }
        }
        closeWitnesses(parallel, piece);
    }

    private void assignMacro(ParallelModel parallel, PieceModel piece, MacroModel macro,
                             ReadingSet reading, String token) {
        for (int ms : macro.memberIndices()) {
            if (collation.isRoot(ms))
                continue;
            HandModel original = parallel.getTestimony(ms).getOriginal();
            if (original.isInLacuna())
                continue;
            if (original.getLevel().isAbove(macro.getPriority()))
                continue;
            if (original.getLevel().equals(macro.getPriority())) {
                warn("Duplicate macro:", token + " " + collation.getWitness(ms).getName());
                continue;
            }
            original.setReading(piece.getIndex(), reading);
            original.setLevel(macro.getPriority());
        }
    }

    private void assignWitness(ParallelModel parallel, PieceModel piece, String token, ReadingSet reading)
            throws CollationException {
        WitnessReference ref = WitnessReference.resolve(collation, parallel, token);
        if (ref.getStatus() == WitnessReference.Status.SUPPRESSED)
            return;
        if (!ref.isFound()) {
            unknown("Unknown:", token, token.startsWith("<") || token.contains(">"));
            return;
        }
        HandModel hand = parallel.getTestimony(ref.getWitness()).getHand(ref.getHand());
        if (hand.isInLacuna()) {
            warn("Lacunose (use $?):", token);
            return;
        }
        if (hand.getReading(piece.getIndex()) != null && hand.getLevel().equals(Priority.EXPLICIT)) {
            warn("Duplicate:", token);
            return;
        }
        hand.setReading(piece.getIndex(), reading);
        hand.setLevel(Priority.EXPLICIT);
    }

    // Unknown readings and lacunae leave the cell empty; anything else must have been assigned
    private void closeWitnesses(ParallelModel parallel, PieceModel piece) {
        MacroModel unknown = parallel.getMacros().getUnknown();
        for (TestimonyModel t : parallel.getTestimonies()) {
            int ms = t.getWitness().getIndex();
            HandModel original = t.getOriginal();
            if (collation.isRoot(ms) || original.isSuppressed())
                continue;
            if (unknown.contains(ms) && !original.getLevel().isAbove(unknown.getPriority())) {
                original.clearReading(piece.getIndex());
                continue;
            }
            if (original.isInLacuna()) {
                original.clearReading(piece.getIndex());
                continue;
            }
            if (original.getReading(piece.getIndex()) == null)
                warn("Unassigned:", CollationModel.inputName(t, 0));
        }
    }

    // Syntax: ^ file
    private void doChronology() throws CollationException {
        requireDeclared();
        String token = next();
        String path = token.startsWith("~") ? collation.getConfig().getHome() + token.substring(1) : token;
        ChronologyParser parser = new ChronologyParser(
                (line, text) -> warn("Malformed chronology:", String.format("%s(%d) %s", token, line, text)));
        List<ChronologyEntry> entries;
        try {
            entries = parser.parse(new File(path));
        } catch (IOException e) {
            logger.debug("Cannot read {}", path, e);
            throw fatal("Cannot open file:", token);
        }
        int matched = parser.apply(collation, entries);
        logger.debug("Read {} chronology entries from {}, {} matched", entries.size(), path, matched);
    }

    // Syntax: ~ witness alternate display
    private void doAlias() throws CollationException {
        requireDeclared();
        String token = next();
        WitnessReference ref = WitnessReference.resolve(collation, collation.getCurrentParallel(), token);
        switch (ref.getStatus()) {
            case SUPPRESSED:
                next();
                next();
                return;
            case NOT_FOUND:
                throw fatal("Unknown:", token);
            case BAD_HAND:
                throw fatal("Cannot have a corrector:", token);
            default:
                if (ref.getHand() > 0)
                    throw fatal("Cannot have a corrector:", token);
        }
        WitnessModel witness = collation.getWitness(ref.getWitness());
        witness.setAlternateName(next());
        witness.setDisplayName(next());
    }

    // Syntax: - {witness[:h] | $m}+ ;
    private void doSuppress() throws CollationException {
        requireDeclared();
        ParallelModel parallel = collation.getCurrentParallel();
        String t;
        while (!(t = next()).startsWith(";")) {
            if (t.startsWith("\"")) {
                skipComment();
            } else if (t.startsWith("$")) {
                MacroModel macro = resolveMacro(t);
                if (macro == null) {
                    unknown("Unknown macro:", t, t.contains(";"));
                    continue;
                }
                for (int ms : macro.memberIndices())
                    if (!collation.isRoot(ms))
                        parallel.getTestimony(ms).suppressAll();
            } else if (!t.startsWith("-")) {
                WitnessReference ref = WitnessReference.resolve(collation, parallel, t);
                switch (ref.getStatus()) {
                    case SUPPRESSED:
                        warn("Already suppressed:", t);
                        break;
                    case FOUND:
                        TestimonyModel testimony = parallel.getTestimony(ref.getWitness());
                        if (ref.getHand() != 0)
                            testimony.getHand(ref.getHand()).setSuppressed(true);
                        else
                            testimony.suppressAll();
                        break;
                    default:
                        unknown("Unknown:", t, t.contains(";"));
                }
            }
        }
    }

    // Syntax: " ... "
    private void skipComment() throws CollationException {
        skipUntil('"');
    }

    private void skipUntil(char terminator) throws CollationException {
        String token;
        do {
            token = next();
        } while (token.charAt(0) != terminator);
    }

    private MacroModel resolveMacro(String token) {
        return token.length() < 2 ? null : collation.getCurrentParallel().getMacros().resolve(token.charAt(1));
    }

    private String next() throws CollationException {
        String token = tokens.next();
        if (token == null)
            throw fatal("Unexpected end of file", "");
        return token;
    }

    private void requireDeclared() throws CollationException {
        if (!collation.isDeclared())
            throw fatal("Witnesses not declared", "");
    }

    private String position() {
        return collation.isDeclared() ? collation.getCurrentParallel().getPosition() : pendingPosition;
    }

    // Becomes fatal when the unknown token has swallowed the terminator of its list
    private void unknown(String message, String token, boolean terminal) throws CollationException {
        if (terminal)
            throw fatal(message, token);
        warn(message, token);
    }

    private void warn(String message, String argument) {
        diagnostics.report(diagnostic(Diagnostic.Severity.WARNING, message, argument));
    }

    private CollationException fatal(String message, String argument) {
        Diagnostic d = diagnostic(Diagnostic.Severity.FATAL, message, argument);
        diagnostics.report(d);
        return new CollationException(d);
    }

    private Diagnostic diagnostic(Diagnostic.Severity severity, String message, String argument) {
        return new Diagnostic(severity, tokens.getLine(), commandLine, command,
                message, argument, position(), lemma);
    }
}
