package net.stemmaweb.prep.parser;

/**
 * The commands of the collation notation, each selected by the first character of the
 * token that opens it.
 */
public enum CommandType {
    DECLARE('*'),           // * {witness | /c}+ ;
    PARALLEL('/'),          // /c
    MACRO('='),             // =[+-?] $m {witness | $n}* ;
    LACUNA_OPEN('('),       // ([?] {witness | $m}* ;
    LACUNA_CLOSE(')'),      // ) {witness | $m}* ;
    POSITION('@'),          // @ verse
    READINGS('['),          // [ lemma* { |[weight] reading* }+ ]
    WITNESSES('<'),         // < states {witness | $m}+ { | states {witness | $m}+ }* >
    CHRONOLOGY('^'),        // ^ file
    ALIAS('~'),             // ~ name alternate display
    SUPPRESS('-'),          // - {witness | $m}+ ;
    COMMENT('"'),           // " ... "
    DISCARD('+'),           // + ... ;
    BRACE_OPEN('{'),
    BRACE_CLOSE('}'),
    END('!'),
    UNKNOWN('?');

    private final char symbol;

    CommandType(char symbol) {
        this.symbol = symbol;
    }

    public char getSymbol() {
        return symbol;
    }

    public static CommandType fromToken(String token) {
        char first = token.charAt(0);
        for (CommandType c : values())
            if (c != UNKNOWN && c.symbol == first)
                return c;
        return UNKNOWN;
    }
}
