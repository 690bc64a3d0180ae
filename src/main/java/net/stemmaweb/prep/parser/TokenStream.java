package net.stemmaweb.prep.parser;

/**
 * Splits collation text into whitespace-delimited tokens, keeping track of line numbers.
 * The stream can be restarted from the beginning, since the collation is read once for
 * interpretation and once more for the variant listing.
 */
public class TokenStream {

    private final String source;
    private int offset;
    private int line;
    private int tokenLine;

    public TokenStream(String source) {
        // Strip the byte order mark, if it exists
        this.source = source.startsWith("\uFEFF") ? source.substring(1) : source;
        restart();
    }

    public void restart() {
        offset = 0;
        line = 1;
        tokenLine = 0;
    }

    /**
     * @return the next token, or null at the end of the text
     */
    public String next() {
        int len = source.length();
        while (offset < len && Character.isWhitespace(source.charAt(offset))) {
            if (source.charAt(offset) == '\n')
                line++;
            offset++;
        }
        if (offset == len)
            return null;

        int start = offset;
        while (offset < len && !Character.isWhitespace(source.charAt(offset)))
            offset++;
        tokenLine = line;
        return source.substring(start, offset);
    }

    /**
     * @return the line of the token most recently returned
     */
    public int getLine() {
        return tokenLine;
    }
}
