package net.stemmaweb.prep.exporter;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.commons.io.FileUtils;

import net.stemmaweb.prep.model.VariationUnitModel;
import net.stemmaweb.prep.parser.CommandType;
import net.stemmaweb.prep.parser.TokenStream;

/**
 * Writes the variant listing by reading the collation text once more. Each position
 * marker starts a section; each reading block gives its lemma, then one line per variation
 * unit with its column in the matrix (or dashes if the unit was dropped) and its numbered
 * readings.
 */
public class VariantListExporter {

    private final TokenStream tokens;
    private final List<VariationUnitModel> units;

    /**
     * @param tokens - the token stream of the collation that was interpreted
     * @param units - the variation units of the collation, with their final weights
     */
    public VariantListExporter(TokenStream tokens, List<VariationUnitModel> units) {
        this.tokens = tokens;
        this.units = units;
    }

    public String exportAsString() {
        StringBuilder out = new StringBuilder();
        Cursor cursor = new Cursor();
        tokens.restart();
        String token;
        while ((token = tokens.next()) != null) {
            CommandType type = CommandType.fromToken(token);
            if (type == CommandType.END)
                break;
            switch (type) {
                case POSITION:
                    String position = tokens.next();
                    if (position == null)
                        return out.toString();
                    out.append("\n@ ").append(position).append('\n');
                    break;
                case READINGS:
                    listReadings(out, cursor);
                    break;
                case DECLARE:
                case MACRO:
                case LACUNA_OPEN:
                case LACUNA_CLOSE:
                case SUPPRESS:
                case DISCARD:
                    skipUntil(';');
                    break;
                case WITNESSES:
                    skipUntil('>');
                    break;
                case COMMENT:
                    skipUntil('"');
                    break;
                case ALIAS:
                    skip(3);
                    break;
                case CHRONOLOGY:
                    skip(1);
                    break;
                default:
                    break;
            }
        }
        return out.toString();
    }

    private void listReadings(StringBuilder out, Cursor cursor) {
        boolean lemma = true;
        boolean space = false;
        int reading = 0;
        String token;
        while ((token = tokens.next()) != null) {
            switch (token.charAt(0)) {
                case '|':
                    int weight = cursor.unit < units.size() ? units.get(cursor.unit).getWeight() : 0;
                    cursor.unit++;
                    cursor.column += weight;
                    if (weight > 0)
                        out.append(String.format("\n%4d  ", cursor.column - 1));
                    else
                        out.append("\n----  ");
                    lemma = false;
                    space = false;
                    reading = 0;
                    break;
                case ']':
                    out.append('\n');
                    return;
                case '"':
                    skipUntil('"');
                    break;
                default:
                    if (lemma && !space)
                        out.append("\n>     ");
                    if (space)
                        out.append(' ');
                    if (!lemma)
                        out.append(++reading).append('=');
                    out.append(token);
                    space = true;
            }
        }
    }

    private void skipUntil(char terminator) {
        String token;
        do {
            token = tokens.next();
        } while (token != null && token.charAt(0) != terminator);
    }

    private void skip(int count) {
        for (int i = 0; i < count; i++)
            tokens.next();
    }

    public void exportToFile(File target) throws IOException {
        FileUtils.writeStringToFile(target, exportAsString(), StandardCharsets.UTF_8);
    }

    // Position in the unit list and in the weighted matrix columns
    private static class Cursor {
        int unit = 0;
        int column = 0;
    }
}
