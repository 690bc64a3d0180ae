package net.stemmaweb.prep.exporter;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;

import net.stemmaweb.prep.model.CollationModel;
import net.stemmaweb.prep.model.HandModel;
import net.stemmaweb.prep.model.PieceModel;
import net.stemmaweb.prep.model.TestimonyModel;
import net.stemmaweb.prep.model.VariationUnitModel;

/**
 * Writes the character matrix: a header with the number of surviving hands and the
 * weighted unit total, then one row per surviving hand with the state of every unit,
 * repeated as many times as the unit weighs.
 */
public class MatrixExporter {

    private final CollationModel collation;

    public MatrixExporter(CollationModel collation) {
        this.collation = collation;
    }

    public String exportAsString() {
        StringBuilder matrix = new StringBuilder();
        matrix.append(String.format("%-9d %d\n", collation.activeHands(), collation.getWeightedTotal()));
        for (TestimonyModel t : collation.getAllTestimonies()) {
            for (HandModel h : t.getHands()) {
                if (h.isSuppressed())
                    continue;
                matrix.append(String.format("%-9s ", CollationModel.handName(t, h.getIndex())));
                for (PieceModel piece : collation.getPieces()) {
                    for (int u = 0; u < piece.size(); u++) {
                        VariationUnitModel unit = piece.getUnits().get(u);
                        char state = collation.stateOf(t, h.getIndex(), piece, u);
                        for (int w = 0; w < unit.getWeight(); w++)
                            matrix.append(state);
                    }
                }
                matrix.append('\n');
            }
        }
        return matrix.toString();
    }

    public void exportToFile(File target) throws IOException {
        FileUtils.writeStringToFile(target, exportAsString(), StandardCharsets.UTF_8);
    }
}
