package net.stemmaweb.prep.exporter;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.commons.io.FileUtils;

import net.stemmaweb.prep.model.ConstraintModel;

/**
 * Writes the constraints file, one line per surviving hand:
 *
 *     name      stratum < predecessor predecessor ... >
 */
public class ConstraintExporter {

    private final List<ConstraintModel> constraints;

    public ConstraintExporter(List<ConstraintModel> constraints) {
        this.constraints = constraints;
    }

    public String exportAsString() {
        StringBuilder sb = new StringBuilder();
        for (ConstraintModel c : constraints) {
            sb.append(String.format("%-9s %d < ", c.getName(), c.getStratum()));
            c.getPredecessors().forEach(x -> sb.append(x).append(' '));
            sb.append(">\n");
        }
        return sb.toString();
    }

    public void exportToFile(File target) throws IOException {
        FileUtils.writeStringToFile(target, exportAsString(), StandardCharsets.UTF_8);
    }
}
