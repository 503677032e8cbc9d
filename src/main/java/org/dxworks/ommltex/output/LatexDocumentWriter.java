package org.dxworks.ommltex.output;

import org.dxworks.ommltex.model.DocumentConversion;
import org.dxworks.ommltex.model.EquationResult;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;

/**
 * Writes converted equations as a standalone LaTeX document using amsmath, amssymb and amsfonts.
 */
public class LatexDocumentWriter {

    private static final String NL = "\n";

    private final String environment;

    public LatexDocumentWriter(String environment) {
        this.environment = environment;
    }

    public void write(Writer writer, List<DocumentConversion> documents) throws IOException {
        writer.write("\\documentclass{article}" + NL);
        writer.write("\\usepackage{amsmath}" + NL);
        writer.write("\\usepackage{amssymb}" + NL);
        writer.write("\\usepackage{amsfonts}" + NL);
        writer.write("\\begin{document}" + NL + NL);

        for (DocumentConversion document : documents) {
            writer.write("% Source: " + document.filePath + NL + NL);
            for (EquationResult equation : document.equations) {
                writeEquation(writer, equation);
            }
        }

        writer.write("\\end{document}" + NL);
    }

    public String render(List<DocumentConversion> documents) {
        StringWriter out = new StringWriter();
        try {
            write(out, documents);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    private void writeEquation(Writer writer, EquationResult equation) throws IOException {
        writer.write("% Equation " + equation.index + NL);
        writer.write("\\begin{" + environment + "}" + NL);
        writer.write("  " + equation.latex + NL);
        writer.write("\\end{" + environment + "}" + NL + NL);
    }
}
