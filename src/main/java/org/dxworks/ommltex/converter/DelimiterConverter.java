package org.dxworks.ommltex.converter;

import org.dxworks.ommltex.model.MathNode;
import org.dxworks.ommltex.model.NodeKind;
import org.dxworks.ommltex.symbols.LatexCommands;
import org.dxworks.ommltex.symbols.SymbolTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@code m:d} delimiter groups, together with the two shapes that Word nests inside them:
 * matrices ({@code m:m}) and equation arrays ({@code m:eqArr}, used for piecewise functions).
 */
public class DelimiterConverter implements NodeConverter {

    private static final String DEFAULT_OPEN = "(";
    private static final String DEFAULT_CLOSE = ")";
    private static final String DEFAULT_SEPARATOR = "|";

    private static final String ROW_SEPARATOR = " \\\\ ";
    private static final String CELL_SEPARATOR = " & ";

    private static final Map<String, String> MATRIX_ENVIRONMENTS = Map.of(
            "(", "pmatrix",
            "[", "bmatrix",
            "{", "Bmatrix",
            "|", "vmatrix",
            "‖", "Vmatrix"
    );
    private static final String PLAIN_MATRIX = "matrix";

    // open delimiter -> {close delimiter, \left token, \right token}
    private static final Map<String, String[]> SCALED_PAIRS = Map.of(
            "(", new String[]{")", "\\left(", "\\right)"},
            "[", new String[]{"]", "\\left[", "\\right]"},
            "{", new String[]{"}", "\\left\\{", "\\right\\}"},
            "|", new String[]{"|", "\\left|", "\\right|"}
    );

    private final OmmlToLatexConverter dispatcher;

    public DelimiterConverter(OmmlToLatexConverter dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public String convert(MathNode node) {
        return switch (node.getKind()) {
            case DELIMITER -> delimiter(node);
            case MATRIX -> matrix(node, PLAIN_MATRIX);
            case EQUATION_ARRAY -> equationArray(node);
            default -> dispatcher.concatenateChildren(node);
        };
    }

    private String delimiter(MathNode node) {
        String open = attributeOrDefault(node, MathNode.ATTR_BEGIN_CHR, DEFAULT_OPEN);
        String close = attributeOrDefault(node, MathNode.ATTR_END_CHR, DEFAULT_CLOSE);

        List<MathNode> arguments = MathNodes.findAllChildren(node, NodeKind.ARGUMENT);
        if (arguments.isEmpty()) {
            return "";
        }

        for (MathNode grandchild : arguments.get(0).getChildren()) {
            if (grandchild.is(NodeKind.MATRIX)) {
                return matrix(grandchild, MATRIX_ENVIRONMENTS.getOrDefault(open, PLAIN_MATRIX));
            }
            if (grandchild.is(NodeKind.EQUATION_ARRAY)) {
                String content = equationArray(grandchild);
                if ("{".equals(open) && close.isEmpty()) {
                    return "\\begin{cases} " + content + " \\end{cases}";
                }
                return content;
            }
        }

        String inner = joinArguments(node, arguments);

        String[] pair = SCALED_PAIRS.get(open);
        if (pair != null && pair[0].equals(close)) {
            return pair[1] + inner + pair[2];
        }
        return open + inner + close;
    }

    private String joinArguments(MathNode node, List<MathNode> arguments) {
        String separator = SymbolTable.convert(
                attributeOrDefault(node, MathNode.ATTR_SEPARATOR_CHR, DEFAULT_SEPARATOR));
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) sb.append(separator);
            sb.append(dispatcher.convert(arguments.get(i)));
        }
        return sb.toString();
    }

    /** Empty cells and empty rows are skipped; a matrix without content is the empty fragment. */
    String matrix(MathNode matrix, String environment) {
        List<String> rows = new ArrayList<>();
        for (MathNode row : MathNodes.findAllChildren(matrix, NodeKind.MATRIX_ROW)) {
            List<String> cells = new ArrayList<>();
            for (MathNode cell : MathNodes.findAllChildren(row, NodeKind.ARGUMENT)) {
                String content = dispatcher.convert(cell);
                if (!content.isBlank()) {
                    cells.add(content);
                }
            }
            if (!cells.isEmpty()) {
                rows.add(String.join(CELL_SEPARATOR, cells));
            }
        }

        if (rows.isEmpty()) {
            return "";
        }
        return "\\begin{" + environment + "} " + String.join(ROW_SEPARATOR, rows) + " \\end{" + environment + "}";
    }

    /**
     * Rows of a piecewise definition. Each row is split on its first comma into a value and
     * a condition; conditions mentioning parity are typeset as text.
     */
    String equationArray(MathNode array) {
        List<String> rows = new ArrayList<>();
        for (MathNode row : MathNodes.findAllChildren(array, NodeKind.ARGUMENT)) {
            String part = dispatcher.convert(row);
            if (!part.isBlank()) {
                rows.add(formatCase(part.strip()));
            }
        }
        return String.join(ROW_SEPARATOR, rows);
    }

    private static String formatCase(String part) {
        int comma = part.indexOf(',');
        if (comma < 0) {
            return part;
        }

        String value = part.substring(0, comma).strip();
        String condition = part.substring(comma + 1).strip();
        if (condition.startsWith("&")) {
            condition = condition.substring(1).strip();
        }

        if (condition.isEmpty()) {
            return value;
        }
        if (condition.contains("odd") || condition.contains("even")) {
            return value + ", & " + LatexCommands.format("text", condition);
        }
        return value + ", & " + condition;
    }

    private static String attributeOrDefault(MathNode node, String name, String fallback) {
        String value = node.getAttribute(name);
        return value != null ? value : fallback;
    }
}
