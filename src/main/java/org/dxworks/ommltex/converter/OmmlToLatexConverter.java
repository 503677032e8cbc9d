package org.dxworks.ommltex.converter;

import org.dxworks.ommltex.model.MathNode;
import org.dxworks.ommltex.model.NodeKind;

/**
 * Recursive-descent translator from an OMML node tree to LaTeX.
 *
 * <p>{@link #convert(MathNode)} is the dispatcher: it picks the converter for a node's kind
 * and falls back to concatenating the converted children for containers and unknown kinds.
 * {@link #convertEquation(MathNode)} converts a whole {@code oMath} and runs the global
 * {@link PostProcessor} once over the assembled result.</p>
 *
 * <p>Instances hold no per-call state and can be shared between threads.</p>
 */
public class OmmlToLatexConverter {

    private final TextRunConverter textRuns = new TextRunConverter();
    private final FractionConverter fractions = new FractionConverter(this);
    private final ScriptConverter scripts = new ScriptConverter(this);
    private final NaryConverter naryOperators = new NaryConverter(this);
    private final RadicalConverter radicals = new RadicalConverter(this);
    private final DelimiterConverter delimiters = new DelimiterConverter(this);
    private final AccentConverter accents = new AccentConverter(this);
    private final FunctionConverter functions = new FunctionConverter(this);
    private final DecorationConverter decorations = new DecorationConverter(this);

    public String convertEquation(MathNode equation) {
        if (equation == null) return "";
        return PostProcessor.normalize(convert(equation));
    }

    public String convert(MathNode node) {
        if (node == null) return "";

        return switch (node.getKind()) {
            case TEXT_RUN -> textRuns.convert(node);
            case FRACTION -> fractions.convert(node);
            case SUPERSCRIPT, SUBSCRIPT, SUB_SUPERSCRIPT, PRE_SUB_SUPERSCRIPT -> scripts.convert(node);
            case NARY -> naryOperators.convert(node);
            case RADICAL -> radicals.convert(node);
            case DELIMITER, MATRIX, EQUATION_ARRAY -> delimiters.convert(node);
            case ACCENT -> accents.convert(node);
            case FUNCTION, LIMIT_LOWER, LIMIT_UPPER -> functions.convert(node);
            case BAR, BORDER_BOX, GROUP_CHARACTER -> decorations.convert(node);
            // containers (e, num, den, sub, sup, ...) and anything unrecognized
            default -> concatenateChildren(node);
        };
    }

    /** Converts the first child of the given kind; an absent child is the empty fragment. */
    String convertChild(MathNode parent, NodeKind kind) {
        return convert(MathNodes.findFirstChild(parent, kind));
    }

    String concatenateChildren(MathNode node) {
        StringBuilder sb = new StringBuilder();
        for (MathNode child : node.getChildren()) {
            sb.append(convert(child));
        }
        return sb.toString();
    }
}
