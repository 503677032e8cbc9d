package org.dxworks.ommltex.converter;

import org.dxworks.ommltex.model.MathNode;
import org.dxworks.ommltex.model.NodeKind;

import java.util.regex.Pattern;

/**
 * {@code m:sSup}, {@code m:sSub}, {@code m:sSubSup} and {@code m:sPre}.
 */
public class ScriptConverter implements NodeConverter {

    private static final String INTEGRAL = "\\int";
    private static final String BRACKET_OPEN = "\\left[";
    private static final String BRACKET_CLOSE = "\\right]";

    private final OmmlToLatexConverter dispatcher;

    public ScriptConverter(OmmlToLatexConverter dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public String convert(MathNode node) {
        return switch (node.getKind()) {
            case SUPERSCRIPT -> superscript(node);
            case SUBSCRIPT -> subscript(node);
            case SUB_SUPERSCRIPT -> subSuperscript(node);
            case PRE_SUB_SUPERSCRIPT -> preSubSuperscript(node);
            default -> dispatcher.concatenateChildren(node);
        };
    }

    private String superscript(MathNode node) {
        String base = dispatcher.convertChild(node, NodeKind.ARGUMENT).strip();
        String sup = dispatcher.convertChild(node, NodeKind.SUP);

        base = dropDuplicatedIntegrals(base);
        if (!LatexCleanup.hasCompoundCommand(base)) {
            base = LatexCleanup.clean(base);
        }
        return base + "^{" + sup + "}";
    }

    private String subscript(MathNode node) {
        String base = LatexCleanup.clean(dispatcher.convertChild(node, NodeKind.ARGUMENT).strip());
        String sub = dispatcher.convertChild(node, NodeKind.SUB);
        return base + "_{" + sub + "}";
    }

    private String subSuperscript(MathNode node) {
        String base = LatexCleanup.clean(dispatcher.convertChild(node, NodeKind.ARGUMENT).strip());
        String sub = dispatcher.convertChild(node, NodeKind.SUB);
        String sup = dispatcher.convertChild(node, NodeKind.SUP);
        return base + "_{" + sub + "}^{" + sup + "}";
    }

    private String preSubSuperscript(MathNode node) {
        String base = LatexCleanup.clean(dispatcher.convertChild(node, NodeKind.ARGUMENT).strip());
        String sub = dispatcher.convertChild(node, NodeKind.SUB);
        String sup = dispatcher.convertChild(node, NodeKind.SUP);
        return "{}_{" + sub + "}^{" + sup + "}" + base;
    }

    /**
     * Repairs a bracketed base that Word exported with its integrals repeated: when a
     * {@code \left[...} base holds more than two {@code \int}, only the part up to the
     * third one is kept and the bracket is closed again.
     */
    static String dropDuplicatedIntegrals(String base) {
        if (!base.startsWith(BRACKET_OPEN) || countOccurrences(base, INTEGRAL) <= 2) {
            return base;
        }
        String[] parts = base.split(Pattern.quote(INTEGRAL), -1);
        if (parts.length <= 3) {
            return base;
        }
        String kept = parts[0] + INTEGRAL + parts[1] + INTEGRAL + parts[2];
        return kept.endsWith(BRACKET_CLOSE) ? kept : kept + BRACKET_CLOSE;
    }

    private static int countOccurrences(String text, String needle) {
        int count = 0;
        int from = 0;
        while ((from = text.indexOf(needle, from)) >= 0) {
            count++;
            from += needle.length();
        }
        return count;
    }
}
