package org.dxworks.ommltex.converter;

import org.dxworks.ommltex.model.MathNode;
import org.dxworks.ommltex.model.NodeKind;
import org.dxworks.ommltex.symbols.LatexCommands;
import org.dxworks.ommltex.symbols.SymbolTable;

import java.util.Set;

/**
 * Bars, boxes and grouping characters. OMML places both bars and group characters
 * below the base unless {@code pos} says {@code top}. A group character that is not a
 * brace is stacked over or under the base.
 */
public class DecorationConverter implements NodeConverter {

    private static final String TOP = "top";

    // absent chr is the default bottom brace
    private static final Set<String> BRACES = Set.of("\u23DF", "\u23DE", "{", "}");

    private final OmmlToLatexConverter dispatcher;

    public DecorationConverter(OmmlToLatexConverter dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public String convert(MathNode node) {
        String base = dispatcher.convertChild(node, NodeKind.ARGUMENT).strip();
        boolean top = TOP.equals(node.getAttribute(MathNode.ATTR_POSITION));

        return switch (node.getKind()) {
            case BAR -> LatexCommands.format(top ? "overline" : "underline", base);
            case GROUP_CHARACTER -> groupCharacter(node.getAttribute(MathNode.ATTR_CHR), base, top);
            case BORDER_BOX -> LatexCommands.format("boxed", base);
            default -> dispatcher.concatenateChildren(node);
        };
    }

    private static String groupCharacter(String chr, String base, boolean top) {
        if (chr == null || chr.isEmpty() || BRACES.contains(chr)) {
            return LatexCommands.format(top ? "overbrace" : "underbrace", base);
        }
        String symbol = SymbolTable.convert(chr).strip();
        return LatexCommands.format(top ? "overset" : "underset", symbol, base);
    }
}
