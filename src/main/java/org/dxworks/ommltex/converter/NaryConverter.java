package org.dxworks.ommltex.converter;

import org.dxworks.ommltex.model.MathNode;
import org.dxworks.ommltex.model.NodeKind;
import org.dxworks.ommltex.symbols.SymbolTable;

/**
 * {@code m:nary}: sums, products, integrals and other big operators.
 * Limits that are missing (or empty) are left out instead of emitting {@code _{}}.
 */
public class NaryConverter implements NodeConverter {

    private static final String DEFAULT_OPERATOR = "∫";

    private final OmmlToLatexConverter dispatcher;

    public NaryConverter(OmmlToLatexConverter dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public String convert(MathNode node) {
        String operatorChar = node.getAttribute(MathNode.ATTR_CHR);
        if (operatorChar == null || operatorChar.isEmpty()) {
            operatorChar = DEFAULT_OPERATOR;
        }

        StringBuilder sb = new StringBuilder(SymbolTable.convert(operatorChar).strip());

        MathNode sub = MathNodes.findFirstChild(node, NodeKind.SUB);
        if (sub != null) {
            String lower = dispatcher.convert(sub);
            if (!lower.isBlank()) {
                sb.append("_{").append(lower).append('}');
            }
        }

        MathNode sup = MathNodes.findFirstChild(node, NodeKind.SUP);
        if (sup != null) {
            String upper = dispatcher.convert(sup);
            if (!upper.isBlank()) {
                sb.append("^{").append(upper).append('}');
            }
        }

        MathNode operand = MathNodes.findFirstChild(node, NodeKind.ARGUMENT);
        if (operand != null) {
            sb.append(' ').append(dispatcher.convert(operand));
        }
        return sb.toString();
    }
}
