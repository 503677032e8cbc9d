package org.dxworks.ommltex.converter;

import org.dxworks.ommltex.model.MathNode;
import org.dxworks.ommltex.model.NodeKind;
import org.dxworks.ommltex.symbols.LatexCommands;

import java.util.Set;

/**
 * {@code m:rad}: square roots and n-th roots.
 */
public class RadicalConverter implements NodeConverter {

    private static final Set<String> ON_VALUES = Set.of("1", "on", "true");

    private final OmmlToLatexConverter dispatcher;

    public RadicalConverter(OmmlToLatexConverter dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public String convert(MathNode node) {
        String expression = dispatcher.convertChild(node, NodeKind.ARGUMENT);

        if (isDegreeHidden(node)) {
            return LatexCommands.format("sqrt", expression);
        }

        MathNode degreeNode = MathNodes.findFirstChild(node, NodeKind.DEGREE);
        if (degreeNode != null) {
            String degree = dispatcher.convert(degreeNode);
            if (!degree.isBlank()) {
                return "\\sqrt[" + degree.strip() + "]{" + expression + "}";
            }
        }

        return LatexCommands.format("sqrt", expression);
    }

    private static boolean isDegreeHidden(MathNode node) {
        String value = node.getAttribute(MathNode.ATTR_DEGREE_HIDE);
        return value != null && ON_VALUES.contains(value.toLowerCase());
    }
}
