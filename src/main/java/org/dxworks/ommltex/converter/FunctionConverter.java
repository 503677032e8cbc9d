package org.dxworks.ommltex.converter;

import org.dxworks.ommltex.model.MathNode;
import org.dxworks.ommltex.model.NodeKind;
import org.dxworks.ommltex.symbols.FunctionNames;

import java.util.Locale;

/**
 * {@code m:func} applications and the {@code m:limLow} / {@code m:limUpp} limit constructs.
 */
public class FunctionConverter implements NodeConverter {

    private static final String LIMIT_COMMAND = "\\lim";

    private final OmmlToLatexConverter dispatcher;

    public FunctionConverter(OmmlToLatexConverter dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public String convert(MathNode node) {
        return switch (node.getKind()) {
            case FUNCTION -> function(node);
            case LIMIT_LOWER -> limit(node, "_");
            case LIMIT_UPPER -> limit(node, "^");
            default -> dispatcher.concatenateChildren(node);
        };
    }

    private String function(MathNode node) {
        MathNode nameNode = MathNodes.findFirstChild(node, NodeKind.FUNCTION_NAME);
        String argument = dispatcher.convertChild(node, NodeKind.ARGUMENT).strip();

        if (nameNode != null && MathNodes.hasDescendant(nameNode, NodeKind.LIMIT_LOWER)) {
            String name = dispatcher.convert(nameNode).strip();
            // an argument that already carries its own \lim would be emitted twice
            if (!argument.isEmpty() && !argument.contains(LIMIT_COMMAND)) {
                return name + " " + argument;
            }
            return name;
        }

        String name = dispatcher.convert(nameNode).strip();
        if (!name.isEmpty() && !name.startsWith("\\")) {
            name = FunctionNames.convert(name).strip();
        }

        if (!name.isEmpty() && name.toLowerCase(Locale.ROOT).contains("lim")) {
            return argument.isEmpty() ? name : name + " " + argument;
        }

        if (!name.isEmpty() && !argument.isEmpty()) {
            return name + "(" + argument + ")";
        }
        return name.isEmpty() ? argument : name;
    }

    private String limit(MathNode node, String position) {
        String base = dispatcher.convertChild(node, NodeKind.ARGUMENT).strip();
        String limit = dispatcher.convertChild(node, NodeKind.LIMIT).strip();

        if ("lim".equals(base)) {
            base = LIMIT_COMMAND;
        } else if (!base.startsWith("\\")) {
            base = FunctionNames.convert(base).strip();
        }
        return base + position + "{" + limit + "}";
    }
}
