package org.dxworks.ommltex.converter;

import org.dxworks.ommltex.model.MathNode;
import org.dxworks.ommltex.model.NodeKind;
import org.dxworks.ommltex.symbols.LatexCommands;

import java.util.Map;

/**
 * {@code m:acc}. The accent character is a combining mark; unknown marks fall back to a hat.
 */
public class AccentConverter implements NodeConverter {

    private static final String DEFAULT_ACCENT = "hat";

    private static final Map<String, String> ACCENTS = Map.of(
            "\u0302", "hat",
            "\u0303", "tilde",
            "\u0304", "bar",
            "\u0307", "dot",
            "\u0308", "ddot",
            "\u20D7", "vec"
    );

    private final OmmlToLatexConverter dispatcher;

    public AccentConverter(OmmlToLatexConverter dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public String convert(MathNode node) {
        String base = dispatcher.convertChild(node, NodeKind.ARGUMENT).strip();
        String accent = accentName(node.getAttribute(MathNode.ATTR_CHR));
        return LatexCleanup.clean(LatexCommands.format(accent, base));
    }

    static String accentName(String accentChar) {
        if (accentChar == null) return DEFAULT_ACCENT;
        return ACCENTS.getOrDefault(accentChar, DEFAULT_ACCENT);
    }
}
