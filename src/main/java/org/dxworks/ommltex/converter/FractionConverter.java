package org.dxworks.ommltex.converter;

import org.dxworks.ommltex.model.MathNode;
import org.dxworks.ommltex.model.NodeKind;
import org.dxworks.ommltex.symbols.LatexCommands;

import java.util.Set;

/**
 * {@code m:f}: plain fractions and binomial coefficients.
 *
 * <ol>
 *   <li>small numeric fractions (1..3 over 2..4) are always {@code \frac}</li>
 *   <li>two single letters become {@code \binom} when they are {@code n} over {@code k}
 *       or when the fraction sits directly inside a delimiter group</li>
 *   <li>everything else is {@code \frac}</li>
 * </ol>
 */
public class FractionConverter implements NodeConverter {

    private static final Set<String> SMALL_NUMERATORS = Set.of("1", "2", "3");
    private static final Set<String> SMALL_DENOMINATORS = Set.of("2", "3", "4");

    private final OmmlToLatexConverter dispatcher;

    public FractionConverter(OmmlToLatexConverter dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public String convert(MathNode node) {
        String numerator = dispatcher.convertChild(node, NodeKind.NUMERATOR).strip();
        String denominator = dispatcher.convertChild(node, NodeKind.DENOMINATOR).strip();
        return LatexCleanup.clean(format(node, numerator, denominator));
    }

    private String format(MathNode node, String numerator, String denominator) {
        if (SMALL_NUMERATORS.contains(numerator) && SMALL_DENOMINATORS.contains(denominator)) {
            return LatexCommands.format("frac", numerator, denominator);
        }

        if (isSingleLetter(numerator) && isSingleLetter(denominator)
                && (("n".equals(numerator) && "k".equals(denominator)) || isInsideDelimiter(node))) {
            return LatexCommands.format("binom", numerator, denominator);
        }

        return LatexCommands.format("frac", numerator, denominator);
    }

    private static boolean isSingleLetter(String s) {
        return s.codePointCount(0, s.length()) == 1 && Character.isLetter(s.codePointAt(0));
    }

    /**
     * The fraction's immediate parent is a delimiter group. A fraction inside the
     * delimiter's {@code m:e} argument does not qualify.
     */
    static boolean isInsideDelimiter(MathNode node) {
        MathNode parent = node.getParent();
        return parent != null && parent.is(NodeKind.DELIMITER);
    }
}
