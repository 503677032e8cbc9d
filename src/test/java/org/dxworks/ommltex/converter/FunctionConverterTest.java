package org.dxworks.ommltex.converter;

import org.dxworks.ommltex.model.MathNode;
import org.dxworks.ommltex.model.NodeKind;
import org.junit.jupiter.api.Test;

import static org.dxworks.ommltex.TestUtils.wrap;
import static org.junit.jupiter.api.Assertions.*;

public class FunctionConverterTest {

    private final OmmlToLatexConverter converter = new OmmlToLatexConverter();

    @Test
    void namedFunction_WrapsArgumentInParentheses() {
        MathNode function = MathNode.of(NodeKind.FUNCTION,
                wrap(NodeKind.FUNCTION_NAME, "sin"),
                wrap(NodeKind.ARGUMENT, "x"));

        assertEquals("\\sin(x)", converter.convert(function));
    }

    @Test
    void functionWithoutArgument_IsJustTheName() {
        MathNode function = MathNode.of(NodeKind.FUNCTION, wrap(NodeKind.FUNCTION_NAME, "det"));
        assertEquals("\\det", converter.convert(function));
    }

    @Test
    void unknownName_IsKeptVerbatim() {
        MathNode function = MathNode.of(NodeKind.FUNCTION,
                wrap(NodeKind.FUNCTION_NAME, "f"),
                wrap(NodeKind.ARGUMENT, "t"));

        assertEquals("f(t)", converter.convert(function));
    }

    @Test
    void limitName_IsFollowedByArgument() {
        MathNode function = MathNode.of(NodeKind.FUNCTION,
                MathNode.of(NodeKind.FUNCTION_NAME, lowerLimit("lim", "n→∞")),
                wrap(NodeKind.ARGUMENT, "f(n)"));

        assertEquals("\\lim_{n\\rightarrow \\infty} f(n)", converter.convert(function));
    }

    @Test
    void limitName_DropsArgumentThatRepeatsTheLimit() {
        MathNode function = MathNode.of(NodeKind.FUNCTION,
                MathNode.of(NodeKind.FUNCTION_NAME, lowerLimit("lim", "x→0")),
                MathNode.of(NodeKind.ARGUMENT, lowerLimit("lim", "x→0")));

        assertEquals("\\lim_{x\\rightarrow 0}", converter.convert(function));
    }

    @Test
    void lowerLimit_OnKnownFunctionName() {
        assertEquals("\\max_{i}", converter.convert(lowerLimit("max", "i")));
    }

    @Test
    void upperLimit_UsesSuperscript() {
        MathNode upper = MathNode.of(NodeKind.LIMIT_UPPER,
                wrap(NodeKind.ARGUMENT, "x"),
                wrap(NodeKind.LIMIT, "y"));

        assertEquals("x^{y}", converter.convert(upper));
    }

    private static MathNode lowerLimit(String base, String limit) {
        return MathNode.of(NodeKind.LIMIT_LOWER,
                wrap(NodeKind.ARGUMENT, base),
                wrap(NodeKind.LIMIT, limit));
    }
}
