package org.dxworks.ommltex.converter;

import org.dxworks.ommltex.model.MathNode;
import org.dxworks.ommltex.model.NodeKind;
import org.junit.jupiter.api.Test;

import static org.dxworks.ommltex.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

public class NaryConverterTest {

    private final OmmlToLatexConverter converter = new OmmlToLatexConverter();

    @Test
    void defaultOperator_IsIntegral() {
        MathNode nary = MathNode.of(NodeKind.NARY,
                wrap(NodeKind.SUB, "0"), wrap(NodeKind.SUP, "1"), wrap(NodeKind.ARGUMENT, "f(x)"));

        assertEquals("\\int_{0}^{1} f(x)", converter.convert(nary));
    }

    @Test
    void sumWithLimits() {
        MathNode nary = MathNode.builder(NodeKind.NARY)
                .attribute(MathNode.ATTR_CHR, "∑")
                .child(wrap(NodeKind.SUB, "i=1"))
                .child(wrap(NodeKind.SUP, "n"))
                .child(wrap(NodeKind.ARGUMENT, "i"))
                .build();

        assertEquals("\\sum_{i=1}^{n} i", converter.convert(nary));
    }

    @Test
    void missingLimits_AreOmitted() {
        MathNode nary = MathNode.builder(NodeKind.NARY)
                .attribute(MathNode.ATTR_CHR, "∏")
                .child(wrap(NodeKind.ARGUMENT, "a"))
                .build();

        assertEquals("\\prod a", converter.convert(nary));
    }

    @Test
    void emptyLimits_AreOmitted() {
        MathNode nary = MathNode.of(NodeKind.NARY,
                MathNode.of(NodeKind.SUB), MathNode.of(NodeKind.SUP), wrap(NodeKind.ARGUMENT, "g"));

        assertEquals("\\int g", converter.convert(nary));
    }

    @Test
    void missingOperand_IsOmitted() {
        MathNode nary = MathNode.of(NodeKind.NARY, wrap(NodeKind.SUB, "D"));
        assertEquals("\\int_{D}", converter.convert(nary));
    }

    @Test
    void unknownOperator_PassesThrough() {
        MathNode nary = MathNode.builder(NodeKind.NARY)
                .attribute(MathNode.ATTR_CHR, "⨁")
                .child(wrap(NodeKind.ARGUMENT, "V"))
                .build();

        assertEquals("⨁ V", converter.convert(nary));
    }
}
