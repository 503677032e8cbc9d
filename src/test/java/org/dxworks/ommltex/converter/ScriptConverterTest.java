package org.dxworks.ommltex.converter;

import org.dxworks.ommltex.model.MathNode;
import org.dxworks.ommltex.model.NodeKind;
import org.junit.jupiter.api.Test;

import static org.dxworks.ommltex.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

public class ScriptConverterTest {

    private final OmmlToLatexConverter converter = new OmmlToLatexConverter();

    @Test
    void superscript() {
        MathNode node = MathNode.of(NodeKind.SUPERSCRIPT, wrap(NodeKind.ARGUMENT, "x"), wrap(NodeKind.SUP, "2"));
        assertEquals("x^{2}", converter.convert(node));
    }

    @Test
    void subscript() {
        MathNode node = MathNode.of(NodeKind.SUBSCRIPT, wrap(NodeKind.ARGUMENT, "a"), wrap(NodeKind.SUB, "i"));
        assertEquals("a_{i}", converter.convert(node));
    }

    @Test
    void subSuperscript() {
        MathNode node = MathNode.of(NodeKind.SUB_SUPERSCRIPT,
                wrap(NodeKind.ARGUMENT, "x"), wrap(NodeKind.SUB, "i"), wrap(NodeKind.SUP, "2"));
        assertEquals("x_{i}^{2}", converter.convert(node));
    }

    @Test
    void preSubSuperscript() {
        MathNode node = MathNode.of(NodeKind.PRE_SUB_SUPERSCRIPT,
                wrap(NodeKind.SUB, "1"), wrap(NodeKind.SUP, "n"), wrap(NodeKind.ARGUMENT, "F"));
        assertEquals("{}_{1}^{n}F", converter.convert(node));
    }

    @Test
    void greekBase_KeepsCommandSpacingOutOfScript() {
        MathNode node = MathNode.of(NodeKind.SUBSCRIPT, wrap(NodeKind.ARGUMENT, "α"), wrap(NodeKind.SUB, "0"));
        assertEquals("\\alpha_{0}", converter.convert(node));
    }

    @Test
    void missingScript_IsEmptyBraces() {
        MathNode node = MathNode.of(NodeKind.SUPERSCRIPT, wrap(NodeKind.ARGUMENT, "x"));
        assertEquals("x^{}", converter.convert(node));
    }

    @Test
    void delimitedBase_IsNotCleaned() {
        MathNode base = argument(MathNode.of(NodeKind.DELIMITER, argument(run("a+b"))));
        MathNode node = MathNode.of(NodeKind.SUPERSCRIPT, base, wrap(NodeKind.SUP, "2"));
        assertEquals("\\left(a+b\\right)^{2}", converter.convert(node));
    }

    @Test
    void duplicatedIntegrals_AreTruncated() {
        String base = "\\left[\\int a\\int b\\int c\\right]";
        assertEquals("\\left[\\int a\\int b\\right]", ScriptConverter.dropDuplicatedIntegrals(base));
    }

    @Test
    void twoIntegrals_AreKept() {
        String base = "\\left[\\int a\\int b\\right]";
        assertEquals(base, ScriptConverter.dropDuplicatedIntegrals(base));
    }

    @Test
    void unbracketedIntegrals_AreKept() {
        String base = "\\int a\\int b\\int c";
        assertEquals(base, ScriptConverter.dropDuplicatedIntegrals(base));
    }
}
