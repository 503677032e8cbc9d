package org.dxworks.ommltex.output;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MathDelimitersTest {

    @Test
    void shortEquation_IsInline() {
        assertTrue(MathDelimiters.isInline("x^2", 30));
        assertEquals("\\(x^2\\)", MathDelimiters.wrap(" x^2 ", 30));
    }

    @Test
    void equationAtThreshold_IsDisplayed() {
        String latex = "a".repeat(30);

        assertFalse(MathDelimiters.isInline(latex, 30));
        assertEquals("\\[" + latex + "\\]", MathDelimiters.wrap(latex, 30));
        assertTrue(MathDelimiters.isInline(latex, 31));
    }

    @Test
    void missingLatex_IsEmptyInline() {
        assertEquals("\\(\\)", MathDelimiters.wrap(null, 30));
    }

    @Test
    void placeholder_NamesTheEquation() {
        assertEquals("[EQUATION_7_EMPTY]", MathDelimiters.emptyPlaceholder(7));
    }
}
