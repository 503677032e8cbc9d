package org.dxworks.ommltex.converter;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class PostProcessorTest {

    @Test
    void bareBinomialArguments_AreBraced() {
        assertEquals("\\binom{n}{k}", PostProcessor.normalize("\\binomnk"));
    }

    @Test
    void parenthesizedBinomial_IsUnwrapped() {
        assertEquals("\\binom{n}{k}", PostProcessor.normalize("\\left(\\binom{n}{k}\\right)"));
    }

    @Test
    void commandsGluedToLetters_AreSpaced() {
        assertEquals("\\partial x", PostProcessor.normalize("\\partialx"));
        assertEquals("\\upsilon t", PostProcessor.normalize("\\upsilont"));
        assertEquals("\\gamma x", PostProcessor.normalize("\\gammax"));
        assertEquals("\\exists x", PostProcessor.normalize("\\existsx"));
        assertEquals("\\forall y", PostProcessor.normalize("\\forally"));
        assertEquals("\\cdot x", PostProcessor.normalize("\\cdotx"));
    }

    @Test
    void cdots_IsNotSplit() {
        assertEquals("1+\\cdots+n", PostProcessor.normalize("1+\\cdots+n"));
    }

    @Test
    void arrowBeforeWord_IsSpaced() {
        assertEquals("P\\rightarrow Then", PostProcessor.normalize("P\\rightarrowThen"));
    }

    @Test
    void dotOperator_BecomesCdot() {
        assertEquals("a\\cdot b", PostProcessor.normalize("a⋅b"));
        assertEquals("2\\cdot(x)", PostProcessor.normalize("2⋅(x)"));
    }

    @Test
    void relationBeforeDigit_IsSpaced() {
        assertEquals("\\pi\\approx 3", PostProcessor.normalize("\\pi\\approx3"));
    }

    @Test
    void repeatedLimit_IsDropped() {
        assertEquals("\\lim_{x\\to 0} f", PostProcessor.normalize("\\lim_{x\\to 0} \\lim f"));
    }

    @Test
    void repeatedParenthesizedTerm_IsDropped() {
        assertEquals("f\\left(x\\right)", PostProcessor.normalize("f\\left(x\\right)f"));
    }

    @Test
    void repeatedExponentialTerm_IsDropped() {
        assertEquals("e^{x}dx+1", PostProcessor.normalize("e^{x}dx+1e^{x}dx"));
    }

    @Test
    void emptyInput_IsEmpty() {
        assertEquals("", PostProcessor.normalize(""));
        assertEquals("", PostProcessor.normalize(null));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "\\binomnk",
            "\\partialx+\\gammay",
            "a⋅b⋅c",
            "\\existsx\\forally",
            "\\left(\\binom{n}{k}\\right)",
            "x=\\frac{-b\\pm \\sqrt{b^2-4ac}}{2a}",
            "\\lim_{n\\rightarrow \\infty} \\lim \\frac{1}{n}"
    })
    void normalize_IsIdempotent(String latex) {
        String once = PostProcessor.normalize(latex);
        assertEquals(once, PostProcessor.normalize(once));
    }
}
