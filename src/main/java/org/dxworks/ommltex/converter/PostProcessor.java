package org.dxworks.ommltex.converter;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Global normalization of a fully assembled equation.
 *
 * <p>The rules repair artifacts that only appear once fragments from different subtrees have
 * been concatenated, so they cannot run inside the individual converters. They are applied in
 * the listed order; the sequence is repeated until the text stops changing, which makes
 * {@link #normalize(String)} a fixed point of itself.</p>
 */
public final class PostProcessor {

    private static final int MAX_PASSES = 8;

    private static final List<Rule> RULES = List.of(
            new Rule("brace bare binomial arguments",
                    "\\\\binom([a-zA-Z])([a-zA-Z])", "\\\\binom{$1}{$2}"),
            new Rule("drop repeated exponential term",
                    "(e\\^\\{[^}]+\\}[a-z]+)(.*?)\\1", "$1$2"),
            new Rule("drop repeated parenthesized term",
                    "([a-zA-Z]+)\\\\left\\(([^)]+)\\\\right\\)\\1", "$1\\\\left($2\\\\right)"),
            new Rule("space after partial",
                    "\\\\partial([a-zA-Z])", "\\\\partial $1"),
            new Rule("space after upsilon",
                    "\\\\upsilon([a-zA-Z])", "\\\\upsilon $1"),
            new Rule("space after gamma",
                    "\\\\gamma([a-zA-Z])", "\\\\gamma $1"),
            new Rule("space after arrow before a word",
                    "\\\\rightarrow([A-Z][a-z])", "\\\\rightarrow $1"),
            new Rule("dot operator before a letter",
                    "⋅(?=[A-Za-z])", "\\\\cdot "),
            new Rule("dot operator",
                    "⋅", "\\\\cdot"),
            new Rule("drop repeated limit",
                    "(\\\\lim[^}]*\\})\\s*\\\\lim\\s", "$1 "),
            new Rule("space after quantifier",
                    "(\\\\exists|\\\\forall)([a-zA-Z])", "$1 $2"),
            new Rule("unwrap parenthesized binomial",
                    "\\\\left\\(\\\\binom\\{([^}]+)\\}\\{([^}]+)\\}\\\\right\\)", "\\\\binom{$1}{$2}"),
            new Rule("space after cdot",
                    "\\\\cdot(?!s)([A-Za-z])", "\\\\cdot $1"),
            new Rule("space between relation and digit",
                    "(\\\\approx|\\\\equiv|\\\\sim)(\\d)", "$1 $2")
    );

    private PostProcessor() {}

    public static String normalize(String latex) {
        if (latex == null || latex.isEmpty()) return "";

        String current = latex;
        for (int pass = 0; pass < MAX_PASSES; pass++) {
            String next = applyOnce(current);
            if (next.equals(current)) {
                return current;
            }
            current = next;
        }
        return current;
    }

    static String applyOnce(String latex) {
        String result = latex;
        for (Rule rule : RULES) {
            result = rule.apply(result);
        }
        return result;
    }

    private record Rule(String name, Pattern pattern, String replacement) {

        Rule(String name, String regex, String replacement) {
            this(name, Pattern.compile(regex), replacement);
        }

        String apply(String latex) {
            return pattern.matcher(latex).replaceAll(replacement);
        }
    }
}
