package org.dxworks.ommltex.converter;

import org.dxworks.ommltex.model.MathNode;
import org.dxworks.ommltex.symbols.FunctionNames;
import org.dxworks.ommltex.symbols.LatexCommands;
import org.dxworks.ommltex.symbols.SymbolTable;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts the literal text of an {@code m:r} run.
 *
 * <p>The rewrite steps in {@link #convertText(String)} run in a fixed order; each one relies on
 * the output shape of the previous ones.</p>
 */
public class TextRunConverter implements NodeConverter {

    private static final String DOUBLE_STRUCK = "double-struck";

    private static final Map<String, String> BLACKBOARD_LETTERS = Map.of(
            "R", "\\mathbb{R} ",
            "C", "\\mathbb{C} ",
            "N", "\\mathbb{N} ",
            "Z", "\\mathbb{Z} ",
            "Q", "\\mathbb{Q} ",
            "H", "\\mathbb{H} ",
            "F", "\\mathbb{F} ",
            "P", "\\mathbb{P} "
    );

    private static final Pattern COMMAND_WORD = Pattern.compile("\\\\([a-zA-Z]+)");

    // real commands that must never be split even though a shorter known name is a prefix
    private static final Set<String> UNSPLITTABLE = Set.of(
            "cdots", "ldots", "vdots", "ddots", "dots",
            "iint", "iiint", "oint",
            "varepsilon", "vartheta", "varphi", "varsigma",
            "inf", "sinh", "cosh", "tanh", "arcsin", "arccos", "arctan"
    );

    private static final Set<String> KNOWN_COMMANDS;

    static {
        Set<String> known = new HashSet<>(SymbolTable.commandNames());
        known.addAll(FunctionNames.names());
        known.addAll(UNSPLITTABLE);
        KNOWN_COMMANDS = Set.copyOf(known);
    }

    private static final Pattern DOUBLE_DIFFERENTIAL_SYMBOL = Pattern.compile("([a-z])ⅆ([a-z])ⅆ");
    private static final Pattern DIFFERENTIAL_SYMBOL = Pattern.compile("([a-z])ⅆ");
    private static final Pattern DOUBLE_DIFFERENTIAL_LETTER = Pattern.compile("([a-z])d([a-z])d\\b");
    private static final Pattern GREEK_DIFFERENTIAL_LETTER = Pattern.compile("([a-z])d([αβγδεζηθικλμνξοπρστυφχψω])");

    private static final Pattern RELATION_BEFORE_LETTER = Pattern.compile(
            "(\\\\neq|\\\\in|\\\\rightarrow|\\\\leftarrow|\\\\implies|\\\\leq|\\\\geq)(?![a-z])([a-zA-Z])");

    private static final Pattern NAMED_COMMAND_BEFORE_LETTER = Pattern.compile(
            "(\\\\(?:neq|eq|leq|geq|in|notin|subset|subseteq|rightarrow|leftarrow|implies|Rightarrow"
                    + "|forall|exists|pm|mp|times|div|cdot|approx|equiv|sim"
                    + "|alpha|beta|gamma|delta|epsilon|theta|lambda|mu|pi|sigma|tau|phi|psi|omega"
                    + "|Gamma|Delta|Sigma|Omega))(?![a-z])([a-zA-Z])");

    private static final Pattern GREEK_BEFORE_LOWERCASE = Pattern.compile(
            "(\\\\gamma|\\\\alpha|\\\\beta|\\\\delta|\\\\theta|\\\\sigma)([a-z])");

    @Override
    public String convert(MathNode run) {
        if (run == null) return "";
        String text = run.getText();

        if (DOUBLE_STRUCK.equals(run.getAttribute(MathNode.ATTR_SCRIPT))) {
            return blackboardBold(text);
        }
        return convertText(text);
    }

    public String convertText(String text) {
        if (text == null || text.isEmpty()) return "";

        String result = text.replace('−', '-');
        result = separateRunTogetherCommands(result);

        result = DOUBLE_DIFFERENTIAL_SYMBOL.matcher(result).replaceAll("$1 \\\\, d$2 \\\\, d");
        result = DIFFERENTIAL_SYMBOL.matcher(result).replaceAll("$1 \\\\, d");
        result = DOUBLE_DIFFERENTIAL_LETTER.matcher(result).replaceAll("$1 \\\\, d$2 \\\\, d");
        result = GREEK_DIFFERENTIAL_LETTER.matcher(result).replaceAll("$1 \\\\, d$2");

        result = SymbolTable.convert(result);

        result = RELATION_BEFORE_LETTER.matcher(result).replaceAll("$1 $2");
        result = NAMED_COMMAND_BEFORE_LETTER.matcher(result).replaceAll("$1 $2");
        result = GREEK_BEFORE_LOWERCASE.matcher(result).replaceAll("$1 $2");

        return FunctionNames.convert(result);
    }

    String blackboardBold(String text) {
        String letter = BLACKBOARD_LETTERS.get(text);
        if (letter != null) {
            return letter;
        }
        return LatexCommands.format("mathbb", text);
    }

    /**
     * Inserts the missing space in commands typed directly into a run: {@code \neqx} becomes
     * {@code \neq x} and {@code \alpha2} becomes {@code \alpha 2}. Only a single trailing
     * character is split off a known command name.
     */
    static String separateRunTogetherCommands(String text) {
        if (text.indexOf('\\') < 0) return text;

        Matcher matcher = COMMAND_WORD.matcher(text);
        StringBuilder sb = new StringBuilder(text.length() + 8);
        while (matcher.find()) {
            String letters = matcher.group(1);
            int next = matcher.end();
            String replacement = matcher.group();
            if (KNOWN_COMMANDS.contains(letters)) {
                if (next < text.length() && Character.isDigit(text.charAt(next))) {
                    replacement = "\\" + letters + " ";
                }
            } else {
                String head = letters.substring(0, letters.length() - 1);
                if (KNOWN_COMMANDS.contains(head)) {
                    replacement = "\\" + head + " " + letters.charAt(letters.length() - 1);
                }
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
