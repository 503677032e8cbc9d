package org.dxworks.ommltex.symbols;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Known function names (sin, log, lim, ...) and their LaTeX operator macros.
 */
public final class FunctionNames {

    private static final String[] NAMES = {
            "sin", "cos", "tan", "sec", "csc", "cot",
            "arcsin", "arccos", "arctan",
            "sinh", "cosh", "tanh",
            "log", "ln", "exp",
            "lim", "sup", "inf", "min", "max",
            "det", "dim"
    };

    private static final Map<String, Pattern> PATTERNS;

    static {
        Map<String, Pattern> patterns = new LinkedHashMap<>();
        for (String name : NAMES) {
            if (patterns.containsKey(name)) {
                throw new IllegalStateException("Duplicate function name: " + name);
            }
            // whole word, not already a command, followed by whitespace, '(' or the end
            patterns.put(name, Pattern.compile("(?<![\\\\\\w])" + name + "(?=\\s|\\(|$)"));
        }
        PATTERNS = Collections.unmodifiableMap(patterns);
    }

    private FunctionNames() {}

    public static Set<String> names() {
        return PATTERNS.keySet();
    }

    public static boolean isFunctionName(String name) {
        return PATTERNS.containsKey(name);
    }

    /** {@code \sin } for {@code sin}; the macro always carries its own trailing space. */
    public static String toLatex(String name) {
        return "\\" + name + " ";
    }

    /**
     * Replaces bare function names with their macros. Text that already starts with a
     * backslash is returned untouched.
     */
    public static String convert(String text) {
        if (text == null || text.isEmpty() || text.startsWith("\\")) {
            return text;
        }
        String result = text;
        for (Map.Entry<String, Pattern> entry : PATTERNS.entrySet()) {
            result = replace(result, entry.getKey(), entry.getValue());
        }
        return result;
    }

    private static String replace(String text, String name, Pattern pattern) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length() + 8);
        do {
            int next = matcher.end();
            boolean spaceFollows = next < text.length() && Character.isWhitespace(text.charAt(next));
            String macro = spaceFollows ? "\\" + name : toLatex(name);
            matcher.appendReplacement(sb, Matcher.quoteReplacement(macro));
        } while (matcher.find());
        matcher.appendTail(sb);
        return sb.toString();
    }
}
