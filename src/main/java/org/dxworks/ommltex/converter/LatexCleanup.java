package org.dxworks.ommltex.converter;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Local brace and spacing cleanup, applied to a fragment as soon as a structural converter
 * has assembled it.
 *
 * <p>Fragments that contain a compound construct ({@code \binom}, {@code \left},
 * {@code \right}, {@code \begin}) only get the spacing fixes; simple fragments also lose
 * redundant braces around single characters and doubled braces.</p>
 */
public final class LatexCleanup {

    private static final List<String> COMPOUND_COMMANDS = List.of("\\binom", "\\left", "\\right", "\\begin");

    private static final Pattern SPACE_BEFORE_SUBSCRIPT = Pattern.compile("\\s+_");
    private static final Pattern SPACE_BEFORE_SUPERSCRIPT = Pattern.compile("\\s+\\^");
    private static final Pattern PARTIAL_BEFORE_LETTER = Pattern.compile("(\\\\partial)([a-zA-Z])");
    private static final Pattern UNBRACED_FRACTION_NUMERATOR = Pattern.compile("\\\\frac([a-zA-Z0-9])\\{");
    private static final Pattern DOUBLED_BRACES = Pattern.compile("\\{\\{([^}]+)\\}\\}");

    private LatexCleanup() {}

    public static String clean(String latex) {
        if (latex == null || latex.isEmpty()) return "";

        if (hasCompoundCommand(latex)) {
            return spacingFixes(latex);
        }

        String result = braceFractionNumerator(latex);
        result = stripSingleCharacterBraces(result);
        result = DOUBLED_BRACES.matcher(result).replaceAll("{$1}");
        return spacingFixes(result);
    }

    public static boolean hasCompoundCommand(String latex) {
        for (String command : COMPOUND_COMMANDS) {
            if (latex.contains(command)) {
                return true;
            }
        }
        return false;
    }

    private static String spacingFixes(String latex) {
        String result = SPACE_BEFORE_SUBSCRIPT.matcher(latex).replaceAll("_");
        result = SPACE_BEFORE_SUPERSCRIPT.matcher(result).replaceAll("^");
        result = PARTIAL_BEFORE_LETTER.matcher(result).replaceAll("$1 $2");
        return braceFractionNumerator(result);
    }

    private static String braceFractionNumerator(String latex) {
        return UNBRACED_FRACTION_NUMERATOR.matcher(latex).replaceAll("\\\\frac{$1}{");
    }

    /**
     * Removes the braces of {@code {x}} groups holding one ASCII letter or digit, except where
     * the group is an argument of a command: right after {@code \name}, after a previous
     * argument group, or after an optional {@code [..]} argument.
     */
    static String stripSingleCharacterBraces(String latex) {
        StringBuilder out = new StringBuilder(latex.length());
        Deque<Boolean> groups = new ArrayDeque<>(); // true for command arguments
        boolean argumentPosition = false;
        int n = latex.length();
        int i = 0;

        while (i < n) {
            char c = latex.charAt(i);

            if (c == '\\') {
                int j = i + 1;
                while (j < n && isAsciiLetter(latex.charAt(j))) j++;
                boolean named = j > i + 1;
                if (!named && j < n) j++; // control symbol: \{ \, \\
                out.append(latex, i, j);
                argumentPosition = named;
                i = j;
                continue;
            }

            if (c == '{') {
                if (!argumentPosition && i + 2 < n
                        && isAsciiLetterOrDigit(latex.charAt(i + 1)) && latex.charAt(i + 2) == '}') {
                    out.append(latex.charAt(i + 1));
                    i += 3;
                    continue;
                }
                groups.push(argumentPosition);
                argumentPosition = false;
                out.append(c);
                i++;
                continue;
            }

            if (c == '}') {
                argumentPosition = !groups.isEmpty() && groups.pop();
                out.append(c);
                i++;
                continue;
            }

            if (c == '[' && argumentPosition) {
                int close = latex.indexOf(']', i);
                if (close > i) {
                    out.append(latex, i, close + 1);
                    i = close + 1;
                    continue;
                }
            }

            argumentPosition = false;
            out.append(c);
            i++;
        }
        return out.toString();
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isAsciiLetterOrDigit(char c) {
        return isAsciiLetter(c) || (c >= '0' && c <= '9');
    }
}
