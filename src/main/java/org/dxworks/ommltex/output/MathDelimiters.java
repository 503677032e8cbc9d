package org.dxworks.ommltex.output;

/**
 * Chooses between inline {@code \( \)} and display {@code \[ \]} math by length.
 */
public final class MathDelimiters {

    private MathDelimiters() {}

    public static boolean isInline(String latex, int inlineMaxLength) {
        return latex.length() < inlineMaxLength;
    }

    public static String wrap(String latex, int inlineMaxLength) {
        String trimmed = latex == null ? "" : latex.strip();
        if (isInline(trimmed, inlineMaxLength)) {
            return "\\(" + trimmed + "\\)";
        }
        return "\\[" + trimmed + "\\]";
    }

    /** Stand-in for an equation that converted to nothing, so it can be found and fixed by hand. */
    public static String emptyPlaceholder(int index) {
        return "[EQUATION_" + index + "_EMPTY]";
    }
}
