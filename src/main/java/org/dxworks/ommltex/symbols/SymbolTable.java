package org.dxworks.ommltex.symbols;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-only mapping from Unicode math symbols to LaTeX commands.
 * Built once at class initialization; duplicate source keys fail fast.
 */
public final class SymbolTable {

    private static final List<SymbolEntry> ENTRIES = List.of(
            // relations
            spaced("≠", "\\neq"),
            spaced("≤", "\\leq"),
            spaced("≥", "\\geq"),
            spaced("≈", "\\approx"),
            spaced("≡", "\\equiv"),
            spaced("∼", "\\sim"),

            // sets
            spaced("∈", "\\in"),
            spaced("∉", "\\notin"),
            spaced("⊂", "\\subset"),
            spaced("⊆", "\\subseteq"),
            spaced("∪", "\\cup"),
            spaced("∩", "\\cap"),
            spaced("∅", "\\emptyset"),

            // logic
            spaced("∧", "\\land"),
            spaced("∨", "\\lor"),
            spaced("¬", "\\neg"),
            spaced("∀", "\\forall"),
            spaced("∃", "\\exists"),

            // arrows
            spaced("→", "\\rightarrow"),
            spaced("←", "\\leftarrow"),
            spaced("↔", "\\leftrightarrow"),
            spaced("⇒", "\\Rightarrow"),
            spaced("⟹", "\\implies"),
            spaced("⟸", "\\impliedby"),

            // greek
            spaced("α", "\\alpha"),
            spaced("β", "\\beta"),
            spaced("γ", "\\gamma"),
            spaced("δ", "\\delta"),
            spaced("ε", "\\epsilon"),
            spaced("θ", "\\theta"),
            spaced("λ", "\\lambda"),
            spaced("μ", "\\mu"),
            spaced("π", "\\pi"),
            spaced("σ", "\\sigma"),
            spaced("τ", "\\tau"),
            spaced("φ", "\\phi"),
            spaced("ψ", "\\psi"),
            spaced("ω", "\\omega"),
            spaced("υ", "\\upsilon"),
            spaced("Γ", "\\Gamma"),
            spaced("Δ", "\\Delta"),
            spaced("Σ", "\\Sigma"),
            spaced("Ω", "\\Omega"),
            spaced("ϒ", "\\Upsilon"),

            // miscellaneous
            spaced("∂", "\\partial"),
            spaced("∇", "\\nabla"),
            spaced("∞", "\\infty"),
            spaced("∠", "\\angle"),
            spaced("⊥", "\\perp"),
            spaced("∥", "\\parallel"),
            spaced("…", "\\ldots"),
            spaced("∴", "\\therefore"),
            spaced("∵", "\\because"),

            // binary operators
            spaced("±", "\\pm"),
            spaced("∓", "\\mp"),
            spaced("×", "\\times"),
            spaced("÷", "\\div"),
            spaced("·", "\\cdot"),

            // big operators
            spaced("∑", "\\sum"),
            spaced("∏", "\\prod"),
            spaced("∫", "\\int"),
            spaced("∬", "\\iint"),
            spaced("∭", "\\iiint"),
            spaced("∮", "\\oint"),
            spaced("∐", "\\coprod"),
            spaced("⋃", "\\bigcup"),
            spaced("⋂", "\\bigcap"),

            // followed by a brace, a superscript or carrying their own spacing
            bare("√", "\\sqrt"),
            bare("°", "^\\circ"),
            bare("ⅆ", "\\, d"),

            // blackboard bold number sets
            spaced("ℝ", "\\mathbb{R}"),
            spaced("ℂ", "\\mathbb{C}"),
            spaced("ℕ", "\\mathbb{N}"),
            spaced("ℤ", "\\mathbb{Z}"),
            spaced("ℚ", "\\mathbb{Q}"),
            spaced("ℍ", "\\mathbb{H}"),
            spaced("ℙ", "\\mathbb{P}"),
            spaced("𝔽", "\\mathbb{F}"),
            spaced("𝕂", "\\mathbb{K}"),
            spaced("𝔸", "\\mathbb{A}"),
            spaced("𝔹", "\\mathbb{B}"),
            spaced("𝕊", "\\mathbb{S}"),
            spaced("𝕋", "\\mathbb{T}"),
            spaced("𝕌", "\\mathbb{U}"),
            spaced("𝕍", "\\mathbb{V}"),
            spaced("𝕎", "\\mathbb{W}"),
            spaced("𝕏", "\\mathbb{X}"),
            spaced("𝕐", "\\mathbb{Y}")
    );

    private static final Map<String, SymbolEntry> BY_SOURCE = ENTRIES.stream()
            .collect(Collectors.toUnmodifiableMap(SymbolEntry::source, Function.identity()));

    private static final int LONGEST_SOURCE = ENTRIES.stream()
            .mapToInt(e -> e.source().length())
            .max()
            .orElse(1);

    private static final Set<String> COMMAND_NAMES = ENTRIES.stream()
            .map(SymbolEntry::command)
            .filter(c -> c.startsWith("\\") && c.length() > 1 && Character.isLetter(c.charAt(1)))
            .map(c -> c.substring(1).split("[^a-zA-Z]", 2)[0])
            .collect(Collectors.toUnmodifiableSet());

    private SymbolTable() {}

    public static Optional<SymbolEntry> lookup(String source) {
        return Optional.ofNullable(BY_SOURCE.get(source));
    }

    public static List<SymbolEntry> entries() {
        return ENTRIES;
    }

    /** Names (without backslash) of every command the table can emit. */
    public static Set<String> commandNames() {
        return COMMAND_NAMES;
    }

    /**
     * Replaces every known symbol, scanning left to right with a longest-prefix match.
     * Unknown characters are copied through unchanged.
     */
    public static String convert(String text) {
        if (text == null || text.isEmpty()) return "";

        StringBuilder result = new StringBuilder(text.length() + 16);
        int i = 0;
        while (i < text.length()) {
            SymbolEntry match = null;
            int maxLength = Math.min(LONGEST_SOURCE, text.length() - i);
            for (int length = maxLength; length > 0 && match == null; length--) {
                match = BY_SOURCE.get(text.substring(i, i + length));
            }
            if (match != null) {
                result.append(match.toLatex());
                i += match.source().length();
            } else {
                result.append(text.charAt(i));
                i++;
            }
        }
        return result.toString();
    }

    private static SymbolEntry spaced(String source, String command) {
        return new SymbolEntry(source, command, true);
    }

    private static SymbolEntry bare(String source, String command) {
        return new SymbolEntry(source, command, false);
    }

    static Set<String> sources() {
        return BY_SOURCE.keySet();
    }
}
