package org.dxworks.ommltex.symbols;

/**
 * Maps a source Unicode symbol to a LaTeX command.
 *
 * @param source        the symbol as it appears in a text run
 * @param command       LaTeX text without any trailing space
 * @param trailingSpace whether the command must be followed by a space so that a following letter
 *                      is not read as part of the command name
 */
public record SymbolEntry(String source, String command, boolean trailingSpace) {

    public String toLatex() {
        return trailingSpace ? command + " " : command;
    }
}
