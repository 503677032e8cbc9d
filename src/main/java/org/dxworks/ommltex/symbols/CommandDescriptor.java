package org.dxworks.ommltex.symbols;

/**
 * Shape of a parameterized LaTeX command.
 *
 * @param name           command name without the backslash
 * @param parameterCount number of brace-delimited arguments
 * @param trailingSpace  whether a space is appended after the last argument
 */
public record CommandDescriptor(String name, int parameterCount, boolean trailingSpace) {

    public CommandDescriptor {
        if (parameterCount < 0) {
            throw new IllegalArgumentException("Negative parameter count for \\" + name);
        }
    }
}
