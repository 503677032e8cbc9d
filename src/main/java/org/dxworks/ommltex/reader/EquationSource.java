package org.dxworks.ommltex.reader;

import org.dxworks.ommltex.model.MathNode;

/**
 * One {@code m:oMath} found in a document, with the raw text of its runs.
 */
public record EquationSource(int index, MathNode root, String text) {
}
