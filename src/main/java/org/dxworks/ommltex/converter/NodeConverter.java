package org.dxworks.ommltex.converter;

import org.dxworks.ommltex.model.MathNode;

/**
 * Converts one kind of OMML node into a LaTeX fragment.
 * Implementations are total: a missing child converts as the empty fragment.
 */
public interface NodeConverter {
    String convert(MathNode node);
}
