package org.dxworks.ommltex.model;

import java.util.HashMap;
import java.util.Map;

/**
 * Closed set of OMML element kinds the converter knows about.
 * Anything else maps to {@link #UNKNOWN} and is converted by concatenating its children.
 */
public enum NodeKind {
    MATH_PARAGRAPH("oMathPara"),
    MATH("oMath"),
    TEXT_RUN("r"),
    FRACTION("f"),
    NUMERATOR("num"),
    DENOMINATOR("den"),
    SUPERSCRIPT("sSup"),
    SUBSCRIPT("sSub"),
    SUB_SUPERSCRIPT("sSubSup"),
    PRE_SUB_SUPERSCRIPT("sPre"),
    NARY("nary"),
    RADICAL("rad"),
    DEGREE("deg"),
    DELIMITER("d"),
    MATRIX("m"),
    MATRIX_ROW("mr"),
    EQUATION_ARRAY("eqArr"),
    ACCENT("acc"),
    BAR("bar"),
    BOX("box"),
    BORDER_BOX("borderBox"),
    GROUP_CHARACTER("groupChr"),
    FUNCTION("func"),
    FUNCTION_NAME("fName"),
    LIMIT_LOWER("limLow"),
    LIMIT_UPPER("limUpp"),
    LIMIT("lim"),
    ARGUMENT("e"),
    SUB("sub"),
    SUP("sup"),
    UNKNOWN(null);

    private static final Map<String, NodeKind> BY_TAG = new HashMap<>();

    static {
        for (NodeKind kind : values()) {
            if (kind.tag != null) {
                BY_TAG.put(kind.tag, kind);
            }
        }
    }

    private final String tag;

    NodeKind(String tag) {
        this.tag = tag;
    }

    /** OMML local element name, {@code null} for {@link #UNKNOWN}. */
    public String getTag() {
        return tag;
    }

    public static NodeKind fromTag(String localName) {
        if (localName == null) return UNKNOWN;
        return BY_TAG.getOrDefault(localName, UNKNOWN);
    }
}
