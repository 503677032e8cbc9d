package org.dxworks.ommltex.reader;

import org.dxworks.ommltex.model.MathNode;
import org.dxworks.ommltex.model.NodeKind;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * Builds a {@link MathNode} tree from a namespace-aware DOM element.
 *
 * <p>Property elements ({@code m:fPr}, {@code m:dPr}, {@code m:naryPr}, ...) are folded into
 * attributes of the node that owns them, keyed by the property's local name. A run
 * ({@code m:r}) becomes a leaf holding the text of its {@code m:t} descendants.</p>
 */
public class OmmlReader {

    public static final String MATH_NAMESPACE = "http://schemas.openxmlformats.org/officeDocument/2006/math";

    private static final String PROPERTIES_SUFFIX = "Pr";
    private static final String RUN_PROPERTIES = "rPr";
    private static final String TEXT = "t";
    private static final String VALUE = "val";

    public MathNode read(Element element) {
        String localName = localName(element);
        NodeKind kind = isMath(element) ? NodeKind.fromTag(localName) : NodeKind.UNKNOWN;
        MathNode.Builder builder = MathNode.builder(kind).tag(localName);

        if (kind == NodeKind.TEXT_RUN) {
            readRun(element, builder);
            return builder.build();
        }

        for (Node child = element.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (!(child instanceof Element childElement)) {
                continue;
            }
            if (isPropertyElement(childElement)) {
                readProperties(childElement, builder);
            } else {
                builder.child(read(childElement));
            }
        }
        return builder.build();
    }

    private void readRun(Element run, MathNode.Builder builder) {
        StringBuilder text = new StringBuilder();
        NodeList texts = run.getElementsByTagNameNS(MATH_NAMESPACE, TEXT);
        for (int i = 0; i < texts.getLength(); i++) {
            text.append(texts.item(i).getTextContent());
        }
        builder.text(text.toString());

        for (Node child = run.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child instanceof Element childElement && isMath(childElement)
                    && RUN_PROPERTIES.equals(localName(childElement))) {
                readProperties(childElement, builder);
            }
        }
    }

    private void readProperties(Element properties, MathNode.Builder builder) {
        for (Node child = properties.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child instanceof Element property && property.hasAttributeNS(MATH_NAMESPACE, VALUE)) {
                builder.attribute(localName(property), property.getAttributeNS(MATH_NAMESPACE, VALUE));
            }
        }
    }

    private static boolean isPropertyElement(Element element) {
        return isMath(element) && localName(element).endsWith(PROPERTIES_SUFFIX);
    }

    private static boolean isMath(Element element) {
        return MATH_NAMESPACE.equals(element.getNamespaceURI());
    }

    private static String localName(Element element) {
        String localName = element.getLocalName();
        return localName != null ? localName : element.getTagName();
    }
}
