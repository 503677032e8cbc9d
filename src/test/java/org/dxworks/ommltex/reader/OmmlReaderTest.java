package org.dxworks.ommltex.reader;

import org.dxworks.ommltex.model.MathNode;
import org.dxworks.ommltex.model.NodeKind;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class OmmlReaderTest {

    private static final String M = "xmlns:m=\"" + OmmlReader.MATH_NAMESPACE + "\"";
    private static final String W = "xmlns:w=\"http://schemas.openxmlformats.org/wordprocessingml/2006/main\"";

    private final OmmlReader reader = new OmmlReader();

    @Test
    void propertiesBecomeAttributesOfTheirOwner() throws Exception {
        MathNode root = read("<m:oMath " + M + ">"
                + "<m:d><m:dPr><m:begChr m:val=\"[\"/><m:endChr m:val=\"\"/></m:dPr>"
                + "<m:e><m:r><m:t>x</m:t></m:r></m:e></m:d>"
                + "</m:oMath>");

        assertEquals(NodeKind.MATH, root.getKind());
        MathNode delimiter = root.getChildren().get(0);
        assertEquals(NodeKind.DELIMITER, delimiter.getKind());
        assertEquals("[", delimiter.getAttribute(MathNode.ATTR_BEGIN_CHR));
        assertEquals("", delimiter.getAttribute(MathNode.ATTR_END_CHR));
        assertTrue(delimiter.hasAttribute(MathNode.ATTR_END_CHR));
        assertEquals(2, delimiter.getAttributes().size());
        assertEquals(1, delimiter.getChildren().size());
        assertSame(delimiter, delimiter.getChildren().get(0).getParent());
    }

    @Test
    void runTextConcatenatesAllTextElements() throws Exception {
        MathNode root = read("<m:oMath " + M + " " + W + ">"
                + "<m:r><w:rPr><w:i/></w:rPr><m:t>ab</m:t><m:t xml:space=\"preserve\"> c</m:t></m:r>"
                + "</m:oMath>");

        MathNode run = root.getChildren().get(0);
        assertEquals(NodeKind.TEXT_RUN, run.getKind());
        assertEquals("ab c", run.getText());
        assertTrue(run.getChildren().isEmpty());
    }

    @Test
    void runScriptPropertyIsKept() throws Exception {
        MathNode root = read("<m:oMath " + M + ">"
                + "<m:r><m:rPr><m:scr m:val=\"double-struck\"/></m:rPr><m:t>R</m:t></m:r>"
                + "</m:oMath>");

        assertEquals("double-struck", root.getChildren().get(0).getAttribute(MathNode.ATTR_SCRIPT));
    }

    @Test
    void unknownAndForeignElementsAreKeptAsUnknown() throws Exception {
        MathNode root = read("<m:oMath " + M + " " + W + ">"
                + "<w:bookmarkStart/><m:phant><m:e><m:r><m:t>y</m:t></m:r></m:e></m:phant>"
                + "</m:oMath>");

        assertEquals(NodeKind.UNKNOWN, root.getChildren().get(0).getKind());
        assertEquals("bookmarkStart", root.getChildren().get(0).getTag());
        assertEquals(NodeKind.UNKNOWN, root.getChildren().get(1).getKind());
        assertEquals("phant", root.getChildren().get(1).getTag());
    }

    private MathNode read(String xml) throws Exception {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        Document document = factory.newDocumentBuilder()
                .parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
        return reader.read(document.getDocumentElement());
    }
}
