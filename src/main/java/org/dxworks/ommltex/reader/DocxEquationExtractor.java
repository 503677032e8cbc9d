package org.dxworks.ommltex.reader;

import org.dxworks.ommltex.InputFormat;
import org.dxworks.ommltex.converter.MathNodes;
import org.dxworks.ommltex.model.MathNode;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Collects every {@code m:oMath} equation of a Word document, in document order.
 * Accepts a .docx archive (reads {@code word/document.xml}) or a plain XML file.
 */
public class DocxEquationExtractor {

    public static final String DOCUMENT_ENTRY = "word/document.xml";
    private static final String EQUATION = "oMath";

    private final OmmlReader reader = new OmmlReader();

    public List<EquationSource> extract(Path file, InputFormat format) throws IOException {
        return switch (format) {
            case DOCX -> extractFromDocx(file);
            case XML -> {
                try (InputStream in = Files.newInputStream(file)) {
                    yield extractFromXml(in);
                }
            }
        };
    }

    public List<EquationSource> extractFromDocx(Path docx) throws IOException {
        try (ZipFile zip = new ZipFile(docx.toFile())) {
            ZipEntry entry = zip.getEntry(DOCUMENT_ENTRY);
            if (entry == null) {
                throw new IOException("Not a Word document, missing " + DOCUMENT_ENTRY + ": " + docx);
            }
            try (InputStream in = zip.getInputStream(entry)) {
                return extractFromXml(in);
            }
        }
    }

    public List<EquationSource> extractFromXml(InputStream in) throws IOException {
        Document document = parse(in);
        NodeList equations = document.getElementsByTagNameNS(OmmlReader.MATH_NAMESPACE, EQUATION);

        List<EquationSource> result = new ArrayList<>(equations.getLength());
        for (int i = 0; i < equations.getLength(); i++) {
            MathNode root = reader.read((Element) equations.item(i));
            result.add(new EquationSource(i + 1, root, MathNodes.plainText(root)));
        }
        return result;
    }

    private static Document parse(InputStream in) throws IOException {
        try {
            return newDocumentBuilder().parse(in);
        } catch (SAXException e) {
            throw new IOException("Malformed XML: " + e.getMessage(), e);
        }
    }

    // DocumentBuilder is not thread-safe, one per parse
    private static DocumentBuilder newDocumentBuilder() throws IOException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setValidating(false);
        factory.setCoalescing(true);
        factory.setIgnoringComments(true);
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setExpandEntityReferences(false);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IOException("Failed to configure XML parser", e);
        }
    }
}
