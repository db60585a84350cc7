package org.dxworks.ouxml.reader;

import org.dxworks.ouxml.model.ContentNode;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses OU-XML into a {@link ContentNode} tree.
 * Comments and processing instructions are dropped; the text around them is joined.
 * Tags are local names, the element namespace is kept on the node.
 */
public final class OuXmlReader {

    private static final String LOAD_EXTERNAL_DTD = "http://apache.org/xml/features/nonvalidating/load-external-dtd";

    private OuXmlReader() {}

    public static ContentNode read(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return parse(new InputSource(in), path.toString());
        }
    }

    public static ContentNode read(InputStream in) throws IOException {
        return parse(new InputSource(in), "stream");
    }

    public static ContentNode read(String xml) {
        try {
            return parse(new InputSource(new StringReader(xml)), "string");
        } catch (IOException e) {
            throw new OuXmlReadException("Failed to read XML string", e);
        }
    }

    private static ContentNode parse(InputSource source, String origin) throws IOException {
        Document document;
        try {
            document = newDocumentBuilder().parse(source);
        } catch (SAXException e) {
            throw new OuXmlReadException("Malformed OU-XML in " + origin + ": " + e.getMessage(), e);
        }
        return toContentNode(document.getDocumentElement(), null);
    }

    private static DocumentBuilder newDocumentBuilder() {
        DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
        dbf.setNamespaceAware(true);
        dbf.setValidating(false);
        dbf.setCoalescing(true);
        dbf.setIgnoringComments(true);
        try {
            dbf.setFeature(LOAD_EXTERNAL_DTD, false);
            return dbf.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support the required configuration", e);
        }
    }

    private static ContentNode toContentNode(Element element, String tail) {
        StringBuilder pending = new StringBuilder();
        String leadingText = null;
        Element pendingElement = null;
        List<ContentNode> children = new ArrayList<>();

        NodeList nodes = element.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            switch (node.getNodeType()) {
                case Node.TEXT_NODE, Node.CDATA_SECTION_NODE -> pending.append(node.getNodeValue());
                case Node.ELEMENT_NODE -> {
                    if (pendingElement == null) {
                        leadingText = emptyToNull(pending);
                    } else {
                        children.add(toContentNode(pendingElement, emptyToNull(pending)));
                    }
                    pending.setLength(0);
                    pendingElement = (Element) node;
                }
                default -> {
                    // comments and processing instructions carry no content
                }
            }
        }
        if (pendingElement == null) {
            leadingText = emptyToNull(pending);
        } else {
            children.add(toContentNode(pendingElement, emptyToNull(pending)));
        }

        return new ContentNode(element.getNamespaceURI(), tagOf(element), leadingText, tail,
                attributesOf(element), children);
    }

    private static String tagOf(Element element) {
        String localName = element.getLocalName();
        return localName != null ? localName : element.getNodeName();
    }

    private static Map<String, String> attributesOf(Element element) {
        Map<String, String> attributes = new LinkedHashMap<>();
        NamedNodeMap map = element.getAttributes();
        for (int i = 0; i < map.getLength(); i++) {
            Attr attr = (Attr) map.item(i);
            String name = attr.getName();
            if (name.equals("xmlns") || name.startsWith("xmlns:")) {
                continue;
            }
            attributes.put(name, attr.getValue());
        }
        return attributes;
    }

    private static String emptyToNull(StringBuilder sb) {
        return sb.length() == 0 ? null : sb.toString();
    }
}
