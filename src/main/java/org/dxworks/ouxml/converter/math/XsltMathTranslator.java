package org.dxworks.ouxml.converter.math;

import org.dxworks.ouxml.model.ContentNode;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.Templates;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerConfigurationException;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import javax.xml.transform.stream.StreamSource;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringWriter;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * {@link MathTranslator} backed by an XSLT stylesheet producing text output, such as XSLTML's
 * {@code mmltex.xsl}. A small stylesheet covering common presentation MathML ships with the tool.
 * The MathML subtree is handed over with its original namespaces, so stylesheets may match
 * either on namespaced names or on local names.
 */
public class XsltMathTranslator implements MathTranslator {

    public static final String BUNDLED_STYLESHEET = "mathml-to-tex.xsl";

    private final Templates templates;

    public XsltMathTranslator(Templates templates) {
        this.templates = templates;
    }

    public static XsltMathTranslator bundled() {
        URL url = XsltMathTranslator.class.getResource(BUNDLED_STYLESHEET);
        if (url == null) {
            throw new IllegalStateException("Bundled stylesheet not found: " + BUNDLED_STYLESHEET);
        }
        try (InputStream in = url.openStream()) {
            return new XsltMathTranslator(compile(new StreamSource(in, url.toExternalForm())));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read bundled stylesheet", e);
        }
    }

    public static XsltMathTranslator fromStylesheet(Path stylesheet) {
        if (!Files.isRegularFile(stylesheet)) {
            throw new IllegalStateException("Math stylesheet does not exist: " + stylesheet);
        }
        return new XsltMathTranslator(compile(new StreamSource(stylesheet.toFile())));
    }

    private static Templates compile(StreamSource source) {
        try {
            return TransformerFactory.newInstance().newTemplates(source);
        } catch (TransformerConfigurationException e) {
            throw new IllegalStateException("Invalid math stylesheet " + source.getSystemId() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<String> translate(ContentNode mathml) {
        try {
            Transformer transformer = templates.newTransformer();
            StringWriter out = new StringWriter();
            transformer.transform(new DOMSource(toDocument(mathml)), new StreamResult(out));
            String result = out.toString().trim();
            return result.isEmpty() ? Optional.empty() : Optional.of(result);
        } catch (TransformerException e) {
            System.err.println("Warning: Failed to translate equation: " + e.getMessage());
            return Optional.empty();
        }
    }

    private static Document toDocument(ContentNode root) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            Document document = factory.newDocumentBuilder().newDocument();
            document.appendChild(toElement(document, root));
            return document;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML document builder unavailable", e);
        }
    }

    private static Element toElement(Document document, ContentNode node) {
        Element element = document.createElementNS(node.getNamespaceUri(), node.getTag());
        for (Map.Entry<String, String> attribute : node.getAttributes().entrySet()) {
            String name = attribute.getKey();
            if (name.indexOf(':') < 0) {
                element.setAttributeNS(null, name, attribute.getValue());
            } else {
                // prefixed attributes such as xml:lang carry no meaning for the stylesheet
                element.setAttribute(name, attribute.getValue());
            }
        }
        if (node.getText() != null) {
            element.appendChild(document.createTextNode(node.getText()));
        }
        for (ContentNode child : node.getChildren()) {
            element.appendChild(toElement(document, child));
            if (child.getTail() != null) {
                element.appendChild(document.createTextNode(child.getTail()));
            }
        }
        return element;
    }
}
