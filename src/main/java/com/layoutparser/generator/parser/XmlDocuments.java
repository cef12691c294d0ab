package com.layoutparser.generator.parser;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import com.layoutparser.generator.exception.StructureException;

/**
 * DOM helpers shared by the XML readers. Element lookups match on local name so
 * namespaced and plain documents read the same way.
 */
public final class XmlDocuments {

    public static final String XSI_NAMESPACE = "http://www.w3.org/2001/XMLSchema-instance";

    private XmlDocuments() {
        // Utility class
    }

    public static Document parse(String xml) {
        if (xml == null || xml.isBlank()) {
            throw new StructureException("XML content is empty");
        }
        String content = xml.charAt(0) == '\uFEFF' ? xml.substring(1) : xml;
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(new InputSource(new StringReader(content.trim())));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new StructureException("Malformed XML: " + e.getMessage(), e);
        }
    }

    public static List<Element> children(Element parent, String localName) {
        List<Element> result = new ArrayList<>();
        if (parent == null) {
            return result;
        }
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node instanceof Element element && localName.equals(localNameOf(element))) {
                result.add(element);
            }
        }
        return result;
    }

    public static Optional<Element> child(Element parent, String localName) {
        return children(parent, localName).stream().findFirst();
    }

    public static String text(Element parent, String localName) {
        return child(parent, localName).map(Node::getTextContent).map(String::trim).orElse(null);
    }

    public static String text(Element parent, String localName, String fallback) {
        String value = text(parent, localName);
        return value == null || value.isEmpty() ? fallback : value;
    }

    public static int intValue(Element parent, String localName, int fallback) {
        String value = text(parent, localName);
        if (value == null || value.isEmpty()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new StructureException("Element <" + localName + "> is not a number: " + value, e);
        }
    }

    public static boolean boolValue(Element parent, String localName, boolean fallback) {
        String value = text(parent, localName);
        if (value == null || value.isEmpty()) {
            return fallback;
        }
        return Boolean.parseBoolean(value);
    }

    /**
     * The {@code xsi:type} of an element, or an empty string.
     */
    public static String xsiType(Element element) {
        String type = element.getAttributeNS(XSI_NAMESPACE, "type");
        return type == null ? "" : type;
    }

    public static String localNameOf(Element element) {
        return element.getLocalName() != null ? element.getLocalName() : element.getNodeName();
    }
}
