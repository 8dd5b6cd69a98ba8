package com.apidocs.porter.xml;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import lombok.experimental.UtilityClass;

/**
 * Parsing of whole documents and of inner xml fragments.
 */
@UtilityClass
public class XmlFragments {

    private static final Logger log = LoggerFactory.getLogger(XmlFragments.class);

    private static final String WRAPPER = "fragment";

    /**
     * Parses a complete document keeping every whitespace text node and CDATA section.
     */
    public static Document parseDocument(String xml) throws SAXException {
        try {
            DocumentBuilder builder = newBuilder();
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (IOException e) {
            // reading from a String cannot fail
            throw new IllegalStateException(e);
        }
    }

    /**
     * Parses an inner xml fragment and imports its nodes into the owner document.
     * Text that is not well formed xml is kept as a single text node.
     */
    public static List<Node> parseInto(Document owner, String innerXml) {
        List<Node> nodes = new ArrayList<>();
        if (innerXml == null || innerXml.isEmpty()) {
            return nodes;
        }
        if (innerXml.indexOf('<') < 0 && innerXml.indexOf('&') < 0) {
            nodes.add(owner.createTextNode(innerXml));
            return nodes;
        }
        try {
            Document fragment = parseDocument("<" + WRAPPER + ">" + innerXml + "</" + WRAPPER + ">");
            NodeList children = fragment.getDocumentElement().getChildNodes();
            for (int i = 0; i < children.getLength(); i++) {
                nodes.add(owner.importNode(children.item(i), true));
            }
        } catch (SAXException e) {
            log.debug("Fragment is not well formed xml, keeping it as text: {}", innerXml);
            nodes.clear();
            nodes.add(owner.createTextNode(innerXml));
        }
        return nodes;
    }

    /**
     * Replaces every child of the element with the parsed fragment.
     */
    public static void replaceChildren(Element element, String innerXml) {
        while (element.getFirstChild() != null) {
            element.removeChild(element.getFirstChild());
        }
        for (Node node : parseInto(element.getOwnerDocument(), innerXml)) {
            element.appendChild(node);
        }
    }

    private static DocumentBuilder newBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(false);
            factory.setCoalescing(false);
            factory.setIgnoringComments(false);
            factory.setExpandEntityReferences(true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            DocumentBuilder builder = factory.newDocumentBuilder();
            // the default handler prints fatal errors to stderr before throwing
            builder.setErrorHandler(new DefaultHandler());
            return builder;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not available", e);
        }
    }
}
