package com.apidocs.porter.xml;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import lombok.experimental.UtilityClass;

/**
 * Small DOM helpers for navigating and editing indented documents.
 */
@UtilityClass
public class XmlElements {

    private static final String INDENT_STEP = "  ";

    public static Optional<Element> child(Element parent, String name) {
        if (parent == null) {
            return Optional.empty();
        }
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n.getNodeType() == Node.ELEMENT_NODE && n.getNodeName().equals(name)) {
                return Optional.of((Element) n);
            }
        }
        return Optional.empty();
    }

    public static List<Element> children(Element parent, String name) {
        List<Element> result = new ArrayList<>();
        if (parent == null) {
            return result;
        }
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node n = nodes.item(i);
            if (n.getNodeType() == Node.ELEMENT_NODE && (name == null || n.getNodeName().equals(name))) {
                result.add((Element) n);
            }
        }
        return result;
    }

    /**
     * Text content of the first child element with the given name, trimmed, or
     * an empty string when absent.
     */
    public static String childText(Element parent, String name) {
        return child(parent, name).map(e -> e.getTextContent().trim()).orElse("");
    }

    /**
     * Text of the element at the end of a path of child element names.
     */
    public static String pathText(Element parent, String... path) {
        Element current = parent;
        for (String name : path) {
            Optional<Element> next = child(current, name);
            if (next.isEmpty()) {
                return "";
            }
            current = next.get();
        }
        return current.getTextContent().trim();
    }

    /**
     * Inner xml of an element with the document indentation removed: every
     * line is trimmed and leading and trailing empty lines are dropped.
     */
    public static String innerXml(Element element) {
        if (element == null) {
            return "";
        }
        String[] lines = XmlNodeWriter.writeChildren(element).split("\\r?\\n", -1);
        int first = 0;
        int last = lines.length - 1;
        while (first <= last && lines[first].isBlank()) {
            first++;
        }
        while (last >= first && lines[last].isBlank()) {
            last--;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = first; i <= last; i++) {
            if (i > first) {
                sb.append('\n');
            }
            sb.append(lines[i].strip());
        }
        return sb.toString();
    }

    public static String attribute(Element element, String name) {
        return element.hasAttribute(name) ? element.getAttribute(name) : "";
    }

    /**
     * Indentation of an element, read from the whitespace text node in front of it.
     */
    public static String indentationOf(Element element) {
        Node previous = element.getPreviousSibling();
        if (previous == null || previous.getNodeType() != Node.TEXT_NODE) {
            return "";
        }
        String text = previous.getNodeValue();
        int newline = text.lastIndexOf('\n');
        String tail = newline < 0 ? text : text.substring(newline + 1);
        return tail.isBlank() ? tail : "";
    }

    public static String childIndentationOf(Element element) {
        return indentationOf(element) + INDENT_STEP;
    }

    /**
     * Appends a child element on its own indented line, keeping the closing tag
     * of the parent on its own line.
     */
    public static void appendIndented(Element parent, Element child) {
        insertIndentedBefore(parent, child, null);
    }

    /**
     * Inserts a child element on its own indented line right before {@code reference},
     * or at the end when the reference is null.
     */
    public static void insertIndentedBefore(Element parent, Element child, Element reference) {
        String indent = childIndentationOf(parent);
        if (reference != null) {
            parent.insertBefore(child, reference);
            parent.insertBefore(parent.getOwnerDocument().createTextNode("\n" + indent), reference);
            return;
        }
        Node last = parent.getLastChild();
        if (last != null && last.getNodeType() == Node.TEXT_NODE && last.getNodeValue().isBlank()) {
            parent.insertBefore(parent.getOwnerDocument().createTextNode("\n" + indent), last);
            parent.insertBefore(child, last);
            return;
        }
        parent.appendChild(parent.getOwnerDocument().createTextNode("\n" + indent));
        parent.appendChild(child);
        parent.appendChild(parent.getOwnerDocument().createTextNode("\n" + indentationOf(parent)));
    }

    /**
     * Inserts a child element following a canonical element order: before the
     * first existing child ranked after it, otherwise at the end.
     */
    public static void insertInOrder(Element parent, Element child, List<String> order) {
        int rank = rank(order, child.getNodeName());
        for (Element existing : children(parent, null)) {
            if (rank(order, existing.getNodeName()) > rank) {
                insertIndentedBefore(parent, child, existing);
                return;
            }
        }
        appendIndented(parent, child);
    }

    private static int rank(List<String> order, String name) {
        int index = order.indexOf(name);
        return index < 0 ? order.size() : index;
    }
}
