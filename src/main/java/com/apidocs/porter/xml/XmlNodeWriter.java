package com.apidocs.porter.xml;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import org.w3c.dom.Attr;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import lombok.experimental.UtilityClass;

/**
 * Serializes DOM nodes the way Docs xml files are written.
 *
 * Whitespace text nodes are kept untouched, CDATA sections are kept, empty
 * elements are written self-closing with one space before {@code />}, and
 * attributes of the known Docs and IntelliSense elements are written in schema
 * order. The DOM does not keep source attribute order, so unknown attributes
 * follow the known ones alphabetically.
 */
@UtilityClass
public class XmlNodeWriter {

    private static final Map<String, List<String>> ATTRIBUTE_ORDER = Map.ofEntries(
            Map.entry("Type", List.of("Name", "FullName")),
            Map.entry("TypeSignature", List.of("Language", "Value", "Maintainer")),
            Map.entry("MemberSignature", List.of("Language", "Value", "Usage")),
            Map.entry("Member", List.of("MemberName")),
            Map.entry("Parameter", List.of("Name", "Type", "RefType", "Index", "FrameworkAlternate")),
            Map.entry("TypeParameter", List.of("Name", "Index", "FrameworkAlternate")),
            Map.entry("Attribute", List.of("FrameworkAlternate")),
            Map.entry("AttributeName", List.of("Language")),
            Map.entry("format", List.of("type")),
            Map.entry("see", List.of("cref", "langword", "href")),
            Map.entry("seealso", List.of("cref", "href")),
            Map.entry("exception", List.of("cref")),
            Map.entry("inheritdoc", List.of("cref")),
            Map.entry("param", List.of("name")),
            Map.entry("typeparam", List.of("name")));

    /**
     * Writes a node and its subtree.
     */
    public static String write(Node node) {
        StringBuilder sb = new StringBuilder();
        append(sb, node);
        return sb.toString();
    }

    /**
     * Writes only the children of a node, i.e. its inner xml.
     */
    public static String writeChildren(Node node) {
        StringBuilder sb = new StringBuilder();
        NodeList children = node.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            append(sb, children.item(i));
        }
        return sb.toString();
    }

    public static String escapeText(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    public static String escapeAttribute(String value) {
        return escapeText(value).replace("\"", "&quot;");
    }

    private static void append(StringBuilder sb, Node node) {
        switch (node.getNodeType()) {
            case Node.DOCUMENT_NODE -> {
                NodeList children = node.getChildNodes();
                for (int i = 0; i < children.getLength(); i++) {
                    append(sb, children.item(i));
                    // top level nodes carry no whitespace in the DOM
                    if (i < children.getLength() - 1) {
                        sb.append('\n');
                    }
                }
            }
            case Node.ELEMENT_NODE -> appendElement(sb, node);
            case Node.TEXT_NODE -> sb.append(escapeText(node.getNodeValue()));
            case Node.CDATA_SECTION_NODE -> appendCData(sb, node.getNodeValue());
            case Node.COMMENT_NODE -> sb.append("<!--").append(node.getNodeValue()).append("-->");
            case Node.PROCESSING_INSTRUCTION_NODE ->
                    sb.append("<?").append(node.getNodeName()).append(' ').append(node.getNodeValue()).append("?>");
            case Node.ENTITY_REFERENCE_NODE -> sb.append('&').append(node.getNodeName()).append(';');
            default -> {
                // document type and notation nodes are not part of either dialect
            }
        }
    }

    /**
     * A CDATA section cannot contain its own terminator, so every {@code ]]>}
     * inside the value splits it into two adjacent sections.
     */
    private static void appendCData(StringBuilder sb, String value) {
        sb.append("<![CDATA[").append(value.replace("]]>", "]]]]><![CDATA[>")).append("]]>");
    }

    private static void appendElement(StringBuilder sb, Node element) {
        String name = element.getNodeName();
        sb.append('<').append(name);
        for (Attr attr : orderedAttributes(element)) {
            sb.append(' ').append(attr.getName()).append("=\"").append(escapeAttribute(attr.getValue())).append('"');
        }
        NodeList children = element.getChildNodes();
        if (children.getLength() == 0) {
            sb.append(" />");
            return;
        }
        sb.append('>');
        for (int i = 0; i < children.getLength(); i++) {
            append(sb, children.item(i));
        }
        sb.append("</").append(name).append('>');
    }

    private static List<Attr> orderedAttributes(Node element) {
        NamedNodeMap map = element.getAttributes();
        List<Attr> attrs = new ArrayList<>(map.getLength());
        for (int i = 0; i < map.getLength(); i++) {
            attrs.add((Attr) map.item(i));
        }
        List<String> order = ATTRIBUTE_ORDER.getOrDefault(element.getNodeName(), List.of());
        attrs.sort(Comparator.comparingInt((Attr a) -> rank(order, a.getName())).thenComparing(Attr::getName));
        return attrs;
    }

    private static int rank(List<String> order, String name) {
        int index = order.indexOf(name);
        return index < 0 ? order.size() : index;
    }
}
