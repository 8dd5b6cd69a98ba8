package com.apidocs.porter.xml;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import static org.assertj.core.api.Assertions.*;

/**
 * DOM editing helpers and the Docs flavored serializer.
 */
class XmlElementsTest {

    private static final List<String> ORDER = List.of("param", "summary", "returns", "remarks");

    @Test
    void testInsertInOrderKeepsIndentation() throws Exception {
        Document document = XmlFragments.parseDocument("""
                <Member>
                  <Docs>
                    <summary>Summary.</summary>
                    <remarks>Remarks.</remarks>
                  </Docs>
                </Member>""");
        Element docs = XmlElements.child(document.getDocumentElement(), "Docs").orElseThrow();

        Element returns = document.createElement("returns");
        returns.setTextContent("Returns.");
        XmlElements.insertInOrder(docs, returns, ORDER);
        Element seeAlso = document.createElement("seealso");
        seeAlso.setAttribute("cref", "T:System.Object");
        XmlElements.insertInOrder(docs, seeAlso, ORDER);

        assertThat(XmlNodeWriter.write(document)).isEqualTo("""
                <Member>
                  <Docs>
                    <summary>Summary.</summary>
                    <returns>Returns.</returns>
                    <remarks>Remarks.</remarks>
                    <seealso cref="T:System.Object" />
                  </Docs>
                </Member>""");
    }

    @Test
    void testAppendIntoEmptyElement() throws Exception {
        Document document = XmlFragments.parseDocument("""
                <Type>
                  <Docs />
                </Type>""");
        Element docs = XmlElements.child(document.getDocumentElement(), "Docs").orElseThrow();

        XmlElements.appendIndented(docs, document.createElement("inheritdoc"));

        assertThat(XmlNodeWriter.write(document)).isEqualTo("""
                <Type>
                  <Docs>
                    <inheritdoc />
                  </Docs>
                </Type>""");
    }

    @Test
    void testInnerXmlRemovesIndentation() throws Exception {
        Document document = XmlFragments.parseDocument("""
                <member>
                  <remarks>
                    First line with <c>code</c>.
                      Second line.
                  </remarks>
                </member>""");
        Element remarks = XmlElements.child(document.getDocumentElement(), "remarks").orElseThrow();

        assertThat(XmlElements.innerXml(remarks)).isEqualTo("First line with <c>code</c>.\nSecond line.");
        assertThat(XmlElements.indentationOf(remarks)).isEqualTo("  ");
        assertThat(XmlElements.childIndentationOf(remarks)).isEqualTo("    ");
        assertThat(XmlElements.innerXml(null)).isEmpty();
    }

    @Test
    void testNavigation() throws Exception {
        Document document = XmlFragments.parseDocument("""
                <Type Name="MyType">
                  <Base>
                    <BaseTypeName> System.Object </BaseTypeName>
                  </Base>
                  <Interfaces>
                    <Interface />
                    <Interface />
                  </Interfaces>
                </Type>""");
        Element root = document.getDocumentElement();

        assertThat(XmlElements.pathText(root, "Base", "BaseTypeName")).isEqualTo("System.Object");
        assertThat(XmlElements.pathText(root, "Base", "Missing")).isEmpty();
        assertThat(XmlElements.children(XmlElements.child(root, "Interfaces").orElseThrow(), "Interface")).hasSize(2);
        assertThat(XmlElements.children(root, null)).hasSize(2);
        assertThat(XmlElements.attribute(root, "Name")).isEqualTo("MyType");
        assertThat(XmlElements.attribute(root, "FullName")).isEmpty();
    }

    @Test
    void testWriterOrdersKnownAttributes() throws Exception {
        Document document = XmlFragments.parseDocument(
                "<Parameter Type=\"System.Int32\" Index=\"0\" Name=\"value\" Extra=\"x\" />");

        assertThat(XmlNodeWriter.write(document.getDocumentElement()))
                .isEqualTo("<Parameter Name=\"value\" Type=\"System.Int32\" Index=\"0\" Extra=\"x\" />");
        assertThat(XmlNodeWriter.escapeAttribute("a<\"b\">&")).isEqualTo("a&lt;&quot;b&quot;&gt;&amp;");
    }

    @Test
    void testReplaceChildrenWithFragment() throws Exception {
        Document document = XmlFragments.parseDocument("<summary>To be added.</summary>");
        Element summary = document.getDocumentElement();

        XmlFragments.replaceChildren(summary, "Gets the <see cref=\"T:System.String\" /> value.");
        assertThat(XmlNodeWriter.write(summary))
                .isEqualTo("<summary>Gets the <see cref=\"T:System.String\" /> value.</summary>");

        XmlFragments.replaceChildren(summary, "Unbalanced <b> tag & text");
        assertThat(XmlNodeWriter.write(summary))
                .isEqualTo("<summary>Unbalanced &lt;b&gt; tag &amp; text</summary>");
    }

    @Test
    void testWriterSplitsCDataTerminator() throws Exception {
        Document document = XmlFragments.parseDocument("<remarks><format type=\"text/markdown\" /></remarks>");
        Element format = XmlElements.child(document.getDocumentElement(), "format").orElseThrow();
        format.appendChild(document.createCDATASection("a]]>b"));

        String written = XmlNodeWriter.write(document.getDocumentElement());

        assertThat(written).isEqualTo(
                "<remarks><format type=\"text/markdown\"><![CDATA[a]]]]><![CDATA[>b]]></format></remarks>");
        assertThat(XmlFragments.parseDocument(written).getDocumentElement().getTextContent()).isEqualTo("a]]>b");
    }
}
