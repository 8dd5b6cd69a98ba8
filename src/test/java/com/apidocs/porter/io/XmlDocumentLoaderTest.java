package com.apidocs.porter.io;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.*;

/**
 * Loading and writing back Docs files byte for byte.
 */
class XmlDocumentLoaderTest {

    private static final String TYPE_XML = """
            <?xml version="1.0" encoding="utf-8"?>
            <Type Name="MyType" FullName="MyNamespace.MyType">
              <TypeSignature Language="DocId" Value="T:MyNamespace.MyType" />
              <Docs>
                <summary>Summary with <see cref="T:System.String" /> and &lt;angle&gt; brackets.</summary>
                <remarks>
                  <format type="text/markdown"><![CDATA[

            ## Remarks

            Some `code` & text.

                  ]]></format>
                </remarks>
              </Docs>
            </Type>
            """;

    @TempDir
    Path tempDir;

    private final XmlDocumentLoader loader = new XmlDocumentLoader();
    private final DocsXmlWriter writer = new DocsXmlWriter();

    @Test
    void testRoundTripUtf8WithBomAndCrLf() throws Exception {
        Path file = tempDir.resolve("MyType.xml");
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        bytes.write(new byte[] { (byte) 0xEF, (byte) 0xBB, (byte) 0xBF });
        bytes.write(TYPE_XML.replace("\n", "\r\n").getBytes(StandardCharsets.UTF_8));
        Files.write(file, bytes.toByteArray());

        LoadedXmlDocument loaded = loader.load(file);

        assertThat(loaded.getCharset()).isEqualTo(StandardCharsets.UTF_8);
        assertThat(loaded.isByteOrderMark()).isTrue();
        assertThat(loaded.getLineSeparator()).isEqualTo("\r\n");
        assertThat(loaded.getXmlDeclaration()).isEqualTo("<?xml version=\"1.0\" encoding=\"utf-8\"?>");
        assertThat(loaded.isTrailingNewline()).isTrue();

        writer.write(loaded);

        assertThat(Files.readAllBytes(file)).isEqualTo(bytes.toByteArray());
    }

    @Test
    void testRoundTripUtf16LittleEndian() throws Exception {
        Path file = tempDir.resolve("MyType.xml");
        String xml = TYPE_XML.replace("utf-8", "utf-16");
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        bytes.write(new byte[] { (byte) 0xFF, (byte) 0xFE });
        bytes.write(xml.getBytes(StandardCharsets.UTF_16LE));
        Files.write(file, bytes.toByteArray());

        LoadedXmlDocument loaded = loader.load(file);
        writer.write(loaded);

        assertThat(loaded.getCharset()).isEqualTo(StandardCharsets.UTF_16LE);
        assertThat(Files.readAllBytes(file)).isEqualTo(bytes.toByteArray());
    }

    @Test
    void testDeclaredEncodingWithoutBom() throws Exception {
        Path file = tempDir.resolve("MyType.xml");
        String xml = """
                <?xml version="1.0" encoding="ISO-8859-1"?>
                <Type Name="MyType" FullName="MyNamespace.MyType">
                  <Docs>
                    <summary>Café.</summary>
                  </Docs>
                </Type>""";
        byte[] original = xml.getBytes(StandardCharsets.ISO_8859_1);
        Files.write(file, original);

        LoadedXmlDocument loaded = loader.load(file);
        writer.write(loaded);

        assertThat(loaded.getCharset()).isEqualTo(StandardCharsets.ISO_8859_1);
        assertThat(loaded.isByteOrderMark()).isFalse();
        assertThat(loaded.isTrailingNewline()).isFalse();
        assertThat(loaded.getDocument().getDocumentElement().getTextContent()).contains("Café.");
        assertThat(Files.readAllBytes(file)).isEqualTo(original);
    }

    @Test
    void testSerializeWithoutDeclaration() throws Exception {
        String xml = TYPE_XML.substring(TYPE_XML.indexOf('\n') + 1);

        LoadedXmlDocument loaded = loader.fromString(xml, Path.of("MyType.xml"));

        assertThat(loaded.getXmlDeclaration()).isNull();
        assertThat(writer.serialize(loaded)).isEqualTo(xml);
    }

    @Test
    void testMalformedXmlIsRejected() throws Exception {
        Path file = tempDir.resolve("Broken.xml");
        Files.writeString(file, "<Type><Docs></Type>");

        assertThatThrownBy(() -> loader.load(file)).isInstanceOf(org.xml.sax.SAXException.class);
    }
}
