package com.apidocs.porter.io;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.xml.sax.SAXException;

import com.apidocs.porter.xml.XmlFragments;

import lombok.NoArgsConstructor;

/**
 * Reads xml files, detecting the byte order mark and the declared encoding so
 * the file can be written back the way it was found.
 */
@NoArgsConstructor
public class XmlDocumentLoader {

    private static final Logger log = LoggerFactory.getLogger(XmlDocumentLoader.class);

    private static final Pattern DECLARATION = Pattern.compile("^<\\?xml[^?]*\\?>");
    private static final Pattern DECLARED_ENCODING = Pattern.compile("encoding\\s*=\\s*[\"']([^\"']+)[\"']");

    public LoadedXmlDocument load(Path path) throws IOException, SAXException {
        byte[] bytes = Files.readAllBytes(path);

        Charset charset = StandardCharsets.UTF_8;
        int bomLength = 0;
        if (bytes.length >= 3 && (bytes[0] & 0xFF) == 0xEF && (bytes[1] & 0xFF) == 0xBB && (bytes[2] & 0xFF) == 0xBF) {
            bomLength = 3;
        } else if (bytes.length >= 2 && (bytes[0] & 0xFF) == 0xFF && (bytes[1] & 0xFF) == 0xFE) {
            charset = StandardCharsets.UTF_16LE;
            bomLength = 2;
        } else if (bytes.length >= 2 && (bytes[0] & 0xFF) == 0xFE && (bytes[1] & 0xFF) == 0xFF) {
            charset = StandardCharsets.UTF_16BE;
            bomLength = 2;
        }

        String text = new String(bytes, bomLength, bytes.length - bomLength, charset);
        if (bomLength == 0) {
            Charset declared = declaredCharset(text);
            if (declared != null && !declared.equals(charset)) {
                charset = declared;
                text = new String(bytes, charset);
            }
        }
        log.trace("Read {} as {} (BOM: {})", path, charset, bomLength > 0);
        return parse(text, path, charset, bomLength > 0);
    }

    /**
     * Parses in-memory xml as if it had been read from a UTF-8 file without BOM.
     */
    public LoadedXmlDocument fromString(String xml, Path path) throws SAXException {
        return parse(xml, path, StandardCharsets.UTF_8, false);
    }

    private LoadedXmlDocument parse(String text, Path path, Charset charset, boolean bom) throws SAXException {
        String declaration = null;
        Matcher m = DECLARATION.matcher(text);
        if (m.find()) {
            declaration = m.group();
        }
        Document document = XmlFragments.parseDocument(text);
        return LoadedXmlDocument.builder()
                .path(path)
                .document(document)
                .charset(charset)
                .byteOrderMark(bom)
                .xmlDeclaration(declaration)
                .lineSeparator(text.contains("\r\n") ? "\r\n" : "\n")
                .trailingNewline(text.endsWith("\n"))
                .build();
    }

    private static Charset declaredCharset(String text) {
        Matcher declaration = DECLARATION.matcher(text);
        if (!declaration.find()) {
            return null;
        }
        Matcher encoding = DECLARED_ENCODING.matcher(declaration.group());
        if (!encoding.find()) {
            return null;
        }
        try {
            return Charset.forName(encoding.group(1));
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            log.warn("Unknown declared encoding '{}', reading as UTF-8", encoding.group(1));
            return null;
        }
    }
}
