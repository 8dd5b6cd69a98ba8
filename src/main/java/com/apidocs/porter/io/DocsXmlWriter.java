package com.apidocs.porter.io;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.apidocs.porter.xml.XmlNodeWriter;

import lombok.NoArgsConstructor;

/**
 * Writes Docs xml documents back to disk with their original charset, byte
 * order mark, declaration and line separators.
 */
@NoArgsConstructor
public class DocsXmlWriter {

    private static final Logger log = LoggerFactory.getLogger(DocsXmlWriter.class);

    public void write(LoadedXmlDocument loaded) throws IOException {
        Files.write(loaded.getPath(), toBytes(loaded));
        log.debug("Saved {}", loaded.getPath());
    }

    /**
     * Document text as it would be written, without the byte order mark.
     */
    public String serialize(LoadedXmlDocument loaded) {
        StringBuilder sb = new StringBuilder();
        if (loaded.getXmlDeclaration() != null) {
            sb.append(loaded.getXmlDeclaration()).append('\n');
        }
        sb.append(XmlNodeWriter.write(loaded.getDocument()));
        if (loaded.isTrailingNewline()) {
            sb.append('\n');
        }
        String text = sb.toString();
        return "\n".equals(loaded.getLineSeparator()) ? text : text.replace("\n", loaded.getLineSeparator());
    }

    byte[] toBytes(LoadedXmlDocument loaded) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        if (loaded.isByteOrderMark()) {
            out.write(byteOrderMark(loaded));
        }
        out.write(serialize(loaded).getBytes(loaded.getCharset()));
        return out.toByteArray();
    }

    private static byte[] byteOrderMark(LoadedXmlDocument loaded) {
        if (StandardCharsets.UTF_16LE.equals(loaded.getCharset())) {
            return new byte[] { (byte) 0xFF, (byte) 0xFE };
        }
        if (StandardCharsets.UTF_16BE.equals(loaded.getCharset())) {
            return new byte[] { (byte) 0xFE, (byte) 0xFF };
        }
        return new byte[] { (byte) 0xEF, (byte) 0xBB, (byte) 0xBF };
    }
}
