package com.apidocs.porter.io;

import java.nio.charset.Charset;
import java.nio.file.Path;

import org.w3c.dom.Document;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A parsed xml file together with what is needed to write it back unchanged:
 * charset, byte order mark, xml declaration, line separator and trailing newline.
 */
@Value
@Builder
public class LoadedXmlDocument {

    @NonNull
    Path path;

    @NonNull
    Document document;

    @NonNull
    Charset charset;

    boolean byteOrderMark;

    /** Raw xml declaration, or null when the file has none. */
    String xmlDeclaration;

    @Builder.Default
    String lineSeparator = "\n";

    boolean trailingNewline;
}
