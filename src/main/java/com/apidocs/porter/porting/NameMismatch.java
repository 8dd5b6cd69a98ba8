package com.apidocs.porter.porting;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A Docs param or type param whose name is not among the IntelliSense names
 * of the same API, while both sides list the same number of entries.
 */
@Value
@Builder
public class NameMismatch {

    public enum Kind {
        PARAM("param"),
        TYPE_PARAM("typeparam");

        private final String elementName;

        Kind(String elementName) {
            this.elementName = elementName;
        }

        public String getElementName() {
            return elementName;
        }
    }

    Kind kind;

    /** DocId of the API being documented. */
    String docId;

    Path filePath;

    /** Name found in the Docs file. */
    String docsName;

    /** Names found in the IntelliSense member, in declaration order. */
    @Singular
    List<String> candidates;
}
