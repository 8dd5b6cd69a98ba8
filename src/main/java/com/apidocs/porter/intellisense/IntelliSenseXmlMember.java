package com.apidocs.porter.intellisense;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Documentation of one API element as exported by the compiler.
 *
 * Immutable once parsed. Text fields hold inner xml with the surrounding
 * indentation removed and are never null.
 */
@Value
@Builder
public class IntelliSenseXmlMember {

    /** DocId, e.g. {@code M:System.String.Trim}. */
    @NonNull
    String name;

    @NonNull
    String assembly;

    Path filePath;

    @Builder.Default
    String summary = "";

    @Builder.Default
    String remarks = "";

    @Builder.Default
    String returns = "";

    @Builder.Default
    String value = "";

    @Singular
    List<IntelliSenseXmlParam> params;

    @Singular
    List<IntelliSenseXmlParam> typeParams;

    @Singular
    List<IntelliSenseXmlException> exceptions;

    /** Whether an {@code inheritdoc} element is present. */
    boolean inheritDoc;

    /** Target of the {@code inheritdoc} element, empty when bare. */
    @Builder.Default
    String inheritDocCref = "";

    public Optional<IntelliSenseXmlParam> findParam(String paramName) {
        return params.stream().filter(p -> p.getName().equals(paramName)).findFirst();
    }

    public Optional<IntelliSenseXmlParam> findTypeParam(String typeParamName) {
        return typeParams.stream().filter(p -> p.getName().equals(typeParamName)).findFirst();
    }

    public boolean hasInheritDocCref() {
        return inheritDoc && !inheritDocCref.isEmpty();
    }
}
