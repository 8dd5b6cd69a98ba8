package com.apidocs.porter.intellisense;

import lombok.NonNull;
import lombok.Value;

/**
 * A {@code param} or {@code typeparam} entry of an IntelliSense member.
 */
@Value
public class IntelliSenseXmlParam {
    @NonNull
    String name;

    /** Inner xml, indentation removed. */
    @NonNull
    String text;
}
