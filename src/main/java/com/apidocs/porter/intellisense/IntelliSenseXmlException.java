package com.apidocs.porter.intellisense;

import lombok.NonNull;
import lombok.Value;

@Value
public class IntelliSenseXmlException {
    @NonNull
    String cref;

    @NonNull
    String text;
}
