package com.apidocs.porter.porting;

import java.nio.file.Path;

import lombok.Value;

/**
 * One documentation element written during a run.
 */
@Value
public class ModifiedElement {
    /** Element description, e.g. {@code summary} or {@code param 'value'}. */
    String element;
    Path filePath;
    String docId;
    boolean eii;
}
