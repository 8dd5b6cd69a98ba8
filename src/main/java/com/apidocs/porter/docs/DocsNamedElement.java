package com.apidocs.porter.docs;

/**
 * A named {@code param} or {@code typeparam} entry of a {@code Docs} block.
 */
public interface DocsNamedElement {

    String getName();

    String getValue();

    void setValue(String structuredXml);

    DocsApi getParentApi();
}
