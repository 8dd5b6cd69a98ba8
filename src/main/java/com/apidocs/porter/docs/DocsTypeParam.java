package com.apidocs.porter.docs;

import org.w3c.dom.Element;

import com.apidocs.porter.xml.XmlElements;

/**
 * A {@code typeparam} element inside a {@code Docs} block. Not to be confused
 * with {@link DocsTypeParameter}, which describes the signature.
 */
public class DocsTypeParam implements DocsNamedElement {

    private final DocsApi parentApi;
    private final Element xeTypeParam;

    DocsTypeParam(DocsApi parentApi, Element xeTypeParam) {
        this.parentApi = parentApi;
        this.xeTypeParam = xeTypeParam;
    }

    @Override
    public DocsApi getParentApi() {
        return parentApi;
    }

    @Override
    public String getName() {
        return XmlElements.attribute(xeTypeParam, "name");
    }

    @Override
    public String getValue() {
        return XmlElements.innerXml(xeTypeParam);
    }

    @Override
    public void setValue(String structuredXml) {
        parentApi.setElementText(xeTypeParam, structuredXml);
    }
}
