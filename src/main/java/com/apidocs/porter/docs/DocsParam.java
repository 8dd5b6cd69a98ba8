package com.apidocs.porter.docs;

import org.w3c.dom.Element;

import com.apidocs.porter.xml.XmlElements;

/**
 * A {@code param} element inside a {@code Docs} block.
 */
public class DocsParam implements DocsNamedElement {

    private final DocsApi parentApi;
    private final Element xeParam;

    DocsParam(DocsApi parentApi, Element xeParam) {
        this.parentApi = parentApi;
        this.xeParam = xeParam;
    }

    @Override
    public DocsApi getParentApi() {
        return parentApi;
    }

    @Override
    public String getName() {
        return XmlElements.attribute(xeParam, "name");
    }

    @Override
    public String getValue() {
        return XmlElements.innerXml(xeParam);
    }

    @Override
    public void setValue(String structuredXml) {
        parentApi.setElementText(xeParam, structuredXml);
    }
}
