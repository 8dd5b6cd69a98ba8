package com.apidocs.porter.docs;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.w3c.dom.Element;

import com.apidocs.porter.xml.XmlElements;

/**
 * A {@code TypeParameter} of a type or member signature, located inside the
 * {@code TypeParameters} section.
 */
public class DocsTypeParameter {

    private final Element xeTypeParameter;

    DocsTypeParameter(Element xeTypeParameter) {
        this.xeTypeParameter = xeTypeParameter;
    }

    public String getName() {
        return XmlElements.attribute(xeTypeParameter, "Name");
    }

    public List<String> getConstraintsParameterAttributes() {
        List<String> attributes = new ArrayList<>();
        constraints().ifPresent(c -> {
            for (Element attribute : XmlElements.children(c, "ParameterAttribute")) {
                attributes.add(attribute.getTextContent().trim());
            }
        });
        return attributes;
    }

    public String getConstraintsBaseTypeName() {
        return constraints().map(c -> XmlElements.childText(c, "BaseTypeName")).orElse("");
    }

    private Optional<Element> constraints() {
        return XmlElements.child(xeTypeParameter, "Constraints");
    }
}
