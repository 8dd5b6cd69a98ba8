package com.apidocs.porter.docs;

import java.util.ArrayList;
import java.util.List;

import org.w3c.dom.Element;

import com.apidocs.porter.xml.XmlElements;

/**
 * A {@code Member} element of a Docs xml file.
 */
public class DocsMember extends DocsApi {

    public static final String VOID_RETURN_TYPE = "System.Void";

    public static final String METHOD = "Method";
    public static final String CONSTRUCTOR = "Constructor";
    public static final String PROPERTY = "Property";
    public static final String FIELD = "Field";
    public static final String EVENT = "Event";

    private final DocsType parentType;

    public DocsMember(Element xeMember, DocsType parentType) {
        super(xeMember, parentType.getFilePath());
        this.parentType = parentType;
    }

    @Override
    public String getDocId() {
        return signatureDocId("MemberSignature");
    }

    public DocsType getParentType() {
        return parentType;
    }

    public String getMemberName() {
        return XmlElements.attribute(xeApi, "MemberName");
    }

    /**
     * Method, Constructor, Property, Field or Event.
     */
    public String getMemberType() {
        return XmlElements.childText(xeApi, "MemberType");
    }

    public boolean isMethod() {
        return METHOD.equals(getMemberType());
    }

    public boolean isProperty() {
        return PROPERTY.equals(getMemberType());
    }

    public boolean isField() {
        return FIELD.equals(getMemberType());
    }

    public String getReturnType() {
        return XmlElements.pathText(xeApi, "ReturnValue", "ReturnType");
    }

    public boolean returnsVoid() {
        return VOID_RETURN_TYPE.equals(getReturnType());
    }

    /**
     * DocId of the interface member this member implements, empty when none.
     * Only the first entry is used when several are listed.
     */
    public String getImplementsInterfaceMember() {
        return XmlElements.pathText(xeApi, "Implements", "InterfaceMember");
    }

    /**
     * Parameter names of the signature, in declaration order.
     */
    public List<String> getSignatureParameterNames() {
        List<String> names = new ArrayList<>();
        XmlElements.child(xeApi, "Parameters").ifPresent(section -> {
            for (Element p : XmlElements.children(section, "Parameter")) {
                names.add(XmlElements.attribute(p, "Name"));
            }
        });
        return names;
    }

    public List<DocsTypeParameter> getTypeParameters() {
        List<DocsTypeParameter> result = new ArrayList<>();
        XmlElements.child(xeApi, "TypeParameters").ifPresent(section -> {
            for (Element tp : XmlElements.children(section, "TypeParameter")) {
                result.add(new DocsTypeParameter(tp));
            }
        });
        return result;
    }

    @Override
    public List<String> getAssemblyNames() {
        List<String> own = assemblyNamesOf(xeApi);
        return own.isEmpty() ? parentType.getAssemblyNames() : own;
    }
}
