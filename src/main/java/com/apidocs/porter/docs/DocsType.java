package com.apidocs.porter.docs;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.w3c.dom.Element;

import com.apidocs.porter.xml.XmlElements;

/**
 * A Docs xml file's {@code Type} element: signature metadata plus the
 * type-level {@code Docs} block.
 */
public class DocsType extends DocsApi {

    public static final String DELEGATE_BASE_TYPE = "System.Delegate";
    public static final String ENUM_BASE_TYPE = "System.Enum";

    private final List<DocsMember> members = new ArrayList<>();

    public DocsType(Element xeType, Path filePath) {
        super(xeType, filePath);
    }

    @Override
    public String getDocId() {
        return signatureDocId("TypeSignature");
    }

    public String getName() {
        return XmlElements.attribute(xeApi, "Name");
    }

    public String getFullName() {
        return XmlElements.attribute(xeApi, "FullName");
    }

    /**
     * Namespace part of the full name. Nested types keep their outer type out
     * of the namespace, e.g. {@code N} for {@code N.Outer+Inner}.
     */
    public String getNamespace() {
        String fullName = getFullName();
        int plus = fullName.indexOf('+');
        String outer = plus < 0 ? fullName : fullName.substring(0, plus);
        int dot = outer.lastIndexOf('.');
        return dot < 0 ? "" : outer.substring(0, dot);
    }

    @Override
    public List<String> getAssemblyNames() {
        return assemblyNamesOf(xeApi);
    }

    /**
     * Name of the base type, empty when the type has none.
     */
    public String getBaseTypeName() {
        return XmlElements.pathText(xeApi, "Base", "BaseTypeName");
    }

    public List<String> getInterfaceNames() {
        List<String> names = new ArrayList<>();
        XmlElements.child(xeApi, "Interfaces").ifPresent(interfaces -> {
            for (Element iface : XmlElements.children(interfaces, "Interface")) {
                String name = XmlElements.childText(iface, "InterfaceName");
                if (!name.isEmpty()) {
                    names.add(name);
                }
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

    public boolean isDelegate() {
        return DELEGATE_BASE_TYPE.equals(getBaseTypeName());
    }

    public boolean isEnum() {
        return ENUM_BASE_TYPE.equals(getBaseTypeName());
    }

    public List<DocsMember> getMembers() {
        return Collections.unmodifiableList(members);
    }

    void addMember(DocsMember member) {
        members.add(member);
    }

    /**
     * Whether the type or any of its members has been modified.
     */
    public boolean isFileChanged() {
        return isChanged() || members.stream().anyMatch(DocsApi::isChanged);
    }
}
