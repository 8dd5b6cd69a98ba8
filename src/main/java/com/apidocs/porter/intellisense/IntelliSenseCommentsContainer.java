package com.apidocs.porter.intellisense;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import com.apidocs.porter.config.ApiFilter;
import com.apidocs.porter.core.context.ToolDiagnostics;
import com.apidocs.porter.docid.DocIds;
import com.apidocs.porter.xml.XmlElements;

/**
 * Indexed IntelliSense members of every loaded file, keyed by DocId.
 *
 * Iteration follows load order. When two files define the same DocId the
 * first one wins and the duplicate is reported as a warning.
 */
public class IntelliSenseCommentsContainer {

    private static final Logger log = LoggerFactory.getLogger(IntelliSenseCommentsContainer.class);

    static final String ROOT = "doc";

    private final Map<String, IntelliSenseXmlMember> members = new LinkedHashMap<>();
    private final ApiFilter filter;
    private final ToolDiagnostics diagnostics;

    public IntelliSenseCommentsContainer(ApiFilter filter, ToolDiagnostics diagnostics) {
        this.filter = filter;
        this.diagnostics = diagnostics;
    }

    /**
     * Adds the members of one IntelliSense document. Documents that do not look
     * like IntelliSense xml are skipped and reported, never thrown.
     *
     * @return number of members added
     */
    public int load(Document document, Path path) {
        Element root = document == null ? null : document.getDocumentElement();
        if (root == null || !ROOT.equals(root.getNodeName())) {
            String message = "Not an IntelliSense xml file, skipped: " + path;
            log.error(message);
            diagnostics.skipFile(path, message);
            return 0;
        }

        String assembly = XmlElements.pathText(root, "assembly", "name");
        if (!filter.isAssemblyIncluded(assembly)) {
            log.debug("Skipping IntelliSense file of excluded assembly {}: {}", assembly, path);
            return 0;
        }

        Optional<Element> membersElement = XmlElements.child(root, "members");
        if (membersElement.isEmpty()) {
            diagnostics.getWarnings().add("IntelliSense xml file has no members: " + path);
            return 0;
        }

        int added = 0;
        for (Element memberElement : XmlElements.children(membersElement.get(), "member")) {
            String docId = XmlElements.attribute(memberElement, "name");
            if (!DocIds.hasPrefix(docId)) {
                String message = "IntelliSense member without a valid DocId in " + path + ": '" + docId + "'";
                log.warn(message);
                diagnostics.getWarnings().add(message);
                continue;
            }
            if (!isIncluded(docId)) {
                log.trace("Filtered out {}", docId);
                continue;
            }
            if (members.containsKey(docId)) {
                IntelliSenseXmlMember first = members.get(docId);
                String message = "Duplicate IntelliSense member " + docId + " in " + path
                        + ", keeping the one from " + first.getFilePath();
                log.warn(message);
                diagnostics.getWarnings().add(message);
                continue;
            }
            members.put(docId, parseMember(memberElement, docId, assembly, path));
            added++;
        }
        log.debug("Loaded {} IntelliSense members from {}", added, path);
        return added;
    }

    public Optional<IntelliSenseXmlMember> find(String docId) {
        return Optional.ofNullable(members.get(docId));
    }

    public Collection<IntelliSenseXmlMember> getMembers() {
        return Collections.unmodifiableCollection(members.values());
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    /**
     * Namespace and type filters, matched against the declaring type named by the
     * DocId. Generic types are spelled differently in Docs files ({@code List<T>}
     * rather than {@code List`1}), so the type filter is only applied to
     * non generic declaring types; the Docs side still filters those.
     */
    private boolean isIncluded(String docId) {
        String typeName = DocIds.declaringTypeNameOf(docId);
        int dot = typeName.lastIndexOf('.');
        String namespace = dot < 0 ? "" : typeName.substring(0, dot);
        if (!filter.isNamespaceIncluded(namespace)) {
            return false;
        }
        if (typeName.indexOf('`') >= 0) {
            return true;
        }
        return filter.isTypeIncluded(typeName.substring(dot + 1), typeName);
    }

    private IntelliSenseXmlMember parseMember(Element element, String docId, String assembly, Path path) {
        IntelliSenseXmlMember.IntelliSenseXmlMemberBuilder builder = IntelliSenseXmlMember.builder()
                .name(docId)
                .assembly(assembly)
                .filePath(path);

        for (Element child : XmlElements.children(element, null)) {
            switch (child.getNodeName()) {
                case "summary" -> builder.summary(XmlElements.innerXml(child));
                case "remarks" -> builder.remarks(XmlElements.innerXml(child));
                case "returns" -> builder.returns(XmlElements.innerXml(child));
                case "value" -> builder.value(XmlElements.innerXml(child));
                case "param" -> builder.param(
                        new IntelliSenseXmlParam(XmlElements.attribute(child, "name"), XmlElements.innerXml(child)));
                case "typeparam" -> builder.typeParam(
                        new IntelliSenseXmlParam(XmlElements.attribute(child, "name"), XmlElements.innerXml(child)));
                case "exception" -> builder.exception(
                        new IntelliSenseXmlException(XmlElements.attribute(child, "cref"), XmlElements.innerXml(child)));
                case "inheritdoc" -> builder.inheritDoc(true).inheritDocCref(XmlElements.attribute(child, "cref"));
                default -> log.trace("Ignoring <{}> in {}", child.getNodeName(), docId);
            }
        }
        return builder.build();
    }
}
