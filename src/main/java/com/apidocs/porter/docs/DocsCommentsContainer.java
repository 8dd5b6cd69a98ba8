package com.apidocs.porter.docs;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import com.apidocs.porter.config.ApiFilter;
import com.apidocs.porter.core.context.ToolDiagnostics;
import com.apidocs.porter.docid.DocIds;
import com.apidocs.porter.io.DocsXmlWriter;
import com.apidocs.porter.io.LoadedXmlDocument;
import com.apidocs.porter.xml.XmlElements;

/**
 * Indexed types and members of every loaded Docs xml file.
 *
 * Types and members are kept in load order. A DocId defined twice keeps its
 * first definition and the duplicate is reported as a warning.
 */
public class DocsCommentsContainer {

    private static final Logger log = LoggerFactory.getLogger(DocsCommentsContainer.class);

    static final String ROOT = "Type";

    private final Map<String, DocsType> types = new LinkedHashMap<>();
    private final Map<String, DocsMember> members = new LinkedHashMap<>();
    private final Map<Path, LoadedXmlDocument> files = new LinkedHashMap<>();
    private final Map<Path, DocsType> typesByFile = new LinkedHashMap<>();
    private final ApiFilter filter;
    private final ToolDiagnostics diagnostics;

    public DocsCommentsContainer(ApiFilter filter, ToolDiagnostics diagnostics) {
        this.filter = filter;
        this.diagnostics = diagnostics;
    }

    /**
     * Adds the type described by one Docs xml file and its members. Files that
     * are not type files, or whose type is filtered out, are skipped.
     *
     * @return the loaded type, empty when the file was skipped
     */
    public Optional<DocsType> load(LoadedXmlDocument loaded) {
        Path path = loaded.getPath();
        Element root = loaded.getDocument().getDocumentElement();
        if (root == null || !ROOT.equals(root.getNodeName())) {
            String message = "Not a Docs type file, skipped: " + path;
            log.error(message);
            diagnostics.skipFile(path, message);
            return Optional.empty();
        }

        DocsType type = new DocsType(root, path);
        String docId = type.getDocId();
        if (!DocIds.hasPrefix(docId)) {
            String message = "Docs type without a DocId signature, skipped: " + path;
            log.error(message);
            diagnostics.skipFile(path, message);
            return Optional.empty();
        }
        if (!isIncluded(type)) {
            log.trace("Filtered out {}", docId);
            return Optional.empty();
        }
        if (types.containsKey(docId)) {
            String message = "Duplicate Docs type " + docId + " in " + path
                    + ", keeping the one from " + types.get(docId).getFilePath();
            log.warn(message);
            diagnostics.getWarnings().add(message);
            return Optional.empty();
        }

        types.put(docId, type);
        files.put(path, loaded);
        typesByFile.put(path, type);

        XmlElements.child(root, "Members").ifPresent(section -> {
            for (Element memberElement : XmlElements.children(section, "Member")) {
                addMember(type, new DocsMember(memberElement, type));
            }
        });
        log.debug("Loaded Docs type {} with {} members from {}", docId, type.getMembers().size(), path);
        return Optional.of(type);
    }

    public Optional<DocsType> findType(String docId) {
        return Optional.ofNullable(types.get(docId));
    }

    public Optional<DocsMember> findMember(String docId) {
        return Optional.ofNullable(members.get(docId));
    }

    /**
     * Looks up a type or a member, whichever the DocId names.
     */
    public Optional<DocsApi> find(String docId) {
        if (docId == null || docId.isEmpty()) {
            return Optional.empty();
        }
        DocsApi api = docId.startsWith("T:") ? types.get(docId) : members.get(docId);
        return Optional.ofNullable(api);
    }

    public Collection<DocsType> getTypes() {
        return Collections.unmodifiableCollection(types.values());
    }

    public Collection<DocsMember> getMembers() {
        return Collections.unmodifiableCollection(members.values());
    }

    public List<DocsMember> getMembersOf(String typeDocId) {
        DocsType type = types.get(typeDocId);
        return type == null ? List.of() : type.getMembers();
    }

    public Collection<LoadedXmlDocument> getFiles() {
        return Collections.unmodifiableCollection(files.values());
    }

    /**
     * Files holding at least one changed type or member.
     */
    public List<LoadedXmlDocument> getChangedFiles() {
        List<LoadedXmlDocument> changed = new ArrayList<>();
        for (Map.Entry<Path, DocsType> entry : typesByFile.entrySet()) {
            if (entry.getValue().isFileChanged()) {
                changed.add(files.get(entry.getKey()));
            }
        }
        return changed;
    }

    /**
     * Writes every changed file. A file that cannot be written is reported and
     * the remaining files are still saved.
     *
     * @return number of files written
     */
    public int save(DocsXmlWriter writer) {
        int saved = 0;
        for (LoadedXmlDocument file : getChangedFiles()) {
            try {
                writer.write(file);
                saved++;
            } catch (IOException e) {
                String message = "Failed to save " + file.getPath() + ": " + e.getMessage();
                log.error(message, e);
                diagnostics.getErrors().add(message);
            }
        }
        return saved;
    }

    public boolean isEmpty() {
        return types.isEmpty();
    }

    private void addMember(DocsType type, DocsMember member) {
        String docId = member.getDocId();
        if (!DocIds.hasPrefix(docId)) {
            String message = "Docs member without a DocId signature in " + type.getFilePath() + ": " + member.getMemberName();
            log.warn(message);
            diagnostics.getWarnings().add(message);
            return;
        }
        if (members.containsKey(docId)) {
            String message = "Duplicate Docs member " + docId + " in " + type.getFilePath();
            log.warn(message);
            diagnostics.getWarnings().add(message);
            return;
        }
        members.put(docId, member);
        type.addMember(member);
    }

    private boolean isIncluded(DocsType type) {
        return filter.isAnyAssemblyIncluded(type.getAssemblyNames())
                && filter.isNamespaceIncluded(type.getNamespace())
                && filter.isTypeIncluded(type.getName(), type.getFullName());
    }
}
