package com.apidocs.porter.docs;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.w3c.dom.Element;

import com.apidocs.porter.markup.MarkupTranslator;
import com.apidocs.porter.xml.XmlElements;
import com.apidocs.porter.xml.XmlFragments;

/**
 * Common view over the {@code Docs} block of a Docs xml type or member.
 *
 * Reads come straight from the DOM and writes go straight into it, so saving
 * the owning document persists every change. Any write sets the changed flag.
 */
public abstract class DocsApi {

    /** Canonical order of the children of a {@code Docs} element. */
    static final List<String> DOCS_ORDER = List.of(
            "typeparam", "param", "summary", "returns", "value", "remarks", "exception",
            "threadsafe", "permission", "example", "altmember", "related", "seealso", "inheritdoc");

    static final String DOCID_LANGUAGE = "DocId";

    protected final Element xeApi;
    private final Path filePath;
    private boolean changed;

    protected DocsApi(Element xeApi, Path filePath) {
        this.xeApi = xeApi;
        this.filePath = filePath;
    }

    public abstract String getDocId();

    /**
     * Assemblies this API ships in.
     */
    public abstract List<String> getAssemblyNames();

    public Path getFilePath() {
        return filePath;
    }

    public boolean isChanged() {
        return changed;
    }

    protected void markChanged() {
        this.changed = true;
    }

    public String getSummary() {
        return fieldText("summary");
    }

    public void setSummary(String structuredXml) {
        setFieldText("summary", structuredXml);
    }

    public String getRemarks() {
        return fieldText("remarks");
    }

    public void setRemarks(String structuredXml) {
        setFieldText("remarks", structuredXml);
    }

    /**
     * Writes remarks as a markdown block wrapped in a {@code format} element.
     */
    public void setRemarksMarkdown(String markdownBody) {
        Element remarks = fieldElement("remarks");
        while (remarks.getFirstChild() != null) {
            remarks.removeChild(remarks.getFirstChild());
        }
        String outer = XmlElements.indentationOf(remarks);
        String inner = XmlElements.childIndentationOf(remarks);

        Element format = remarks.getOwnerDocument().createElement("format");
        format.setAttribute("type", "text/markdown");
        format.appendChild(remarks.getOwnerDocument()
                .createCDATASection(MarkupTranslator.markdownRemarksBlock(markdownBody, inner)));

        remarks.appendChild(remarks.getOwnerDocument().createTextNode("\n" + inner));
        remarks.appendChild(format);
        remarks.appendChild(remarks.getOwnerDocument().createTextNode("\n" + outer));
        markChanged();
    }

    public String getReturns() {
        return fieldText("returns");
    }

    public void setReturns(String structuredXml) {
        setFieldText("returns", structuredXml);
    }

    public String getValue() {
        return fieldText("value");
    }

    public void setValue(String structuredXml) {
        setFieldText("value", structuredXml);
    }

    public List<DocsParam> getParams() {
        List<DocsParam> params = new ArrayList<>();
        for (Element e : docsChildren("param")) {
            params.add(new DocsParam(this, e));
        }
        return params;
    }

    public List<DocsTypeParam> getTypeParams() {
        List<DocsTypeParam> typeParams = new ArrayList<>();
        for (Element e : docsChildren("typeparam")) {
            typeParams.add(new DocsTypeParam(this, e));
        }
        return typeParams;
    }

    public List<DocsException> getExceptions() {
        List<DocsException> exceptions = new ArrayList<>();
        for (Element e : docsChildren("exception")) {
            exceptions.add(new DocsException(this, e));
        }
        return exceptions;
    }

    public Optional<DocsException> findException(String cref) {
        return getExceptions().stream().filter(e -> e.getCref().equals(cref)).findFirst();
    }

    public DocsException addException(String cref, String structuredXml) {
        Element element = docsElement().getOwnerDocument().createElement("exception");
        element.setAttribute("cref", cref);
        XmlFragments.replaceChildren(element, structuredXml);
        XmlElements.insertInOrder(docsElement(), element, DOCS_ORDER);
        markChanged();
        return new DocsException(this, element);
    }

    /**
     * True when an {@code inheritdoc} element is already present.
     */
    public boolean hasInheritDoc() {
        return existingDocsElement().flatMap(docs -> XmlElements.child(docs, "inheritdoc")).isPresent();
    }

    public String getInheritDocCref() {
        return existingDocsElement()
                .flatMap(docs -> XmlElements.child(docs, "inheritdoc"))
                .map(e -> XmlElements.attribute(e, "cref"))
                .orElse("");
    }

    /**
     * Records an inherit-doc marker as the last element of the {@code Docs}
     * block. An empty cref writes a bare marker.
     */
    public void setInheritDoc(String cref) {
        if (hasInheritDoc()) {
            return;
        }
        Element element = docsElement().getOwnerDocument().createElement("inheritdoc");
        if (cref != null && !cref.isEmpty()) {
            element.setAttribute("cref", cref);
        }
        XmlElements.appendIndented(docsElement(), element);
        markChanged();
    }

    /**
     * True when summary, remarks and every param and type param are docs-empty.
     */
    public boolean isUndocumented() {
        if (!MarkupTranslator.isDocsEmpty(getSummary()) || !MarkupTranslator.isDocsEmpty(getRemarks())) {
            return false;
        }
        for (DocsParam p : getParams()) {
            if (!MarkupTranslator.isDocsEmpty(p.getValue())) {
                return false;
            }
        }
        for (DocsTypeParam tp : getTypeParams()) {
            if (!MarkupTranslator.isDocsEmpty(tp.getValue())) {
                return false;
            }
        }
        return true;
    }

    /**
     * The {@code Docs} element, created when missing. Only write paths call this;
     * reads go through {@link #existingDocsElement()} and never touch the DOM.
     */
    protected Element docsElement() {
        Optional<Element> docs = existingDocsElement();
        if (docs.isPresent()) {
            return docs.get();
        }
        Element created = xeApi.getOwnerDocument().createElement("Docs");
        XmlElements.appendIndented(xeApi, created);
        return created;
    }

    protected String signatureDocId(String signatureElement) {
        for (Element signature : XmlElements.children(xeApi, signatureElement)) {
            if (DOCID_LANGUAGE.equals(signature.getAttribute("Language"))) {
                return signature.getAttribute("Value");
            }
        }
        return "";
    }

    protected List<String> assemblyNamesOf(Element element) {
        List<String> names = new ArrayList<>();
        for (Element info : XmlElements.children(element, "AssemblyInfo")) {
            for (Element name : XmlElements.children(info, "AssemblyName")) {
                String value = name.getTextContent().trim();
                if (!value.isEmpty() && !names.contains(value)) {
                    names.add(value);
                }
            }
        }
        return names;
    }

    protected Optional<Element> existingDocsElement() {
        return XmlElements.child(xeApi, "Docs");
    }

    private List<Element> docsChildren(String name) {
        return existingDocsElement().map(docs -> XmlElements.children(docs, name)).orElse(List.of());
    }

    private String fieldText(String name) {
        return existingDocsElement()
                .flatMap(docs -> XmlElements.child(docs, name))
                .map(XmlElements::innerXml)
                .orElse("");
    }

    private Element fieldElement(String name) {
        Optional<Element> existing = XmlElements.child(docsElement(), name);
        if (existing.isPresent()) {
            return existing.get();
        }
        Element created = docsElement().getOwnerDocument().createElement(name);
        XmlElements.insertInOrder(docsElement(), created, DOCS_ORDER);
        return created;
    }

    private void setFieldText(String name, String structuredXml) {
        XmlFragments.replaceChildren(fieldElement(name), structuredXml);
        markChanged();
    }

    void setElementText(Element element, String structuredXml) {
        XmlFragments.replaceChildren(element, structuredXml);
        markChanged();
    }

    @Override
    public String toString() {
        return getDocId();
    }
}
