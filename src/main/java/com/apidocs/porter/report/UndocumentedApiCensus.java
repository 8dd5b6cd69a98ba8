package com.apidocs.porter.report;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.apidocs.porter.docs.DocsApi;
import com.apidocs.porter.docs.DocsCommentsContainer;
import com.apidocs.porter.docs.DocsException;
import com.apidocs.porter.docs.DocsMember;
import com.apidocs.porter.docs.DocsNamedElement;
import com.apidocs.porter.docs.DocsType;
import com.apidocs.porter.docs.DocsTypeParameter;
import com.apidocs.porter.markup.MarkupTranslator;

import lombok.Getter;

/**
 * Counts the Docs fields that are still undocumented, usually taken after a
 * port to show what is left for a human to write.
 */
@Getter
public class UndocumentedApiCensus {

    private int typeSummaries;
    private int memberSummaries;
    private int memberReturns;
    private int memberProperties;
    private int params;
    private int typeParams;
    private int exceptions;

    /** One "{element}: {DocId}" line per undocumented field. */
    private final List<String> entries = new ArrayList<>();

    public static UndocumentedApiCensus take(DocsCommentsContainer docs) {
        UndocumentedApiCensus census = new UndocumentedApiCensus();
        for (DocsType type : docs.getTypes()) {
            if (MarkupTranslator.isDocsEmpty(type.getSummary())) {
                census.typeSummaries++;
                census.entries.add("summary: " + type.getDocId());
            }
            census.countNamed(type, type.getParams(), "param");
            census.countNamed(type, type.getTypeParams(), "typeparam");
            census.countMissingTypeParams(type, type.getTypeParameters());
        }
        for (DocsMember member : docs.getMembers()) {
            if (MarkupTranslator.isDocsEmpty(member.getSummary())) {
                census.memberSummaries++;
                census.entries.add("summary: " + member.getDocId());
            }
            if (member.isMethod() && !member.returnsVoid() && MarkupTranslator.isDocsEmpty(member.getReturns())) {
                census.memberReturns++;
                census.entries.add("returns: " + member.getDocId());
            }
            if (member.isProperty() && MarkupTranslator.isDocsEmpty(member.getValue())) {
                census.memberProperties++;
                census.entries.add("value: " + member.getDocId());
            }
            census.countNamed(member, member.getParams(), "param");
            census.countNamed(member, member.getTypeParams(), "typeparam");
            census.countMissingTypeParams(member, member.getTypeParameters());
            for (String name : member.getSignatureParameterNames()) {
                if (member.getParams().stream().noneMatch(p -> p.getName().equals(name))) {
                    census.params++;
                    census.entries.add("param " + name + " (missing): " + member.getDocId());
                }
            }
            for (DocsException exception : member.getExceptions()) {
                if (MarkupTranslator.isDocsEmpty(exception.getValue())) {
                    census.exceptions++;
                    census.entries.add("exception " + exception.getCref() + ": " + member.getDocId());
                }
            }
        }
        return census;
    }

    public int getTotal() {
        return typeSummaries + memberSummaries + memberReturns + memberProperties + params + typeParams + exceptions;
    }

    public List<String> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    /**
     * Signature type parameters the {@code Docs} block has no typeparam element for.
     */
    private void countMissingTypeParams(DocsApi api, List<DocsTypeParameter> signatureTypeParameters) {
        for (DocsTypeParameter tp : signatureTypeParameters) {
            if (api.getTypeParams().stream().noneMatch(p -> p.getName().equals(tp.getName()))) {
                typeParams++;
                entries.add("typeparam " + tp.getName() + " (missing): " + api.getDocId());
            }
        }
    }

    private void countNamed(DocsApi api, List<? extends DocsNamedElement> elements, String elementName) {
        for (DocsNamedElement element : elements) {
            if (MarkupTranslator.isDocsEmpty(element.getValue())) {
                if ("param".equals(elementName)) {
                    params++;
                } else {
                    typeParams++;
                }
                entries.add(elementName + " " + element.getName() + ": " + api.getDocId());
            }
        }
    }
}
