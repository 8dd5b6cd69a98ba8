package com.apidocs.porter.porting;

import java.util.Optional;

import com.apidocs.porter.config.MergePolicy;
import com.apidocs.porter.docid.DocIds;
import com.apidocs.porter.docs.DocsCommentsContainer;
import com.apidocs.porter.docs.DocsMember;
import com.apidocs.porter.markup.MarkupTranslator;

import lombok.RequiredArgsConstructor;

/**
 * Documentation for members without IntelliSense comments, taken from the
 * interface member they implement.
 */
@RequiredArgsConstructor
class ExplicitInterfaceFallback {

    private final DocsCommentsContainer docs;
    private final MergePolicy policy;

    Optional<DocsMember> findInterfacedMember(DocsMember member) {
        String interfacedDocId = member.getImplementsInterfaceMember();
        if (interfacedDocId.isEmpty() || interfacedDocId.equals(member.getDocId())) {
            return Optional.empty();
        }
        return docs.findMember(interfacedDocId);
    }

    /**
     * Summary, returns and property value are copied. Remarks are only produced
     * for explicit implementations, i.e. when the member is named after the
     * full interface member, and consist of a fixed sentence optionally
     * followed by the interface remarks.
     */
    MissingComments collect(DocsMember member, DocsMember interfaced) {
        MissingComments mc = new MissingComments();
        mc.setEii(true);
        mc.fillEmpty(
                interfaced.getSummary(),
                member.isMethod() ? interfaced.getReturns() : null,
                null,
                member.isProperty() ? MissingComments.propertyValue(interfaced.getValue(), interfaced.getReturns()) : null);

        String interfaceRemarks = interfaced.getRemarks();
        if (!MarkupTranslator.isDocsEmpty(interfaceRemarks)
                && member.getMemberName().equals(DocIds.stripPrefix(interfaced.getDocId()))) {
            mc.setRemarks(explicitImplementationRemarks(member, interfaced));
        }
        return mc;
    }

    private String explicitImplementationRemarks(DocsMember member, DocsMember interfaced) {
        String typeDocId = member.getParentType().getDocId();
        String interfaceTypeDocId = interfaced.getParentType().getDocId();

        String sentence = "This member is an explicit interface member implementation. It can be used only when the "
                + reference(typeDocId) + " instance is cast to an " + reference(interfaceTypeDocId) + " interface.";
        if (policy.isSkipInterfaceRemarks()) {
            return sentence;
        }

        String remarks = interfaced.getRemarks();
        String cleaned = remarks.contains(MarkupTranslator.TO_BE_ADDED) ? "" : MarkupTranslator.cleanRemarks(remarks);
        return cleaned.isEmpty() ? sentence : sentence + "\n\n" + cleaned;
    }

    private String reference(String typeDocId) {
        if (policy.isMarkdownRemarks()) {
            return "<xref:" + MarkupTranslator.escapeXref(DocIds.stripPrefix(typeDocId)) + ">";
        }
        return "<see cref=\"" + typeDocId + "\" />";
    }
}
