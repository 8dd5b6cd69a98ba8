package com.apidocs.porter.porting;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.apidocs.porter.config.MergePolicy;
import com.apidocs.porter.docs.DocsApi;
import com.apidocs.porter.docs.DocsMember;
import com.apidocs.porter.docs.DocsType;
import com.apidocs.porter.markup.MarkupTranslator;

import lombok.RequiredArgsConstructor;

/**
 * Writes single-valued fields (summary, remarks, returns, property value).
 *
 * A candidate is written only when its field kind is enabled, the target field
 * is docs-empty and the candidate is not. Existing text is never replaced.
 */
@RequiredArgsConstructor
class FieldPorter {

    private static final Logger log = LoggerFactory.getLogger(FieldPorter.class);

    private final MergePolicy policy;
    private final PortingReport report;

    void portSummary(DocsApi api, String summary, boolean eii) {
        boolean enabled = api instanceof DocsType ? policy.isPortTypeSummaries() : policy.isPortMemberSummaries();
        if (!enabled || !MarkupTranslator.isDocsEmpty(api.getSummary()) || MarkupTranslator.isDocsEmpty(summary)) {
            return;
        }
        api.setSummary(MarkupTranslator.toStructuredXml(summary));
        recordModified("summary", api, eii);
    }

    void portRemarks(DocsApi api, String remarks, boolean eii) {
        boolean enabled = api instanceof DocsType ? policy.isPortTypeRemarks() : policy.isPortMemberRemarks();
        if (!enabled || !MarkupTranslator.isDocsEmpty(api.getRemarks()) || MarkupTranslator.isDocsEmpty(remarks)) {
            return;
        }
        // the Docs schema does not allow remarks on enum values
        if (api instanceof DocsMember member && member.isField() && member.getParentType().isEnum()) {
            return;
        }
        if (policy.isMarkdownRemarks()) {
            api.setRemarksMarkdown(MarkupTranslator.toMarkdown(remarks));
        } else {
            api.setRemarks(MarkupTranslator.toStructuredXml(remarks));
        }
        recordModified("remarks", api, eii);
    }

    void portReturns(DocsApi api, String returns, boolean eii) {
        if (!policy.isPortMemberReturns()) {
            return;
        }
        if (api instanceof DocsMember member && member.returnsVoid()) {
            return;
        }
        if (!MarkupTranslator.isDocsEmpty(api.getReturns()) || MarkupTranslator.isDocsEmpty(returns)) {
            return;
        }
        api.setReturns(MarkupTranslator.toStructuredXml(returns));
        recordModified("returns", api, eii);
    }

    void portProperty(DocsMember member, String property, boolean eii) {
        if (!policy.isPortMemberProperties()
                || !MarkupTranslator.isDocsEmpty(member.getValue())
                || MarkupTranslator.isDocsEmpty(property)) {
            return;
        }
        member.setValue(MarkupTranslator.toStructuredXml(property));
        recordModified("property", member, eii);
    }

    void recordModified(String element, DocsApi api, boolean eii) {
        report.recordModifiedElement(element, api.getFilePath(), api.getDocId(), eii);
        if (eii) {
            log.info("    [EII] {} ported: {} ({})", element, api.getDocId(), api.getFilePath());
        } else {
            log.info("    {} ported: {} ({})", element, api.getDocId(), api.getFilePath());
        }
    }
}
