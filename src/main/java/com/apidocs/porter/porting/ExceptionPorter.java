package com.apidocs.porter.porting;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.apidocs.porter.config.MergePolicy;
import com.apidocs.porter.docs.DocsException;
import com.apidocs.porter.docs.DocsMember;
import com.apidocs.porter.intellisense.IntelliSenseXmlException;
import com.apidocs.porter.intellisense.IntelliSenseXmlMember;
import com.apidocs.porter.markup.MarkupTranslator;

import lombok.RequiredArgsConstructor;

/**
 * Ports exceptions. Unlike other fields every IntelliSense exception is looked
 * at: an unknown cref adds a new element, a known cref gets the text appended
 * unless it mostly repeats what is already there.
 */
@RequiredArgsConstructor
class ExceptionPorter {

    private static final Logger log = LoggerFactory.getLogger(ExceptionPorter.class);

    private final MergePolicy policy;
    private final FieldPorter fieldPorter;
    private final PortingReport report;

    void portExceptions(DocsMember member, IntelliSenseXmlMember source) {
        if (!policy.isPortExceptionsNew() && !policy.isPortExceptionsExisting()) {
            return;
        }
        for (IntelliSenseXmlException exception : source.getExceptions()) {
            String cref = exception.getCref();
            String text = MarkupTranslator.exceptionText(exception.getText());
            Optional<DocsException> existing = member.findException(cref);

            if (existing.isEmpty() && policy.isPortExceptionsNew()) {
                member.addException(cref, MarkupTranslator.isDocsEmpty(text) ? MarkupTranslator.TO_BE_ADDED : text);
                report.recordAddedException(cref, member.getDocId());
                fieldPorter.recordModified("exception '" + cref + "'", member, false);
            } else if (existing.isPresent() && policy.isPortExceptionsExisting() && !MarkupTranslator.isDocsEmpty(text)) {
                DocsException docsException = existing.get();
                if (docsException.wordCountCollidesAboveThreshold(text, policy.getExceptionCollisionThreshold())) {
                    log.debug("Exception {} of {} already says the same, not appended", cref, member.getDocId());
                    continue;
                }
                docsException.appendException(text);
                report.recordAddedException(cref, member.getDocId());
                fieldPorter.recordModified("exception '" + cref + "'", member, false);
            }
        }
    }
}
