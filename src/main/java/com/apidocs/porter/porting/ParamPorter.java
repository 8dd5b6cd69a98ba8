package com.apidocs.porter.porting;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.apidocs.porter.config.MergePolicy;
import com.apidocs.porter.docs.DocsApi;
import com.apidocs.porter.docs.DocsNamedElement;
import com.apidocs.porter.docs.DocsType;
import com.apidocs.porter.intellisense.IntelliSenseXmlParam;
import com.apidocs.porter.markup.MarkupTranslator;

import lombok.RequiredArgsConstructor;

/**
 * Ports {@code param} and {@code typeparam} texts, matching entries by name.
 *
 * Names missing from the IntelliSense member are reported as problems, or
 * handed to the {@link NameMismatchResolver} when both sides list the same
 * number of entries and prompts are enabled. A fallback API (the implemented
 * interface member or the inherited ancestor) supplies texts the IntelliSense
 * member leaves empty.
 */
@RequiredArgsConstructor
class ParamPorter {

    private static final Logger log = LoggerFactory.getLogger(ParamPorter.class);

    private final MergePolicy policy;
    private final FieldPorter fieldPorter;
    private final PortingReport report;
    private final NameMismatchResolver mismatchResolver;

    /**
     * @param source   IntelliSense params, or null when the API has no IntelliSense member
     * @param fallback API whose params fill gaps, may be null
     */
    void portParams(DocsApi api, List<IntelliSenseXmlParam> source, DocsApi fallback, boolean fallbackIsEii) {
        boolean enabled = api instanceof DocsType ? policy.isPortTypeParams() : policy.isPortMemberParams();
        if (!enabled) {
            return;
        }
        port(NameMismatch.Kind.PARAM, api, api.getParams(), source,
                fallback == null ? List.of() : fallback.getParams(), fallbackIsEii);
    }

    void portTypeParams(DocsApi api, List<IntelliSenseXmlParam> source, DocsApi fallback, boolean fallbackIsEii) {
        boolean enabled = api instanceof DocsType ? policy.isPortTypeTypeParams() : policy.isPortMemberTypeParams();
        if (!enabled) {
            return;
        }
        port(NameMismatch.Kind.TYPE_PARAM, api, api.getTypeParams(), source,
                fallback == null ? List.of() : fallback.getTypeParams(), fallbackIsEii);
    }

    private void port(NameMismatch.Kind kind, DocsApi api, List<? extends DocsNamedElement> targets,
            List<IntelliSenseXmlParam> source, List<? extends DocsNamedElement> fallback, boolean fallbackIsEii) {

        for (DocsNamedElement target : targets) {
            if (!MarkupTranslator.isDocsEmpty(target.getValue())) {
                continue;
            }

            String value = null;
            String name = target.getName();
            boolean fromFallback = false;

            Optional<IntelliSenseXmlParam> match = source == null ? Optional.empty() : find(source, target.getName());
            if (match.isPresent() && !MarkupTranslator.isDocsEmpty(match.get().getText())) {
                value = match.get().getText();
                name = match.get().getName();
            } else {
                String alternativeName = match.map(IntelliSenseXmlParam::getName).orElse(target.getName());
                Optional<? extends DocsNamedElement> inherited = findFallback(fallback, target.getName(), alternativeName);
                if (inherited.isPresent()) {
                    value = inherited.get().getValue();
                    name = inherited.get().getName();
                    fromFallback = true;
                } else if (source != null && match.isEmpty()) {
                    Optional<IntelliSenseXmlParam> selected = resolveMissingName(kind, api, target, targets.size(), source);
                    if (selected.isPresent() && !MarkupTranslator.isDocsEmpty(selected.get().getText())) {
                        value = selected.get().getText();
                        name = selected.get().getName();
                    }
                }
            }

            if (!MarkupTranslator.isDocsEmpty(value)) {
                target.setValue(MarkupTranslator.toStructuredXml(value));
                fieldPorter.recordModified(kind.getElementName() + " '" + name + "'", api, fromFallback && fallbackIsEii);
            }
        }
    }

    private Optional<IntelliSenseXmlParam> resolveMissingName(NameMismatch.Kind kind, DocsApi api,
            DocsNamedElement target, int targetCount, List<IntelliSenseXmlParam> source) {
        String element = kind.getElementName();
        if (source.isEmpty()) {
            problem("There were no IntelliSense xml comments for " + element + " " + target.getName()
                    + " in Member DocId " + api.getDocId());
            return Optional.empty();
        }
        if (source.size() != targetCount) {
            problem("The total number of " + element + "s does not match between IntelliSense and Docs members "
                    + api.getDocId());
            return Optional.empty();
        }

        MismatchDecision decision;
        if (policy.isDisablePrompts()) {
            log.error("Prompts disabled. Will not process the '{}' {}.", target.getName(), element);
            decision = MismatchDecision.skip();
        } else {
            NameMismatch.NameMismatchBuilder mismatch = NameMismatch.builder()
                    .kind(kind)
                    .docId(api.getDocId())
                    .filePath(api.getFilePath())
                    .docsName(target.getName());
            source.forEach(p -> mismatch.candidate(p.getName()));
            decision = mismatchResolver.resolve(mismatch.build());
        }

        if (decision.getOutcome() == MismatchDecision.Outcome.ABORT) {
            throw new PortAbortedException("Aborted while resolving " + element + " '" + target.getName()
                    + "' of " + api.getDocId());
        }
        Optional<IntelliSenseXmlParam> selected = decision.getOutcome() == MismatchDecision.Outcome.SELECT
                ? find(source, decision.getSelectedName())
                : Optional.empty();
        if (selected.isEmpty()) {
            problem("The " + element + " " + target.getName() + " was not found in IntelliSense xml for " + api.getDocId());
        }
        return selected;
    }

    private void problem(String message) {
        report.recordProblem(message);
        log.warn(message);
    }

    private static Optional<IntelliSenseXmlParam> find(List<IntelliSenseXmlParam> source, String name) {
        return source.stream().filter(p -> p.getName().equals(name)).findFirst();
    }

    private static Optional<? extends DocsNamedElement> findFallback(List<? extends DocsNamedElement> fallback,
            String name, String alternativeName) {
        return fallback.stream()
                .filter(p -> p.getName().equals(name) || p.getName().equals(alternativeName))
                .filter(p -> !MarkupTranslator.isDocsEmpty(p.getValue()))
                .findFirst();
    }
}
