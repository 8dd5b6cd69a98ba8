package com.apidocs.porter.porting;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.apidocs.porter.config.MergePolicy;
import com.apidocs.porter.docs.DocsApi;
import com.apidocs.porter.docs.DocsCommentsContainer;
import com.apidocs.porter.docs.DocsMember;
import com.apidocs.porter.docs.DocsType;
import com.apidocs.porter.intellisense.IntelliSenseCommentsContainer;
import com.apidocs.porter.intellisense.IntelliSenseXmlMember;
import com.apidocs.porter.intellisense.IntelliSenseXmlParam;
import com.apidocs.porter.markup.MarkupTranslator;

/**
 * Ports IntelliSense comments into undocumented Docs fields.
 *
 * Every type is handled before any member. For each API the candidate texts
 * come from, in order: the IntelliSense member with the same DocId, the API
 * its inherit-doc marker points at, and for members without IntelliSense
 * comments the interface member they implement. Only the Docs side is
 * modified, and only fields that are still empty.
 */
public class DocsPorter {

    private static final Logger log = LoggerFactory.getLogger(DocsPorter.class);

    private final MergePolicy policy;
    private final IntelliSenseCommentsContainer intelliSense;
    private final DocsCommentsContainer docs;
    private final PortingReport report = new PortingReport();
    private final FieldPorter fieldPorter;
    private final ParamPorter paramPorter;
    private final ExceptionPorter exceptionPorter;
    private final InheritDocResolver inheritDocResolver;
    private final ExplicitInterfaceFallback interfaceFallback;

    /** APIs already visited, also guards recursive inherit-doc ports against cycles. */
    private final Set<String> started = new HashSet<>();

    public DocsPorter(MergePolicy policy, IntelliSenseCommentsContainer intelliSense, DocsCommentsContainer docs,
            NameMismatchResolver mismatchResolver) {
        this.policy = policy;
        this.intelliSense = intelliSense;
        this.docs = docs;
        this.fieldPorter = new FieldPorter(policy, report);
        this.paramPorter = new ParamPorter(policy, fieldPorter, report, mismatchResolver);
        this.exceptionPorter = new ExceptionPorter(policy, fieldPorter, report);
        this.inheritDocResolver = new InheritDocResolver(docs);
        this.interfaceFallback = new ExplicitInterfaceFallback(docs, policy);
    }

    /**
     * Runs the port over both containers.
     *
     * @throws PortAbortedException when the operator aborts from a prompt
     */
    public PortingReport port() {
        if (intelliSense.isEmpty()) {
            log.error("No IntelliSense xml comments found.");
            report.markFailed("No IntelliSense xml comments found.");
            return report;
        }
        if (docs.isEmpty()) {
            log.error("No Docs xml types found.");
            report.markFailed("No Docs xml types found.");
            return report;
        }

        log.info("Looking for IntelliSense xml comments that can be ported...");
        for (DocsType type : docs.getTypes()) {
            portType(type);
        }
        for (DocsMember member : docs.getMembers()) {
            portMember(member);
        }
        report.markCompleted();
        return report;
    }

    private void portType(DocsType type) {
        if (!started.add(type.getDocId())) {
            return;
        }
        Optional<IntelliSenseXmlMember> found = intelliSense.find(type.getDocId());
        if (found.isEmpty()) {
            return;
        }
        IntelliSenseXmlMember source = found.get();
        log.debug("Porting type {}", type.getDocId());

        MissingComments mc = new MissingComments();
        mc.fillEmpty(source.getSummary(), source.getReturns(), source.getRemarks(), null);
        Inherited inherited = Inherited.NONE;
        if (source.isInheritDoc()) {
            if (policy.isPreserveInheritDocTag()) {
                type.setInheritDoc(source.getInheritDocCref());
            } else {
                inherited = inherit(mc, type, source);
            }
        }

        fieldPorter.portSummary(type, mc.getSummary(), false);
        fieldPorter.portRemarks(type, mc.getRemarks(), false);
        paramPorter.portParams(type, merge(source.getParams(), inherited.params), inherited.api, false);
        paramPorter.portTypeParams(type, merge(source.getTypeParams(), inherited.typeParams), inherited.api, false);
        if (type.isDelegate()) {
            fieldPorter.portReturns(type, mc.getReturns(), false);
        }

        if (type.isChanged()) {
            report.recordModifiedType(type.getDocId(), type.getFilePath());
        }
    }

    private void portMember(DocsMember member) {
        if (!started.add(member.getDocId())) {
            return;
        }
        Optional<IntelliSenseXmlMember> found = intelliSense.find(member.getDocId());

        MissingComments mc;
        List<IntelliSenseXmlParam> params = null;
        List<IntelliSenseXmlParam> typeParams = null;
        DocsApi fallback = null;
        boolean fallbackIsEii = false;

        if (found.isPresent()) {
            IntelliSenseXmlMember source = found.get();
            log.debug("Porting member {}", member.getDocId());
            mc = new MissingComments();
            mc.fillEmpty(source.getSummary(),
                    member.isMethod() ? source.getReturns() : null,
                    source.getRemarks(),
                    member.isProperty() ? MissingComments.propertyValue(source.getValue(), source.getReturns()) : null);
            params = source.getParams();
            typeParams = source.getTypeParams();

            // explicitly authored text wins, inherited text only fills what is left
            if (source.isInheritDoc()) {
                if (policy.isPreserveInheritDocTag()) {
                    member.setInheritDoc(source.getInheritDocCref());
                } else {
                    Inherited inherited = inherit(mc, member, source);
                    params = merge(params, inherited.params);
                    typeParams = merge(typeParams, inherited.typeParams);
                    fallback = inherited.api;
                }
            }
        } else if (!policy.isSkipInterfaceImplementations()) {
            Optional<DocsMember> interfaced = interfaceFallback.findInterfacedMember(member);
            if (interfaced.isEmpty()) {
                return;
            }
            log.debug("Porting member {} from interface member {}", member.getDocId(), interfaced.get().getDocId());
            portFirstIfUndocumented(interfaced.get());
            mc = interfaceFallback.collect(member, interfaced.get());
            fallback = interfaced.get();
            fallbackIsEii = true;
        } else {
            return;
        }

        fieldPorter.portSummary(member, mc.getSummary(), mc.isEii());
        fieldPorter.portRemarks(member, mc.getRemarks(), mc.isEii());
        paramPorter.portParams(member, params, fallback, fallbackIsEii);
        paramPorter.portTypeParams(member, typeParams, fallback, fallbackIsEii);
        if (found.isPresent()) {
            exceptionPorter.portExceptions(member, found.get());
        }
        if (member.isProperty()) {
            fieldPorter.portProperty(member, mc.getProperty(), mc.isEii());
        } else if (member.isMethod()) {
            fieldPorter.portReturns(member, mc.getReturns(), mc.isEii());
        }

        if (member.isChanged()) {
            report.recordModifiedApi(member.getDocId(), member.getFilePath());
        }
    }

    /**
     * Fills the empty candidates of {@code mc} from the API the inherit-doc
     * marker points at: the explicit cref, looked up among the IntelliSense
     * members and then among the Docs APIs, or else the nearest Docs ancestor.
     */
    private Inherited inherit(MissingComments mc, DocsApi api, IntelliSenseXmlMember source) {
        String cref = source.getInheritDocCref();
        if (!cref.isEmpty() && !cref.equals(api.getDocId())) {
            Optional<IntelliSenseXmlMember> crefSource = intelliSense.find(cref);
            if (crefSource.isPresent()) {
                IntelliSenseXmlMember m = crefSource.get();
                mc.fillEmpty(m.getSummary(), m.getReturns(), m.getRemarks(),
                        MissingComments.propertyValue(m.getValue(), m.getReturns()));
                return new Inherited(null, m.getParams(), m.getTypeParams());
            }
            Optional<DocsApi> crefDocs = docs.find(cref);
            if (crefDocs.isPresent()) {
                return inheritFromDocs(mc, crefDocs.get());
            }
            log.debug("inheritdoc cref {} of {} does not resolve, trying ancestors", cref, api.getDocId());
        }

        Optional<? extends DocsApi> ancestor = api instanceof DocsType type
                ? inheritDocResolver.findAncestorType(type)
                : inheritDocResolver.findAncestorMember((DocsMember) api);
        if (ancestor.isPresent()) {
            return inheritFromDocs(mc, ancestor.get());
        }
        log.debug("No documented ancestor found for inheritdoc of {}", api.getDocId());
        return Inherited.NONE;
    }

    private Inherited inheritFromDocs(MissingComments mc, DocsApi ancestor) {
        portFirstIfUndocumented(ancestor);
        String remarks = ancestor.getRemarks();
        if (remarks.contains("<format")) {
            remarks = MarkupTranslator.cleanRemarks(remarks);
        }
        mc.fillEmpty(ancestor.getSummary(), ancestor.getReturns(), remarks,
                MissingComments.propertyValue(ancestor.getValue(), ancestor.getReturns()));
        return new Inherited(ancestor, List.of(), List.of());
    }

    private void portFirstIfUndocumented(DocsApi api) {
        if (!api.isUndocumented()) {
            return;
        }
        if (api instanceof DocsType type) {
            portType(type);
        } else {
            portMember((DocsMember) api);
        }
    }

    private static List<IntelliSenseXmlParam> merge(List<IntelliSenseXmlParam> own, List<IntelliSenseXmlParam> inherited) {
        if (inherited.isEmpty()) {
            return own;
        }
        List<IntelliSenseXmlParam> merged = new ArrayList<>();
        for (IntelliSenseXmlParam p : own) {
            Optional<IntelliSenseXmlParam> replacement = inherited.stream()
                    .filter(i -> i.getName().equals(p.getName()))
                    .findFirst();
            merged.add(MarkupTranslator.isDocsEmpty(p.getText()) && replacement.isPresent() ? replacement.get() : p);
        }
        for (IntelliSenseXmlParam i : inherited) {
            if (own.stream().noneMatch(p -> p.getName().equals(i.getName()))) {
                merged.add(i);
            }
        }
        return merged;
    }

    /**
     * What an inherit-doc marker resolved to besides the single-valued texts.
     */
    private static final class Inherited {
        static final Inherited NONE = new Inherited(null, List.of(), List.of());

        final DocsApi api;
        final List<IntelliSenseXmlParam> params;
        final List<IntelliSenseXmlParam> typeParams;

        Inherited(DocsApi api, List<IntelliSenseXmlParam> params, List<IntelliSenseXmlParam> typeParams) {
            this.api = api;
            this.params = params;
            this.typeParams = typeParams;
        }
    }
}
