package com.apidocs.porter.porting;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

import com.apidocs.porter.docid.DocIds;
import com.apidocs.porter.docs.DocsCommentsContainer;
import com.apidocs.porter.docs.DocsMember;
import com.apidocs.porter.docs.DocsType;

import lombok.RequiredArgsConstructor;

/**
 * Finds the Docs API an inherit-doc marker points at when no explicit cref
 * resolves: the nearest loaded ancestor, walking base types before interfaces.
 *
 * The walk goes through DocId lookups in the container, never through object
 * references, and visits every type at most once, so self-referencing or
 * mutually referencing base types terminate. A base name that is not loaded
 * ends that branch of the walk.
 */
@RequiredArgsConstructor
class InheritDocResolver {

    private final DocsCommentsContainer docs;

    Optional<DocsType> findAncestorType(DocsType type) {
        Deque<String> pending = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        visited.add(type.getDocId());
        enqueueAncestors(type, pending);

        while (!pending.isEmpty()) {
            String typeDocId = pending.removeFirst();
            if (!visited.add(typeDocId)) {
                continue;
            }
            Optional<DocsType> found = docs.findType(typeDocId);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    /**
     * Member with the same signature in the nearest ancestor type declaring it,
     * or else the interface member the member implements.
     */
    Optional<DocsMember> findAncestorMember(DocsMember member) {
        DocsType declaringType = member.getParentType();
        String suffix = DocIds.memberSuffix(member.getDocId(), declaringType.getDocId());
        String prefix = DocIds.prefixOf(member.getDocId());

        if (!suffix.isEmpty()) {
            Deque<String> pending = new ArrayDeque<>();
            Set<String> visited = new HashSet<>();
            visited.add(declaringType.getDocId());
            enqueueAncestors(declaringType, pending);

            while (!pending.isEmpty()) {
                String typeDocId = pending.removeFirst();
                if (!visited.add(typeDocId)) {
                    continue;
                }
                Optional<DocsMember> candidate = docs.findMember(prefix + DocIds.stripPrefix(typeDocId) + suffix);
                if (candidate.isPresent()) {
                    return candidate;
                }
                docs.findType(typeDocId).ifPresent(t -> enqueueAncestors(t, pending));
            }
        }

        String interfaceMember = member.getImplementsInterfaceMember();
        if (!interfaceMember.isEmpty() && !interfaceMember.equals(member.getDocId())) {
            return docs.findMember(interfaceMember);
        }
        return Optional.empty();
    }

    private static void enqueueAncestors(DocsType type, Deque<String> pending) {
        String baseTypeName = type.getBaseTypeName();
        if (!baseTypeName.isEmpty()) {
            pending.addLast(DocIds.typeDocIdOf(baseTypeName));
        }
        for (String interfaceName : type.getInterfaceNames()) {
            pending.addLast(DocIds.typeDocIdOf(interfaceName));
        }
    }
}
