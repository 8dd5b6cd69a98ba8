package com.apidocs.porter.config;

import java.util.Collection;
import java.util.Set;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Decides which APIs take part in a porting run.
 *
 * Assemblies and namespaces match by prefix, types by exact simple or full
 * name. An empty include set means everything is included. Excludes always win.
 */
@Value
@Builder
public class ApiFilter {

    @Singular
    Set<String> includedAssemblies;

    @Singular
    Set<String> excludedAssemblies;

    @Singular
    Set<String> includedNamespaces;

    @Singular
    Set<String> excludedNamespaces;

    @Singular
    Set<String> includedTypes;

    @Singular
    Set<String> excludedTypes;

    public static ApiFilter includeAll() {
        return ApiFilter.builder().build();
    }

    public boolean isAssemblyIncluded(String assemblyName) {
        if (assemblyName == null) {
            return includedAssemblies.isEmpty();
        }
        if (anyPrefix(excludedAssemblies, assemblyName)) {
            return false;
        }
        return includedAssemblies.isEmpty() || anyPrefix(includedAssemblies, assemblyName);
    }

    /**
     * True if at least one of the assemblies is included. Docs types list every
     * assembly (and version) they ship in, so any match is enough.
     */
    public boolean isAnyAssemblyIncluded(Collection<String> assemblyNames) {
        if (assemblyNames.isEmpty()) {
            return includedAssemblies.isEmpty();
        }
        for (String name : assemblyNames) {
            if (isAssemblyIncluded(name)) {
                return true;
            }
        }
        return false;
    }

    public boolean isNamespaceIncluded(String namespace) {
        String ns = namespace == null ? "" : namespace;
        if (anyPrefix(excludedNamespaces, ns)) {
            return false;
        }
        return includedNamespaces.isEmpty() || anyPrefix(includedNamespaces, ns);
    }

    public boolean isTypeIncluded(String simpleName, String fullName) {
        if (excludedTypes.contains(simpleName) || excludedTypes.contains(fullName)) {
            return false;
        }
        return includedTypes.isEmpty() || includedTypes.contains(simpleName) || includedTypes.contains(fullName);
    }

    private static boolean anyPrefix(Set<String> prefixes, String value) {
        for (String prefix : prefixes) {
            if (value.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
