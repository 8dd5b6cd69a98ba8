package com.apidocs.porter.config;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ApiFilterTest {

    @Test
    void testIncludeAll() {
        ApiFilter filter = ApiFilter.includeAll();

        assertThat(filter.isAssemblyIncluded("System.Runtime")).isTrue();
        assertThat(filter.isAnyAssemblyIncluded(List.of())).isTrue();
        assertThat(filter.isNamespaceIncluded("")).isTrue();
        assertThat(filter.isTypeIncluded("String", "System.String")).isTrue();
    }

    @Test
    void testAssembliesMatchByPrefix() {
        ApiFilter filter = ApiFilter.builder()
                .includedAssembly("System.Text")
                .excludedAssembly("System.Text.Json")
                .build();

        assertThat(filter.isAssemblyIncluded("System.Text.Encodings.Web")).isTrue();
        assertThat(filter.isAssemblyIncluded("System.Text.Json")).isFalse();
        assertThat(filter.isAssemblyIncluded("System.Runtime")).isFalse();
        assertThat(filter.isAnyAssemblyIncluded(List.of("System.Runtime", "System.Text.RegularExpressions"))).isTrue();
        assertThat(filter.isAnyAssemblyIncluded(List.of())).isFalse();
    }

    @Test
    void testNamespacesMatchByPrefix() {
        ApiFilter filter = ApiFilter.builder()
                .includedNamespace("System.IO")
                .excludedNamespace("System.IO.Pipes")
                .build();

        assertThat(filter.isNamespaceIncluded("System.IO.Compression")).isTrue();
        assertThat(filter.isNamespaceIncluded("System.IO.Pipes")).isFalse();
        assertThat(filter.isNamespaceIncluded("System.Net")).isFalse();
        assertThat(filter.isNamespaceIncluded(null)).isFalse();
    }

    @Test
    void testTypesMatchSimpleOrFullName() {
        ApiFilter filter = ApiFilter.builder()
                .includedType("System.IO.Stream")
                .includedType("Path")
                .excludedType("File")
                .build();

        assertThat(filter.isTypeIncluded("Stream", "System.IO.Stream")).isTrue();
        assertThat(filter.isTypeIncluded("Path", "System.IO.Path")).isTrue();
        assertThat(filter.isTypeIncluded("Directory", "System.IO.Directory")).isFalse();

        ApiFilter excludeOnly = ApiFilter.builder().excludedType("System.IO.File").build();
        assertThat(excludeOnly.isTypeIncluded("File", "System.IO.File")).isFalse();
        assertThat(excludeOnly.isTypeIncluded("Directory", "System.IO.Directory")).isTrue();
    }
}
