package com.apidocs.porter.intellisense;

import java.nio.file.Path;

import org.junit.jupiter.api.Test;

import com.apidocs.porter.config.ApiFilter;
import com.apidocs.porter.core.context.ToolDiagnostics;
import com.apidocs.porter.xml.XmlFragments;

import static org.assertj.core.api.Assertions.*;

class IntelliSenseCommentsContainerTest {

    private static final String MY_ASSEMBLY = """
            <doc>
              <assembly>
                <name>MyAssembly</name>
              </assembly>
              <members>
                <member name="M:MyNamespace.MyType.MyMethod``1(System.Int32)">
                  <summary>
                    Multi line
                    summary.
                  </summary>
                  <typeparam name="T">The element type.</typeparam>
                  <param name="count">The <see cref="T:System.Int32"/> count.</param>
                  <returns>The result.</returns>
                  <exception cref="T:System.ArgumentOutOfRangeException"><paramref name="count" /> is negative.</exception>
                  <inheritdoc cref="M:MyNamespace.IMyInterface.MyMethod``1(System.Int32)" />
                  <example>Ignored.</example>
                </member>
                <member name="P:MyNamespace.MyType.Count">
                  <value>The count.</value>
                </member>
                <member name="NotADocId">
                  <summary>Skipped.</summary>
                </member>
              </members>
            </doc>
            """;

    private final ToolDiagnostics diagnostics = new ToolDiagnostics();

    @Test
    void testLoadParsesMemberFields() throws Exception {
        IntelliSenseCommentsContainer container = new IntelliSenseCommentsContainer(ApiFilter.includeAll(), diagnostics);

        int added = container.load(XmlFragments.parseDocument(MY_ASSEMBLY), Path.of("MyAssembly.xml"));

        assertThat(added).isEqualTo(2);
        IntelliSenseXmlMember method = container.find("M:MyNamespace.MyType.MyMethod``1(System.Int32)").orElseThrow();
        assertThat(method.getAssembly()).isEqualTo("MyAssembly");
        assertThat(method.getSummary()).isEqualTo("Multi line\nsummary.");
        assertThat(method.getReturns()).isEqualTo("The result.");
        assertThat(method.getRemarks()).isEmpty();
        assertThat(method.findTypeParam("T").orElseThrow().getText()).isEqualTo("The element type.");
        assertThat(method.findParam("count").orElseThrow().getText())
                .isEqualTo("The <see cref=\"T:System.Int32\" /> count.");
        assertThat(method.getExceptions()).hasSize(1);
        assertThat(method.getExceptions().get(0).getCref()).isEqualTo("T:System.ArgumentOutOfRangeException");
        assertThat(method.isInheritDoc()).isTrue();
        assertThat(method.hasInheritDocCref()).isTrue();
        assertThat(method.getInheritDocCref()).isEqualTo("M:MyNamespace.IMyInterface.MyMethod``1(System.Int32)");

        assertThat(container.find("P:MyNamespace.MyType.Count").orElseThrow().getValue()).isEqualTo("The count.");
        assertThat(diagnostics.getWarnings()).anyMatch(w -> w.contains("'NotADocId'"));
    }

    @Test
    void testFirstDuplicateWins() throws Exception {
        IntelliSenseCommentsContainer container = new IntelliSenseCommentsContainer(ApiFilter.includeAll(), diagnostics);
        container.load(XmlFragments.parseDocument(MY_ASSEMBLY), Path.of("first", "MyAssembly.xml"));

        int added = container.load(XmlFragments.parseDocument(MY_ASSEMBLY.replace("The count.", "Other count.")),
                Path.of("second", "MyAssembly.xml"));

        assertThat(added).isZero();
        assertThat(container.size()).isEqualTo(2);
        assertThat(container.find("P:MyNamespace.MyType.Count").orElseThrow().getValue()).isEqualTo("The count.");
        assertThat(diagnostics.getWarnings())
                .anyMatch(w -> w.startsWith("Duplicate IntelliSense member P:MyNamespace.MyType.Count"));
    }

    @Test
    void testNonIntelliSenseDocumentIsReported() throws Exception {
        IntelliSenseCommentsContainer container = new IntelliSenseCommentsContainer(ApiFilter.includeAll(), diagnostics);

        int added = container.load(XmlFragments.parseDocument("<Type Name=\"MyType\" />"), Path.of("MyType.xml"));

        assertThat(added).isZero();
        assertThat(container.isEmpty()).isTrue();
        assertThat(diagnostics.getErrors()).containsExactly("Not an IntelliSense xml file, skipped: MyType.xml");
        assertThat(diagnostics.getSkippedFiles()).hasSize(1);
    }

    @Test
    void testExcludedAssemblyIsSkipped() throws Exception {
        ApiFilter filter = ApiFilter.builder().excludedAssembly("MyAss").build();
        IntelliSenseCommentsContainer container = new IntelliSenseCommentsContainer(filter, diagnostics);

        container.load(XmlFragments.parseDocument(MY_ASSEMBLY), Path.of("MyAssembly.xml"));

        assertThat(container.isEmpty()).isTrue();
        assertThat(diagnostics.hasErrors()).isFalse();
    }

    @Test
    void testNamespaceAndTypeFiltersApplyAtLoad() throws Exception {
        String xml = """
                <doc>
                  <assembly>
                    <name>MyAssembly</name>
                  </assembly>
                  <members>
                    <member name="T:MyNamespace.MyType">
                      <summary>Kept.</summary>
                    </member>
                    <member name="M:MyNamespace.MyType.Run(System.String)">
                      <summary>Kept.</summary>
                    </member>
                    <member name="T:MyNamespace.Hidden">
                      <summary>Excluded type.</summary>
                    </member>
                    <member name="P:MyNamespace.Hidden.Count">
                      <summary>Member of an excluded type.</summary>
                    </member>
                    <member name="T:MyNamespace.Internal.Helper">
                      <summary>Excluded namespace.</summary>
                    </member>
                    <member name="T:MyNamespace.MyList`1">
                      <summary>Generic types are left to the Docs side.</summary>
                    </member>
                  </members>
                </doc>
                """;
        ApiFilter filter = ApiFilter.builder()
                .excludedNamespace("MyNamespace.Internal")
                .excludedType("Hidden")
                .build();
        IntelliSenseCommentsContainer container = new IntelliSenseCommentsContainer(filter, diagnostics);

        container.load(XmlFragments.parseDocument(xml), Path.of("MyAssembly.xml"));

        assertThat(container.getMembers())
                .extracting(IntelliSenseXmlMember::getName)
                .containsExactly("T:MyNamespace.MyType", "M:MyNamespace.MyType.Run(System.String)",
                        "T:MyNamespace.MyList`1");
    }
}
