package com.apidocs.porter.report;

import java.nio.file.Path;

import org.junit.jupiter.api.Test;

import com.apidocs.porter.config.ApiFilter;
import com.apidocs.porter.core.context.ToolDiagnostics;
import com.apidocs.porter.docs.DocsCommentsContainer;
import com.apidocs.porter.io.DocsXmlWriter;
import com.apidocs.porter.io.LoadedXmlDocument;
import com.apidocs.porter.io.XmlDocumentLoader;

import static org.assertj.core.api.Assertions.*;

class UndocumentedApiCensusTest {

    @Test
    void testCountsEmptyAndMissingFields() throws Exception {
        DocsCommentsContainer docs = new DocsCommentsContainer(ApiFilter.includeAll(), new ToolDiagnostics());
        docs.load(new XmlDocumentLoader().fromString("""
                <Type Name="MyType&lt;T&gt;" FullName="MyNamespace.MyType&lt;T&gt;">
                  <TypeSignature Language="DocId" Value="T:MyNamespace.MyType`1" />
                  <TypeParameters>
                    <TypeParameter Name="T" />
                  </TypeParameters>
                  <Docs>
                    <summary>To be added.</summary>
                  </Docs>
                  <Members>
                    <Member MemberName="Parse">
                      <MemberSignature Language="DocId" Value="M:MyNamespace.MyType`1.Parse(System.String,System.Int32)" />
                      <MemberType>Method</MemberType>
                      <ReturnValue>
                        <ReturnType>System.Boolean</ReturnType>
                      </ReturnValue>
                      <Parameters>
                        <Parameter Name="text" Type="System.String" />
                        <Parameter Name="start" Type="System.Int32" />
                      </Parameters>
                      <Docs>
                        <param name="text">The text.</param>
                        <summary>Parses text.</summary>
                        <returns>To be added.</returns>
                        <exception cref="T:System.FormatException">To be added.</exception>
                      </Docs>
                    </Member>
                    <Member MemberName="Clear">
                      <MemberSignature Language="DocId" Value="M:MyNamespace.MyType`1.Clear" />
                      <MemberType>Method</MemberType>
                      <ReturnValue>
                        <ReturnType>System.Void</ReturnType>
                      </ReturnValue>
                      <Docs>
                        <summary>Clears the instance.</summary>
                      </Docs>
                    </Member>
                    <Member MemberName="Length">
                      <MemberSignature Language="DocId" Value="P:MyNamespace.MyType`1.Length" />
                      <MemberType>Property</MemberType>
                      <Docs>
                        <summary>To be added.</summary>
                        <value>To be added.</value>
                      </Docs>
                    </Member>
                  </Members>
                </Type>
                """, Path.of("MyType`1.xml")));

        UndocumentedApiCensus census = UndocumentedApiCensus.take(docs);

        assertThat(census.getTypeSummaries()).isEqualTo(1);
        assertThat(census.getMemberSummaries()).isEqualTo(1);
        assertThat(census.getMemberReturns()).isEqualTo(1);
        assertThat(census.getMemberProperties()).isEqualTo(1);
        assertThat(census.getParams()).isEqualTo(1);
        assertThat(census.getTypeParams()).isEqualTo(1);
        assertThat(census.getExceptions()).isEqualTo(1);
        assertThat(census.getTotal()).isEqualTo(7);
        assertThat(census.getEntries()).containsExactly(
                "summary: T:MyNamespace.MyType`1",
                "typeparam T (missing): T:MyNamespace.MyType`1",
                "returns: M:MyNamespace.MyType`1.Parse(System.String,System.Int32)",
                "param start (missing): M:MyNamespace.MyType`1.Parse(System.String,System.Int32)",
                "exception T:System.FormatException: M:MyNamespace.MyType`1.Parse(System.String,System.Int32)",
                "summary: P:MyNamespace.MyType`1.Length",
                "value: P:MyNamespace.MyType`1.Length");
    }

    @Test
    void testCensusLeavesDocumentsWithoutDocsUntouched() throws Exception {
        DocsCommentsContainer docs = new DocsCommentsContainer(ApiFilter.includeAll(), new ToolDiagnostics());
        LoadedXmlDocument loaded = new XmlDocumentLoader().fromString("""
                <Type Name="MyType" FullName="MyNamespace.MyType">
                  <TypeSignature Language="DocId" Value="T:MyNamespace.MyType" />
                  <Members>
                    <Member MemberName="Run">
                      <MemberSignature Language="DocId" Value="M:MyNamespace.MyType.Run(System.String)" />
                      <MemberType>Method</MemberType>
                      <ReturnValue>
                        <ReturnType>System.Int32</ReturnType>
                      </ReturnValue>
                      <Parameters>
                        <Parameter Name="name" Type="System.String" />
                      </Parameters>
                    </Member>
                  </Members>
                </Type>
                """, Path.of("MyType.xml"));
        docs.load(loaded);
        DocsXmlWriter writer = new DocsXmlWriter();
        String before = writer.serialize(loaded);

        UndocumentedApiCensus.take(docs);

        assertThat(writer.serialize(loaded)).isEqualTo(before).doesNotContain("<Docs");
        assertThat(docs.getChangedFiles()).isEmpty();
    }
}
