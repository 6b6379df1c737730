package com.codegraph.core.service.store;

import com.codegraph.core.service.model.EdgeKind;
import com.codegraph.core.service.model.Language;
import com.codegraph.core.service.model.SymbolKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphExportServiceTest {

    private final GraphExportService exportService = new GraphExportService(new ObjectMapper());

    private final GraphDocument document = GraphDocument.of("repo-1",
            List.of(
                    new GraphDocument.Node("s1", "Foo", SymbolKind.CLASS, "a.py", Language.PYTHON, 1, 8, null,
                            Map.of()),
                    new GraphDocument.Node("s2", "bar", SymbolKind.METHOD, "a.py", Language.PYTHON, 2, 4, "s1",
                            Map.of("parameters", List.of("self")))),
            List.of(new GraphDocument.Link("e1", "s1", "s2", EdgeKind.CONTAINS, Map.of())));

    @Test
    void graphMlContainsNodesEdgesAndKeys() throws Exception {
        var out = new ByteArrayOutputStream();
        exportService.write(document, GraphExportService.ExportFormat.GRAPHML, out);

        var factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        Document xml = factory.newDocumentBuilder().parse(new ByteArrayInputStream(out.toByteArray()));

        Element root = xml.getDocumentElement();
        assertThat(root.getLocalName()).isEqualTo("graphml");
        assertThat(root.getNamespaceURI()).isEqualTo("http://graphml.graphdrawing.org/xmlns");

        Element graph = (Element) root.getElementsByTagNameNS("*", "graph").item(0);
        assertThat(graph.getAttribute("id")).isEqualTo("repo-1");
        assertThat(graph.getAttribute("edgedefault")).isEqualTo("directed");

        NodeList nodes = root.getElementsByTagNameNS("*", "node");
        assertThat(nodes.getLength()).isEqualTo(2);
        assertThat(((Element) nodes.item(1)).getAttribute("id")).isEqualTo("s2");

        Element edge = (Element) root.getElementsByTagNameNS("*", "edge").item(0);
        assertThat(edge.getAttribute("source")).isEqualTo("s1");
        assertThat(edge.getAttribute("target")).isEqualTo("s2");
        assertThat(edge.getTextContent()).isEqualTo("contains");

        assertThat(root.getElementsByTagNameNS("*", "key").getLength()).isEqualTo(8);
    }

    @Test
    void graphMlOmitsNullData() {
        var out = new ByteArrayOutputStream();
        exportService.write(document, GraphExportService.ExportFormat.GRAPHML, out);

        String xml = out.toString(StandardCharsets.UTF_8);
        assertThat(xml).contains("<data key=\"parent_id\">s1</data>");
        assertThat(xml.split("key=\"parent_id\"", -1)).hasSize(2);
    }

    @Test
    void jsonExportReadsBack() {
        var out = new ByteArrayOutputStream();
        exportService.write(document, GraphExportService.ExportFormat.JSON, out);

        GraphDocument read = exportService.readJson(new ByteArrayInputStream(out.toByteArray()));

        assertThat(read).isEqualTo(document);
    }

    @Test
    void formatLookupIsCaseInsensitive() {
        assertThat(GraphExportService.ExportFormat.fromValue("GraphML"))
                .isEqualTo(GraphExportService.ExportFormat.GRAPHML);
        assertThat(GraphExportService.ExportFormat.fromValue("json").getContentType())
                .isEqualTo("application/json");
        assertThatThrownBy(() -> GraphExportService.ExportFormat.fromValue("csv"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("csv");
    }
}
