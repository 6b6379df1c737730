package com.codegraph.core.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;

/**
 * Renders exported graph documents as GraphML or JSON, and reads the JSON form back.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GraphExportService {

    private static final String GRAPHML_NS = "http://graphml.graphdrawing.org/xmlns";
    private static final String XSI_NS = "http://www.w3.org/2001/XMLSchema-instance";
    private static final String GRAPHML_SCHEMA = GRAPHML_NS + " " + GRAPHML_NS + "/1.0/graphml.xsd";

    private final ObjectMapper objectMapper;

    /**
     * Supported export formats.
     */
    public enum ExportFormat {
        GRAPHML("application/graphml+xml", "graphml"),
        JSON("application/json", "json");

        private final String contentType;
        private final String extension;

        ExportFormat(String contentType, String extension) {
            this.contentType = contentType;
            this.extension = extension;
        }

        public String getContentType() {
            return contentType;
        }

        public String getExtension() {
            return extension;
        }

        public static ExportFormat fromValue(String value) {
            return Arrays.stream(values())
                    .filter(format -> format.name().equalsIgnoreCase(value))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Unsupported export format: " + value + " (expected graphml or json)"));
        }
    }

    // ==================== Public API ====================

    public void write(GraphDocument document, ExportFormat format, OutputStream out) {
        switch (format) {
            case GRAPHML -> writeGraphMl(document, out);
            case JSON -> writeJson(document, out);
        }
        log.debug("Exported repository {} as {} ({} nodes, {} links)",
                document.repoId(), format.name().toLowerCase(Locale.ROOT),
                document.nodes().size(), document.links().size());
    }

    public GraphDocument readJson(InputStream in) {
        try {
            return objectMapper.readValue(in, GraphDocument.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read graph document", e);
        }
    }

    // ==================== JSON ====================

    private void writeJson(GraphDocument document, OutputStream out) {
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(out, document);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write graph document", e);
        }
    }

    // ==================== GraphML ====================

    private void writeGraphMl(GraphDocument document, OutputStream out) {
        try {
            XMLStreamWriter xml = XMLOutputFactory.newFactory()
                    .createXMLStreamWriter(out, StandardCharsets.UTF_8.name());
            xml.writeStartDocument(StandardCharsets.UTF_8.name(), "1.0");
            xml.writeStartElement("graphml");
            xml.writeDefaultNamespace(GRAPHML_NS);
            xml.writeNamespace("xsi", XSI_NS);
            xml.writeAttribute("xsi", XSI_NS, "schemaLocation", GRAPHML_SCHEMA);

            writeKey(xml, "name", "node", "name");
            writeKey(xml, "type", "node", "type");
            writeKey(xml, "file_path", "node", "file_path");
            writeKey(xml, "language", "node", "language");
            writeKey(xml, "start_line", "node", "start_line");
            writeKey(xml, "end_line", "node", "end_line");
            writeKey(xml, "parent_id", "node", "parent_id");
            writeKey(xml, "relationship_type", "edge", "type");

            xml.writeStartElement("graph");
            xml.writeAttribute("id", document.repoId() != null ? document.repoId() : "G");
            xml.writeAttribute("edgedefault", document.directed() ? "directed" : "undirected");

            for (GraphDocument.Node node : document.nodes()) {
                writeNode(xml, node);
            }
            for (GraphDocument.Link link : document.links()) {
                writeLink(xml, link);
            }

            xml.writeEndElement();
            xml.writeEndElement();
            xml.writeEndDocument();
            xml.flush();
            xml.close();
        } catch (XMLStreamException e) {
            throw new IllegalStateException("Cannot write GraphML for repository " + document.repoId(), e);
        }
    }

    private void writeKey(XMLStreamWriter xml, String id, String target, String name) throws XMLStreamException {
        xml.writeEmptyElement("key");
        xml.writeAttribute("id", id);
        xml.writeAttribute("for", target);
        xml.writeAttribute("attr.name", name);
        xml.writeAttribute("attr.type", id.endsWith("_line") ? "int" : "string");
    }

    private void writeNode(XMLStreamWriter xml, GraphDocument.Node node) throws XMLStreamException {
        xml.writeStartElement("node");
        xml.writeAttribute("id", node.id());
        writeData(xml, "name", node.name());
        writeData(xml, "type", node.kind() != null ? node.kind().getValue() : null);
        writeData(xml, "file_path", node.filePath());
        writeData(xml, "language", node.language() != null ? node.language().getValue() : null);
        writeData(xml, "start_line", node.startLine());
        writeData(xml, "end_line", node.endLine());
        writeData(xml, "parent_id", node.parentId());
        xml.writeEndElement();
    }

    private void writeLink(XMLStreamWriter xml, GraphDocument.Link link) throws XMLStreamException {
        xml.writeStartElement("edge");
        xml.writeAttribute("id", link.id());
        xml.writeAttribute("source", link.source());
        xml.writeAttribute("target", link.target());
        writeData(xml, "relationship_type", link.kind().getValue());
        xml.writeEndElement();
    }

    private void writeData(XMLStreamWriter xml, String key, Object value) throws XMLStreamException {
        if (value == null) {
            return;
        }
        xml.writeStartElement("data");
        xml.writeAttribute("key", key);
        xml.writeCharacters(String.valueOf(value));
        xml.writeEndElement();
    }
}
