package com.codegraph.core.service.api.controller;

import com.codegraph.core.service.api.dto.ApiResponse;
import com.codegraph.core.service.model.Edge;
import com.codegraph.core.service.model.Symbol;
import com.codegraph.core.service.store.GraphDocument;
import com.codegraph.core.service.store.GraphExportService;
import com.codegraph.core.service.store.GraphExportService.ExportFormat;
import com.codegraph.core.service.store.GraphImportData;
import com.codegraph.core.service.store.GraphStore;
import com.codegraph.core.service.store.ImportSummary;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.ByteArrayOutputStream;
import java.util.List;
import java.util.Map;

/**
 * Controller for graph queries, export, import and deletion.
 */
@Slf4j
@RestController
@RequestMapping("/repos")
@Tag(name = "Code Graph", description = "Endpoints for querying and managing repository code graphs")
@RequiredArgsConstructor
public class GraphController {

    private final GraphStore graphStore;
    private final GraphExportService exportService;

    // ==================== Lookups ====================

    @GetMapping("/{repoId}/symbols")
    @Operation(summary = "List symbols", description = "Returns the symbols of a repository, optionally of one file")
    public ResponseEntity<ApiResponse<List<Symbol>>> getSymbols(
            @Parameter(description = "Repository ID") @PathVariable String repoId,
            @Parameter(description = "Repository-relative file path") @RequestParam(required = false) String file) {
        List<Symbol> symbols = file != null
                ? graphStore.getSymbolsByFile(repoId, file)
                : graphStore.getSymbolsByRepo(repoId);
        log.debug("Returning {} symbols for {}", symbols.size(), repoId);
        return ResponseEntity.ok(ApiResponse.success(symbols));
    }

    @GetMapping("/{repoId}/symbols/{symbolId}")
    @Operation(summary = "Get symbol by ID")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Symbol found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Symbol not found")
    })
    public ResponseEntity<ApiResponse<Symbol>> getSymbol(
            @Parameter(description = "Repository ID") @PathVariable String repoId,
            @Parameter(description = "Symbol ID") @PathVariable String symbolId) {
        return graphStore.getSymbol(symbolId)
                .filter(symbol -> repoId.equals(symbol.repoId()))
                .map(symbol -> ResponseEntity.ok(ApiResponse.success(symbol)))
                .orElseGet(() -> symbolNotFound(symbolId));
    }

    @GetMapping("/{repoId}/edges")
    @Operation(summary = "List edges", description = "Returns every stored edge of a repository, resolved or not")
    public ResponseEntity<ApiResponse<List<Edge>>> getEdges(
            @Parameter(description = "Repository ID") @PathVariable String repoId) {
        return ResponseEntity.ok(ApiResponse.success(graphStore.getEdgesByRepo(repoId)));
    }

    // ==================== Analytical Queries ====================

    @GetMapping("/{repoId}/call-graph")
    @Operation(summary = "Call graph", description = "Maps each caller name to the names it calls, in call-site order")
    public ResponseEntity<ApiResponse<Map<String, List<String>>>> getCallGraph(
            @Parameter(description = "Repository ID") @PathVariable String repoId) {
        return ResponseEntity.ok(ApiResponse.success(graphStore.callGraph(repoId)));
    }

    @GetMapping("/{repoId}/orphans")
    @Operation(summary = "Orphan symbols", description = "Symbols with no incoming relationship, modules excluded")
    public ResponseEntity<ApiResponse<List<Symbol>>> getOrphans(
            @Parameter(description = "Repository ID") @PathVariable String repoId) {
        return ResponseEntity.ok(ApiResponse.success(graphStore.orphanSymbols(repoId)));
    }

    @GetMapping("/{repoId}/cycles")
    @Operation(summary = "Dependency cycles", description = "Cycles as lists of symbol names, first name repeated at the end")
    public ResponseEntity<ApiResponse<List<List<String>>>> getCycles(
            @Parameter(description = "Repository ID") @PathVariable String repoId) {
        return ResponseEntity.ok(ApiResponse.success(graphStore.cycles(repoId)));
    }

    @GetMapping("/{repoId}/endpoints-without-validation")
    @Operation(summary = "Functions without validation",
               description = "Functions with parameters that call nothing named like validate or check")
    public ResponseEntity<ApiResponse<List<Symbol>>> getEndpointsWithoutValidation(
            @Parameter(description = "Repository ID") @PathVariable String repoId) {
        return ResponseEntity.ok(ApiResponse.success(graphStore.endpointsWithoutValidation(repoId)));
    }

    // ==================== Export / Import ====================

    @GetMapping("/{repoId}/export")
    @Operation(summary = "Export graph", description = "Exports the repository graph as GraphML or JSON")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Graph exported"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Unsupported format")
    })
    public ResponseEntity<byte[]> export(
            @Parameter(description = "Repository ID") @PathVariable String repoId,
            @Parameter(description = "Export format: 'graphml' or 'json'")
            @RequestParam(defaultValue = "graphml") String format) {
        ExportFormat exportFormat = ExportFormat.fromValue(format);
        GraphDocument document = graphStore.export(repoId);

        var out = new ByteArrayOutputStream();
        exportService.write(document, exportFormat, out);

        log.info("Exported repository {} as {} ({} nodes, {} links)",
                repoId, exportFormat.getExtension(), document.nodes().size(), document.links().size());
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(exportFormat.getContentType()))
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        "attachment; filename=\"" + repoId + "." + exportFormat.getExtension() + "\"")
                .body(out.toByteArray());
    }

    @PostMapping("/import")
    @Operation(summary = "Import graph", description = "Bulk-imports a JSON graph document produced by export")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Graph imported"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid document")
    })
    public ResponseEntity<ApiResponse<ImportSummary>> importGraph(@RequestBody GraphDocument document) {
        if (document.repoId() == null || document.repoId().isBlank()) {
            throw new IllegalArgumentException("Graph document has no repoId");
        }
        GraphImportData data = GraphImportData.fromDocument(document);
        return ResponseEntity.ok(ApiResponse.success(graphStore.importBulk(data)));
    }

    // ==================== Deletion ====================

    @DeleteMapping("/{repoId}")
    @Operation(summary = "Delete repository graph", description = "Removes every symbol and edge of a repository")
    public ResponseEntity<ApiResponse<DeleteResponse>> deleteRepository(
            @Parameter(description = "Repository ID") @PathVariable String repoId) {
        long deleted = graphStore.deleteRepository(repoId);
        log.info("Deleted repository {} ({} symbols)", repoId, deleted);
        return ResponseEntity.ok(ApiResponse.success(new DeleteResponse(repoId, deleted)));
    }

    // ==================== Response Builders ====================

    private <T> ResponseEntity<ApiResponse<T>> symbolNotFound(String symbolId) {
        log.warn("Symbol not found: {}", symbolId);
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error("Symbol not found", "SYMBOL_NOT_FOUND", null, symbolId));
    }

    /**
     * Response for repository deletion.
     */
    public record DeleteResponse(String repoId, long symbolsDeleted) {}
}
