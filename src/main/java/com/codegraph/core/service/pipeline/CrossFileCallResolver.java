package com.codegraph.core.service.pipeline;

import com.codegraph.core.service.extract.SymbolIds;
import com.codegraph.core.service.ingest.ParseUnit;
import com.codegraph.core.service.model.Edge;
import com.codegraph.core.service.model.EdgeKind;
import com.codegraph.core.service.model.Symbol;
import com.codegraph.core.service.model.SymbolKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves calls whose callee was not defined in the calling file.
 *
 * Matching is by name only: the first function or method with the callee's name, in file
 * order, wins. A {@code callee_kind} of {@code method} restricts matches to methods.
 */
@Slf4j
@Component
public class CrossFileCallResolver {

    private static final String CALLEE_KIND_METHOD = SymbolKind.METHOD.getValue();

    /**
     * Resolved edges plus the number of calls left without a target.
     */
    public record Resolution(List<Edge> resolved, int unresolved) {

        public Resolution {
            resolved = List.copyOf(resolved);
        }
    }

    public Resolution resolve(List<ParseUnit> units, List<Edge> unresolvedCalls) {
        Map<String, List<Symbol>> callablesByName = indexCallables(units);

        List<Edge> resolved = new ArrayList<>();
        int unresolved = 0;
        for (Edge call : unresolvedCalls) {
            Optional<Edge> edge = resolveCall(call, callablesByName);
            if (edge.isPresent()) {
                resolved.add(edge.get());
            } else {
                unresolved++;
                log.debug("No target for call to '{}' from {}", call.attributes().get(Edge.ATTR_CALLEE), call.sourceId());
            }
        }
        return new Resolution(resolved, unresolved);
    }

    private Optional<Edge> resolveCall(Edge call, Map<String, List<Symbol>> callablesByName) {
        if (call.kind() != EdgeKind.CALLS || call.isResolved()) {
            return Optional.empty();
        }
        Object callee = call.attributes().get(Edge.ATTR_CALLEE);
        if (callee == null) {
            return Optional.empty();
        }
        boolean methodsOnly = CALLEE_KIND_METHOD.equals(call.attributes().get(Edge.ATTR_CALLEE_KIND));

        return callablesByName.getOrDefault(callee.toString(), List.of()).stream()
                .filter(symbol -> !methodsOnly || symbol.kind() == SymbolKind.METHOD)
                .findFirst()
                .map(target -> toResolvedEdge(call, target));
    }

    private Edge toResolvedEdge(Edge call, Symbol target) {
        return call.toBuilder()
                .id(SymbolIds.resolvedEdgeId(call.id(), target.id()))
                .targetId(target.id())
                .build();
    }

    private Map<String, List<Symbol>> indexCallables(List<ParseUnit> units) {
        Map<String, List<Symbol>> index = new HashMap<>();
        units.stream()
                .filter(ParseUnit::isExtracted)
                .flatMap(unit -> unit.getSymbols().stream())
                .filter(Objects::nonNull)
                .filter(symbol -> symbol.kind().isCallable())
                .forEach(symbol -> index.computeIfAbsent(symbol.name(), k -> new ArrayList<>()).add(symbol));
        return index;
    }
}
