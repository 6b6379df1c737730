package com.codegraph.core.service.parse;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of one node of a concrete syntax tree.
 *
 * Node types and field names follow the tree-sitter grammars ({@code function_definition},
 * field {@code name}, and so on). Points are 0-based.
 */
public interface SyntaxNode {

    String getType();

    /**
     * Source text covered by this node, never null.
     */
    String getText();

    Point getStartPoint();

    Point getEndPoint();

    List<SyntaxNode> getChildren();

    /**
     * First child attached under the given field name.
     */
    Optional<SyntaxNode> getChildByFieldName(String fieldName);

    /**
     * All children attached under the given field name, in source order.
     */
    List<SyntaxNode> getChildrenByFieldName(String fieldName);

    default List<SyntaxNode> getChildrenOfType(String type) {
        return getChildren().stream()
                .filter(child -> type.equals(child.getType()))
                .toList();
    }

    default Optional<SyntaxNode> getFirstChild() {
        List<SyntaxNode> children = getChildren();
        return children.isEmpty() ? Optional.empty() : Optional.of(children.get(0));
    }

    /**
     * Pre-order walk collecting every descendant (excluding this node) of the given type.
     */
    default List<SyntaxNode> getDescendantsOfType(String type) {
        List<SyntaxNode> matches = new ArrayList<>();
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        pushReversed(stack, getChildren());
        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            if (type.equals(node.getType())) {
                matches.add(node);
            }
            pushReversed(stack, node.getChildren());
        }
        return matches;
    }

    private static void pushReversed(Deque<SyntaxNode> stack, List<SyntaxNode> nodes) {
        for (int i = nodes.size() - 1; i >= 0; i--) {
            stack.push(nodes.get(i));
        }
    }

    /**
     * 0-based row and column; the column counts UTF-8 bytes.
     */
    record Point(int row, int column) {
    }
}
