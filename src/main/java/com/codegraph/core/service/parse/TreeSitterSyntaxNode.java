package com.codegraph.core.service.parse;

import org.treesitter.TSNode;
import org.treesitter.TSPoint;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link SyntaxNode} view over a tree-sitter node.
 *
 * Children are the named children only; punctuation and keywords are left out. Text is sliced
 * from the UTF-8 bytes the tree was parsed from, and columns count bytes.
 */
final class TreeSitterSyntaxNode implements SyntaxNode {

    private final TSNode node;
    private final byte[] source;

    TreeSitterSyntaxNode(TSNode node, byte[] source) {
        this.node = node;
        this.source = source;
    }

    @Override
    public String getType() {
        return node.getType();
    }

    @Override
    public String getText() {
        int start = Math.max(0, Math.min(node.getStartByte(), source.length));
        int end = Math.max(start, Math.min(node.getEndByte(), source.length));
        return new String(source, start, end - start, StandardCharsets.UTF_8);
    }

    @Override
    public Point getStartPoint() {
        return toPoint(node.getStartPoint());
    }

    @Override
    public Point getEndPoint() {
        return toPoint(node.getEndPoint());
    }

    @Override
    public List<SyntaxNode> getChildren() {
        int count = node.getNamedChildCount();
        List<SyntaxNode> children = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            children.add(wrap(node.getNamedChild(i)));
        }
        return children;
    }

    @Override
    public Optional<SyntaxNode> getChildByFieldName(String fieldName) {
        TSNode child = node.getChildByFieldName(fieldName);
        if (child == null || child.isNull()) {
            return Optional.empty();
        }
        return Optional.of(wrap(child));
    }

    @Override
    public List<SyntaxNode> getChildrenByFieldName(String fieldName) {
        List<SyntaxNode> children = new ArrayList<>();
        int count = node.getChildCount();
        for (int i = 0; i < count; i++) {
            if (fieldName.equals(node.getFieldNameForChild(i))) {
                children.add(wrap(node.getChild(i)));
            }
        }
        return children;
    }

    boolean hasError() {
        return node.hasError();
    }

    @Override
    public String toString() {
        return getType() + "@" + getStartPoint();
    }

    private SyntaxNode wrap(TSNode child) {
        return new TreeSitterSyntaxNode(child, source);
    }

    private static Point toPoint(TSPoint point) {
        return new Point(point.getRow(), point.getColumn());
    }
}
