package com.github.musiKk.quench.syntax;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Immutable node of a syntax tree. A node never changes once built; edits
 * produce shifted copies.
 */
@Accessors(fluent = true)
@Getter
public final class SyntaxNode {

    private final NodeKind kind;
    private final Optional<String> field;
    private final List<SyntaxNode> children;
    private final int startByte;
    private final int endByte;
    private final Point startPoint;
    private final Point endPoint;
    /**
     * Exclusive end of the bytes the parser examined while building this node.
     * Only meaningful for top-level statements.
     */
    private final int lookaheadEnd;
    private final boolean hasError;

    public SyntaxNode(NodeKind kind, List<SyntaxNode> children, int startByte, int endByte, Point startPoint, Point endPoint) {
        this(kind, Optional.empty(), children, startByte, endByte, startPoint, endPoint, endByte);
    }

    private SyntaxNode(NodeKind kind, Optional<String> field, List<SyntaxNode> children,
            int startByte, int endByte, Point startPoint, Point endPoint, int lookaheadEnd) {
        this.kind = kind;
        this.field = field;
        this.children = List.copyOf(children);
        this.startByte = startByte;
        this.endByte = endByte;
        this.startPoint = startPoint;
        this.endPoint = endPoint;
        this.lookaheadEnd = lookaheadEnd;
        this.hasError = kind == NodeKind.ERROR || this.children.stream().anyMatch(SyntaxNode::hasError);
    }

    public SyntaxNode withField(String field) {
        return new SyntaxNode(kind, Optional.of(field), children, startByte, endByte, startPoint, endPoint, lookaheadEnd);
    }

    public SyntaxNode withLookaheadEnd(int lookaheadEnd) {
        return new SyntaxNode(kind, field, children, startByte, endByte, startPoint, endPoint, lookaheadEnd);
    }

    public boolean isError() {
        return kind == NodeKind.ERROR;
    }

    public Optional<SyntaxNode> child(String fieldName) {
        return children.stream()
                .filter(c -> c.field.isPresent() && c.field.get().equals(fieldName))
                .findFirst();
    }

    /**
     * Children that carry no field label, in order.
     */
    public List<SyntaxNode> unlabelledChildren() {
        return children.stream()
                .filter(c -> c.field.isEmpty())
                .toList();
    }

    public String text(byte[] source) {
        return new String(source, startByte, endByte - startByte, StandardCharsets.UTF_8);
    }

    /**
     * Copy of this subtree moved by {@code edit}. The subtree must lie
     * entirely at or after the edit's old end.
     */
    public SyntaxNode shift(InputEdit edit) {
        List<SyntaxNode> shiftedChildren = new ArrayList<>(children.size());
        for (var child : children) {
            shiftedChildren.add(child.shift(edit));
        }
        return new SyntaxNode(kind, field, shiftedChildren,
                edit.shift(startByte), edit.shift(endByte),
                edit.shift(startPoint), edit.shift(endPoint),
                edit.shift(lookaheadEnd));
    }

    void appendDebugString(StringBuilder sb, int depth) {
        for (int i = 0; i < depth; i++) {
            sb.append("  ");
        }
        field.ifPresent(f -> sb.append(f).append(": "));
        sb.append(kind.debugName())
                .append(" [").append(startPoint).append(" - ").append(endPoint).append("]")
                .append(" (").append(startByte).append("..").append(endByte).append(")")
                .append('\n');
        for (var child : children) {
            child.appendDebugString(sb, depth + 1);
        }
    }

    @Override
    public String toString() {
        return kind.debugName() + " [" + startPoint + " - " + endPoint + "]";
    }
}
