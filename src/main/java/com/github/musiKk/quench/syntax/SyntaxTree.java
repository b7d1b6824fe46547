package com.github.musiKk.quench.syntax;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * A parsed version of a text. Immutable; a new text gets a new tree.
 */
public final class SyntaxTree {

    private final byte[] source;
    private final SyntaxNode root;

    public SyntaxTree(byte[] source, SyntaxNode root) {
        this.source = source;
        this.root = root;
    }

    public SyntaxNode rootNode() {
        return root;
    }

    public String text() {
        return new String(source, StandardCharsets.UTF_8);
    }

    public String text(SyntaxNode node) {
        return node.text(source);
    }

    public int length() {
        return source.length;
    }

    public boolean hasError() {
        return root.hasError();
    }

    /**
     * One line per node, children indented by two spaces:
     * {@code field: kind [row:column - row:column] (startByte..endByte)}.
     */
    public String debugString() {
        var sb = new StringBuilder();
        root.appendDebugString(sb, 0);
        return sb.toString();
    }

    /**
     * Applies {@code edit} to a scratch copy of this tree's top-level
     * statements. Statements the edit cannot have influenced are kept (those
     * after the edit with shifted ranges); everything else is dropped.
     */
    public Edited edit(InputEdit edit) {
        List<SyntaxNode> reusable = new ArrayList<>();
        for (var statement : root.children()) {
            if (statement.hasError()) {
                continue;
            }
            if (statement.lookaheadEnd() <= edit.startByte()) {
                reusable.add(statement);
            } else if (edit.oldEndByte() <= statement.startByte()) {
                reusable.add(statement.shift(edit));
            }
        }
        return new Edited(edit, List.copyOf(reusable));
    }

    /**
     * Reuse hint for the next parse: top-level statements in new-text
     * coordinates, ordered by start byte.
     */
    public record Edited(InputEdit edit, List<SyntaxNode> reusableStatements) {}
}
