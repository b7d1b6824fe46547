package com.github.musiKk.quench;

import com.github.musiKk.quench.syntax.NodeKind;
import com.github.musiKk.quench.syntax.Point;

/**
 * Thrown when code generation meets a tree it cannot translate, typically one
 * that still contains parse errors. Generation produces no output in that case.
 */
public class MalformedTreeException extends QuenchException {

    private static final long serialVersionUID = 1L;

    private final NodeKind kind;
    private final Point position;

    public MalformedTreeException(String message, NodeKind kind, Point position) {
        super(message + " at " + (position.row() + 1) + ":" + (position.column() + 1));
        this.kind = kind;
        this.position = position;
    }

    public NodeKind kind() {
        return kind;
    }

    /**
     * 0-based start of the offending node.
     */
    public Point position() {
        return position;
    }
}
