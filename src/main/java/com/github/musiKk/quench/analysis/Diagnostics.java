package com.github.musiKk.quench.analysis;

import java.util.ArrayList;
import java.util.List;

import com.github.musiKk.quench.syntax.Point;
import com.github.musiKk.quench.syntax.SyntaxNode;
import com.github.musiKk.quench.syntax.SyntaxTree;

/**
 * Problems an editor should underline. For now only parse errors are reported.
 */
public final class Diagnostics {

    public static final String SYNTAX_ERROR = "syntax error";

    private Diagnostics() {
    }

    /**
     * One diagnostic per outermost error node, in document order.
     */
    public static List<Diagnostic> of(SyntaxTree tree) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        collect(tree.rootNode(), diagnostics);
        return diagnostics;
    }

    private static void collect(SyntaxNode node, List<Diagnostic> diagnostics) {
        if (!node.hasError()) {
            return;
        }
        if (node.isError()) {
            diagnostics.add(new Diagnostic(node.startPoint(), node.endPoint(), Severity.ERROR, SYNTAX_ERROR));
            return;
        }
        for (var child : node.children()) {
            collect(child, diagnostics);
        }
    }

    public enum Severity {
        ERROR
    }

    public record Diagnostic(Point start, Point end, Severity severity, String message) {}
}
