package com.github.musiKk.quench.parser;

import java.util.ArrayList;
import java.util.List;

import com.github.musiKk.quench.MalformedTreeException;
import com.github.musiKk.quench.parser.CompilationUnit.BlockExpression;
import com.github.musiKk.quench.parser.CompilationUnit.BooleanExpression;
import com.github.musiKk.quench.parser.CompilationUnit.Expression;
import com.github.musiKk.quench.parser.CompilationUnit.ExpressionStatement;
import com.github.musiKk.quench.parser.CompilationUnit.FieldExpression;
import com.github.musiKk.quench.parser.CompilationUnit.FunctionEvaluationExpression;
import com.github.musiKk.quench.parser.CompilationUnit.FunctionExpression;
import com.github.musiKk.quench.parser.CompilationUnit.IntegerExpression;
import com.github.musiKk.quench.parser.CompilationUnit.ListExpression;
import com.github.musiKk.quench.parser.CompilationUnit.LookupExpression;
import com.github.musiKk.quench.parser.CompilationUnit.MapEntry;
import com.github.musiKk.quench.parser.CompilationUnit.MapExpression;
import com.github.musiKk.quench.parser.CompilationUnit.NullExpression;
import com.github.musiKk.quench.parser.CompilationUnit.Statement;
import com.github.musiKk.quench.parser.CompilationUnit.StringExpression;
import com.github.musiKk.quench.parser.CompilationUnit.SymbolExpression;
import com.github.musiKk.quench.parser.CompilationUnit.VariableDeclaration;
import com.github.musiKk.quench.parser.CompilationUnit.VariableExpression;
import com.github.musiKk.quench.syntax.NodeKind;
import com.github.musiKk.quench.syntax.SyntaxNode;
import com.github.musiKk.quench.syntax.SyntaxTree;

import lombok.RequiredArgsConstructor;

/**
 * Turns a syntax tree into a {@link CompilationUnit}. Any error node makes it
 * fail with {@link MalformedTreeException}.
 */
@RequiredArgsConstructor
public class AstBuilder {

    private final SyntaxTree tree;

    public CompilationUnit build() {
        var root = tree.rootNode();
        if (root.kind() != NodeKind.SOURCE_FILE) {
            throw malformed("expected a source file", root);
        }
        return new CompilationUnit(statements(root.children()));
    }

    private List<Statement> statements(List<SyntaxNode> nodes) {
        List<Statement> statements = new ArrayList<>();
        for (var node : nodes) {
            statements.add(statement(node));
        }
        return statements;
    }

    private Statement statement(SyntaxNode node) {
        return switch (node.kind()) {
            case DECLARATION -> new VariableDeclaration(
                    text(required(node, "name")),
                    expression(required(node, "value")));
            case EXPRESSION_STATEMENT -> new ExpressionStatement(expression(required(node, "expression")));
            case ERROR -> throw malformed("syntax error", node);
            default -> throw malformed("expected a statement but found " + node.kind().debugName(), node);
        };
    }

    private Expression expression(SyntaxNode node) {
        return switch (node.kind()) {
            case IDENTIFIER -> new VariableExpression(text(node));
            case NULL -> new NullExpression();
            case BOOLEAN -> new BooleanExpression(text(node).equals("true"));
            case INTEGER -> {
                try {
                    yield new IntegerExpression(Long.parseLong(text(node)));
                } catch (NumberFormatException e) {
                    throw malformed("integer literal out of range", node);
                }
            }
            case STRING -> {
                var image = text(node);
                yield new StringExpression(image.substring(1, image.length() - 1));
            }
            case SYMBOL -> new SymbolExpression(text(node).substring(1));
            case LIST -> new ListExpression(node.children().stream().map(this::expression).toList());
            case MAP -> new MapExpression(node.children().stream()
                    .map(pair -> new MapEntry(expression(required(pair, "key")), expression(required(pair, "value"))))
                    .toList());
            case BLOCK -> {
                var statements = statements(node.unlabelledChildren());
                var result = node.child("result").map(this::expression);
                yield new BlockExpression(statements, result);
            }
            case FUNCTION -> new FunctionExpression(
                    text(required(node, "parameter")),
                    expression(required(node, "body")));
            case CALL -> new FunctionEvaluationExpression(
                    expression(required(node, "function")),
                    expression(required(node, "argument")));
            case INDEX -> new LookupExpression(
                    expression(required(node, "collection")),
                    expression(required(node, "key")));
            case FIELD -> new FieldExpression(
                    expression(required(node, "value")),
                    text(required(node, "key")));
            case PARENTHESIZED_EXPRESSION -> expression(required(node, "expression"));
            case ERROR -> throw malformed("syntax error", node);
            default -> throw malformed("expected an expression but found " + node.kind().debugName(), node);
        };
    }

    private SyntaxNode required(SyntaxNode node, String field) {
        return node.child(field)
                .orElseThrow(() -> malformed(node.kind().debugName() + " without " + field, node));
    }

    private String text(SyntaxNode node) {
        return tree.text(node);
    }

    private static MalformedTreeException malformed(String message, SyntaxNode node) {
        return new MalformedTreeException(message, node.kind(), node.startPoint());
    }

}
