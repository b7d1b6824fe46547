package com.github.musiKk.quench.compiler;

import java.util.List;

/**
 * The slice of JavaScript the generator produces. Built per compilation and
 * thrown away once emitted.
 */
public final class Output {

    private Output() {
    }

    public record Module(List<Statement> body) {}

    public interface Element {}
    public interface Expression extends Element {}
    public interface Statement extends Element {}

    public record NumberExpression(long l) implements Expression {}
    /**
     * @param s the runtime value; escaped when emitted
     */
    public record StringLiteral(String s) implements Expression {}
    public record Boolean(boolean b) implements Expression {}
    public record Null() implements Expression {}
    public record NameExpression(String name) implements Expression {}
    public record MemberAccess(Expression target, String property) implements Expression {}
    public record FunctionEvaluation(Expression callee, List<Expression> arguments) implements Expression {}
    public record ArrayExpression(List<Expression> elements) implements Expression {}
    public record ArrowFunction(List<String> parameters, Expression body) implements Expression {}
    public record BlockFunction(List<String> parameters, List<Statement> body) implements Expression {}

    /**
     * {@code import * as namespace from "module";}
     */
    public record Import(String namespace, String module) implements Statement {}
    public record ConstDeclaration(String name, Expression right) implements Statement {}
    public record ExpressionStatement(Expression expression) implements Statement {}
    public record Return(Expression retval) implements Statement {}
}
