package com.github.musiKk.quench.parser;

import java.util.List;
import java.util.Optional;

public record CompilationUnit(List<Statement> statements) {

    public sealed interface Statement {
        <R> R accept(StatementVisitor<R> visitor);
    }

    public interface StatementVisitor<R> {
        R visitVariableDeclaration(VariableDeclaration declaration);
        R visitExpressionStatement(ExpressionStatement statement);
    }

    public record VariableDeclaration(String name, Expression initializer) implements Statement {
        @Override
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visitVariableDeclaration(this);
        }
    }

    public record ExpressionStatement(Expression expression) implements Statement {
        @Override
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visitExpressionStatement(this);
        }
    }

    public sealed interface Expression {
        <R> R accept(ExpressionVisitor<R> visitor);
    }

    /**
     * One method per expression kind, so that adding a kind breaks every
     * translation that forgets it.
     */
    public interface ExpressionVisitor<R> {
        R visitNull(NullExpression expression);
        R visitBoolean(BooleanExpression expression);
        R visitInteger(IntegerExpression expression);
        R visitString(StringExpression expression);
        R visitSymbol(SymbolExpression expression);
        R visitList(ListExpression expression);
        R visitMap(MapExpression expression);
        R visitVariable(VariableExpression expression);
        R visitBlock(BlockExpression expression);
        R visitFunction(FunctionExpression expression);
        R visitFunctionEvaluation(FunctionEvaluationExpression expression);
        R visitLookup(LookupExpression expression);
        R visitField(FieldExpression expression);
    }

    public record NullExpression() implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitNull(this);
        }
    }

    public record BooleanExpression(boolean value) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitBoolean(this);
        }
    }

    public record IntegerExpression(long number) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitInteger(this);
        }
    }

    /**
     * @param string the text between the quotes, escapes left as written
     */
    public record StringExpression(String string) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitString(this);
        }
    }

    public record SymbolExpression(String name) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitSymbol(this);
        }
    }

    public record ListExpression(List<Expression> elements) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitList(this);
        }
    }

    public record MapEntry(Expression key, Expression value) {}

    public record MapExpression(List<MapEntry> entries) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitMap(this);
        }
    }

    public record VariableExpression(String name) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitVariable(this);
        }
    }

    public record BlockExpression(List<Statement> statements, Optional<Expression> result) implements Expression {
        public BlockExpression(List<Statement> statements) {
            this(statements, Optional.empty());
        }
        public BlockExpression(List<Statement> statements, Expression result) {
            this(statements, Optional.of(result));
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitBlock(this);
        }
    }

    public record FunctionExpression(String parameter, Expression body) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitFunction(this);
        }
    }

    public record FunctionEvaluationExpression(Expression function, Expression argument) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitFunctionEvaluation(this);
        }
    }

    public record LookupExpression(Expression target, Expression key) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitLookup(this);
        }
    }

    public record FieldExpression(Expression target, String name) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitField(this);
        }
    }

}
