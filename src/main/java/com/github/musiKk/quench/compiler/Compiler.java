package com.github.musiKk.quench.compiler;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.musiKk.quench.ConfigReader;
import com.github.musiKk.quench.MalformedTreeException;
import com.github.musiKk.quench.parser.AstBuilder;
import com.github.musiKk.quench.parser.CompilationUnit;
import com.github.musiKk.quench.parser.CompilationUnit.BlockExpression;
import com.github.musiKk.quench.parser.CompilationUnit.BooleanExpression;
import com.github.musiKk.quench.parser.CompilationUnit.Expression;
import com.github.musiKk.quench.parser.CompilationUnit.ExpressionStatement;
import com.github.musiKk.quench.parser.CompilationUnit.ExpressionVisitor;
import com.github.musiKk.quench.parser.CompilationUnit.FieldExpression;
import com.github.musiKk.quench.parser.CompilationUnit.FunctionEvaluationExpression;
import com.github.musiKk.quench.parser.CompilationUnit.FunctionExpression;
import com.github.musiKk.quench.parser.CompilationUnit.IntegerExpression;
import com.github.musiKk.quench.parser.CompilationUnit.ListExpression;
import com.github.musiKk.quench.parser.CompilationUnit.LookupExpression;
import com.github.musiKk.quench.parser.CompilationUnit.MapExpression;
import com.github.musiKk.quench.parser.CompilationUnit.NullExpression;
import com.github.musiKk.quench.parser.CompilationUnit.Statement;
import com.github.musiKk.quench.parser.CompilationUnit.StatementVisitor;
import com.github.musiKk.quench.parser.CompilationUnit.StringExpression;
import com.github.musiKk.quench.parser.CompilationUnit.SymbolExpression;
import com.github.musiKk.quench.parser.CompilationUnit.VariableDeclaration;
import com.github.musiKk.quench.parser.CompilationUnit.VariableExpression;
import com.github.musiKk.quench.syntax.SyntaxTree;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Translates a program into a JavaScript ES module that uses the
 * {@code immutable} library for lists and maps.
 *
 * <p>Every user name {@code x} becomes {@code $x}; {@code print} and
 * {@code args} are special forms. A block becomes an immediately invoked arrow
 * function so that it can stand wherever an expression can. If the module
 * declares {@code main} at top level, the module ends by calling it.
 */
public class Compiler implements ConfigReader.ConfigTarget {

    private static final Logger LOG = LoggerFactory.getLogger(Compiler.class);

    static final String COLLECTIONS_NAMESPACE = "Immutable";
    public static final String ENTRY_POINT = "main";

    @Accessors(fluent = true)
    @Getter
    private String collectionsModule = "immutable";

    @Override
    public void setCollectionsModule(String collectionsModule) {
        this.collectionsModule = collectionsModule;
    }

    /**
     * @throws MalformedTreeException if the tree contains parse errors
     */
    public String compile(SyntaxTree tree) {
        return compile(new AstBuilder(tree).build());
    }

    public String compile(CompilationUnit compilationUnit) {
        return OutputEmitter.emitToString(generate(compilationUnit));
    }

    public Output.Module generate(CompilationUnit compilationUnit) {
        List<Output.Statement> body = new ArrayList<>();
        body.add(new Output.Import(COLLECTIONS_NAMESPACE, collectionsModule));

        boolean hasEntryPoint = false;
        for (var statement : compilationUnit.statements()) {
            body.add(compileStatement(statement));
            if (statement instanceof VariableDeclaration vd && vd.name().equals(ENTRY_POINT)) {
                hasEntryPoint = true;
            }
        }
        if (hasEntryPoint) {
            body.add(new Output.ExpressionStatement(
                    new Output.FunctionEvaluation(new Output.NameExpression(SpecialForms.mangle(ENTRY_POINT)), List.of())));
        }

        LOG.debug("generated {} top-level statements, entry point: {}", compilationUnit.statements().size(), hasEntryPoint);
        return new Output.Module(body);
    }

    private Output.Statement compileStatement(Statement statement) {
        return statement.accept(statementCompiler);
    }

    private Output.Expression compileExpression(Expression expression) {
        return expression.accept(expressionCompiler);
    }

    private List<Output.Expression> compileExpressions(List<Expression> expressions) {
        return expressions.stream().map(this::compileExpression).toList();
    }

    private static Output.Expression collection(String constructor, List<Output.Expression> elements) {
        return new Output.FunctionEvaluation(
                new Output.MemberAccess(new Output.NameExpression(COLLECTIONS_NAMESPACE), constructor),
                List.of(new Output.ArrayExpression(elements)));
    }

    private static Output.Expression symbol(String name) {
        return new Output.FunctionEvaluation(
                new Output.MemberAccess(new Output.NameExpression("Symbol"), "for"),
                List.of(new Output.StringLiteral(name)));
    }

    private static Output.Expression get(Output.Expression target, Output.Expression key) {
        return new Output.FunctionEvaluation(new Output.MemberAccess(target, "get"), List.of(key));
    }

    private final StatementVisitor<Output.Statement> statementCompiler = new StatementVisitor<>() {
        @Override
        public Output.Statement visitVariableDeclaration(VariableDeclaration declaration) {
            return new Output.ConstDeclaration(SpecialForms.mangle(declaration.name()), compileExpression(declaration.initializer()));
        }

        @Override
        public Output.Statement visitExpressionStatement(ExpressionStatement statement) {
            return new Output.ExpressionStatement(compileExpression(statement.expression()));
        }
    };

    private final ExpressionVisitor<Output.Expression> expressionCompiler = new ExpressionVisitor<>() {
        @Override
        public Output.Expression visitNull(NullExpression expression) {
            return new Output.Null();
        }

        @Override
        public Output.Expression visitBoolean(BooleanExpression expression) {
            return new Output.Boolean(expression.value());
        }

        @Override
        public Output.Expression visitInteger(IntegerExpression expression) {
            return new Output.NumberExpression(expression.number());
        }

        @Override
        public Output.Expression visitString(StringExpression expression) {
            return new Output.StringLiteral(expression.string());
        }

        @Override
        public Output.Expression visitSymbol(SymbolExpression expression) {
            return symbol(expression.name());
        }

        @Override
        public Output.Expression visitList(ListExpression expression) {
            return collection("List", compileExpressions(expression.elements()));
        }

        @Override
        public Output.Expression visitMap(MapExpression expression) {
            var pairs = expression.entries().stream()
                    .map(e -> (Output.Expression) new Output.ArrayExpression(
                            List.of(compileExpression(e.key()), compileExpression(e.value()))))
                    .toList();
            return collection("Map", pairs);
        }

        @Override
        public Output.Expression visitVariable(VariableExpression expression) {
            return SpecialForms.resolve(expression.name());
        }

        @Override
        public Output.Expression visitBlock(BlockExpression expression) {
            List<Output.Statement> body = new ArrayList<>();
            expression.statements().stream()
                    .map(Compiler.this::compileStatement)
                    .forEach(body::add);
            expression.result()
                    .map(r -> new Output.Return(compileExpression(r)))
                    .ifPresent(body::add);
            return new Output.FunctionEvaluation(new Output.BlockFunction(List.of(), body), List.of());
        }

        @Override
        public Output.Expression visitFunction(FunctionExpression expression) {
            return new Output.ArrowFunction(List.of(SpecialForms.mangle(expression.parameter())), compileExpression(expression.body()));
        }

        @Override
        public Output.Expression visitFunctionEvaluation(FunctionEvaluationExpression expression) {
            return new Output.FunctionEvaluation(compileExpression(expression.function()), List.of(compileExpression(expression.argument())));
        }

        @Override
        public Output.Expression visitLookup(LookupExpression expression) {
            return get(compileExpression(expression.target()), compileExpression(expression.key()));
        }

        @Override
        public Output.Expression visitField(FieldExpression expression) {
            return get(compileExpression(expression.target()), symbol(expression.name()));
        }
    };

}
