package com.github.musiKk.quench.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import com.github.musiKk.quench.parser.CompilationUnit.BlockExpression;
import com.github.musiKk.quench.parser.CompilationUnit.BooleanExpression;
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
import com.github.musiKk.quench.syntax.SyntaxTree;

public class ParserTest {

    @ParameterizedTest
    @MethodSource("statements")
    public void testStatementParse(String code, Statement expected) {
        var tree = parse(code);
        assertFalse(tree.hasError(), tree::debugString);
        var statements = new AstBuilder(tree).build().statements();
        assertEquals(List.of(expected), statements);
    }

    private static Object[][] statements() {
        return new Object[][] {
            {
                "x := 1;",
                new VariableDeclaration("x", new IntegerExpression(1))
            }, {
                "x := null;",
                new VariableDeclaration("x", new NullExpression())
            }, {
                "b := false;",
                new VariableDeclaration("b", new BooleanExpression(false))
            }, {
                "s := \"a\\\"b\";",
                new VariableDeclaration("s", new StringExpression("a\\\"b"))
            }, {
                "#red;",
                new ExpressionStatement(new SymbolExpression("red"))
            }, {
                "f x y;",
                new ExpressionStatement(new FunctionEvaluationExpression(
                        new FunctionEvaluationExpression(new VariableExpression("f"), new VariableExpression("x")),
                        new VariableExpression("y")))
            }, {
                "f (g x);",
                new ExpressionStatement(new FunctionEvaluationExpression(
                        new VariableExpression("f"),
                        new FunctionEvaluationExpression(new VariableExpression("g"), new VariableExpression("x"))))
            }, {
                "id := x => x;",
                new VariableDeclaration("id", new FunctionExpression("x", new VariableExpression("x")))
            }, {
                "k := a => b => a;",
                new VariableDeclaration("k", new FunctionExpression("a", new FunctionExpression("b", new VariableExpression("a"))))
            }, {
                "map xs x => x;",
                new ExpressionStatement(new FunctionEvaluationExpression(
                        new FunctionEvaluationExpression(new VariableExpression("map"), new VariableExpression("xs")),
                        new FunctionExpression("x", new VariableExpression("x"))))
            }, {
                "(x => x) 1;",
                new ExpressionStatement(new FunctionEvaluationExpression(
                        new FunctionExpression("x", new VariableExpression("x")),
                        new IntegerExpression(1)))
            }, {
                "a.b[0];",
                new ExpressionStatement(new LookupExpression(
                        new FieldExpression(new VariableExpression("a"), "b"),
                        new IntegerExpression(0)))
            }, {
                "f xs[0];",
                new ExpressionStatement(new FunctionEvaluationExpression(
                        new VariableExpression("f"),
                        new LookupExpression(new VariableExpression("xs"), new IntegerExpression(0))))
            }, {
                "[1, 2, 3,];",
                new ExpressionStatement(new ListExpression(List.of(
                        new IntegerExpression(1), new IntegerExpression(2), new IntegerExpression(3))))
            }, {
                "[];",
                new ExpressionStatement(new ListExpression(List.of()))
            }, {
                "{};",
                new ExpressionStatement(new MapExpression(List.of()))
            }, {
                "{#a: 1, \"b\": 2,};",
                new ExpressionStatement(new MapExpression(List.of(
                        new MapEntry(new SymbolExpression("a"), new IntegerExpression(1)),
                        new MapEntry(new StringExpression("b"), new IntegerExpression(2)))))
            }, {
                "{1};",
                new ExpressionStatement(new BlockExpression(List.of(), new IntegerExpression(1)))
            }, {
                "{print 1;};",
                new ExpressionStatement(new BlockExpression(List.of(new ExpressionStatement(
                        new FunctionEvaluationExpression(new VariableExpression("print"), new IntegerExpression(1))))))
            }, {
                "{x := 1; y := 2; x};",
                new ExpressionStatement(new BlockExpression(List.of(
                        new VariableDeclaration("x", new IntegerExpression(1)),
                        new VariableDeclaration("y", new IntegerExpression(2))),
                        new VariableExpression("x")))
            }, {
                "x := 1; // one",
                new VariableDeclaration("x", new IntegerExpression(1))
            },
        };
    }

    @Test
    public void testDebugString() {
        var tree = parse("x := [1];\nf x;");
        var expected = """
                source_file [0:0 - 1:4] (0..14)
                  declaration [0:0 - 0:9] (0..9)
                    name: identifier [0:0 - 0:1] (0..1)
                    value: list [0:5 - 0:8] (5..8)
                      integer [0:6 - 0:7] (6..7)
                  expression_statement [1:0 - 1:4] (10..14)
                    expression: call [1:0 - 1:3] (10..13)
                      function: identifier [1:0 - 1:1] (10..11)
                      argument: identifier [1:2 - 1:3] (12..13)
                """;
        assertEquals(expected, tree.debugString());
    }

    @Test
    public void testErrorRecovery() {
        var tree = parse("x := ;\ny := 2;\nz := (1;\n");
        var statements = tree.rootNode().children();

        assertEquals(List.of(NodeKind.ERROR, NodeKind.DECLARATION, NodeKind.ERROR),
                statements.stream().map(s -> s.kind()).toList());
        assertEquals(0, statements.get(0).startByte());
        assertEquals(6, statements.get(0).endByte());
        assertTrue(tree.hasError());
    }

    @Test
    public void testUnknownCharacter() {
        var tree = parse("x := 1 @ 2;");
        assertEquals(1, tree.rootNode().children().size());
        assertEquals(NodeKind.ERROR, tree.rootNode().children().get(0).kind());
    }

    @Test
    public void testEmptySource() {
        var tree = parse("");
        assertEquals(NodeKind.SOURCE_FILE, tree.rootNode().kind());
        assertTrue(tree.rootNode().children().isEmpty());
        assertFalse(tree.hasError());
    }

    @Test
    public void testMultiByteColumns() {
        var tree = parse("s := \"ä\";");
        var value = tree.rootNode().children().get(0).child("value").orElseThrow();
        assertEquals(5, value.startByte());
        assertEquals(9, value.endByte());
        assertEquals(9, value.endPoint().column());
    }

    private static SyntaxTree parse(String code) {
        return new Parser().parse(code.getBytes(StandardCharsets.UTF_8)).tree();
    }
}
