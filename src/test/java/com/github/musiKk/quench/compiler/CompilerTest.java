package com.github.musiKk.quench.compiler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import org.junit.jupiter.api.DynamicContainer;
import org.junit.jupiter.api.DynamicNode;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestFactory;

import com.github.musiKk.quench.MalformedTreeException;
import com.github.musiKk.quench.parser.CompilationUnit;
import com.github.musiKk.quench.parser.CompilationUnit.ExpressionStatement;
import com.github.musiKk.quench.parser.CompilationUnit.IntegerExpression;
import com.github.musiKk.quench.parser.CompilationUnit.VariableDeclaration;
import com.github.musiKk.quench.parser.CompilationUnit.VariableExpression;
import com.github.musiKk.quench.parser.Parser;
import com.github.musiKk.quench.syntax.NodeKind;
import com.github.musiKk.quench.syntax.Point;

public class CompilerTest {

    @TestFactory
    public DynamicNode testFactory() {
        var basePath = Paths.get("src/test/resources/compiler-tests");

        var testFiles = basePath.toFile().listFiles((dir, name) -> name.endsWith(".qn"));
        var tests = Arrays.stream(testFiles)
            .sorted(Comparator.comparing(File::getName))
            .map(this::createTest).toList();

        return DynamicContainer.dynamicContainer("Compiler tests", tests);
    }

    private DynamicNode createTest(File testFile) {
        var testName = testFile.getName().substring(0, testFile.getName().indexOf('.'));
        return DynamicTest.dynamicTest("compile " + testName, () -> {
            var source = Files.readString(testFile.toPath(), StandardCharsets.UTF_8);

            String expectedOutput;
            try (var s = Files.lines(testFile.toPath())) {
                expectedOutput = s.dropWhile(l -> !l.equals("// EXPECTED-OUTPUT")).skip(1)
                    .map(l -> l.startsWith("// ") ? l.substring(3) : l.substring(2))
                    .reduce("", (a, b) -> a + b + "\n");
            }

            var tree = new Parser().parse(source.getBytes(StandardCharsets.UTF_8)).tree();
            assertEquals(expectedOutput, new Compiler().compile(tree));
        });
    }

    @Test
    public void testCollectionsModuleIsConfigurable() {
        var compiler = new Compiler();
        compiler.setCollectionsModule("https://esm.sh/immutable");

        var output = compiler.compile(new CompilationUnit(List.of()));

        assertEquals("import * as Immutable from \"https://esm.sh/immutable\";\n", output);
    }

    @Test
    public void testEntryPointOnlyForDeclaration() {
        var compiler = new Compiler();
        var unit = new CompilationUnit(List.of(
                new ExpressionStatement(new VariableExpression("main")),
                new VariableDeclaration("mainly", new IntegerExpression(1))));

        var output = compiler.compile(unit);

        assertEquals("""
                import * as Immutable from "immutable";
                $main;
                const $mainly = 1;
                """, output);
    }

    @Test
    public void testGenerateShape() {
        var module = new Compiler().generate(new CompilationUnit(List.of(
                new VariableDeclaration("main", new IntegerExpression(0)))));

        assertEquals(3, module.body().size());
        assertEquals(new Output.Import("Immutable", "immutable"), module.body().get(0));
        assertEquals(new Output.ConstDeclaration("$main", new Output.NumberExpression(0)), module.body().get(1));
        assertEquals(new Output.ExpressionStatement(new Output.FunctionEvaluation(new Output.NameExpression("$main"), List.of())),
                module.body().get(2));
    }

    @Test
    public void testErrorTreeIsRejected() {
        var tree = new Parser().parse("x := 1;\ny := ;".getBytes(StandardCharsets.UTF_8)).tree();

        var e = assertThrows(MalformedTreeException.class, () -> new Compiler().compile(tree));

        assertEquals(NodeKind.ERROR, e.kind());
        assertEquals(new Point(1, 0), e.position());
        assertTrue(e.getMessage().endsWith("at 2:1"), e.getMessage());
    }

    @Test
    public void testIntegerOutOfRange() {
        var tree = new Parser().parse("x := 99999999999999999999;".getBytes(StandardCharsets.UTF_8)).tree();

        var e = assertThrows(MalformedTreeException.class, () -> new Compiler().compile(tree));

        assertEquals(NodeKind.INTEGER, e.kind());
        assertEquals(new Point(0, 5), e.position());
    }

    @Test
    public void testLargestInteger() {
        var tree = new Parser().parse("x := 9223372036854775807;".getBytes(StandardCharsets.UTF_8)).tree();

        assertEquals("import * as Immutable from \"immutable\";\nconst $x = 9223372036854775807;\n",
                new Compiler().compile(tree));
    }
}
