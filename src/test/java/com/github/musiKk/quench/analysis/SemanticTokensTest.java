package com.github.musiKk.quench.analysis;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.github.musiKk.quench.analysis.SemanticTokens.SemanticToken;
import com.github.musiKk.quench.analysis.SemanticTokens.Type;
import com.github.musiKk.quench.parser.Parser;
import com.github.musiKk.quench.syntax.SyntaxTree;

public class SemanticTokensTest {

    @Test
    public void testRelativeEncoding() {
        var tokens = SemanticTokens.of(parse("// hi\nx := \"s\" #k;\n  y;"));

        assertEquals(List.of(
                new SemanticToken(0, 0, 5, Type.COMMENT, 0),
                new SemanticToken(1, 0, 1, Type.VARIABLE, 0),
                new SemanticToken(0, 5, 3, Type.STRING, 0),
                new SemanticToken(0, 4, 2, Type.SYMBOL, 0),
                new SemanticToken(1, 2, 1, Type.VARIABLE, 0)),
                tokens);
        assertArrayEquals(new int[] {
                0, 0, 5, 0, 0,
                1, 0, 1, 2, 0,
                0, 5, 3, 1, 0,
                0, 4, 2, 3, 0,
                1, 2, 1, 2, 0 },
                SemanticTokens.encode(tokens));
    }

    @Test
    public void testMultiLineStringIsSkipped() {
        var tokens = SemanticTokens.of(parse("s := \"a\nb\";"));

        assertEquals(List.of(new SemanticToken(0, 0, 1, Type.VARIABLE, 0)), tokens);
    }

    @Test
    public void testEmptySource() {
        assertEquals(List.of(), SemanticTokens.of(parse("")));
    }

    private static SyntaxTree parse(String code) {
        return new Parser().parse(code.getBytes(StandardCharsets.UTF_8)).tree();
    }
}
