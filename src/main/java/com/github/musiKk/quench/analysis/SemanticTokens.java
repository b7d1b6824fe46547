package com.github.musiKk.quench.analysis;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.github.musiKk.quench.Tokenizer;
import com.github.musiKk.quench.Tokenizer.TokenType;
import com.github.musiKk.quench.syntax.Point;
import com.github.musiKk.quench.syntax.SyntaxNode;
import com.github.musiKk.quench.syntax.SyntaxTree;

/**
 * Highlighting information in the relative encoding editors expect: every
 * token is five integers {@code deltaLine, deltaStart, length, tokenType, 0}
 * where {@code deltaStart} is relative to the previous token only when both
 * are on the same line. Columns and lengths count bytes.
 */
public final class SemanticTokens {

    private SemanticTokens() {
    }

    /**
     * Legend order is the ordinal order.
     */
    public enum Type {
        COMMENT,
        STRING,
        VARIABLE,
        SYMBOL
    }

    public record SemanticToken(int deltaLine, int deltaStart, int length, Type type, int modifiers) {}

    record AbsoluteToken(int startByte, int line, int start, int length, Type type) {}

    public static List<SemanticToken> of(SyntaxTree tree) {
        return relative(absolute(tree));
    }

    /**
     * Flattens {@link #of(SyntaxTree)} into the wire format.
     */
    public static int[] encode(List<SemanticToken> tokens) {
        int[] data = new int[tokens.size() * 5];
        int i = 0;
        for (var token : tokens) {
            data[i++] = token.deltaLine();
            data[i++] = token.deltaStart();
            data[i++] = token.length();
            data[i++] = token.type().ordinal();
            data[i++] = token.modifiers();
        }
        return data;
    }

    static List<AbsoluteToken> absolute(SyntaxTree tree) {
        List<AbsoluteToken> tokens = new ArrayList<>();
        collect(tree.rootNode(), tokens);

        byte[] source = tree.text().getBytes(StandardCharsets.UTF_8);
        var tokenizer = new Tokenizer();
        var stream = tokenizer.tokens(source);
        for (var token : tokenizer.tokenize(source)) {
            if (token.type() == TokenType.COMMENT) {
                add(tokens, token.start(), token.end(), stream.pointAt(token.start()), stream.pointAt(token.end()), Type.COMMENT);
            }
        }

        tokens.sort(Comparator.comparingInt(AbsoluteToken::startByte));
        return tokens;
    }

    private static void collect(SyntaxNode node, List<AbsoluteToken> tokens) {
        switch (node.kind()) {
            case IDENTIFIER -> add(tokens, node, Type.VARIABLE);
            case STRING -> add(tokens, node, Type.STRING);
            case SYMBOL -> add(tokens, node, Type.SYMBOL);
            default -> node.children().forEach(c -> collect(c, tokens));
        }
    }

    private static void add(List<AbsoluteToken> tokens, SyntaxNode node, Type type) {
        add(tokens, node.startByte(), node.endByte(), node.startPoint(), node.endPoint(), type);
    }

    // multi-line tokens are not representable
    private static void add(List<AbsoluteToken> tokens, int startByte, int endByte, Point start, Point end, Type type) {
        if (start.row() != end.row()) {
            return;
        }
        tokens.add(new AbsoluteToken(startByte, start.row(), start.column(), endByte - startByte, type));
    }

    static List<SemanticToken> relative(List<AbsoluteToken> tokens) {
        List<SemanticToken> relative = new ArrayList<>(tokens.size());
        int lastLine = 0;
        int lastStart = 0;
        for (var token : tokens) {
            int deltaLine = token.line() - lastLine;
            int deltaStart = deltaLine == 0 ? token.start() - lastStart : token.start();
            relative.add(new SemanticToken(deltaLine, deltaStart, token.length(), token.type(), 0));
            lastLine = token.line();
            lastStart = token.start();
        }
        return relative;
    }
}
