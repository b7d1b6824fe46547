package com.github.musiKk.quench.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.github.musiKk.quench.Tokenizer;
import com.github.musiKk.quench.Tokenizer.Token;
import com.github.musiKk.quench.Tokenizer.TokenType;
import com.github.musiKk.quench.Tokenizer.Tokens;
import com.github.musiKk.quench.Tokenizer.UnexpectedTokenException;
import com.github.musiKk.quench.syntax.NodeKind;
import com.github.musiKk.quench.syntax.SyntaxNode;
import com.github.musiKk.quench.syntax.SyntaxTree;

/**
 * Recursive-descent parser producing a {@link SyntaxTree}. Malformed text never
 * makes it fail: a top-level statement that cannot be parsed becomes an
 * {@link NodeKind#ERROR} node and parsing resumes after the next {@code ;}.
 */
public class Parser {

    private final Tokenizer tokenizer = new Tokenizer();

    public Result parse(byte[] source) {
        return parse(source, Optional.empty());
    }

    /**
     * Parses {@code source}. Top-level statements listed in {@code hint} are
     * adopted instead of reparsed whenever the parser reaches a statement
     * boundary exactly at their start byte.
     */
    public Result parse(byte[] source, Optional<SyntaxTree.Edited> hint) {
        var tokens = tokenizer.tokens(source);
        var reusable = hint.map(SyntaxTree.Edited::reusableStatements).orElse(List.of());

        List<SyntaxNode> statements = new ArrayList<>();
        int reused = 0;
        int candidate = 0;

        while (!tokens.matches(TokenType.EOF)) {
            int start = tokens.peek().start();

            while (candidate < reusable.size() && reusable.get(candidate).startByte() < start) {
                candidate++;
            }
            if (candidate < reusable.size() && reusable.get(candidate).startByte() == start) {
                var statement = reusable.get(candidate++);
                statements.add(statement);
                tokens.seek(statement.endByte());
                reused++;
                continue;
            }

            tokens.resetLookahead();
            var statement = parseTopLevelStatement(tokens);
            statements.add(statement.withLookaheadEnd(tokens.maxLookahead()));
        }

        var root = new SyntaxNode(NodeKind.SOURCE_FILE, statements, 0, source.length, tokens.pointAt(0), tokens.pointAt(source.length));
        return new Result(new SyntaxTree(source, root), reused);
    }

    public record Result(SyntaxTree tree, int reusedStatements) {}

    private SyntaxNode parseTopLevelStatement(Tokens tokens) {
        int start = tokens.peek().start();
        try {
            return parseStatement(tokens);
        } catch (UnexpectedTokenException e) {
            tokens.seek(start);
            return skipToStatementEnd(tokens);
        }
    }

    // skips up to and including the next ';' outside of brackets
    private SyntaxNode skipToStatementEnd(Tokens tokens) {
        var first = tokens.peek();
        var last = first;
        int depth = 0;
        while (!tokens.matches(TokenType.EOF)) {
            last = tokens.next();
            switch (last.type()) {
                case LBRACE, LBRACKET, LPAREN -> depth++;
                case RBRACE, RBRACKET, RPAREN -> depth = Math.max(0, depth - 1);
                default -> { }
            }
            if (last.type() == TokenType.SEMICOLON && depth == 0) {
                break;
            }
        }
        return node(tokens, NodeKind.ERROR, first.start(), last.end(), List.of());
    }

    SyntaxNode parseStatement(Tokens tokens) {
        if (startsDeclaration(tokens)) {
            return parseDeclaration(tokens);
        }
        var expression = parseExpression(tokens);
        var semicolon = tokens.next(TokenType.SEMICOLON);
        return node(tokens, NodeKind.EXPRESSION_STATEMENT, expression.startByte(), semicolon.end(),
                List.of(expression.withField("expression")));
    }

    private boolean startsDeclaration(Tokens tokens) {
        return tokens.matches(TokenType.IDENTIFIER) && tokens.peek(1).type() == TokenType.COLON_EQUALS;
    }

    // <> name ":=" expression ";"
    private SyntaxNode parseDeclaration(Tokens tokens) {
        var name = leaf(tokens, NodeKind.IDENTIFIER, tokens.next(TokenType.IDENTIFIER));
        tokens.next(TokenType.COLON_EQUALS);
        var value = parseExpression(tokens);
        var semicolon = tokens.next(TokenType.SEMICOLON);
        return node(tokens, NodeKind.DECLARATION, name.startByte(), semicolon.end(),
                List.of(name.withField("name"), value.withField("value")));
    }

    SyntaxNode parseExpression(Tokens tokens) {
        if (startsFunction(tokens)) {
            return parseFunction(tokens);
        }
        return parseApplication(tokens);
    }

    private boolean startsFunction(Tokens tokens) {
        return tokens.matches(TokenType.IDENTIFIER) && tokens.peek(1).type() == TokenType.ARROW;
    }

    // <> parameter "=>" expression
    private SyntaxNode parseFunction(Tokens tokens) {
        var parameter = leaf(tokens, NodeKind.IDENTIFIER, tokens.next(TokenType.IDENTIFIER));
        tokens.next(TokenType.ARROW);
        var body = parseExpression(tokens);
        return node(tokens, NodeKind.FUNCTION, parameter.startByte(), body.endByte(),
                List.of(parameter.withField("parameter"), body.withField("body")));
    }

    // <> postfix argument*
    private SyntaxNode parseApplication(Tokens tokens) {
        var expression = parsePostfix(tokens);

        while (tokens.matches(TokenType.IDENTIFIER, TokenType.NULL, TokenType.TRUE, TokenType.FALSE,
                TokenType.INTEGER, TokenType.STRING, TokenType.SYMBOL,
                TokenType.LPAREN, TokenType.LBRACKET, TokenType.LBRACE)) {
            var argument = startsFunction(tokens) ? parseFunction(tokens) : parsePostfix(tokens);
            expression = node(tokens, NodeKind.CALL, expression.startByte(), argument.endByte(),
                    List.of(expression.withField("function"), argument.withField("argument")));
        }
        return expression;
    }

    private SyntaxNode parsePostfix(Tokens tokens) {
        var expression = parseAtom(tokens);

        while (tokens.matches(TokenType.DOT, TokenType.LBRACKET)) {
            var postfixToken = tokens.next();
            if (postfixToken.type() == TokenType.LBRACKET) {
                var key = parseExpression(tokens);
                var close = tokens.next(TokenType.RBRACKET);
                expression = node(tokens, NodeKind.INDEX, expression.startByte(), close.end(),
                        List.of(expression.withField("collection"), key.withField("key")));
            } else {
                var key = leaf(tokens, NodeKind.IDENTIFIER, tokens.next(TokenType.IDENTIFIER));
                expression = node(tokens, NodeKind.FIELD, expression.startByte(), key.endByte(),
                        List.of(expression.withField("value"), key.withField("key")));
            }
        }
        return expression;
    }

    private SyntaxNode parseAtom(Tokens tokens) {
        var token = tokens.peek();

        return switch (token.type()) {
            case IDENTIFIER -> leaf(tokens, NodeKind.IDENTIFIER, tokens.next());
            case NULL -> leaf(tokens, NodeKind.NULL, tokens.next());
            case TRUE, FALSE -> leaf(tokens, NodeKind.BOOLEAN, tokens.next());
            case INTEGER -> leaf(tokens, NodeKind.INTEGER, tokens.next());
            case STRING -> leaf(tokens, NodeKind.STRING, tokens.next());
            case SYMBOL -> leaf(tokens, NodeKind.SYMBOL, tokens.next());
            case LPAREN -> {
                var open = tokens.next(TokenType.LPAREN);
                var inner = parseExpression(tokens);
                var close = tokens.next(TokenType.RPAREN);
                yield node(tokens, NodeKind.PARENTHESIZED_EXPRESSION, open.start(), close.end(),
                        List.of(inner.withField("expression")));
            }
            case LBRACKET -> parseList(tokens);
            case LBRACE -> parseBraced(tokens);
            default -> throw new UnexpectedTokenException("unexpected token " + token, token);
        };
    }

    // <> "[" (expression ("," expression)* ","?)? "]"
    private SyntaxNode parseList(Tokens tokens) {
        var open = tokens.next(TokenType.LBRACKET);
        List<SyntaxNode> elements = new ArrayList<>();
        while (!tokens.matches(TokenType.RBRACKET)) {
            elements.add(parseExpression(tokens));
            if (!tokens.matches(TokenType.COMMA)) {
                break;
            }
            tokens.next(TokenType.COMMA);
        }
        var close = tokens.next(TokenType.RBRACKET);
        return node(tokens, NodeKind.LIST, open.start(), close.end(), elements);
    }

    // a map when the first expression is followed by ':', a block otherwise
    private SyntaxNode parseBraced(Tokens tokens) {
        var open = tokens.next(TokenType.LBRACE);
        if (tokens.matches(TokenType.RBRACE)) {
            var close = tokens.next();
            return node(tokens, NodeKind.MAP, open.start(), close.end(), List.of());
        }
        if (startsDeclaration(tokens)) {
            return parseBlock(tokens, open, new ArrayList<>());
        }

        var first = parseExpression(tokens);
        return switch (tokens.peek().type()) {
            case COLON -> parseMap(tokens, open, first);
            case SEMICOLON -> {
                var semicolon = tokens.next();
                List<SyntaxNode> statements = new ArrayList<>();
                statements.add(node(tokens, NodeKind.EXPRESSION_STATEMENT, first.startByte(), semicolon.end(),
                        List.of(first.withField("expression"))));
                yield parseBlock(tokens, open, statements);
            }
            case RBRACE -> {
                var close = tokens.next();
                yield node(tokens, NodeKind.BLOCK, open.start(), close.end(), List.of(first.withField("result")));
            }
            default -> throw new UnexpectedTokenException("expected ':', ';' or '}' but got " + tokens.peek(), tokens.peek());
        };
    }

    // <> "{" statement* expression? "}"
    private SyntaxNode parseBlock(Tokens tokens, Token open, List<SyntaxNode> children) {
        while (true) {
            if (tokens.matches(TokenType.RBRACE)) {
                var close = tokens.next();
                return node(tokens, NodeKind.BLOCK, open.start(), close.end(), children);
            }
            if (startsDeclaration(tokens)) {
                children.add(parseDeclaration(tokens));
                continue;
            }
            var expression = parseExpression(tokens);
            if (tokens.matches(TokenType.SEMICOLON)) {
                var semicolon = tokens.next();
                children.add(node(tokens, NodeKind.EXPRESSION_STATEMENT, expression.startByte(), semicolon.end(),
                        List.of(expression.withField("expression"))));
            } else {
                var close = tokens.next(TokenType.RBRACE);
                children.add(expression.withField("result"));
                return node(tokens, NodeKind.BLOCK, open.start(), close.end(), children);
            }
        }
    }

    // <> "{" key ":" value ("," key ":" value)* ","? "}"
    private SyntaxNode parseMap(Tokens tokens, Token open, SyntaxNode firstKey) {
        List<SyntaxNode> pairs = new ArrayList<>();
        var key = firstKey;
        while (true) {
            tokens.next(TokenType.COLON);
            var value = parseExpression(tokens);
            pairs.add(node(tokens, NodeKind.PAIR, key.startByte(), value.endByte(),
                    List.of(key.withField("key"), value.withField("value"))));
            if (!tokens.matches(TokenType.COMMA)) {
                break;
            }
            tokens.next(TokenType.COMMA);
            if (tokens.matches(TokenType.RBRACE)) {
                break;
            }
            key = parseExpression(tokens);
        }
        var close = tokens.next(TokenType.RBRACE);
        return node(tokens, NodeKind.MAP, open.start(), close.end(), pairs);
    }

    private SyntaxNode leaf(Tokens tokens, NodeKind kind, Token token) {
        return node(tokens, kind, token.start(), token.end(), List.of());
    }

    private SyntaxNode node(Tokens tokens, NodeKind kind, int start, int end, List<SyntaxNode> children) {
        return new SyntaxNode(kind, children, start, end, tokens.pointAt(start), tokens.pointAt(end));
    }

}
