package com.github.musiKk.quench;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import com.github.musiKk.quench.syntax.Point;

/**
 * Lexer over the UTF-8 bytes of a source text. All offsets are byte offsets.
 *
 * <p>Every token remembers how far the lexer had to look to produce it
 * ({@link Token#lookahead()}, exclusive). A token that had to look at the end
 * of input reports {@code source.length + 1}.
 */
public class Tokenizer {

    private final List<Pattern> patterns = new ArrayList<>();

    {
        for (var tokenType : TokenType.values()) {
            if (tokenType.constantPattern != null && !tokenType.keyword) {
                patterns.add(new StaticPattern(tokenType.constantPattern, tokenType));
            }
        }

        patterns.add(new IdentifierPattern());
        patterns.add(new NumberPattern());
        patterns.add(new StringPattern());
        patterns.add(new SymbolPattern());
        patterns.add(new CommentPattern());

        patterns.sort(Comparator.comparingInt(Pattern::priority).reversed());
    }

    /**
     * Lexes the whole source eagerly, comments included.
     */
    public List<Token> tokenize(byte[] source) {
        List<Token> tokens = new ArrayList<>();
        int index = 0;
        while (true) {
            var token = lex(source, index);
            tokens.add(token);
            if (token.type() == TokenType.EOF) {
                return tokens;
            }
            index = token.end();
        }
    }

    public Tokens tokens(byte[] source) {
        return new Tokens(this, source);
    }

    Token lex(byte[] source, int index) {
        while (index < source.length && isWhitespace(source[index])) {
            index++;
        }
        if (index >= source.length) {
            return new Token(TokenType.EOF, "", source.length, source.length);
        }

        for (var pattern : patterns) {
            var result = pattern.match(source, index);
            if (result.isPresent()) {
                return result.get();
            }
        }
        return new Token(TokenType.ERROR, image(source, index, index + 1), index, index + 1);
    }

    static boolean isWhitespace(byte b) {
        return b == ' ' || b == '\t' || b == '\n' || b == '\r' || b == '\f';
    }

    static boolean isIdentifierStart(byte b) {
        return (b >= 'a' && b <= 'z') || (b >= 'A' && b <= 'Z') || b == '_';
    }

    static boolean isIdentifierPart(byte b) {
        return isIdentifierStart(b) || isDigit(b);
    }

    static boolean isDigit(byte b) {
        return b >= '0' && b <= '9';
    }

    static String image(byte[] source, int start, int end) {
        return new String(source, start, end - start, StandardCharsets.UTF_8);
    }

    interface Pattern {
        Optional<Token> match(byte[] source, int index);

        default int priority() {
            return Integer.MIN_VALUE;
        }
    }

    static class StaticPattern implements Pattern {
        final byte[] pattern;
        final TokenType tokenType;

        StaticPattern(String pattern, TokenType tokenType) {
            this.pattern = pattern.getBytes(StandardCharsets.US_ASCII);
            this.tokenType = tokenType;
        }

        @Override
        public Optional<Token> match(byte[] source, int index) {
            if (index + pattern.length > source.length) {
                return Optional.empty();
            }
            for (int i = 0; i < pattern.length; i++) {
                if (source[index + i] != pattern[i]) {
                    return Optional.empty();
                }
            }
            return Optional.of(new Token(tokenType, tokenType.constantPattern, index, index + pattern.length));
        }

        @Override
        public int priority() {
            return pattern.length;
        }
    }

    static class NumberPattern implements Pattern {
        @Override
        public Optional<Token> match(byte[] source, int index) {
            if (!isDigit(source[index])) {
                return Optional.empty();
            }
            int start = index;
            while (index < source.length && isDigit(source[index])) {
                index++;
            }
            return Optional.of(new Token(TokenType.INTEGER, image(source, start, index), start, index));
        }
    }

    static class IdentifierPattern implements Pattern {
        @Override
        public Optional<Token> match(byte[] source, int index) {
            if (!isIdentifierStart(source[index])) {
                return Optional.empty();
            }
            int start = index;
            while (index < source.length && isIdentifierPart(source[index])) {
                index++;
            }
            var image = image(source, start, index);
            var type = TokenType.keyword(image).orElse(TokenType.IDENTIFIER);
            return Optional.of(new Token(type, image, start, index));
        }
    }

    static class SymbolPattern implements Pattern {
        @Override
        public Optional<Token> match(byte[] source, int index) {
            if (source[index] != '#' || index + 1 >= source.length || !isIdentifierPart(source[index + 1])) {
                return Optional.empty();
            }
            int start = index;
            index++;
            while (index < source.length && isIdentifierPart(source[index])) {
                index++;
            }
            return Optional.of(new Token(TokenType.SYMBOL, image(source, start, index), start, index));
        }
    }

    static class StringPattern implements Pattern {
        @Override
        public Optional<Token> match(byte[] source, int index) {
            if (source[index] != '"') {
                return Optional.empty();
            }
            int start = index;
            index++;
            while (index < source.length && source[index] != '"') {
                if (source[index] == '\\') {
                    index++;
                }
                index++;
            }
            if (index >= source.length) {
                // unterminated, swallow the rest of the input
                return Optional.of(new Token(TokenType.ERROR, image(source, start, source.length), start, source.length));
            }
            index++;
            return Optional.of(new Token(TokenType.STRING, image(source, start, index), start, index));
        }
    }

    static class CommentPattern implements Pattern {
        @Override
        public Optional<Token> match(byte[] source, int index) {
            if (index + 1 >= source.length || source[index] != '/' || source[index + 1] != '/') {
                return Optional.empty();
            }
            int start = index;
            index += 2;
            while (index < source.length && source[index] != '\n') {
                index++;
            }
            return Optional.of(new Token(TokenType.COMMENT, image(source, start, index), start, index));
        }

        @Override
        public int priority() {
            return Integer.MAX_VALUE;
        }
    }

    public record Token(TokenType type, String image, int start, int end) {
        public int length() {
            return end - start;
        }

        /**
         * Exclusive end of the bytes examined to produce this token. Every
         * pattern decides by looking at most one byte past the token.
         */
        public int lookahead() {
            return end + 1;
        }
    }

    public enum TokenType {
        NULL("null", true),
        TRUE("true", true),
        FALSE("false", true),

        INTEGER,
        STRING,
        SYMBOL,
        IDENTIFIER,

        COMMENT,

        COLON_EQUALS(":="),
        ARROW("=>"),
        COLON(":"),
        SEMICOLON(";"),
        COMMA(","),
        DOT("."),
        LBRACE("{"),
        RBRACE("}"),
        LBRACKET("["),
        RBRACKET("]"),
        LPAREN("("),
        RPAREN(")"),

        ERROR,
        EOF;

        final String constantPattern;
        final boolean keyword;

        TokenType() {
            this(null);
        }

        TokenType(String constantPattern) {
            this(constantPattern, false);
        }

        TokenType(String constantPattern, boolean keyword) {
            this.constantPattern = constantPattern;
            this.keyword = keyword;
        }

        static Optional<TokenType> keyword(String image) {
            for (var type : values()) {
                if (type.keyword && type.constantPattern.equals(image)) {
                    return Optional.of(type);
                }
            }
            return Optional.empty();
        }
    }

    /**
     * Lazy token stream used by the parser. Comments are skipped. The stream
     * can be repositioned with {@link #seek(int)} which is how reused subtrees
     * are stepped over.
     */
    public static class Tokens {
        private final Tokenizer tokenizer;
        private final byte[] source;
        private final List<Token> buffer = new ArrayList<>();
        private int position;
        private int maxLookahead;
        private int[] lineStarts;

        Tokens(Tokenizer tokenizer, byte[] source) {
            this.tokenizer = tokenizer;
            this.source = source;
        }

        public byte[] source() {
            return source;
        }

        public Token next() {
            var token = peek();
            buffer.remove(0);
            position = token.end();
            return token;
        }

        public Token peek() {
            return peek(0);
        }

        /**
         * Looks {@code offset} tokens ahead without consuming anything.
         */
        public Token peek(int offset) {
            while (buffer.size() <= offset) {
                int from = buffer.isEmpty() ? position : buffer.get(buffer.size() - 1).end();
                var token = tokenizer.lex(source, from);
                while (token.type() == TokenType.COMMENT) {
                    token = tokenizer.lex(source, token.end());
                }
                maxLookahead = Math.max(maxLookahead, token.lookahead());
                buffer.add(token);
                if (token.type() == TokenType.EOF) {
                    break;
                }
            }
            return buffer.get(Math.min(offset, buffer.size() - 1));
        }

        public boolean matches(TokenType... types) {
            TokenType peekType = peek().type();
            for (var type : types) {
                if (peekType == type) {
                    return true;
                }
            }
            return false;
        }

        public Token peek(TokenType type) {
            var token = peek();
            if (token.type() != type) {
                throw new UnexpectedTokenException(type, token);
            }
            return token;
        }

        public Token next(TokenType type) {
            peek(type);
            return next();
        }

        /**
         * Drops any buffered lookahead and continues lexing at {@code offset}.
         */
        public void seek(int offset) {
            buffer.clear();
            position = offset;
        }

        /**
         * Restarts lookahead accounting at the already peeked token.
         */
        public void resetLookahead() {
            maxLookahead = peek().lookahead();
            for (var token : buffer) {
                maxLookahead = Math.max(maxLookahead, token.lookahead());
            }
        }

        public int maxLookahead() {
            return maxLookahead;
        }

        /**
         * Row/column of a byte offset; columns count bytes.
         */
        public Point pointAt(int offset) {
            if (lineStarts == null) {
                lineStarts = lineStarts(source);
            }
            int low = 0;
            int high = lineStarts.length - 1;
            while (low < high) {
                int mid = (low + high + 1) >>> 1;
                if (lineStarts[mid] <= offset) {
                    low = mid;
                } else {
                    high = mid - 1;
                }
            }
            return new Point(low, offset - lineStarts[low]);
        }

        private static int[] lineStarts(byte[] source) {
            int lines = 1;
            for (byte b : source) {
                if (b == '\n') {
                    lines++;
                }
            }
            int[] starts = new int[lines];
            int line = 1;
            for (int i = 0; i < source.length; i++) {
                if (source[i] == '\n') {
                    starts[line++] = i + 1;
                }
            }
            return starts;
        }
    }

    public static class UnexpectedTokenException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        private final transient Token token;

        public UnexpectedTokenException(TokenType expected, Token token) {
            this("expected " + expected + " but got " + token, token);
        }

        public UnexpectedTokenException(String message, Token token) {
            super(message);
            this.token = token;
        }

        public Token token() {
            return token;
        }
    }

}
