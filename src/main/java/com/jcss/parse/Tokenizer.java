package com.jcss.parse;

import com.jcss.node.Position;

import java.util.ArrayDeque;
import java.util.Deque;

import static com.jcss.parse.TokenType.*;

/**
 * Splits CSS text into tokens on demand. The concatenated token texts always equal
 * the input, so nothing is lost between tokenizing and printing.
 * <p>
 * A tokenizer is single use: tokens are produced once and cannot be rewound, apart
 * from the ones handed back through {@link #back(Token)}.
 */
public class Tokenizer {
    private final String css;
    private final String from;
    private final Deque<Token> returned = new ArrayDeque<>();
    private int pos = 0;
    private int line = 1;
    private int column = 1;

    public Tokenizer(String css, String from) {
        this.css = css;
        this.from = from;
    }

    /**
     * @return the next token, or null at end of input
     * @throws CssSyntaxError for a string or comment that is still open at end of input
     */
    public Token nextToken() {
        if (!returned.isEmpty()) {
            return returned.pop();
        }
        if (pos >= css.length()) {
            return null;
        }

        int start = pos;
        int startLine = line;
        int startColumn = column;
        char c = css.charAt(pos);

        TokenType type = switch (c) {
            case ' ', '\t', '\n', '\r', '\f' -> {
                while (pos < css.length() && isSpace(css.charAt(pos))) {
                    advance();
                }
                yield SPACE;
            }
            case '\'', '"' -> {
                readString(c, startLine, startColumn);
                yield STRING;
            }
            case '{' -> {
                advance();
                yield OPEN_CURLY;
            }
            case '}' -> {
                advance();
                yield CLOSE_CURLY;
            }
            case '(', '[' -> {
                advance();
                yield OPEN_BRACKET;
            }
            case ')', ']' -> {
                advance();
                yield CLOSE_BRACKET;
            }
            case ':' -> {
                advance();
                yield COLON;
            }
            case ';' -> {
                advance();
                yield SEMICOLON;
            }
            case '>', '+', '~', ',' -> {
                advance();
                yield COMBINATOR;
            }
            case '@' -> {
                advance();
                readWord();
                yield AT_WORD;
            }
            default -> {
                if (c == '/' && peek(1) == '*') {
                    readComment(startLine, startColumn);
                    yield COMMENT;
                }
                readWord();
                yield WORD;
            }
        };

        return new Token(type, css.substring(start, pos), startLine, startColumn);
    }

    /**
     * Hands a token back; it will be the next one returned.
     */
    public void back(Token token) {
        returned.push(token);
    }

    public boolean endOfFile() {
        return returned.isEmpty() && pos >= css.length();
    }

    public Position position() {
        return new Position(line, column);
    }

    private void readString(char quote, int startLine, int startColumn) {
        advance();
        while (true) {
            if (pos >= css.length()) {
                throw new CssSyntaxError(CssSyntaxError.Kind.UNCLOSED_STRING, from, startLine, startColumn);
            }
            char c = css.charAt(pos);
            advance();
            if (c == '\\') {
                if (pos < css.length()) {
                    advance();
                }
            } else if (c == quote) {
                return;
            }
        }
    }

    private void readComment(int startLine, int startColumn) {
        advance();
        advance();
        while (true) {
            if (pos >= css.length()) {
                throw new CssSyntaxError(CssSyntaxError.Kind.UNCLOSED_COMMENT, from, startLine, startColumn);
            }
            if (css.charAt(pos) == '*' && peek(1) == '/') {
                advance();
                advance();
                return;
            }
            advance();
        }
    }

    private void readWord() {
        while (pos < css.length()) {
            char c = css.charAt(pos);
            if (c == '\\') {
                advance();
                if (pos < css.length()) {
                    advance();
                }
                continue;
            }
            if (isWordEnd(c) || (c == '/' && peek(1) == '*')) {
                return;
            }
            advance();
        }
    }

    private void advance() {
        if (isLineBreak(css, pos)) {
            line++;
            column = 1;
        } else {
            column++;
        }
        pos++;
    }

    private char peek(int offset) {
        int index = pos + offset;
        return index < css.length() ? css.charAt(index) : '\0';
    }

    static boolean isLineBreak(String text, int index) {
        char c = text.charAt(index);
        if (c == '\n' || c == '\f') {
            return true;
        }
        // \r\n is counted once, on the \n
        return c == '\r' && (index + 1 >= text.length() || text.charAt(index + 1) != '\n');
    }

    static boolean isSpace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f';
    }

    private static boolean isWordEnd(char c) {
        return switch (c) {
            case ' ', '\t', '\n', '\r', '\f',
                 '\'', '"', '{', '}', '(', ')', '[', ']',
                 ':', ';', '>', '+', '~', ',' -> true;
            default -> false;
        };
    }
}
