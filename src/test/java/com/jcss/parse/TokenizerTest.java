package com.jcss.parse;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static com.jcss.parse.TokenType.*;
import static org.junit.jupiter.api.Assertions.*;

public class TokenizerTest {

    private static MutableList<Token> tokenize(String css) {
        Tokenizer tokenizer = new Tokenizer(css, null);
        MutableList<Token> tokens = Lists.mutable.empty();
        Token token;
        while ((token = tokenizer.nextToken()) != null) {
            tokens.add(token);
        }
        return tokens;
    }

    @Test
    public void testSimpleRule() {
        MutableList<Token> tokens = tokenize("a{color:red}");

        assertEquals(Lists.mutable.with(WORD, OPEN_CURLY, WORD, COLON, WORD, CLOSE_CURLY),
            tokens.collect(Token::type));
        assertEquals("color", tokens.get(2).text());
    }

    @Test
    public void testAtWordAndString() {
        MutableList<Token> tokens = tokenize("@import 'a.css';");

        assertEquals(Lists.mutable.with(AT_WORD, SPACE, STRING, SEMICOLON), tokens.collect(Token::type));
        assertEquals("@import", tokens.get(0).text());
        assertEquals("'a.css'", tokens.get(2).text());
    }

    @Test
    public void testBracketsAndCombinators() {
        MutableList<Token> tokens = tokenize("a>b[x]");

        assertEquals(Lists.mutable.with(WORD, COMBINATOR, WORD, OPEN_BRACKET, WORD, CLOSE_BRACKET),
            tokens.collect(Token::type));
    }

    @Test
    public void testAtSignInsideWord() {
        MutableList<Token> tokens = tokenize("a@b");

        assertEquals(1, tokens.size());
        assertEquals("a@b", tokens.get(0).text());
    }

    @Test
    public void testCommentToken() {
        MutableList<Token> tokens = tokenize("a/* x */b");

        assertEquals(Lists.mutable.with(WORD, COMMENT, WORD), tokens.collect(Token::type));
        assertEquals("/* x */", tokens.get(1).text());
    }

    @Test
    public void testEscapedCharacterStaysInWord() {
        MutableList<Token> tokens = tokenize("a\\:b");

        assertEquals(1, tokens.size());
        assertEquals("a\\:b", tokens.get(0).text());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "a { color: red; }",
        "@media (max-width: 100px) { a { b: c } }",
        "/* comment */ a::before { content: \"\\\"}\" }",
        "a,\r\nb > c ~ d + e {}",
        "  \n\t"
    })
    public void testTokensCoverInput(String css) {
        assertEquals(css, tokenize(css).collect(Token::text).makeString(""));
    }

    @Test
    public void testPositions() {
        MutableList<Token> tokens = tokenize("a\n  b");

        Token b = tokens.getLast();
        assertEquals(2, b.line());
        assertEquals(3, b.column());
    }

    @Test
    public void testCarriageReturnLineFeedCountsAsOneLine() {
        Token b = tokenize("a\r\nb").getLast();

        assertEquals(2, b.line());
        assertEquals(1, b.column());
    }

    @Test
    public void testTokenEnd() {
        Token comment = tokenize("/* a\nbc */").getFirst();

        assertEquals("2:5", comment.end().toString());
    }

    @Test
    public void testBackReturnsTokenAgain() {
        Tokenizer tokenizer = new Tokenizer("a b", null);
        Token first = tokenizer.nextToken();
        tokenizer.back(first);

        assertSame(first, tokenizer.nextToken());
        assertEquals(SPACE, tokenizer.nextToken().type());
        assertEquals("b", tokenizer.nextToken().text());
        assertTrue(tokenizer.endOfFile());
        assertNull(tokenizer.nextToken());
    }

    // ============================================================
    // Errors
    // ============================================================

    @Test
    public void testUnclosedString() {
        CssSyntaxError error = assertThrows(CssSyntaxError.class, () -> tokenize("a { content: 'x"));

        assertEquals(CssSyntaxError.Kind.UNCLOSED_STRING, error.getKind());
        assertEquals(1, error.getLine());
        assertEquals(14, error.getColumn());
        assertEquals("1:14: Unclosed string", error.getMessage());
    }

    @Test
    public void testUnclosedCommentPosition() {
        CssSyntaxError error = tokenizeError("\n/* abc", "x.css");

        assertEquals("x.css:2:1: Unclosed comment", error.getMessage());
        assertEquals("x.css", error.getFile());
        assertEquals("Unclosed comment", error.getReason());
    }

    private static CssSyntaxError tokenizeError(String css, String from) {
        Tokenizer tokenizer = new Tokenizer(css, from);
        return assertThrows(CssSyntaxError.class, () -> {
            while (tokenizer.nextToken() != null) {
                // drain
            }
        });
    }
}
