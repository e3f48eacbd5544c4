package com.jcss.parse;

public enum TokenType {
    SPACE,
    WORD,
    STRING,
    COMMENT,
    AT_WORD,
    OPEN_CURLY,
    CLOSE_CURLY,
    OPEN_BRACKET,
    CLOSE_BRACKET,
    COLON,
    SEMICOLON,
    COMBINATOR
}
