package com.jcss.parse;

import com.jcss.node.Position;

public record Token(TokenType type, String text, int line, int column) {
    public Position position() {
        return new Position(line, column);
    }

    /**
     * Position of the last character of this token.
     */
    public Position end() {
        int endLine = line;
        int endColumn = column;
        for (int i = 0; i + 1 < text.length(); i++) {
            if (Tokenizer.isLineBreak(text, i)) {
                endLine++;
                endColumn = 1;
            } else {
                endColumn++;
            }
        }
        return new Position(endLine, endColumn);
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }
}
