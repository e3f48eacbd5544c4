package com.jcss.parse;

import com.jcss.node.Position;

/**
 * Malformed CSS. The message has the form {@code file:line:column: reason}; the
 * file segment is left out when the input had no source label.
 */
public class CssSyntaxError extends RuntimeException {
    public enum Kind {
        UNCLOSED_BLOCK("Unclosed block"),
        UNCLOSED_STRING("Unclosed string"),
        UNCLOSED_COMMENT("Unclosed comment"),
        UNCLOSED_BRACKET("Unclosed bracket"),
        UNEXPECTED_CLOSE_BRACE("Unexpected }"),
        UNKNOWN_WORD("Unknown word");

        private final String reason;

        Kind(String reason) {
            this.reason = reason;
        }

        public String reason() {
            return reason;
        }
    }

    private final Kind kind;
    private final String file;
    private final int line;
    private final int column;

    public CssSyntaxError(Kind kind, String file, int line, int column) {
        super(format(file, line, column, kind.reason()));
        this.kind = kind;
        this.file = file;
        this.line = line;
        this.column = column;
    }

    public CssSyntaxError(Kind kind, String file, Position position) {
        this(kind, file, position.line(), position.column());
    }

    public Kind getKind() {
        return kind;
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getReason() {
        return kind.reason();
    }

    private static String format(String file, int line, int column, String reason) {
        String location = line + ":" + column;
        return (file == null ? location : file + ":" + location) + ": " + reason;
    }
}
