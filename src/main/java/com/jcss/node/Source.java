package com.jcss.node;

/**
 * Where a node came from. Only used for error reporting, never for output.
 *
 * @param file source label, or null when none was given
 * @param start position of the first character of the node
 * @param end position of the last character, or null while the node is still open
 */
public record Source(String file, Position start, Position end) {
    public Source withEnd(Position end) {
        return new Source(file, start, end);
    }
}
