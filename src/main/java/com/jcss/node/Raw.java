package com.jcss.node;

/**
 * Formatting slots a node may carry. The stored text is exactly what occupied the
 * slot in the source; a missing slot is filled in by the stringifier.
 */
public enum Raw {
    /** Whitespace (and stray semicolons) before the node. */
    BEFORE("before"),
    /** Whitespace before the closing brace of a block, or at the end of a root. */
    AFTER("after"),
    /** Selector or params to the opening brace; prop to value, colon included. */
    BETWEEN("between"),
    /** {@code ";"} when the last statement of a block ended with a semicolon, else {@code ""}. */
    SEMICOLON("semicolon"),
    /** The {@code !important} marker with its leading whitespace. */
    IMPORTANT("important"),
    /** Whitespace between an at-rule name and its params. */
    AFTER_NAME("afterName"),
    /** Whitespace between a declaration value and its terminating semicolon. */
    AFTER_VALUE("afterValue"),
    LEFT("left"),
    RIGHT("right");

    private final String key;

    Raw(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Raw fromKey(String key) {
        for (Raw raw : values()) {
            if (raw.key.equals(key)) {
                return raw;
            }
        }
        throw new IllegalArgumentException("Unknown raw slot: " + key);
    }
}
