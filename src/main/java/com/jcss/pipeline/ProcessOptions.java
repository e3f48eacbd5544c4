package com.jcss.pipeline;

/**
 * Options for one pipeline run, handed unchanged to every transform unit.
 *
 * @param from source label used in error messages and in node sources, may be null
 */
public record ProcessOptions(String from) {
    private static final ProcessOptions DEFAULTS = new ProcessOptions(null);

    public static ProcessOptions defaults() {
        return DEFAULTS;
    }

    public static ProcessOptions from(String from) {
        return new ProcessOptions(from);
    }
}
