package com.jcss.pipeline;

/**
 * Something that carries a transform unit, such as a configured plugin object.
 * Registering a provider registers the unit it returns.
 */
public interface PluginProvider {
    TransformUnit plugin();
}
