package com.jcss.node;

import java.util.Map;

/**
 * Turns a plain field map such as {@code {prop: "color", value: "black"}} into a node.
 * The kind of node is decided by the key that only that kind has.
 */
public final class NodeFields {
    private NodeFields() {
    }

    public static Node toNode(Map<String, ?> fields) {
        if (fields.containsKey("prop")) {
            return new Declaration(text(fields, "prop"), text(fields, "value"), flag(fields, "important"));
        }
        if (fields.containsKey("selector")) {
            return new Rule(text(fields, "selector"));
        }
        if (fields.containsKey("name")) {
            return new AtRule(text(fields, "name"), text(fields, "params"));
        }
        if (fields.containsKey("text")) {
            return new Comment(text(fields, "text"));
        }
        throw new IllegalArgumentException("Unknown node type for fields: " + fields.keySet());
    }

    private static String text(Map<String, ?> fields, String key) {
        Object value = fields.get(key);
        return value == null ? "" : value.toString();
    }

    private static boolean flag(Map<String, ?> fields, String key) {
        Object value = fields.get(key);
        if (value instanceof Boolean bool) {
            return bool;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }
}
