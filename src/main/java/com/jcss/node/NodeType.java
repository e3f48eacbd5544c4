package com.jcss.node;

public enum NodeType {
    ROOT("root"),
    RULE("rule"),
    AT_RULE("atrule"),
    DECLARATION("decl"),
    COMMENT("comment");

    private final String label;

    NodeType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static NodeType fromLabel(String label) {
        for (NodeType type : values()) {
            if (type.label.equals(label)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown node type: " + label);
    }
}
