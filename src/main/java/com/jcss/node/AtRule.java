package com.jcss.node;

/**
 * An {@code @}-directive. Statement at-rules such as {@code @import} have no body;
 * block at-rules such as {@code @media} do. Appending a child opens a body.
 */
public final class AtRule extends Container {
    private String name;
    private String params;

    public AtRule(String name) {
        this(name, "");
    }

    public AtRule(String name, String params) {
        super(false);
        this.name = name;
        this.params = params;
    }

    @Override
    public NodeType type() {
        return NodeType.AT_RULE;
    }

    public String name() {
        return name;
    }

    public AtRule setName(String name) {
        this.name = name;
        return this;
    }

    public String params() {
        return params;
    }

    public AtRule setParams(String params) {
        this.params = params;
        return this;
    }

    @Override
    public AtRule ensureBody() {
        super.ensureBody();
        return this;
    }

    @Override
    public AtRule copy() {
        return copyChildrenInto(new AtRule(name, params));
    }

    @Override
    boolean sameFields(Node other) {
        AtRule that = (AtRule) other;
        return name.equals(that.name) && params.equals(that.params);
    }
}
