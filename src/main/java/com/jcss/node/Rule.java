package com.jcss.node;

public final class Rule extends Container {
    private String selector;

    public Rule(String selector) {
        super(true);
        this.selector = selector;
    }

    @Override
    public NodeType type() {
        return NodeType.RULE;
    }

    public String selector() {
        return selector;
    }

    public Rule setSelector(String selector) {
        this.selector = selector;
        return this;
    }

    @Override
    public Rule copy() {
        return copyChildrenInto(new Rule(selector));
    }

    @Override
    boolean sameFields(Node other) {
        return selector.equals(((Rule) other).selector);
    }
}
