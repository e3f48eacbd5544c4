package com.jcss.node;

public final class Root extends Container {
    public Root() {
        super(true);
    }

    @Override
    public NodeType type() {
        return NodeType.ROOT;
    }

    @Override
    public Root copy() {
        return copyChildrenInto(new Root());
    }

    @Override
    boolean sameFields(Node other) {
        return true;
    }
}
