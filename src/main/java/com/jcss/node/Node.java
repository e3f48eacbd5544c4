package com.jcss.node;

import com.jcss.output.Stringifier;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;

public abstract sealed class Node permits Container, Declaration, Comment {
    Container parent;
    private final MutableMap<Raw, String> raws = Maps.mutable.empty();
    private Source source;

    public abstract NodeType type();

    /**
     * Deep copy of this node. The copy keeps raws and source but has no parent.
     */
    public abstract Node copy();

    abstract boolean sameFields(Node other);

    public Container parent() {
        return parent;
    }

    public Root root() {
        Node node = this;
        while (node.parent != null) {
            node = node.parent;
        }
        return node instanceof Root root ? root : null;
    }

    public int index() {
        return parent == null ? -1 : parent.index(this);
    }

    public Node next() {
        if (parent == null) {
            return null;
        }
        int index = parent.index(this);
        return index + 1 < parent.size() ? parent.get(index + 1) : null;
    }

    public Node prev() {
        if (parent == null) {
            return null;
        }
        int index = parent.index(this);
        return index > 0 ? parent.get(index - 1) : null;
    }

    public Node remove() {
        if (parent != null) {
            parent.removeChild(this);
        }
        return this;
    }

    /**
     * Puts the given nodes where this node is and detaches this node.
     * A running traversal of the parent does not visit the replacements.
     */
    public Node replaceWith(Node... replacements) {
        if (parent == null) {
            throw new IllegalStateException("Cannot replace a node without parent");
        }
        for (Node replacement : replacements) {
            if (replacement != this) {
                parent.insertBefore(this, replacement);
            }
        }
        return remove();
    }

    public Node moveTo(Container container) {
        container.append(this);
        return this;
    }

    public Node moveBefore(Node other) {
        requireParent(other).insertBefore(other, this);
        return this;
    }

    public Node moveAfter(Node other) {
        requireParent(other).insertAfter(other, this);
        return this;
    }

    public MutableMap<Raw, String> raws() {
        return raws;
    }

    public String raw(Raw slot) {
        return raws.get(slot);
    }

    public boolean hasRaw(Raw slot) {
        return raws.containsKey(slot);
    }

    public Node setRaw(Raw slot, String value) {
        if (value == null) {
            raws.remove(slot);
        } else {
            raws.put(slot, value);
        }
        return this;
    }

    public Node clearRaws() {
        raws.clear();
        return this;
    }

    public Source source() {
        return source;
    }

    public void setSource(Source source) {
        this.source = source;
    }

    /**
     * Compares type, semantic fields and children. Raws and source are ignored.
     */
    public boolean structurallyEquals(Node other) {
        if (other == this) {
            return true;
        }
        if (other == null || other.type() != type() || !sameFields(other)) {
            return false;
        }
        if (this instanceof Container container) {
            Container that = (Container) other;
            if (container.hasBody() != that.hasBody() || container.size() != that.size()) {
                return false;
            }
            for (int i = 0; i < container.size(); i++) {
                if (!container.get(i).structurallyEquals(that.get(i))) {
                    return false;
                }
            }
        }
        return true;
    }

    <T extends Node> T copyBaseInto(T copy) {
        copy.raws().putAll(raws);
        copy.setSource(source);
        return copy;
    }

    @Override
    public String toString() {
        return new Stringifier().stringify(this);
    }

    private static Container requireParent(Node node) {
        if (node.parent == null) {
            throw new IllegalArgumentException("Target node has no parent");
        }
        return node.parent;
    }
}
