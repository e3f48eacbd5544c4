package com.jcss.node;

import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.primitive.MutableIntIntMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.map.mutable.primitive.IntIntHashMap;

import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * A node that owns an ordered list of children.
 * <p>
 * Traversals are index based. Each running traversal keeps a cursor (the index of
 * the child it visited last) in {@link #cursors}; every insertion or removal shifts
 * the cursors at or after the touched index, so callbacks may insert, remove or
 * replace nodes without a later sibling being skipped or visited twice.
 */
public abstract sealed class Container extends Node permits Root, Rule, AtRule {
    MutableList<Node> nodes;
    private final MutableIntIntMap cursors = new IntIntHashMap();
    private int lastCursor;

    protected Container(boolean withBody) {
        this.nodes = withBody ? Lists.mutable.empty() : null;
    }

    public boolean hasBody() {
        return nodes != null;
    }

    public Container ensureBody() {
        if (nodes == null) {
            nodes = Lists.mutable.empty();
        }
        return this;
    }

    public ListIterable<Node> nodes() {
        return nodes == null ? Lists.immutable.empty() : nodes.asUnmodifiable();
    }

    public int size() {
        return nodes == null ? 0 : nodes.size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public Node get(int index) {
        if (nodes == null) {
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds for length 0");
        }
        return nodes.get(index);
    }

    public Node first() {
        return isEmpty() ? null : nodes.getFirst();
    }

    public Node last() {
        return isEmpty() ? null : nodes.getLast();
    }

    public int index(Node child) {
        return nodes == null ? -1 : nodes.detectIndex(node -> node == child);
    }

    // Mutation

    public Container append(Node... children) {
        ensureBody();
        for (Node child : expand(children)) {
            adopt(child);
            insertAt(nodes.size(), child);
        }
        return this;
    }

    public Container append(Map<String, ?> fields) {
        return append(NodeFields.toNode(fields));
    }

    public Container prepend(Node... children) {
        ensureBody();
        int position = 0;
        for (Node child : expand(children)) {
            adopt(child);
            insertAt(position++, child);
        }
        return this;
    }

    public Container prepend(Map<String, ?> fields) {
        return prepend(NodeFields.toNode(fields));
    }

    public Container insertBefore(Node exist, Node... children) {
        requireChild(exist);
        for (Node child : expand(children)) {
            if (child == exist) {
                continue;
            }
            adopt(child);
            insertAt(index(exist), child);
        }
        return this;
    }

    public Container insertBefore(Node exist, Map<String, ?> fields) {
        return insertBefore(exist, NodeFields.toNode(fields));
    }

    public Container insertAfter(Node exist, Node... children) {
        requireChild(exist);
        Node anchor = exist;
        for (Node child : expand(children)) {
            if (child == anchor) {
                continue;
            }
            adopt(child);
            insertAt(index(anchor) + 1, child);
            anchor = child;
        }
        return this;
    }

    public Container insertAfter(Node exist, Map<String, ?> fields) {
        return insertAfter(exist, NodeFields.toNode(fields));
    }

    public Container removeChild(Node child) {
        removeAt(requireChild(child));
        return this;
    }

    public Container removeAll() {
        if (nodes != null) {
            nodes.each(node -> node.parent = null);
            nodes.clear();
            for (int id : cursors.keySet().toArray()) {
                cursors.put(id, -1);
            }
        }
        return this;
    }

    // Traversal

    public void each(Consumer<? super Node> callback) {
        eachWhile(node -> {
            callback.accept(node);
            return true;
        });
    }

    /**
     * Visits direct children until the callback returns false.
     *
     * @return false if the callback stopped the iteration
     */
    public boolean eachWhile(Predicate<? super Node> callback) {
        if (nodes == null) {
            return true;
        }
        int id = openCursor();
        try {
            while (true) {
                int index = cursors.get(id) + 1;
                if (index >= nodes.size()) {
                    return true;
                }
                cursors.put(id, index);
                if (!callback.test(nodes.get(index))) {
                    return false;
                }
            }
        } finally {
            cursors.removeKey(id);
        }
    }

    public void walk(Consumer<? super Node> callback) {
        walkWhile(node -> {
            callback.accept(node);
            return true;
        });
    }

    /**
     * Depth-first walk over all descendants in document order, stopping as soon
     * as the callback returns false.
     */
    public boolean walkWhile(Predicate<? super Node> callback) {
        return eachWhile(child -> {
            if (!callback.test(child)) {
                return false;
            }
            return !(child instanceof Container container) || container.walkWhile(callback);
        });
    }

    public void eachRule(Consumer<? super Rule> callback) {
        walk(node -> {
            if (node instanceof Rule rule) {
                callback.accept(rule);
            }
        });
    }

    public void eachAtRule(Consumer<? super AtRule> callback) {
        walk(node -> {
            if (node instanceof AtRule atRule) {
                callback.accept(atRule);
            }
        });
    }

    public void eachDecl(Consumer<? super Declaration> callback) {
        walk(node -> {
            if (node instanceof Declaration decl) {
                callback.accept(decl);
            }
        });
    }

    public void eachDecl(String prop, Consumer<? super Declaration> callback) {
        eachDecl(decl -> {
            if (decl.prop().equals(prop)) {
                callback.accept(decl);
            }
        });
    }

    public void eachComment(Consumer<? super Comment> callback) {
        walk(node -> {
            if (node instanceof Comment comment) {
                callback.accept(comment);
            }
        });
    }

    public boolean some(Predicate<? super Node> predicate) {
        return !eachWhile(node -> !predicate.test(node));
    }

    public boolean every(Predicate<? super Node> predicate) {
        return eachWhile(predicate);
    }

    /**
     * Lazy view of the direct children of the given type. The loop body may mutate
     * this container: each step resumes after the node returned last, or at its old
     * index when that node was removed.
     */
    public <T extends Node> Iterable<T> children(Class<T> type) {
        return () -> new ChildIterator<>(type);
    }

    <T extends Container> T copyChildrenInto(T copy) {
        if (nodes != null) {
            copy.ensureBody();
            nodes.each(child -> copy.append(child.copy()));
        }
        return copyBaseInto(copy);
    }

    private int openCursor() {
        int id = ++lastCursor;
        cursors.put(id, -1);
        return id;
    }

    private void shiftCursors(int position, int delta) {
        for (int id : cursors.keySet().toArray()) {
            int cursor = cursors.get(id);
            if (cursor >= position) {
                cursors.put(id, cursor + delta);
            }
        }
    }

    private void insertAt(int position, Node child) {
        nodes.add(position, child);
        child.parent = this;
        shiftCursors(position, 1);
    }

    private void removeAt(int position) {
        Node removed = nodes.remove(position);
        removed.parent = null;
        shiftCursors(position, -1);
    }

    private void adopt(Node child) {
        for (Node ancestor = this; ancestor != null; ancestor = ancestor.parent) {
            if (ancestor == child) {
                throw new IllegalArgumentException("Cannot insert a node into itself or its descendant");
            }
        }
        ensureBody();
        if (child.parent != null) {
            child.parent.removeChild(child);
        }
    }

    private int requireChild(Node child) {
        int index = index(child);
        if (index < 0) {
            throw new IllegalArgumentException("Node is not a child of this " + type().label());
        }
        return index;
    }

    // A root passed as a child contributes its children instead of itself
    private static MutableList<Node> expand(Node[] children) {
        MutableList<Node> expanded = Lists.mutable.empty();
        for (Node child : children) {
            if (child instanceof Root root) {
                expanded.addAllIterable(root.nodes());
            } else {
                expanded.add(child);
            }
        }
        return expanded;
    }

    private final class ChildIterator<T extends Node> implements Iterator<T> {
        private final Class<T> type;
        private Node lastReturned;
        private int lastIndex = -1;
        private T next;

        ChildIterator(Class<T> type) {
            this.type = type;
        }

        @Override
        public boolean hasNext() {
            if (next != null) {
                return true;
            }
            int index = resumeIndex();
            while (index < size()) {
                Node node = nodes.get(index);
                if (type.isInstance(node)) {
                    next = type.cast(node);
                    lastReturned = node;
                    lastIndex = index;
                    return true;
                }
                index++;
            }
            return false;
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            T result = next;
            next = null;
            return result;
        }

        private int resumeIndex() {
            if (lastReturned == null) {
                return 0;
            }
            int current = index(lastReturned);
            return current >= 0 ? current + 1 : Math.min(lastIndex, size());
        }
    }
}
