package com.jcss.node;

public final class Comment extends Node {
    private String text;

    public Comment(String text) {
        this.text = text;
    }

    @Override
    public NodeType type() {
        return NodeType.COMMENT;
    }

    public String text() {
        return text;
    }

    public Comment setText(String text) {
        this.text = text;
        return this;
    }

    @Override
    public Comment copy() {
        return copyBaseInto(new Comment(text));
    }

    @Override
    boolean sameFields(Node other) {
        return text.equals(((Comment) other).text);
    }
}
