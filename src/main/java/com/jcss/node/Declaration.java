package com.jcss.node;

public final class Declaration extends Node {
    private String prop;
    private String value;
    private boolean important;

    public Declaration(String prop, String value) {
        this(prop, value, false);
    }

    public Declaration(String prop, String value, boolean important) {
        this.prop = prop;
        this.value = value;
        this.important = important;
    }

    @Override
    public NodeType type() {
        return NodeType.DECLARATION;
    }

    public String prop() {
        return prop;
    }

    public Declaration setProp(String prop) {
        this.prop = prop;
        return this;
    }

    public String value() {
        return value;
    }

    public Declaration setValue(String value) {
        this.value = value;
        return this;
    }

    public boolean important() {
        return important;
    }

    public Declaration setImportant(boolean important) {
        this.important = important;
        return this;
    }

    @Override
    public Declaration copy() {
        return copyBaseInto(new Declaration(prop, value, important));
    }

    @Override
    boolean sameFields(Node other) {
        Declaration that = (Declaration) other;
        return prop.equals(that.prop) && value.equals(that.value) && important == that.important;
    }
}
