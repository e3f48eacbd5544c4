package com.jcss;

import com.jcss.node.AtRule;
import com.jcss.node.Comment;
import com.jcss.node.Declaration;
import com.jcss.node.Node;
import com.jcss.node.Root;
import com.jcss.node.Rule;
import com.jcss.output.Stringifier;
import com.jcss.parse.CssParser;
import com.jcss.pipeline.Processor;
import com.jcss.pipeline.Transform;

/**
 * Entry points for parsing, building and processing CSS.
 */
public final class Css {
    private Css() {
    }

    public static Root parse(String css) {
        return new CssParser(css).parse();
    }

    public static Root parse(String css, String from) {
        return new CssParser(css, from).parse();
    }

    public static Root root() {
        return new Root();
    }

    public static Rule rule(String selector) {
        return new Rule(selector);
    }

    public static AtRule atRule(String name) {
        return new AtRule(name);
    }

    public static AtRule atRule(String name, String params) {
        return new AtRule(name, params);
    }

    public static Declaration decl(String prop, String value) {
        return new Declaration(prop, value);
    }

    public static Comment comment(String text) {
        return new Comment(text);
    }

    public static Processor processor(Transform... transforms) {
        return Processor.of(transforms);
    }

    public static Processor processor(Iterable<?> units) {
        return new Processor(units);
    }

    public static String stringify(Node node) {
        return new Stringifier().stringify(node);
    }
}
