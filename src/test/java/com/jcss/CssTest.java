package com.jcss;

import com.jcss.node.Root;
import com.jcss.node.Rule;
import com.jcss.pipeline.Result;
import com.jcss.pipeline.Transform;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CssTest {

    @Test
    public void testBuilderPath() {
        Root root = Css.root();
        Rule rule = Css.rule("a");
        rule.append(Css.decl("color", "black"));
        root.append(rule);

        assertEquals("a {\n    color: black\n}", Css.stringify(root));
        assertEquals(Css.stringify(root), root.toString());
    }

    @Test
    public void testParseAndStringify() {
        String css = "@media print{a{color:red}}/* x */";

        assertEquals(css, Css.stringify(Css.parse(css)));
        assertEquals("in.css", Css.parse(css, "in.css").source().file());
    }

    @Test
    public void testProcessorComposition() {
        Transform rename = (root, options) -> {
            root.eachRule(rule -> rule.setSelector(rule.selector() + ".x"));
            return null;
        };
        Transform addComment = (root, options) -> {
            root.prepend(Css.comment("generated"));
            return null;
        };

        Result result = Css.processor(List.of(rename, addComment)).process("a{}");

        assertEquals("/* generated */a.x{}", result.css());
        assertEquals(2, Css.processor(rename, addComment).units().size());
    }

    @Test
    public void testAtRuleBuilders() {
        Root root = Css.root();
        root.append(Css.atRule("import", "'a.css'"));
        root.append(Css.atRule("font-face").ensureBody());

        assertEquals("@import 'a.css';\n@font-face {}", Css.stringify(root));
    }
}
