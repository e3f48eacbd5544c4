package com.jcss.json;

import com.jcss.node.AtRule;
import com.jcss.node.Declaration;
import com.jcss.node.Node;
import com.jcss.node.Raw;
import com.jcss.node.Root;
import com.jcss.node.Rule;
import com.jcss.output.Stringifier;
import com.jcss.parse.CssParser;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class NodeJsonTest {

    private final NodeJsonWriter compact = new NodeJsonWriter(false);
    private final NodeJsonReader reader = new NodeJsonReader();

    @Test
    public void testCompactDeclaration() throws IOException {
        String json = compact.write(new Declaration("color", "red"));

        assertEquals("{\"type\":\"decl\",\"prop\":\"color\",\"value\":\"red\",\"raws\":{}}", json);
    }

    @Test
    public void testImportantAndRaws() throws IOException {
        Declaration decl = new Declaration("color", "red", true);
        decl.setRaw(Raw.BETWEEN, ":");

        String json = compact.write(decl);

        assertEquals("{\"type\":\"decl\",\"prop\":\"color\",\"value\":\"red\",\"important\":true,"
            + "\"raws\":{\"between\":\":\"}}", json);
    }

    @Test
    public void testBodilessAtRuleHasNoNodes() throws IOException {
        String json = compact.write(new AtRule("import", "'a.css'"));

        assertFalse(json.contains("\"nodes\""));
        assertTrue(compact.write(new AtRule("media", "print").ensureBody()).contains("\"nodes\":[]"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "a { color: red !important; }\n",
        "@import url(a.css);\n@media print {\n  /* note */\n  b{top:0}\n}",
        "@font-face{}a::before{content:\"\\\"\"}"
    })
    public void testExportImportKeepsOutput(String css) throws IOException {
        Root root = new CssParser(css, "in.css").parse();

        String json = new NodeJsonWriter(true).write(root);
        Node restored = reader.read(json);

        assertTrue(restored instanceof Root);
        assertEquals(css, new Stringifier().stringify(restored));
        assertTrue(root.structurallyEquals(restored));
    }

    @Test
    public void testSourcesSurvive() throws IOException {
        Root root = new CssParser("a {\n  color: red;\n}", "in.css").parse();

        Root restored = (Root) reader.read(new ByteArrayInputStream(
            compact.write(root).getBytes(StandardCharsets.UTF_8)));

        Declaration decl = (Declaration) ((Rule) restored.first()).first();
        assertEquals("in.css", decl.source().file());
        assertEquals("2:3", decl.source().start().toString());
        assertEquals("2:13", decl.source().end().toString());
        assertSame(restored, decl.root());
    }

    @Test
    public void testFieldOrderDoesNotMatter() throws IOException {
        Node node = reader.read("{\"nodes\":[{\"value\":\"1\",\"prop\":\"a\",\"type\":\"decl\"}],"
            + "\"selector\":\"x\",\"type\":\"rule\",\"extra\":{\"ignored\":[1,2]}}");

        Rule rule = (Rule) node;
        assertEquals("x", rule.selector());
        assertEquals("a", ((Declaration) rule.first()).prop());
    }

    @Test
    public void testUnknownTypeFails() {
        IOException error = assertThrows(IOException.class, () -> reader.read("{\"type\":\"media\"}"));

        assertEquals("Unknown node type: media", error.getMessage());
    }

    @Test
    public void testMalformedInputFails() {
        assertThrows(IOException.class, () -> reader.read("[1,2]"));
        assertThrows(IOException.class, () -> reader.read("{\"type\":\"decl\",\"nodes\":[]}"));
        assertThrows(IOException.class, () -> reader.read("{\"type\":\"decl\",\"raws\":{\"colon\":\":\"}}"));
        assertThrows(IOException.class, () -> reader.read("{\"type\":"));
    }
}
