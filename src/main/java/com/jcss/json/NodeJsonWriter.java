package com.jcss.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.jcss.node.AtRule;
import com.jcss.node.Comment;
import com.jcss.node.Container;
import com.jcss.node.Declaration;
import com.jcss.node.Node;
import com.jcss.node.Position;
import com.jcss.node.Raw;
import com.jcss.node.Rule;
import com.jcss.node.Source;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;

/**
 * Writes a node tree as JSON, raws and sources included.
 */
public class NodeJsonWriter {
    private final JsonFactory factory = new JsonFactory();
    private final boolean prettyPrint;

    public NodeJsonWriter(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
    }

    public String write(Node node) throws IOException {
        StringWriter out = new StringWriter();
        write(node, out);
        return out.toString();
    }

    public void write(Node node, Writer out) throws IOException {
        try (JsonGenerator generator = factory.createGenerator(out)) {
            if (prettyPrint) {
                generator.useDefaultPrettyPrinter();
            }
            writeNode(node, generator);
        }
    }

    private void writeNode(Node node, JsonGenerator generator) throws IOException {
        generator.writeStartObject();
        generator.writeStringField("type", node.type().label());

        switch (node.type()) {
            case RULE -> generator.writeStringField("selector", ((Rule) node).selector());
            case AT_RULE -> {
                AtRule atRule = (AtRule) node;
                generator.writeStringField("name", atRule.name());
                generator.writeStringField("params", atRule.params());
            }
            case DECLARATION -> {
                Declaration decl = (Declaration) node;
                generator.writeStringField("prop", decl.prop());
                generator.writeStringField("value", decl.value());
                if (decl.important()) {
                    generator.writeBooleanField("important", true);
                }
            }
            case COMMENT -> generator.writeStringField("text", ((Comment) node).text());
            default -> {
            }
        }

        generator.writeObjectFieldStart("raws");
        for (Raw slot : Raw.values()) {
            String value = node.raw(slot);
            if (value != null) {
                generator.writeStringField(slot.key(), value);
            }
        }
        generator.writeEndObject();

        Source source = node.source();
        if (source != null) {
            writeSource(source, generator);
        }

        if (node instanceof Container container && container.hasBody()) {
            generator.writeArrayFieldStart("nodes");
            for (Node child : container.nodes()) {
                writeNode(child, generator);
            }
            generator.writeEndArray();
        }
        generator.writeEndObject();
    }

    private void writeSource(Source source, JsonGenerator generator) throws IOException {
        generator.writeObjectFieldStart("source");
        if (source.file() != null) {
            generator.writeStringField("file", source.file());
        }
        writePosition("start", source.start(), generator);
        writePosition("end", source.end(), generator);
        generator.writeEndObject();
    }

    private void writePosition(String field, Position position, JsonGenerator generator) throws IOException {
        if (position == null) {
            return;
        }
        generator.writeObjectFieldStart(field);
        generator.writeNumberField("line", position.line());
        generator.writeNumberField("column", position.column());
        generator.writeEndObject();
    }
}
