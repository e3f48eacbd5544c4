package com.jcss.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.jcss.node.AtRule;
import com.jcss.node.Comment;
import com.jcss.node.Container;
import com.jcss.node.Declaration;
import com.jcss.node.Node;
import com.jcss.node.NodeType;
import com.jcss.node.Position;
import com.jcss.node.Raw;
import com.jcss.node.Root;
import com.jcss.node.Rule;
import com.jcss.node.Source;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

import java.io.IOException;
import java.io.InputStream;

/**
 * Rebuilds a node tree from the JSON written by {@link NodeJsonWriter}. Fields may
 * come in any order; unknown fields are skipped.
 */
public class NodeJsonReader {
    private final JsonFactory factory = new JsonFactory();

    public Node read(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            return readTop(parser);
        }
    }

    public Node read(String json) throws IOException {
        try (JsonParser parser = factory.createParser(json)) {
            return readTop(parser);
        }
    }

    private Node readTop(JsonParser parser) throws IOException {
        JsonToken token = parser.nextToken();
        if (token != JsonToken.START_OBJECT) {
            throw new IOException("Expected a node object but found: " + token);
        }
        return readNode(parser);
    }

    private Node readNode(JsonParser parser) throws IOException {
        MutableMap<String, String> fields = Maps.mutable.empty();
        MutableMap<Raw, String> raws = Maps.mutable.empty();
        MutableList<Node> children = null;
        Source source = null;
        boolean important = false;

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String fieldName = parser.getCurrentName();
            JsonToken token = parser.nextToken();
            switch (fieldName) {
                case "raws" -> readRaws(parser, token, raws);
                case "source" -> source = readSource(parser, token);
                case "nodes" -> children = readChildren(parser, token);
                case "important" -> important = token == JsonToken.VALUE_TRUE;
                default -> {
                    if (token == JsonToken.VALUE_STRING) {
                        fields.put(fieldName, parser.getText());
                    } else {
                        parser.skipChildren();
                    }
                }
            }
        }

        Node node = create(fields, important);
        raws.forEachKeyValue(node::setRaw);
        node.setSource(source);
        if (children != null) {
            if (!(node instanceof Container container)) {
                throw new IOException("Node of type " + node.type().label() + " cannot have children");
            }
            container.ensureBody();
            for (Node child : children) {
                container.append(child);
            }
        }
        return node;
    }

    private Node create(MutableMap<String, String> fields, boolean important) throws IOException {
        String type = fields.get("type");
        if (type == null) {
            throw new IOException("Node without type");
        }
        NodeType nodeType;
        try {
            nodeType = NodeType.fromLabel(type);
        } catch (IllegalArgumentException e) {
            throw new IOException("Unknown node type: " + type, e);
        }
        return switch (nodeType) {
            case ROOT -> new Root();
            case RULE -> new Rule(fields.getIfAbsentValue("selector", ""));
            case AT_RULE -> new AtRule(fields.getIfAbsentValue("name", ""), fields.getIfAbsentValue("params", ""));
            case DECLARATION -> new Declaration(fields.getIfAbsentValue("prop", ""),
                fields.getIfAbsentValue("value", ""), important);
            case COMMENT -> new Comment(fields.getIfAbsentValue("text", ""));
        };
    }

    private void readRaws(JsonParser parser, JsonToken token, MutableMap<Raw, String> raws) throws IOException {
        expect(JsonToken.START_OBJECT, token, "raws");
        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String key = parser.getCurrentName();
            JsonToken value = parser.nextToken();
            expect(JsonToken.VALUE_STRING, value, "raws." + key);
            try {
                raws.put(Raw.fromKey(key), parser.getText());
            } catch (IllegalArgumentException e) {
                throw new IOException(e.getMessage(), e);
            }
        }
    }

    private MutableList<Node> readChildren(JsonParser parser, JsonToken token) throws IOException {
        expect(JsonToken.START_ARRAY, token, "nodes");
        MutableList<Node> children = Lists.mutable.empty();
        while (true) {
            JsonToken element = parser.nextToken();
            if (element == JsonToken.END_ARRAY) {
                break;
            }
            expect(JsonToken.START_OBJECT, element, "nodes[]");
            Node child = readNode(parser);
            if (child instanceof Root) {
                throw new IOException("A root cannot be nested inside another node");
            }
            children.add(child);
        }
        return children;
    }

    private Source readSource(JsonParser parser, JsonToken token) throws IOException {
        if (token == JsonToken.VALUE_NULL) {
            return null;
        }
        expect(JsonToken.START_OBJECT, token, "source");
        String file = null;
        Position start = null;
        Position end = null;
        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String fieldName = parser.getCurrentName();
            JsonToken value = parser.nextToken();
            switch (fieldName) {
                case "file" -> file = value == JsonToken.VALUE_NULL ? null : parser.getText();
                case "start" -> start = readPosition(parser, value);
                case "end" -> end = readPosition(parser, value);
                default -> parser.skipChildren();
            }
        }
        return new Source(file, start, end);
    }

    private Position readPosition(JsonParser parser, JsonToken token) throws IOException {
        if (token == JsonToken.VALUE_NULL) {
            return null;
        }
        expect(JsonToken.START_OBJECT, token, "position");
        int line = 0;
        int column = 0;
        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String fieldName = parser.getCurrentName();
            parser.nextToken();
            switch (fieldName) {
                case "line" -> line = parser.getIntValue();
                case "column" -> column = parser.getIntValue();
                default -> parser.skipChildren();
            }
        }
        return new Position(line, column);
    }

    private static void expect(JsonToken expected, JsonToken actual, String field) throws IOException {
        if (actual != expected) {
            throw new IOException("Unexpected JSON token in " + field + ": " + actual);
        }
    }
}
