package com.jcss.output;

import com.jcss.node.AtRule;
import com.jcss.node.Comment;
import com.jcss.node.Container;
import com.jcss.node.Declaration;
import com.jcss.node.Node;
import com.jcss.node.Raw;
import com.jcss.node.Root;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;

import java.util.function.Function;

/**
 * Supplies formatting for nodes that have no raw of their own.
 * <p>
 * A missing raw is copied from the first node in the same tree (document order)
 * that has one, so an inserted node looks like its neighbours. When the tree has no
 * example either, a fixed default is used. Values containing a line break get one
 * indent per non-root ancestor of the node. Lookups are cached for a single
 * stringification only.
 */
final class RawDetector {
    static final String DEFAULT_INDENT = "    ";

    private final Container scope;
    private final MutableMap<String, String> cache = Maps.mutable.empty();

    RawDetector(Node node) {
        Node top = node;
        while (top.parent() != null) {
            top = top.parent();
        }
        this.scope = top instanceof Container container ? container : null;
    }

    String before(Node node) {
        String raw = node.raw(Raw.BEFORE);
        if (raw != null) {
            return raw;
        }
        Container parent = node.parent();
        if (parent == null || (parent instanceof Root && parent.first() == node)) {
            return "";
        }
        String value = switch (node.type()) {
            case DECLARATION -> beforeDecl();
            case COMMENT -> beforeComment();
            default -> beforeRule();
        };
        return indented(value, depth(node));
    }

    String after(Container node) {
        String raw = node.raw(Raw.AFTER);
        if (raw != null) {
            return raw;
        }
        if (node.isEmpty()) {
            return orDefault(detect("emptyBody", child -> child instanceof Container container
                    && container.hasBody() && container.isEmpty() ? child.raw(Raw.AFTER) : null), "");
        }
        String value = orDefault(detect("beforeClose", child -> child instanceof Container container
                && !container.isEmpty() ? lineBreaks(child.raw(Raw.AFTER)) : null), "\n");
        return indented(value, depth(node));
    }

    String blockBetween(Container node) {
        String raw = node.raw(Raw.BETWEEN);
        if (raw != null) {
            return raw;
        }
        return orDefault(detect("beforeOpen", child -> child instanceof Container container
                && container.hasBody() ? child.raw(Raw.BETWEEN) : null), " ");
    }

    String colon(Declaration decl) {
        String raw = decl.raw(Raw.BETWEEN);
        if (raw != null) {
            return raw;
        }
        return orDefault(detect("colon", child -> child instanceof Declaration && child.hasRaw(Raw.BETWEEN)
                ? child.raw(Raw.BETWEEN).replaceAll("[^\\s:]", "") : null), ": ");
    }

    String afterName(AtRule atRule) {
        String raw = atRule.raw(Raw.AFTER_NAME);
        if (raw != null) {
            return raw;
        }
        return atRule.params().isEmpty() ? "" : " ";
    }

    boolean semicolon(Container node) {
        String raw = node.raw(Raw.SEMICOLON);
        if (raw != null) {
            return raw.equals(";");
        }
        String detected = detect("semicolon", child -> child instanceof Container container
                && container.last() instanceof Declaration ? child.raw(Raw.SEMICOLON) : null);
        return ";".equals(detected);
    }

    String commentLeft(Comment comment) {
        String raw = comment.raw(Raw.LEFT);
        if (raw != null) {
            return raw;
        }
        return orDefault(detect("commentLeft", child -> child instanceof Comment ? child.raw(Raw.LEFT) : null), " ");
    }

    String commentRight(Comment comment) {
        String raw = comment.raw(Raw.RIGHT);
        if (raw != null) {
            return raw;
        }
        return orDefault(detect("commentRight", child -> child instanceof Comment ? child.raw(Raw.RIGHT) : null), " ");
    }

    String indent() {
        return orDefault(detect("indent", child -> {
            Container parent = child.parent();
            if (parent == null || parent instanceof Root || !(parent.parent() instanceof Root)) {
                return null;
            }
            String before = child.raw(Raw.BEFORE);
            if (before == null) {
                return null;
            }
            return whitespace(before.substring(before.lastIndexOf('\n') + 1));
        }), DEFAULT_INDENT);
    }

    private String beforeDecl() {
        return orDefault(detect("beforeDecl", child -> child instanceof Declaration
                ? lineBreaks(child.raw(Raw.BEFORE)) : null), "\n");
    }

    private String beforeRule() {
        return orDefault(detect("beforeRule", child -> child instanceof Container && !isFirstInRoot(child)
                ? lineBreaks(child.raw(Raw.BEFORE)) : null), "\n");
    }

    private String beforeComment() {
        String detected = detect("beforeComment", child -> child instanceof Comment && !isFirstInRoot(child)
                ? lineBreaks(child.raw(Raw.BEFORE)) : null);
        return detected != null ? detected : beforeDecl();
    }

    private String indented(String value, int depth) {
        return value.indexOf('\n') >= 0 ? value + indent().repeat(depth) : value;
    }

    private String detect(String key, Function<Node, String> probe) {
        if (cache.containsKey(key)) {
            return cache.get(key);
        }
        String value = scope == null ? null : search(scope, probe);
        cache.put(key, value);
        return value;
    }

    private static String search(Container container, Function<Node, String> probe) {
        for (Node child : container.nodes()) {
            String value = probe.apply(child);
            if (value != null) {
                return value;
            }
            if (child instanceof Container nested) {
                value = search(nested, probe);
                if (value != null) {
                    return value;
                }
            }
        }
        return null;
    }

    // Keeps everything up to the last line break, so a sample's own indentation is dropped
    private static String lineBreaks(String before) {
        if (before == null) {
            return null;
        }
        int lastBreak = before.lastIndexOf('\n');
        return whitespace(lastBreak >= 0 ? before.substring(0, lastBreak + 1) : before);
    }

    private static String whitespace(String text) {
        return text.replaceAll("\\S", "");
    }

    private static boolean isFirstInRoot(Node node) {
        return node.parent() instanceof Root && node.parent().first() == node;
    }

    private static int depth(Node node) {
        int depth = 0;
        for (Container parent = node.parent(); parent != null && !(parent instanceof Root); parent = parent.parent()) {
            depth++;
        }
        return depth;
    }

    private static String orDefault(String value, String fallback) {
        return value != null ? value : fallback;
    }
}
