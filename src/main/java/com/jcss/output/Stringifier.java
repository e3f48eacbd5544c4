package com.jcss.output;

import com.jcss.node.AtRule;
import com.jcss.node.Comment;
import com.jcss.node.Container;
import com.jcss.node.Declaration;
import com.jcss.node.Node;
import com.jcss.node.Raw;
import com.jcss.node.Root;
import com.jcss.node.Rule;

/**
 * Prints a node tree as CSS. Raws are written as stored; missing ones come from
 * {@link RawDetector}. Printing never changes the tree.
 */
public class Stringifier {

    public String stringify(Node node) {
        StringBuilder sb = new StringBuilder();
        write(node, false, new RawDetector(node), sb);
        return sb.toString();
    }

    private void write(Node node, boolean semicolon, RawDetector raws, StringBuilder sb) {
        switch (node.type()) {
            case ROOT -> {
                Root root = (Root) node;
                body(root, raws, sb);
                String after = root.raw(Raw.AFTER);
                if (after != null) {
                    sb.append(after);
                }
            }
            case RULE -> {
                Rule rule = (Rule) node;
                block(rule, rule.selector(), raws, sb);
            }
            case AT_RULE -> atRule((AtRule) node, semicolon, raws, sb);
            case DECLARATION -> decl((Declaration) node, semicolon, raws, sb);
            case COMMENT -> {
                Comment comment = (Comment) node;
                sb.append("/*")
                  .append(raws.commentLeft(comment))
                  .append(comment.text())
                  .append(raws.commentRight(comment))
                  .append("*/");
            }
        }
    }

    private void body(Container container, RawDetector raws, StringBuilder sb) {
        // Trailing comments do not count when deciding where the last semicolon goes
        int last = container.size() - 1;
        while (last > 0 && container.get(last) instanceof Comment) {
            last--;
        }
        boolean semicolon = raws.semicolon(container);

        for (int i = 0; i < container.size(); i++) {
            Node child = container.get(i);
            sb.append(raws.before(child));
            write(child, i != last || semicolon, raws, sb);
        }
    }

    private void block(Container container, String head, RawDetector raws, StringBuilder sb) {
        sb.append(head).append(raws.blockBetween(container)).append('{');
        if (!container.isEmpty()) {
            body(container, raws, sb);
        }
        sb.append(raws.after(container)).append('}');
    }

    private void atRule(AtRule atRule, boolean semicolon, RawDetector raws, StringBuilder sb) {
        String head = "@" + atRule.name() + raws.afterName(atRule) + atRule.params();
        if (atRule.hasBody()) {
            block(atRule, head, raws, sb);
            return;
        }
        sb.append(head);
        String between = atRule.raw(Raw.BETWEEN);
        if (between != null) {
            sb.append(between);
        }
        if (semicolon) {
            sb.append(';');
        }
    }

    private void decl(Declaration decl, boolean semicolon, RawDetector raws, StringBuilder sb) {
        sb.append(decl.prop())
          .append(raws.colon(decl))
          .append(decl.value());
        if (decl.important()) {
            String important = decl.raw(Raw.IMPORTANT);
            sb.append(important != null ? important : " !important");
        }
        if (semicolon) {
            String afterValue = decl.raw(Raw.AFTER_VALUE);
            if (afterValue != null) {
                sb.append(afterValue);
            }
            sb.append(';');
        }
    }
}
