package com.jcss.parse;

import com.jcss.node.AtRule;
import com.jcss.node.Comment;
import com.jcss.node.Container;
import com.jcss.node.Declaration;
import com.jcss.node.Node;
import com.jcss.node.Position;
import com.jcss.node.Raw;
import com.jcss.node.Root;
import com.jcss.node.Rule;
import com.jcss.node.Source;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.jboss.logging.Logger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.jcss.parse.TokenType.*;

/**
 * Builds a node tree from CSS text. Every byte of the input ends up either in a
 * semantic field or in a raw slot, so printing an untouched tree gives the input back.
 * <p>
 * A parser instance parses one input once.
 */
public class CssParser {
    private static final Logger LOG = Logger.getLogger(CssParser.class);
    private static final Pattern IMPORTANT = Pattern.compile("(\\s*!\\s*important)$", Pattern.CASE_INSENSITIVE);

    private final String from;
    private final Tokenizer tokenizer;
    private final Root root = new Root();
    private final MutableList<Container> open = Lists.mutable.with(root);
    private final StringBuilder spaces = new StringBuilder();
    private boolean semicolon = false;
    private Token lastToken;

    public CssParser(String css) {
        this(css, null);
    }

    /**
     * @param css the text to parse
     * @param from source label used in error messages, may be null
     */
    public CssParser(String css, String from) {
        this.from = from;
        this.tokenizer = new Tokenizer(css, from);
    }

    public Root parse() {
        root.setSource(new Source(from, new Position(1, 1), null));

        Token token;
        while ((token = next()) != null) {
            switch (token.type()) {
                case SPACE, SEMICOLON -> spaces.append(token.text());
                case COMMENT -> comment(token);
                case OPEN_CURLY -> rule(Lists.mutable.empty(), token);
                case CLOSE_CURLY -> close(token);
                case AT_WORD -> atRule(token);
                default -> other(token);
            }
        }
        endFile();

        LOG.debugv("Parsed {0} top-level nodes from {1}", root.size(), from == null ? "<input>" : from);
        return root;
    }

    private void comment(Token token) {
        String inner = token.text().substring(2, token.text().length() - 2);
        Comment comment = new Comment("");
        init(comment, token.position());
        comment.setSource(comment.source().withEnd(token.end()));

        int start = leadingSpace(inner);
        if (start == inner.length()) {
            comment.setRaw(Raw.LEFT, inner);
            comment.setRaw(Raw.RIGHT, "");
            return;
        }
        int end = inner.length() - trailingSpace(inner);
        comment.setText(inner.substring(start, end));
        comment.setRaw(Raw.LEFT, inner.substring(0, start));
        comment.setRaw(Raw.RIGHT, inner.substring(end));
    }

    private void rule(MutableList<Token> tokens, Token openCurly) {
        Rule rule = new Rule("");
        init(rule, tokens.isEmpty() ? openCurly.position() : tokens.getFirst().position());
        rule.setRaw(Raw.BETWEEN, takeTrailingSpaces(tokens));
        rule.setSelector(join(tokens));
        open.add(rule);
    }

    private void atRule(Token atWord) {
        AtRule atRule = new AtRule(atWord.text().substring(1));
        init(atRule, atWord.position());

        Statement statement = statement(null);
        MutableList<Token> params = statement.tokens();
        String trailing = takeTrailingSpaces(params);
        atRule.setRaw(Raw.AFTER_NAME, takeLeadingSpaces(params));
        atRule.setParams(join(params));

        Token end = statement.end();
        if (end != null && end.is(OPEN_CURLY)) {
            atRule.setRaw(Raw.BETWEEN, trailing);
            atRule.ensureBody();
            open.add(atRule);
        } else if (end != null) {
            atRule.setRaw(Raw.BETWEEN, trailing);
            atRule.setSource(atRule.source().withEnd(end.position()));
            semicolon = true;
        } else {
            // Ended by } or end of input: the whitespace belongs to what follows
            atRule.setRaw(Raw.BETWEEN, "");
            spaces.append(trailing);
            Token last = params.isEmpty() ? atWord : params.getLast();
            atRule.setSource(atRule.source().withEnd(last.end()));
        }
    }

    private void other(Token start) {
        Statement statement = statement(start);
        if (statement.end() != null && statement.end().is(OPEN_CURLY)) {
            rule(statement.tokens(), statement.end());
        } else if (statement.colon()) {
            decl(statement.tokens(), statement.end());
        } else {
            throw new CssSyntaxError(CssSyntaxError.Kind.UNKNOWN_WORD, from, start.position());
        }
    }

    private void decl(MutableList<Token> tokens, Token end) {
        Declaration decl = new Declaration("", "");
        init(decl, tokens.getFirst().position());

        String trailing = takeTrailingSpaces(tokens);
        if (end != null) {
            semicolon = true;
            if (!trailing.isEmpty()) {
                decl.setRaw(Raw.AFTER_VALUE, trailing);
            }
            decl.setSource(decl.source().withEnd(end.position()));
        } else {
            spaces.append(trailing);
            decl.setSource(decl.source().withEnd(tokens.getLast().end()));
        }

        int colon = topLevelColon(tokens);
        MutableList<Token> prop = Lists.mutable.withAll(tokens.subList(0, colon));
        MutableList<Token> value = Lists.mutable.withAll(tokens.subList(colon + 1, tokens.size()));

        String between = takeTrailingSpaces(prop) + tokens.get(colon).text() + takeLeadingSpaces(value);
        decl.setRaw(Raw.BETWEEN, between);
        decl.setProp(join(prop));

        String text = join(value);
        Matcher important = IMPORTANT.matcher(text);
        if (important.find()) {
            decl.setImportant(true);
            decl.setRaw(Raw.IMPORTANT, important.group(1));
            text = text.substring(0, important.start());
        }
        decl.setValue(text);
    }

    private void close(Token token) {
        if (open.size() == 1) {
            throw new CssSyntaxError(CssSyntaxError.Kind.UNEXPECTED_CLOSE_BRACE, from, token.position());
        }
        Container current = current();
        if (!current.isEmpty()) {
            current.setRaw(Raw.SEMICOLON, semicolon ? ";" : "");
        }
        semicolon = false;
        current.setRaw(Raw.AFTER, takeSpaces());
        current.setSource(current.source().withEnd(token.position()));
        open.remove(open.size() - 1);
    }

    private void endFile() {
        if (open.size() > 1) {
            Container unclosed = open.get(1);
            throw new CssSyntaxError(CssSyntaxError.Kind.UNCLOSED_BLOCK, from, unclosed.source().start());
        }
        if (!root.isEmpty()) {
            root.setRaw(Raw.SEMICOLON, semicolon ? ";" : "");
        }
        root.setRaw(Raw.AFTER, takeSpaces());
        if (lastToken != null) {
            root.setSource(root.source().withEnd(lastToken.end()));
        }
    }

    private void init(Node node, Position start) {
        current().append(node);
        node.setRaw(Raw.BEFORE, takeSpaces());
        node.setSource(new Source(from, start, null));
        if (!(node instanceof Comment)) {
            semicolon = false;
        }
    }

    /**
     * Collects the tokens of one statement. A top-level semicolon or opening brace ends
     * it and is returned as the end token; a closing brace (pushed back) or the end of
     * input ends it with a null end token. Inside brackets everything is literal.
     */
    private Statement statement(Token first) {
        MutableList<Token> tokens = Lists.mutable.empty();
        Deque<Token> brackets = new ArrayDeque<>();
        boolean colon = false;

        Token token = first != null ? first : next();
        while (token != null) {
            TokenType type = token.type();
            if (!brackets.isEmpty()) {
                if (type == OPEN_BRACKET) {
                    brackets.push(token);
                } else if (type == CLOSE_BRACKET) {
                    brackets.pop();
                }
                tokens.add(token);
            } else if (type == SEMICOLON || type == OPEN_CURLY) {
                return new Statement(tokens, token, colon);
            } else if (type == CLOSE_CURLY) {
                tokenizer.back(token);
                return new Statement(tokens, null, colon);
            } else {
                if (type == OPEN_BRACKET) {
                    brackets.push(token);
                } else if (type == COLON) {
                    colon = true;
                }
                tokens.add(token);
            }
            token = next();
        }

        if (!brackets.isEmpty()) {
            throw new CssSyntaxError(CssSyntaxError.Kind.UNCLOSED_BRACKET, from, brackets.getLast().position());
        }
        return new Statement(tokens, null, colon);
    }

    private Token next() {
        Token token = tokenizer.nextToken();
        if (token != null) {
            lastToken = token;
        }
        return token;
    }

    private Container current() {
        return open.getLast();
    }

    private String takeSpaces() {
        String result = spaces.toString();
        spaces.setLength(0);
        return result;
    }

    private static int topLevelColon(MutableList<Token> tokens) {
        int depth = 0;
        for (int i = 0; i < tokens.size(); i++) {
            TokenType type = tokens.get(i).type();
            if (type == OPEN_BRACKET) {
                depth++;
            } else if (type == CLOSE_BRACKET && depth > 0) {
                depth--;
            } else if (type == COLON && depth == 0) {
                return i;
            }
        }
        throw new IllegalStateException("Declaration without colon");
    }

    private static String takeTrailingSpaces(MutableList<Token> tokens) {
        StringBuilder result = new StringBuilder();
        while (!tokens.isEmpty() && tokens.getLast().is(SPACE)) {
            result.insert(0, tokens.remove(tokens.size() - 1).text());
        }
        return result.toString();
    }

    private static String takeLeadingSpaces(MutableList<Token> tokens) {
        StringBuilder result = new StringBuilder();
        while (!tokens.isEmpty() && tokens.getFirst().is(SPACE)) {
            result.append(tokens.remove(0).text());
        }
        return result.toString();
    }

    private static String join(MutableList<Token> tokens) {
        return tokens.collect(Token::text).makeString("");
    }

    private static int leadingSpace(String text) {
        int count = 0;
        while (count < text.length() && Tokenizer.isSpace(text.charAt(count))) {
            count++;
        }
        return count;
    }

    private static int trailingSpace(String text) {
        int count = 0;
        while (count < text.length() && Tokenizer.isSpace(text.charAt(text.length() - 1 - count))) {
            count++;
        }
        return count;
    }

    private record Statement(MutableList<Token> tokens, Token end, boolean colon) {
    }
}
