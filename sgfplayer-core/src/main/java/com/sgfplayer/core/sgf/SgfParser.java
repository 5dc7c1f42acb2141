package com.sgfplayer.core.sgf;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Single-pass reader for SGF game trees that keeps only the main line.
 *
 * <p>The parser walks the text once with a cursor. Nodes of the outer sequence and of the first
 * sub-tree at every level are collected in replay order; every further sibling sub-tree is a
 * variation and is skipped without producing nodes. Characters that do not fit the grammar are
 * stepped over, so the only hard failure is text that does not start with a game tree.
 */
public final class SgfParser {

    private static final Logger LOGGER = Logger.getLogger(SgfParser.class.getName());
    private static final String BYTE_ORDER_MARK = "\uFEFF";

    private final String text;
    private final List<SgfNode> nodes = new ArrayList<>();
    private int position;
    private int skippedVariations;
    private int skippedCharacters;

    private SgfParser(String text) {
        this.text = text;
    }

    /**
     * Parses SGF text and returns the nodes of its main line.
     *
     * @param text raw SGF content, optionally preceded by a byte-order mark
     * @return main-line nodes in the order a replay visits them
     * @throws SgfParseException if the text does not begin with {@code (}
     */
    public static List<SgfNode> parse(String text) throws SgfParseException {
        Objects.requireNonNull(text, "text");
        String normalized = text.replace("\r", "");
        if (normalized.startsWith(BYTE_ORDER_MARK)) {
            normalized = normalized.substring(1);
        }
        return new SgfParser(normalized).parseCollection();
    }

    private List<SgfNode> parseCollection() throws SgfParseException {
        skipWhitespace();
        if (peek() != '(') {
            throw new SgfParseException("Missing '(' at start of game tree", position);
        }
        consumeTree();
        LOGGER.fine(() -> String.format("Parsed %d main-line nodes, skipped %d variations and %d stray characters",
                nodes.size(), skippedVariations, skippedCharacters));
        return List.copyOf(nodes);
    }

    private void consumeTree() {
        advance(); // '('
        // one flag per open tree, set once its first sub-tree has been entered
        Deque<Boolean> mainLineTaken = new ArrayDeque<>();
        mainLineTaken.push(Boolean.FALSE);
        skipWhitespace();
        while (!atEnd() && !mainLineTaken.isEmpty()) {
            char c = peek();
            if (c == ';') {
                advance();
                nodes.add(parseNode());
            } else if (c == '(') {
                if (mainLineTaken.peek()) {
                    skipVariation();
                } else {
                    advance();
                    mainLineTaken.pop();
                    mainLineTaken.push(Boolean.TRUE);
                    mainLineTaken.push(Boolean.FALSE);
                }
            } else if (c == ')') {
                advance();
                mainLineTaken.pop();
            } else {
                skippedCharacters++;
                advance();
            }
            skipWhitespace();
        }
    }

    private SgfNode parseNode() {
        Map<String, List<String>> properties = new LinkedHashMap<>();
        skipWhitespace();
        while (!atEnd() && Character.isLetter(peek())) {
            String key = parseIdentifier();
            List<String> values = new ArrayList<>();
            skipWhitespace();
            while (!atEnd() && peek() == '[') {
                values.add(parseValue());
                skipWhitespace();
            }
            if (!values.isEmpty()) {
                properties.computeIfAbsent(key, ignored -> new ArrayList<>()).addAll(values);
            }
        }
        return new SgfNode(properties);
    }

    private String parseIdentifier() {
        int start = position;
        while (!atEnd() && Character.isLetter(peek())) {
            advance();
        }
        return text.substring(start, position).toUpperCase(Locale.ROOT);
    }

    private String parseValue() {
        advance(); // '['
        StringBuilder value = new StringBuilder();
        while (!atEnd()) {
            char c = text.charAt(position++);
            if (c == '\\') {
                if (!atEnd()) {
                    value.append(text.charAt(position++));
                }
            } else if (c == ']') {
                break;
            } else {
                value.append(c);
            }
        }
        return value.toString();
    }

    private void skipVariation() {
        skippedVariations++;
        advance(); // '('
        int depth = 0;
        while (!atEnd()) {
            char c = peek();
            if (c == '[') {
                parseValue(); // brackets may contain parentheses
                continue;
            }
            advance();
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                if (depth == 0) {
                    return;
                }
                depth--;
            }
        }
    }

    private void skipWhitespace() {
        while (!atEnd() && Character.isWhitespace(peek())) {
            position++;
        }
    }

    private boolean atEnd() {
        return position >= text.length();
    }

    private char peek() {
        return atEnd() ? '\0' : text.charAt(position);
    }

    private void advance() {
        if (!atEnd()) {
            position++;
        }
    }
}
