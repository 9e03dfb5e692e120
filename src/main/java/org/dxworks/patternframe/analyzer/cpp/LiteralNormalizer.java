package org.dxworks.patternframe.analyzer.cpp;

import org.dxworks.patternframe.model.ErrorKind;
import org.dxworks.patternframe.syntax.SourceText;
import org.dxworks.patternframe.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns literal and comment tokens into their bare content. Escape sequences are kept verbatim.
 */
public class LiteralNormalizer {
    static final String PLACEHOLDER = "%s";

    private static final Pattern BLOCK_LINE_MARKER = Pattern.compile("^\\s*\\* ?");
    private static final Pattern LINE_COMMENT_MARKER = Pattern.compile("^/+!?");

    private final SourceText source;
    private final DuplicateGuard guard;

    public LiteralNormalizer(SourceText source, DuplicateGuard guard) {
        this.source = source;
        this.guard = guard;
    }

    /**
     * Content between the first and the last double quote, so encoding prefixes like {@code L} or
     * {@code u8} are dropped too.
     */
    public static String stringContent(String literal) {
        return between(literal, '"');
    }

    public static String charContent(String literal) {
        return between(literal, '\'');
    }

    private static String between(String literal, char quote) {
        int open = literal.indexOf(quote);
        int close = literal.lastIndexOf(quote);
        if (open < 0 || close <= open) {
            return literal;
        }
        return literal.substring(open + 1, close);
    }

    /**
     * Joins the parts of an adjacent-literal concatenation. The node and each quoted part are
     * marked consumed. Identifiers and {@code ERROR} parts are macros the parser cannot expand and
     * become placeholders.
     */
    public String concatenated(SyntaxNode node) {
        guard.markConsumed(node);
        StringBuilder content = new StringBuilder();
        for (SyntaxNode child : node.getChildren()) {
            switch (NodeKind.of(child)) {
                case STRING_LITERAL -> {
                    guard.markConsumed(child);
                    content.append(stringContent(source.slice(child)));
                }
                case IDENTIFIER, ERROR -> content.append(PLACEHOLDER);
                case COMMENT -> { }
                default -> throw ExtractionException.at(ErrorKind.UNSUPPORTED_NODE_KIND,
                        "Unsupported node type in concatenated string: '" + child.getType() + "'",
                        child, source);
            }
        }
        return content.toString();
    }

    /**
     * Content of a suffixed literal such as {@code "_id"_sd}; the suffix is dropped.
     */
    public String userDefined(SyntaxNode node) {
        StringBuilder content = new StringBuilder();
        for (SyntaxNode child : node.getChildren()) {
            switch (NodeKind.of(child)) {
                case STRING_LITERAL -> {
                    guard.markConsumed(child);
                    content.append(stringContent(source.slice(child)));
                }
                case LITERAL_SUFFIX -> { }
                default -> throw ExtractionException.at(ErrorKind.UNSUPPORTED_NODE_KIND,
                        "Unsupported node type in user-defined literal: '" + child.getType() + "'",
                        child, source);
            }
        }
        return content.toString();
    }

    /**
     * Strips comment delimiters. Block comments also lose the leading {@code *} of every line and
     * are folded onto one line.
     */
    public static String commentContent(String comment) {
        String text = comment;
        if (text.startsWith("/*")) {
            text = text.endsWith("*/") && text.length() >= 4
                    ? text.substring(2, text.length() - 2)
                    : text.substring(2);
            List<String> lines = new ArrayList<>();
            for (String line : text.split("\n")) {
                String stripped = BLOCK_LINE_MARKER.matcher(line).replaceFirst("").trim();
                if (!stripped.isEmpty()) {
                    lines.add(stripped);
                }
            }
            text = String.join(" ", lines);
        } else if (text.startsWith("//")) {
            text = LINE_COMMENT_MARKER.matcher(text).replaceFirst("");
        }
        return text.trim();
    }

    public static int wordCount(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }
}
