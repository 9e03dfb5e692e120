package org.dxworks.patternframe.syntax;

import java.util.List;

/**
 * Read-only view over a node of a concrete syntax tree produced by an external parser.
 * Spans are UTF-8 byte offsets into the parsed source, end exclusive.
 */
public interface SyntaxNode {
    String getType();

    int getStartByte();

    int getEndByte();

    /**
     * All children in source order, including anonymous tokens such as operators and quotes.
     */
    List<SyntaxNode> getChildren();
}
