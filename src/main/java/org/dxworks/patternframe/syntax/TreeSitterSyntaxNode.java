package org.dxworks.patternframe.syntax;

import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Adapts a tree-sitter node to {@link SyntaxNode}. The owning {@code TSTree} must stay
 * reachable while the adapter is in use.
 */
public class TreeSitterSyntaxNode implements SyntaxNode {
    private final TSNode node;
    private List<SyntaxNode> children;

    public TreeSitterSyntaxNode(TSNode node) {
        if (node == null || node.isNull()) {
            throw new IllegalArgumentException("Cannot wrap a null tree-sitter node");
        }
        this.node = node;
    }

    @Override
    public String getType() {
        return node.getType();
    }

    @Override
    public int getStartByte() {
        return node.getStartByte();
    }

    @Override
    public int getEndByte() {
        return node.getEndByte();
    }

    @Override
    public List<SyntaxNode> getChildren() {
        if (children == null) {
            int count = node.getChildCount();
            List<SyntaxNode> result = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                TSNode child = node.getChild(i);
                if (child != null && !child.isNull()) {
                    result.add(new TreeSitterSyntaxNode(child));
                }
            }
            children = Collections.unmodifiableList(result);
        }
        return children;
    }

    @Override
    public String toString() {
        return getType() + "[" + getStartByte() + ", " + getEndByte() + ")";
    }
}
