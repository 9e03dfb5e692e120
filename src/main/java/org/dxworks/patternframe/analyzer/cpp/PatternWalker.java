package org.dxworks.patternframe.analyzer.cpp;

import org.dxworks.patternframe.syntax.SourceText;
import org.dxworks.patternframe.syntax.SyntaxNode;

/**
 * Depth-first walk that turns {@code <<} chains into patterns and accumulator values and picks up
 * the comments and literals no chain consumed.
 * <p>
 * Each node runs its own handler before its children, so a chain classifies its right operands
 * before the walk reaches them as free literals. A chain link returns its open text to its parent;
 * the first ancestor that is not a link of the same chain finishes it.
 */
public class PatternWalker {
    private final ExtractionContext context;
    private final SourceText source;
    private boolean firstCommentSeen;

    public PatternWalker(ExtractionContext context) {
        this.context = context;
        this.source = context.getSource();
    }

    /**
     * Walks the whole unit. Errors end up in the context; open accumulators are flushed either way.
     */
    public void run(SyntaxNode root) {
        try {
            Fragment leftover = walk(root);
            if (leftover.isPending()) {
                finish(leftover, root);
            }
        } catch (ExtractionException e) {
            context.recordError(e.getError());
            context.trace("Extraction stopped: " + e.getKind() + " at " + e.getError().position);
        } finally {
            context.getResults().addAccumulators(context.getAccumulators().snapshot());
        }
    }

    Fragment walk(SyntaxNode node) {
        Fragment own = Fragment.NONE;
        switch (NodeKind.of(node)) {
            case BINARY_EXPRESSION -> own = context.getChains().process(node);
            case DECLARATION, PARAMETER_DECLARATION -> context.getAccumulators().registerDeclaration(node);
            case INIT_DECLARATOR -> context.getAccumulators().registerInitDeclarator(node);
            case COMMENT -> collectComment(node);
            case CONCATENATED_STRING -> collectConcatenatedString(node);
            case STRING_LITERAL -> collectStringLiteral(node);
            default -> { }
        }

        if (own.isPending()) {
            context.trace("Chain link '" + source.slice(node) + "' -> " + own);
            Fragment chain = Fragment.NONE;
            for (SyntaxNode child : node.getChildren()) {
                chain = chain.append(walk(child));
            }
            return chain.append(own);
        }

        for (SyntaxNode child : node.getChildren()) {
            walkAndFinish(child);
        }
        return Fragment.NONE;
    }

    private void walkAndFinish(SyntaxNode child) {
        try {
            Fragment fragment = walk(child);
            if (fragment.isPending()) {
                finish(fragment, child);
            }
        } catch (ExtractionException e) {
            if (e.isFatalToUnit() || context.getConfig().isStopOnFirstError()) {
                throw e;
            }
            context.recordError(e.getError());
            context.trace("Dropped chain at " + e.getError().position + ": " + e.getKind());
        }
    }

    private void finish(Fragment chain, SyntaxNode at) {
        if (chain.isNamed()) {
            context.getAccumulators().append(chain.getSinkName(), chain.getText(), at);
            context.trace("Appended '" + chain.getText() + "' to accumulator " + chain.getSinkName());
        } else if (context.getResults().addPattern(chain.getText())) {
            context.trace("Pattern: '" + chain.getText() + "'");
        } else {
            context.trace("Skipping short or repeated pattern: '" + chain.getText() + "'");
        }
    }

    private void collectComment(SyntaxNode node) {
        if (!firstCommentSeen) {
            firstCommentSeen = true;
            if (source.isBlankBefore(node.getStartByte())) {
                // license header
                return;
            }
        }
        context.getResults().addComment(LiteralNormalizer.commentContent(source.slice(node)));
    }

    private void collectConcatenatedString(SyntaxNode node) {
        if (context.getGuard().isConsumed(node)) return;
        context.getResults().addLiteral(context.getNormalizer().concatenated(node));
    }

    private void collectStringLiteral(SyntaxNode node) {
        if (context.getGuard().isConsumed(node)) return;
        context.getGuard().markConsumed(node);
        context.getResults().addLiteral(LiteralNormalizer.stringContent(source.slice(node)));
    }
}
