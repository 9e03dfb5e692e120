package org.dxworks.patternframe.analyzer.cpp;

import com.google.common.hash.BloomFilter;
import com.google.common.hash.Funnels;
import org.dxworks.patternframe.model.ErrorKind;
import org.dxworks.patternframe.syntax.SourceText;
import org.dxworks.patternframe.syntax.SyntaxNode;

import java.nio.charset.StandardCharsets;

/**
 * Remembers which literal nodes were already consumed, keyed by byte span and text.
 * A false positive can only turn into a spurious duplicate report or a skipped free literal,
 * never into a literal counted twice.
 */
public class DuplicateGuard {
    private final SourceText source;
    private final BloomFilter<CharSequence> consumed;

    public DuplicateGuard(SourceText source, int expectedLiterals, double falsePositiveRate) {
        this.source = source;
        this.consumed = BloomFilter.create(
                Funnels.stringFunnel(StandardCharsets.UTF_8), expectedLiterals, falsePositiveRate);
    }

    /**
     * @throws ExtractionException with {@link ErrorKind#DUPLICATE_LITERAL_VISIT} if the node was consumed before
     */
    public void markConsumed(SyntaxNode node) {
        String key = keyOf(node);
        if (consumed.mightContain(key)) {
            throw ExtractionException.at(ErrorKind.DUPLICATE_LITERAL_VISIT,
                    "Already visited string literal, the same span was reached through two traversal paths",
                    node, source);
        }
        consumed.put(key);
    }

    public boolean isConsumed(SyntaxNode node) {
        return consumed.mightContain(keyOf(node));
    }

    private String keyOf(SyntaxNode node) {
        return node.getStartByte() + "_" + node.getEndByte() + "_" + source.slice(node);
    }
}
