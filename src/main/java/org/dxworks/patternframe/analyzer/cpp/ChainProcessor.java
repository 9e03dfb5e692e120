package org.dxworks.patternframe.analyzer.cpp;

import org.dxworks.patternframe.model.ErrorKind;
import org.dxworks.patternframe.syntax.SourceText;
import org.dxworks.patternframe.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Recognizes one link of a {@code <<} chain and resolves the sink the chain feeds.
 * <p>
 * Chains are left-associated, so {@code out << a << b} is {@code (out << a) << b}. The sink is
 * decided by the chain base, the left-most operand, and shared by every link of the chain.
 * <p>
 * A plain identifier base is a sink when it names an output stream, when it is a bound accumulator,
 * or when some link of its chain appends a string or char literal. {@code bits << 3} is a shift.
 */
public class ChainProcessor {
    private static final String CONCAT_OPERATOR = "<<";

    private final SourceText source;
    private final OperandClassifier classifier;
    private final Set<String> builderStartCalls;
    private final Set<String> outputSinks;
    private final AccumulatorTracker accumulators;
    private final Map<String, Sink> sinksByBase = new HashMap<>();

    public ChainProcessor(SourceText source, OperandClassifier classifier, AccumulatorTracker accumulators,
                          Set<String> builderStartCalls, Set<String> outputSinks) {
        this.source = source;
        this.classifier = classifier;
        this.accumulators = accumulators;
        this.builderStartCalls = compactAll(builderStartCalls);
        this.outputSinks = compactAll(outputSinks);
    }

    /**
     * @return a pending fragment holding the classified right operand, or {@link Fragment#NONE} when the
     * node is not a {@code <<} link or its chain does not start at a sink
     * @throws ExtractionException if the link has more than one non-comment right operand, or its
     *                             right operand cannot be classified
     */
    public Fragment process(SyntaxNode node) {
        if (NodeKind.of(node) != NodeKind.BINARY_EXPRESSION) {
            return Fragment.NONE;
        }
        List<SyntaxNode> operands = nonCommentChildren(node);
        if (operands.size() < 3 || !isConcatOperator(operands.get(1))) {
            return Fragment.NONE;
        }
        if (operands.size() > 3) {
            throw ExtractionException.at(ErrorKind.MALFORMED_CHAIN,
                    "Expected a single right operand after '<<' but found " + (operands.size() - 2),
                    node, source);
        }

        Sink sink = sinkOf(node);
        if (sink == null) {
            return Fragment.NONE;
        }
        return Fragment.pending(sink.name, classifier.classify(operands.get(2)));
    }

    /**
     * True for a {@code <<} binary expression, whatever its operands are.
     */
    public boolean isLink(SyntaxNode node) {
        if (NodeKind.of(node) != NodeKind.BINARY_EXPRESSION) {
            return false;
        }
        List<SyntaxNode> operands = nonCommentChildren(node);
        return operands.size() >= 3 && isConcatOperator(operands.get(1));
    }

    SyntaxNode chainBase(SyntaxNode node) {
        SyntaxNode current = node;
        while (isLink(current)) {
            current = nonCommentChildren(current).get(0);
        }
        return current;
    }

    // The outermost link is processed first, so the decision covers the whole chain.
    private Sink sinkOf(SyntaxNode link) {
        SyntaxNode base = chainBase(link);
        String key = base.getStartByte() + "_" + base.getEndByte();
        if (!sinksByBase.containsKey(key)) {
            sinksByBase.put(key, resolveSink(base, link));
        }
        return sinksByBase.get(key);
    }

    private Sink resolveSink(SyntaxNode base, SyntaxNode link) {
        String text = source.slice(base);
        return switch (NodeKind.of(base)) {
            case CALL_EXPRESSION -> builderStartCalls.contains(compact(text)) ? Sink.ANONYMOUS : null;
            case QUALIFIED_IDENTIFIER -> outputSinks.contains(compact(text)) ? Sink.ANONYMOUS : null;
            case IDENTIFIER -> {
                String name = text.trim();
                if (outputSinks.contains(name)) yield Sink.ANONYMOUS;
                if (accumulators.isBound(name) || appendsLiteral(link)) yield new Sink(name);
                yield null;
            }
            default -> null;
        };
    }

    private boolean appendsLiteral(SyntaxNode link) {
        SyntaxNode current = link;
        while (isLink(current)) {
            List<SyntaxNode> operands = nonCommentChildren(current);
            switch (NodeKind.of(operands.get(operands.size() - 1))) {
                case STRING_LITERAL, CHAR_LITERAL, CONCATENATED_STRING, USER_DEFINED_LITERAL -> {
                    return true;
                }
                default -> { }
            }
            current = operands.get(0);
        }
        return false;
    }

    private boolean isConcatOperator(SyntaxNode operator) {
        return CONCAT_OPERATOR.equals(source.slice(operator).trim());
    }

    private static List<SyntaxNode> nonCommentChildren(SyntaxNode node) {
        List<SyntaxNode> result = new ArrayList<>();
        for (SyntaxNode child : node.getChildren()) {
            if (NodeKind.of(child) != NodeKind.COMMENT) {
                result.add(child);
            }
        }
        return result;
    }

    private static String compact(String text) {
        return text.replaceAll("\\s+", "");
    }

    private static Set<String> compactAll(Set<String> names) {
        return names.stream().map(ChainProcessor::compact).collect(Collectors.toSet());
    }

    private static final class Sink {
        static final Sink ANONYMOUS = new Sink(null);

        final String name;

        Sink(String name) {
            this.name = name;
        }
    }
}
