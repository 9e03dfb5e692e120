package org.dxworks.patternframe.analyzer.cpp;

import org.dxworks.patternframe.model.ErrorKind;
import org.dxworks.patternframe.syntax.SourceText;
import org.dxworks.patternframe.syntax.SyntaxNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Variables recognized as accumulators and the text appended to each so far.
 * Bindings live until the end of the unit; a second declaration of a bound name keeps its value.
 */
public class AccumulatorTracker {
    private final SourceText source;
    private final Set<String> accumulatorTypes;
    private final UnresolvedAccumulatorPolicy policy;
    private final Map<String, String> bindings = new LinkedHashMap<>();

    public AccumulatorTracker(SourceText source, Set<String> accumulatorTypes, UnresolvedAccumulatorPolicy policy) {
        this.source = source;
        this.accumulatorTypes = accumulatorTypes;
        this.policy = policy;
    }

    /**
     * {@code StringBuilder sb;}, {@code StringBuilder a, b(16);} or the parameter
     * {@code StringBuilder& sb}: the declared type decides.
     */
    public void registerDeclaration(SyntaxNode declaration) {
        boolean accumulatorType = false;
        for (SyntaxNode child : declaration.getChildren()) {
            NodeKind kind = NodeKind.of(child);
            if ((kind == NodeKind.TYPE_IDENTIFIER || kind == NodeKind.QUALIFIED_IDENTIFIER)
                    && namesAccumulator(source.slice(child))) {
                accumulatorType = true;
                break;
            }
        }
        if (!accumulatorType) return;

        for (SyntaxNode child : declaration.getChildren()) {
            switch (NodeKind.of(child)) {
                case IDENTIFIER, INIT_DECLARATOR, REFERENCE_DECLARATOR, POINTER_DECLARATOR -> {
                    SyntaxNode name = declaredName(child);
                    if (name != null) register(source.slice(name).trim());
                }
                default -> { }
            }
        }
    }

    /**
     * {@code auto sb = StringBuilder();}: the initializer after {@code =} decides.
     */
    public void registerInitDeclarator(SyntaxNode initDeclarator) {
        String variable = null;
        boolean assigned = false;
        for (SyntaxNode child : initDeclarator.getChildren()) {
            switch (NodeKind.of(child)) {
                case IDENTIFIER, REFERENCE_DECLARATOR, POINTER_DECLARATOR -> {
                    SyntaxNode name = declaredName(child);
                    if (variable == null && name != null) variable = source.slice(name).trim();
                }
                case ASSIGN -> assigned = true;
                case CALL_EXPRESSION, PARENTHESIZED_EXPRESSION -> {
                    if (assigned && variable != null && namesAccumulator(source.slice(child))) {
                        register(variable);
                        return;
                    }
                }
                default -> { }
            }
        }
    }

    public boolean isBound(String variable) {
        return bindings.containsKey(variable);
    }

    public void register(String variable) {
        bindings.putIfAbsent(variable, "");
    }

    /**
     * Appends a finished chain to its accumulator.
     *
     * @param at node reported when the name is unbound under {@link UnresolvedAccumulatorPolicy#STRICT}
     */
    public void append(String variable, String text, SyntaxNode at) {
        String existing = bindings.get(variable);
        if (existing == null) {
            if (policy == UnresolvedAccumulatorPolicy.STRICT) {
                throw ExtractionException.at(ErrorKind.UNRESOLVED_ACCUMULATOR_REFERENCE,
                        "'" + variable + "' is used as a << sink but was never declared as an accumulator",
                        at, source);
            }
            existing = "";
        }
        bindings.put(variable, existing + text);
    }

    public Map<String, String> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    }

    private boolean namesAccumulator(String text) {
        for (String type : accumulatorTypes) {
            if (text.contains(type)) return true;
        }
        return false;
    }

    // sb, &sb, *sb and sb = ... all declare sb
    private static SyntaxNode declaredName(SyntaxNode declarator) {
        return switch (NodeKind.of(declarator)) {
            case IDENTIFIER -> declarator;
            case INIT_DECLARATOR -> declarator.getChildren().isEmpty() ? null : declaredName(declarator.getChildren().get(0));
            case REFERENCE_DECLARATOR, POINTER_DECLARATOR -> {
                for (SyntaxNode child : declarator.getChildren()) {
                    SyntaxNode name = declaredName(child);
                    if (name != null) yield name;
                }
                yield null;
            }
            default -> null;
        };
    }
}
