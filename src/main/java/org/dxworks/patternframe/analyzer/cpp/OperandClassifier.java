package org.dxworks.patternframe.analyzer.cpp;

import org.dxworks.patternframe.model.ErrorKind;
import org.dxworks.patternframe.syntax.SourceText;
import org.dxworks.patternframe.syntax.SyntaxNode;

import java.util.Set;

/**
 * Maps the right-hand operand of a {@code <<} link to its contribution: literal text, a
 * placeholder, or nothing for end-of-line terminators. Kinds without a row here are rejected.
 */
public class OperandClassifier {
    static final String NUMBER_PLACEHOLDER = "%d";

    private final SourceText source;
    private final LiteralNormalizer normalizer;
    private final DuplicateGuard guard;
    private final Set<String> terminatorIdentifiers;

    public OperandClassifier(SourceText source, LiteralNormalizer normalizer, DuplicateGuard guard,
                             Set<String> terminatorIdentifiers) {
        this.source = source;
        this.normalizer = normalizer;
        this.guard = guard;
        this.terminatorIdentifiers = terminatorIdentifiers;
    }

    public String classify(SyntaxNode operand) {
        return switch (NodeKind.of(operand)) {
            case STRING_LITERAL -> {
                guard.markConsumed(operand);
                yield LiteralNormalizer.stringContent(source.slice(operand));
            }
            case CHAR_LITERAL -> LiteralNormalizer.charContent(source.slice(operand));
            case CONCATENATED_STRING -> normalizer.concatenated(operand);
            case USER_DEFINED_LITERAL -> normalizer.userDefined(operand);
            case NUMBER_LITERAL -> NUMBER_PLACEHOLDER;
            case TRUE -> "1";
            case FALSE -> "0";
            case IDENTIFIER, QUALIFIED_IDENTIFIER ->
                    terminatorIdentifiers.contains(source.slice(operand).trim()) ? "" : LiteralNormalizer.PLACEHOLDER;
            // TODO: unpack literals inside parenthesized operands instead of collapsing them
            case CALL_EXPRESSION, FIELD_EXPRESSION, SUBSCRIPT_EXPRESSION, POINTER_EXPRESSION,
                    PARENTHESIZED_EXPRESSION, BINARY_EXPRESSION -> LiteralNormalizer.PLACEHOLDER;
            case LITERAL_SUFFIX, TYPE_IDENTIFIER, DECLARATION, INIT_DECLARATOR,
                 PARAMETER_DECLARATION, REFERENCE_DECLARATOR, POINTER_DECLARATOR, ASSIGN, COMMENT, ERROR, OTHER ->
                    throw ExtractionException.at(ErrorKind.UNSUPPORTED_NODE_KIND,
                            "Unsupported node type in << operator: '" + operand.getType() + "'",
                            operand, source);
        };
    }
}
