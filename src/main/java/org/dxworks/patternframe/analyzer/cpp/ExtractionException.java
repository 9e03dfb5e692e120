package org.dxworks.patternframe.analyzer.cpp;

import org.dxworks.patternframe.model.ErrorKind;
import org.dxworks.patternframe.model.ExtractionError;
import org.dxworks.patternframe.syntax.SourceText;
import org.dxworks.patternframe.syntax.SyntaxNode;

/**
 * Aborts the chain (or the whole unit) being extracted. Carries the structured record
 * the driver reports.
 */
public class ExtractionException extends RuntimeException {
    private final ExtractionError error;

    public ExtractionException(ExtractionError error) {
        super(error.message);
        this.error = error;
    }

    public ExtractionError getError() {
        return error;
    }

    public ErrorKind getKind() {
        return error.kind;
    }

    /**
     * Duplicate visits mean the walker itself is broken, so nothing from the unit can be trusted.
     */
    public boolean isFatalToUnit() {
        return error.kind == ErrorKind.DUPLICATE_LITERAL_VISIT;
    }

    public static ExtractionException at(ErrorKind kind, String headline, SyntaxNode node, SourceText source) {
        String position = source.position(node);
        String message = headline + "\n"
                + "  Node text: " + source.slice(node) + "\n"
                + "  Node type: " + node.getType() + "\n"
                + "  Node position: " + position + "\n"
                + "  Byte range: " + node.getStartByte() + "-" + node.getEndByte();
        return new ExtractionException(new ExtractionError(
                kind, message, node.getType(), node.getStartByte(), node.getEndByte(), position));
    }
}
