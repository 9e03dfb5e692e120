package org.dxworks.patternframe.model;

public class ExtractionError {
    public ErrorKind kind;
    public String message;
    public String nodeType;
    public int startByte;
    public int endByte;
    public String position;

    public ExtractionError() {
    }

    public ExtractionError(ErrorKind kind, String message, String nodeType, int startByte, int endByte, String position) {
        this.kind = kind;
        this.message = message;
        this.nodeType = nodeType;
        this.startByte = startByte;
        this.endByte = endByte;
        this.position = position;
    }

    @Override
    public String toString() {
        return kind + " at " + position + ": " + message;
    }
}
