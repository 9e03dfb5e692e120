package org.dxworks.patternframe.syntax;

import java.nio.charset.StandardCharsets;

/**
 * The source of one parsed unit, addressed by the UTF-8 byte offsets the parser reports.
 */
public class SourceText {
    private final String text;
    private final byte[] bytes;

    public SourceText(String text) {
        this.text = text;
        // Tree-sitter uses UTF-8 byte offsets, Java strings use UTF-16 indices
        this.bytes = text.getBytes(StandardCharsets.UTF_8);
    }

    public String getText() {
        return text;
    }

    public int length() {
        return bytes.length;
    }

    public String slice(SyntaxNode node) {
        return slice(node.getStartByte(), node.getEndByte());
    }

    /**
     * Verbatim text of {@code [startByte, endByte)} with line endings normalized to LF.
     */
    public String slice(int startByte, int endByte) {
        int start = Math.max(0, startByte);
        int end = Math.min(bytes.length, endByte);
        if (start >= end) return "";

        String slice = new String(bytes, start, end - start, StandardCharsets.UTF_8);
        return slice.replace("\r\n", "\n").replace("\r", "\n");
    }

    /**
     * True when nothing but whitespace precedes {@code startByte}.
     */
    public boolean isBlankBefore(int startByte) {
        return slice(0, startByte).isBlank();
    }

    /**
     * 1-based line of a byte offset.
     */
    public int lineOf(int offset) {
        int line = 1;
        int end = Math.min(offset, bytes.length);
        for (int i = 0; i < end; i++) {
            if (bytes[i] == '\n') line++;
        }
        return line;
    }

    /**
     * 1-based column of a byte offset, counted in bytes from the start of its line.
     */
    public int columnOf(int offset) {
        int end = Math.min(offset, bytes.length);
        int lineStart = 0;
        for (int i = 0; i < end; i++) {
            if (bytes[i] == '\n') lineStart = i + 1;
        }
        return end - lineStart + 1;
    }

    public String position(SyntaxNode node) {
        int start = node.getStartByte();
        return "line " + lineOf(start) + ", column " + columnOf(start);
    }
}
