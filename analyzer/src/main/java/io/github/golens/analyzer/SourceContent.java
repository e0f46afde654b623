package io.github.golens.analyzer;

import java.nio.charset.StandardCharsets;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Source text of one Go file together with its UTF-8 bytes. Tree-sitter reports byte offsets, so every slice of the
 * text goes through here.
 */
public final class SourceContent {
    private static final Logger log = LogManager.getLogger(SourceContent.class);

    private static final char UTF8_BOM = '\uFEFF';

    private final String text;
    private final byte[] utf8Bytes;

    private SourceContent(String text, byte[] utf8Bytes) {
        this.text = text;
        this.utf8Bytes = utf8Bytes;
    }

    public static SourceContent of(String src) {
        var stripped = !src.isEmpty() && src.charAt(0) == UTF8_BOM ? src.substring(1) : src;
        return new SourceContent(stripped, stripped.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Lenient extraction of the bytes [startByte, endByte). Out-of-range starts give the empty string, an end past
     * the text is truncated.
     */
    public String substringFromBytes(int startByte, int endByte) {
        if (startByte < 0 || endByte < startByte || startByte > utf8Bytes.length) {
            log.warn(
                    "Requested bytes outside valid range for source text (length: {} bytes): startByte={}, endByte={}",
                    utf8Bytes.length,
                    startByte,
                    endByte);
            return "";
        }
        int end = Math.min(endByte, utf8Bytes.length);
        if (end == startByte) return "";
        return new String(utf8Bytes, startByte, end - startByte, StandardCharsets.UTF_8);
    }

    /**
     * Strict extraction for declaration code blocks: the range must satisfy {@code 0 <= start < end <= length},
     * anything else yields the empty string rather than a truncated slice.
     */
    public String sliceExact(int startByte, int endByte) {
        if (startByte < 0 || startByte >= endByte || endByte > utf8Bytes.length) {
            log.debug("Inconsistent offsets [{}, {}) for text of {} bytes", startByte, endByte, utf8Bytes.length);
            return "";
        }
        return new String(utf8Bytes, startByte, endByte - startByte, StandardCharsets.UTF_8);
    }

    /** Text covered by a node, or empty for a missing node. */
    public String substringFrom(@Nullable TSNode node) {
        if (node == null || node.isNull()) {
            return "";
        }
        return substringFromBytes(node.getStartByte(), node.getEndByte());
    }

    public String text() {
        return text;
    }

    public int byteLength() {
        return utf8Bytes.length;
    }

    @Override
    public String toString() {
        return "SourceContent[byteLength=" + utf8Bytes.length + ']';
    }
}
