package io.raggedcsv.ingest.decode;

import java.util.Objects;

/**
 * Text recovered from raw bytes. Never contains U+0000.
 *
 * @param text     the decoded content
 * @param encoding name of the charset that produced it
 * @param wide     whether the double-byte (UTF-16) path was taken
 */
public record DecodedText(String text, String encoding, boolean wide) {
    public DecodedText {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(encoding, "encoding");
        if (text.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("decoded text must not contain null characters");
        }
    }
}
