package io.raggedcsv.ingest.decode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * Turns raw file bytes into null-free text.
 *
 * <p>UTF-16 is recognised by its byte-order mark or, without one, by a high share of null bytes in the
 * first {@value #SNIFF_BYTES} bytes. Everything else goes through an ordered list of narrow charsets;
 * the first one that decodes is used, with malformed input replaced by U+FFFD rather than rejected.
 */
public class ByteDecoder {
    private static final Logger log = LoggerFactory.getLogger(ByteDecoder.class);

    static final int SNIFF_BYTES = 200;
    static final double WIDE_NULL_RATIO = 0.10;

    public static final List<String> DEFAULT_ENCODINGS = List.of("UTF-8", "windows-1252", "ISO-8859-1");

    private final List<String> encodings;

    public ByteDecoder() {
        this(DEFAULT_ENCODINGS);
    }

    public ByteDecoder(List<String> encodings) {
        if (encodings == null || encodings.isEmpty()) {
            throw new IllegalArgumentException("at least one encoding is required");
        }
        this.encodings = List.copyOf(encodings);
    }

    public List<String> encodings() { return encodings; }

    public DecodedText decode(byte[] raw) throws DecodeException {
        Objects.requireNonNull(raw, "raw");
        Charset wide = detectWide(raw);
        if (wide != null) {
            try {
                String text = strictDecode(raw, wide);
                log.debug("Decoded {} bytes as {}", raw.length, wide.name());
                return new DecodedText(clean(text), wide.name(), true);
            } catch (CharacterCodingException e) {
                log.debug("Input looked like {} but did not decode ({}); trying narrow encodings", wide.name(), e.toString());
            }
        }

        Exception last = null;
        for (String name : encodings) {
            try {
                Charset cs = Charset.forName(name);
                String text = replacingDecode(raw, cs);
                log.debug("Decoded {} bytes as {}", raw.length, cs.name());
                return new DecodedText(clean(text), cs.name(), false);
            } catch (RuntimeException | CharacterCodingException e) {
                log.debug("Encoding {} failed: {}", name, e.toString());
                last = e;
            }
        }
        throw new DecodeException("Could not decode input with encodings " + encodings + ": " + last, last);
    }

    /**
     * Decodes with a caller-chosen charset, skipping detection.
     */
    public DecodedText decode(byte[] raw, String encoding) throws DecodeException {
        Objects.requireNonNull(raw, "raw");
        try {
            Charset cs = Charset.forName(encoding);
            boolean wide = cs.name().startsWith("UTF-16");
            return new DecodedText(clean(replacingDecode(raw, cs)), cs.name(), wide);
        } catch (RuntimeException | CharacterCodingException e) {
            throw new DecodeException("Could not decode input as " + encoding + ": " + e, e);
        }
    }

    /**
     * Returns the UTF-16 flavour the bytes appear to be in, or null for narrow input.
     */
    static Charset detectWide(byte[] raw) {
        if (raw.length >= 2) {
            int b0 = raw[0] & 0xFF;
            int b1 = raw[1] & 0xFF;
            if (b0 == 0xFF && b1 == 0xFE) return StandardCharsets.UTF_16LE;
            if (b0 == 0xFE && b1 == 0xFF) return StandardCharsets.UTF_16BE;
        }
        int n = Math.min(raw.length, SNIFF_BYTES);
        if (n == 0) return null;
        int evenNulls = 0;
        int oddNulls = 0;
        for (int i = 0; i < n; i++) {
            if (raw[i] == 0) {
                if ((i & 1) == 0) evenNulls++; else oddNulls++;
            }
        }
        if ((double) (evenNulls + oddNulls) / n <= WIDE_NULL_RATIO) return null;
        // ASCII in UTF-16LE puts the zero high byte at odd offsets
        return oddNulls >= evenNulls ? StandardCharsets.UTF_16LE : StandardCharsets.UTF_16BE;
    }

    private static String strictDecode(byte[] raw, Charset cs) throws CharacterCodingException {
        CharsetDecoder decoder = cs.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        return decoder.decode(ByteBuffer.wrap(raw)).toString();
    }

    private static String replacingDecode(byte[] raw, Charset cs) throws CharacterCodingException {
        CharsetDecoder decoder = cs.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        return decoder.decode(ByteBuffer.wrap(raw)).toString();
    }

    static String clean(String text) {
        String s = text;
        if (!s.isEmpty() && s.charAt(0) == '\uFEFF') s = s.substring(1);
        return s.indexOf('\0') >= 0 ? s.replace("\0", "") : s;
    }
}
