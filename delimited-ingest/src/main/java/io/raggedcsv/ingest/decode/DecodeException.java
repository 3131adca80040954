package io.raggedcsv.ingest.decode;

import io.raggedcsv.ingest.IngestException;

/**
 * No configured charset could turn the bytes into text. Fatal for the file.
 */
public class DecodeException extends IngestException {
    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
