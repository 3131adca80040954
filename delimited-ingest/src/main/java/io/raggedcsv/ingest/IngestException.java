package io.raggedcsv.ingest;

/**
 * Base of the checked failures raised while turning a delimited file into a table.
 */
public class IngestException extends Exception {
    public IngestException(String message) {
        super(message);
    }

    public IngestException(String message, Throwable cause) {
        super(message, cause);
    }
}
