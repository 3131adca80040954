package io.raggedcsv.error;

import io.raggedcsv.core.Record;

/**
 * Receives records that could not be processed. Implementations must not throw.
 */
public interface DeadLetterSink<T> extends AutoCloseable {

    /** Where in the pipeline the record failed. */
    enum Stage {
        TRANSFORM, SINK;

        public String label() { return name().toLowerCase(); }
    }

    void acceptFailure(Stage stage, Record<T> record, Exception error);

    @Override default void close() {}
}
