package io.raggedcsv.core;

import java.io.Closeable;

/**
 * Terminal stage. Called from a single thread with records in increasing seq order; an exception
 * from {@link #accept} dead-letters that record and the run goes on with the next one.
 */
public interface Sink<T> extends Closeable {
    void accept(Record<T> record) throws Exception;

    @Override
    default void close() {}
}
