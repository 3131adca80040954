package io.raggedcsv.core;

import java.io.Closeable;
import java.util.Optional;

/**
 * A finite Source hands out records numbered 0, 1, 2, ... without gaps.
 */
public interface Source<T> extends Closeable {
    /**
     * Next record, or empty once the source is exhausted. After an empty result {@link #isFinished()} must be true.
     */
    Optional<Record<T>> poll();

    boolean isFinished();

    @Override
    default void close() {}
}
