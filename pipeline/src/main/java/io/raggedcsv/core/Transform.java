package io.raggedcsv.core;

/**
 * Transform converts one input record into one output record carrying the same seq.
 * Implementations are invoked concurrently from worker threads and must not share mutable state.
 */
public interface Transform<I, O> {
    Record<O> apply(Record<I> input) throws Exception;
}
