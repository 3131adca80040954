package io.raggedcsv.core;

/**
 * A payload tagged with its position in the source. Sinks see records in increasing seq order.
 */
public record Record<T>(long seq, T payload) implements Comparable<Record<?>> {

    public <R> Record<R> withPayload(R next) {
        return new Record<>(seq, next);
    }

    @Override
    public int compareTo(Record<?> o) {
        return Long.compare(this.seq, o.seq);
    }
}
