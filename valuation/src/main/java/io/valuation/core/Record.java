package io.valuation.core;

/**
 * Carries a payload together with its position in the source, so outputs can be put back in source order.
 */
public record Record<T>(long seq, T payload) implements Comparable<Record<?>> {
    @Override
    public int compareTo(Record<?> o) {
        return Long.compare(this.seq, o.seq);
    }
}
