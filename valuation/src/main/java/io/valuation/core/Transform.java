package io.valuation.core;

/**
 * Maps one input record to one output payload. Runs on a worker thread; must not share mutable state
 * with other invocations.
 */
@FunctionalInterface
public interface Transform<I, O> {
    O apply(Record<I> input) throws Exception;
}
