package io.valuation.core;

/**
 * Consumes records in seq order. Only ever called from the pipeline's single sink thread.
 */
@FunctionalInterface
public interface Sink<T> {
    void accept(Record<T> record) throws Exception;
}
