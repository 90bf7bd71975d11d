package io.valuation.core;

import java.util.Optional;

/**
 * A finite producer of records with strictly increasing seq starting at 0.
 */
public interface Source<T> {
    /**
     * Next record, or empty once the source has nothing left. Callers use {@link #isFinished()} to tell
     * "nothing yet" from "done".
     */
    Optional<Record<T>> poll();

    boolean isFinished();
}
