package io.valuation.source;

import io.valuation.core.Record;
import io.valuation.core.Source;

import java.util.List;
import java.util.Optional;

/**
 * Emits a fixed list of tickers as records, in list order, then completes.
 * Polled from the pipeline's source thread only.
 */
public class TickerListSource implements Source<String> {
    private final List<String> tickers;
    private int idx = 0;

    public TickerListSource(List<String> tickers) {
        this.tickers = List.copyOf(tickers);
    }

    @Override
    public Optional<Record<String>> poll() {
        if (idx >= tickers.size()) return Optional.empty();
        Record<String> r = new Record<>(idx, tickers.get(idx));
        idx++;
        return Optional.of(r);
    }

    @Override
    public boolean isFinished() {
        return idx >= tickers.size();
    }

    public int size() { return tickers.size(); }
}
