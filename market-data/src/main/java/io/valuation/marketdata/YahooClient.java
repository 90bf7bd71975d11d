package io.valuation.marketdata;

/**
 * Raw access to the Yahoo Finance v8 chart endpoint. period1 / period2 are epoch seconds,
 * interval is a Yahoo interval such as "1d".
 */
@FunctionalInterface
public interface YahooClient {
    String fetch(String symbol, long period1, long period2, String interval) throws Exception;
}
