package io.valuation.marketdata;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.valuation.error.DataException;
import io.valuation.error.NoDataException;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Daily bars parsed out of a v8 chart response. Bars with a null close are dropped; dates are the
 * exchange-local calendar date of each bar's timestamp, shifted by {@code meta.gmtoffset} (UTC when the
 * response has no offset).
 */
record YahooChart(String symbol, List<Bar> bars) {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** adjClose is NaN when the response carries no adjusted series. */
    record Bar(LocalDate date, double close, double adjClose) {}

    static YahooChart parse(String symbol, String body) {
        JsonNode root;
        try {
            root = MAPPER.readTree(body);
        } catch (IOException e) {
            throw new DataException("Unreadable chart response for " + symbol + ": " + e.getMessage());
        }
        JsonNode chart = root.path("chart");
        JsonNode error = chart.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new NoDataException("No data found for " + symbol + ": " + error.path("description").asText(error.toString()));
        }
        JsonNode result = chart.path("result").path(0);
        JsonNode timestamps = result.path("timestamp");
        if (result.isMissingNode() || !timestamps.isArray()) {
            return new YahooChart(symbol, List.of());
        }
        ZoneOffset zone = exchangeOffset(result.path("meta").path("gmtoffset"));
        JsonNode close = result.path("indicators").path("quote").path(0).path("close");
        JsonNode adjClose = result.path("indicators").path("adjclose").path(0).path("adjclose");

        List<Bar> bars = new ArrayList<>(timestamps.size());
        for (int i = 0; i < timestamps.size(); i++) {
            JsonNode c = close.path(i);
            if (!c.isNumber()) continue;
            JsonNode a = adjClose.path(i);
            LocalDate d = Instant.ofEpochSecond(timestamps.get(i).asLong()).atZone(zone).toLocalDate();
            bars.add(new Bar(d, c.asDouble(), a.isNumber() ? a.asDouble() : Double.NaN));
        }
        return new YahooChart(symbol, bars);
    }

    private static ZoneOffset exchangeOffset(JsonNode gmtoffset) {
        if (!gmtoffset.isNumber()) return ZoneOffset.UTC;
        int seconds = gmtoffset.asInt();
        // ZoneOffset accepts +/-18h; anything else is not a real exchange offset
        if (Math.abs(seconds) > 18 * 3600) return ZoneOffset.UTC;
        return ZoneOffset.ofTotalSeconds(seconds);
    }
}
