package io.valuation.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.valuation.analytics.Frequency;
import io.valuation.error.ConfigException;
import io.valuation.error.DataException;
import io.valuation.orchestrator.OptionParameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Inputs of one valuation run, read from a JSON document such as:
 *
 * <pre>
 * {
 *   "stock_price": 50.0,
 *   "strike_price": 45.0,
 *   "grant_date": "2019-06-01",
 *   "valuation_date": "2020-01-01",
 *   "expiration_date": "2025-01-01",
 *   "vesting_end_date": "2023-01-01",
 *   "public_comps": ["AAPL", "MSFT"],
 *   "frequency": "weekly"
 * }
 * </pre>
 *
 * frequency is optional and defaults to daily. Every other field is required.
 */
public record ValuationConfig(double stockPrice,
                              double strikePrice,
                              LocalDate grantDate,
                              LocalDate valuationDate,
                              LocalDate expirationDate,
                              LocalDate vestingEndDate,
                              List<String> publicComps,
                              Frequency frequency) {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public ValuationConfig {
        publicComps = List.copyOf(publicComps);
    }

    public static ValuationConfig load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigException("config", "file not found: " + path);
        }
        try {
            return fromJson(MAPPER.readTree(path.toFile()));
        } catch (IOException e) {
            throw new ConfigException("config", "cannot read " + path + ": " + e.getMessage(), e);
        }
    }

    public static ValuationConfig parse(String json) {
        try {
            return fromJson(MAPPER.readTree(json));
        } catch (IOException e) {
            throw new ConfigException("config", "malformed JSON: " + e.getMessage(), e);
        }
    }

    static ValuationConfig fromJson(JsonNode root) {
        if (root == null || !root.isObject()) throw new ConfigException("config", "expected a JSON object");
        double stock = positiveNumber(root, "stock_price");
        double strike = positiveNumber(root, "strike_price");
        LocalDate grant = date(root, "grant_date");
        LocalDate valuation = date(root, "valuation_date");
        LocalDate expiration = date(root, "expiration_date");
        LocalDate vestingEnd = date(root, "vesting_end_date");
        if (expiration.isBefore(valuation)) {
            throw new ConfigException("expiration_date", "must not be before valuation_date " + valuation);
        }
        if (vestingEnd.isBefore(valuation)) {
            throw new ConfigException("vesting_end_date", "must not be before valuation_date " + valuation);
        }
        List<String> comps = tickers(root, "public_comps");
        Frequency frequency = Frequency.DAILY;
        JsonNode f = root.get("frequency");
        if (f != null && !f.isNull()) {
            if (!f.isTextual()) throw new ConfigException("frequency", "expected a string");
            try {
                frequency = Frequency.parse(f.asText());
            } catch (DataException e) {
                throw new ConfigException("frequency", e.getMessage(), e);
            }
        }
        return new ValuationConfig(stock, strike, grant, valuation, expiration, vestingEnd, comps, frequency);
    }

    public OptionParameters optionParameters() {
        return new OptionParameters(stockPrice, strikePrice, grantDate, valuationDate, expirationDate, vestingEndDate);
    }

    private static JsonNode required(JsonNode root, String field) {
        JsonNode n = root.get(field);
        if (n == null || n.isNull()) throw new ConfigException(field, "required field is missing");
        return n;
    }

    private static double positiveNumber(JsonNode root, String field) {
        JsonNode n = required(root, field);
        if (!n.isNumber()) throw new ConfigException(field, "expected a number, got " + n);
        double v = n.asDouble();
        if (!(v > 0) || Double.isInfinite(v)) throw new ConfigException(field, "must be positive, was " + v);
        return v;
    }

    private static LocalDate date(JsonNode root, String field) {
        JsonNode n = required(root, field);
        if (!n.isTextual()) throw new ConfigException(field, "expected a yyyy-MM-dd string, got " + n);
        try {
            return LocalDate.parse(n.asText());
        } catch (DateTimeParseException e) {
            throw new ConfigException(field, "not a yyyy-MM-dd date: '" + n.asText() + "'", e);
        }
    }

    private static List<String> tickers(JsonNode root, String field) {
        JsonNode n = required(root, field);
        if (!n.isArray() || n.isEmpty()) throw new ConfigException(field, "expected a non-empty list of tickers");
        List<String> out = new ArrayList<>(n.size());
        for (JsonNode t : n) {
            if (!t.isTextual() || t.asText().isBlank()) throw new ConfigException(field, "ticker must be a non-blank string, got " + t);
            out.add(t.asText().trim());
        }
        return out;
    }
}
