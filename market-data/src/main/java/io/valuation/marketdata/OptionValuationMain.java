package io.valuation.marketdata;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Module;
import io.valuation.config.RuntimeSettings;
import io.valuation.config.ValuationConfig;
import io.valuation.error.ConfigException;
import io.valuation.error.ValuationException;
import io.valuation.ingestor.ValuationModule;
import io.valuation.orchestrator.ValuationOrchestrator;
import io.valuation.orchestrator.ValuationResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI that values an option grant from a JSON config and writes the report CSVs.
 */
@CommandLine.Command(name = "option-valuation", mixinStandardHelpOptions = true,
        description = "Black-Scholes valuation of an option grant from comparable-company volatility and the treasury curve")
public final class OptionValuationMain implements Callable<Integer> {
    private static final Logger log = LogManager.getLogger(OptionValuationMain.class);

    static final int EXIT_CONFIG = 2;
    static final int EXIT_FAILURE = 1;

    @CommandLine.Option(names = {"-c", "--config"}, description = "Valuation config JSON", defaultValue = "config/config.json")
    Path configPath;

    @CommandLine.Option(names = {"-o", "--out"}, description = "Output directory for the report CSVs (default: valuation.out / VALUATION_OUT / output)")
    Path outDir;

    @CommandLine.Option(names = {"-w", "--workers"}, description = "Tickers fetched in parallel (default: valuation.workers / VALUATION_WORKERS / 4)")
    Integer workers;

    private final Module marketDataModule;

    public OptionValuationMain() {
        this(new YahooMarketDataModule());
    }

    OptionValuationMain(Module marketDataModule) {
        this.marketDataModule = marketDataModule;
    }

    public static void main(String[] args) {
        int code = new CommandLine(new OptionValuationMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() throws Exception {
        RuntimeSettings settings;
        ValuationConfig config;
        try {
            settings = RuntimeSettings.fromEnv();
            if (workers != null) settings = settings.withWorkers(Math.max(1, workers));
            if (outDir != null) settings = settings.withOutputDir(outDir);
            log.info("Loading configuration from {}", configPath);
            config = ValuationConfig.load(configPath);
            log.info("Configuration loaded: {}", config);
        } catch (ConfigException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return EXIT_CONFIG;
        }

        Injector injector = Guice.createInjector(new ValuationModule(settings), marketDataModule);
        ValuationOrchestrator orchestrator = injector.getInstance(ValuationOrchestrator.class);
        MetricRegistry registry = injector.getInstance(MetricRegistry.class);

        try {
            ValuationResult result = orchestrator.run(config);
            ReportCsvWriter writer = new ReportCsvWriter(settings.outputDir());
            log.info("Saving results to {}", writer.outDir());
            List<Path> files = writer.write(ValuationReport.from(result));
            log.info("Results saved to {}", files);
            return 0;
        } catch (ValuationException e) {
            log.error("Valuation failed: {}", e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException e) {
            log.error("Could not write report to {}: {}", settings.outputDir(), e.getMessage());
            return EXIT_FAILURE;
        } finally {
            logMetrics(registry);
        }
    }

    private static void logMetrics(MetricRegistry r) {
        log.info("metrics: tickersOk={} tickersFailed={} | yieldsOk={} yieldsMissing={} | yahooRequests={} yahooFailures={} yahooZeroRows={} | transform.p50(ms)={}",
                r.counter("volatility.tickers.succeeded").getCount(),
                r.counter("volatility.tickers.failed").getCount(),
                r.counter("yield.instruments.fetched").getCount(),
                r.counter("yield.instruments.missing").getCount(),
                r.counter("yahoo.fetch.requests").getCount(),
                r.counter("yahoo.fetch.failures").getCount(),
                r.counter("yahoo.fetch.zeroRows").getCount(),
                String.format("%.3f", r.timer("volatility.transform.time").getSnapshot().getMedian() / 1_000_000.0));
    }
}
