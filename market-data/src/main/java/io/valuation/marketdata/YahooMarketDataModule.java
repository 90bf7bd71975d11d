package io.valuation.marketdata;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.valuation.config.RuntimeSettings;
import io.valuation.market.MarketDataProvider;
import io.valuation.retry.ExponentialBackoffRetryPolicy;
import io.valuation.retry.RetryPolicy;

/** Binds {@link MarketDataProvider} to Yahoo Finance over HTTP. */
public class YahooMarketDataModule extends AbstractModule {

    @Provides @Singleton RetryPolicy retryPolicy(RuntimeSettings settings) {
        return new ExponentialBackoffRetryPolicy(settings.httpAttempts(), settings.httpBackoffMillis(), 4_000L);
    }

    @Provides @Singleton YahooClient yahooClient(RetryPolicy retryPolicy) {
        return new HttpYahooClient(retryPolicy);
    }

    @Provides @Singleton MarketDataProvider marketDataProvider(YahooClient client, MetricRegistry registry) {
        return new YahooMarketDataProvider(client, registry);
    }
}
