package com.expensesnap.core.infrastructure.rates;

import com.expensesnap.core.application.CurrencyConversionService;
import com.expensesnap.core.domain.ExchangeRateSnapshot;
import com.expensesnap.core.domain.RateSource;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports which rate table conversions currently use. Stays UP when degraded: conversions
 * still succeed from stale or fallback rates.
 */
@Component("exchangeRates")
public class ExchangeRateHealthIndicator implements HealthIndicator {

    private final CurrencyConversionService currency;

    public ExchangeRateHealthIndicator(CurrencyConversionService currency) {
        this.currency = currency;
    }

    @Override
    public Health health() {
        ExchangeRateSnapshot snapshot = currency.peek();
        boolean degraded = snapshot.getSource() == RateSource.STALE || snapshot.getSource() == RateSource.FALLBACK;
        return Health.up()
                .withDetail("state", degraded ? "DEGRADED" : "OK")
                .withDetail("source", snapshot.getSource().name())
                .withDetail("fetchedAt", snapshot.getFetchedAt().toString())
                .withDetail("currencies", snapshot.getRates().size())
                .build();
    }
}
