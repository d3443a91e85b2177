package com.expensesnap.core.domain;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Immutable USD-relative rate table. Published as a whole so readers never see a partial update.
 */
public final class ExchangeRateSnapshot {

    private final Map<String, BigDecimal> rates;
    private final Instant fetchedAt;
    private final RateSource source;

    public ExchangeRateSnapshot(Map<String, BigDecimal> rates, Instant fetchedAt, RateSource source) {
        this.rates = Map.copyOf(rates);
        this.fetchedAt = fetchedAt;
        this.source = source;
    }

    public static ExchangeRateSnapshot fallback(Instant now) {
        return new ExchangeRateSnapshot(FallbackRates.TABLE, now, RateSource.FALLBACK);
    }

    /** Rate of {@code code} against USD; unknown codes are treated as USD-pegged. */
    public BigDecimal rateOf(CurrencyCode code) {
        return rates.getOrDefault(code.code(), BigDecimal.ONE);
    }

    public boolean isFresh(Instant now, Duration ttl) {
        return fetchedAt.plus(ttl).isAfter(now);
    }

    public ExchangeRateSnapshot withSource(RateSource newSource) {
        return new ExchangeRateSnapshot(rates, fetchedAt, newSource);
    }

    public Map<String, BigDecimal> getRates() {
        return rates;
    }

    public Instant getFetchedAt() {
        return fetchedAt;
    }

    public RateSource getSource() {
        return source;
    }
}
