package com.expensesnap.core.application;

import com.expensesnap.core.config.AppProperties;
import com.expensesnap.core.domain.CurrencyCode;
import com.expensesnap.core.domain.ExchangeRateSnapshot;
import com.expensesnap.core.domain.RateSource;
import com.expensesnap.core.domain.ports.ExchangeRateSource;
import com.expensesnap.core.exception.RateFetchDegradedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Converts amounts between currencies through USD-relative rates.
 *
 * <p>Rates are cached process-wide for the configured time-to-live. A failed refresh serves
 * the expired snapshot if one exists and the hardcoded fallback table otherwise, so
 * {@link #convert} never fails because of the network. The fetch itself runs outside the
 * lock; only publication of the new snapshot is guarded.
 */
@Service
public class CurrencyConversionService {

    private static final Logger log = LoggerFactory.getLogger(CurrencyConversionService.class);

    private final ExchangeRateSource source;
    private final Clock clock;
    private final Duration ttl;
    private final ReentrantLock lock = new ReentrantLock();

    // Last successfully fetched snapshot; the fallback table is never stored here
    private volatile ExchangeRateSnapshot cached;

    public CurrencyConversionService(ExchangeRateSource source, Clock clock, AppProperties props) {
        this.source = source;
        this.clock = clock;
        this.ttl = props.getRates().getTtl();
    }

    public BigDecimal convert(BigDecimal amount, CurrencyCode from, CurrencyCode to) {
        if (amount == null) {
            return null;
        }
        if (amount.signum() == 0 || from.equals(to)) {
            return amount.setScale(2, RoundingMode.HALF_UP);
        }
        return convert(amount, from, to, currentRates());
    }

    static BigDecimal convert(BigDecimal amount, CurrencyCode from, CurrencyCode to, ExchangeRateSnapshot rates) {
        if (amount.signum() == 0 || from.equals(to)) {
            return amount.setScale(2, RoundingMode.HALF_UP);
        }
        BigDecimal inUsd = amount.divide(rates.rateOf(from), MathContext.DECIMAL64);
        return inUsd.multiply(rates.rateOf(to)).setScale(2, RoundingMode.HALF_UP);
    }

    /** Current rate table, refreshing it first if the cached one has expired. */
    public ExchangeRateSnapshot currentRates() {
        Instant now = clock.instant();
        ExchangeRateSnapshot snapshot = cached;
        if (snapshot != null && snapshot.isFresh(now, ttl)) {
            return snapshot.withSource(RateSource.CACHED);
        }

        try {
            Map<String, BigDecimal> rates = source.fetchRates();
            ExchangeRateSnapshot fresh = new ExchangeRateSnapshot(rates, now, RateSource.LIVE);
            publish(fresh);
            return fresh;
        } catch (RateFetchDegradedException e) {
            ExchangeRateSnapshot last = cached;
            if (last != null) {
                log.warn("Exchange rate refresh failed, using rates from {}: {}", last.getFetchedAt(), e.getMessage());
                return last.withSource(RateSource.STALE);
            }
            log.warn("Exchange rate refresh failed and nothing is cached, using fallback rates: {}", e.getMessage());
            return ExchangeRateSnapshot.fallback(now);
        }
    }

    /**
     * Snapshot for display and health reporting. Does not trigger a fetch.
     */
    public ExchangeRateSnapshot peek() {
        ExchangeRateSnapshot snapshot = cached;
        if (snapshot == null) {
            return ExchangeRateSnapshot.fallback(clock.instant());
        }
        return snapshot.isFresh(clock.instant(), ttl) ? snapshot.withSource(RateSource.CACHED)
                : snapshot.withSource(RateSource.STALE);
    }

    private void publish(ExchangeRateSnapshot fresh) {
        lock.lock();
        try {
            // Concurrent refreshes may finish out of order; keep the newest
            if (cached == null || !cached.getFetchedAt().isAfter(fresh.getFetchedAt())) {
                cached = fresh;
            }
        } finally {
            lock.unlock();
        }
    }
}
