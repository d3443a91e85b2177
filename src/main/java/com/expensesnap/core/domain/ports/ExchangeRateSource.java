package com.expensesnap.core.domain.ports;

import com.expensesnap.core.exception.RateFetchDegradedException;

import java.math.BigDecimal;
import java.util.Map;

public interface ExchangeRateSource {

    /** Current USD-relative rates keyed by upper-case currency code. */
    Map<String, BigDecimal> fetchRates() throws RateFetchDegradedException;
}
