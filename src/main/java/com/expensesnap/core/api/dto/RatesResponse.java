package com.expensesnap.core.api.dto;

import com.expensesnap.core.domain.ExchangeRateSnapshot;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

public record RatesResponse(String base, String source, Instant fetchedAt, Map<String, BigDecimal> rates) {

    public static RatesResponse from(ExchangeRateSnapshot s) {
        return new RatesResponse("USD", s.getSource().name(), s.getFetchedAt(), new TreeMap<>(s.getRates()));
    }
}
