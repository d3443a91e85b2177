package com.expensesnap.core.infrastructure.rates;

import com.expensesnap.core.config.AppProperties;
import com.expensesnap.core.domain.ports.ExchangeRateSource;
import com.expensesnap.core.exception.RateFetchDegradedException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;

/**
 * Reads USD-based rates from an open.er-api.com style endpoint:
 * {@code {"result": "success", "rates": {"EUR": 0.92, ...}}}.
 */
@Component
public class OpenErApiRateSource implements ExchangeRateSource {

    private static final Logger log = LoggerFactory.getLogger(OpenErApiRateSource.class);

    private final RestClient restClient;
    private final String url;

    public OpenErApiRateSource(@Qualifier("ratesRestClient") RestClient restClient, AppProperties props) {
        this.restClient = restClient;
        this.url = props.getRates().getUrl();
    }

    @Override
    public Map<String, BigDecimal> fetchRates() throws RateFetchDegradedException {
        JsonNode body;
        try {
            body = restClient.get().uri(url).retrieve().body(JsonNode.class);
        } catch (RestClientException e) {
            throw new RateFetchDegradedException("Exchange rate request failed: " + e.getMessage(), e);
        }
        if (body == null) {
            throw new RateFetchDegradedException("Exchange rate response was empty");
        }
        String result = body.path("result").asText("");
        if (!"success".equalsIgnoreCase(result)) {
            throw new RateFetchDegradedException("Exchange rate source reported result '" + result + "'");
        }

        JsonNode ratesNode = body.path("rates");
        Map<String, BigDecimal> rates = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = ratesNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode value = entry.getValue();
            if (value.isNumber() && value.decimalValue().signum() > 0) {
                rates.put(entry.getKey().toUpperCase(Locale.ROOT), value.decimalValue());
            } else {
                log.debug("Skipping non-positive or non-numeric rate for {}", entry.getKey());
            }
        }
        if (rates.isEmpty()) {
            throw new RateFetchDegradedException("Exchange rate response contained no rates");
        }
        log.info("Fetched {} exchange rates", rates.size());
        return rates;
    }
}
