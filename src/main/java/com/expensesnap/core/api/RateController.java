package com.expensesnap.core.api;

import com.expensesnap.core.api.dto.RatesResponse;
import com.expensesnap.core.application.CurrencyConversionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Exchange rates")
@SecurityRequirement(name = "Bearer Authentication")
public class RateController {

    private final CurrencyConversionService currency;

    public RateController(CurrencyConversionService currency) {
        this.currency = currency;
    }

    @GetMapping("/rates")
    @Operation(summary = "USD-based rate table currently in use and where it came from")
    public RatesResponse rates() {
        return RatesResponse.from(currency.currentRates());
    }
}
