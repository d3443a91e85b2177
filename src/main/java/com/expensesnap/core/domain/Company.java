package com.expensesnap.core.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

public class Company {

    private final UUID id;
    private final String name;
    private final CurrencyCode homeCurrency;
    private final OffsetDateTime createdAt;

    public Company(UUID id, String name, CurrencyCode homeCurrency, OffsetDateTime createdAt) {
        this.id = id;
        this.name = name;
        this.homeCurrency = homeCurrency == null ? CurrencyCode.USD : homeCurrency;
        this.createdAt = createdAt;
    }

    public Company withSettings(String newName, CurrencyCode newHomeCurrency) {
        return new Company(id,
                newName != null ? newName : name,
                newHomeCurrency != null ? newHomeCurrency : homeCurrency,
                createdAt);
    }

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public CurrencyCode getHomeCurrency() {
        return homeCurrency;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
