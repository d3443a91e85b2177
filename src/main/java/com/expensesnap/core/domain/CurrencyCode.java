package com.expensesnap.core.domain;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Three-letter currency code, upper-cased on construction. Whether the code is a real
 * ISO 4217 currency is not checked: unknown codes are accepted and converted at rate 1.
 */
public final class CurrencyCode {

    public static final CurrencyCode USD = new CurrencyCode("USD");

    private static final Pattern THREE_LETTERS = Pattern.compile("[A-Z]{3}");

    private final String code;

    private CurrencyCode(String code) {
        this.code = code;
    }

    public static CurrencyCode of(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Currency code is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (!THREE_LETTERS.matcher(normalized).matches()) {
            throw new IllegalArgumentException("Currency code must be three letters: '" + value + "'");
        }
        return new CurrencyCode(normalized);
    }

    /** Lenient variant for extractor output: blank or malformed values fall back to {@code fallback}. */
    public static CurrencyCode parseOrDefault(String value, CurrencyCode fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return of(value);
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }

    public static boolean isValid(String value) {
        return value != null && THREE_LETTERS.matcher(value.trim().toUpperCase(Locale.ROOT)).matches();
    }

    public String code() {
        return code;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CurrencyCode other)) return false;
        return code.equals(other.code);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code);
    }

    @Override
    public String toString() {
        return code;
    }
}
