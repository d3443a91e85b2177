package com.expensesnap.core.domain;

import java.util.Arrays;
import java.util.List;

/**
 * Closed set of expense categories. Anything the extractor or an editor sends that is not
 * one of these labels is stored as {@link #OTHER}.
 */
public enum ExpenseCategory {
    FOOD_AND_DINING("Food & Dining"),
    GROCERIES("Groceries"),
    AIR_TRAVEL("Air Travel"),
    CAB_AND_RIDESHARE("Cab & Rideshare"),
    HOTEL_AND_ACCOMMODATION("Hotel & Accommodation"),
    SHOPPING_AND_RETAIL("Shopping & Retail"),
    UTILITIES("Utilities"),
    ENTERTAINMENT("Entertainment"),
    OFFICE_AND_BUSINESS("Office & Business"),
    HEALTHCARE("Healthcare"),
    FUEL_AND_PARKING("Fuel & Parking"),
    OTHER("Other");

    private final String label;

    ExpenseCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static ExpenseCategory fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        String v = value.trim();
        return Arrays.stream(values())
                .filter(c -> c.label.equalsIgnoreCase(v) || c.name().equalsIgnoreCase(v))
                .findFirst()
                .orElse(OTHER);
    }

    public static List<String> labels() {
        return Arrays.stream(values()).map(ExpenseCategory::label).toList();
    }
}
