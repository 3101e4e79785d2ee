package com.raditha.neardup.config;

import java.util.Locale;

/**
 * What a query's count measures.
 */
public enum AggregationMode {
    /**
     * Documents with at least one near-duplicate span (default).
     */
    DOCUMENTS,

    /**
     * Near-duplicate span starts, summed over all documents. Disables early exit.
     */
    SPANS;

    public static AggregationMode fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("AggregationMode value cannot be null");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "documents", "docs" -> DOCUMENTS;
            case "spans" -> SPANS;
            default -> throw new IllegalArgumentException(
                    "Invalid aggregation mode: " + value + ". Must be: documents or spans");
        };
    }
}
