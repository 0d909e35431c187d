package com.kpAnalyzer.financeEngine.extraction.model;

import java.util.Arrays;

/**
 * Named cost categories of a proposal budget.
 * Each category carries the lower-case key used in pattern data and API responses.
 */
public enum CostCategory {
    DEVELOPMENT("development"),
    INFRASTRUCTURE("infrastructure"),
    SUPPORT("support"),
    TESTING("testing"),
    DEPLOYMENT("deployment"),
    PROJECT_MANAGEMENT("project_management"),
    DESIGN("design"),
    DOCUMENTATION("documentation");

    private final String key;

    CostCategory(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * Resolves a category from its key.
     *
     * @param key Category key (e.g., "project_management")
     * @return Matching category
     * @throws IllegalArgumentException if no category has this key
     */
    public static CostCategory fromKey(String key) {
        return Arrays.stream(values())
                .filter(category -> category.key.equalsIgnoreCase(key))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown cost category: " + key));
    }
}
