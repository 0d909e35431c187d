package com.kpAnalyzer.financeEngine.extraction.model;

/**
 * Currencies recognized in proposal text.
 */
public enum CurrencyCode {
    KGS,
    RUB,
    USD,
    EUR,
    KZT,
    UZS,
    TJS,
    UAH
}
