package com.kpAnalyzer.financeEngine.extraction.model;

import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Compiled recognition data for one currency.
 */
@Getter
@Builder
public class CurrencyPattern {
    
    private final CurrencyCode code;
    
    private final String symbol;
    
    private final String name;
    
    /**
     * Value of one unit in the reference currency.
     */
    private final BigDecimal referenceRate;
    
    /**
     * Amount-plus-symbol pattern (prefix form "$1,234.56" or suffix form "10 000 руб").
     */
    private final Pattern pattern;
}
