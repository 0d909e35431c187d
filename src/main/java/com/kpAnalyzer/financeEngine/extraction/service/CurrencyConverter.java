package com.kpAnalyzer.financeEngine.extraction.service;

import com.kpAnalyzer.financeEngine.extraction.config.ExtractionPatterns;
import com.kpAnalyzer.financeEngine.extraction.model.CurrencyCode;
import com.kpAnalyzer.financeEngine.extraction.model.CurrencyMention;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Collection;

/**
 * Converts mentions to the reference currency using the fixed rate table.
 * Rates are for comparison only; they are not live exchange rates.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CurrencyConverter {
    
    private final ExtractionPatterns patterns;
    
    public CurrencyCode getReferenceCurrency() {
        return patterns.getReferenceCurrency();
    }
    
    /**
     * Converts one mention to the reference currency.
     * A currency missing from the rate table is taken at par.
     */
    public BigDecimal toReference(CurrencyMention mention) {
        BigDecimal rate = patterns.getReferenceRate(mention.getCode());
        if (rate == null) {
            log.warn("No reference rate for {} - using 1", mention.getCode());
            rate = BigDecimal.ONE;
        }
        return mention.getAmount().multiply(rate);
    }
    
    /**
     * Sum of the given mentions in the reference currency.
     */
    public BigDecimal toReference(Collection<CurrencyMention> mentions) {
        return mentions.stream()
                .map(this::toReference)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
