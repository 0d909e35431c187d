package com.kpAnalyzer.financeEngine.extraction.config;

import com.kpAnalyzer.financeEngine.extraction.model.CostCategory;
import com.kpAnalyzer.financeEngine.extraction.model.CurrencyCode;
import com.kpAnalyzer.financeEngine.extraction.model.CurrencyPattern;
import com.kpAnalyzer.financeEngine.extraction.model.KeywordPattern;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Immutable, precompiled pattern tables shared by all extraction services.
 * 
 * Built once by {@link ExtractionPatternsLoader}; safe to share across threads.
 */
public final class ExtractionPatterns {
    
    private final CurrencyCode referenceCurrency;
    private final List<CurrencyPattern> currencies;
    private final Map<CurrencyCode, CurrencyPattern> currenciesByCode;
    private final List<KeywordPattern> budgetKeywords;
    private final Map<CostCategory, List<KeywordPattern>> categoryKeywords;
    private final List<Pattern> paymentTermPatterns;
    private final List<Pattern> financialNotePatterns;
    
    ExtractionPatterns(CurrencyCode referenceCurrency,
                       List<CurrencyPattern> currencies,
                       List<KeywordPattern> budgetKeywords,
                       Map<CostCategory, List<KeywordPattern>> categoryKeywords,
                       List<Pattern> paymentTermPatterns,
                       List<Pattern> financialNotePatterns) {
        this.referenceCurrency = referenceCurrency;
        this.currencies = List.copyOf(currencies);
        
        Map<CurrencyCode, CurrencyPattern> byCode = new EnumMap<>(CurrencyCode.class);
        for (CurrencyPattern currency : currencies) {
            byCode.put(currency.getCode(), currency);
        }
        this.currenciesByCode = Collections.unmodifiableMap(byCode);
        
        this.budgetKeywords = List.copyOf(budgetKeywords);
        
        Map<CostCategory, List<KeywordPattern>> categories = new LinkedHashMap<>();
        categoryKeywords.forEach((category, keywords) -> categories.put(category, List.copyOf(keywords)));
        this.categoryKeywords = Collections.unmodifiableMap(categories);
        
        this.paymentTermPatterns = List.copyOf(paymentTermPatterns);
        this.financialNotePatterns = List.copyOf(financialNotePatterns);
    }
    
    public CurrencyCode getReferenceCurrency() {
        return referenceCurrency;
    }
    
    /**
     * Currency patterns in priority order.
     */
    public List<CurrencyPattern> getCurrencies() {
        return currencies;
    }
    
    public CurrencyPattern getCurrency(CurrencyCode code) {
        return currenciesByCode.get(code);
    }
    
    /**
     * Reference-currency rate of a currency, or null if the table has no entry for it.
     */
    public BigDecimal getReferenceRate(CurrencyCode code) {
        CurrencyPattern currency = currenciesByCode.get(code);
        return currency != null ? currency.getReferenceRate() : null;
    }
    
    public List<KeywordPattern> getBudgetKeywords() {
        return budgetKeywords;
    }
    
    /**
     * Whole-word keyword patterns per category, in category order.
     */
    public Map<CostCategory, List<KeywordPattern>> getCategoryKeywords() {
        return categoryKeywords;
    }
    
    public List<Pattern> getPaymentTermPatterns() {
        return paymentTermPatterns;
    }
    
    public List<Pattern> getFinancialNotePatterns() {
        return financialNotePatterns;
    }
}
