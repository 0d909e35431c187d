package com.kpAnalyzer.financeEngine.extraction.service;

import com.kpAnalyzer.financeEngine.extraction.exception.InvalidInputException;
import com.kpAnalyzer.financeEngine.extraction.model.CostBreakdown;
import com.kpAnalyzer.financeEngine.extraction.model.CurrencyMention;
import com.kpAnalyzer.financeEngine.extraction.model.ExtractedFinancials;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Financial data extraction engine - entry point.
 * 
 * Pipeline:
 * SCAN -> DEDUPLICATE -> IDENTIFY_BUDGET -> CATEGORIZE -> EXTRACT_TERMS -> EXTRACT_NOTES
 * 
 * Stateless and deterministic: the same text always yields an equal result, and concurrent
 * calls on independent inputs need no coordination.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FinancialExtractionService {
    
    private final CurrencyMentionScanner currencyMentionScanner;
    private final MentionDeduplicator mentionDeduplicator;
    private final BudgetIdentifier budgetIdentifier;
    private final CostBreakdownCategorizer costBreakdownCategorizer;
    private final FinancialExcerptExtractor financialExcerptExtractor;
    
    /**
     * Extracts the structured financial summary of a proposal.
     * 
     * @param text Plain document text; may be empty
     * @return Extracted financials (all-empty when the text holds no financial data)
     * @throws InvalidInputException if text is null
     */
    public ExtractedFinancials extractFinancialData(String text) {
        if (text == null) {
            log.warn("Rejected extraction request with null text");
            throw new InvalidInputException("Document text must not be null");
        }
        
        log.debug("Starting financial data extraction - text length: {}", text.length());
        
        List<CurrencyMention> currencies = mentionDeduplicator.deduplicate(currencyMentionScanner.scan(text));
        CurrencyMention totalBudget = budgetIdentifier.identify(currencies, text);
        CostBreakdown costBreakdown = costBreakdownCategorizer.categorize(currencies, text);
        List<String> paymentTerms = financialExcerptExtractor.extractPaymentTerms(text);
        List<String> financialNotes = financialExcerptExtractor.extractFinancialNotes(text);
        
        log.info("Extraction completed - currencies: {}, totalBudget: {}, categories: {}, paymentTerms: {}, notes: {}",
                currencies.size(),
                totalBudget != null ? totalBudget.getAmount() + " " + totalBudget.getCode() : "none",
                costBreakdown.namedCategoryCount(),
                paymentTerms.size(),
                financialNotes.size());
        
        return ExtractedFinancials.builder()
                .totalBudget(totalBudget)
                .currencies(currencies)
                .costBreakdown(costBreakdown)
                .paymentTerms(paymentTerms)
                .financialNotes(financialNotes)
                .build();
    }
}
