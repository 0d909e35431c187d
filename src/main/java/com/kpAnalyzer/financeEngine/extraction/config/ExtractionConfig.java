package com.kpAnalyzer.financeEngine.extraction.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;

/**
 * Exposes the pattern tables and thresholds of the extraction pipeline as beans.
 */
@Slf4j
@Configuration
public class ExtractionConfig {
    
    @Value("${finance.extraction.patterns-resource:" + ExtractionPatternsLoader.DEFAULT_RESOURCE + "}")
    private String patternsResource;
    
    @Value("${finance.extraction.claim-window:10}")
    private int claimWindow;
    
    @Value("${finance.extraction.dedup.amount-tolerance:0.01}")
    private BigDecimal dedupAmountTolerance;
    
    @Value("${finance.extraction.dedup.position-window:50}")
    private int dedupPositionWindow;
    
    @Value("${finance.extraction.budget.keyword-window:200}")
    private int budgetKeywordWindow;
    
    @Value("${finance.extraction.category.keyword-window:150}")
    private int categoryKeywordWindow;
    
    @Value("${finance.extraction.payment-terms.min-length:15}")
    private int paymentTermMinLength;
    
    @Value("${finance.extraction.payment-terms.max-length:200}")
    private int paymentTermMaxLength;
    
    @Value("${finance.extraction.payment-terms.similarity:0.7}")
    private double paymentTermSimilarity;
    
    @Value("${finance.extraction.payment-terms.max-count:10}")
    private int maxPaymentTerms;
    
    @Value("${finance.extraction.notes.min-length:20}")
    private int financialNoteMinLength;
    
    @Value("${finance.extraction.notes.max-length:300}")
    private int financialNoteMaxLength;
    
    @Value("${finance.extraction.notes.similarity:0.6}")
    private double financialNoteSimilarity;
    
    @Value("${finance.extraction.notes.max-count:15}")
    private int maxFinancialNotes;
    
    @Value("${finance.extraction.validation.min-realistic-amount:0.01}")
    private BigDecimal minRealisticAmount;
    
    @Value("${finance.extraction.validation.max-realistic-amount:1000000000}")
    private BigDecimal maxRealisticAmount;
    
    @Value("${finance.extraction.validation.budget-overrun-tolerance:0.25}")
    private BigDecimal budgetOverrunTolerance;
    
    @Value("${finance.extraction.validation.min-valid-confidence:60}")
    private int minValidConfidence;
    
    @Value("${finance.extraction.validation.max-issues-for-valid:3}")
    private int maxIssuesForValid;
    
    @Bean
    public ExtractionPatterns extractionPatterns() {
        return ExtractionPatternsLoader.load(patternsResource);
    }
    
    @Bean
    public ExtractionThresholds extractionThresholds() {
        ExtractionThresholds thresholds = ExtractionThresholds.builder()
                .claimWindow(claimWindow)
                .dedupAmountTolerance(dedupAmountTolerance)
                .dedupPositionWindow(dedupPositionWindow)
                .budgetKeywordWindow(budgetKeywordWindow)
                .categoryKeywordWindow(categoryKeywordWindow)
                .paymentTermMinLength(paymentTermMinLength)
                .paymentTermMaxLength(paymentTermMaxLength)
                .paymentTermSimilarity(paymentTermSimilarity)
                .maxPaymentTerms(maxPaymentTerms)
                .financialNoteMinLength(financialNoteMinLength)
                .financialNoteMaxLength(financialNoteMaxLength)
                .financialNoteSimilarity(financialNoteSimilarity)
                .maxFinancialNotes(maxFinancialNotes)
                .minRealisticAmount(minRealisticAmount)
                .maxRealisticAmount(maxRealisticAmount)
                .budgetOverrunTolerance(budgetOverrunTolerance)
                .minValidConfidence(minValidConfidence)
                .maxIssuesForValid(maxIssuesForValid)
                .build();
        log.debug("Extraction thresholds - budgetWindow: {}, categoryWindow: {}, termSimilarity: {}, noteSimilarity: {}",
                budgetKeywordWindow, categoryKeywordWindow, paymentTermSimilarity, financialNoteSimilarity);
        return thresholds;
    }
}
