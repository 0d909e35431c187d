package com.kpAnalyzer.financeEngine.extraction.config;

import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * Tunable windows, tolerances and limits of the extraction pipeline.
 * 
 * Defaults are empirical and have not been calibrated against a labelled corpus;
 * override them through {@code finance.extraction.*} properties.
 */
@Getter
@Builder
public class ExtractionThresholds {
    
    /**
     * Characters on each side of an accepted match start that later currencies cannot claim.
     */
    @Builder.Default
    private final int claimWindow = 10;
    
    /**
     * Relative amount difference under which two mentions of one currency are duplicates.
     */
    @Builder.Default
    private final BigDecimal dedupAmountTolerance = new BigDecimal("0.01");
    
    @Builder.Default
    private final int dedupPositionWindow = 50;
    
    @Builder.Default
    private final int budgetKeywordWindow = 200;
    
    @Builder.Default
    private final int categoryKeywordWindow = 150;
    
    @Builder.Default
    private final int paymentTermMinLength = 15;
    
    @Builder.Default
    private final int paymentTermMaxLength = 200;
    
    @Builder.Default
    private final double paymentTermSimilarity = 0.7;
    
    @Builder.Default
    private final int maxPaymentTerms = 10;
    
    @Builder.Default
    private final int financialNoteMinLength = 20;
    
    @Builder.Default
    private final int financialNoteMaxLength = 300;
    
    @Builder.Default
    private final double financialNoteSimilarity = 0.6;
    
    @Builder.Default
    private final int maxFinancialNotes = 15;
    
    @Builder.Default
    private final BigDecimal minRealisticAmount = new BigDecimal("0.01");
    
    @Builder.Default
    private final BigDecimal maxRealisticAmount = new BigDecimal("1000000000");
    
    /**
     * Share by which the other mentions may exceed the total budget before it is flagged.
     */
    @Builder.Default
    private final BigDecimal budgetOverrunTolerance = new BigDecimal("0.25");
    
    @Builder.Default
    private final int minValidConfidence = 60;
    
    /**
     * A result with this many issues or more is never valid.
     */
    @Builder.Default
    private final int maxIssuesForValid = 3;
    
    public static ExtractionThresholds defaults() {
        return ExtractionThresholds.builder().build();
    }
}
