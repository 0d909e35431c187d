package com.kpAnalyzer.financeEngine.extraction.service;

import com.kpAnalyzer.financeEngine.extraction.config.ExtractionThresholds;
import com.kpAnalyzer.financeEngine.extraction.model.CurrencyMention;
import com.kpAnalyzer.financeEngine.extraction.model.ExtractedFinancials;
import com.kpAnalyzer.financeEngine.extraction.model.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Scores how trustworthy an extraction result is.
 * 
 * Confidence starts at 100 and each failed check lowers it:
 * - no currencies found: -30
 * - unrealistic amounts present: -10
 * - other mentions sum above the total budget beyond tolerance: -15
 * - no named cost category populated: -5 (suggestion only)
 * 
 * A result is valid when confidence reaches the minimum, fewer issues than the limit were
 * recorded and at least one currency was found.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FinancialDataValidator {
    
    private static final int MAX_CONFIDENCE = 100;
    private static final int NO_CURRENCIES_PENALTY = 30;
    private static final int UNREALISTIC_AMOUNTS_PENALTY = 10;
    private static final int BUDGET_MISMATCH_PENALTY = 15;
    private static final int NO_BREAKDOWN_PENALTY = 5;
    
    private final CurrencyConverter currencyConverter;
    private final ExtractionThresholds thresholds;
    
    public ValidationResult validate(ExtractedFinancials financials) {
        List<String> issues = new ArrayList<>();
        List<String> suggestions = new ArrayList<>();
        int confidence = MAX_CONFIDENCE;
        List<CurrencyMention> currencies = financials.getCurrencies();
        
        if (currencies.isEmpty()) {
            issues.add("No currency amounts were found in the document");
            suggestions.add("Verify that the document contains financial information");
            confidence -= NO_CURRENCIES_PENALTY;
        }
        
        long unrealistic = currencies.stream().filter(this::isUnrealistic).count();
        if (unrealistic > 0) {
            issues.add("Unrealistic amounts detected: " + unrealistic);
            suggestions.add("Verify that numeric values were parsed correctly");
            confidence -= UNREALISTIC_AMOUNTS_PENALTY;
        }
        
        if (isBudgetSmallerThanParts(financials)) {
            issues.add("Total budget is smaller than the sum of its parts");
            suggestions.add("Verify that the total budget was identified correctly");
            confidence -= BUDGET_MISMATCH_PENALTY;
        }
        
        if (financials.getCostBreakdown().namedCategoryCount() == 0) {
            suggestions.add("No cost breakdown found - consider adding itemized cost data to the proposal");
            confidence -= NO_BREAKDOWN_PENALTY;
        }
        
        confidence = Math.max(0, Math.min(MAX_CONFIDENCE, confidence));
        boolean valid = confidence >= thresholds.getMinValidConfidence()
                && issues.size() < thresholds.getMaxIssuesForValid()
                && !currencies.isEmpty();
        
        log.debug("Validation completed - valid: {}, confidence: {}, issues: {}", valid, confidence, issues.size());
        return ValidationResult.builder()
                .valid(valid)
                .confidence(confidence)
                .issues(issues)
                .suggestions(suggestions)
                .build();
    }
    
    private boolean isUnrealistic(CurrencyMention mention) {
        return mention.getAmount().compareTo(thresholds.getMaxRealisticAmount()) > 0
                || mention.getAmount().compareTo(thresholds.getMinRealisticAmount()) < 0;
    }
    
    private boolean isBudgetSmallerThanParts(ExtractedFinancials financials) {
        CurrencyMention budget = financials.getTotalBudget();
        if (budget == null) {
            return false;
        }
        List<CurrencyMention> others = financials.getCurrencies().stream()
                .filter(mention -> mention != budget)
                .toList();
        if (others.isEmpty()) {
            return false;
        }
        BigDecimal sumOfOthers = currencyConverter.toReference(others);
        BigDecimal allowed = currencyConverter.toReference(budget)
                .multiply(BigDecimal.ONE.add(thresholds.getBudgetOverrunTolerance()));
        return sumOfOthers.compareTo(allowed) > 0;
    }
}
