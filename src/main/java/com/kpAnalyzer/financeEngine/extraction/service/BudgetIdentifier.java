package com.kpAnalyzer.financeEngine.extraction.service;

import com.kpAnalyzer.financeEngine.extraction.config.ExtractionPatterns;
import com.kpAnalyzer.financeEngine.extraction.config.ExtractionThresholds;
import com.kpAnalyzer.financeEngine.extraction.model.CurrencyMention;
import com.kpAnalyzer.financeEngine.extraction.model.KeywordPattern;
import com.kpAnalyzer.financeEngine.extraction.util.MentionProximity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.regex.Matcher;

/**
 * Selects the mention that represents the total project cost.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BudgetIdentifier {
    
    private final ExtractionPatterns patterns;
    private final ExtractionThresholds thresholds;
    
    /**
     * Identifies the total budget.
     * 
     * Budget keywords are tried in priority order; the first keyword whose first occurrence has a
     * mention within the budget window decides, taking the closest such mention.
     * Without such a keyword the largest amount is used.
     * 
     * @param currencies Deduplicated mentions sorted by position
     * @param text Document text
     * @return One element of {@code currencies}, or null if the list is empty
     */
    public CurrencyMention identify(List<CurrencyMention> currencies, String text) {
        if (currencies.isEmpty()) {
            return null;
        }
        
        for (KeywordPattern keyword : patterns.getBudgetKeywords()) {
            Matcher matcher = keyword.getPattern().matcher(text);
            if (!matcher.find()) {
                continue;
            }
            CurrencyMention nearby = MentionProximity.closest(currencies, matcher.start(), thresholds.getBudgetKeywordWindow());
            if (nearby != null) {
                log.debug("Total budget found via keyword '{}': {} {}", keyword.getKeyword(), nearby.getAmount(), nearby.getCode());
                return nearby;
            }
        }
        
        CurrencyMention largest = currencies.get(0);
        for (CurrencyMention mention : currencies) {
            if (mention.getAmount().compareTo(largest.getAmount()) > 0) {
                largest = mention;
            }
        }
        log.debug("Total budget identified as largest amount: {} {}", largest.getAmount(), largest.getCode());
        return largest;
    }
}
