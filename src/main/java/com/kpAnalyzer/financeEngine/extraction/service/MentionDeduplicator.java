package com.kpAnalyzer.financeEngine.extraction.service;

import com.kpAnalyzer.financeEngine.extraction.config.ExtractionThresholds;
import com.kpAnalyzer.financeEngine.extraction.model.CurrencyMention;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Collapses near-identical mentions.
 * 
 * Two mentions are duplicates when they share a currency, their amounts differ by less than
 * the tolerance (relative to the larger amount) and their positions are closer than the window.
 * The first mention in position order is kept. Running the deduplicator on its own output
 * returns the same list.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MentionDeduplicator {
    
    private final ExtractionThresholds thresholds;
    
    public List<CurrencyMention> deduplicate(List<CurrencyMention> mentions) {
        List<CurrencyMention> ordered = new ArrayList<>(mentions);
        ordered.sort(Comparator.comparingInt(CurrencyMention::getPosition));
        
        List<CurrencyMention> retained = new ArrayList<>();
        for (CurrencyMention mention : ordered) {
            boolean duplicate = retained.stream().anyMatch(existing -> isDuplicate(existing, mention));
            if (!duplicate) {
                retained.add(mention);
            }
        }
        
        if (retained.size() < mentions.size()) {
            log.debug("Deduplication removed {} of {} mentions", mentions.size() - retained.size(), mentions.size());
        }
        return retained;
    }
    
    boolean isDuplicate(CurrencyMention first, CurrencyMention second) {
        if (first.getCode() != second.getCode()) {
            return false;
        }
        if (Math.abs(first.getPosition() - second.getPosition()) >= thresholds.getDedupPositionWindow()) {
            return false;
        }
        BigDecimal larger = first.getAmount().max(second.getAmount());
        BigDecimal difference = first.getAmount().subtract(second.getAmount()).abs();
        return difference.compareTo(larger.multiply(thresholds.getDedupAmountTolerance())) < 0;
    }
}
