package com.kpAnalyzer.financeEngine.extraction.service;

import com.kpAnalyzer.financeEngine.extraction.config.ExtractionPatterns;
import com.kpAnalyzer.financeEngine.extraction.config.ExtractionThresholds;
import com.kpAnalyzer.financeEngine.extraction.model.CostBreakdown;
import com.kpAnalyzer.financeEngine.extraction.model.CostCategory;
import com.kpAnalyzer.financeEngine.extraction.model.CurrencyMention;
import com.kpAnalyzer.financeEngine.extraction.model.KeywordPattern;
import com.kpAnalyzer.financeEngine.extraction.util.MentionProximity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Assigns mentions to cost categories by keyword proximity.
 * 
 * Every whole-word occurrence of a category keyword proposes the nearest mention in the
 * category window. A proposal replaces the current holder of the category unless the holder is
 * strictly better: closer to its keyword, or equally close with a larger amount. A mention
 * never holds two categories. Proposals that lose end up in {@code other}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CostBreakdownCategorizer {
    
    private final ExtractionPatterns patterns;
    private final ExtractionThresholds thresholds;
    
    public CostBreakdown categorize(List<CurrencyMention> currencies, String text) {
        if (currencies.isEmpty()) {
            return CostBreakdown.empty();
        }
        
        Map<CostCategory, Assignment> assignments = new EnumMap<>(CostCategory.class);
        List<CurrencyMention> losers = new ArrayList<>();
        
        for (Map.Entry<CostCategory, List<KeywordPattern>> entry : patterns.getCategoryKeywords().entrySet()) {
            CostCategory category = entry.getKey();
            for (KeywordPattern keyword : entry.getValue()) {
                Matcher matcher = keyword.getPattern().matcher(text);
                while (matcher.find()) {
                    int keywordPosition = matcher.start();
                    CurrencyMention candidate = MentionProximity.nearest(
                            currencies, keywordPosition, thresholds.getCategoryKeywordWindow());
                    if (candidate != null) {
                        propose(assignments, losers, category, candidate, candidate.distanceTo(keywordPosition));
                    }
                }
            }
        }
        
        Map<CostCategory, CurrencyMention> categories = new EnumMap<>(CostCategory.class);
        Set<CurrencyMention> assigned = Collections.newSetFromMap(new IdentityHashMap<>());
        assignments.forEach((category, assignment) -> {
            categories.put(category, assignment.mention());
            assigned.add(assignment.mention());
        });
        
        List<CurrencyMention> other = new ArrayList<>();
        Set<CurrencyMention> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (CurrencyMention loser : losers) {
            if (!assigned.contains(loser) && seen.add(loser)) {
                other.add(loser);
            }
        }
        
        log.debug("Cost breakdown extracted - categories: {}, other: {}", categories.keySet(), other.size());
        return CostBreakdown.builder()
                .categories(categories)
                .other(other)
                .build();
    }
    
    private void propose(Map<CostCategory, Assignment> assignments,
                         List<CurrencyMention> losers,
                         CostCategory category,
                         CurrencyMention candidate,
                         int distance) {
        Assignment current = assignments.get(category);
        
        if (current != null && current.mention() == candidate) {
            if (distance < current.distance()) {
                assignments.put(category, new Assignment(candidate, distance));
            }
            return;
        }
        
        if (isHeldElsewhere(assignments, category, candidate)) {
            losers.add(candidate);
            return;
        }
        
        if (current == null || replacesHolder(candidate, distance, current)) {
            if (current != null) {
                losers.add(current.mention());
            }
            assignments.put(category, new Assignment(candidate, distance));
        } else {
            losers.add(candidate);
        }
    }
    
    /**
     * The holder stays only when strictly better: closer, or equally close with a larger amount.
     */
    private boolean replacesHolder(CurrencyMention candidate, int distance, Assignment current) {
        if (distance != current.distance()) {
            return distance < current.distance();
        }
        return candidate.getAmount().compareTo(current.mention().getAmount()) >= 0;
    }
    
    private boolean isHeldElsewhere(Map<CostCategory, Assignment> assignments, CostCategory category, CurrencyMention candidate) {
        return assignments.entrySet().stream()
                .anyMatch(entry -> entry.getKey() != category && entry.getValue().mention() == candidate);
    }
    
    private record Assignment(CurrencyMention mention, int distance) {}
}
