package com.kpAnalyzer.financeEngine.extraction.service;

import com.kpAnalyzer.financeEngine.extraction.config.ExtractionPatterns;
import com.kpAnalyzer.financeEngine.extraction.config.ExtractionThresholds;
import com.kpAnalyzer.financeEngine.extraction.util.TextSimilarity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts payment-term and financial-note excerpts from document text.
 * 
 * Excerpts are whitespace-collapsed, kept only when strictly between the length bounds,
 * and returned in discovery order;
 * a candidate too similar to an already kept excerpt is dropped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FinancialExcerptExtractor {
    
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0]+");
    
    private final ExtractionPatterns patterns;
    private final ExtractionThresholds thresholds;
    
    /**
     * Extracts payment schedule excerpts (prepayment, stages, deadlines).
     */
    public List<String> extractPaymentTerms(String text) {
        List<String> terms = extractExcerpts(text, patterns.getPaymentTermPatterns(), new ExcerptLimits(
                thresholds.getPaymentTermMinLength(),
                thresholds.getPaymentTermMaxLength(),
                thresholds.getPaymentTermSimilarity(),
                thresholds.getMaxPaymentTerms()));
        log.debug("Payment terms extracted: {}", terms.size());
        return terms;
    }
    
    /**
     * Extracts financial caveats (taxes, discounts, extras, conditions, warranty).
     */
    public List<String> extractFinancialNotes(String text) {
        List<String> notes = extractExcerpts(text, patterns.getFinancialNotePatterns(), new ExcerptLimits(
                thresholds.getFinancialNoteMinLength(),
                thresholds.getFinancialNoteMaxLength(),
                thresholds.getFinancialNoteSimilarity(),
                thresholds.getMaxFinancialNotes()));
        log.debug("Financial notes extracted: {}", notes.size());
        return notes;
    }
    
    private List<String> extractExcerpts(String text, List<Pattern> families, ExcerptLimits limits) {
        List<String> excerpts = new ArrayList<>();
        
        for (Pattern pattern : families) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                if (excerpts.size() >= limits.maxCount()) {
                    return excerpts;
                }
                String excerpt = WHITESPACE.matcher(matcher.group()).replaceAll(" ").trim();
                if (excerpt.length() <= limits.minLength() || excerpt.length() >= limits.maxLength()) {
                    continue;
                }
                boolean similar = excerpts.stream()
                        .anyMatch(existing -> TextSimilarity.similarity(existing, excerpt) > limits.similarity());
                if (!similar) {
                    excerpts.add(excerpt);
                }
            }
        }
        
        return excerpts;
    }
    
    private record ExcerptLimits(int minLength, int maxLength, double similarity, int maxCount) {}
}
