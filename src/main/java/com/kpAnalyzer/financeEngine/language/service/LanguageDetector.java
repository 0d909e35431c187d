package com.kpAnalyzer.financeEngine.language.service;

import com.kpAnalyzer.financeEngine.language.model.LanguageDetectionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Language Detector service.
 * 
 * Detection strategy:
 * - Counts Cyrillic letters (U+0400 to U+04FF) against Latin letters
 * - Documents with more Cyrillic than Latin letters are classified as Russian
 * - Otherwise, default to English
 * 
 * The result is informational only: extraction patterns cover both languages.
 */
@Slf4j
@Service
public class LanguageDetector {
    
    private static final int CYRILLIC_START = 0x0400;
    private static final int CYRILLIC_END = 0x04FF;
    
    /**
     * Detects the language of the given document text.
     * 
     * @param text The document text to analyze
     * @return LanguageDetectionResult indicating Russian or English
     */
    public LanguageDetectionResult detectLanguage(String text) {
        if (text == null || text.isBlank()) {
            log.warn("Empty text provided for language detection");
            return LanguageDetectionResult.builder()
                    .languageCode("en")
                    .confidence(0.0)
                    .build();
        }
        
        long totalLetters = text.chars().filter(Character::isLetter).count();
        if (totalLetters == 0) {
            // Neutral confidence for non-text content
            return LanguageDetectionResult.builder()
                    .languageCode("en")
                    .confidence(0.5)
                    .build();
        }
        
        long cyrillicLetters = text.chars().filter(this::isCyrillicLetter).count();
        long latinLetters = text.chars()
                .filter(c -> Character.isLetter(c) && c < 128)
                .count();
        
        boolean russian = cyrillicLetters > latinLetters;
        long detectedLetters = russian ? cyrillicLetters : latinLetters;
        double confidence = Math.min(1.0, (double) detectedLetters / totalLetters);
        String detectedLanguage = russian ? "ru" : "en";
        
        log.debug("Language detection - detected: {}, confidence: {}",
                detectedLanguage, String.format("%.2f", confidence));
        
        return LanguageDetectionResult.builder()
                .languageCode(detectedLanguage)
                .confidence(confidence)
                .build();
    }
    
    private boolean isCyrillicLetter(int c) {
        return c >= CYRILLIC_START && c <= CYRILLIC_END && Character.isLetter(c);
    }
}
