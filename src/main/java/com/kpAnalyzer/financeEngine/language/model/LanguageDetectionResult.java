package com.kpAnalyzer.financeEngine.language.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of language detection.
 * Indicates whether the document is Russian or English.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LanguageDetectionResult {
    
    /**
     * Detected language code: "ru" for Russian (Cyrillic script), "en" for English.
     */
    private String languageCode;
    
    /**
     * Confidence score (0.0 to 1.0) indicating detection confidence.
     */
    private double confidence;
    
    public boolean isRussian() {
        return "ru".equals(languageCode);
    }
    
    public boolean isEnglish() {
        return "en".equals(languageCode);
    }
}
