package com.kpAnalyzer.financeEngine.extraction.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Quality assessment of an extraction result.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ValidationResult {
    
    private boolean valid;
    
    /**
     * Confidence score (0 to 100).
     */
    private int confidence;
    
    @Builder.Default
    private List<String> issues = new ArrayList<>();
    
    @Builder.Default
    private List<String> suggestions = new ArrayList<>();
}
