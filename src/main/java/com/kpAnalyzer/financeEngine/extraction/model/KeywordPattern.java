package com.kpAnalyzer.financeEngine.extraction.model;

import lombok.Builder;
import lombok.Getter;

import java.util.regex.Pattern;

/**
 * A keyword together with the compiled pattern used to locate it in text.
 */
@Getter
@Builder
public class KeywordPattern {
    
    private final String keyword;
    
    private final Pattern pattern;
}
