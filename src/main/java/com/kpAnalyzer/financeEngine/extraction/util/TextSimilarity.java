package com.kpAnalyzer.financeEngine.extraction.util;

import java.util.Locale;

/**
 * Edit-distance based string similarity used to suppress near-duplicate excerpts.
 */
public class TextSimilarity {
    
    private TextSimilarity() {}
    
    /**
     * Case-insensitive similarity in [0, 1]:
     * (length of longer - levenshtein(longer, shorter)) / length of longer.
     * Two empty strings are fully similar.
     */
    public static double similarity(String first, String second) {
        String longer = first.toLowerCase(Locale.ROOT);
        String shorter = second.toLowerCase(Locale.ROOT);
        if (longer.length() < shorter.length()) {
            String swap = longer;
            longer = shorter;
            shorter = swap;
        }
        
        if (longer.isEmpty()) {
            return 1.0;
        }
        
        int distance = levenshtein(longer, shorter);
        return (longer.length() - distance) / (double) longer.length();
    }
    
    /**
     * Levenshtein distance (insertions, deletions and substitutions of cost 1).
     */
    public static int levenshtein(String source, String target) {
        int[] previous = new int[target.length() + 1];
        int[] current = new int[target.length() + 1];
        
        for (int j = 0; j <= target.length(); j++) {
            previous[j] = j;
        }
        
        for (int i = 1; i <= source.length(); i++) {
            current[0] = i;
            char sourceChar = source.charAt(i - 1);
            for (int j = 1; j <= target.length(); j++) {
                int substitution = previous[j - 1] + (sourceChar == target.charAt(j - 1) ? 0 : 1);
                current[j] = Math.min(substitution, Math.min(previous[j] + 1, current[j - 1] + 1));
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        
        return previous[target.length()];
    }
}
