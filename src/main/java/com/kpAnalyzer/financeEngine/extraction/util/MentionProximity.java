package com.kpAnalyzer.financeEngine.extraction.util;

import com.kpAnalyzer.financeEngine.extraction.model.CurrencyMention;

import java.util.List;

/**
 * Locates the mention that belongs to a keyword occurrence.
 */
public class MentionProximity {
    
    private MentionProximity() {}
    
    /**
     * Finds the mention closest to a keyword within a window, in either direction.
     * Ties go to the mention listed first.
     * 
     * @param mentions Mentions to search
     * @param keywordPosition Start offset of the keyword occurrence
     * @param window Exclusive maximum distance in characters
     * @return Closest mention, or null if none lies inside the window
     */
    public static CurrencyMention closest(List<CurrencyMention> mentions, int keywordPosition, int window) {
        CurrencyMention closest = null;
        for (CurrencyMention mention : mentions) {
            int distance = mention.distanceTo(keywordPosition);
            if (distance < window && (closest == null || distance < closest.distanceTo(keywordPosition))) {
                closest = mention;
            }
        }
        return closest;
    }
    
    /**
     * Finds the mention belonging to a label keyword within a window.
     * 
     * Labels precede amounts in proposals ("Разработка: 200 000 руб."), so the nearest mention
     * starting at or after the keyword is taken first; only when none lies inside the window is
     * the nearest preceding mention used. Ties go to the mention listed first.
     * 
     * @param mentions Mentions to search
     * @param keywordPosition Start offset of the keyword occurrence
     * @param window Exclusive maximum distance in characters
     * @return Nearest mention, or null if none lies inside the window
     */
    public static CurrencyMention nearest(List<CurrencyMention> mentions, int keywordPosition, int window) {
        CurrencyMention following = null;
        CurrencyMention preceding = null;
        
        for (CurrencyMention mention : mentions) {
            int distance = mention.distanceTo(keywordPosition);
            if (distance >= window) {
                continue;
            }
            if (mention.getPosition() >= keywordPosition) {
                if (following == null || distance < following.distanceTo(keywordPosition)) {
                    following = mention;
                }
            } else if (preceding == null || distance < preceding.distanceTo(keywordPosition)) {
                preceding = mention;
            }
        }
        
        return following != null ? following : preceding;
    }
}
