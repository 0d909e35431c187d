package com.kpAnalyzer.financeEngine.extraction.service;

import com.kpAnalyzer.financeEngine.extraction.config.ExtractionPatterns;
import com.kpAnalyzer.financeEngine.extraction.config.ExtractionThresholds;
import com.kpAnalyzer.financeEngine.extraction.model.CurrencyMention;
import com.kpAnalyzer.financeEngine.extraction.model.CurrencyPattern;
import com.kpAnalyzer.financeEngine.extraction.util.AmountParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Finds all currency-tagged amounts in a text.
 * 
 * Currencies are scanned in table order. Once a currency is done, the start of each of its
 * accepted matches claims a window of text, and later currencies skip matches starting
 * inside a claimed window. Matches without a positive amount are dropped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CurrencyMentionScanner {
    
    private final ExtractionPatterns patterns;
    private final ExtractionThresholds thresholds;
    
    /**
     * Scans the text for currency mentions.
     * 
     * @param text Document text
     * @return Raw mentions sorted by position
     */
    public List<CurrencyMention> scan(String text) {
        List<CurrencyMention> mentions = new ArrayList<>();
        BitSet claimed = new BitSet(text.length() + 1);
        int window = thresholds.getClaimWindow();
        
        for (CurrencyPattern currency : patterns.getCurrencies()) {
            List<Integer> acceptedStarts = new ArrayList<>();
            Matcher matcher = currency.getPattern().matcher(text);
            
            while (matcher.find()) {
                int start = matcher.start();
                if (claimed.get(start)) {
                    log.trace("Skipping {} match at {} - position claimed by an earlier currency", currency.getCode(), start);
                    continue;
                }
                
                BigDecimal amount = AmountParser.parse(matcher.group());
                if (amount == null || amount.signum() <= 0) {
                    continue;
                }
                
                mentions.add(CurrencyMention.builder()
                        .code(currency.getCode())
                        .symbol(currency.getSymbol())
                        .name(currency.getName())
                        .amount(amount)
                        .originalText(matcher.group().trim())
                        .position(start)
                        .build());
                acceptedStarts.add(start);
            }
            
            for (int start : acceptedStarts) {
                claimed.set(Math.max(0, start - window), start + window + 1);
            }
        }
        
        mentions.sort(Comparator.comparingInt(CurrencyMention::getPosition));
        log.debug("Currency scan found {} mentions", mentions.size());
        return mentions;
    }
}
