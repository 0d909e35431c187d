package com.kpAnalyzer.financeEngine.extraction.util;

import com.kpAnalyzer.financeEngine.extraction.model.CurrencyMention;

import java.math.RoundingMode;
import java.text.NumberFormat;
import java.util.Locale;

/**
 * Formats mentions for display in reports (Russian number format).
 */
public class CurrencyFormatter {
    
    private static final Locale DISPLAY_LOCALE = Locale.forLanguageTag("ru-RU");
    
    private CurrencyFormatter() {}
    
    /**
     * Formats a mention with its symbol: "$1 234,56" for USD/EUR, "10 000 ₽" for the others.
     * Grouping uses the locale's separator (a no-break space for ru-RU).
     */
    public static String format(CurrencyMention mention) {
        NumberFormat formatter = NumberFormat.getNumberInstance(DISPLAY_LOCALE);
        formatter.setMinimumFractionDigits(0);
        formatter.setMaximumFractionDigits(2);
        formatter.setRoundingMode(RoundingMode.HALF_UP);
        
        String amount = formatter.format(mention.getAmount());
        
        return switch (mention.getCode()) {
            case USD, EUR -> mention.getSymbol() + amount;
            default -> amount + " " + mention.getSymbol();
        };
    }
}
