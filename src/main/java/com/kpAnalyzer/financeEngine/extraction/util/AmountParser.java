package com.kpAnalyzer.financeEngine.extraction.util;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses amounts written with ambiguous thousands/decimal separators.
 * 
 * Resolution rules, applied in order:
 * - whitespace is dropped ("10 000" -> 10000)
 * - a last comma followed by at most 2 digits is the decimal separator, every other
 *   comma and dot is a thousands separator ("1.000,50" -> 1000.50, "12,5" -> 12.5)
 * - otherwise commas are thousands separators ("1,234.56" -> 1234.56, "12,500" -> 12500)
 * - of several dots only the last can be decimal; a single dot followed by more than
 *   2 digits is a thousands separator ("1.000.000" -> 1000000)
 */
@Slf4j
public class AmountParser {
    
    /**
     * First digit-led numeric run; always ends on a digit so trailing punctuation is excluded.
     */
    private static final Pattern NUMBER_RUN = Pattern.compile("\\d(?:[\\d\\s\\u00A0\\u202F.,]*\\d)?");
    
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0\\u202F]+");
    
    private static final int MAX_DECIMAL_DIGITS = 2;
    
    private AmountParser() {}
    
    /**
     * Parses the first number found in the given text.
     * 
     * @param text Text containing an amount, optionally with currency symbols (e.g., "$1,234.56", "10 000 руб")
     * @return Non-negative amount, or null if no amount could be parsed
     */
    public static BigDecimal parse(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        
        Matcher matcher = NUMBER_RUN.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        
        String number = WHITESPACE.matcher(matcher.group()).replaceAll("");
        String canonical = normalizeSeparators(number);
        
        try {
            BigDecimal amount = new BigDecimal(canonical);
            return amount.signum() < 0 ? null : amount;
        } catch (NumberFormatException e) {
            log.debug("Unparseable amount '{}' (canonical '{}')", text, canonical);
            return null;
        }
    }
    
    /**
     * Rewrites a whitespace-free number so that '.' is the only, optional, decimal separator.
     */
    static String normalizeSeparators(String number) {
        String result = number;
        
        int lastComma = result.lastIndexOf(',');
        if (lastComma >= 0 && result.length() - lastComma - 1 <= MAX_DECIMAL_DIGITS) {
            String integerPart = result.substring(0, lastComma).replace(",", "").replace(".", "");
            result = integerPart + "." + result.substring(lastComma + 1);
        } else {
            result = result.replace(",", "");
        }
        
        int lastDot = result.lastIndexOf('.');
        if (lastDot != result.indexOf('.')) {
            result = result.substring(0, lastDot).replace(".", "") + result.substring(lastDot);
            lastDot = result.lastIndexOf('.');
        }
        if (lastDot >= 0 && result.length() - lastDot - 1 > MAX_DECIMAL_DIGITS) {
            result = result.replace(".", "");
        }
        
        return result;
    }
}
