package com.kpAnalyzer.financeEngine.extraction.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kpAnalyzer.financeEngine.extraction.dto.PatternDefinitions;
import com.kpAnalyzer.financeEngine.extraction.model.CostCategory;
import com.kpAnalyzer.financeEngine.extraction.model.CurrencyPattern;
import com.kpAnalyzer.financeEngine.extraction.model.KeywordPattern;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Loads pattern definitions from a classpath JSON resource and compiles them
 * into {@link ExtractionPatterns}.
 * 
 * Any problem with the resource (missing, unreadable, invalid regex, unknown category)
 * fails with {@link IllegalStateException}, so a broken table is caught at startup.
 */
@Slf4j
public final class ExtractionPatternsLoader {
    
    public static final String DEFAULT_RESOURCE = "patterns/financial-patterns.json";
    
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
    
    /**
     * Spacing allowed between a symbol and its amount, no-break spaces included.
     */
    private static final String SPACING = "[\\s\\u00A0]*";
    
    /**
     * A trailing symbol followed by a number is the prefix of the next amount ("$100 $200").
     */
    private static final String NO_FOLLOWING_AMOUNT = "(?!" + SPACING + "\\d)";
    
    private static final String WORD_START = "(?<![\\p{L}\\p{N}_])";
    private static final String WORD_END = "(?![\\p{L}\\p{N}_])";
    
    private static final ObjectMapper objectMapper = new ObjectMapper();
    
    private ExtractionPatternsLoader() {}
    
    public static ExtractionPatterns loadDefault() {
        return load(DEFAULT_RESOURCE);
    }
    
    /**
     * Loads and compiles the pattern tables stored at the given classpath location.
     * 
     * @param resourcePath Classpath location of the JSON file
     * @return Compiled pattern tables
     * @throws IllegalStateException if the resource is missing or invalid
     */
    public static ExtractionPatterns load(String resourcePath) {
        PatternDefinitions definitions = readDefinitions(resourcePath);
        try {
            ExtractionPatterns patterns = compile(definitions);
            log.info("Loaded extraction patterns from {} - currencies: {}, budgetKeywords: {}, categories: {}",
                    resourcePath, patterns.getCurrencies().size(), patterns.getBudgetKeywords().size(),
                    patterns.getCategoryKeywords().size());
            return patterns;
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid pattern definitions in " + resourcePath + ": " + e.getMessage(), e);
        }
    }
    
    private static PatternDefinitions readDefinitions(String resourcePath) {
        try (InputStream inputStream = ExtractionPatternsLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IllegalStateException("Pattern resource not found: " + resourcePath);
            }
            return objectMapper.readValue(inputStream, PatternDefinitions.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read pattern resource: " + resourcePath, e);
        }
    }
    
    static ExtractionPatterns compile(PatternDefinitions definitions) {
        if (definitions.getAmountPattern() == null || definitions.getAmountPattern().isBlank()) {
            throw new IllegalArgumentException("amountPattern is required");
        }
        if (definitions.getReferenceCurrency() == null) {
            throw new IllegalArgumentException("referenceCurrency is required");
        }
        
        List<CurrencyPattern> currencies = new ArrayList<>();
        for (PatternDefinitions.CurrencyDefinition currency : definitions.getCurrencies()) {
            currencies.add(compileCurrency(currency, definitions.getAmountPattern()));
        }
        
        List<KeywordPattern> budgetKeywords = new ArrayList<>();
        for (String keyword : definitions.getBudgetKeywords()) {
            budgetKeywords.add(KeywordPattern.builder()
                    .keyword(keyword)
                    .pattern(Pattern.compile(Pattern.quote(keyword), FLAGS))
                    .build());
        }
        
        Map<CostCategory, List<KeywordPattern>> categoryKeywords = new EnumMap<>(CostCategory.class);
        for (PatternDefinitions.CategoryDefinition definition : definitions.getCostCategories()) {
            CostCategory category = CostCategory.fromKey(definition.getCategory());
            List<KeywordPattern> keywords = new ArrayList<>();
            for (String keyword : definition.getKeywords()) {
                keywords.add(KeywordPattern.builder()
                        .keyword(keyword)
                        .pattern(Pattern.compile(WORD_START + Pattern.quote(keyword) + WORD_END, FLAGS))
                        .build());
            }
            categoryKeywords.put(category, keywords);
        }
        
        return new ExtractionPatterns(
                definitions.getReferenceCurrency(),
                currencies,
                budgetKeywords,
                categoryKeywords,
                compileAll(definitions.getPaymentTermPatterns()),
                compileAll(definitions.getFinancialNotePatterns()));
    }
    
    /**
     * Builds "(?:PREFIX amount (SUFFIX)? | amount SUFFIX)" for one currency.
     * The optional suffix of the prefix form is not taken when an amount follows it.
     */
    private static CurrencyPattern compileCurrency(PatternDefinitions.CurrencyDefinition currency, String amountPattern) {
        if (currency.getCode() == null || currency.getReferenceRate() == null) {
            throw new IllegalArgumentException("Currency definition requires code and referenceRate");
        }
        if (currency.getSuffixSymbols().isEmpty()) {
            throw new IllegalArgumentException("Currency " + currency.getCode() + " has no suffix symbols");
        }
        
        String suffixes = "(?:" + String.join("|", currency.getSuffixSymbols()) + ")";
        StringBuilder regex = new StringBuilder("(?:");
        if (!currency.getPrefixSymbols().isEmpty()) {
            String prefixes = "(?:" + String.join("|", currency.getPrefixSymbols()) + ")";
            regex.append(prefixes).append(SPACING).append(amountPattern)
                    .append("(?:").append(SPACING).append(suffixes).append(NO_FOLLOWING_AMOUNT).append(")?")
                    .append('|');
        }
        regex.append(amountPattern).append(SPACING).append(suffixes).append(')');
        
        return CurrencyPattern.builder()
                .code(currency.getCode())
                .symbol(currency.getSymbol())
                .name(currency.getName())
                .referenceRate(currency.getReferenceRate())
                .pattern(Pattern.compile(regex.toString(), FLAGS))
                .build();
    }
    
    private static List<Pattern> compileAll(List<String> regexes) {
        List<Pattern> compiled = new ArrayList<>();
        for (String regex : regexes) {
            compiled.add(Pattern.compile(regex, FLAGS));
        }
        return compiled;
    }
}
