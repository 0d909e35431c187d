package com.kpAnalyzer.financeEngine.gateway.service;

import com.kpAnalyzer.financeEngine.extraction.exception.InvalidInputException;
import com.kpAnalyzer.financeEngine.extraction.model.CostBreakdown;
import com.kpAnalyzer.financeEngine.extraction.model.CurrencyMention;
import com.kpAnalyzer.financeEngine.extraction.model.CurrencyStatistics;
import com.kpAnalyzer.financeEngine.extraction.model.ExtractedFinancials;
import com.kpAnalyzer.financeEngine.extraction.model.ValidationResult;
import com.kpAnalyzer.financeEngine.extraction.service.CurrencyStatisticsService;
import com.kpAnalyzer.financeEngine.extraction.service.FinancialDataValidator;
import com.kpAnalyzer.financeEngine.extraction.service.FinancialExtractionService;
import com.kpAnalyzer.financeEngine.extraction.util.CurrencyFormatter;
import com.kpAnalyzer.financeEngine.gateway.dto.ExtractionRequest;
import com.kpAnalyzer.financeEngine.gateway.dto.ExtractionResponse;
import com.kpAnalyzer.financeEngine.gateway.dto.ExtractionResponse.FinancialsView;
import com.kpAnalyzer.financeEngine.gateway.dto.ExtractionResponse.MentionView;
import com.kpAnalyzer.financeEngine.gateway.dto.ExtractionResponse.StatisticsView;
import com.kpAnalyzer.financeEngine.language.model.LanguageDetectionResult;
import com.kpAnalyzer.financeEngine.language.service.LanguageDetector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Gateway service - handles all business logic for the extraction endpoint.
 * 
 * Responsibilities:
 * - Generate correlationId
 * - Detect document language
 * - Run extraction, statistics and validation
 * - Map the engine model to the HTTP response
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GatewayService {
    
    private final LanguageDetector languageDetector;
    private final FinancialExtractionService financialExtractionService;
    private final CurrencyStatisticsService currencyStatisticsService;
    private final FinancialDataValidator financialDataValidator;
    
    /**
     * Processes an extraction request.
     * 
     * @param request Request containing the document text
     * @return Extraction response with financials, statistics and validation
     * @throws InvalidInputException if the text is null
     */
    public ExtractionResponse processExtractionRequest(ExtractionRequest request) {
        String correlationId = UUID.randomUUID().toString();
        String text = request.getText();
        
        log.info("Extraction request received - correlationId: {}, textLength: {}",
                correlationId, text != null ? text.length() : -1);
        
        ExtractedFinancials financials = financialExtractionService.extractFinancialData(text);
        LanguageDetectionResult languageResult = languageDetector.detectLanguage(text);
        CurrencyStatistics statistics = currencyStatisticsService.calculate(financials);
        ValidationResult validation = financialDataValidator.validate(financials);
        
        log.info("Extraction request completed - correlationId: {}, language: {}, mentions: {}, valid: {}, confidence: {}",
                correlationId, languageResult.getLanguageCode(), statistics.getTotalMentions(),
                validation.isValid(), validation.getConfidence());
        
        return ExtractionResponse.builder()
                .correlationId(correlationId)
                .language(languageResult.getLanguageCode())
                .financials(toFinancialsView(financials))
                .statistics(toStatisticsView(statistics))
                .validation(validation)
                .build();
    }
    
    private FinancialsView toFinancialsView(ExtractedFinancials financials) {
        CostBreakdown breakdown = financials.getCostBreakdown();
        Map<String, MentionView> categories = new LinkedHashMap<>();
        breakdown.getCategories().forEach((category, mention) -> categories.put(category.getKey(), toMentionView(mention)));
        
        return FinancialsView.builder()
                .totalBudget(toMentionView(financials.getTotalBudget()))
                .currencies(toMentionViews(financials.getCurrencies()))
                .costBreakdown(categories)
                .otherCosts(toMentionViews(breakdown.getOther()))
                .paymentTerms(financials.getPaymentTerms())
                .financialNotes(financials.getFinancialNotes())
                .build();
    }
    
    private StatisticsView toStatisticsView(CurrencyStatistics statistics) {
        Map<String, Integer> distribution = new LinkedHashMap<>();
        statistics.getDistribution().forEach((code, count) -> distribution.put(code.name(), count));
        
        return StatisticsView.builder()
                .totalMentions(statistics.getTotalMentions())
                .uniqueCurrencies(statistics.getUniqueCurrencies())
                .primaryCurrency(statistics.getPrimaryCurrency() != null ? statistics.getPrimaryCurrency().name() : null)
                .totalValueUsd(statistics.getTotalValueReference())
                .mixedCurrencies(statistics.isMixedCurrencies())
                .distribution(distribution)
                .averageAmount(statistics.getAverageAmount())
                .medianAmount(statistics.getMedianAmount())
                .largestMention(toMentionView(statistics.getLargestMention()))
                .build();
    }
    
    private List<MentionView> toMentionViews(List<CurrencyMention> mentions) {
        return mentions.stream().map(this::toMentionView).toList();
    }
    
    private MentionView toMentionView(CurrencyMention mention) {
        if (mention == null) {
            return null;
        }
        return MentionView.builder()
                .currency(mention.getCode().name())
                .symbol(mention.getSymbol())
                .name(mention.getName())
                .amount(mention.getAmount())
                .formattedAmount(CurrencyFormatter.format(mention))
                .originalText(mention.getOriginalText())
                .position(mention.getPosition())
                .build();
    }
}
