package com.kpAnalyzer.financeEngine.gateway.controller;

import com.kpAnalyzer.financeEngine.gateway.service.GatewayService;
import com.kpAnalyzer.financeEngine.language.service.LanguageDetector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static com.kpAnalyzer.financeEngine.extraction.ExtractionTestFixtures.PROPOSAL_TEXT;
import static com.kpAnalyzer.financeEngine.extraction.ExtractionTestFixtures.extractionService;
import static com.kpAnalyzer.financeEngine.extraction.ExtractionTestFixtures.statisticsService;
import static com.kpAnalyzer.financeEngine.extraction.ExtractionTestFixtures.validator;
import static org.hamcrest.Matchers.endsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("FinancialExtractionController Tests")
class FinancialExtractionControllerTest {

    private static final String EXTRACT_URL = "/api/v1/financials/extract";

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        GatewayService gatewayService = new GatewayService(
                new LanguageDetector(), extractionService(), statisticsService(), validator());
        mockMvc = MockMvcBuilders.standaloneSetup(new FinancialExtractionController(gatewayService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Nested
    @DisplayName("Successful Extraction")
    class SuccessTests {

        @Test
        @DisplayName("Should return financials, statistics and validation")
        void shouldReturnFullResponse() throws Exception {
            String body = "{\"text\": \"" + PROPOSAL_TEXT.replace("\n", "\\n") + "\"}";

            mockMvc.perform(post(EXTRACT_URL).contentType(MediaType.APPLICATION_JSON).content(body))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.correlationId").isNotEmpty())
                    .andExpect(jsonPath("$.language").value("ru"))
                    .andExpect(jsonPath("$.financials.totalBudget.amount").value(450000))
                    .andExpect(jsonPath("$.financials.totalBudget.currency").value("RUB"))
                    .andExpect(jsonPath("$.financials.totalBudget.formattedAmount").value(endsWith(" ₽")))
                    .andExpect(jsonPath("$.financials.costBreakdown.development.amount").value(300000))
                    .andExpect(jsonPath("$.financials.costBreakdown.testing.amount").value(50000))
                    .andExpect(jsonPath("$.financials.currencies.length()").value(4))
                    .andExpect(jsonPath("$.statistics.primaryCurrency").value("RUB"))
                    .andExpect(jsonPath("$.statistics.distribution.RUB").value(4))
                    .andExpect(jsonPath("$.validation.valid").value(true))
                    .andExpect(jsonPath("$.validation.confidence").value(100));
        }

        @Test
        @DisplayName("Should accept empty text and report it as invalid")
        void shouldAcceptEmptyText() throws Exception {
            mockMvc.perform(post(EXTRACT_URL).contentType(MediaType.APPLICATION_JSON).content("{\"text\": \"\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.financials.totalBudget").doesNotExist())
                    .andExpect(jsonPath("$.statistics.totalMentions").value(0))
                    .andExpect(jsonPath("$.validation.valid").value(false))
                    .andExpect(jsonPath("$.validation.confidence").value(65));
        }
    }

    @Nested
    @DisplayName("Rejected Requests")
    class ErrorTests {

        @Test
        @DisplayName("Should reject a null text")
        void shouldRejectNullText() throws Exception {
            mockMvc.perform(post(EXTRACT_URL).contentType(MediaType.APPLICATION_JSON).content("{\"text\": null}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
        }

        @Test
        @DisplayName("Should reject a missing text")
        void shouldRejectMissingText() throws Exception {
            mockMvc.perform(post(EXTRACT_URL).contentType(MediaType.APPLICATION_JSON).content("{}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
        }

        @Test
        @DisplayName("Should reject a malformed body")
        void shouldRejectMalformedBody() throws Exception {
            mockMvc.perform(post(EXTRACT_URL).contentType(MediaType.APPLICATION_JSON).content("not json"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("MALFORMED_REQUEST"));
        }
    }
}
