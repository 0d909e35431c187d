package com.kpAnalyzer.financeEngine.extraction.service;

import com.kpAnalyzer.financeEngine.extraction.exception.InvalidInputException;
import com.kpAnalyzer.financeEngine.extraction.model.CostCategory;
import com.kpAnalyzer.financeEngine.extraction.model.CurrencyMention;
import com.kpAnalyzer.financeEngine.extraction.model.ExtractedFinancials;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.kpAnalyzer.financeEngine.extraction.ExtractionTestFixtures.PROPOSAL_TEXT;
import static com.kpAnalyzer.financeEngine.extraction.ExtractionTestFixtures.extractionService;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("FinancialExtractionService Tests")
class FinancialExtractionServiceTest {

    private final FinancialExtractionService extractionService = extractionService();

    @Nested
    @DisplayName("Proposal Extraction")
    class ProposalTests {

        @Test
        @DisplayName("Should extract the full financial summary of a proposal")
        void shouldExtractFullSummary() {
            ExtractedFinancials financials = extractionService.extractFinancialData(PROPOSAL_TEXT);

            assertThat(financials.getCurrencies()).hasSize(4);
            assertThat(financials.getTotalBudget().getAmount()).isEqualByComparingTo("450000");
            assertThat(financials.getCostBreakdown().get(CostCategory.DEVELOPMENT).getAmount()).isEqualByComparingTo("300000");
            assertThat(financials.getCostBreakdown().get(CostCategory.TESTING).getAmount()).isEqualByComparingTo("50000");
            assertThat(financials.getCostBreakdown().get(CostCategory.DEPLOYMENT).getAmount()).isEqualByComparingTo("100000");
            assertThat(financials.getCostBreakdown().getOther()).isEmpty();
            assertThat(financials.getPaymentTerms()).contains("Оплата производится поэтапно");
            assertThat(financials.getFinancialNotes()).containsExactly("Важно: цены указаны без учета НДС.");
        }

        @Test
        @DisplayName("Should keep the budget as one of the extracted mentions")
        void shouldKeepBudgetInCurrencies() {
            ExtractedFinancials financials = extractionService.extractFinancialData(PROPOSAL_TEXT);

            assertThat(financials.getCurrencies()).anyMatch(mention -> mention == financials.getTotalBudget());
        }

        @Test
        @DisplayName("Should return positive amounts in strictly increasing positions")
        void shouldReturnOrderedPositiveMentions() {
            List<CurrencyMention> currencies = extractionService
                    .extractFinancialData("Итого $1,500; сервер 200 EUR; лицензии 10 000 руб; опция 0 KZT")
                    .getCurrencies();

            assertThat(currencies).hasSize(3);
            assertThat(currencies).allMatch(mention -> mention.getAmount().signum() > 0);
            for (int i = 1; i < currencies.size(); i++) {
                assertThat(currencies.get(i).getPosition()).isGreaterThan(currencies.get(i - 1).getPosition());
            }
        }

        @Test
        @DisplayName("Should be deterministic")
        void shouldBeDeterministic() {
            assertThat(extractionService.extractFinancialData(PROPOSAL_TEXT))
                    .isEqualTo(extractionService.extractFinancialData(PROPOSAL_TEXT));
        }
    }

    @Nested
    @DisplayName("Input Handling")
    class InputTests {

        @Test
        @DisplayName("Should reject null text")
        void shouldRejectNullText() {
            assertThatThrownBy(() -> extractionService.extractFinancialData(null))
                    .isInstanceOf(InvalidInputException.class);
        }

        @Test
        @DisplayName("Should return an empty result for empty text")
        void shouldReturnEmptyResultForEmptyText() {
            ExtractedFinancials financials = extractionService.extractFinancialData("");

            assertThat(financials.getTotalBudget()).isNull();
            assertThat(financials.getCurrencies()).isEmpty();
            assertThat(financials.getCostBreakdown().getCategories()).isEmpty();
            assertThat(financials.getPaymentTerms()).isEmpty();
            assertThat(financials.getFinancialNotes()).isEmpty();
        }
    }
}
