package com.finsight.backend.services.analysis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.finsight.backend.dto.analysis.BudgetAnalysisDTO;
import com.finsight.backend.dto.analysis.RecommendationDTO;
import com.finsight.backend.dto.analysis.TargetAnalysisDTO;
import com.finsight.backend.enums.RecommendationPriority;
import com.finsight.backend.enums.RecommendationType;
import com.finsight.backend.services.analysis.model.AnalysisMetrics;

class RecommendationGeneratorTest {

    private final RecommendationGenerator generator = new RecommendationGenerator();

    @Test
    void generate_healthyFinances_returnsNothing() {
        List<RecommendationDTO> result = generator.generate(metrics("25", "2000", "500", 0, 0));
        assertTrue(result.isEmpty());
    }

    @Test
    void generate_everyRuleFiring_keepsOrder() {
        // net > 0 with no investments cannot coexist with negative cash flow
        List<RecommendationDTO> result = generator.generate(metrics("7.5", "-250.5", "0", 2, 1));

        assertEquals(4, result.size());
        assertEquals(RecommendationType.SAVINGS, result.get(0).getType());
        assertEquals(RecommendationPriority.HIGH, result.get(0).getPriority());
        assertEquals(RecommendationType.INCOME, result.get(1).getType());
        assertEquals(RecommendationPriority.CRITICAL, result.get(1).getPriority());
        assertEquals(RecommendationType.TARGETS, result.get(2).getType());
        assertEquals(RecommendationType.BUDGET, result.get(3).getType());
    }

    @Test
    void generate_descriptionsCarryLiveNumbers() {
        List<RecommendationDTO> result = generator.generate(metrics("7.5", "-250.5", "0", 2, 1));

        assertEquals("Your current savings rate is 7.5%. Consider increasing it to at least 10-20% for better financial security.",
                result.get(0).getDescription());
        assertEquals("You are spending ₹250.50 more than you earn each month. This is unsustainable in the long term.",
                result.get(1).getDescription());
        assertEquals("You have 2 targets that are behind schedule.", result.get(2).getDescription());
        assertEquals("You are over budget in 1 category.", result.get(3).getDescription());
    }

    @Test
    void generate_positiveCashFlowWithoutInvestments_suggestsInvesting() {
        List<RecommendationDTO> result = generator.generate(metrics("30", "1234.5", "0", 0, 0));

        assertEquals(1, result.size());
        RecommendationDTO rec = result.get(0);
        assertEquals("Start Investing", rec.getTitle());
        assertEquals(RecommendationPriority.MEDIUM, rec.getPriority());
        assertTrue(rec.getDescription().contains("₹1,234.50 per month"));
    }

    @Test
    void generate_savingsRateAtThreshold_doesNotFire() {
        List<RecommendationDTO> result = generator.generate(metrics("10", "100", "50", 0, 0));
        assertTrue(result.stream().noneMatch(r -> r.getType() == RecommendationType.SAVINGS));
    }

    private static AnalysisMetrics metrics(String savingsRate, String monthlyNet, String investments,
                                           int behindTargets, int overBudget) {
        return new AnalysisMetrics(
                new BigDecimal(savingsRate),
                new BigDecimal(savingsRate),
                BigDecimal.ZERO,
                BigDecimal.ZERO,
                new BigDecimal(monthlyNet),
                new BigDecimal(investments),
                TargetAnalysisDTO.builder().behindTargets(behindTargets).build(),
                BudgetAnalysisDTO.builder().overBudget(overBudget).build(),
                null,
                "₹");
    }
}
