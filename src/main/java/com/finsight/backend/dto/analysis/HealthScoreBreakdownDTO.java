package com.finsight.backend.dto.analysis;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class HealthScoreBreakdownDTO {

    int savingsRatePoints;
    int netIncomePoints;
    int targetProgressPoints;
    int budgetAdherencePoints;
    int trendPoints;
    int achievedPoints;
    int maxPoints;
    int score;
}
