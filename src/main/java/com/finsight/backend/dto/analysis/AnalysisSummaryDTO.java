package com.finsight.backend.dto.analysis;

import java.util.List;

import com.finsight.backend.enums.HealthStatus;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class AnalysisSummaryDTO {

    int healthScore;
    HealthStatus healthStatus;
    KeyMetricsDTO keyMetrics;
    @Singular
    List<String> strengths;
    @Singular("areaForImprovement")
    List<String> areasForImprovement;
}
