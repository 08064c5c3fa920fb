package com.finsight.backend.dto.analysis;

import java.math.BigDecimal;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TargetAnalysisDTO {

    int totalTargets;
    BigDecimal totalTargetAmount;
    BigDecimal totalCurrentAmount;
    BigDecimal overallProgress;
    int completedTargets;
    int onTrackTargets;
    int behindTargets;
}
