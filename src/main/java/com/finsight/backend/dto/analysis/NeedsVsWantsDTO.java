package com.finsight.backend.dto.analysis;

import java.math.BigDecimal;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class NeedsVsWantsDTO {

    BigDecimal needs;
    BigDecimal wants;
    /** Spend that matched neither keyword list, before it was apportioned. */
    BigDecimal unclassified;
    int needsPercentage;
    int wantsPercentage;
}
