package com.finsight.backend.dto.analysis;

import com.finsight.backend.enums.RecommendationPriority;
import com.finsight.backend.enums.RecommendationType;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RecommendationDTO {

    RecommendationType type;
    RecommendationPriority priority;
    String title;
    String description;
    String action;
}
