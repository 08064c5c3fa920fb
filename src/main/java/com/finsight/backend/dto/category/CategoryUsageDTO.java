package com.finsight.backend.dto.category;

import java.math.BigDecimal;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CategoryUsageDTO {

    String category;
    long transactionCount;
    BigDecimal totalAmount;
    BigDecimal averageAmount;
}
