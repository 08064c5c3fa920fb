package com.finsight.backend.dto.analysis;

import java.math.BigDecimal;
import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class TransactionTypeSummaryDTO {

    BigDecimal total;
    /** Total divided by the number of calendar months the transactions span. */
    BigDecimal monthly;
    int transactions;
    @Singular
    List<CategoryAmountDTO> categories;
}
