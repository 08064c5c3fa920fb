package com.finsight.backend.dto.analysis;

import java.math.BigDecimal;

import lombok.Value;

@Value
public class CategoryAmountDTO {

    String name;
    BigDecimal amount;
}
