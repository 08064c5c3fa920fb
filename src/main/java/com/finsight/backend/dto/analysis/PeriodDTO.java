package com.finsight.backend.dto.analysis;

import java.time.LocalDate;

import lombok.Value;

@Value
public class PeriodDTO {

    LocalDate startDate;
    LocalDate endDate;
    int totalTransactions;
}
