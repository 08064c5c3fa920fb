package com.finsight.backend.dto.transaction;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.finsight.backend.enums.TransactionType;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * @param targetId only honoured for {@link TransactionType#INVESTMENT}
 */
public record FinancialTransactionRequestDTO(

        @NotBlank(message = "personId is required")
        String personId,

        @NotBlank(message = "Description is required")
        String description,

        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be greater than zero")
        BigDecimal amount,

        @NotNull(message = "Type is required")
        TransactionType type,

        String category,

        @NotNull(message = "Transaction date is required")
        LocalDate transactionDate,

        String targetId
) {}
