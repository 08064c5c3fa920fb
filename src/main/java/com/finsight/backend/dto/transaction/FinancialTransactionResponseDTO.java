package com.finsight.backend.dto.transaction;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

import com.finsight.backend.enums.TransactionType;

public record FinancialTransactionResponseDTO(
        String id,
        String personId,
        String description,
        BigDecimal amount,
        TransactionType type,
        String category,
        String categoryId,
        LocalDate transactionDate,
        String targetId,
        String targetTitle,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {}
