package com.finsight.backend.services.analysis.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

import com.finsight.backend.enums.TransactionType;

/**
 * Read-only view of a transaction as consumed by the analysis engine.
 *
 * @param category   free-text label, may be null or blank
 * @param categoryId id of the owner's category with that label, when known
 * @param targetId   savings target an investment contributes to, when linked
 */
public record TransactionFact(
        LocalDate date,
        BigDecimal amount,
        TransactionType type,
        String category,
        UUID categoryId,
        UUID targetId
) {
}
