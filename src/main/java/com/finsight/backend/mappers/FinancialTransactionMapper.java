package com.finsight.backend.mappers;

import com.finsight.backend.dto.transaction.FinancialTransactionResponseDTO;
import com.finsight.backend.entities.FinancialTransaction;

public class FinancialTransactionMapper {

    private FinancialTransactionMapper() {}

    public static FinancialTransactionResponseDTO toResponseDTO(FinancialTransaction tx) {
        return new FinancialTransactionResponseDTO(
                tx.getId() != null ? tx.getId().toString() : null,
                tx.getPerson() != null && tx.getPerson().getId() != null ? tx.getPerson().getId().toString() : null,
                tx.getDescription(),
                tx.getAmount(),
                tx.getType(),
                tx.getCategory(),
                tx.getCategoryRef() != null && tx.getCategoryRef().getId() != null
                        ? tx.getCategoryRef().getId().toString()
                        : null,
                tx.getTransactionDate(),
                tx.getTarget() != null && tx.getTarget().getId() != null ? tx.getTarget().getId().toString() : null,
                tx.getTarget() != null ? tx.getTarget().getTitle() : null,
                tx.getCreatedAt(),
                tx.getUpdatedAt()
        );
    }
}
