package com.finsight.backend.dto.budget;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import lombok.Data;

@Data
public class BudgetResponseDTO {

    private String id;
    private String ownerId;
    private String categoryId;
    private String categoryName;
    private BigDecimal amount;
    private int month;
    private int year;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
