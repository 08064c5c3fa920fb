package com.finsight.backend.dto.target;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import lombok.Data;

@Data
public class TargetResponseDTO {

    private String id;
    private String ownerId;
    private String title;
    private String description;
    private BigDecimal targetAmount;
    private BigDecimal currentAmount;
    private BigDecimal progressPercentage;
    private LocalDate targetDate;
    private LocalDate createdAt;
    private LocalDateTime updatedAt;
    private List<ActionStepDTO> actionSteps;
}
