package com.finsight.backend.dto.target;

import java.math.BigDecimal;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionStepDTO {

    private String id;
    private Integer stepNumber;

    @NotBlank(message = "Step description is required")
    private String description;

    @PositiveOrZero(message = "Step amount cannot be negative")
    private BigDecimal amount;

    private boolean completed;
}
