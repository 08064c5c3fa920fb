package com.finsight.backend.dto.target;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

@Data
public class TargetRequestDTO {

    @NotBlank(message = "ownerId is required")
    private String ownerId;

    @NotBlank(message = "Title is required")
    private String title;

    private String description;

    @NotNull(message = "Target amount is required")
    @Positive(message = "Target amount must be greater than zero")
    private BigDecimal targetAmount;

    // starts at 0 when omitted
    @PositiveOrZero(message = "Current amount cannot be negative")
    private BigDecimal currentAmount;

    private LocalDate targetDate;

    @Valid
    private List<ActionStepDTO> actionSteps;
}
