package com.finsight.backend.dto.target;

import java.math.BigDecimal;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

public record TargetProgressRequestDTO(
        @NotNull(message = "Current amount is required")
        @PositiveOrZero(message = "Current amount cannot be negative")
        BigDecimal currentAmount
) {}
