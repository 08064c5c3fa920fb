package com.finsight.backend.dto.target;

import java.math.BigDecimal;

import jakarta.validation.constraints.PositiveOrZero;

/**
 * Partial update of an action step; at least one field must be present.
 */
public record ActionStepUpdateDTO(
        Boolean completed,
        @PositiveOrZero(message = "Step amount cannot be negative")
        BigDecimal amount,
        String description
) {}
