package com.finsight.backend.dto.category;

import java.time.LocalDateTime;

import com.finsight.backend.enums.CategoryType;

import lombok.Data;

@Data
public class CategoryResponseDTO {

    private String id;
    private String ownerId;
    private String name;
    private CategoryType type;
    private LocalDateTime createdAt;
}
