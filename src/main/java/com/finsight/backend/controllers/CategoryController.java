package com.finsight.backend.controllers;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.finsight.backend.dto.ApiResponse;
import com.finsight.backend.dto.category.CategoryRequestDTO;
import com.finsight.backend.dto.category.CategoryResponseDTO;
import com.finsight.backend.dto.category.CategoryUsageDTO;
import com.finsight.backend.enums.CategoryType;
import com.finsight.backend.services.CategoryService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/categories")
@RequiredArgsConstructor
public class CategoryController {

    private final CategoryService categoryService;

    @PostMapping
    @PreAuthorize("hasRole('ADMIN') or @securityService.canAccessPerson(#dto.ownerId)")
    public ResponseEntity<ApiResponse<CategoryResponseDTO>> create(@Valid @RequestBody CategoryRequestDTO dto) {
        CategoryResponseDTO created = categoryService.create(dto);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(created, "Category created successfully"));
    }

    @GetMapping("/owner/{ownerId}")
    @PreAuthorize("hasRole('ADMIN') or @securityService.canAccessPerson(#ownerId)")
    public ResponseEntity<ApiResponse<List<CategoryResponseDTO>>> findByOwner(
            @PathVariable String ownerId,
            @RequestParam(required = false) CategoryType type
    ) {
        List<CategoryResponseDTO> list = type != null
                ? categoryService.findByOwnerAndType(ownerId, type)
                : categoryService.findByOwner(ownerId);
        return ResponseEntity.ok(ApiResponse.success(list, "Categories found"));
    }

    @GetMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN') or @securityService.canAccessCategory(#id)")
    public ResponseEntity<ApiResponse<CategoryResponseDTO>> findById(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.success(categoryService.findById(id), "Category found"));
    }

    @GetMapping("/{id}/usage")
    @PreAuthorize("hasRole('ADMIN') or @securityService.canAccessCategory(#id)")
    public ResponseEntity<ApiResponse<CategoryUsageDTO>> usage(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.success(categoryService.usage(id), "Category usage"));
    }

    @PutMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN') or @securityService.canAccessCategory(#id)")
    public ResponseEntity<ApiResponse<CategoryResponseDTO>> update(
            @PathVariable String id,
            @Valid @RequestBody CategoryRequestDTO dto
    ) {
        return ResponseEntity.ok(ApiResponse.success(categoryService.update(id, dto), "Category updated successfully"));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN') or @securityService.canAccessCategory(#id)")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable String id) {
        categoryService.delete(id);
        return ResponseEntity.ok(ApiResponse.success(null, "Category deleted successfully"));
    }
}
