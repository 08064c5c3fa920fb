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
import com.finsight.backend.dto.budget.BudgetRequestDTO;
import com.finsight.backend.dto.budget.BudgetResponseDTO;
import com.finsight.backend.dto.budget.BudgetUsageDTO;
import com.finsight.backend.services.BudgetService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/budgets")
@RequiredArgsConstructor
public class BudgetController {

    private final BudgetService budgetService;

    @PostMapping
    @PreAuthorize("hasRole('ADMIN') or @securityService.canAccessPerson(#dto.ownerId)")
    public ResponseEntity<ApiResponse<BudgetResponseDTO>> create(@Valid @RequestBody BudgetRequestDTO dto) {
        BudgetResponseDTO created = budgetService.create(dto);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(created, "Budget created successfully"));
    }

    @GetMapping("/owner/{ownerId}")
    @PreAuthorize("hasRole('ADMIN') or @securityService.canAccessPerson(#ownerId)")
    public ResponseEntity<ApiResponse<List<BudgetResponseDTO>>> findByOwner(
            @PathVariable String ownerId,
            @RequestParam(required = false) Integer year,
            @RequestParam(required = false) Integer month
    ) {
        List<BudgetResponseDTO> list = year != null && month != null
                ? budgetService.findByOwnerAndPeriod(ownerId, year, month)
                : budgetService.findByOwner(ownerId);
        return ResponseEntity.ok(ApiResponse.success(list, "Budgets found"));
    }

    @GetMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN') or @securityService.canAccessBudget(#id)")
    public ResponseEntity<ApiResponse<BudgetResponseDTO>> findById(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.success(budgetService.findById(id), "Budget found"));
    }

    @GetMapping("/{id}/analysis")
    @PreAuthorize("hasRole('ADMIN') or @securityService.canAccessBudget(#id)")
    public ResponseEntity<ApiResponse<BudgetUsageDTO>> analysis(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.success(budgetService.analyze(id), "Budget analysis"));
    }

    @PutMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN') or @securityService.canAccessBudget(#id)")
    public ResponseEntity<ApiResponse<BudgetResponseDTO>> update(
            @PathVariable String id,
            @Valid @RequestBody BudgetRequestDTO dto
    ) {
        return ResponseEntity.ok(ApiResponse.success(budgetService.update(id, dto), "Budget updated successfully"));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN') or @securityService.canAccessBudget(#id)")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable String id) {
        budgetService.delete(id);
        return ResponseEntity.ok(ApiResponse.success(null, "Budget deleted successfully"));
    }
}
