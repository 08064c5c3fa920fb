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
import org.springframework.web.bind.annotation.RestController;

import com.finsight.backend.dto.ApiResponse;
import com.finsight.backend.dto.target.ActionStepUpdateDTO;
import com.finsight.backend.dto.target.TargetProgressRequestDTO;
import com.finsight.backend.dto.target.TargetRequestDTO;
import com.finsight.backend.dto.target.TargetResponseDTO;
import com.finsight.backend.dto.transaction.FinancialTransactionResponseDTO;
import com.finsight.backend.services.TargetService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/targets")
@RequiredArgsConstructor
public class TargetController {

    private final TargetService targetService;

    @PostMapping
    @PreAuthorize("hasRole('ADMIN') or @securityService.canAccessPerson(#dto.ownerId)")
    public ResponseEntity<ApiResponse<TargetResponseDTO>> create(@Valid @RequestBody TargetRequestDTO dto) {
        TargetResponseDTO created = targetService.create(dto);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(created, "Target created successfully"));
    }

    @GetMapping("/owner/{ownerId}")
    @PreAuthorize("hasRole('ADMIN') or @securityService.canAccessPerson(#ownerId)")
    public ResponseEntity<ApiResponse<List<TargetResponseDTO>>> findByOwner(@PathVariable String ownerId) {
        return ResponseEntity.ok(ApiResponse.success(targetService.findByOwner(ownerId), "Targets found"));
    }

    @GetMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN') or @securityService.canAccessTarget(#id)")
    public ResponseEntity<ApiResponse<TargetResponseDTO>> findById(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.success(targetService.findById(id), "Target found"));
    }

    @PutMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN') or @securityService.canAccessTarget(#id)")
    public ResponseEntity<ApiResponse<TargetResponseDTO>> update(
            @PathVariable String id,
            @Valid @RequestBody TargetRequestDTO dto
    ) {
        return ResponseEntity.ok(ApiResponse.success(targetService.update(id, dto), "Target updated successfully"));
    }

    @PutMapping("/{id}/progress")
    @PreAuthorize("hasRole('ADMIN') or @securityService.canAccessTarget(#id)")
    public ResponseEntity<ApiResponse<TargetResponseDTO>> updateProgress(
            @PathVariable String id,
            @Valid @RequestBody TargetProgressRequestDTO dto
    ) {
        return ResponseEntity.ok(ApiResponse.success(
                targetService.updateProgress(id, dto.currentAmount()), "Progress updated successfully"));
    }

    @PutMapping("/{id}/steps/{stepId}")
    @PreAuthorize("hasRole('ADMIN') or @securityService.canAccessTarget(#id)")
    public ResponseEntity<ApiResponse<TargetResponseDTO>> updateStep(
            @PathVariable String id,
            @PathVariable String stepId,
            @Valid @RequestBody ActionStepUpdateDTO dto
    ) {
        return ResponseEntity.ok(ApiResponse.success(
                targetService.updateStep(id, stepId, dto), "Action step updated successfully"));
    }

    @GetMapping("/{id}/investments")
    @PreAuthorize("hasRole('ADMIN') or @securityService.canAccessTarget(#id)")
    public ResponseEntity<ApiResponse<List<FinancialTransactionResponseDTO>>> investments(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.success(targetService.findInvestments(id), "Investments found"));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN') or @securityService.canAccessTarget(#id)")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable String id) {
        targetService.delete(id);
        return ResponseEntity.ok(ApiResponse.success(null, "Target deleted successfully"));
    }
}
