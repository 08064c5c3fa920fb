package com.finsight.backend.controllers;

import java.time.LocalDate;
import java.util.List;

import org.springframework.format.annotation.DateTimeFormat;
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
import com.finsight.backend.dto.transaction.FinancialTransactionRequestDTO;
import com.finsight.backend.dto.transaction.FinancialTransactionResponseDTO;
import com.finsight.backend.enums.TransactionType;
import com.finsight.backend.services.FinancialTransactionService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/transactions")
@RequiredArgsConstructor
public class FinancialTransactionController {

    private final FinancialTransactionService service;

    @PostMapping
    @PreAuthorize("hasRole('ADMIN') or @securityService.canAccessPerson(#dto.personId)")
    public ResponseEntity<ApiResponse<FinancialTransactionResponseDTO>> create(
            @Valid @RequestBody FinancialTransactionRequestDTO dto
    ) {
        FinancialTransactionResponseDTO created = service.create(dto);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(created, "Transaction created successfully"));
    }

    @GetMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN') or @securityService.canAccessTransaction(#id)")
    public ResponseEntity<ApiResponse<FinancialTransactionResponseDTO>> findById(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.success(service.findById(id), "Transaction found"));
    }

    /**
     * All transactions of a person, newest first, optionally narrowed by type or by a date range.
     */
    @GetMapping("/person/{personId}")
    @PreAuthorize("hasRole('ADMIN') or @securityService.canAccessPerson(#personId)")
    public ResponseEntity<ApiResponse<List<FinancialTransactionResponseDTO>>> findByPerson(
            @PathVariable String personId,
            @RequestParam(required = false) TransactionType type,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end
    ) {
        List<FinancialTransactionResponseDTO> list;
        if (start != null || end != null) {
            list = service.findByPersonAndPeriod(personId, start, end);
        } else if (type != null) {
            list = service.findByPersonAndType(personId, type);
        } else {
            list = service.findByPerson(personId);
        }
        return ResponseEntity.ok(ApiResponse.success(list, "Transactions found"));
    }

    @PutMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN') or @securityService.canAccessTransaction(#id)")
    public ResponseEntity<ApiResponse<FinancialTransactionResponseDTO>> update(
            @PathVariable String id,
            @Valid @RequestBody FinancialTransactionRequestDTO dto
    ) {
        return ResponseEntity.ok(ApiResponse.success(service.update(id, dto), "Transaction updated successfully"));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN') or @securityService.canAccessTransaction(#id)")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable String id) {
        service.delete(id);
        return ResponseEntity.ok(ApiResponse.success(null, "Transaction deleted successfully"));
    }
}
