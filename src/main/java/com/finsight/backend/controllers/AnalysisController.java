package com.finsight.backend.controllers;

import java.time.LocalDate;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.finsight.backend.dto.ApiResponse;
import com.finsight.backend.dto.analysis.AnalysisReportDTO;
import com.finsight.backend.enums.AnalysisPeriod;
import com.finsight.backend.services.AnalysisService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/analysis")
@RequiredArgsConstructor
public class AnalysisController {

    private final AnalysisService analysisService;

    /**
     * Explicit {@code from}/{@code to} take precedence over {@code period}.
     */
    @RequestMapping(value = "/{personId}", method = {RequestMethod.GET, RequestMethod.POST})
    @PreAuthorize("hasRole('ADMIN') or @securityService.canAccessPerson(#personId)")
    public ResponseEntity<ApiResponse<AnalysisReportDTO>> analyze(
            @PathVariable String personId,
            @RequestParam(defaultValue = "ALL") AnalysisPeriod period,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        log.info("[Analysis] personId={}, period={}, from={}, to={}", personId, period, from, to);
        AnalysisReportDTO report = analysisService.analyze(personId, period, from, to);
        return ResponseEntity.ok(ApiResponse.success(report, "Analysis completed"));
    }
}
