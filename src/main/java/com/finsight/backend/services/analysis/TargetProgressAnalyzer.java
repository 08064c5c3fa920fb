package com.finsight.backend.services.analysis;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;

import org.springframework.stereotype.Component;

import com.finsight.backend.config.AnalysisProperties;
import com.finsight.backend.dto.analysis.TargetAnalysisDTO;
import com.finsight.backend.services.analysis.model.TargetSnapshot;

import lombok.RequiredArgsConstructor;

/**
 * Measures progress of savings targets against linear pacing toward their deadline.
 */
@Component
@RequiredArgsConstructor
public class TargetProgressAnalyzer {

    private final AnalysisProperties properties;

    public TargetAnalysisDTO analyze(List<TargetSnapshot> targets, LocalDate now) {
        List<TargetSnapshot> list = targets == null
                ? List.of()
                : targets.stream().filter(Objects::nonNull).toList();

        BigDecimal totalTarget = BigDecimal.ZERO;
        BigDecimal totalCurrent = BigDecimal.ZERO;
        int completed = 0;
        int onTrack = 0;

        for (TargetSnapshot target : list) {
            BigDecimal targetAmount = AnalysisMath.safeAmount(target.targetAmount());
            BigDecimal currentAmount = AnalysisMath.safeAmount(target.currentAmount());
            totalTarget = totalTarget.add(targetAmount);
            totalCurrent = totalCurrent.add(currentAmount);

            if (isCompleted(target)) {
                completed++;
            } else if (isOnTrack(target, now)) {
                onTrack++;
            }
        }

        return TargetAnalysisDTO.builder()
                .totalTargets(list.size())
                .totalTargetAmount(AnalysisMath.money(totalTarget))
                .totalCurrentAmount(AnalysisMath.money(totalCurrent))
                .overallProgress(AnalysisMath.percentage(totalCurrent, totalTarget))
                .completedTargets(completed)
                .onTrackTargets(onTrack)
                // derived so that the three counts always partition the total
                .behindTargets(list.size() - completed - onTrack)
                .build();
    }

    boolean isCompleted(TargetSnapshot target) {
        return AnalysisMath.safeAmount(target.currentAmount())
                .compareTo(AnalysisMath.safeAmount(target.targetAmount())) >= 0;
    }

    /**
     * Targets without a deadline or creation date are unscheduled and count as on track.
     */
    boolean isOnTrack(TargetSnapshot target, LocalDate now) {
        if (target.targetDate() == null || target.createdAt() == null || now == null) {
            return true;
        }

        BigDecimal targetAmount = AnalysisMath.safeAmount(target.targetAmount());
        if (targetAmount.signum() <= 0) {
            return false;
        }

        BigDecimal progress = AnalysisMath.ratio(AnalysisMath.safeAmount(target.currentAmount()), targetAmount);
        BigDecimal required = expectedProgress(target, now).multiply(properties.onTrackTolerance());
        return progress.compareTo(required) >= 0;
    }

    /**
     * Fraction of the way from creation to deadline, capped at 1. A deadline on or before the creation date
     * counts as fully elapsed.
     */
    BigDecimal expectedProgress(TargetSnapshot target, LocalDate now) {
        long totalDays = ChronoUnit.DAYS.between(target.createdAt(), target.targetDate());
        if (totalDays <= 0) {
            return BigDecimal.ONE;
        }

        long daysPassed = ChronoUnit.DAYS.between(target.createdAt(), now);
        BigDecimal fraction = BigDecimal.valueOf(daysPassed)
                .divide(BigDecimal.valueOf(totalDays), AnalysisMath.DIVISION_SCALE, RoundingMode.HALF_UP);
        return fraction.min(BigDecimal.ONE);
    }
}
