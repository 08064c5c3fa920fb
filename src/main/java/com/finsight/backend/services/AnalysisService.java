package com.finsight.backend.services;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.finsight.backend.config.AnalysisProperties;
import com.finsight.backend.dto.analysis.AnalysisReportDTO;
import com.finsight.backend.entities.FinancialTransaction;
import com.finsight.backend.entities.Person;
import com.finsight.backend.enums.AnalysisPeriod;
import com.finsight.backend.exceptions.BadRequestException;
import com.finsight.backend.mappers.AnalysisFactMapper;
import com.finsight.backend.repositories.BudgetRepository;
import com.finsight.backend.repositories.FinancialTransactionRepository;
import com.finsight.backend.repositories.TargetRepository;
import com.finsight.backend.services.analysis.FinancialAnalysisFacade;
import com.finsight.backend.services.analysis.model.AnalysisInput;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads one person's data, narrows transactions to the requested window and hands everything to the engine.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisService {

    private final UserService userService;
    private final FinancialTransactionRepository transactionRepository;
    private final TargetRepository targetRepository;
    private final BudgetRepository budgetRepository;
    private final FinancialAnalysisFacade facade;
    private final AnalysisProperties properties;
    private final Clock clock;

    @Transactional(readOnly = true)
    public AnalysisReportDTO analyze(String personId, AnalysisPeriod period, LocalDate from, LocalDate to) {
        Person person = userService.findPerson(personId);
        LocalDate today = LocalDate.now(clock);

        LocalDate start = from;
        LocalDate end = to;
        if (start == null && end == null && period != null) {
            start = period.startFrom(today);
            end = start != null ? today : null;
        }
        if (start != null && end == null) {
            end = today;
        }
        if (start != null && end.isBefore(start)) {
            throw new BadRequestException("'to' must not be before 'from'");
        }

        List<FinancialTransaction> transactions = start == null && end == null
                ? transactionRepository.findByPersonOrderByTransactionDateDesc(person)
                : transactionRepository.findByPersonAndTransactionDateBetweenOrderByTransactionDateDesc(
                        person, start != null ? start : LocalDate.of(1900, 1, 1), end);

        // a narrowed window may cut off part of the current month, which budgets are compared against
        List<FinancialTransaction> monthTransactions = start == null && end == null
                ? null
                : transactionRepository.findByPersonAndTransactionDateBetweenOrderByTransactionDateDesc(
                        person, today.withDayOfMonth(1), today.with(TemporalAdjusters.lastDayOfMonth()));

        String symbol = person.getCurrency() != null
                ? person.getCurrency().getSymbol()
                : properties.defaultCurrencySymbol();

        AnalysisInput input = new AnalysisInput(
                transactions.stream().map(AnalysisFactMapper::toFact).toList(),
                targetRepository.findByOwner(person).stream().map(AnalysisFactMapper::toSnapshot).toList(),
                budgetRepository.findByOwnerOrderByYearDescMonthDesc(person).stream().map(AnalysisFactMapper::toLimit).toList(),
                monthTransactions != null
                        ? monthTransactions.stream().map(AnalysisFactMapper::toFact).toList()
                        : null,
                today,
                symbol);

        AnalysisReportDTO report = facade.analyze(input);
        log.info("[Analysis] personId={}, window={}..{}, transactions={}, score={}",
                person.getId(), start, end, input.transactions().size(), report.getHealthScore());
        return report;
    }
}
