package com.finsight.backend.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.finsight.backend.config.AnalysisProperties;
import com.finsight.backend.dto.analysis.AnalysisReportDTO;
import com.finsight.backend.entities.Budget;
import com.finsight.backend.entities.Category;
import com.finsight.backend.entities.FinancialTransaction;
import com.finsight.backend.entities.Person;
import com.finsight.backend.enums.AnalysisPeriod;
import com.finsight.backend.enums.CategoryType;
import com.finsight.backend.enums.Currency;
import com.finsight.backend.enums.TransactionType;
import com.finsight.backend.exceptions.BadRequestException;
import com.finsight.backend.repositories.BudgetRepository;
import com.finsight.backend.repositories.FinancialTransactionRepository;
import com.finsight.backend.repositories.TargetRepository;
import com.finsight.backend.services.analysis.FinancialAnalysisFacade;
import com.finsight.backend.services.analysis.model.AnalysisInput;

@ExtendWith(MockitoExtension.class)
class AnalysisServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 5, 10);
    private static final LocalDate MONTH_START = LocalDate.of(2024, 5, 1);
    private static final LocalDate MONTH_END = LocalDate.of(2024, 5, 31);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-10T12:00:00Z"), ZoneOffset.UTC);

    @Mock
    private UserService userService;

    @Mock
    private FinancialTransactionRepository transactionRepository;

    @Mock
    private TargetRepository targetRepository;

    @Mock
    private BudgetRepository budgetRepository;

    @Mock
    private FinancialAnalysisFacade facade;

    private AnalysisService analysisService;

    private Person person;

    @BeforeEach
    void setUp() {
        analysisService = new AnalysisService(userService, transactionRepository, targetRepository, budgetRepository,
                facade, AnalysisProperties.defaults(), CLOCK);

        person = new Person();
        person.setId(UUID.randomUUID());
        person.setCurrency(Currency.USD);
    }

    @Test
    void analyze_monthPeriod_narrowsTransactionsToRollingWindow() {
        AnalysisReportDTO report = AnalysisReportDTO.builder().healthScore(42).build();
        when(userService.findPerson(person.getId().toString())).thenReturn(person);
        when(transactionRepository.findByPersonAndTransactionDateBetweenOrderByTransactionDateDesc(
                person, LocalDate.of(2024, 4, 10), TODAY)).thenReturn(List.of(tx()));
        when(transactionRepository.findByPersonAndTransactionDateBetweenOrderByTransactionDateDesc(
                person, MONTH_START, MONTH_END)).thenReturn(List.of(tx()));
        when(targetRepository.findByOwner(person)).thenReturn(List.of());
        when(budgetRepository.findByOwnerOrderByYearDescMonthDesc(person)).thenReturn(List.of(budget()));
        when(facade.analyze(any(AnalysisInput.class))).thenReturn(report);

        AnalysisReportDTO result = analysisService.analyze(person.getId().toString(), AnalysisPeriod.MONTH, null, null);

        assertSame(report, result);
        ArgumentCaptor<AnalysisInput> captor = ArgumentCaptor.forClass(AnalysisInput.class);
        verify(facade).analyze(captor.capture());
        AnalysisInput input = captor.getValue();
        assertEquals(TODAY, input.now());
        assertEquals("$", input.currencySymbol());
        assertEquals(1, input.transactions().size());
        assertEquals("Rent", input.budgets().get(0).categoryName());
    }

    @Test
    void analyze_allPeriod_loadsEveryTransaction() {
        when(userService.findPerson(person.getId().toString())).thenReturn(person);
        when(transactionRepository.findByPersonOrderByTransactionDateDesc(person)).thenReturn(List.of());
        when(facade.analyze(any(AnalysisInput.class))).thenReturn(AnalysisReportDTO.builder().build());

        analysisService.analyze(person.getId().toString(), AnalysisPeriod.ALL, null, null);

        verify(transactionRepository, never())
                .findByPersonAndTransactionDateBetweenOrderByTransactionDateDesc(any(), any(), any());
    }

    @Test
    void analyze_weekPeriod_comparesBudgetsAgainstWholeCurrentMonth() {
        FinancialTransaction earlyInMonth = tx();
        when(userService.findPerson(person.getId().toString())).thenReturn(person);
        when(transactionRepository.findByPersonAndTransactionDateBetweenOrderByTransactionDateDesc(
                person, LocalDate.of(2024, 5, 3), TODAY)).thenReturn(List.of());
        when(transactionRepository.findByPersonAndTransactionDateBetweenOrderByTransactionDateDesc(
                person, MONTH_START, MONTH_END)).thenReturn(List.of(earlyInMonth));
        when(targetRepository.findByOwner(person)).thenReturn(List.of());
        when(budgetRepository.findByOwnerOrderByYearDescMonthDesc(person)).thenReturn(List.of(budget()));
        when(facade.analyze(any(AnalysisInput.class))).thenReturn(AnalysisReportDTO.builder().build());

        analysisService.analyze(person.getId().toString(), AnalysisPeriod.WEEK, null, null);

        ArgumentCaptor<AnalysisInput> captor = ArgumentCaptor.forClass(AnalysisInput.class);
        verify(facade).analyze(captor.capture());
        AnalysisInput input = captor.getValue();
        assertTrue(input.transactions().isEmpty());
        assertEquals(1, input.budgetTransactions().size());
        assertEquals(new BigDecimal("900"), input.budgetTransactions().get(0).amount());
    }

    @Test
    void analyze_allPeriod_budgetsUseAnalysedTransactions() {
        when(userService.findPerson(person.getId().toString())).thenReturn(person);
        when(transactionRepository.findByPersonOrderByTransactionDateDesc(person)).thenReturn(List.of(tx()));
        when(facade.analyze(any(AnalysisInput.class))).thenReturn(AnalysisReportDTO.builder().build());

        analysisService.analyze(person.getId().toString(), AnalysisPeriod.ALL, null, null);

        ArgumentCaptor<AnalysisInput> captor = ArgumentCaptor.forClass(AnalysisInput.class);
        verify(facade).analyze(captor.capture());
        assertEquals(captor.getValue().transactions(), captor.getValue().budgetTransactions());
    }

    @Test
    void analyze_explicitFromOverridesPeriodAndEndsToday() {
        LocalDate from = LocalDate.of(2024, 1, 1);
        when(userService.findPerson(person.getId().toString())).thenReturn(person);
        when(transactionRepository.findByPersonAndTransactionDateBetweenOrderByTransactionDateDesc(person, from, TODAY))
                .thenReturn(List.of());
        when(transactionRepository.findByPersonAndTransactionDateBetweenOrderByTransactionDateDesc(
                person, MONTH_START, MONTH_END)).thenReturn(List.of());
        when(facade.analyze(any(AnalysisInput.class))).thenReturn(AnalysisReportDTO.builder().build());

        analysisService.analyze(person.getId().toString(), AnalysisPeriod.WEEK, from, null);

        verify(transactionRepository).findByPersonAndTransactionDateBetweenOrderByTransactionDateDesc(person, from, TODAY);
    }

    @Test
    void analyze_toBeforeFrom_throwsBadRequest() {
        when(userService.findPerson(person.getId().toString())).thenReturn(person);

        assertThrows(BadRequestException.class, () -> analysisService.analyze(
                person.getId().toString(), AnalysisPeriod.ALL, LocalDate.of(2024, 5, 1), LocalDate.of(2024, 4, 1)));
        verify(facade, never()).analyze(any());
    }

    private FinancialTransaction tx() {
        return FinancialTransaction.builder()
                .person(person)
                .description("Rent")
                .amount(new BigDecimal("900"))
                .type(TransactionType.EXPENSE)
                .category("Rent")
                .transactionDate(LocalDate.of(2024, 5, 1))
                .build();
    }

    private Budget budget() {
        return Budget.builder()
                .owner(person)
                .category(Category.builder().id(UUID.randomUUID()).owner(person).name("Rent").type(CategoryType.EXPENSE).build())
                .amount(new BigDecimal("1000"))
                .month(5)
                .year(2024)
                .build();
    }
}
