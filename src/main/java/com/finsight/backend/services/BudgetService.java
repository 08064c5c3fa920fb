package com.finsight.backend.services;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Objects;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.finsight.backend.dto.analysis.BudgetCategoryDTO;
import com.finsight.backend.dto.budget.BudgetRequestDTO;
import com.finsight.backend.dto.budget.BudgetResponseDTO;
import com.finsight.backend.dto.budget.BudgetUsageDTO;
import com.finsight.backend.entities.Budget;
import com.finsight.backend.entities.Category;
import com.finsight.backend.entities.Person;
import com.finsight.backend.exceptions.BadRequestException;
import com.finsight.backend.exceptions.ConflictException;
import com.finsight.backend.exceptions.ResourceNotFoundException;
import com.finsight.backend.mappers.AnalysisFactMapper;
import com.finsight.backend.repositories.BudgetRepository;
import com.finsight.backend.repositories.CategoryRepository;
import com.finsight.backend.repositories.FinancialTransactionRepository;
import com.finsight.backend.services.analysis.BudgetComparator;
import com.finsight.backend.services.analysis.model.TransactionFact;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class BudgetService {

    static final int MIN_YEAR = 2000;
    static final int MAX_YEAR = 2100;

    private final BudgetRepository budgetRepository;
    private final CategoryRepository categoryRepository;
    private final FinancialTransactionRepository transactionRepository;
    private final BudgetComparator budgetComparator;
    private final UserService userService;

    @Transactional
    public BudgetResponseDTO create(BudgetRequestDTO dto) {
        validatePeriod(dto.getMonth(), dto.getYear());
        validateAmount(dto);

        Person owner = userService.findPerson(dto.getOwnerId());
        Category category = getOwnedCategory(owner, dto.getCategoryId());

        if (budgetRepository.existsByOwnerAndCategoryAndMonthAndYear(owner, category, dto.getMonth(), dto.getYear())) {
            throw new ConflictException("Budget already exists for this category and period");
        }

        Budget saved = budgetRepository.save(Budget.builder()
                .owner(owner)
                .category(category)
                .amount(dto.getAmount())
                .month(dto.getMonth())
                .year(dto.getYear())
                .build());

        log.info("[Budget] Created {} for '{}' {}/{}", saved.getAmount(), category.getName(), saved.getMonth(), saved.getYear());
        return toDTO(saved);
    }

    @Transactional(readOnly = true)
    public BudgetResponseDTO findById(String id) {
        return toDTO(getBudget(id));
    }

    @Transactional(readOnly = true)
    public List<BudgetResponseDTO> findByOwner(String ownerId) {
        Person owner = userService.findPerson(ownerId);
        return budgetRepository.findByOwnerOrderByYearDescMonthDesc(owner)
                .stream()
                .map(this::toDTO)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<BudgetResponseDTO> findByOwnerAndPeriod(String ownerId, int year, int month) {
        validatePeriod(month, year);
        Person owner = userService.findPerson(ownerId);
        return budgetRepository.findByOwnerAndYearAndMonth(owner, year, month)
                .stream()
                .map(this::toDTO)
                .toList();
    }

    @Transactional
    public BudgetResponseDTO update(String id, BudgetRequestDTO dto) {
        validatePeriod(dto.getMonth(), dto.getYear());
        validateAmount(dto);

        Budget budget = getBudget(id);
        Category category = getOwnedCategory(budget.getOwner(), dto.getCategoryId());

        boolean keyChanged = !Objects.equals(category.getId(), budget.getCategory().getId())
                || dto.getMonth() != budget.getMonth()
                || dto.getYear() != budget.getYear();
        if (keyChanged && budgetRepository.existsByOwnerAndCategoryAndMonthAndYear(
                budget.getOwner(), category, dto.getMonth(), dto.getYear())) {
            throw new ConflictException("Budget already exists for this category and period");
        }

        budget.setCategory(category);
        budget.setAmount(dto.getAmount());
        budget.setMonth(dto.getMonth());
        budget.setYear(dto.getYear());
        return toDTO(budgetRepository.save(budget));
    }

    @Transactional
    public void delete(String id) {
        budgetRepository.delete(getBudget(id));
        log.info("[Budget] Deleted {}", id);
    }

    /**
     * Expense spend against the budget within its own month.
     */
    @Transactional(readOnly = true)
    public BudgetUsageDTO analyze(String id) {
        Budget budget = getBudget(id);
        YearMonth period = YearMonth.of(budget.getYear(), budget.getMonth());
        LocalDate start = period.atDay(1);
        LocalDate end = period.atEndOfMonth();

        List<TransactionFact> facts = transactionRepository
                .findByPersonAndTransactionDateBetweenOrderByTransactionDateDesc(budget.getOwner(), start, end)
                .stream()
                .map(AnalysisFactMapper::toFact)
                .toList();

        BudgetCategoryDTO usage = budgetComparator.usage(AnalysisFactMapper.toLimit(budget), facts);
        return new BudgetUsageDTO(toDTO(budget), usage);
    }

    private static void validatePeriod(Integer month, Integer year) {
        if (month == null || month < 1 || month > 12) {
            throw new BadRequestException("Month must be between 1 and 12");
        }
        if (year == null || year < MIN_YEAR || year > MAX_YEAR) {
            throw new BadRequestException("Year must be between " + MIN_YEAR + " and " + MAX_YEAR);
        }
    }

    private static void validateAmount(BudgetRequestDTO dto) {
        if (dto.getAmount() == null || dto.getAmount().signum() < 0) {
            throw new BadRequestException("Budget amount cannot be negative");
        }
    }

    private Category getOwnedCategory(Person owner, String categoryId) {
        Category category = categoryRepository.findById(UserService.parseId(categoryId, "category"))
                .orElseThrow(() -> new ResourceNotFoundException("Category not found"));
        if (category.getOwner() == null || !Objects.equals(category.getOwner().getId(), owner.getId())) {
            throw new BadRequestException("Category does not belong to this person");
        }
        return category;
    }

    private Budget getBudget(String id) {
        return budgetRepository.findById(UserService.parseId(id, "budget"))
                .orElseThrow(() -> new ResourceNotFoundException("Budget not found"));
    }

    private BudgetResponseDTO toDTO(Budget budget) {
        BudgetResponseDTO dto = new BudgetResponseDTO();
        dto.setId(budget.getId() != null ? budget.getId().toString() : null);
        dto.setOwnerId(budget.getOwner() != null && budget.getOwner().getId() != null
                ? budget.getOwner().getId().toString()
                : null);
        if (budget.getCategory() != null) {
            dto.setCategoryId(budget.getCategory().getId() != null ? budget.getCategory().getId().toString() : null);
            dto.setCategoryName(budget.getCategory().getName());
        }
        dto.setAmount(budget.getAmount());
        dto.setMonth(budget.getMonth());
        dto.setYear(budget.getYear());
        dto.setCreatedAt(budget.getCreatedAt());
        dto.setUpdatedAt(budget.getUpdatedAt());
        return dto;
    }
}
