package com.finsight.backend.services;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.finsight.backend.config.ProvisioningProperties;
import com.finsight.backend.config.ProvisioningProperties.DefaultCategory;
import com.finsight.backend.entities.Budget;
import com.finsight.backend.entities.Category;
import com.finsight.backend.entities.Person;
import com.finsight.backend.enums.CategoryType;
import com.finsight.backend.repositories.BudgetRepository;
import com.finsight.backend.repositories.CategoryRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Seeds a new account with the configured default categories and, when enabled, zero-amount budgets for the
 * expense categories of the current month.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CategoryProvisioningService {

    private final ProvisioningProperties properties;
    private final CategoryRepository categoryRepository;
    private final BudgetRepository budgetRepository;
    private final Clock clock;

    @Transactional
    public List<Category> provision(Person owner) {
        List<Category> created = new ArrayList<>();

        for (DefaultCategory def : properties.defaultCategories()) {
            if (def == null || def.name() == null || def.name().isBlank() || def.type() == null) {
                log.warn("[Provisioning] Skipping incomplete default category {}", def);
                continue;
            }
            if (categoryRepository.existsByOwnerAndNameAndType(owner, def.name(), def.type())) {
                continue;
            }
            created.add(categoryRepository.save(Category.builder()
                    .owner(owner)
                    .name(def.name())
                    .type(def.type())
                    .build()));
        }

        if (properties.createZeroBudgets()) {
            createZeroBudgets(owner, created);
        }

        log.info("[Provisioning] Created {} default categories for {}", created.size(), owner.getId());
        return created;
    }

    private void createZeroBudgets(Person owner, List<Category> categories) {
        LocalDate today = LocalDate.now(clock);
        int count = 0;
        for (Category category : categories) {
            if (category.getType() != CategoryType.EXPENSE) continue;
            budgetRepository.save(Budget.builder()
                    .owner(owner)
                    .category(category)
                    .amount(BigDecimal.ZERO)
                    .month(today.getMonthValue())
                    .year(today.getYear())
                    .build());
            count++;
        }
        log.info("[Provisioning] Created {} zero budgets for {}/{}", count, today.getMonthValue(), today.getYear());
    }
}
