package com.finsight.backend.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import com.finsight.backend.config.ProvisioningProperties;
import com.finsight.backend.config.ProvisioningProperties.DefaultCategory;
import com.finsight.backend.entities.Budget;
import com.finsight.backend.entities.Category;
import com.finsight.backend.entities.Person;
import com.finsight.backend.enums.CategoryType;
import com.finsight.backend.repositories.BudgetRepository;
import com.finsight.backend.repositories.CategoryRepository;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CategoryProvisioningServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-10T10:00:00Z"), ZoneOffset.UTC);

    private static final List<DefaultCategory> DEFAULTS = List.of(
            new DefaultCategory("Salary", CategoryType.INCOME),
            new DefaultCategory("Rent", CategoryType.EXPENSE),
            new DefaultCategory("Dining", CategoryType.EXPENSE),
            new DefaultCategory(" ", CategoryType.EXPENSE)
    );

    @Mock
    private CategoryRepository categoryRepository;

    @Mock
    private BudgetRepository budgetRepository;

    private Person owner;

    @BeforeEach
    void setUp() {
        owner = new Person();
        owner.setId(UUID.randomUUID());
    }

    @Test
    void provision_createsConfiguredCategoriesOnly() {
        when(categoryRepository.save(any(Category.class))).thenAnswer(inv -> inv.getArgument(0));
        CategoryProvisioningService service = service(false);

        List<Category> created = service.provision(owner);

        assertEquals(3, created.size());
        assertEquals("Salary", created.get(0).getName());
        verify(budgetRepository, never()).save(any());
    }

    @Test
    void provision_skipsExistingCategories() {
        when(categoryRepository.existsByOwnerAndNameAndType(owner, "Rent", CategoryType.EXPENSE)).thenReturn(true);
        when(categoryRepository.save(any(Category.class))).thenAnswer(inv -> inv.getArgument(0));

        List<Category> created = service(false).provision(owner);

        assertEquals(List.of("Salary", "Dining"), created.stream().map(Category::getName).toList());
    }

    @Test
    void provision_withZeroBudgets_createsOnePerExpenseCategoryForCurrentMonth() {
        when(categoryRepository.save(any(Category.class))).thenAnswer(inv -> inv.getArgument(0));

        service(true).provision(owner);

        ArgumentCaptor<Budget> captor = ArgumentCaptor.forClass(Budget.class);
        verify(budgetRepository, times(2)).save(captor.capture());
        Budget first = captor.getAllValues().get(0);
        assertEquals(0, BigDecimal.ZERO.compareTo(first.getAmount()));
        assertEquals(5, first.getMonth());
        assertEquals(2024, first.getYear());
        assertEquals("Rent", first.getCategory().getName());
    }

    private CategoryProvisioningService service(boolean zeroBudgets) {
        return new CategoryProvisioningService(
                new ProvisioningProperties(DEFAULTS, zeroBudgets), categoryRepository, budgetRepository, CLOCK);
    }
}
