package com.finsight.backend.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.finsight.backend.dto.transaction.FinancialTransactionRequestDTO;
import com.finsight.backend.dto.transaction.FinancialTransactionResponseDTO;
import com.finsight.backend.entities.Category;
import com.finsight.backend.entities.FinancialTransaction;
import com.finsight.backend.entities.Person;
import com.finsight.backend.entities.Target;
import com.finsight.backend.enums.CategoryType;
import com.finsight.backend.enums.TransactionType;
import com.finsight.backend.exceptions.BadRequestException;
import com.finsight.backend.repositories.CategoryRepository;
import com.finsight.backend.repositories.FinancialTransactionRepository;
import com.finsight.backend.repositories.TargetRepository;

@ExtendWith(MockitoExtension.class)
class FinancialTransactionServiceTest {

    @Mock
    private FinancialTransactionRepository repository;

    @Mock
    private CategoryRepository categoryRepository;

    @Mock
    private TargetRepository targetRepository;

    @Mock
    private UserService userService;

    @InjectMocks
    private FinancialTransactionService service;

    private Person person;

    @BeforeEach
    void setUp() {
        person = new Person();
        person.setId(UUID.randomUUID());
        person.setName("Asha");
    }

    @Test
    void create_investmentLinkedToTarget_recomputesTargetAmount() {
        Target target = target(person);
        when(userService.findPerson(person.getId().toString())).thenReturn(person);
        when(targetRepository.findById(target.getId())).thenReturn(Optional.of(target));
        when(repository.save(any(FinancialTransaction.class))).thenAnswer(inv -> inv.getArgument(0));
        when(repository.sumInvestmentsByTarget(target)).thenReturn(new BigDecimal("1500.00"));

        FinancialTransactionResponseDTO dto = service.create(request(
                TransactionType.INVESTMENT, "500.00", "Mutual Fund", target.getId().toString()));

        assertEquals(new BigDecimal("1500.00"), target.getCurrentAmount());
        assertEquals(target.getId().toString(), dto.targetId());
        assertEquals("Emergency fund", dto.targetTitle());
        verify(targetRepository).save(target);
    }

    @Test
    void create_expenseResolvesOwnerCategory() {
        Category rent = Category.builder().id(UUID.randomUUID()).owner(person).name("Rent").type(CategoryType.EXPENSE).build();
        when(userService.findPerson(person.getId().toString())).thenReturn(person);
        when(categoryRepository.findFirstByOwnerAndNameAndType(person, "Rent", CategoryType.EXPENSE))
                .thenReturn(Optional.of(rent));
        when(repository.save(any(FinancialTransaction.class))).thenAnswer(inv -> inv.getArgument(0));

        FinancialTransactionResponseDTO dto = service.create(request(TransactionType.EXPENSE, "900", " Rent ", null));

        assertEquals("Rent", dto.category());
        assertEquals(rent.getId().toString(), dto.categoryId());
        verify(repository, never()).sumInvestmentsByTarget(any());
    }

    @Test
    void create_expenseWithTarget_throwsBadRequest() {
        when(userService.findPerson(person.getId().toString())).thenReturn(person);

        assertThrows(BadRequestException.class, () -> service.create(
                request(TransactionType.EXPENSE, "10", null, UUID.randomUUID().toString())));
        verify(repository, never()).save(any());
    }

    @Test
    void create_targetOfAnotherPerson_throwsBadRequest() {
        Person other = new Person();
        other.setId(UUID.randomUUID());
        Target foreign = target(other);
        when(userService.findPerson(person.getId().toString())).thenReturn(person);
        when(targetRepository.findById(foreign.getId())).thenReturn(Optional.of(foreign));

        assertThrows(BadRequestException.class, () -> service.create(
                request(TransactionType.INVESTMENT, "10", null, foreign.getId().toString())));
    }

    @Test
    void update_movingToAnotherTarget_recomputesBoth() {
        Target oldTarget = target(person);
        Target newTarget = target(person);
        FinancialTransaction existing = FinancialTransaction.builder()
                .id(UUID.randomUUID())
                .person(person)
                .description("SIP")
                .amount(new BigDecimal("200"))
                .type(TransactionType.INVESTMENT)
                .transactionDate(LocalDate.of(2024, 3, 1))
                .target(oldTarget)
                .build();

        when(repository.findById(existing.getId())).thenReturn(Optional.of(existing));
        when(targetRepository.findById(newTarget.getId())).thenReturn(Optional.of(newTarget));
        when(repository.save(existing)).thenReturn(existing);
        when(repository.sumInvestmentsByTarget(oldTarget)).thenReturn(BigDecimal.ZERO);
        when(repository.sumInvestmentsByTarget(newTarget)).thenReturn(new BigDecimal("200"));

        service.update(existing.getId().toString(),
                request(TransactionType.INVESTMENT, "200", null, newTarget.getId().toString()));

        assertEquals(0, oldTarget.getCurrentAmount().signum());
        assertEquals(new BigDecimal("200"), newTarget.getCurrentAmount());
    }

    @Test
    void delete_linkedInvestment_subtractsFromTarget() {
        Target target = target(person);
        target.setCurrentAmount(new BigDecimal("700"));
        FinancialTransaction existing = FinancialTransaction.builder()
                .id(UUID.randomUUID())
                .person(person)
                .type(TransactionType.INVESTMENT)
                .amount(new BigDecimal("700"))
                .target(target)
                .build();
        when(repository.findById(existing.getId())).thenReturn(Optional.of(existing));
        when(repository.sumInvestmentsByTarget(target)).thenReturn(BigDecimal.ZERO);

        service.delete(existing.getId().toString());

        verify(repository).delete(existing);
        assertEquals(0, target.getCurrentAmount().signum());
    }

    @Test
    void findByPersonAndPeriod_endBeforeStart_throwsBadRequest() {
        assertThrows(BadRequestException.class, () -> service.findByPersonAndPeriod(
                person.getId().toString(), LocalDate.of(2024, 3, 1), LocalDate.of(2024, 2, 1)));
    }

    @Test
    void findById_malformedId_throwsBadRequest() {
        assertThrows(BadRequestException.class, () -> service.findById("not-a-uuid"));
    }

    private FinancialTransactionRequestDTO request(TransactionType type, String amount, String category, String targetId) {
        return new FinancialTransactionRequestDTO(
                person.getId().toString(),
                "Test transaction",
                new BigDecimal(amount),
                type,
                category,
                LocalDate.of(2024, 3, 1),
                targetId);
    }

    private static Target target(Person owner) {
        Target target = new Target();
        target.setId(UUID.randomUUID());
        target.setOwner(owner);
        target.setTitle("Emergency fund");
        target.setTargetAmount(new BigDecimal("10000"));
        return target;
    }
}
