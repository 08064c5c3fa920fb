package com.finsight.backend.services;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.finsight.backend.dto.transaction.FinancialTransactionRequestDTO;
import com.finsight.backend.dto.transaction.FinancialTransactionResponseDTO;
import com.finsight.backend.entities.Category;
import com.finsight.backend.entities.FinancialTransaction;
import com.finsight.backend.entities.Person;
import com.finsight.backend.entities.Target;
import com.finsight.backend.enums.CategoryType;
import com.finsight.backend.enums.TransactionType;
import com.finsight.backend.exceptions.BadRequestException;
import com.finsight.backend.exceptions.ResourceNotFoundException;
import com.finsight.backend.mappers.FinancialTransactionMapper;
import com.finsight.backend.repositories.CategoryRepository;
import com.finsight.backend.repositories.FinancialTransactionRepository;
import com.finsight.backend.repositories.TargetRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Transaction writes keep the linked savings target in step: a target's {@code currentAmount} is the sum of the
 * investment transactions that point at it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FinancialTransactionService {

    private final FinancialTransactionRepository repository;
    private final CategoryRepository categoryRepository;
    private final TargetRepository targetRepository;
    private final UserService userService;

    @Transactional
    public FinancialTransactionResponseDTO create(FinancialTransactionRequestDTO dto) {
        Person person = userService.findPerson(dto.personId());

        FinancialTransaction entity = FinancialTransaction.builder()
                .person(person)
                .build();
        apply(entity, dto, person);

        FinancialTransaction saved = repository.save(entity);
        if (saved.getTarget() != null) {
            recomputeTargetAmount(saved.getTarget());
        }

        log.info("[Transaction] Created {} {} for {}", saved.getType(), saved.getAmount(), person.getId());
        return toDTO(saved);
    }

    @Transactional(readOnly = true)
    public FinancialTransactionResponseDTO findById(String id) {
        return toDTO(getTransaction(id));
    }

    @Transactional(readOnly = true)
    public List<FinancialTransactionResponseDTO> findByPerson(String personId) {
        Person person = userService.findPerson(personId);
        return repository.findByPersonOrderByTransactionDateDesc(person)
                .stream()
                .map(this::toDTO)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<FinancialTransactionResponseDTO> findByPersonAndType(String personId, TransactionType type) {
        Person person = userService.findPerson(personId);
        return repository.findByPersonAndTypeOrderByTransactionDateDesc(person, type)
                .stream()
                .map(this::toDTO)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<FinancialTransactionResponseDTO> findByPersonAndPeriod(String personId, LocalDate start, LocalDate end) {
        if (start == null || end == null) {
            throw new BadRequestException("Start and end dates are required");
        }
        if (end.isBefore(start)) {
            throw new BadRequestException("End date must not be before start date");
        }
        Person person = userService.findPerson(personId);
        return repository.findByPersonAndTransactionDateBetweenOrderByTransactionDateDesc(person, start, end)
                .stream()
                .map(this::toDTO)
                .toList();
    }

    @Transactional
    public FinancialTransactionResponseDTO update(String id, FinancialTransactionRequestDTO dto) {
        FinancialTransaction entity = getTransaction(id);
        Target previousTarget = entity.getTarget();

        apply(entity, dto, entity.getPerson());
        FinancialTransaction saved = repository.save(entity);

        if (previousTarget != null && !sameTarget(previousTarget, saved.getTarget())) {
            recomputeTargetAmount(previousTarget);
        }
        if (saved.getTarget() != null) {
            recomputeTargetAmount(saved.getTarget());
        }

        return toDTO(saved);
    }

    @Transactional
    public void delete(String id) {
        FinancialTransaction entity = getTransaction(id);
        Target target = entity.getTarget();

        repository.delete(entity);
        if (target != null) {
            recomputeTargetAmount(target);
        }
        log.info("[Transaction] Deleted {}", id);
    }

    void recomputeTargetAmount(Target target) {
        BigDecimal sum = repository.sumInvestmentsByTarget(target);
        target.setCurrentAmount(sum != null ? sum : BigDecimal.ZERO);
        targetRepository.save(target);
    }

    private void apply(FinancialTransaction entity, FinancialTransactionRequestDTO dto, Person person) {
        entity.setDescription(dto.description().trim());
        entity.setAmount(dto.amount());
        entity.setType(dto.type());
        entity.setTransactionDate(dto.transactionDate());

        String category = dto.category() != null && !dto.category().isBlank() ? dto.category().trim() : null;
        entity.setCategory(category);
        entity.setCategoryRef(resolveCategory(person, category, dto.type()));
        entity.setTarget(resolveTarget(person, dto));
    }

    private Category resolveCategory(Person person, String name, TransactionType type) {
        if (name == null) {
            return null;
        }
        CategoryType categoryType = switch (type) {
            case INCOME -> CategoryType.INCOME;
            case EXPENSE -> CategoryType.EXPENSE;
            case INVESTMENT -> null;
        };
        if (categoryType == null) {
            return null;
        }
        return categoryRepository.findFirstByOwnerAndNameAndType(person, name, categoryType).orElse(null);
    }

    private Target resolveTarget(Person person, FinancialTransactionRequestDTO dto) {
        if (dto.targetId() == null || dto.targetId().isBlank()) {
            return null;
        }
        if (dto.type() != TransactionType.INVESTMENT) {
            throw new BadRequestException("Only investment transactions can be linked to a target");
        }

        Target target = targetRepository.findById(UserService.parseId(dto.targetId(), "target"))
                .orElseThrow(() -> new ResourceNotFoundException("Target not found"));
        if (target.getOwner() == null || !Objects.equals(target.getOwner().getId(), person.getId())) {
            throw new BadRequestException("Target does not belong to this person");
        }
        return target;
    }

    private static boolean sameTarget(Target a, Target b) {
        return b != null && Objects.equals(a.getId(), b.getId());
    }

    private FinancialTransaction getTransaction(String id) {
        return repository.findById(UserService.parseId(id, "transaction"))
                .orElseThrow(() -> new ResourceNotFoundException("Transaction not found"));
    }

    private FinancialTransactionResponseDTO toDTO(FinancialTransaction tx) {
        return FinancialTransactionMapper.toResponseDTO(tx);
    }
}
