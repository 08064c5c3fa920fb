package com.finsight.backend.services;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.finsight.backend.dto.target.ActionStepDTO;
import com.finsight.backend.dto.target.ActionStepUpdateDTO;
import com.finsight.backend.dto.target.TargetRequestDTO;
import com.finsight.backend.dto.target.TargetResponseDTO;
import com.finsight.backend.dto.transaction.FinancialTransactionResponseDTO;
import com.finsight.backend.entities.ActionStep;
import com.finsight.backend.entities.Person;
import com.finsight.backend.entities.Target;
import com.finsight.backend.enums.TransactionType;
import com.finsight.backend.exceptions.BadRequestException;
import com.finsight.backend.exceptions.ResourceNotFoundException;
import com.finsight.backend.mappers.FinancialTransactionMapper;
import com.finsight.backend.repositories.FinancialTransactionRepository;
import com.finsight.backend.repositories.TargetRepository;
import com.finsight.backend.services.analysis.AnalysisMath;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class TargetService {

    private final TargetRepository targetRepository;
    private final FinancialTransactionRepository transactionRepository;
    private final UserService userService;
    private final Clock clock;

    @Transactional
    public TargetResponseDTO create(TargetRequestDTO dto) {
        Person owner = userService.findPerson(dto.getOwnerId());
        BigDecimal current = dto.getCurrentAmount() != null ? dto.getCurrentAmount() : BigDecimal.ZERO;

        validateTargetBusinessRules(dto.getTargetAmount(), current, dto.getTargetDate());

        Target target = new Target();
        target.setOwner(owner);
        target.setTitle(dto.getTitle().trim());
        target.setDescription(dto.getDescription());
        target.setTargetAmount(dto.getTargetAmount());
        target.setCurrentAmount(current);
        target.setTargetDate(dto.getTargetDate());
        target.setCreatedAt(LocalDate.now(clock));

        if (dto.getActionSteps() != null) {
            int number = 1;
            for (ActionStepDTO step : dto.getActionSteps()) {
                target.addActionStep(ActionStep.builder()
                        .stepNumber(number++)
                        .description(step.getDescription())
                        .amount(step.getAmount() != null ? step.getAmount() : BigDecimal.ZERO)
                        .build());
            }
        }

        Target saved = targetRepository.save(target);
        log.info("[Target] Created '{}' with {} steps for {}", saved.getTitle(), saved.getActionSteps().size(), owner.getId());
        return toDTO(saved);
    }

    @Transactional(readOnly = true)
    public TargetResponseDTO findById(String id) {
        return toDTO(getTarget(id));
    }

    @Transactional(readOnly = true)
    public List<TargetResponseDTO> findByOwner(String ownerId) {
        Person owner = userService.findPerson(ownerId);
        return targetRepository.findByOwner(owner)
                .stream()
                .map(this::toDTO)
                .toList();
    }

    /**
     * Fields left null keep their stored value. The owner cannot be changed.
     */
    @Transactional
    public TargetResponseDTO update(String id, TargetRequestDTO dto) {
        Target target = getTarget(id);

        BigDecimal targetAmount = dto.getTargetAmount() != null ? dto.getTargetAmount() : target.getTargetAmount();
        BigDecimal currentAmount = dto.getCurrentAmount() != null ? dto.getCurrentAmount() : target.getCurrentAmount();
        LocalDate targetDate = dto.getTargetDate() != null ? dto.getTargetDate() : target.getTargetDate();
        validateTargetBusinessRules(targetAmount, currentAmount, null);

        if (dto.getTitle() != null && !dto.getTitle().isBlank()) {
            target.setTitle(dto.getTitle().trim());
        }
        if (dto.getDescription() != null) {
            target.setDescription(dto.getDescription());
        }
        target.setTargetAmount(targetAmount);
        target.setCurrentAmount(currentAmount);
        target.setTargetDate(targetDate);

        return toDTO(targetRepository.save(target));
    }

    @Transactional
    public TargetResponseDTO updateProgress(String id, BigDecimal currentAmount) {
        if (currentAmount == null || currentAmount.signum() < 0) {
            throw new BadRequestException("Invalid current amount");
        }
        Target target = getTarget(id);
        target.setCurrentAmount(currentAmount);
        return toDTO(targetRepository.save(target));
    }

    @Transactional
    public TargetResponseDTO updateStep(String targetId, String stepId, ActionStepUpdateDTO dto) {
        if (dto == null || (dto.completed() == null && dto.amount() == null && dto.description() == null)) {
            throw new BadRequestException("No fields to update");
        }

        Target target = getTarget(targetId);
        ActionStep step = target.getActionSteps().stream()
                .filter(s -> s.getId() != null && s.getId().toString().equals(stepId))
                .findFirst()
                .orElseThrow(() -> new ResourceNotFoundException("Action step not found"));

        if (dto.completed() != null) {
            step.setCompleted(dto.completed());
        }
        if (dto.amount() != null) {
            step.setAmount(dto.amount());
        }
        if (dto.description() != null && !dto.description().isBlank()) {
            step.setDescription(dto.description().trim());
        }

        return toDTO(targetRepository.save(target));
    }

    @Transactional(readOnly = true)
    public List<FinancialTransactionResponseDTO> findInvestments(String targetId) {
        Target target = getTarget(targetId);
        return transactionRepository.findByTargetAndTypeOrderByTransactionDateDesc(target, TransactionType.INVESTMENT)
                .stream()
                .map(FinancialTransactionMapper::toResponseDTO)
                .toList();
    }

    @Transactional
    public void delete(String id) {
        Target target = getTarget(id);
        // linked investments stay, unlinked
        transactionRepository.findByTargetAndTypeOrderByTransactionDateDesc(target, TransactionType.INVESTMENT)
                .forEach(tx -> tx.setTarget(null));
        targetRepository.delete(target);
        log.info("[Target] Deleted {}", id);
    }

    private void validateTargetBusinessRules(BigDecimal targetAmount, BigDecimal currentAmount, LocalDate targetDate) {
        if (targetAmount == null || targetAmount.signum() <= 0) {
            throw new BadRequestException("Target amount must be greater than zero");
        }
        if (currentAmount != null && currentAmount.signum() < 0) {
            throw new BadRequestException("Current amount cannot be negative");
        }
        if (targetDate != null && targetDate.isBefore(LocalDate.now(clock))) {
            throw new BadRequestException("Target date cannot be in the past");
        }
    }

    private Target getTarget(String id) {
        return targetRepository.findById(UserService.parseId(id, "target"))
                .orElseThrow(() -> new ResourceNotFoundException("Target not found"));
    }

    private TargetResponseDTO toDTO(Target target) {
        TargetResponseDTO dto = new TargetResponseDTO();
        dto.setId(target.getId() != null ? target.getId().toString() : null);
        dto.setOwnerId(target.getOwner() != null && target.getOwner().getId() != null
                ? target.getOwner().getId().toString()
                : null);
        dto.setTitle(target.getTitle());
        dto.setDescription(target.getDescription());
        dto.setTargetAmount(target.getTargetAmount());
        dto.setCurrentAmount(target.getCurrentAmount());
        dto.setProgressPercentage(AnalysisMath.percentage(target.getCurrentAmount(), target.getTargetAmount()));
        dto.setTargetDate(target.getTargetDate());
        dto.setCreatedAt(target.getCreatedAt());
        dto.setUpdatedAt(target.getUpdatedAt());
        dto.setActionSteps(target.getActionSteps().stream()
                .map(step -> ActionStepDTO.builder()
                        .id(step.getId() != null ? step.getId().toString() : null)
                        .stepNumber(step.getStepNumber())
                        .description(step.getDescription())
                        .amount(step.getAmount())
                        .completed(step.isCompleted())
                        .build())
                .toList());
        return dto;
    }
}
