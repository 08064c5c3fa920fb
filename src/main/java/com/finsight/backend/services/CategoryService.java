package com.finsight.backend.services;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.finsight.backend.config.CacheConfig;
import com.finsight.backend.dto.category.CategoryRequestDTO;
import com.finsight.backend.dto.category.CategoryResponseDTO;
import com.finsight.backend.dto.category.CategoryUsageDTO;
import com.finsight.backend.entities.Category;
import com.finsight.backend.entities.FinancialTransaction;
import com.finsight.backend.entities.Person;
import com.finsight.backend.enums.CategoryType;
import com.finsight.backend.exceptions.BusinessException;
import com.finsight.backend.exceptions.ConflictException;
import com.finsight.backend.exceptions.ResourceNotFoundException;
import com.finsight.backend.repositories.BudgetRepository;
import com.finsight.backend.repositories.CategoryRepository;
import com.finsight.backend.repositories.FinancialTransactionRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class CategoryService {

    private final CategoryRepository categoryRepository;
    private final FinancialTransactionRepository transactionRepository;
    private final BudgetRepository budgetRepository;
    private final UserService userService;

    @Transactional
    @CacheEvict(cacheNames = CacheConfig.CATEGORIES, key = "#dto.ownerId")
    public CategoryResponseDTO create(CategoryRequestDTO dto) {
        Person owner = userService.findPerson(dto.getOwnerId());
        String name = dto.getName().trim();

        if (categoryRepository.existsByOwnerAndNameAndType(owner, name, dto.getType())) {
            throw new ConflictException("Category already exists");
        }

        Category saved = categoryRepository.save(Category.builder()
                .owner(owner)
                .name(name)
                .type(dto.getType())
                .build());

        log.info("[Category] Created '{}' ({}) for {}", saved.getName(), saved.getType(), owner.getId());
        return toDTO(saved);
    }

    public CategoryResponseDTO findById(String id) {
        return toDTO(getCategory(id));
    }

    @Cacheable(cacheNames = CacheConfig.CATEGORIES, key = "#ownerId")
    public List<CategoryResponseDTO> findByOwner(String ownerId) {
        Person owner = userService.findPerson(ownerId);
        return categoryRepository.findByOwnerOrderByNameAsc(owner)
                .stream()
                .map(this::toDTO)
                .toList();
    }

    public List<CategoryResponseDTO> findByOwnerAndType(String ownerId, CategoryType type) {
        Person owner = userService.findPerson(ownerId);
        return categoryRepository.findByOwnerAndTypeOrderByNameAsc(owner, type)
                .stream()
                .map(this::toDTO)
                .toList();
    }

    @Transactional
    @CacheEvict(cacheNames = CacheConfig.CATEGORIES, allEntries = true)
    public CategoryResponseDTO update(String id, CategoryRequestDTO dto) {
        Category category = getCategory(id);
        String name = dto.getName() != null && !dto.getName().isBlank() ? dto.getName().trim() : category.getName();
        CategoryType type = dto.getType() != null ? dto.getType() : category.getType();

        boolean changed = !name.equals(category.getName()) || type != category.getType();
        if (changed && categoryRepository.existsByOwnerAndNameAndType(category.getOwner(), name, type)) {
            throw new ConflictException("Category already exists");
        }

        category.setName(name);
        category.setType(type);
        return toDTO(categoryRepository.save(category));
    }

    /**
     * Refuses to delete a category still referenced by transactions or budgets.
     */
    @Transactional
    @CacheEvict(cacheNames = CacheConfig.CATEGORIES, allEntries = true)
    public void delete(String id) {
        Category category = getCategory(id);

        if (transactionRepository.existsByCategoryRef(category)
                || transactionRepository.countByPersonAndCategory(category.getOwner(), category.getName()) > 0) {
            throw new BusinessException("Cannot delete category. It is being used in transactions.");
        }
        if (budgetRepository.existsByCategory(category)) {
            throw new BusinessException("Cannot delete category. It is being used in budgets.");
        }

        categoryRepository.delete(category);
        log.info("[Category] Deleted {}", id);
    }

    @Transactional(readOnly = true)
    public CategoryUsageDTO usage(String id) {
        Category category = getCategory(id);
        List<FinancialTransaction> txs = transactionRepository.findByPersonAndCategory(category.getOwner(), category.getName());

        BigDecimal total = txs.stream()
                .map(FinancialTransaction::getAmount)
                .filter(a -> a != null)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal average = txs.isEmpty()
                ? BigDecimal.ZERO
                : total.divide(BigDecimal.valueOf(txs.size()), 2, RoundingMode.HALF_UP);

        return CategoryUsageDTO.builder()
                .category(category.getName())
                .transactionCount(txs.size())
                .totalAmount(total.setScale(2, RoundingMode.HALF_UP))
                .averageAmount(average.setScale(2, RoundingMode.HALF_UP))
                .build();
    }

    private Category getCategory(String id) {
        return categoryRepository.findById(UserService.parseId(id, "category"))
                .orElseThrow(() -> new ResourceNotFoundException("Category not found"));
    }

    private CategoryResponseDTO toDTO(Category category) {
        CategoryResponseDTO dto = new CategoryResponseDTO();
        dto.setId(category.getId() != null ? category.getId().toString() : null);
        dto.setOwnerId(category.getOwner() != null && category.getOwner().getId() != null
                ? category.getOwner().getId().toString()
                : null);
        dto.setName(category.getName());
        dto.setType(category.getType());
        dto.setCreatedAt(category.getCreatedAt());
        return dto;
    }
}
