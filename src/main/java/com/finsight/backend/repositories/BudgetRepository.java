package com.finsight.backend.repositories;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.finsight.backend.entities.Budget;
import com.finsight.backend.entities.Category;
import com.finsight.backend.entities.Person;

@Repository
public interface BudgetRepository extends JpaRepository<Budget, UUID> {

    List<Budget> findByOwnerOrderByYearDescMonthDesc(Person owner);

    List<Budget> findByOwnerAndYearAndMonth(Person owner, int year, int month);

    boolean existsByOwnerAndCategoryAndMonthAndYear(Person owner, Category category, int month, int year);

    boolean existsByCategory(Category category);
}
