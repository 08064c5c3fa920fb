package com.finsight.backend.repositories;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.finsight.backend.entities.Category;
import com.finsight.backend.entities.FinancialTransaction;
import com.finsight.backend.entities.Person;
import com.finsight.backend.entities.Target;
import com.finsight.backend.enums.TransactionType;

public interface FinancialTransactionRepository extends JpaRepository<FinancialTransaction, UUID> {

    List<FinancialTransaction> findByPersonOrderByTransactionDateDesc(Person person);

    List<FinancialTransaction> findByPersonAndTransactionDateBetweenOrderByTransactionDateDesc(
            Person person,
            LocalDate startDate,
            LocalDate endDate
    );

    List<FinancialTransaction> findByPersonAndTypeOrderByTransactionDateDesc(Person person, TransactionType type);

    List<FinancialTransaction> findByTargetAndTypeOrderByTransactionDateDesc(Target target, TransactionType type);

    List<FinancialTransaction> findByPersonAndCategory(Person person, String category);

    long countByPersonAndCategory(Person person, String category);

    boolean existsByCategoryRef(Category categoryRef);

    @Query("""
            select coalesce(sum(t.amount), 0)
            from FinancialTransaction t
            where t.target = :target and t.type = com.finsight.backend.enums.TransactionType.INVESTMENT
            """)
    BigDecimal sumInvestmentsByTarget(@Param("target") Target target);
}
