package com.finsight.backend.repositories;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.finsight.backend.entities.Category;
import com.finsight.backend.entities.Person;
import com.finsight.backend.enums.CategoryType;

public interface CategoryRepository extends JpaRepository<Category, UUID> {

    List<Category> findByOwnerOrderByNameAsc(Person owner);

    List<Category> findByOwnerAndTypeOrderByNameAsc(Person owner, CategoryType type);

    List<Category> findByOwnerAndName(Person owner, String name);

    boolean existsByOwnerAndNameAndType(Person owner, String name, CategoryType type);

    Optional<Category> findFirstByOwnerAndNameAndType(Person owner, String name, CategoryType type);
}
