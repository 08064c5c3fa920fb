package com.finsight.backend.repositories;

import com.finsight.backend.entities.Person;
import com.finsight.backend.entities.Target;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface TargetRepository extends JpaRepository<Target, UUID> {

    List<Target> findByOwner(Person owner);
}
