package com.finsight.backend.security;

import java.util.Optional;
import java.util.UUID;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import com.finsight.backend.entities.Person;
import com.finsight.backend.entities.User;
import com.finsight.backend.enums.Role;
import com.finsight.backend.repositories.BudgetRepository;
import com.finsight.backend.repositories.CategoryRepository;
import com.finsight.backend.repositories.FinancialTransactionRepository;
import com.finsight.backend.repositories.TargetRepository;
import com.finsight.backend.repositories.UserRepository;

import lombok.RequiredArgsConstructor;

/**
 * Ownership checks referenced from {@code @PreAuthorize} expressions as {@code @securityService}.
 */
@Component("securityService")
@RequiredArgsConstructor
public class SecurityService {

    private final UserRepository userRepository;
    private final CategoryRepository categoryRepository;
    private final FinancialTransactionRepository transactionRepository;
    private final TargetRepository targetRepository;
    private final BudgetRepository budgetRepository;

    private Optional<User> currentUser() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth == null || !auth.isAuthenticated()) {
            return Optional.empty();
        }
        return userRepository.findByEmail(auth.getName());
    }

    private static boolean isAdmin(User user) {
        return user.getRole() == Role.ADMIN;
    }

    private static boolean owns(User user, Person owner) {
        return owner != null && user.getId().equals(owner.getId());
    }

    public boolean canAccessPerson(String personId) {
        return currentUser()
                .map(user -> isAdmin(user) || user.getId().equals(UUID.fromString(personId)))
                .orElse(false);
    }

    public boolean canAccessCategory(String categoryId) {
        return currentUser()
                .map(user -> isAdmin(user) || categoryRepository.findById(UUID.fromString(categoryId))
                        .map(c -> owns(user, c.getOwner()))
                        .orElse(false))
                .orElse(false);
    }

    public boolean canAccessTransaction(String transactionId) {
        return currentUser()
                .map(user -> isAdmin(user) || transactionRepository.findById(UUID.fromString(transactionId))
                        .map(tx -> owns(user, tx.getPerson()))
                        .orElse(false))
                .orElse(false);
    }

    public boolean canAccessTarget(String targetId) {
        return currentUser()
                .map(user -> isAdmin(user) || targetRepository.findById(UUID.fromString(targetId))
                        .map(t -> owns(user, t.getOwner()))
                        .orElse(false))
                .orElse(false);
    }

    public boolean canAccessBudget(String budgetId) {
        return currentUser()
                .map(user -> isAdmin(user) || budgetRepository.findById(UUID.fromString(budgetId))
                        .map(b -> owns(user, b.getOwner()))
                        .orElse(false))
                .orElse(false);
    }
}
