package com.finsight.backend.config;

import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.finsight.backend.enums.CategoryType;

/**
 * Categories (and optionally zero-amount budgets) created for every new account.
 */
@ConfigurationProperties(prefix = "finsight.provisioning")
public record ProvisioningProperties(
        List<DefaultCategory> defaultCategories,
        boolean createZeroBudgets
) {

    public ProvisioningProperties {
        if (defaultCategories == null) {
            defaultCategories = List.of();
        }
    }

    public record DefaultCategory(String name, CategoryType type) {
    }
}
