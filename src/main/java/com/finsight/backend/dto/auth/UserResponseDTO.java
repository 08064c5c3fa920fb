package com.finsight.backend.dto.auth;

import java.time.LocalDateTime;

import com.finsight.backend.entities.User;
import com.finsight.backend.enums.Currency;
import com.finsight.backend.enums.Role;
import com.finsight.backend.enums.Status;

import lombok.Data;

@Data
public class UserResponseDTO {

    private String id;
    private String name;
    private String email;
    private Currency currency;
    private String currencySymbol;
    private Role role;
    private Status status;
    private LocalDateTime createdAt;

    public static UserResponseDTO from(User user) {
        UserResponseDTO dto = new UserResponseDTO();
        dto.setId(user.getId() != null ? user.getId().toString() : null);
        dto.setName(user.getName());
        dto.setEmail(user.getEmail());
        dto.setCurrency(user.getCurrency());
        dto.setCurrencySymbol(user.getCurrency() != null ? user.getCurrency().getSymbol() : null);
        dto.setRole(user.getRole());
        dto.setStatus(user.getStatus());
        dto.setCreatedAt(user.getCreatedAt());
        return dto;
    }
}
