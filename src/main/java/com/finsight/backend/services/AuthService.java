package com.finsight.backend.services;

import java.util.Locale;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.finsight.backend.dto.auth.AuthRequestDTO;
import com.finsight.backend.dto.auth.AuthResponseDTO;
import com.finsight.backend.dto.auth.RegisterRequestDTO;
import com.finsight.backend.dto.auth.UserResponseDTO;
import com.finsight.backend.entities.User;
import com.finsight.backend.enums.Currency;
import com.finsight.backend.exceptions.BadRequestException;
import com.finsight.backend.exceptions.ConflictException;
import com.finsight.backend.repositories.UserRepository;
import com.finsight.backend.security.JwtService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtService jwtService;
    private final CategoryProvisioningService provisioningService;

    /**
     * Creates the account and its default categories in one transaction.
     */
    @Transactional
    public AuthResponseDTO register(RegisterRequestDTO request) {
        String email = normalizeEmail(request.getEmail());

        if (request.getName() == null || request.getName().isBlank()) {
            throw new BadRequestException("Name is required");
        }
        if (email == null || email.isBlank()) {
            throw new BadRequestException("Email is required");
        }
        if (request.getPassword() == null || request.getPassword().isBlank()) {
            throw new BadRequestException("Password is required");
        }
        if (userRepository.existsByEmail(email)) {
            throw new ConflictException("Email already registered");
        }

        User user = new User();
        user.setName(request.getName().trim());
        user.setEmail(email);
        user.setPassword(passwordEncoder.encode(request.getPassword()));
        user.setCurrency(request.getCurrency() != null ? request.getCurrency() : Currency.INR);

        User created = userRepository.save(user);
        provisioningService.provision(created);

        log.info("[Auth] Registered user {}", created.getId());
        return toAuthResponse(created);
    }

    public AuthResponseDTO login(AuthRequestDTO request) {
        String email = normalizeEmail(request.getEmail());
        User user = userRepository.findByEmail(email)
                .orElseThrow(() -> new BadRequestException("Invalid credentials"));

        if (!passwordEncoder.matches(request.getPassword(), user.getPassword())) {
            throw new BadRequestException("Invalid credentials");
        }

        return toAuthResponse(user);
    }

    private AuthResponseDTO toAuthResponse(User user) {
        return AuthResponseDTO.builder()
                .token(jwtService.generateToken(user))
                .tokenType("Bearer")
                .expiresIn(jwtService.getExpirationMillis())
                .user(UserResponseDTO.from(user))
                .build();
    }

    private String normalizeEmail(String email) {
        if (email == null) return null;
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
