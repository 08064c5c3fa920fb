package com.finsight.backend.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.password.PasswordEncoder;

import com.finsight.backend.dto.auth.AuthRequestDTO;
import com.finsight.backend.dto.auth.AuthResponseDTO;
import com.finsight.backend.dto.auth.RegisterRequestDTO;
import com.finsight.backend.entities.User;
import com.finsight.backend.enums.Currency;
import com.finsight.backend.exceptions.BadRequestException;
import com.finsight.backend.exceptions.ConflictException;
import com.finsight.backend.repositories.UserRepository;
import com.finsight.backend.security.JwtService;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    @Mock
    private UserRepository userRepository;

    @Mock
    private PasswordEncoder passwordEncoder;

    @Mock
    private JwtService jwtService;

    @Mock
    private CategoryProvisioningService provisioningService;

    @InjectMocks
    private AuthService authService;

    @Test
    void register_newEmail_createsUserAndProvisionsCategories() {
        when(userRepository.existsByEmail("asha@example.com")).thenReturn(false);
        when(passwordEncoder.encode("secret1")).thenReturn("hashed");
        when(userRepository.save(any(User.class))).thenAnswer(inv -> {
            User u = inv.getArgument(0);
            u.setId(UUID.randomUUID());
            return u;
        });
        when(jwtService.generateToken(any(User.class))).thenReturn("token");
        when(jwtService.getExpirationMillis()).thenReturn(3_600_000L);

        AuthResponseDTO resp = authService.register(register(" Asha@Example.com "));

        ArgumentCaptor<User> captor = ArgumentCaptor.forClass(User.class);
        verify(userRepository).save(captor.capture());
        User saved = captor.getValue();
        assertEquals("asha@example.com", saved.getEmail());
        assertEquals("hashed", saved.getPassword());
        assertEquals(Currency.INR, saved.getCurrency());
        verify(provisioningService).provision(saved);

        assertEquals("token", resp.getToken());
        assertEquals("Bearer", resp.getTokenType());
        assertEquals("₹", resp.getUser().getCurrencySymbol());
    }

    @Test
    void register_existingEmail_throwsConflict() {
        when(userRepository.existsByEmail("asha@example.com")).thenReturn(true);

        assertThrows(ConflictException.class, () -> authService.register(register("asha@example.com")));
        verify(userRepository, never()).save(any());
        verify(provisioningService, never()).provision(any());
    }

    @Test
    void login_wrongPassword_throwsBadRequest() {
        User user = new User();
        user.setEmail("asha@example.com");
        user.setPassword("hashed");
        when(userRepository.findByEmail("asha@example.com")).thenReturn(Optional.of(user));
        when(passwordEncoder.matches("nope", "hashed")).thenReturn(false);

        AuthRequestDTO req = new AuthRequestDTO();
        req.setEmail("asha@example.com");
        req.setPassword("nope");

        assertThrows(BadRequestException.class, () -> authService.login(req));
    }

    @Test
    void login_unknownEmail_throwsBadRequest() {
        when(userRepository.findByEmail("ghost@example.com")).thenReturn(Optional.empty());

        AuthRequestDTO req = new AuthRequestDTO();
        req.setEmail("ghost@example.com");
        req.setPassword("whatever");

        assertThrows(BadRequestException.class, () -> authService.login(req));
    }

    private static RegisterRequestDTO register(String email) {
        RegisterRequestDTO req = new RegisterRequestDTO();
        req.setName("Asha");
        req.setEmail(email);
        req.setPassword("secret1");
        return req;
    }
}
