package com.itms.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.itms.backend.modules.auth.application.AuthService;
import com.itms.backend.modules.auth.application.JwtTokenService;
import com.itms.backend.modules.auth.domain.AccessRole;
import com.itms.backend.modules.auth.domain.AppUser;
import com.itms.backend.modules.auth.domain.AppUserStatus;
import com.itms.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.itms.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.itms.backend.modules.auth.presentation.dto.LoginRequest;
import com.itms.backend.modules.auth.presentation.dto.LoginResponse;
import com.itms.backend.support.MutableClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.server.ResponseStatusException;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    @Mock
    private AppUserRepository appUserRepository;

    private final PasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);
    private AuthService authService;
    private AppUser manager;

    @BeforeEach
    void setUp() {
        JwtTokenService jwtTokenService = new JwtTokenService(
                new JwtTokenProvider("test-itms-jwt-secret-with-at-least-32-bytes!!"),
                3_600_000L,
                new MutableClock(OffsetDateTime.parse("2025-03-10T08:00:00Z"))
        );
        authService = new AuthService(appUserRepository, passwordEncoder, jwtTokenService);

        manager = new AppUser();
        ReflectionTestUtils.setField(manager, "id", UUID.randomUUID());
        manager.setLoginId("kim.manager");
        manager.setPasswordHash(passwordEncoder.encode("secret1!"));
        manager.setFullName("Kim Manager");
        manager.setEmail("kim@itms.local");
        manager.setRole(AccessRole.MANAGER);
        manager.setStatus(AppUserStatus.ACTIVE);
    }

    @Test
    void loginReturnsTokenAndCapabilities() {
        when(appUserRepository.findByLoginIdIgnoreCase("kim.manager")).thenReturn(Optional.of(manager));

        LoginResponse response = authService.login(new LoginRequest("kim.manager", "secret1!"));

        assertThat(response.tokens().accessToken()).isNotBlank();
        assertThat(response.user().role()).isEqualTo("MANAGER");
        assertThat(response.user().capabilities()).contains("APPROVE_BOOKING").doesNotContain("MANAGE_RESOURCES");
    }

    @Test
    void wrongPasswordIsUnauthorized() {
        when(appUserRepository.findByLoginIdIgnoreCase("kim.manager")).thenReturn(Optional.of(manager));

        assertThatThrownBy(() -> authService.login(new LoginRequest("kim.manager", "nope")))
                .isInstanceOf(ResponseStatusException.class)
                .extracting(ex -> ((ResponseStatusException) ex).getStatusCode())
                .isEqualTo(HttpStatus.UNAUTHORIZED);
    }

    @Test
    void inactiveUserIsForbidden() {
        manager.setStatus(AppUserStatus.INACTIVE);
        when(appUserRepository.findByLoginIdIgnoreCase("kim.manager")).thenReturn(Optional.of(manager));

        assertThatThrownBy(() -> authService.login(new LoginRequest("kim.manager", "secret1!")))
                .isInstanceOf(ResponseStatusException.class)
                .hasMessageContaining("USER_INACTIVE");
    }
}
