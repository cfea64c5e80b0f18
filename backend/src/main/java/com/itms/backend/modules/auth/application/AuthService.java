package com.itms.backend.modules.auth.application;

import java.util.List;
import java.util.UUID;

import com.itms.backend.modules.auth.domain.AppUser;
import com.itms.backend.modules.auth.domain.AppUserStatus;
import com.itms.backend.modules.auth.domain.Capability;
import com.itms.backend.modules.auth.domain.CapabilityTable;
import com.itms.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.itms.backend.modules.auth.presentation.dto.AccessTokenResponse;
import com.itms.backend.modules.auth.presentation.dto.LoginRequest;
import com.itms.backend.modules.auth.presentation.dto.LoginResponse;
import com.itms.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
@Transactional(readOnly = true)
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final AppUserRepository appUserRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;

    public AuthService(
            AppUserRepository appUserRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService
    ) {
        this.appUserRepository = appUserRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
    }

    public LoginResponse login(LoginRequest request) {
        AppUser user = appUserRepository.findByLoginIdIgnoreCase(request.loginId())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS"));

        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS");
        }

        if (user.getStatus() != AppUserStatus.ACTIVE) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "USER_INACTIVE");
        }

        List<String> roleCodes = List.of(user.getRole().code());
        AccessTokenResponse token = jwtTokenService.issueAccessToken(user.getId(), user.getLoginId(), roleCodes);
        log.info("User {} logged in", user.getLoginId());
        return new LoginResponse(token, buildUserProfile(user));
    }

    public UserProfileResponse loadProfile(UUID userId) {
        AppUser user = appUserRepository.findById(userId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND"));
        return buildUserProfile(user);
    }

    private UserProfileResponse buildUserProfile(AppUser user) {
        List<String> capabilities = CapabilityTable.capabilitiesOf(user.getRole()).stream()
                .map(Capability::name)
                .sorted()
                .toList();
        return new UserProfileResponse(
                user.getId(),
                user.getLoginId(),
                user.getFullName(),
                user.getEmail(),
                user.getDepartment(),
                user.getRole().code(),
                capabilities,
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }
}
