package com.itms.backend.global.config;

import java.util.Optional;
import java.util.UUID;

import com.itms.backend.global.security.JwtAuthenticationPrincipal;

import org.springframework.data.domain.AuditorAware;
import org.springframework.lang.NonNull;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Resolves the current auditor (ITMS user id) for JPA auditing.
 * Scheduled sweeps run without a principal and resolve to {@code Optional.empty()}.
 */
public class ItmsAuditorAware implements AuditorAware<UUID> {

    @Override
    @NonNull
    public Optional<UUID> getCurrentAuditor() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !authentication.isAuthenticated()) {
            return Optional.empty();
        }
        if (authentication.getPrincipal() instanceof JwtAuthenticationPrincipal principal) {
            return Optional.ofNullable(principal.userId());
        }
        return Optional.empty();
    }
}
