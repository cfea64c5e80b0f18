package com.itms.backend.modules.auth.application;

import java.util.Objects;
import java.util.Optional;

import com.itms.backend.global.security.JwtAuthenticationPrincipal;
import com.itms.backend.modules.auth.domain.AccessRole;
import com.itms.backend.modules.auth.domain.Capability;
import com.itms.backend.modules.auth.domain.CapabilityTable;

import org.springframework.stereotype.Component;

/**
 * Answers capability questions about an authenticated principal using {@link CapabilityTable}.
 */
@Component
public class AccessPolicy {

    public boolean hasCapability(JwtAuthenticationPrincipal principal, Capability capability) {
        if (principal == null || principal.roles() == null) {
            return false;
        }
        return principal.roles().stream()
                .filter(Objects::nonNull)
                .map(AccessRole::fromCode)
                .flatMap(Optional::stream)
                .anyMatch(role -> CapabilityTable.has(role, capability));
    }

    /**
     * Approval rights are granted per role and cover every resource category.
     */
    public boolean mayApproveBookings(JwtAuthenticationPrincipal principal) {
        return hasCapability(principal, Capability.APPROVE_BOOKING);
    }
}
