package com.itms.backend.modules.auth.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of ITMS roles. Capabilities per role live in {@link CapabilityTable}.
 */
public enum AccessRole {
    SUPER_ADMIN,
    ADMIN,
    MANAGER,
    TECHNICIAN,
    USER;

    public String code() {
        return name();
    }

    public static Optional<AccessRole> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(AccessRole.valueOf(code.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
