package com.itms.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.UUID;

import com.itms.backend.global.security.JwtAuthenticationPrincipal;
import com.itms.backend.modules.auth.application.AccessPolicy;
import com.itms.backend.modules.auth.domain.AccessRole;
import com.itms.backend.modules.auth.domain.Capability;
import com.itms.backend.modules.auth.domain.CapabilityTable;

import org.junit.jupiter.api.Test;

class CapabilityTableTest {

    @Test
    void adminsHoldEveryCapability() {
        for (Capability capability : Capability.values()) {
            assertThat(CapabilityTable.has(AccessRole.SUPER_ADMIN, capability)).isTrue();
            assertThat(CapabilityTable.has(AccessRole.ADMIN, capability)).isTrue();
        }
    }

    @Test
    void onlyManagersAndAboveApprove() {
        assertThat(CapabilityTable.rolesWith(Capability.APPROVE_BOOKING))
                .containsExactly(AccessRole.SUPER_ADMIN, AccessRole.ADMIN, AccessRole.MANAGER);
        assertThat(CapabilityTable.has(AccessRole.TECHNICIAN, Capability.VIEW_REPORTS)).isTrue();
        assertThat(CapabilityTable.has(AccessRole.TECHNICIAN, Capability.MANAGE_RESOURCES)).isFalse();
        assertThat(CapabilityTable.capabilitiesOf(AccessRole.USER))
                .containsExactlyInAnyOrder(Capability.READ_BOOKING, Capability.CREATE_BOOKING);
    }

    @Test
    void accessPolicyIgnoresUnknownRoleCodes() {
        AccessPolicy policy = new AccessPolicy();
        JwtAuthenticationPrincipal stranger = new JwtAuthenticationPrincipal(UUID.randomUUID(), "x", List.of("JANITOR"));
        JwtAuthenticationPrincipal manager = new JwtAuthenticationPrincipal(UUID.randomUUID(), "m", List.of("manager"));

        assertThat(policy.hasCapability(stranger, Capability.READ_BOOKING)).isFalse();
        assertThat(policy.mayApproveBookings(manager)).isTrue();
        assertThat(policy.hasCapability(null, Capability.READ_BOOKING)).isFalse();
    }

    @Test
    void approvalGrantIsIndependentOfResourceCategory() {
        AccessPolicy policy = new AccessPolicy();
        JwtAuthenticationPrincipal technician = new JwtAuthenticationPrincipal(UUID.randomUUID(), "t", List.of("TECHNICIAN"));
        JwtAuthenticationPrincipal user = new JwtAuthenticationPrincipal(UUID.randomUUID(), "u", List.of("USER"));

        assertThat(policy.mayApproveBookings(technician)).isFalse();
        assertThat(policy.mayApproveBookings(user)).isFalse();
        assertThat(policy.mayApproveBookings(null)).isFalse();
    }
}
