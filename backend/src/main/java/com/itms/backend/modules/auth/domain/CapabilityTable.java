package com.itms.backend.modules.auth.domain;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Role to capability lookup.
 *
 * <ul>
 *   <li>SUPER_ADMIN, ADMIN: everything</li>
 *   <li>MANAGER: bookings incl. approval, reports</li>
 *   <li>TECHNICIAN: bookings, reports</li>
 *   <li>USER: read and create bookings</li>
 * </ul>
 */
public final class CapabilityTable {

    private static final Map<AccessRole, Set<Capability>> TABLE = new EnumMap<>(AccessRole.class);

    static {
        TABLE.put(AccessRole.SUPER_ADMIN, EnumSet.allOf(Capability.class));
        TABLE.put(AccessRole.ADMIN, EnumSet.allOf(Capability.class));
        TABLE.put(AccessRole.MANAGER, EnumSet.of(
                Capability.READ_BOOKING,
                Capability.CREATE_BOOKING,
                Capability.UPDATE_BOOKING,
                Capability.APPROVE_BOOKING,
                Capability.VIEW_REPORTS
        ));
        TABLE.put(AccessRole.TECHNICIAN, EnumSet.of(
                Capability.READ_BOOKING,
                Capability.CREATE_BOOKING,
                Capability.UPDATE_BOOKING,
                Capability.VIEW_REPORTS
        ));
        TABLE.put(AccessRole.USER, EnumSet.of(
                Capability.READ_BOOKING,
                Capability.CREATE_BOOKING
        ));
    }

    private CapabilityTable() {
    }

    public static Set<Capability> capabilitiesOf(AccessRole role) {
        Set<Capability> capabilities = TABLE.get(role);
        return capabilities == null ? Set.of() : Collections.unmodifiableSet(capabilities);
    }

    public static boolean has(AccessRole role, Capability capability) {
        return capabilitiesOf(role).contains(capability);
    }

    public static List<AccessRole> rolesWith(Capability capability) {
        return Arrays.stream(AccessRole.values())
                .filter(role -> has(role, capability))
                .toList();
    }
}
