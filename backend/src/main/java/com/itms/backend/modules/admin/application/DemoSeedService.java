package com.itms.backend.modules.admin.application;

import java.util.List;
import java.util.Map;

import com.itms.backend.modules.audit.application.AuditLogService;
import com.itms.backend.modules.auth.domain.AccessRole;
import com.itms.backend.modules.auth.domain.AppUser;
import com.itms.backend.modules.auth.domain.AppUserStatus;
import com.itms.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.itms.backend.modules.resource.domain.BookableResource;
import com.itms.backend.modules.resource.domain.ResourceCategory;
import com.itms.backend.modules.resource.domain.ResourceStatus;
import com.itms.backend.modules.resource.infrastructure.persistence.BookableResourceRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Loads an administrator account and a handful of bookable resources into an empty database.
 * Existing rows are never touched, so running it twice is harmless.
 */
@Service
public class DemoSeedService {

    private static final Logger log = LoggerFactory.getLogger(DemoSeedService.class);

    private static final List<DemoResource> DEMO_RESOURCES = List.of(
            new DemoResource("Conference Room A", ResourceCategory.MEETING_ROOM, 12, "Building 1, 3F",
                    "Large meeting room with projector"),
            new DemoResource("Conference Room B", ResourceCategory.MEETING_ROOM, 6, "Building 1, 4F",
                    "Small meeting room with whiteboard"),
            new DemoResource("Company Van", ResourceCategory.TRANSPORTATION, 8, "Parking lot B2",
                    "8-seat van for site visits"),
            new DemoResource("Laptop Pool #1", ResourceCategory.IT_EQUIPMENT, 1, "IT desk",
                    "Loaner laptop with presentation tools"),
            new DemoResource("Network Toolkit", ResourceCategory.TOOL, 1, "Server room",
                    "Cable tester, crimper and spare patch cables")
    );

    private final AppUserRepository appUserRepository;
    private final BookableResourceRepository resourceRepository;
    private final PasswordEncoder passwordEncoder;
    private final AuditLogService auditLogService;
    private final String adminLoginId;
    private final String adminPassword;

    public DemoSeedService(
            AppUserRepository appUserRepository,
            BookableResourceRepository resourceRepository,
            PasswordEncoder passwordEncoder,
            AuditLogService auditLogService,
            @Value("${app.seed.admin-login-id:admin}") String adminLoginId,
            @Value("${app.seed.admin-password:}") String adminPassword
    ) {
        this.appUserRepository = appUserRepository;
        this.resourceRepository = resourceRepository;
        this.passwordEncoder = passwordEncoder;
        this.auditLogService = auditLogService;
        this.adminLoginId = adminLoginId;
        this.adminPassword = adminPassword;
    }

    @Transactional
    public SeedResult seed() {
        boolean adminCreated = seedAdmin();
        int resourcesCreated = seedResources();
        if (adminCreated || resourcesCreated > 0) {
            auditLogService.record(new AuditLogService.AuditLogCommand(
                    "DEMO_SEED_EXECUTED",
                    "DEMO_DATA",
                    "ITMS",
                    null,
                    null,
                    Map.of("adminCreated", adminCreated, "resourcesCreated", resourcesCreated)
            ));
        }
        log.info("Demo seed finished: adminCreated={}, resourcesCreated={}", adminCreated, resourcesCreated);
        return new SeedResult(adminCreated, resourcesCreated);
    }

    private boolean seedAdmin() {
        if (appUserRepository.findByLoginIdIgnoreCase(adminLoginId).isPresent()) {
            return false;
        }
        if (adminPassword == null || adminPassword.isBlank()) {
            log.warn("Skipping demo admin account: app.seed.admin-password is not set");
            return false;
        }
        AppUser admin = new AppUser();
        admin.setLoginId(adminLoginId);
        admin.setPasswordHash(passwordEncoder.encode(adminPassword));
        admin.setFullName("System Administrator");
        admin.setEmail(adminLoginId + "@itms.local");
        admin.setDepartment("IT");
        admin.setRole(AccessRole.SUPER_ADMIN);
        admin.setStatus(AppUserStatus.ACTIVE);
        appUserRepository.save(admin);
        return true;
    }

    private int seedResources() {
        int created = 0;
        for (DemoResource demo : DEMO_RESOURCES) {
            if (resourceRepository.existsByNameIgnoreCase(demo.name())) {
                continue;
            }
            BookableResource resource = new BookableResource();
            resource.setName(demo.name());
            resource.setCategory(demo.category());
            resource.setCapacity(demo.capacity());
            resource.setLocation(demo.location());
            resource.setDescription(demo.description());
            resource.setStatus(ResourceStatus.AVAILABLE);
            resourceRepository.save(resource);
            created++;
        }
        return created;
    }

    public record SeedResult(boolean adminCreated, int resourcesCreated) {
    }

    private record DemoResource(
            String name,
            ResourceCategory category,
            int capacity,
            String location,
            String description
    ) {
    }
}
