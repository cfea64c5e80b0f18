package com.itms.backend.modules.auth.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.itms.backend.modules.auth.domain.AccessRole;
import com.itms.backend.modules.auth.domain.AppUser;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AppUserRepository extends JpaRepository<AppUser, UUID> {

    @Query("select u from AppUser u where lower(u.loginId) = lower(:loginId)")
    Optional<AppUser> findByLoginIdIgnoreCase(@Param("loginId") String loginId);

    @Query("""
            select u.id
              from AppUser u
             where u.status = com.itms.backend.modules.auth.domain.AppUserStatus.ACTIVE
               and u.role in :roles
            """)
    List<UUID> findActiveUserIdsByRoleIn(@Param("roles") List<AccessRole> roles);
}
