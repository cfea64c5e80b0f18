package com.itms.backend.modules.resource.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;

import com.itms.backend.modules.resource.domain.BookableResource;
import com.itms.backend.modules.resource.domain.ResourceCategory;
import com.itms.backend.modules.resource.domain.ResourceStatus;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

public interface BookableResourceRepository extends JpaRepository<BookableResource, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000"))
    @Query("select r from BookableResource r where r.id = :id")
    Optional<BookableResource> findByIdForUpdate(@Param("id") UUID id);

    @Query("""
            select r
              from BookableResource r
             where (:category is null or r.category = :category)
               and (:status is null or r.status = :status)
             order by r.category, lower(r.name)
            """)
    List<BookableResource> search(
            @Param("category") ResourceCategory category,
            @Param("status") ResourceStatus status
    );

    boolean existsByNameIgnoreCase(String name);

    long countByStatus(ResourceStatus status);
}
