package com.itms.backend.modules.booking.infrastructure.persistence;

import java.util.UUID;
import java.util.function.Supplier;

import com.itms.backend.modules.booking.application.ResourceLock;
import com.itms.backend.modules.booking.domain.BookingException;
import com.itms.backend.modules.resource.infrastructure.persistence.BookableResourceRepository;

import jakarta.persistence.EntityManager;
import jakarta.persistence.LockTimeoutException;
import jakarta.persistence.PessimisticLockException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Serializes booking writes per resource with {@code SELECT ... FOR UPDATE} on the resource row.
 * The row lock lives until the surrounding transaction ends, so callers must already be in one.
 * Rule violations raised by the locked work leave the rollback decision to the caller.
 */
@Component
public class DatabaseResourceLock implements ResourceLock {

    private static final Logger log = LoggerFactory.getLogger(DatabaseResourceLock.class);
    static final String LOCK_TIMEOUT = "3s";

    private final BookableResourceRepository resourceRepository;
    private final EntityManager entityManager;

    public DatabaseResourceLock(BookableResourceRepository resourceRepository, EntityManager entityManager) {
        this.resourceRepository = resourceRepository;
        this.entityManager = entityManager;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY, noRollbackFor = BookingException.class)
    public <T> T withLock(UUID resourceId, Supplier<T> work) {
        try {
            // PostgreSQL ignores the JPA lock timeout hint
            entityManager.createNativeQuery("select set_config('lock_timeout', :timeout, true)")
                    .setParameter("timeout", LOCK_TIMEOUT)
                    .getSingleResult();
            resourceRepository.findByIdForUpdate(resourceId);
        } catch (PessimisticLockingFailureException | QueryTimeoutException
                 | PessimisticLockException | LockTimeoutException ex) {
            log.warn("Timed out waiting for lock on resource {}", resourceId);
            throw BookingException.storeUnavailable("resource " + resourceId + " is busy, retry shortly", ex);
        }
        return work.get();
    }
}
