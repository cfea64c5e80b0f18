package com.itms.backend.modules.booking.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;

import org.springframework.stereotype.Repository;
import org.springframework.util.CollectionUtils;

import com.itms.backend.modules.booking.domain.Booking;
import com.itms.backend.modules.booking.domain.BookingStatus;

@Repository
public class BookingRepositoryImpl implements BookingRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<Booking> searchBookings(UUID resourceId, UUID requesterId, BookingStatus status) {
        List<String> whereClauses = new ArrayList<>();
        Map<String, Object> params = new LinkedHashMap<>();

        if (resourceId != null) {
            whereClauses.add("b.resourceId = :resourceId");
            params.put("resourceId", resourceId);
        }
        if (requesterId != null) {
            whereClauses.add("b.requesterId = :requesterId");
            params.put("requesterId", requesterId);
        }
        if (status != null) {
            whereClauses.add("b.status = :status");
            params.put("status", status);
        }
        return execute(whereClauses, params, "b.startTime asc, b.endTime asc");
    }

    @Override
    public List<Booking> findOverlapping(UUID resourceId, OffsetDateTime rangeStart, OffsetDateTime rangeEnd,
                                         Collection<BookingStatus> statuses) {
        Objects.requireNonNull(rangeStart, "rangeStart must not be null");
        Objects.requireNonNull(rangeEnd, "rangeEnd must not be null");
        if (CollectionUtils.isEmpty(statuses)) {
            throw new IllegalArgumentException("At least one status must be provided");
        }

        List<String> whereClauses = new ArrayList<>();
        Map<String, Object> params = new LinkedHashMap<>();
        whereClauses.add("b.status in :statuses");
        params.put("statuses", statuses);
        // half-open overlap: s1 < e2 and s2 < e1
        whereClauses.add("b.startTime < :rangeEnd");
        params.put("rangeEnd", rangeEnd);
        whereClauses.add("b.endTime > :rangeStart");
        params.put("rangeStart", rangeStart);
        if (resourceId != null) {
            whereClauses.add("b.resourceId = :resourceId");
            params.put("resourceId", resourceId);
        }
        return execute(whereClauses, params, "b.startTime asc, b.endTime asc");
    }

    private List<Booking> execute(List<String> whereClauses, Map<String, Object> params, String orderBy) {
        StringBuilder jpql = new StringBuilder("select b from Booking b");
        if (!whereClauses.isEmpty()) {
            jpql.append(" where ").append(String.join(" and ", whereClauses));
        }
        jpql.append(" order by ").append(orderBy);

        TypedQuery<Booking> query = entityManager.createQuery(jpql.toString(), Booking.class);
        params.forEach(query::setParameter);
        return query.getResultList();
    }
}
