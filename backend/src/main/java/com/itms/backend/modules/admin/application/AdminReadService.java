package com.itms.backend.modules.admin.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;

import com.itms.backend.modules.admin.presentation.dto.AdminDashboardResponse;
import com.itms.backend.modules.admin.presentation.dto.AdminDashboardResponse.SummaryCard;
import com.itms.backend.modules.booking.domain.BookingStatus;
import com.itms.backend.modules.booking.infrastructure.persistence.BookingRepository;
import com.itms.backend.modules.resource.domain.ResourceStatus;
import com.itms.backend.modules.resource.infrastructure.persistence.BookableResourceRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class AdminReadService {

    private final BookingRepository bookingRepository;
    private final BookableResourceRepository resourceRepository;
    private final Clock clock;

    public AdminReadService(
            BookingRepository bookingRepository,
            BookableResourceRepository resourceRepository,
            Clock clock
    ) {
        this.bookingRepository = bookingRepository;
        this.resourceRepository = resourceRepository;
        this.clock = clock;
    }

    public AdminDashboardResponse getDashboard() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        LocalDate today = LocalDate.now(clock);
        OffsetDateTime dayStart = today.atStartOfDay().atOffset(ZoneOffset.UTC);
        OffsetDateTime dayEnd = dayStart.plusDays(1);

        long totalBookings = bookingRepository.count();
        long pending = bookingRepository.countByStatus(BookingStatus.PENDING);
        long approved = bookingRepository.countByStatus(BookingStatus.APPROVED);
        EnumSet<BookingStatus> occupying = EnumSet.copyOf(BookingStatus.ACTIVE);
        occupying.add(BookingStatus.COMPLETED);
        long todayBookings = bookingRepository.countOverlapping(dayStart, dayEnd, occupying);
        long totalResources = resourceRepository.count();
        long availableResources = resourceRepository.countByStatus(ResourceStatus.AVAILABLE);

        List<SummaryCard> summary = List.of(
                new SummaryCard("pending", "승인 대기", String.valueOf(pending), "결재가 필요한 예약"),
                new SummaryCard("today", "오늘 예약", String.valueOf(todayBookings), today + " 사용 예정 및 사용 중"),
                new SummaryCard(
                        "resources",
                        "가용 자원",
                        availableResources + " / " + totalResources,
                        "예약 가능한 자원 수"
                )
        );

        return new AdminDashboardResponse(
                totalBookings,
                pending,
                approved,
                todayBookings,
                totalResources,
                availableResources,
                summary,
                now
        );
    }
}
