package com.itms.backend.modules.booking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.matchesPattern;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.anonymous;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.itms.backend.modules.auth.domain.AccessRole;
import com.itms.backend.support.AbstractPostgresIntegrationTest;
import com.itms.backend.support.TestUserFactory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.ResultMatcher;

@SpringBootTest
@AutoConfigureMockMvc
class BookingIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String PASSWORD = "secret1!";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestUserFactory testUserFactory;

    private String adminToken;
    private String managerToken;
    private String aliceToken;
    private String bobToken;
    private OffsetDateTime slotStart;

    @BeforeEach
    void setUp() throws Exception {
        testUserFactory.ensureUser("it-admin", PASSWORD, AccessRole.ADMIN);
        testUserFactory.ensureUser("it-manager", PASSWORD, AccessRole.MANAGER);
        testUserFactory.ensureUser("alice", PASSWORD, AccessRole.USER);
        testUserFactory.ensureUser("bob", PASSWORD, AccessRole.USER);
        adminToken = login("it-admin");
        managerToken = login("it-manager");
        aliceToken = login("alice");
        bobToken = login("bob");
        slotStart = OffsetDateTime.now(ZoneOffset.UTC).plusDays(3).truncatedTo(ChronoUnit.HOURS);
    }

    @Test
    @DisplayName("요청-승인-확정 흐름과 겹치는 예약 거절")
    void requestApproveConfirmAndRejectOverlap() throws Exception {
        UUID resourceId = createResource("Room 1");
        UUID bookingId = createBooking(aliceToken, resourceId, slotStart, slotStart.plusHours(1))
                .andExpect(status().isCreated())
                .andExpect(header().exists("Location"))
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.bookingNumber").value(matchesPattern("BK\\d{8}-[2-9A-Z]{6}")))
                .andReturnId();

        mockMvc.perform(get("/notifications").header("Authorization", bearer(managerToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.unreadCount").value(1))
                .andExpect(jsonPath("$.items[0].kindCode").value("BOOKING_CREATED"));

        createBooking(bobToken, resourceId, slotStart.plusMinutes(30), slotStart.plusMinutes(90))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("BOOKING_CONFLICT"));

        mockMvc.perform(post("/bookings/{id}/approve", bookingId).header("Authorization", bearer(aliceToken)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("APPROVER_ONLY"));

        mockMvc.perform(post("/bookings/{id}/approve", bookingId)
                        .header("Authorization", bearer(managerToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"note\": \"ok\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("APPROVED"))
                .andExpect(jsonPath("$.approvalNote").value("ok"))
                .andExpect(jsonPath("$.rejectionReason").doesNotExist());

        mockMvc.perform(post("/bookings/{id}/confirm", bookingId).header("Authorization", bearer(managerToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CONFIRMED"));

        mockMvc.perform(get("/resources/{id}/availability", resourceId)
                        .header("Authorization", bearer(bobToken))
                        .param("start", slotStart.plusHours(1).toString())
                        .param("end", slotStart.plusHours(2).toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.free").value(true));

        mockMvc.perform(get("/resources/{id}/free-busy", resourceId)
                        .header("Authorization", bearer(bobToken))
                        .param("start", slotStart.minusHours(1).toString())
                        .param("end", slotStart.plusHours(2).toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.bookable").value(true))
                .andExpect(jsonPath("$.slots.length()").value(3))
                .andExpect(jsonPath("$.slots[1].busy").value(true));

        mockMvc.perform(get("/bookings/{id}/history", bookingId).header("Authorization", bearer(aliceToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(3))
                .andExpect(jsonPath("$[0].actionType").value("BOOKING_CREATED"));
    }

    @Test
    void cancelledBookingFreesTheSlot() throws Exception {
        UUID resourceId = createResource("Projector A");
        UUID bookingId = createBooking(aliceToken, resourceId, slotStart, slotStart.plusHours(2))
                .andExpect(status().isCreated())
                .andReturnId();

        mockMvc.perform(post("/bookings/{id}/cancel", bookingId).header("Authorization", bearer(bobToken)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("NOT_BOOKING_OWNER"));

        mockMvc.perform(post("/bookings/{id}/cancel", bookingId).header("Authorization", bearer(aliceToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"));

        UUID bobsBookingId = createBooking(bobToken, resourceId, slotStart, slotStart.plusHours(2))
                .andExpect(status().isCreated())
                .andReturnId();

        mockMvc.perform(get("/bookings/{id}", bookingId).header("Authorization", bearer(bobToken)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("BOOKING_ACCESS_DENIED"));

        mockMvc.perform(get("/resources/{id}/bookings", resourceId).header("Authorization", bearer(bobToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].id").value(bobsBookingId.toString()));

        mockMvc.perform(get("/resources/{id}/bookings", resourceId).header("Authorization", bearer(managerToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].id", containsInAnyOrder(bookingId.toString(), bobsBookingId.toString())));
    }

    @Test
    @DisplayName("동시에 들어온 겹치는 예약 요청 중 하나만 성공")
    void concurrentOverlappingRequestsAdmitExactlyOne() throws Exception {
        UUID resourceId = createResource("Room 7");
        int attempts = 8;
        ExecutorService executor = Executors.newFixedThreadPool(attempts);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<MvcResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < attempts; i++) {
                String token = i % 2 == 0 ? aliceToken : bobToken;
                OffsetDateTime from = slotStart.plusMinutes(i * 5L);
                futures.add(executor.submit(() -> {
                    start.await();
                    return createBooking(token, resourceId, from, from.plusHours(1)).andReturn();
                }));
            }
            start.countDown();

            int created = 0;
            int conflicts = 0;
            for (Future<MvcResult> future : futures) {
                MvcResult result = future.get(30, TimeUnit.SECONDS);
                int httpStatus = result.getResponse().getStatus();
                if (httpStatus == 201) {
                    created++;
                } else if (httpStatus == 409 && "BOOKING_CONFLICT".equals(objectMapper
                        .readTree(result.getResponse().getContentAsString()).path("code").asText())) {
                    conflicts++;
                }
            }

            assertThat(created).isEqualTo(1);
            assertThat(conflicts).isEqualTo(attempts - 1);
            assertThat(jdbcTemplate.queryForObject(
                    "SELECT count(*) FROM booking WHERE resource_id = ?", Long.class, resourceId)).isEqualTo(1L);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void retiredResourceRefusesNewBookings() throws Exception {
        UUID resourceId = createResource("Old laptop");

        mockMvc.perform(post("/admin/resources/{id}/retire", resourceId).header("Authorization", bearer(adminToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.bookable").value(false));

        createBooking(aliceToken, resourceId, slotStart, slotStart.plusHours(1))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("RESOURCE_UNAVAILABLE"));
    }

    @Test
    void invalidIntervalIsUnprocessable() throws Exception {
        UUID resourceId = createResource("Van 2");

        createBooking(aliceToken, resourceId, slotStart, slotStart)
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("INVALID_INTERVAL"));
    }

    @Test
    void requestsWithoutTokenAreUnauthorized() throws Exception {
        mockMvc.perform(get("/bookings").with(anonymous()))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void databaseRejectsOverlappingActiveRowsWrittenDirectly() throws Exception {
        UUID resourceId = createResource("Room 9");
        UUID requesterId = jdbcTemplate.queryForObject(
                "SELECT id FROM app_user WHERE login_id = 'alice'", UUID.class);
        String insert = """
                INSERT INTO booking (id, booking_number, resource_id, requester_id, start_time, end_time, status,
                                     title, version, created_at, updated_at)
                VALUES (?, substr(md5(random()::text), 1, 20), ?, ?, ?, ?, ?, 'direct', 0, now(), now())
                """;
        jdbcTemplate.update(insert, UUID.randomUUID(), resourceId, requesterId,
                slotStart, slotStart.plusHours(1), "CONFIRMED");
        jdbcTemplate.update(insert, UUID.randomUUID(), resourceId, requesterId,
                slotStart.plusHours(1), slotStart.plusHours(2), "PENDING");

        assertThatThrownBy(() -> jdbcTemplate.update(insert, UUID.randomUUID(), resourceId, requesterId,
                slotStart.plusMinutes(30), slotStart.plusMinutes(45), "APPROVED"))
                .isInstanceOf(DataAccessException.class)
                .hasMessageContaining("ex_booking_active_no_overlap");

        jdbcTemplate.update(insert, UUID.randomUUID(), resourceId, requesterId,
                slotStart.plusMinutes(30), slotStart.plusMinutes(45), "REJECTED");
        assertThat(jdbcTemplate.queryForObject(
                "SELECT count(*) FROM booking WHERE resource_id = ?", Long.class, resourceId)).isEqualTo(3L);
    }

    private String login(String loginId) throws Exception {
        MvcResult result = mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "loginId": "%s",
                                  "password": "%s"
                                }
                                """.formatted(loginId, PASSWORD)))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString())
                .path("tokens").path("accessToken").asText();
    }

    private UUID createResource(String name) throws Exception {
        MvcResult result = mockMvc.perform(post("/admin/resources")
                        .header("Authorization", bearer(adminToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "name": "%s",
                                  "category": "MEETING_ROOM",
                                  "capacity": 8,
                                  "location": "HQ 3F"
                                }
                                """.formatted(name)))
                .andExpect(status().isCreated())
                .andReturn();
        return UUID.fromString(objectMapper.readTree(result.getResponse().getContentAsString()).path("id").asText());
    }

    private BookingCall createBooking(String token, UUID resourceId, OffsetDateTime start, OffsetDateTime end)
            throws Exception {
        return new BookingCall(mockMvc.perform(post("/bookings")
                .header("Authorization", bearer(token))
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {
                          "resourceId": "%s",
                          "startTime": "%s",
                          "endTime": "%s",
                          "title": "weekly sync"
                        }
                        """.formatted(resourceId, start, end))));
    }

    private static String bearer(String token) {
        return "Bearer " + token;
    }

    private final class BookingCall {

        private final ResultActions actions;

        private BookingCall(ResultActions actions) {
            this.actions = actions;
        }

        BookingCall andExpect(ResultMatcher matcher) throws Exception {
            actions.andExpect(matcher);
            return this;
        }

        MvcResult andReturn() {
            return actions.andReturn();
        }

        UUID andReturnId() throws Exception {
            JsonNode body = objectMapper.readTree(actions.andReturn().getResponse().getContentAsString());
            return UUID.fromString(body.path("id").asText());
        }
    }
}
