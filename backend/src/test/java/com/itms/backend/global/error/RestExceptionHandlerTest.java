package com.itms.backend.global.error;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.UUID;

import com.itms.backend.modules.booking.domain.BookingException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

class RestExceptionHandlerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new FailingController())
                .setControllerAdvice(new RestExceptionHandler())
                .build();
    }

    @Test
    void bookingConflictBecomesProblemBody() throws Exception {
        mockMvc.perform(get("/fail/conflict"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("BOOKING_CONFLICT"))
                .andExpect(jsonPath("$.type").value("urn:problem:itms:booking_conflict"))
                .andExpect(jsonPath("$.instance").value("/fail/conflict"))
                .andExpect(header().doesNotExist("Retry-After"));
    }

    @Test
    void storeFailureCarriesRetryAfter() throws Exception {
        mockMvc.perform(get("/fail/store"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("STORE_UNAVAILABLE"))
                .andExpect(header().string("Retry-After", "1"));

        mockMvc.perform(get("/fail/lock"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(header().string("Retry-After", "1"));
    }

    @Test
    void optimisticLockFailureIsConflict() throws Exception {
        mockMvc.perform(get("/fail/stale"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("CONCURRENT_MODIFICATION"));
    }

    @Test
    void unexpectedErrorHidesDetails() throws Exception {
        mockMvc.perform(get("/fail/boom"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.detail").value("unexpected server error"));
    }

    @RestController
    static class FailingController {

        @GetMapping("/fail/conflict")
        void conflict() {
            throw BookingException.conflict(UUID.randomUUID());
        }

        @GetMapping("/fail/store")
        void store() {
            throw BookingException.storeUnavailable("lock timeout", null);
        }

        @GetMapping("/fail/lock")
        void lock() {
            throw new CannotAcquireLockException("could not obtain lock");
        }

        @GetMapping("/fail/stale")
        void stale() {
            throw new OptimisticLockingFailureException("row was updated");
        }

        @GetMapping("/fail/boom")
        void boom() {
            throw new IllegalStateException("secret internals");
        }
    }
}
