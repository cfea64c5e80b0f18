package com.itms.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    private MockEnvironment environment;

    @BeforeEach
    void setUp() {
        environment = new MockEnvironment()
                .withProperty("spring.datasource.url", "jdbc:postgresql://localhost:5432/itms")
                .withProperty("jwt.secret", EnvironmentValidator.DEFAULT_DEV_SECRET)
                .withProperty("jwt.expiration", "3600000")
                .withProperty("app.cors.allowed-origins", "http://localhost:5173")
                .withProperty("app.booking.sweep-interval", "PT1M");
    }

    @Test
    void validConfigurationPasses() {
        assertThat(new EnvironmentValidator(environment).collectProblems()).isEmpty();
    }

    @Test
    void reportsMissingAndMalformedValues() {
        environment.setProperty("jwt.secret", " ");
        environment.setProperty("jwt.expiration", "1000");
        environment.setProperty("app.booking.sweep-interval", "every minute");

        assertThat(new EnvironmentValidator(environment).collectProblems())
                .containsExactlyInAnyOrder(
                        "jwt.secret is required",
                        "jwt.expiration must be between 300000 and 86400000 milliseconds",
                        "app.booking.sweep-interval must be an ISO-8601 duration"
                );
    }

    @Test
    void productionRefusesDevelopmentSecret() {
        environment.setActiveProfiles("prod");

        assertThatThrownBy(() -> new EnvironmentValidator(environment).validateEnvironment())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("jwt.secret must be replaced");
    }
}
