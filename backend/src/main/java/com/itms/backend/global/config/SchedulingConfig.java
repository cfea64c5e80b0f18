package com.itms.backend.global.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables the booking lifecycle sweep. Tests switch it off with {@code app.booking.sweep-enabled=false}.
 */
@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(value = "app.booking.sweep-enabled", havingValue = "true", matchIfMissing = true)
@EnableScheduling
public class SchedulingConfig {
}
