package com.kmg.altbuddy.service;

import com.kmg.altbuddy.config.AltBuddyProperties;
import com.kmg.altbuddy.model.SweepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Periodic sweep reclaiming idle sessions. Jobs are not swept here; the job registry
 * drops finished jobs lazily on read.
 */
@Component
@ConditionalOnProperty(prefix = "altbuddy.sessions", name = "janitor-enabled", havingValue = "true", matchIfMissing = true)
public class SessionJanitor {
    private static final Logger log = LoggerFactory.getLogger(SessionJanitor.class);

    private final SessionRegistry sessionRegistry;
    private final Duration maxAge;

    public SessionJanitor(SessionRegistry sessionRegistry, AltBuddyProperties properties) {
        this.sessionRegistry = sessionRegistry;
        this.maxAge = properties.getSessions().getMaxAge();
    }

    @Scheduled(
            initialDelayString = "${altbuddy.sessions.sweep-initial-delay-ms:60000}",
            fixedDelayString = "${altbuddy.sessions.sweep-interval-ms:3600000}"
    )
    public void sweep() {
        try {
            SweepResult result = sessionRegistry.expireOlderThan(maxAge);
            if (result.removed() > 0 || result.failed() > 0) {
                log.info("Session sweep removed {} session(s), {} failed", result.removed(), result.failed());
            }
        } catch (Exception e) {
            log.error("Session sweep failed: {}", e.getMessage(), e);
        }
    }
}
