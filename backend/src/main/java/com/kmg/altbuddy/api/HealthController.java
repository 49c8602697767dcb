package com.kmg.altbuddy.api;

import com.kmg.altbuddy.dto.HealthResponse;
import com.kmg.altbuddy.service.JobRegistry;
import com.kmg.altbuddy.service.SessionRegistry;
import com.kmg.altbuddy.service.TimeService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/health")
public class HealthController {
    private final JobRegistry jobRegistry;
    private final SessionRegistry sessionRegistry;
    private final TimeService timeService;

    public HealthController(JobRegistry jobRegistry, SessionRegistry sessionRegistry, TimeService timeService) {
        this.jobRegistry = jobRegistry;
        this.sessionRegistry = sessionRegistry;
        this.timeService = timeService;
    }

    @GetMapping
    public HealthResponse health() {
        return new HealthResponse(
                "healthy",
                jobRegistry.activeCount(),
                sessionRegistry.countByType(),
                timeService.now().toString()
        );
    }
}
