package com.kmg.altbuddy.api;

import com.kmg.altbuddy.dto.AnalyzePageRequest;
import com.kmg.altbuddy.dto.BatchJobRequest;
import com.kmg.altbuddy.dto.JobStartedResponse;
import com.kmg.altbuddy.dto.JobView;
import com.kmg.altbuddy.model.JobSpec;
import com.kmg.altbuddy.model.SessionRecord;
import com.kmg.altbuddy.service.JobRegistry;
import com.kmg.altbuddy.service.JobRunner;
import com.kmg.altbuddy.service.SessionRegistry;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/jobs")
public class JobController {
    private final JobRunner jobRunner;
    private final JobRegistry jobRegistry;
    private final SessionRegistry sessionRegistry;
    private final SessionCookies sessionCookies;

    public JobController(
            JobRunner jobRunner,
            JobRegistry jobRegistry,
            SessionRegistry sessionRegistry,
            SessionCookies sessionCookies
    ) {
        this.jobRunner = jobRunner;
        this.jobRegistry = jobRegistry;
        this.sessionRegistry = sessionRegistry;
        this.sessionCookies = sessionCookies;
    }

    @PostMapping("/analyze-page")
    public ResponseEntity<JobStartedResponse> analyzePage(
            @Valid @RequestBody AnalyzePageRequest request,
            HttpServletRequest httpRequest
    ) {
        SessionRecord session = sessionRegistry.resolveOrCreate(sessionCookies.pick(request.session(), httpRequest));
        return started(request.toSpec(session.sessionId()));
    }

    @PostMapping("/batch")
    public ResponseEntity<JobStartedResponse> batch(
            @Valid @RequestBody BatchJobRequest request,
            HttpServletRequest httpRequest
    ) {
        SessionRecord session = sessionRegistry.resolveOrCreate(sessionCookies.pick(request.session(), httpRequest));
        return started(request.toSpec(session.sessionId()));
    }

    @GetMapping
    public List<JobView> listJobs() {
        return jobRegistry.list().stream().map(JobView::from).toList();
    }

    @GetMapping("/{id}")
    public JobView getJob(@PathVariable String id) {
        return JobView.from(jobRegistry.require(id));
    }

    private ResponseEntity<JobStartedResponse> started(JobSpec spec) {
        String jobId = jobRunner.submit(spec);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .header(HttpHeaders.SET_COOKIE, sessionCookies.issue(spec.sessionId()).toString())
                .body(JobStartedResponse.started(jobId, spec.sessionId()));
    }
}
