package com.kmg.altbuddy.api;

import com.kmg.altbuddy.dto.ClearSessionResponse;
import com.kmg.altbuddy.dto.SessionListResponse;
import com.kmg.altbuddy.dto.SessionView;
import com.kmg.altbuddy.model.SessionRecord;
import com.kmg.altbuddy.model.SessionType;
import com.kmg.altbuddy.service.SessionRegistry;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
public class SessionController {
    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private final SessionRegistry sessionRegistry;
    private final SessionCookies sessionCookies;

    public SessionController(SessionRegistry sessionRegistry, SessionCookies sessionCookies) {
        this.sessionRegistry = sessionRegistry;
        this.sessionCookies = sessionCookies;
    }

    @GetMapping("/session")
    public ResponseEntity<SessionView> session(HttpServletRequest request) {
        SessionRecord session = sessionRegistry.resolveOrCreate(sessionCookies.read(request));
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, sessionCookies.issue(session.sessionId()).toString())
                .body(SessionView.of(session, sessionRegistry.pathsOf(session.sessionId())));
    }

    @PostMapping("/clear-session")
    public ResponseEntity<ClearSessionResponse> clearSession(HttpServletRequest request) {
        String sessionId = sessionCookies.read(request);
        ClearSessionResponse body;
        if (sessionRegistry.exists(sessionId)) {
            body = ClearSessionResponse.cleared(sessionRegistry.clear(sessionId));
            log.info("Session {} cleared on request: {} file(s), {} folder(s)",
                    sessionId, body.filesDeleted(), body.foldersDeleted());
        } else {
            body = ClearSessionResponse.noSession();
        }
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, sessionCookies.expire().toString())
                .body(body);
    }

    @GetMapping("/sessions")
    public SessionListResponse sessions(@RequestParam(value = "type", required = false) String type) {
        SessionType filter = type == null || type.isBlank() ? null : SessionType.fromName(type);
        List<SessionView> sessions = sessionRegistry.list(filter).stream()
                .map(session -> SessionView.of(session, sessionRegistry.pathsOf(session.sessionId())))
                .toList();
        return new SessionListResponse(sessionRegistry.countByType(), sessions);
    }
}
