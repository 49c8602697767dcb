package com.kmg.altbuddy.api;

import com.kmg.altbuddy.config.AltBuddyProperties;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;
import org.springframework.web.util.WebUtils;

import java.time.Duration;

@Component
public class SessionCookies {
    private final String name;
    private final Duration maxAge;

    public SessionCookies(AltBuddyProperties properties) {
        this.name = properties.getSessions().getCookieName();
        this.maxAge = properties.getSessions().getMaxAge();
    }

    public String read(HttpServletRequest request) {
        Cookie cookie = WebUtils.getCookie(request, name);
        return cookie == null ? null : cookie.getValue();
    }

    // An explicit id in the request body wins over the cookie.
    public String pick(String explicit, HttpServletRequest request) {
        if (explicit != null && !explicit.isBlank()) {
            return explicit.trim();
        }
        return read(request);
    }

    public ResponseCookie issue(String sessionId) {
        return ResponseCookie.from(name, sessionId)
                .httpOnly(true)
                .sameSite("Lax")
                .path("/")
                .maxAge(maxAge)
                .build();
    }

    public ResponseCookie expire() {
        return ResponseCookie.from(name, "")
                .httpOnly(true)
                .sameSite("Lax")
                .path("/")
                .maxAge(Duration.ZERO)
                .build();
    }
}
