package com.kmg.altbuddy.service;

import java.util.UUID;
import java.util.regex.Pattern;

public final class RandomIds {
    // Letters, digits and dashes only, so an id can never name a path outside its parent.
    private static final Pattern SESSION_ID = Pattern.compile("^[a-z]+-[A-Za-z0-9-]{8,80}$");

    private RandomIds() {
    }

    public static String jobId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    public static String sessionId(String prefix, String stamp) {
        String random = UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        return prefix + "-" + stamp + "-" + random;
    }

    public static boolean isWellFormedSessionId(String id) {
        return id != null && SESSION_ID.matcher(id).matches();
    }
}
