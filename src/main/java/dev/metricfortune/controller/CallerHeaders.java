package dev.metricfortune.controller;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * The upstream auth layer identifies the caller with {@code X-User-Id}.
 */
final class CallerHeaders {

    static final String USER_ID = "X-User-Id";

    private CallerHeaders() {
    }

    static String requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "error.missing_user");
        }
        return userId.trim();
    }
}
