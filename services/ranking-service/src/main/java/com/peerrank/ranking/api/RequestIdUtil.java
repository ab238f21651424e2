package com.peerrank.ranking.api;

import jakarta.servlet.http.HttpServletRequest;
import java.util.UUID;

public final class RequestIdUtil {
    static final int MAX_ID_LENGTH = 128;

    private RequestIdUtil() {
    }

    public static String resolveOrGenerate(String value) {
        if (value == null) {
            return UUID.randomUUID().toString();
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty() || trimmed.length() > MAX_ID_LENGTH) {
            return UUID.randomUUID().toString();
        }
        return trimmed;
    }

    public static String resolveOrGenerate(HttpServletRequest request, String headerName) {
        return resolveOrGenerate(request.getHeader(headerName));
    }
}
