package com.slipsafe.claims.api;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Request provenance recorded with every verification attempt.
 */
final class ClientInfo {

    private ClientInfo() {}

    static String clientIp(HttpServletRequest request) {
        String xff = request.getHeader("X-Forwarded-For");
        if (xff != null && !xff.isBlank()) {
            return xff.split(",")[0].trim();
        }
        String xri = request.getHeader("X-Real-IP");
        if (xri != null && !xri.isBlank()) return xri.trim();
        return request.getRemoteAddr();
    }

    static String userAgent(HttpServletRequest request) {
        return request.getHeader("User-Agent");
    }
}
