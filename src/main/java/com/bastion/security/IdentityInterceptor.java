package com.bastion.security;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Binds the caller's identity to the request thread.
 *
 * Authentication happens upstream; this interceptor only reads what the
 * gateway forwards:
 * - {@value #USER_ID_HEADER}: numeric user id, absent for anonymous calls
 * - client IP from {@code X-Forwarded-For} (first hop), then
 *   {@code X-Real-IP}, then {@code CF-Connecting-IP}, then the socket address
 *
 * A non-numeric user id is rejected with 400.
 */
@Component
public class IdentityInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(IdentityInterceptor.class);

    public static final String USER_ID_HEADER = "X-User-Id";

    private static final String[] CLIENT_IP_HEADERS = {"X-Forwarded-For", "X-Real-IP", "CF-Connecting-IP"};

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws Exception {

        Long userId = null;
        String rawUserId = request.getHeader(USER_ID_HEADER);
        if (rawUserId != null && !rawUserId.isBlank()) {
            try {
                userId = Long.parseLong(rawUserId.trim());
            } catch (NumberFormatException e) {
                log.warn("Rejecting request {} {} with malformed {} header: {}",
                    request.getMethod(), request.getRequestURI(), USER_ID_HEADER, rawUserId);
                response.setStatus(HttpServletResponse.SC_BAD_REQUEST);
                response.setContentType("application/json");
                response.getWriter().write("{\"error\":\"Invalid user id header\",\"code\":\"INVALID_ARGUMENT\"}");
                return false;
            }
        }

        IdentityContext.set(new RequestIdentity(userId, resolveClientIp(request)));
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response,
                                Object handler, Exception ex) throws Exception {
        IdentityContext.clear();
    }

    static String resolveClientIp(HttpServletRequest request) {
        for (String header : CLIENT_IP_HEADERS) {
            String value = request.getHeader(header);
            if (value != null && !value.isBlank()) {
                String first = value.split(",")[0].trim();
                if (!first.isEmpty()) {
                    return first;
                }
            }
        }
        return request.getRemoteAddr();
    }
}
