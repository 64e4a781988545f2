package com.herzen.activity.api;

import com.herzen.activity.exception.UnauthenticatedException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Rejects activity requests without a caller before the body is read or validated,
 * so an unauthenticated batch is always answered with 401 whatever its content.
 */
@Component
public class CallerIdentityInterceptor implements HandlerInterceptor {

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String callerId = request.getHeader(ActivityController.USER_HEADER);
        if (callerId == null || callerId.isBlank()) {
            throw new UnauthenticatedException("Caller identity is required");
        }
        return true;
    }
}
