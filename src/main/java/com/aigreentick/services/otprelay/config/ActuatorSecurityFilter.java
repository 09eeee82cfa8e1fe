package com.aigreentick.services.otprelay.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * The relay runs on a single public port (the callback sender must reach it),
 * so only /actuator/health is served there. Every other actuator path gets a 404.
 */
@Component
@Order(1)
@Slf4j
public class ActuatorSecurityFilter extends OncePerRequestFilter {

    private static final String ACTUATOR_PREFIX = "/actuator";
    private static final String HEALTH_PATH = "/actuator/health";

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        String path = request.getRequestURI();

        if (isBlockedActuatorPath(path)) {
            log.warn("Blocked actuator access attempt: path={}, ip={}", path, request.getRemoteAddr());
            response.setStatus(HttpStatus.NOT_FOUND.value());
            response.getWriter().write("{\"error\":\"Not Found\"}");
            return;
        }

        filterChain.doFilter(request, response);
    }

    boolean isBlockedActuatorPath(String path) {
        if (path == null || !path.startsWith(ACTUATOR_PREFIX)) {
            return false;
        }
        return !(path.equals(HEALTH_PATH) || path.startsWith(HEALTH_PATH + "/"));
    }
}
