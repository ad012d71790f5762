package com.ai.clinicbot.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Guards service-to-service endpoints with the {@code X-Internal-Secret} header. An empty
 * configured secret leaves the endpoints open (local development).
 */
@Component
public class InternalSecretInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(InternalSecretInterceptor.class);
    static final String HEADER = "X-Internal-Secret";

    @Value("${clinicbot.internal-secret:}")
    private String internalSecret;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws IOException {
        if (StringUtils.isEmpty(internalSecret)) return true;
        String presented = StringUtils.defaultString(request.getHeader(HEADER));
        if (MessageDigest.isEqual(presented.getBytes(StandardCharsets.UTF_8), internalSecret.getBytes(StandardCharsets.UTF_8))) {
            return true;
        }
        log.warn("Rejected {} {}: missing or wrong internal secret", request.getMethod(), request.getRequestURI());
        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write("{\"ok\":false,\"error\":\"Unauthorized\",\"errorCode\":\"UNAUTHORIZED\"}");
        return false;
    }
}
