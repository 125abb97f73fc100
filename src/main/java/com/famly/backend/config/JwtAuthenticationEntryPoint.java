package com.famly.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class JwtAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) throws IOException {

        String authHeader = request.getHeader("Authorization");
        boolean hasJwtToken = authHeader != null && authHeader.startsWith("Bearer ");

        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType("application/json;charset=UTF-8");

        // Same shape as the controller error bodies
        Map<String, Object> errorResponse = new LinkedHashMap<>();
        errorResponse.put("error", "UNAUTHORIZED");
        errorResponse.put("message", hasJwtToken
            ? "Session expired or invalid. Please log in again."
            : "You must be logged in!");
        errorResponse.put("timestamp", Instant.now().toEpochMilli());

        response.getWriter().write(objectMapper.writeValueAsString(errorResponse));
    }
}
