package com.famly.backend.config;

import com.famly.backend.model.Session;
import com.famly.backend.repository.SessionRepository;
import com.famly.backend.service.JwtService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Optional;

/**
 * Authenticates bearer tokens. A token counts only while the session it names is still stored,
 * so logging out revokes it before its expiry.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(JwtAuthenticationFilter.class);

    public static final String USER_ID_ATTRIBUTE = "userId";
    public static final String SESSION_ID_ATTRIBUTE = "sessionId";

    @Autowired
    private JwtService jwtService;

    @Autowired
    private SessionRepository sessionRepository;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String authHeader = request.getHeader("Authorization");

        if (authHeader != null && authHeader.startsWith("Bearer ")) {
            String token = authHeader.substring(7);

            if (jwtService.isTokenValid(token)) {
                String userId = jwtService.extractUserId(token);
                String sessionId = jwtService.extractSessionId(token);

                if (isLiveSession(sessionId, userId)) {
                    UsernamePasswordAuthenticationToken authentication =
                        new UsernamePasswordAuthenticationToken(userId, null, new ArrayList<>());
                    SecurityContextHolder.getContext().setAuthentication(authentication);

                    request.setAttribute(USER_ID_ATTRIBUTE, userId);
                    request.setAttribute(SESSION_ID_ATTRIBUTE, sessionId);
                } else {
                    logger.warn("Token names an ended session for request: {} {}",
                        request.getMethod(), request.getRequestURI());
                }
            } else {
                logger.warn("Invalid or expired JWT token for request: {} {}",
                    request.getMethod(), request.getRequestURI());
            }
            // If token is invalid, don't set authentication - let AuthenticationEntryPoint handle it
        }

        filterChain.doFilter(request, response);
    }

    private boolean isLiveSession(String sessionId, String userId) {
        if (sessionId == null) {
            return false;
        }
        Optional<Session> session = sessionRepository.findById(sessionId);
        return session.isPresent()
            && !session.get().isExpired()
            && userId.equals(session.get().getUserId());
    }
}
