package com.famly.backend.service;

import com.famly.backend.config.JwtAuthenticationFilter;
import com.famly.backend.exception.NotAllowedException;
import com.famly.backend.model.Session;
import com.famly.backend.repository.SessionRepository;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;

/**
 * Login sessions. Each one is a stored record plus a bearer token naming it.
 */
@Service
public class SessionService {

    private static final Logger logger = LoggerFactory.getLogger(SessionService.class);

    @Value("${famly.session.ttl-minutes:1440}")
    private long ttlMinutes;

    @Autowired
    private SessionRepository sessionRepository;

    @Autowired
    private JwtService jwtService;

    /**
     * @return a signed access token for the new session
     */
    public String start(String userId) {
        Instant expiresAt = Instant.now().plus(Duration.ofMinutes(ttlMinutes));
        Session session = sessionRepository.save(new Session(userId, expiresAt));
        logger.info("Started session {} for user {}", session.getSessionId(), userId);
        return jwtService.generateToken(userId, session.getSessionId(), expiresAt);
    }

    public void end(String sessionId) {
        if (sessionId == null) {
            return;
        }
        sessionRepository.delete(sessionId);
        logger.info("Ended session {}", sessionId);
    }

    public String getSessionId(HttpServletRequest request) {
        Object sessionId = request.getAttribute(JwtAuthenticationFilter.SESSION_ID_ATTRIBUTE);
        return sessionId != null ? sessionId.toString() : null;
    }

    public void isLoggedOut(HttpServletRequest request) {
        if (request.getAttribute(JwtAuthenticationFilter.USER_ID_ATTRIBUTE) != null) {
            throw new NotAllowedException("You must be logged out!");
        }
    }

    public long getTtlSeconds() {
        return Duration.ofMinutes(ttlMinutes).getSeconds();
    }
}
