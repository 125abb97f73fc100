package com.famly.backend.repository;

import com.famly.backend.model.Session;

import java.util.Optional;

public interface SessionRepository {

    Session save(Session session);

    Optional<Session> findById(String sessionId);

    void delete(String sessionId);
}
