package com.famly.backend.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Service;

/**
 * BCrypt hashing for account passwords at the cost set by famly.security.bcrypt-strength.
 */
@Service
public class PasswordService {

    private static final int MIN_STRENGTH = 4;
    private static final int MAX_STRENGTH = 31;

    private final BCryptPasswordEncoder encoder;
    private final int strength;

    public PasswordService(@Value("${famly.security.bcrypt-strength:10}") int strength) {
        if (strength < MIN_STRENGTH || strength > MAX_STRENGTH) {
            throw new IllegalArgumentException("BCrypt strength must be between " + MIN_STRENGTH
                + " and " + MAX_STRENGTH + " (was " + strength + ")");
        }
        this.strength = strength;
        this.encoder = new BCryptPasswordEncoder(strength);
    }

    public String hash(String plainPassword) {
        return encoder.encode(plainPassword);
    }

    public boolean matches(String plainPassword, String storedHash) {
        if (plainPassword == null || storedHash == null || storedHash.isEmpty()) {
            return false;
        }
        return encoder.matches(plainPassword, storedHash);
    }

    /**
     * True when the stored hash was made with a lower cost than the configured one.
     */
    public boolean needsRehash(String storedHash) {
        return storedHash != null && encoder.upgradeEncoding(storedHash);
    }

    public int getStrength() {
        return strength;
    }
}
