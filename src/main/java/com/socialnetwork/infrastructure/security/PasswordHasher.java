package com.socialnetwork.infrastructure.security;

import org.mindrot.jbcrypt.BCrypt;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * BCrypt password hashing.
 */
@Component
public class PasswordHasher {

    private final int logRounds;

    public PasswordHasher(@Value("${app.security.bcrypt-rounds:10}") int logRounds) {
        this.logRounds = logRounds;
    }

    public String hash(String rawPassword) {
        return BCrypt.hashpw(rawPassword, BCrypt.gensalt(logRounds));
    }

    public boolean matches(String rawPassword, String hash) {
        if (rawPassword == null || hash == null) {
            return false;
        }
        try {
            return BCrypt.checkpw(rawPassword, hash);
        } catch (IllegalArgumentException e) {
            // malformed stored hash
            return false;
        }
    }
}
