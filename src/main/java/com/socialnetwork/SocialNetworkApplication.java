package com.socialnetwork;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Social Network Backend
 *
 * REST backend for a small social network on a single SQLite database.
 *
 * Architecture:
 * - Cookie sessions resolved by an MVC interceptor
 * - Profiles, follows and follow requests for private accounts
 * - Posts with three privacy levels, comments and votes
 * - Groups with invitations, join requests, posts, events and chat
 * - Direct messaging and notifications, consumed by polling
 * - Redis caching for counters, guarded by a circuit breaker
 * - Scheduled purge of expired sessions
 */
@SpringBootApplication
@EnableScheduling
public class SocialNetworkApplication {

    public static void main(String[] args) {
        SpringApplication.run(SocialNetworkApplication.class, args);
    }
}
