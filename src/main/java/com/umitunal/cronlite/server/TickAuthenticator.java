package com.umitunal.cronlite.server;

import java.security.MessageDigest;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Decides whether a tick request comes from the configured timer service.
 * <p>
 * With a shared secret configured the request must carry {@code Authorization: Bearer <secret>}.
 * Without one, only requests carrying the scheduler header are accepted; that header is set by
 * the managed timer service and is not a credential, so it must not be relied on when the
 * endpoint is reachable from untrusted networks.
 */
public class TickAuthenticator {
    public static final String SCHEDULER_HEADER = "X-Cloudscheduler";
    private static final String BEARER_PREFIX = "Bearer ";

    private final byte[] secret;

    /**
     * @param secret shared secret, or null/empty to trust the scheduler header instead
     */
    public TickAuthenticator(String secret) {
        this.secret = secret == null || secret.isEmpty() ? null : secret.getBytes(UTF_8);
    }

    public boolean requiresSecret() {
        return secret != null;
    }

    /**
     * @param authorization value of the Authorization header, may be null
     * @param schedulerHeader value of the scheduler header, may be null
     */
    public boolean isAuthorized(String authorization, String schedulerHeader) {
        if (secret == null) {
            return schedulerHeader != null && schedulerHeader.trim().equalsIgnoreCase("true");
        }
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
            return false;
        }
        byte[] presented = authorization.substring(BEARER_PREFIX.length()).trim().getBytes(UTF_8);
        return MessageDigest.isEqual(presented, secret);
    }
}
