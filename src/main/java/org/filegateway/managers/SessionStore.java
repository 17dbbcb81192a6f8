package org.filegateway.managers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.filegateway.utils.GatewayLogger;

/**
 * Bearer token sessions.
 * Tokens expire a fixed time after login; expired entries are evicted
 * when they are next looked up. There is no background sweep.
 */
public class SessionStore {

    private static final String TAG = "SESSION";

    /**
     * One live session
     */
    public static class Session {
        public final String token;
        public final String username;
        public final Instant expiresAt;

        public Session(String token, String username, Instant expiresAt) {
            this.token = token;
            this.username = username;
            this.expiresAt = expiresAt;
        }

        public boolean isExpired(Instant now) {
            return expiresAt.isBefore(now);
        }
    }

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public SessionStore(Duration ttl) {
        this(ttl, Clock.systemUTC());
    }

    public SessionStore(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * Creates a session for the user and returns its token
     */
    public String issue(String username) {
        String token = UUID.randomUUID().toString().replace("-", "");
        sessions.put(token, new Session(token, username, clock.instant().plus(ttl)));
        return token;
    }

    /**
     * Returns the username bound to the token, or null if the token is
     * unknown or expired. Never extends the session.
     */
    public String validate(String token) {
        if (token == null || token.isEmpty()) {
            return null;
        }

        Session session = sessions.get(token);
        if (session == null) {
            return null;
        }

        if (session.isExpired(clock.instant())) {
            // conditional remove: a concurrent revoke may already have taken it
            if (sessions.remove(token, session)) {
                GatewayLogger.info(TAG, "Session expired: " + session.username);
            }
            return null;
        }
        return session.username;
    }

    /**
     * Removes the session. Unknown or null tokens are ignored.
     *
     * @return the username of the removed session, or null
     */
    public String revoke(String token) {
        if (token == null) {
            return null;
        }
        Session session = sessions.remove(token);
        return session != null ? session.username : null;
    }

    public int size() {
        return sessions.size();
    }
}
