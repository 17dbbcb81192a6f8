package org.filegateway.accounts;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.filegateway.utils.GatewayLogger;

/**
 * In-memory account store with hashed passwords and a time-boxed lockout
 * after repeated failed logins.
 */
public class LocalUserStore implements CredentialVerifier, UserRegistry {

    private static final String TAG = "ACCOUNTS";
    private static final int MAX_USERNAME_LENGTH = 100;

    private final Map<String, String> passwordHashes = new ConcurrentHashMap<>();
    private final Map<String, Integer> failedAttempts = new ConcurrentHashMap<>();
    private final Map<String, Instant> lockedUntil = new ConcurrentHashMap<>();
    private final int maxFailedAttempts;
    private final Duration lockoutDuration;
    private final Clock clock;

    public LocalUserStore(int maxFailedAttempts, Duration lockoutDuration) {
        this(maxFailedAttempts, lockoutDuration, Clock.systemUTC());
    }

    public LocalUserStore(int maxFailedAttempts, Duration lockoutDuration, Clock clock) {
        this.maxFailedAttempts = maxFailedAttempts;
        this.lockoutDuration = lockoutDuration;
        this.clock = clock;
    }

    public static boolean isValidUsername(String username) {
        return username != null
            && username.length() <= MAX_USERNAME_LENGTH
            && username.matches("^[a-zA-Z0-9_-]+$");
    }

    @Override
    public void createAccount(String username, String password) {
        if (!isValidUsername(username)) {
            throw new IllegalArgumentException("Invalid username: " + username);
        }
        if (password == null || password.isEmpty()) {
            throw new IllegalArgumentException("Password is required");
        }
        if (passwordHashes.putIfAbsent(username, PasswordHasher.hash(password)) != null) {
            throw new IllegalArgumentException("User already exists: " + username);
        }
        GatewayLogger.info(TAG, "Account created: " + username);
    }

    @Override
    public boolean deleteAccount(String username) {
        failedAttempts.remove(username);
        lockedUntil.remove(username);
        boolean removed = passwordHashes.remove(username) != null;
        if (removed) {
            GatewayLogger.info(TAG, "Account deleted: " + username);
        }
        return removed;
    }

    @Override
    public boolean accountExists(String username) {
        return username != null && passwordHashes.containsKey(username);
    }

    @Override
    public boolean verify(String username, String password) {
        String stored = username != null ? passwordHashes.get(username) : null;
        return stored != null && PasswordHasher.verify(password, stored);
    }

    @Override
    public boolean isLockedOut(String username) {
        Instant until = lockedUntil.get(username);
        if (until == null) {
            return false;
        }
        if (until.isAfter(clock.instant())) {
            return true;
        }
        // lock expired
        lockedUntil.remove(username, until);
        failedAttempts.remove(username);
        return false;
    }

    @Override
    public void recordFailedAttempt(String username) {
        int attempts = failedAttempts.merge(username, 1, Integer::sum);
        if (attempts >= maxFailedAttempts) {
            Instant until = clock.instant().plus(lockoutDuration);
            lockedUntil.put(username, until);
            GatewayLogger.security(TAG, "Account " + username + " locked until " + until);
        }
    }

    @Override
    public void resetFailedAttempts(String username) {
        failedAttempts.remove(username);
        lockedUntil.remove(username);
    }
}
