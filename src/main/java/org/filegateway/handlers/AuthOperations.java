package org.filegateway.handlers;

import java.io.IOException;
import java.nio.file.Files;

import org.filegateway.accounts.CredentialVerifier;
import org.filegateway.managers.SessionStore;
import org.filegateway.security.PathResolution;
import org.filegateway.security.PathResolver;
import org.filegateway.utils.GatewayLogger;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Login and logout. Both routes are public.
 */
public class AuthOperations {

    private static final String TAG = "AUTH";

    private final CredentialVerifier credentials;
    private final SessionStore sessions;
    private final PathResolver resolver;

    public AuthOperations(CredentialVerifier credentials, SessionStore sessions, PathResolver resolver) {
        this.credentials = credentials;
        this.sessions = sessions;
        this.resolver = resolver;
    }

    /**
     * Exchanges {@code {"Username", "Password"}} for a bearer token and makes
     * sure the user's sandbox folder exists.
     */
    public OperationResult login(GatewayRequest request) {
        String username;
        String password;
        try {
            JSONObject json = new JSONObject(request.bodyText());
            username = json.optString("Username", json.optString("username", null));
            password = json.optString("Password", json.optString("password", null));
        } catch (JSONException e) {
            return OperationResult.badRequest("Invalid request format");
        }
        if (username == null || password == null) {
            return OperationResult.badRequest("Invalid request format");
        }

        if (!credentials.accountExists(username)) {
            GatewayLogger.security(TAG, "Login FAILED for unknown user: '" + username + "'");
            return OperationResult.failure(Outcome.UNAUTHORIZED, "Invalid credentials");
        }
        if (credentials.isLockedOut(username)) {
            GatewayLogger.security(TAG, "Login FAILED for user: '" + username + "'. Too many tries.");
            return OperationResult.failure(Outcome.UNAUTHORIZED, "Too many tries");
        }
        if (!credentials.verify(username, password)) {
            credentials.recordFailedAttempt(username);
            GatewayLogger.security(TAG, "Login FAILED for user: '" + username + "'. Invalid credentials.");
            return OperationResult.failure(Outcome.UNAUTHORIZED, "Invalid credentials");
        }

        credentials.resetFailedAttempts(username);
        String token = sessions.issue(username);

        PathResolution home = resolver.resolve(token, "/");
        if (!home.isResolved()) {
            sessions.revoke(token);
            GatewayLogger.security(TAG, "Login refused for '" + username + "': sandbox folder is not usable");
            return OperationResult.failure(Outcome.UNAUTHORIZED, "Invalid credentials");
        }
        try {
            Files.createDirectories(home.getPath());
        } catch (IOException e) {
            sessions.revoke(token);
            GatewayLogger.error(TAG, "Could not create folder " + home.getPath() + " for " + username + ": " + e.getMessage());
            return OperationResult.internal("Server error");
        }

        GatewayLogger.info(TAG, "User logged in: " + username + ", folder: " + home.getPath());
        return OperationResult.success()
            .with("token", token)
            .with("username", username);
    }

    /**
     * Revokes the bearer token if one was sent. Always succeeds.
     */
    public OperationResult logout(GatewayRequest request) {
        String username = sessions.revoke(request.bearerToken());
        if (username != null) {
            GatewayLogger.info(TAG, "User logged out: " + username);
        }
        return OperationResult.success();
    }
}
