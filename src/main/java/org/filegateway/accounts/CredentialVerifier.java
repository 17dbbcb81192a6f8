package org.filegateway.accounts;

/**
 * Password checks and failed-login lockout, owned by the credential store
 */
public interface CredentialVerifier {

    boolean accountExists(String username);

    boolean verify(String username, String password);

    boolean isLockedOut(String username);

    void recordFailedAttempt(String username);

    void resetFailedAttempts(String username);
}
