package org.filegateway.accounts;

/**
 * Account creation and removal
 */
public interface UserRegistry {

    /**
     * @throws IllegalArgumentException if the username is invalid or taken
     */
    void createAccount(String username, String password);

    /**
     * @return false if no such account existed
     */
    boolean deleteAccount(String username);
}
