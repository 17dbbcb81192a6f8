package org.filegateway.security;

import java.nio.file.Path;

/**
 * Outcome of resolving a client path inside a user's sandbox
 */
public final class PathResolution {

    public enum Status {
        RESOLVED,
        UNAUTHORIZED,
        FORBIDDEN
    }

    private static final PathResolution UNAUTHORIZED = new PathResolution(Status.UNAUTHORIZED, null, null, null);
    private static final PathResolution FORBIDDEN = new PathResolution(Status.FORBIDDEN, null, null, null);

    private final Status status;
    private final String username;
    private final Path userBase;
    private final Path path;

    private PathResolution(Status status, String username, Path userBase, Path path) {
        this.status = status;
        this.username = username;
        this.userBase = userBase;
        this.path = path;
    }

    static PathResolution resolved(String username, Path userBase, Path path) {
        return new PathResolution(Status.RESOLVED, username, userBase, path);
    }

    static PathResolution unauthorized() {
        return UNAUTHORIZED;
    }

    static PathResolution forbidden() {
        return FORBIDDEN;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isResolved() {
        return status == Status.RESOLVED;
    }

    public String getUsername() {
        return username;
    }

    /**
     * Canonical sandbox root of the user; null unless resolved
     */
    public Path getUserBase() {
        return userBase;
    }

    /**
     * Canonical absolute path; null unless resolved
     */
    public Path getPath() {
        return path;
    }

    /**
     * True when the resolved path is the sandbox root itself
     */
    public boolean isSandboxRoot() {
        return isResolved() && path.equals(userBase);
    }

    @Override
    public String toString() {
        return isResolved() ? status + ":" + path : status.toString();
    }
}
