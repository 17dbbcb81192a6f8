package org.filegateway.handlers;

import java.util.HashMap;
import java.util.Map;

import io.netty.handler.codec.http.HttpMethod;

/**
 * Every path the gateway answers. Matching is exact, no wildcards.
 */
public enum Route {
    LANDING_PAGE("/", HttpMethod.GET, false),
    LOGIN("/api/login", HttpMethod.POST, false),
    LOGOUT("/api/logout", HttpMethod.POST, false),
    LIST("/api/files/list", HttpMethod.GET, true),
    UPLOAD("/api/files/upload", HttpMethod.POST, true),
    DOWNLOAD("/api/files/download", HttpMethod.GET, true),
    CREATE("/api/files/create", HttpMethod.POST, true),
    DELETE("/api/files/delete", HttpMethod.POST, true),
    SAVE("/api/files/save", HttpMethod.POST, true),
    RENAME("/api/files/rename", HttpMethod.POST, true);

    private static final Map<String, Route> BY_PATH = new HashMap<>();

    static {
        for (Route route : values()) {
            BY_PATH.put(route.path, route);
        }
    }

    private final String path;
    private final HttpMethod method;
    private final boolean requiresAuth;

    Route(String path, HttpMethod method, boolean requiresAuth) {
        this.path = path;
        this.method = method;
        this.requiresAuth = requiresAuth;
    }

    /**
     * @return the route for the exact path, or null
     */
    public static Route lookup(String path) {
        return BY_PATH.get(path);
    }

    public String path() {
        return path;
    }

    public HttpMethod method() {
        return method;
    }

    public boolean requiresAuth() {
        return requiresAuth;
    }
}
