package org.filegateway.handlers;

import java.util.EnumMap;
import java.util.Map;

/**
 * Binds each {@link Route} to the operation that serves it. Built once at
 * startup and shared by every connection.
 */
public class RouteTable {

    /**
     * Serves one route. Expected failures come back as results, not
     * exceptions.
     */
    @FunctionalInterface
    public interface RouteHandler {
        OperationResult handle(GatewayRequest request);
    }

    private final Map<Route, RouteHandler> handlers = new EnumMap<>(Route.class);

    public RouteTable(LandingPage landingPage, AuthOperations auth, FileOperations files) {
        handlers.put(Route.LANDING_PAGE, landingPage::serve);
        handlers.put(Route.LOGIN, auth::login);
        handlers.put(Route.LOGOUT, auth::logout);
        handlers.put(Route.LIST, files::list);
        handlers.put(Route.UPLOAD, files::upload);
        handlers.put(Route.DOWNLOAD, files::download);
        handlers.put(Route.CREATE, files::create);
        handlers.put(Route.DELETE, files::delete);
        handlers.put(Route.SAVE, files::save);
        handlers.put(Route.RENAME, files::rename);

        for (Route route : Route.values()) {
            if (!handlers.containsKey(route)) {
                throw new IllegalStateException("No handler bound for " + route);
            }
        }
    }

    public RouteHandler handlerFor(Route route) {
        return handlers.get(route);
    }
}
