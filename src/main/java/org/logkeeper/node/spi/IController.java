package org.logkeeper.node.spi;

import io.javalin.Javalin;

/**
 * An HTTP API controller mounted by the HTTP server process.
 */
public interface IController {

    /**
     * Registers the controller's routes.
     *
     * @param app      The Javalin application.
     * @param basePath The base path the routes are nested under, ending with {@code /}.
     */
    void registerRoutes(Javalin app, String basePath);
}
