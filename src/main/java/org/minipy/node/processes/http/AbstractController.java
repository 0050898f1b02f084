package org.minipy.node.processes.http;

import com.typesafe.config.Config;
import org.minipy.node.spi.IController;
import org.minipy.node.spi.ServiceRegistry;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An abstract base class for {@link IController} implementations. Every controller is
 * constructed reflectively with the {@link ServiceRegistry} and its own options block.
 */
public abstract class AbstractController implements IController {

    protected final ServiceRegistry registry;
    protected final Config options;

    /**
     * Constructs a new AbstractController.
     *
     * @param registry The central service registry for accessing shared services.
     * @param options  The HOCON configuration specific to this controller instance.
     */
    protected AbstractController(final ServiceRegistry registry, final Config options) {
        this.registry = registry;
        this.options = options;
    }

    /**
     * Joins a base path and a route, avoiding doubled or trailing slashes.
     *
     * @param basePath The configured base path, e.g. {@code /} or {@code /api/}.
     * @param route    The route relative to the base path, starting with a slash.
     * @return The full path.
     */
    protected static String joinPath(final String basePath, final String route) {
        String base = basePath == null ? "" : basePath;
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + route;
    }

    /**
     * Creates a standardized error response body.
     *
     * @param status  The HTTP status code.
     * @param error   The short reason phrase of the status.
     * @param message The error message.
     * @return Map containing error details.
     */
    protected Map<String, Object> createErrorBody(final int status, final String error, final String message) {
        final Map<String, Object> errorBody = new LinkedHashMap<>();
        errorBody.put("timestamp", Instant.now().toString());
        errorBody.put("status", status);
        errorBody.put("error", error);
        errorBody.put("message", message);
        return errorBody;
    }
}
