package org.minipy.node.processes.http;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import io.javalin.Javalin;
import org.minipy.analyzer.Analyzer;
import org.minipy.analyzer.api.AnalyzerOptions;
import org.minipy.analyzer.api.IAnalyzer;
import org.minipy.analyzer.api.ReportJsonWriter;
import org.minipy.node.spi.IController;
import org.minipy.node.spi.IProcess;
import org.minipy.node.spi.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A manageable process that runs a Javalin HTTP server. It configures its routes by parsing
 * the {@code minipy.http.routes} block, where every {@code "$controller"} entry names an
 * {@link IController} class and its options:
 * <pre>
 * routes {
 *   "$controller" {
 *     className = "org.minipy.node.processes.http.api.analyze.AnalyzeController"
 *     options { max-source-length = 100000 }
 *   }
 * }
 * </pre>
 * Nested objects add path segments, so a controller under {@code routes { api { ... } } }
 * is mounted at {@code /api}.
 */
public class HttpServerProcess implements IProcess {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpServerProcess.class);

    private static final String HTTP_CONFIG_PATH = "minipy.http";
    private static final String ROUTES_CONFIG_KEY = "routes";
    private static final String CONTROLLER_ACTION_KEY = "$controller";

    private final Config options;
    private final List<RouteDefinition> routeDefinitions = new ArrayList<>();
    private final ServiceRegistry controllerRegistry = new ServiceRegistry();
    private Javalin app;

    /**
     * Constructs a new HttpServerProcess with an analyzer built from the configuration.
     *
     * @param config The root configuration, containing the {@code minipy.http} and
     *               {@code minipy.analyzer} sections.
     */
    public HttpServerProcess(final Config config) {
        this(config, new Analyzer(AnalyzerOptions.fromConfig(config)));
    }

    /**
     * Constructs a new HttpServerProcess serving the given analyzer.
     *
     * @param config   The root configuration, containing the {@code minipy.http} section.
     * @param analyzer The analyzer shared by all requests.
     */
    public HttpServerProcess(final Config config, final IAnalyzer analyzer) {
        this.options = config.getConfig(HTTP_CONFIG_PATH);
        controllerRegistry.register(IAnalyzer.class, analyzer);
        controllerRegistry.register(ReportJsonWriter.class, new ReportJsonWriter());
        parseRoutes();
    }

    @Override
    public void start() {
        if (app != null) {
            LOGGER.warn("HTTP server is already running.");
            return;
        }

        final String host = options.getString("network.host");
        final int port = options.getInt("network.port");

        app = createApp();
        app.start(host, port);
        LOGGER.info("HTTP server started on {}:{}", host, app.port());
    }

    @Override
    public void stop() {
        if (app != null) {
            app.stop();
            app = null;
            LOGGER.info("HTTP server stopped.");
        }
    }

    /**
     * Gets the port the server is listening on.
     *
     * @return The bound port, or -1 if the server is not running.
     */
    public int port() {
        return app == null ? -1 : app.port();
    }

    /**
     * Creates the Javalin application with all configured controllers registered, without
     * starting it.
     *
     * @return The configured, unstarted application.
     */
    public Javalin createApp() {
        final Javalin javalin = Javalin.create(config -> {
            config.showJavalinBanner = false;
            config.requestLogger.http((ctx, ms) -> {
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug("Request: {} {} -> {} (completed in {} ms)", ctx.method(), ctx.path(), ctx.statusCode(), ms);
                }
            });
        });
        registerControllers(javalin);
        return javalin;
    }

    private void parseRoutes() {
        if (!options.hasPath(ROUTES_CONFIG_KEY)) {
            LOGGER.warn("No '{}' block found in http configuration. No routes will be served.", ROUTES_CONFIG_KEY);
            return;
        }
        parseConfigLevel(options.getConfig(ROUTES_CONFIG_KEY).root(), "/");
    }

    private void parseConfigLevel(final ConfigObject configObject, final String currentPath) {
        for (final Map.Entry<String, ConfigValue> entry : configObject.entrySet()) {
            final String key = entry.getKey();
            final ConfigValue value = entry.getValue();

            if (key.equals(CONTROLLER_ACTION_KEY)) {
                if (value.valueType() == ConfigValueType.OBJECT) {
                    routeDefinitions.add(new RouteDefinition(currentPath, (ConfigObject) value));
                } else {
                    LOGGER.error("Invalid config for '$controller' at path '{}'. Expected an object.", currentPath);
                }
            } else if (value.valueType() == ConfigValueType.OBJECT) {
                final String nextPath = (currentPath + key + "/").replaceAll("//", "/");
                parseConfigLevel((ConfigObject) value, nextPath);
            }
        }
    }

    private void registerControllers(final Javalin javalin) {
        for (final RouteDefinition def : routeDefinitions) {
            try {
                registerController(def, javalin);
            } catch (final ReflectiveOperationException | RuntimeException e) {
                LOGGER.error("Failed to register controller at path '{}'", def.basePath, e);
            }
        }
    }

    private void registerController(final RouteDefinition def, final Javalin javalin) throws ReflectiveOperationException {
        final Config controllerConfig = def.configValue.toConfig();
        final String className = controllerConfig.getString("className");
        final Config controllerOptions = controllerConfig.hasPath("options")
            ? controllerConfig.getConfig("options")
            : ConfigFactory.empty();

        LOGGER.debug("Registering controller '{}' at base path '{}'", className, def.basePath);

        final Class<?> controllerClass = Class.forName(className);
        if (!IController.class.isAssignableFrom(controllerClass)) {
            throw new IllegalArgumentException("Class " + className + " does not implement IController.");
        }

        final Constructor<?> constructor = controllerClass.getConstructor(ServiceRegistry.class, Config.class);
        final IController controller = (IController) constructor.newInstance(controllerRegistry, controllerOptions);

        controller.registerRoutes(javalin, def.basePath);
    }

    private static class RouteDefinition {
        private final String basePath;
        private final ConfigObject configValue;

        RouteDefinition(final String basePath, final ConfigObject configValue) {
            this.basePath = Objects.requireNonNull(basePath);
            this.configValue = Objects.requireNonNull(configValue);
        }
    }
}
