package org.minipy.node.processes.http.api.analyze;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import org.minipy.analyzer.api.AnalysisReport;
import org.minipy.analyzer.api.IAnalyzer;
import org.minipy.analyzer.api.ReportJsonWriter;
import org.minipy.node.processes.http.AbstractController;
import org.minipy.node.spi.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves the analyzer over HTTP.
 * <p>
 * Routes, relative to the configured base path:
 * <ul>
 *   <li>{@code POST /analyze}: body {@code {"code": "..."}}, answers the full analysis report</li>
 *   <li>{@code OPTIONS /analyze}: CORS preflight, answers 200 with no body</li>
 *   <li>{@code GET}, {@code PUT}, {@code DELETE}, {@code PATCH /analyze}: 405</li>
 * </ul>
 * Every response carries permissive CORS headers. Bodies that are not valid JSON answer 400;
 * sources longer than {@code max-source-length} characters answer 413.
 * <p>
 * Thread Safety: the analyzer and writer are immutable, so concurrent requests are safe.
 */
public class AnalyzeController extends AbstractController {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnalyzeController.class);

    static final int DEFAULT_MAX_SOURCE_LENGTH = 100_000;
    private static final int PAYLOAD_TOO_LARGE = 413;

    static final String ALLOW_ORIGIN = "*";
    static final String ALLOW_METHODS = "POST, GET, OPTIONS, PUT, DELETE";
    static final String ALLOW_HEADERS =
            "Accept, Content-Type, Content-Length, Accept-Encoding, X-CSRF-Token, Authorization";

    private final IAnalyzer analyzer;
    private final ReportJsonWriter reportWriter;
    private final ObjectMapper requestMapper = new ObjectMapper();
    private final int maxSourceLength;

    /**
     * Constructs a new AnalyzeController.
     *
     * @param registry The service registry; must provide an {@link IAnalyzer}. A
     *                 {@link ReportJsonWriter} is used from the registry when present.
     * @param options  The controller options, optionally containing {@code max-source-length}.
     */
    public AnalyzeController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
        this.analyzer = registry.get(IAnalyzer.class);
        this.reportWriter = registry.hasService(ReportJsonWriter.class)
                ? registry.get(ReportJsonWriter.class)
                : new ReportJsonWriter();
        this.maxSourceLength = options.hasPath("max-source-length")
                ? options.getInt("max-source-length")
                : DEFAULT_MAX_SOURCE_LENGTH;
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        final String path = joinPath(basePath, "/analyze");

        app.before(path, this::addCorsHeaders);
        app.options(path, ctx -> ctx.status(HttpStatus.OK));
        app.post(path, this::analyze);
        app.get(path, this::methodNotAllowed);
        app.put(path, this::methodNotAllowed);
        app.delete(path, this::methodNotAllowed);
        app.patch(path, this::methodNotAllowed);

        app.exception(Exception.class, (e, ctx) -> {
            LOGGER.error("Unhandled exception for request {}", ctx.path(), e);
            ctx.status(HttpStatus.INTERNAL_SERVER_ERROR).json(createErrorBody(
                    HttpStatus.INTERNAL_SERVER_ERROR.getCode(),
                    HttpStatus.INTERNAL_SERVER_ERROR.getMessage(),
                    "An internal server error occurred"));
        });

        LOGGER.debug("Registered analyze routes at '{}' (max source length {})", path, maxSourceLength);
    }

    private void addCorsHeaders(final Context ctx) {
        ctx.header("Access-Control-Allow-Origin", ALLOW_ORIGIN);
        ctx.header("Access-Control-Allow-Methods", ALLOW_METHODS);
        ctx.header("Access-Control-Allow-Headers", ALLOW_HEADERS);
    }

    private void analyze(final Context ctx) {
        final AnalysisRequest request;
        try {
            request = requestMapper.readValue(ctx.body(), AnalysisRequest.class);
        } catch (final JsonProcessingException e) {
            LOGGER.warn("Rejected request to {} with invalid JSON: {}", ctx.path(), e.getOriginalMessage());
            ctx.status(HttpStatus.BAD_REQUEST).json(createErrorBody(
                    HttpStatus.BAD_REQUEST.getCode(), HttpStatus.BAD_REQUEST.getMessage(), "Invalid JSON"));
            return;
        }

        final String code = request == null || request.code() == null ? "" : request.code();
        if (code.length() > maxSourceLength) {
            LOGGER.warn("Rejected request to {} with {} characters of source (limit {})",
                    ctx.path(), code.length(), maxSourceLength);
            ctx.status(PAYLOAD_TOO_LARGE).json(createErrorBody(PAYLOAD_TOO_LARGE, "Payload Too Large",
                    "Source exceeds " + maxSourceLength + " characters"));
            return;
        }

        final AnalysisReport report = analyzer.analyze(code);
        ctx.status(HttpStatus.OK)
                .contentType("application/json")
                .result(reportWriter.toJson(report));
    }

    private void methodNotAllowed(final Context ctx) {
        ctx.status(HttpStatus.METHOD_NOT_ALLOWED).json(createErrorBody(
                HttpStatus.METHOD_NOT_ALLOWED.getCode(),
                HttpStatus.METHOD_NOT_ALLOWED.getMessage(),
                "Method not allowed"));
    }
}
