package org.minipy.node.processes.http.api.analyze;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.ConfigFactory;
import io.javalin.Javalin;
import io.javalin.testtools.JavalinTest;
import org.minipy.analyzer.Analyzer;
import org.minipy.analyzer.api.IAnalyzer;
import org.minipy.node.spi.ServiceRegistry;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Contains unit tests for the {@link AnalyzeController}.
 * The controller is mounted on a bare Javalin app and exercised through the test client, covering
 * the report response, the preflight and method handling, and the error bodies.
 */
@Tag("unit")
public class AnalyzeControllerTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private Javalin createApp(IAnalyzer analyzer, int maxSourceLength) {
        ServiceRegistry registry = new ServiceRegistry();
        registry.register(IAnalyzer.class, analyzer);
        AnalyzeController controller = new AnalyzeController(
                registry, ConfigFactory.parseMap(Map.of("max-source-length", maxSourceLength)));
        Javalin app = Javalin.create();
        controller.registerRoutes(app, "/");
        return app;
    }

    /**
     * Verifies that a POST returns the JSON report with the cross-origin headers.
     */
    @Test
    void testAnalyzeReturnsReport() {
        // Arrange
        Javalin app = createApp(new Analyzer(), 1000);

        JavalinTest.test(app, (server, client) -> {
            // Act
            var response = client.post("/analyze", "{\"code\": \"x = 5\\nif x > 'a':\\n  y = 1\"}");

            // Assert
            assertThat(response.code()).isEqualTo(200);
            assertThat(response.header("Content-Type")).startsWith("application/json");
            assertThat(response.header("Access-Control-Allow-Origin")).isEqualTo("*");

            JsonNode json = mapper.readTree(response.body().string());
            assertThat(json.get("success").asBoolean()).isFalse();
            assertThat(json.get("error").asText())
                    .isEqualTo("semantic errors: semantic error at line 2: cannot compare number with string using '>'");
            assertThat(json.get("semantic_analysis").get("variables").get("x").get("type").asText()).isEqualTo("int");
        });
    }

    /**
     * Verifies that a body without a {@code code} field is analyzed as an empty source.
     */
    @Test
    void testMissingCodeIsEmptySource() {
        // Arrange
        Javalin app = createApp(new Analyzer(), 1000);

        JavalinTest.test(app, (server, client) -> {
            // Act
            var response = client.post("/analyze", "{\"source\": \"ignored\"}");

            // Assert
            assertThat(response.code()).isEqualTo(200);

            JsonNode json = mapper.readTree(response.body().string());
            assertThat(json.get("success").asBoolean()).isTrue();
            assertThat(json.get("lexical_analysis").get("tokens")).isEmpty();
        });
    }

    /**
     * Verifies that the preflight request answers 200 with all cross-origin headers.
     */
    @Test
    void testPreflightRequest() {
        // Arrange
        Javalin app = createApp(new Analyzer(), 1000);

        JavalinTest.test(app, (server, client) -> {
            // Act
            var response = client.request("/analyze", builder -> builder.method("OPTIONS", null));

            // Assert
            assertThat(response.code()).isEqualTo(200);
            assertThat(response.header("Access-Control-Allow-Origin")).isEqualTo("*");
            assertThat(response.header("Access-Control-Allow-Methods")).isEqualTo("POST, GET, OPTIONS, PUT, DELETE");
            assertThat(response.header("Access-Control-Allow-Headers")).contains("Content-Type", "Authorization");
        });
    }

    /**
     * Verifies that methods other than POST and OPTIONS answer 405 with an error body.
     */
    @Test
    void testOtherMethodsAreNotAllowed() {
        // Arrange
        Javalin app = createApp(new Analyzer(), 1000);

        JavalinTest.test(app, (server, client) -> {
            // Act
            var get = client.get("/analyze");
            var put = client.put("/analyze", "{}");
            var delete = client.delete("/analyze");

            // Assert
            assertThat(get.code()).isEqualTo(405);
            assertThat(put.code()).isEqualTo(405);
            assertThat(delete.code()).isEqualTo(405);
            assertThat(get.header("Access-Control-Allow-Origin")).isEqualTo("*");

            JsonNode json = mapper.readTree(get.body().string());
            assertThat(json.get("status").asInt()).isEqualTo(405);
            assertThat(json.get("message").asText()).isEqualTo("Method not allowed");
        });
    }

    /**
     * Verifies that a malformed JSON body answers 400.
     */
    @Test
    void testInvalidJsonIsBadRequest() {
        // Arrange
        Javalin app = createApp(new Analyzer(), 1000);

        JavalinTest.test(app, (server, client) -> {
            // Act
            var response = client.post("/analyze", "{\"code\": ");

            // Assert
            assertThat(response.code()).isEqualTo(400);

            JsonNode json = mapper.readTree(response.body().string());
            assertThat(json.get("status").asInt()).isEqualTo(400);
            assertThat(json.get("message").asText()).isEqualTo("Invalid JSON");
            assertThat(json.has("timestamp")).isTrue();
        });
    }

    /**
     * Verifies that a source above the configured limit answers 413.
     */
    @Test
    void testOversizedSourceIsRejected() {
        // Arrange
        Javalin app = createApp(new Analyzer(), 10);

        JavalinTest.test(app, (server, client) -> {
            // Act
            var response = client.post("/analyze", "{\"code\": \"x = 1234567890\"}");

            // Assert
            assertThat(response.code()).isEqualTo(413);

            JsonNode json = mapper.readTree(response.body().string());
            assertThat(json.get("message").asText()).isEqualTo("Source exceeds 10 characters");
        });
    }

    /**
     * Verifies that an analyzer failure answers 500 without exposing the exception message.
     */
    @Test
    void testUnexpectedFailureIsInternalServerError() {
        // Arrange
        IAnalyzer failing = mock(IAnalyzer.class);
        when(failing.analyze(anyString())).thenThrow(new IllegalStateException("boom"));
        Javalin app = createApp(failing, 1000);

        JavalinTest.test(app, (server, client) -> {
            // Act
            var response = client.post("/analyze", "{\"code\": \"x = 1\"}");

            // Assert
            assertThat(response.code()).isEqualTo(500);

            String body = response.body().string();
            assertThat(body).contains("An internal server error occurred");
            assertThat(body).doesNotContain("boom");
        });
    }
}
