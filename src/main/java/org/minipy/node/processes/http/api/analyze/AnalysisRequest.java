package org.minipy.node.processes.http.api.analyze;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The body of a {@code POST /analyze} request.
 *
 * @param code The source text to analyze; null when the field is absent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalysisRequest(@JsonProperty("code") String code) {
}
