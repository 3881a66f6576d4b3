package io.notebookhive.dispatcher.infra.kernel;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.notebookhive.dispatcher.app.CellExecutionException;
import io.notebookhive.dispatcher.app.CellExecutor;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client of the kernel service. Each code cell is sent as
 * {@code POST {baseUrl}/execute {"jobId", "cellIndex", "source"}}; the answer
 * {@code {"outputs": [...], "error": "..."}} replaces the cell's outputs.
 */
public class KernelCellExecutor implements CellExecutor {
    private static final Logger log = LoggerFactory.getLogger(KernelCellExecutor.class);
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);

    private final HttpClient http;
    private final ObjectMapper json;
    private final URI executeUri;
    private final Duration requestTimeout;

    public KernelCellExecutor(ObjectMapper json, URI baseUrl, Duration requestTimeout) {
        this(HttpClient.newBuilder().connectTimeout(CONNECT_TIMEOUT).build(), json, baseUrl, requestTimeout);
    }

    KernelCellExecutor(HttpClient http, ObjectMapper json, URI baseUrl, Duration requestTimeout) {
        this.http = Objects.requireNonNull(http, "http");
        this.json = Objects.requireNonNull(json, "json");
        this.executeUri = resolveExecuteUri(Objects.requireNonNull(baseUrl, "baseUrl"));
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    }

    @Override
    public boolean enabled() {
        return true;
    }

    @Override
    public void execute(String jobId, ObjectNode notebook) throws CellExecutionException {
        JsonNode cells = notebook.path("cells");
        int executionCount = 0;
        for (int index = 0; index < cells.size(); index++) {
            JsonNode node = cells.get(index);
            if (!node.isObject() || !"code".equals(node.path("cell_type").asText())) {
                continue;
            }
            ObjectNode cell = (ObjectNode) node;
            String source = source(cell);
            if (source.isBlank()) {
                continue;
            }
            KernelAnswer answer = send(new ExecuteRequest(jobId, index, source));
            executionCount++;
            cell.put("execution_count", executionCount);
            ArrayNode outputs = cell.putArray("outputs");
            if (answer.outputs() != null && answer.outputs().isArray()) {
                outputs.addAll((ArrayNode) answer.outputs());
            }
            if (answer.error() != null && !answer.error().isBlank()) {
                throw new CellExecutionException("cell " + index + " failed: " + answer.error());
            }
        }
        log.debug("executed {} code cell(s) of job {}", executionCount, jobId);
    }

    private KernelAnswer send(ExecuteRequest body) throws CellExecutionException {
        HttpResponse<String> response;
        try {
            HttpRequest request = HttpRequest.newBuilder()
                .uri(executeUri)
                .header("Accept", "application/json")
                .header("Content-Type", "application/json")
                .timeout(requestTimeout)
                .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(body)))
                .build();
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException ex) {
            throw new CellExecutionException("kernel unreachable at " + executeUri + ": " + ex.getMessage(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new CellExecutionException("kernel call interrupted", ex);
        }
        if (response.statusCode() != 200) {
            throw new CellExecutionException("kernel answered status " + response.statusCode()
                + " for cell " + body.cellIndex());
        }
        KernelAnswer answer;
        try {
            answer = json.readValue(response.body(), KernelAnswer.class);
        } catch (JsonProcessingException ex) {
            throw new CellExecutionException("unreadable kernel answer for cell " + body.cellIndex(), ex);
        }
        if (answer == null) {
            throw new CellExecutionException("empty kernel answer for cell " + body.cellIndex());
        }
        return answer;
    }

    private static String source(ObjectNode cell) {
        JsonNode source = cell.path("source");
        if (source.isArray()) {
            StringBuilder joined = new StringBuilder();
            source.forEach(line -> joined.append(line.asText()));
            return joined.toString();
        }
        return source.asText("");
    }

    private static URI resolveExecuteUri(URI baseUrl) {
        String scheme = baseUrl.getScheme();
        boolean http = "http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme);
        if (!http || baseUrl.getHost() == null) {
            throw new IllegalArgumentException("kernel base-url must be an absolute http(s) URL but was " + baseUrl);
        }
        String base = baseUrl.toString();
        return URI.create(base.endsWith("/") ? base + "execute" : base + "/execute");
    }

    record ExecuteRequest(String jobId, int cellIndex, String source) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record KernelAnswer(JsonNode outputs, String error) {
    }
}
