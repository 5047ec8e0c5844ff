package com.phillippitts.mcphub.service.backend.anythingllm;

import com.phillippitts.mcphub.config.properties.AnythingLlmProperties;
import com.phillippitts.mcphub.domain.SearchHit;
import com.phillippitts.mcphub.exception.BackendException;
import com.phillippitts.mcphub.exception.BackendExceptionBuilder;
import com.phillippitts.mcphub.exception.ErrorKind;
import com.phillippitts.mcphub.util.LogSanitizer;
import com.phillippitts.mcphub.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Thin wrapper around the AnythingLLM developer API.
 *
 * <p>Endpoints used:
 * <ul>
 *   <li>{@code GET  {base}/v1/auth}: token check, used as the health probe</li>
 *   <li>{@code POST {base}/v1/workspace/{slug}/chat}: {@code {message, mode}} to {@code textResponse}</li>
 *   <li>{@code POST {base}/v1/workspace/{slug}/vector-search}: {@code {query, topN}} to {@code results[]}</li>
 * </ul>
 *
 * <p>Shared by the chat and search backends, which report failures under their own names.
 */
@Component
public class AnythingLlmClient {

    private static final Logger LOG = LogManager.getLogger(AnythingLlmClient.class);

    private final AnythingLlmProperties props;
    private final HttpClient http;

    @Autowired
    public AnythingLlmClient(AnythingLlmProperties props) {
        this(props, HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(props.connectTimeoutMs()))
                .build());
    }

    AnythingLlmClient(AnythingLlmProperties props, HttpClient http) {
        this.props = Objects.requireNonNull(props, "props");
        this.http = Objects.requireNonNull(http, "http");
    }

    /**
     * @return true if the API answers the auth check with 200
     */
    public boolean authenticated() {
        if (!props.hasApiKey()) {
            return false;
        }
        HttpRequest request = baseRequest("/v1/auth").GET().build();
        try {
            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
            return response.statusCode() == 200;
        } catch (IOException e) {
            LOG.debug("AnythingLLM auth check failed: {}", e.toString());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Sends a chat message to the configured workspace.
     *
     * @param backend name reported in failures
     * @param message prompt text
     * @return the model's text response
     */
    public String chat(String backend, String message) {
        JSONObject body = new JSONObject()
                .put("message", message)
                .put("mode", props.chatMode());
        JSONObject json = post(backend, workspacePath("/chat"), body);
        String error = json.optString("error", "");
        if (!error.isEmpty() && !"null".equals(error)) {
            throw BackendExceptionBuilder.create("AnythingLLM chat error: " + LogSanitizer.truncate(error, 200))
                    .backend(backend)
                    .build();
        }
        if (!json.has("textResponse") || json.isNull("textResponse")) {
            throw BackendExceptionBuilder.create("AnythingLLM chat response has no textResponse")
                    .backend(backend)
                    .build();
        }
        return json.getString("textResponse");
    }

    /**
     * Runs a vector search against the configured workspace.
     *
     * @return hits in the order returned by the API
     */
    public List<SearchHit> vectorSearch(String backend, String query, int topN) {
        JSONObject body = new JSONObject()
                .put("query", query)
                .put("topN", topN);
        JSONObject json = post(backend, workspacePath("/vector-search"), body);
        JSONArray results = json.optJSONArray("results");
        List<SearchHit> hits = new ArrayList<>();
        if (results == null) {
            return hits;
        }
        for (int i = 0; i < results.length(); i++) {
            JSONObject r = results.getJSONObject(i);
            JSONObject metadata = r.optJSONObject("metadata");
            String source = metadata != null ? metadata.optString("title", "") : r.optString("title", "");
            hits.add(new SearchHit(source, r.optString("text", ""), r.optDouble("score", 0.0)));
        }
        return hits;
    }

    private JSONObject post(String backend, String path, JSONObject body) {
        HttpRequest request = baseRequest(path)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
                .build();
        long start = System.nanoTime();
        try {
            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw BackendExceptionBuilder.create("AnythingLLM returned HTTP " + response.statusCode())
                        .backend(backend)
                        .durationMs(TimeUtils.elapsedMillis(start))
                        .metadata("path", path)
                        .metadata("body", LogSanitizer.truncate(response.body(), 200))
                        .build();
            }
            LOG.debug("AnythingLLM {} answered in {} ms", path, TimeUtils.elapsedMillis(start));
            return new JSONObject(response.body());
        } catch (HttpTimeoutException e) {
            throw failure(backend, ErrorKind.BACKEND_TIMEOUT, "AnythingLLM request timed out", path, start, e);
        } catch (IOException e) {
            throw failure(backend, ErrorKind.BACKEND_INVOCATION_ERROR, "AnythingLLM request failed", path, start, e);
        } catch (JSONException e) {
            throw failure(backend, ErrorKind.BACKEND_INVOCATION_ERROR, "AnythingLLM returned invalid JSON", path, start, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure(backend, ErrorKind.BACKEND_INVOCATION_ERROR, "Interrupted calling AnythingLLM", path, start, e);
        }
    }

    private BackendException failure(String backend, ErrorKind kind, String msg, String path, long start, Throwable cause) {
        return BackendExceptionBuilder.create(msg)
                .backend(backend)
                .kind(kind)
                .durationMs(TimeUtils.elapsedMillis(start))
                .metadata("path", path)
                .cause(cause)
                .build();
    }

    private HttpRequest.Builder baseRequest(String path) {
        String base = props.baseUrl().endsWith("/")
                ? props.baseUrl().substring(0, props.baseUrl().length() - 1)
                : props.baseUrl();
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(base + path))
                .timeout(Duration.ofMillis(props.requestTimeoutMs()))
                .header("Accept", "application/json");
        if (props.hasApiKey()) {
            builder.header("Authorization", "Bearer " + props.apiKey());
        }
        return builder;
    }

    private String workspacePath(String suffix) {
        return "/v1/workspace/" + URLEncoder.encode(props.workspace(), StandardCharsets.UTF_8) + suffix;
    }
}
