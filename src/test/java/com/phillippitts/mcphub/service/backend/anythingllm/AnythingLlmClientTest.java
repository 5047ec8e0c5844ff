package com.phillippitts.mcphub.service.backend.anythingllm;

import com.phillippitts.mcphub.config.properties.AnythingLlmProperties;
import com.phillippitts.mcphub.domain.Completion;
import com.phillippitts.mcphub.domain.CompletionRequest;
import com.phillippitts.mcphub.domain.SearchHit;
import com.phillippitts.mcphub.domain.SearchRequest;
import com.phillippitts.mcphub.domain.SearchResults;
import com.phillippitts.mcphub.exception.BackendException;
import com.phillippitts.mcphub.exception.ErrorKind;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Exercises the client against a local HTTP server that mimics the AnythingLLM API.
 */
class AnythingLlmClientTest {

    private HttpServer server;
    private final Map<String, String> requestBodies = new ConcurrentHashMap<>();
    private final Map<String, String> authHeaders = new ConcurrentHashMap<>();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private void respond(String path, int status, String body) {
        server.createContext(path, exchange -> {
            requestBodies.put(path, new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            String auth = exchange.getRequestHeaders().getFirst("Authorization");
            if (auth != null) {
                authHeaders.put(path, auth);
            }
            write(exchange, status, body);
        });
    }

    private static void write(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private AnythingLlmClient client(String apiKey) {
        String base = "http://127.0.0.1:" + server.getAddress().getPort() + "/api/";
        return new AnythingLlmClient(new AnythingLlmProperties(base, apiKey, "team-docs", "query", 1000, 2000));
    }

    @Test
    void chatSendsMessageAndModeAndReturnsText() {
        respond("/api/v1/workspace/team-docs/chat", 200,
                "{\"id\":\"1\",\"type\":\"textResponse\",\"textResponse\":\"Hi there\",\"error\":null}");
        AnythingLlmChatBackend backend = new AnythingLlmChatBackend(client("secret"));

        Completion completion = backend.invoke(CompletionRequest.of("Say hi"));

        assertThat(completion.text()).isEqualTo("Hi there");
        JSONObject sent = new JSONObject(requestBodies.get("/api/v1/workspace/team-docs/chat"));
        assertThat(sent.getString("message")).isEqualTo("Say hi");
        assertThat(sent.getString("mode")).isEqualTo("query");
        assertThat(authHeaders.get("/api/v1/workspace/team-docs/chat")).isEqualTo("Bearer secret");
    }

    @Test
    void chatErrorFieldBecomesBackendFailure() {
        respond("/api/v1/workspace/team-docs/chat", 200,
                "{\"textResponse\":null,\"error\":\"workspace has no documents\"}");
        AnythingLlmClient client = client("secret");

        assertThatThrownBy(() -> client.chat("anythingllm-chat", "hello"))
                .isInstanceOf(BackendException.class)
                .hasMessageContaining("workspace has no documents")
                .hasMessageContaining("(backend: anythingllm-chat)");
    }

    @Test
    void nonOkStatusIsInvocationError() {
        respond("/api/v1/workspace/team-docs/chat", 500, "{\"error\":\"boom\"}");
        AnythingLlmClient client = client("secret");

        assertThatThrownBy(() -> client.chat("anythingllm-chat", "hello"))
                .isInstanceOf(BackendException.class)
                .hasMessageContaining("AnythingLLM returned HTTP 500")
                .extracting(e -> ((BackendException) e).getKind())
                .isEqualTo(ErrorKind.BACKEND_INVOCATION_ERROR);
    }

    @Test
    void invalidJsonIsInvocationError() {
        respond("/api/v1/workspace/team-docs/chat", 200, "<html>login</html>");
        AnythingLlmClient client = client("secret");

        assertThatThrownBy(() -> client.chat("anythingllm-chat", "hello"))
                .isInstanceOf(BackendException.class)
                .hasMessageContaining("invalid JSON");
    }

    @Test
    void vectorSearchMapsResults() {
        respond("/api/v1/workspace/team-docs/vector-search", 200, """
                {"results":[
                  {"id":"a","text":"Budgets are due in March.","metadata":{"title":"policy.md"},"score":0.91},
                  {"id":"b","text":"Travel rules","title":"travel.md","score":0.42}
                ]}
                """);
        AnythingLlmSearchBackend backend = new AnythingLlmSearchBackend(client("secret"));

        SearchResults results = backend.invoke(new SearchRequest("budget deadline", 2));

        assertThat(results.hits()).containsExactly(
                new SearchHit("policy.md", "Budgets are due in March.", 0.91),
                new SearchHit("travel.md", "Travel rules", 0.42));
        JSONObject sent = new JSONObject(requestBodies.get("/api/v1/workspace/team-docs/vector-search"));
        assertThat(sent.getInt("topN")).isEqualTo(2);
    }

    @Test
    void vectorSearchWithoutResultsIsEmpty() {
        respond("/api/v1/workspace/team-docs/vector-search", 200, "{}");

        List<SearchHit> hits = client("secret").vectorSearch("anythingllm-search", "anything", 3);

        assertThat(hits).isEmpty();
    }

    @Test
    void authenticatedRequiresKeyAndOkAuthCheck() {
        respond("/api/v1/auth", 200, "{\"authenticated\":true}");

        assertThat(client("").authenticated()).isFalse();
        assertThat(client("secret").authenticated()).isTrue();
        assertThat(new AnythingLlmChatBackend(client("secret")).health()).isTrue();
    }

    @Test
    void authenticatedIsFalseOnRejectedKey() {
        respond("/api/v1/auth", 403, "{\"error\":\"invalid key\"}");

        assertThat(client("wrong").authenticated()).isFalse();
    }

    @Test
    void unreachableServerIsNotHealthy() {
        server.stop(0);
        AnythingLlmClient client = client("secret");

        assertThat(client.authenticated()).isFalse();
        assertThatThrownBy(() -> client.vectorSearch("anythingllm-search", "q", 1))
                .isInstanceOf(BackendException.class);
    }
}
