package assistant.adapter.out.http;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpRequest;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import assistant.core.config.LlamaStackConfig;
import assistant.core.model.LlamaStackException;
import assistant.core.model.agent.AgentConfig;
import assistant.core.model.agent.AgentKind;
import assistant.core.model.sync.KnowledgeBase;
import assistant.core.model.sync.McpServer;
import assistant.core.model.sync.ProviderDescriptor;
import assistant.core.port.out.LlamaStackGateway;

/**
 * llama-stack adapter over the v1 HTTP API using Vert.x WebClient.
 *
 * <p>List endpoints answer with {@code {"data": [...]}}; entries that cannot be
 * mapped are skipped with a warning.
 */
@ApplicationScoped
public class VertxLlamaStackGateway implements LlamaStackGateway {

    private static final Logger LOG = Logger.getLogger(VertxLlamaStackGateway.class);

    static final String TOOLGROUPS_PATH = "/v1/toolgroups";
    static final String PROVIDERS_PATH = "/v1/providers";
    static final String VECTOR_DBS_PATH = "/v1/vector-dbs";
    static final String AGENTS_PATH = "/v1/agents";

    private static final JsonObject REACT_OUTPUT_SCHEMA = new JsonObject()
            .put("type", "object")
            .put(
                    "properties",
                    new JsonObject()
                            .put("thought", new JsonObject().put("type", "string"))
                            .put("action", new JsonObject().put("type", new JsonArray().add("object").add("null")))
                            .put("answer", new JsonObject().put("type", new JsonArray().add("string").add("null"))))
            .put("required", new JsonArray().add("thought"));

    private final WebClient webClient;
    private final LlamaStackConfig config;

    @Inject
    public VertxLlamaStackGateway(Vertx vertx, LlamaStackConfig config) {
        this.webClient = WebClient.create(vertx);
        this.config = config;
    }

    @Override
    public Uni<List<McpServer>> listToolGroups(Map<String, String> headers) {
        return list(TOOLGROUPS_PATH, headers, entry -> {
            final var endpoint = entry.getJsonObject("mcp_endpoint");
            return new McpServer(
                    entry.getString("identifier"),
                    entry.getString("identifier"),
                    entry.getString("provider_id"),
                    endpoint != null ? endpoint.getString("uri") : null,
                    null);
        });
    }

    @Override
    public Uni<List<ProviderDescriptor>> listProviders(Map<String, String> headers) {
        return list(PROVIDERS_PATH, headers, entry -> new ProviderDescriptor(
                entry.getString("api"), entry.getString("provider_id"), entry.getString("provider_type")));
    }

    @Override
    public Uni<List<KnowledgeBase>> listVectorDatabases(Map<String, String> headers) {
        return list(VECTOR_DBS_PATH, headers, entry -> new KnowledgeBase(
                entry.getString("identifier"),
                entry.getString("provider_resource_id"),
                entry.getString("provider_id"),
                entry.getString("embedding_model"),
                entry.getInteger("embedding_dimension", 0),
                null));
    }

    @Override
    public Uni<String> createAgent(AgentKind kind, AgentConfig agentConfig, Map<String, String> headers) {
        final var body = new JsonObject().put("agent_config", toJson(kind, agentConfig));

        return withHeaders(webClient.postAbs(config.url() + AGENTS_PATH), headers)
                .putHeader("Content-Type", "application/json")
                .sendJsonObject(body)
                .map(response -> {
                    ensureSuccess(response, AGENTS_PATH);
                    final var agentId = response.bodyAsJsonObject().getString("agent_id");
                    if (agentId == null || agentId.isBlank()) {
                        throw new LlamaStackException("llama-stack returned no agent_id");
                    }
                    return agentId;
                })
                .onFailure()
                .transform(error -> translate(error, AGENTS_PATH));
    }

    private <T> Uni<List<T>> list(String path, Map<String, String> headers, Function<JsonObject, T> mapper) {
        return withHeaders(webClient.getAbs(config.url() + path), headers)
                .send()
                .map(response -> {
                    ensureSuccess(response, path);
                    final var data = response.bodyAsJsonObject().getJsonArray("data", new JsonArray());
                    final var result = new ArrayList<T>(data.size());
                    for (int i = 0; i < data.size(); i++) {
                        final var value = data.getValue(i);
                        if (!(value instanceof JsonObject entry)) {
                            continue;
                        }
                        try {
                            result.add(mapper.apply(entry));
                        } catch (IllegalArgumentException | ClassCastException e) {
                            LOG.warnf("Skipping malformed entry from %s: %s", path, e.getMessage());
                        }
                    }
                    LOG.debugf("llama-stack %s returned %d entries", path, result.size());
                    return List.copyOf(result);
                })
                .onFailure()
                .transform(error -> translate(error, path));
    }

    private HttpRequest<Buffer> withHeaders(HttpRequest<Buffer> request, Map<String, String> headers) {
        request.timeout(config.timeout().toMillis()).putHeader("Accept", "application/json");
        headers.forEach(request::putHeader);
        return request;
    }

    private static void ensureSuccess(HttpResponse<Buffer> response, String path) {
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new LlamaStackException(
                    "llama-stack " + path + " returned status " + response.statusCode());
        }
    }

    private static Throwable translate(Throwable error, String path) {
        if (error instanceof LlamaStackException) {
            return error;
        }
        LOG.warnf("llama-stack %s call failed: %s", path, error.toString());
        return new LlamaStackException("llama-stack " + path + " call failed: " + error.getMessage(), error);
    }

    private static JsonObject toJson(AgentKind kind, AgentConfig agentConfig) {
        final var json = new JsonObject()
                .put("model", agentConfig.model())
                .put("instructions", agentConfig.instructions())
                .put("toolgroups", new JsonArray(new ArrayList<>(agentConfig.toolGroups())))
                .put("max_infer_iters", agentConfig.maxInferIters())
                .put("enable_session_persistence", false);
        if (kind == AgentKind.REACT) {
            json.put(
                    "response_format",
                    new JsonObject().put("type", "json_schema").put("json_schema", REACT_OUTPUT_SCHEMA));
        }
        return json;
    }
}
