package io.tabletalk.core.provider;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.tabletalk.core.model.ChatMessage;
import io.tabletalk.core.model.MessageRole;
import io.tabletalk.core.model.QueryFailure;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

public final class AnthropicProvider implements LlmProvider {
    private static final MediaType JSON = MediaType.get("application/json");
    private static final String API_VERSION = "2023-06-01";
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final String name;
    private final String apiKey;
    private final HttpUrl apiBase;
    private final int maxTokens;
    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public AnthropicProvider(String name, String apiKey, String apiBase) {
        this(name, apiKey, apiBase, 4096, Duration.ofSeconds(45));
    }

    public AnthropicProvider(String name, String apiKey, String apiBase, int maxTokens, Duration callTimeout) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.apiKey = apiKey == null ? "" : apiKey;
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.maxTokens = Math.max(1, maxTokens);
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(10))
            .readTimeout(callTimeout)
            .writeTimeout(Duration.ofSeconds(20))
            .callTimeout(callTimeout)
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LlmResponse chat(String model, List<ChatMessage> messages) {
        if (apiKey.isBlank()) {
            throw new LlmException(QueryFailure.UPSTREAM_UNAVAILABLE, "missing API key for provider " + name);
        }

        Request request;
        try {
            request = buildRequest(model, messages);
        } catch (IOException e) {
            throw new LlmException(QueryFailure.MALFORMED_OUTPUT, "Failed to encode request: " + e.getMessage(), e);
        }

        try (Response response = client.newCall(request).execute()) {
            String body = response.body() == null ? "" : response.body().string();
            if (!response.isSuccessful()) {
                throw new LlmException(
                    classifyStatus(response.code(), body),
                    "HTTP " + response.code() + " " + body
                );
            }
            return parseResponse(body);
        } catch (LlmException e) {
            throw e;
        } catch (InterruptedIOException e) {
            throw new LlmException(QueryFailure.TIMEOUT, "Call to " + name + " timed out", e);
        } catch (IOException e) {
            throw new LlmException(QueryFailure.UPSTREAM_UNAVAILABLE, "Call to " + name + " failed: " + e.getMessage(), e);
        }
    }

    static QueryFailure classifyStatus(int code, String body) {
        String text = body == null ? "" : body.toLowerCase(Locale.ROOT);
        if (code == 429) {
            return QueryFailure.RATE_LIMITED;
        }
        if (code == 408 || code == 504) {
            return QueryFailure.TIMEOUT;
        }
        if (code == 413 || (code == 400 && mentionsContextLimit(text))) {
            return QueryFailure.CONTEXT_TOO_LARGE;
        }
        if (code >= 500) {
            return QueryFailure.UPSTREAM_UNAVAILABLE;
        }
        return QueryFailure.MALFORMED_OUTPUT;
    }

    private static boolean mentionsContextLimit(String body) {
        return body.contains("prompt is too long")
            || body.contains("too many tokens")
            || body.contains("context length")
            || body.contains("context window");
    }

    private Request buildRequest(String model, List<ChatMessage> messages) throws IOException {
        ObjectNode payload = mapper.createObjectNode()
            .put("model", model)
            .put("max_tokens", maxTokens);
        StringBuilder system = new StringBuilder();
        ArrayNode turns = payload.putArray("messages");
        for (ChatMessage message : messages) {
            if (message.role() == MessageRole.SYSTEM) {
                system.append(system.length() == 0 ? "" : "\n\n").append(message.content());
            } else {
                turns.addObject()
                    .put("role", message.role() == MessageRole.ASSISTANT ? "assistant" : "user")
                    .put("content", message.content());
            }
        }
        if (!system.toString().isBlank()) {
            payload.put("system", system.toString());
        }

        return new Request.Builder()
            .url(apiBase.newBuilder().addPathSegment("messages").build())
            .header("x-api-key", apiKey)
            .header("anthropic-version", API_VERSION)
            .post(RequestBody.create(mapper.writeValueAsBytes(payload), JSON))
            .build();
    }

    private LlmResponse parseResponse(String body) {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (IOException e) {
            throw new LlmException(QueryFailure.MALFORMED_OUTPUT, "Response is not JSON", e);
        }
        if (root == null || !root.path("content").isArray()) {
            throw new LlmException(QueryFailure.MALFORMED_OUTPUT, "Response has no content array");
        }

        StringBuilder text = new StringBuilder();
        root.path("content").forEach(block -> {
            if ("text".equals(block.path("type").asText(""))) {
                text.append(block.path("text").asText(""));
            }
        });

        Map<String, Object> usage = root.has("usage")
            ? mapper.convertValue(root.path("usage"), MAP_TYPE)
            : Map.of();
        return new LlmResponse(text.toString(), usage);
    }
}
