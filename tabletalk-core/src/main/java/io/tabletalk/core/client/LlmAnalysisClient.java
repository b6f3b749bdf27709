package io.tabletalk.core.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tabletalk.core.model.QueryFailure;
import io.tabletalk.core.provider.LlmException;
import io.tabletalk.core.provider.LlmProvider;
import io.tabletalk.core.provider.LlmResponse;
import java.io.IOException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LlmAnalysisClient implements AnalysisClient {
    private static final Logger LOG = LoggerFactory.getLogger(LlmAnalysisClient.class);

    private final LlmProvider provider;
    private final String model;
    private final AnalysisPromptBuilder promptBuilder;
    private final ObjectMapper mapper;

    public LlmAnalysisClient(LlmProvider provider, String model, AnalysisPromptBuilder promptBuilder) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.promptBuilder = Objects.requireNonNull(promptBuilder, "promptBuilder must not be null");
        this.mapper = new ObjectMapper();
    }

    @Override
    public AnalysisResult analyze(AnalysisRequest request) {
        LlmResponse response;
        try {
            response = provider.chat(model, promptBuilder.build(request));
        } catch (LlmException e) {
            throw new AnalysisException(e.failure(), e.getMessage(), e);
        }
        LOG.debug("Provider {} answered with usage {}", provider.name(), response.usage());
        return parse(response.content());
    }

    AnalysisResult parse(String content) {
        String body = stripCodeFence(content == null ? "" : content.trim());
        if (body.isBlank()) {
            throw new AnalysisException(QueryFailure.MALFORMED_OUTPUT, "Model returned an empty answer");
        }
        if (!body.startsWith("{")) {
            return AnalysisResult.text(body);
        }

        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (IOException e) {
            throw new AnalysisException(QueryFailure.MALFORMED_OUTPUT, "Model answer is not valid JSON", e);
        }
        JsonNode text = root.get("text");
        JsonNode visualization = root.get("visualization");
        boolean hasText = text != null && text.isTextual();
        boolean hasVisualization = visualization != null && !visualization.isNull();
        if (!hasText && !hasVisualization) {
            throw new AnalysisException(QueryFailure.MALFORMED_OUTPUT, "Model answer has neither text nor visualization");
        }
        if (hasVisualization && !visualization.isObject()) {
            throw new AnalysisException(QueryFailure.MALFORMED_OUTPUT, "Visualization must be a JSON object");
        }
        return new AnalysisResult(hasText ? text.asText() : "", hasVisualization ? visualization : null);
    }

    private String stripCodeFence(String value) {
        if (!value.startsWith("```")) {
            return value;
        }
        int firstNewline = value.indexOf('\n');
        int closing = value.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return value;
        }
        return value.substring(firstNewline + 1, closing).trim();
    }
}
