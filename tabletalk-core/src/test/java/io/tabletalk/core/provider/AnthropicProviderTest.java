package io.tabletalk.core.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tabletalk.core.model.ChatMessage;
import io.tabletalk.core.model.QueryFailure;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class AnthropicProviderTest {

    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldParseTextBlocksFromMessagesApi() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {
                  "content": [
                    {"type": "text", "text": "East:40, "},
                    {"type": "text", "text": "West:20"}
                  ],
                  "usage": {"input_tokens": 10, "output_tokens": 7}
                }
                """));

        LlmResponse response = provider().chat(
            "claude-sonnet-4-5",
            List.of(ChatMessage.system("You analyze tables."), ChatMessage.user("sum revenue by region"))
        );

        assertThat(response.content()).isEqualTo("East:40, West:20");
        assertThat(response.usage()).containsEntry("input_tokens", 10);

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/messages");
        assertThat(request.getHeader("x-api-key")).isEqualTo("sk-ant");
        assertThat(request.getHeader("anthropic-version")).isEqualTo("2023-06-01");
        String body = request.getBody().readUtf8();
        assertThat(body)
            .contains("\"model\":\"claude-sonnet-4-5\"")
            .contains("\"system\":\"You analyze tables.\"")
            .doesNotContain("\"role\":\"system\"");
    }

    @ParameterizedTest
    @CsvSource({
        "429, '{\"error\":{\"type\":\"rate_limit_error\"}}', RATE_LIMITED",
        "529, '{\"error\":{\"type\":\"overloaded_error\"}}', UPSTREAM_UNAVAILABLE",
        "500, 'boom', UPSTREAM_UNAVAILABLE",
        "504, 'gateway timeout', TIMEOUT",
        "400, '{\"error\":{\"message\":\"prompt is too long: 210000 tokens\"}}', CONTEXT_TOO_LARGE",
        "413, 'request too large', CONTEXT_TOO_LARGE",
        "400, '{\"error\":{\"message\":\"messages: field required\"}}', MALFORMED_OUTPUT"
    })
    void shouldClassifyHttpFailures(int status, String body, QueryFailure expected) {
        server.enqueue(new MockResponse().setResponseCode(status).setBody(body));

        assertThatThrownBy(() -> provider().chat("claude-sonnet-4-5", List.of(ChatMessage.user("hi"))))
            .isInstanceOf(LlmException.class)
            .satisfies(e -> assertThat(((LlmException) e).failure()).isEqualTo(expected));
    }

    @Test
    void shouldClassifyNonJsonBodyAsMalformedOutput() {
        server.enqueue(new MockResponse().setBody("<html>not json</html>"));

        assertThatThrownBy(() -> provider().chat("claude-sonnet-4-5", List.of(ChatMessage.user("hi"))))
            .isInstanceOf(LlmException.class)
            .satisfies(e -> assertThat(((LlmException) e).failure()).isEqualTo(QueryFailure.MALFORMED_OUTPUT));
    }

    @Test
    void shouldClassifyUnansweredCallAsTimeout() {
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));
        AnthropicProvider provider = new AnthropicProvider(
            "anthropic",
            "sk-ant",
            server.url("/v1/").toString(),
            256,
            Duration.ofMillis(500)
        );

        assertThatThrownBy(() -> provider.chat("claude-sonnet-4-5", List.of(ChatMessage.user("hi"))))
            .isInstanceOf(LlmException.class)
            .satisfies(e -> assertThat(((LlmException) e).failure()).isEqualTo(QueryFailure.TIMEOUT));
    }

    @Test
    void shouldFailWithoutCallingUpstreamWhenKeyMissing() {
        AnthropicProvider provider = new AnthropicProvider("anthropic", " ", server.url("/v1/").toString());

        assertThatThrownBy(() -> provider.chat("claude-sonnet-4-5", List.of(ChatMessage.user("hi"))))
            .isInstanceOf(LlmException.class)
            .hasMessageContaining("missing API key");
        assertThat(server.getRequestCount()).isZero();
    }

    private AnthropicProvider provider() {
        return new AnthropicProvider("anthropic", "sk-ant", server.url("/v1/").toString());
    }
}
