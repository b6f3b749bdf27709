package io.tabletalk.core.client;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.tabletalk.core.model.ChatMessage;
import io.tabletalk.core.model.Exchange;
import io.tabletalk.core.model.ExchangeStatus;
import io.tabletalk.core.model.MessageRole;
import io.tabletalk.core.model.Table;
import io.tabletalk.core.model.TableColumn;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class AnalysisPromptBuilderTest {

    @Test
    void shouldSummarizeNumericColumnsWhenRowsAreTruncated() {
        List<List<Object>> rows = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            rows.add(List.<Object>of("r" + i, (long) i * 10));
        }
        Table table = new Table(List.of(new TableColumn("region", "string"), new TableColumn("revenue", "integer")), rows);

        String description = new AnalysisPromptBuilder(2).describeTable(table);

        assertThat(description)
            .contains("Rows (2 of 5)")
            .contains("[\"r2\",20]")
            .doesNotContain("[\"r3\",30]")
            .contains("- revenue: count=5, sum=150, min=10, max=50")
            .doesNotContain("- region: count");
    }

    @Test
    void shouldSkipNonFiniteValuesInSummary() {
        List<List<Object>> rows = List.of(
            List.<Object>of("r1", 1.5),
            List.<Object>of("r2", Double.POSITIVE_INFINITY),
            List.<Object>of("r3", Double.NaN),
            List.<Object>of("r4", 2.5),
            List.<Object>of("r5", Float.NEGATIVE_INFINITY)
        );
        Table table = new Table(List.of(new TableColumn("region", "string"), new TableColumn("price", "number")), rows);

        String description = new AnalysisPromptBuilder(1).describeTable(table);

        assertThat(description).contains("- price: count=2, sum=4.0, min=1.5, max=2.5");
    }

    @Test
    void shouldReplayContextAsAlternatingTurns() {
        Table table = new Table(List.of(new TableColumn("region", "string")), List.of(List.<Object>of("East")));
        Exchange earlier = new Exchange(
            "e1",
            "s1",
            1,
            "sum revenue by region",
            "East:40, West:20",
            JsonNodeFactory.instance.objectNode().put("mark", "bar"),
            ExchangeStatus.SUCCESS,
            null,
            null,
            Instant.parse("2026-03-01T10:00:00Z")
        );

        List<ChatMessage> messages = new AnalysisPromptBuilder(10)
            .build(new AnalysisRequest(table, List.of(earlier), "and as a percentage", true));

        assertThat(messages).extracting(ChatMessage::role)
            .containsExactly(MessageRole.SYSTEM, MessageRole.USER, MessageRole.ASSISTANT, MessageRole.USER);
        assertThat(messages.get(0).content()).contains("Vega-Lite");
        assertThat(messages.get(2).content()).isEqualTo("East:40, West:20");
        assertThat(messages.get(3).content()).isEqualTo("and as a percentage");
    }
}
