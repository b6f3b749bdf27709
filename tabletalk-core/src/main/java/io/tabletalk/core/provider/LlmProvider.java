package io.tabletalk.core.provider;

import io.tabletalk.core.model.ChatMessage;
import java.util.List;

public interface LlmProvider {
    String name();

    LlmResponse chat(String model, List<ChatMessage> messages);
}
