package dev.pekelund.shelfscan.scanner.ai;

import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.DefaultChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import reactor.core.publisher.Flux;

/**
 * {@link ChatModel} registered when no Gemini API key is available, and for the
 * {@code local-scan-test} profile. Spring AI auto-configuration backs off and every call fails with
 * {@link AiConfigurationException}.
 */
public class UnconfiguredChatModel implements ChatModel {

    private final String reason;

    public UnconfiguredChatModel(String reason) {
        this.reason = reason;
    }

    @Override
    public ChatResponse call(Prompt prompt) {
        throw new AiConfigurationException(reason);
    }

    @Override
    public ChatOptions getDefaultOptions() {
        DefaultChatOptions options = new DefaultChatOptions();
        options.setModel("unconfigured");
        return options;
    }

    @Override
    public Flux<ChatResponse> stream(Prompt prompt) {
        return Flux.error(new AiConfigurationException(reason));
    }
}
