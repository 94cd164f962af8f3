package dev.pekelund.shelfscan.scanner.ai.googleai;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.content.Media;
import org.springframework.util.Assert;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * {@link ChatModel} that calls the Google AI Studio Gemini {@code generateContent} endpoint with an API
 * key. Text of every message is sent as one user turn; images attached to user messages are sent inline.
 */
public class GoogleAiGeminiChatModel implements ChatModel {

    public static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com/v1beta";

    private static final Logger LOGGER = LoggerFactory.getLogger(GoogleAiGeminiChatModel.class);

    private final RestClient restClient;
    private final String apiKey;
    private final ChatOptions defaultOptions;
    private final ObservationRegistry observationRegistry;

    public GoogleAiGeminiChatModel(RestClient restClient, String apiKey, ChatOptions defaultOptions,
        ObservationRegistry observationRegistry) {
        this.restClient = restClient;
        this.apiKey = apiKey;
        this.defaultOptions = defaultOptions != null ? defaultOptions : ChatOptions.builder().build();
        this.observationRegistry = observationRegistry != null ? observationRegistry : ObservationRegistry.NOOP;
    }

    @Override
    public ChatResponse call(Prompt prompt) {
        Assert.notNull(prompt, "Prompt must not be null");
        ChatOptions options = resolveOptions(prompt.getOptions());
        if (!StringUtils.hasText(options.getModel())) {
            throw new IllegalStateException("Gemini model name must be configured");
        }
        GenerateContentRequest request = buildRequest(prompt.getInstructions(), options);
        Observation observation = Observation.start("google.ai.gemini.call", observationRegistry)
            .highCardinalityKeyValue("model", options.getModel());
        try (Observation.Scope scope = observation.openScope()) {
            LOGGER.info("Calling Gemini model '{}' with {} content parts", options.getModel(),
                request.contents().get(0).parts().size());
            GenerateContentResponse response = generateContent(options.getModel(), request);
            Candidate candidate = firstCandidate(response);
            observation.lowCardinalityKeyValue("finish.reason",
                Optional.ofNullable(candidate.finishReason()).orElse("UNKNOWN"));
            return new ChatResponse(List.of(new Generation(new AssistantMessage(candidateText(candidate)))));
        } catch (RuntimeException ex) {
            observation.error(ex);
            throw ex;
        } finally {
            observation.stop();
        }
    }

    @Override
    public ChatOptions getDefaultOptions() {
        return defaultOptions;
    }

    ChatOptions resolveOptions(ChatOptions overrides) {
        if (overrides == null) {
            return defaultOptions;
        }
        return ChatOptions.builder()
            .model(StringUtils.hasText(overrides.getModel()) ? overrides.getModel() : defaultOptions.getModel())
            .temperature(firstNonNull(overrides.getTemperature(), defaultOptions.getTemperature()))
            .topP(firstNonNull(overrides.getTopP(), defaultOptions.getTopP()))
            .topK(firstNonNull(overrides.getTopK(), defaultOptions.getTopK()))
            .maxTokens(firstNonNull(overrides.getMaxTokens(), defaultOptions.getMaxTokens()))
            .build();
    }

    private static <T> T firstNonNull(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }

    private GenerateContentRequest buildRequest(List<Message> messages, ChatOptions options) {
        if (CollectionUtils.isEmpty(messages)) {
            throw new IllegalArgumentException("Prompt must contain at least one message");
        }
        List<GenerateContentRequest.Part> parts = new ArrayList<>();
        for (Message message : messages) {
            if (StringUtils.hasText(message.getText())) {
                parts.add(GenerateContentRequest.Part.text(message.getText()));
            }
            if (message instanceof UserMessage userMessage) {
                for (Media media : userMessage.getMedia()) {
                    parts.add(GenerateContentRequest.Part.inline(media.getMimeType().toString(),
                        Base64.getEncoder().encodeToString(media.getDataAsByteArray())));
                }
            }
        }
        GenerateContentRequest.GenerationConfig generationConfig = new GenerateContentRequest.GenerationConfig(
            options.getTemperature(), options.getTopP(), options.getTopK(), options.getMaxTokens());
        return new GenerateContentRequest(List.of(new GenerateContentRequest.Content("user", parts)),
            generationConfig);
    }

    private GenerateContentResponse generateContent(String model, GenerateContentRequest request) {
        try {
            return restClient.post()
                .uri("/models/{model}:generateContent?key={key}", model, apiKey)
                .body(request)
                .retrieve()
                .body(GenerateContentResponse.class);
        } catch (RestClientException ex) {
            throw new IllegalStateException("Google AI Gemini request failed", ex);
        }
    }

    private static Candidate firstCandidate(GenerateContentResponse response) {
        if (response != null && !CollectionUtils.isEmpty(response.candidates())
            && response.candidates().get(0) != null) {
            return response.candidates().get(0);
        }
        if (response != null && response.promptFeedback() != null
            && StringUtils.hasText(response.promptFeedback().blockReason())) {
            throw new IllegalStateException("Gemini blocked the prompt: " + response.promptFeedback().blockReason());
        }
        throw new IllegalStateException("Gemini response did not contain any candidates");
    }

    /**
     * Joins the text parts of a candidate. Long JSON answers can arrive split over several parts.
     */
    private static String candidateText(Candidate candidate) {
        StringBuilder text = new StringBuilder();
        if (candidate.content() != null && candidate.content().parts() != null) {
            for (TextPart part : candidate.content().parts()) {
                if (part != null && part.text() != null) {
                    text.append(part.text());
                }
            }
        }
        if (!StringUtils.hasText(text)) {
            throw new IllegalStateException("Gemini returned no text (finish reason: " + candidate.finishReason() + ")");
        }
        return text.toString();
    }

    private record GenerateContentRequest(List<Content> contents, GenerationConfig generationConfig) {

        private record Content(String role, List<Part> parts) {
        }

        @JsonInclude(JsonInclude.Include.NON_NULL)
        private record Part(String text, InlineData inlineData) {

            static Part text(String text) {
                return new Part(text, null);
            }

            static Part inline(String mimeType, String base64Data) {
                return new Part(null, new InlineData(mimeType, base64Data));
            }
        }

        private record InlineData(String mimeType, String data) {
        }

        @JsonInclude(JsonInclude.Include.NON_NULL)
        private record GenerationConfig(Double temperature, Double topP, Integer topK, Integer maxOutputTokens) {
        }
    }

    private record GenerateContentResponse(List<Candidate> candidates, PromptFeedback promptFeedback) {
    }

    private record PromptFeedback(String blockReason) {
    }

    private record Candidate(CandidateContent content, String finishReason) {
    }

    private record CandidateContent(List<TextPart> parts) {
    }

    private record TextPart(String text) {
    }
}
