package dev.pekelund.genai.chat;

import dev.pekelund.genai.client.GenerativeServiceClient;
import dev.pekelund.genai.content.Candidate;
import dev.pekelund.genai.content.Content;
import dev.pekelund.genai.content.Part;
import dev.pekelund.genai.content.UsageMetadata;
import dev.pekelund.genai.model.GenerativeModel;
import dev.pekelund.genai.response.BaseGenerateContentResponse;
import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.MessageType;
import org.springframework.ai.chat.metadata.ChatGenerationMetadata;
import org.springframework.ai.chat.metadata.ChatResponseMetadata;
import org.springframework.ai.chat.metadata.DefaultUsage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.util.Assert;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;

/**
 * {@link ChatModel} backed by the Gemini generate and stream endpoints. System messages become the
 * system instruction, assistant messages are sent with the {@code model} role and every other
 * message is sent as user content.
 */
public class GeminiChatModel implements ChatModel {

    private static final Logger LOGGER = LoggerFactory.getLogger(GeminiChatModel.class);

    private final GenerativeServiceClient client;
    private final GeminiChatOptions defaultOptions;
    private final ObservationRegistry observationRegistry;

    public GeminiChatModel(GenerativeServiceClient client, GeminiChatOptions defaultOptions,
        ObservationRegistry observationRegistry) {
        Assert.notNull(client, "Generative service client must not be null");
        this.client = client;
        this.defaultOptions = defaultOptions != null ? defaultOptions : GeminiChatOptions.builder().build();
        this.observationRegistry = observationRegistry != null ? observationRegistry : ObservationRegistry.NOOP;
    }

    @Override
    public ChatResponse call(Prompt prompt) {
        Assert.notNull(prompt, "Prompt must not be null");
        GeminiChatOptions resolvedOptions = resolveOptions(prompt.getOptions());
        GenerativeModel model = model(prompt.getInstructions(), resolvedOptions);
        List<Content> contents = contents(prompt.getInstructions());
        Observation observation = Observation.start("google.ai.gemini.chat", observationRegistry)
            .highCardinalityKeyValue("model", model.getModelName());
        try (Observation.Scope scope = observation.openScope()) {
            LOGGER.info("Calling Gemini model '{}' with {} message(s)", model.getModelName(), contents.size());
            return toChatResponse(model.generateContent(contents), model.getModelName());
        } catch (RuntimeException ex) {
            observation.error(ex);
            throw ex;
        } finally {
            observation.stop();
        }
    }

    @Override
    public Flux<ChatResponse> stream(Prompt prompt) {
        Assert.notNull(prompt, "Prompt must not be null");
        GeminiChatOptions resolvedOptions = resolveOptions(prompt.getOptions());
        GenerativeModel model = model(prompt.getInstructions(), resolvedOptions);
        List<Content> contents = contents(prompt.getInstructions());
        return model.streamGenerateContentAsync(contents)
            .doOnSubscribe(subscription -> LOGGER.info("Streaming Gemini model '{}' with {} message(s)",
                model.getModelName(), contents.size()))
            .flatMapMany(response -> response.iterate().doFinally(signal -> response.close()))
            .map(chunk -> toChatResponse(chunk, model.getModelName()));
    }

    @Override
    public ChatOptions getDefaultOptions() {
        return defaultOptions;
    }

    private GeminiChatOptions resolveOptions(ChatOptions promptOptions) {
        return promptOptions != null ? defaultOptions.merge(GeminiChatOptions.from(promptOptions)) : defaultOptions;
    }

    private GenerativeModel model(List<Message> messages, GeminiChatOptions options) {
        String systemInstruction = messages == null ? null : messages.stream()
            .filter(message -> message.getMessageType() == MessageType.SYSTEM)
            .map(Message::getText)
            .filter(StringUtils::hasText)
            .collect(Collectors.joining("\n"));
        return GenerativeModel.builder(client)
            .modelName(options.getModel())
            .generationConfig(options.getGenerationConfig())
            .systemInstruction(systemInstruction)
            .build();
    }

    private List<Content> contents(List<Message> messages) {
        if (CollectionUtils.isEmpty(messages)) {
            throw new IllegalArgumentException("Prompt must contain at least one message");
        }
        List<Content> contents = new ArrayList<>();
        for (Message message : messages) {
            if (message.getMessageType() == MessageType.SYSTEM || !StringUtils.hasText(message.getText())) {
                continue;
            }
            String role = message.getMessageType() == MessageType.ASSISTANT ? Content.ROLE_MODEL : Content.ROLE_USER;
            contents.add(Content.of(role, Part.fromText(message.getText())));
        }
        if (contents.isEmpty()) {
            throw new IllegalArgumentException("Prompt must contain at least one user or assistant message");
        }
        return contents;
    }

    private static ChatResponse toChatResponse(BaseGenerateContentResponse response, String modelName) {
        List<Generation> generations = response.candidates().stream()
            .map(GeminiChatModel::toGeneration)
            .toList();
        ChatResponseMetadata.Builder metadata = ChatResponseMetadata.builder().model(modelName);
        UsageMetadata usage = response.usageMetadata();
        if (usage != null) {
            metadata.usage(new DefaultUsage(usage.promptTokenCount(), usage.candidatesTokenCount(),
                usage.totalTokenCount()));
        }
        return new ChatResponse(generations, metadata.build());
    }

    private static Generation toGeneration(Candidate candidate) {
        String text = candidate.parts().stream()
            .map(Part::text)
            .filter(Objects::nonNull)
            .collect(Collectors.joining());
        String finishReason = Optional.ofNullable(candidate.finishReason()).map(Enum::name).orElse(null);
        return new Generation(new AssistantMessage(text),
            ChatGenerationMetadata.builder().finishReason(finishReason).build());
    }
}
