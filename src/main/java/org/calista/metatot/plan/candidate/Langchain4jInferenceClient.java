package org.calista.metatot.plan.candidate;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.output.Response;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * InferenceClient над langchain4j {@link ChatLanguageModel}.
 * Любая ошибка модели/транспорта превращается в {@link InferenceException}.
 */
public final class Langchain4jInferenceClient implements InferenceClient {

    private static final Logger log = LogManager.getLogger(Langchain4jInferenceClient.class);

    private final ChatLanguageModel model;
    private final String label;

    public Langchain4jInferenceClient(ChatLanguageModel model, String label) {
        this.model = Objects.requireNonNull(model, "model");
        this.label = (label == null || label.isBlank()) ? model.getClass().getSimpleName() : label;
    }

    public static Langchain4jInferenceClient ollama(String baseUrl, String modelName, double temperature, long timeoutMs) {
        ChatLanguageModel m = OllamaChatModel.builder()
                .baseUrl(baseUrl)
                .modelName(modelName)
                .temperature(temperature)
                .timeout(Duration.ofMillis(Math.max(1L, timeoutMs)))
                .maxRetries(0)
                .build();
        log.info("Inference client created: provider=ollama baseUrl={} model={} timeoutMs={}", baseUrl, modelName, timeoutMs);
        return new Langchain4jInferenceClient(m, "ollama:" + modelName);
    }

    @Override
    public String generate(String systemPrompt, String userPrompt) throws InferenceException {
        List<ChatMessage> messages = List.of(
                SystemMessage.from(systemPrompt == null ? "" : systemPrompt),
                UserMessage.from(userPrompt == null ? "" : userPrompt));
        final Response<AiMessage> response;
        try {
            response = model.generate(messages);
        } catch (RuntimeException e) {
            throw new InferenceException(label + " call failed: " + e.getMessage(), e);
        }
        if (response == null || response.content() == null || response.content().text() == null) {
            throw new InferenceException(label + " returned an empty response");
        }
        return response.content().text();
    }

    @Override
    public String describe() {
        return label;
    }
}
