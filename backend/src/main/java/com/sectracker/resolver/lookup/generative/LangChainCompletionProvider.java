package com.sectracker.resolver.lookup.generative;

import com.sectracker.resolver.config.LookupProperties;
import com.sectracker.resolver.lookup.ProviderUnavailableException;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.output.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Completion backed by an OpenAI-compatible chat endpoint through LangChain4j.
 */
public class LangChainCompletionProvider implements CompletionProvider {
    private static final Logger log = LoggerFactory.getLogger(LangChainCompletionProvider.class);
    static final String PROVIDER = "generative-model";

    private final ChatLanguageModel chatModel;
    private final String modelName;

    public LangChainCompletionProvider(LookupProperties.Generative generative) {
        this(
            OpenAiChatModel.builder()
                .baseUrl(generative.getBaseUrl())
                .apiKey(generative.getApiKey())
                .modelName(generative.getModel())
                .maxTokens(generative.getMaxTokens())
                .temperature(0.0)
                .timeout(Duration.ofSeconds(generative.getTimeoutSeconds()))
                .maxRetries(1)
                .build(),
            generative.getModel()
        );
    }

    LangChainCompletionProvider(ChatLanguageModel chatModel, String modelName) {
        this.chatModel = chatModel;
        this.modelName = modelName;
    }

    @Override
    public String complete(String prompt) {
        String requestId = UUID.randomUUID().toString().substring(0, 8);
        long startedAt = System.nanoTime();
        log.debug("Completion request {} model={} promptChars={}", requestId, modelName, prompt.length());
        try {
            List<ChatMessage> messages = List.of(UserMessage.from(prompt));
            Response<AiMessage> response = chatModel.generate(messages);
            AiMessage message = response == null ? null : response.content();
            String text = message == null || message.text() == null ? "" : message.text();
            log.info(
                "Completion request {} model={} promptChars={} answerChars={} latencyMs={}",
                requestId,
                modelName,
                prompt.length(),
                text.length(),
                (System.nanoTime() - startedAt) / 1_000_000
            );
            return text;
        } catch (RuntimeException e) {
            log.warn("Completion request {} model={} failed after {}ms: {}",
                requestId, modelName, (System.nanoTime() - startedAt) / 1_000_000, e.getMessage());
            throw new ProviderUnavailableException(PROVIDER, "completion request failed: " + e.getMessage(), e);
        }
    }
}
