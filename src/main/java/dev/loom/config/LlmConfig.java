package dev.loom.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configures the chat model used for query enhancement.
 *
 * <p>Any OpenAI-compatible endpoint works via {@code loom.llm.base-url}. The client's own retries
 * are disabled; retries happen in {@link dev.loom.query.ChatModelTextGenerator}.
 */
@Configuration
public class LlmConfig {

    @Bean
    public ChatModel chatModel(
            @Value("${loom.llm.base-url:https://api.openai.com/v1}") String baseUrl,
            @Value("${loom.llm.api-key:${OPENAI_API_KEY:not-set}}") String apiKey,
            @Value("${loom.llm.model:gpt-4o-mini}") String model,
            @Value("${loom.llm.timeout:30s}") Duration timeout) {
        return OpenAiChatModel.builder()
                .baseUrl(baseUrl)
                .apiKey(apiKey)
                .modelName(model)
                .timeout(timeout)
                .maxRetries(0)
                .build();
    }
}
