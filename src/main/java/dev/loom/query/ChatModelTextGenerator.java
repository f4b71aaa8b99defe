package dev.loom.query;

import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;

/**
 * {@link TextGenerator} backed by a LangChain4j {@link ChatModel}.
 *
 * <p>Retries transient provider failures with exponential backoff. After the last attempt the
 * exception propagates so the enhancer can decide whether to degrade.
 */
@Component
public class ChatModelTextGenerator implements TextGenerator {

    private static final Logger log = LoggerFactory.getLogger(ChatModelTextGenerator.class);

    private final ChatModel chatModel;

    public ChatModelTextGenerator(ChatModel chatModel) {
        this.chatModel = chatModel;
    }

    @Override
    @Retryable(
            retryFor = RuntimeException.class,
            maxAttemptsExpression = "${loom.llm.retry.max-attempts:3}",
            backoff = @Backoff(
                    delayExpression = "${loom.llm.retry.delay-ms:500}",
                    multiplierExpression = "${loom.llm.retry.multiplier:2.0}"
            )
    )
    public String generate(String prompt, double temperature, int maxTokens) {
        ChatRequest request = ChatRequest.builder()
                .messages(UserMessage.from(prompt))
                .temperature(temperature)
                .maxOutputTokens(maxTokens)
                .build();

        ChatResponse response = chatModel.chat(request);
        String text = response.aiMessage().text();
        log.debug("Generated {} chars (temperature={}, maxTokens={})",
                text == null ? 0 : text.length(), temperature, maxTokens);
        return text == null ? "" : text;
    }
}
