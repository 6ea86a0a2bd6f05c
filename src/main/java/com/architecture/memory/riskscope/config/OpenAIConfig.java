package com.architecture.memory.riskscope.config;

import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration for the OpenAI chat model that backs the investigation reasoning service.
 * Reads API key and model name from application.yml properties. Without an API key no model bean
 * is created and the pipeline runs in degraded (baseline-only) mode.
 */
@Configuration
@Slf4j
@ConditionalOnExpression("'${openai.api-key:}' != ''")
public class OpenAIConfig {

    @Value("${openai.api-key}")
    private String apiKey;

    @Value("${openai.model.chat:gpt-4o-mini}")
    private String chatModel;

    @Value("${openai.timeout:10}")
    private int timeoutSeconds;

    @Value("${openai.max-retries:0}")
    private int maxRetries;

    /**
     * Chat model used for DECIDE and SYNTHESIZE calls. Retries stay at the caller, which
     * owns the malformed-response retry and the per-call timeout.
     */
    @Bean
    public ChatLanguageModel chatLanguageModel() {
        log.info("[OpenAI Config] Initializing ChatLanguageModel with model: {}", chatModel);

        return OpenAiChatModel.builder()
                .apiKey(apiKey)
                .modelName(chatModel)
                .temperature(0.0)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .maxRetries(maxRetries)
                .maxTokens(1200)
                .logRequests(false)
                .logResponses(false)
                .build();
    }
}
