package com.deepansh.kernel.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Creates the concrete driver for the provider selected by {@code llm.provider}.
 * The driver is wrapped by ResilientLlmDriver, which is what the loop receives.
 */
@Configuration
@Slf4j
public class LlmClientConfig {

    @Value("${llm.provider:groq}")
    private String provider;

    @Bean
    @ConfigurationProperties(prefix = "llm.openai")
    public LlmProviderProperties openAiProperties() {
        return new LlmProviderProperties();
    }

    @Bean
    @ConfigurationProperties(prefix = "llm.groq")
    public LlmProviderProperties groqProperties() {
        return new LlmProviderProperties();
    }

    @Bean
    @ConfigurationProperties(prefix = "llm.gemini")
    public LlmProviderProperties geminiProperties() {
        return new LlmProviderProperties();
    }

    @PostConstruct
    public void logActiveProvider() {
        log.info("Active LLM provider: {}", provider.toUpperCase());
    }

    @Bean("openAiCompatibleDriver")
    public LlmDriver openAiCompatibleDriver(ObjectMapper objectMapper, RestClient.Builder builder) {
        LlmProviderProperties props = switch (provider.toLowerCase()) {
            case "openai" -> openAiProperties();
            case "gemini" -> geminiProperties();
            default -> groqProperties();
        };
        logKey(provider, props.getApiKey());
        return new OpenAiCompatibleDriver(props, objectMapper, provider.toLowerCase(), builder.clone());
    }

    private void logKey(String name, String key) {
        if (key == null || key.isBlank()) {
            log.error("{} API key not set! Set env var {}_API_KEY", name.toUpperCase(), name.toUpperCase());
        } else {
            log.info("{} key: {}...{}", name.toUpperCase(), key.substring(0, Math.min(8, key.length())),
                    key.length() > 8 ? key.substring(key.length() - 4) : "");
        }
    }
}
