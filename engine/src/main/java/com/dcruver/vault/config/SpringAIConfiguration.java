package com.dcruver.vault.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.ai.ollama.api.OllamaApi;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.ai.ollama.management.ModelManagementOptions;
import org.springframework.ai.ollama.management.PullModelStrategy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Creates the Spring AI ChatModel used to generate notes.
 */
@Configuration
@Slf4j
public class SpringAIConfiguration {

    @Value("${spring.ai.ollama.base-url:http://localhost:11434}")
    private String ollamaBaseUrl;

    @Value("${spring.ai.ollama.chat.options.model:gpt-oss:20b}")
    private String chatModelName;

    // Extraction wants deterministic output
    @Value("${spring.ai.ollama.chat.options.temperature:0.0}")
    private Double temperature;

    @Bean
    public OllamaApi ollamaApi() {
        log.info("Creating OllamaApi with base URL: {}", ollamaBaseUrl);
        return OllamaApi.builder()
                .baseUrl(ollamaBaseUrl)
                .build();
    }

    @Bean
    public ChatModel chatModel(OllamaApi ollamaApi) {
        log.info("Creating ChatModel with Ollama model: {}", chatModelName);

        var options = OllamaOptions.builder()
                .model(chatModelName)
                .temperature(temperature)
                .build();

        // Models are expected to be present in Ollama already
        var managementOptions = ModelManagementOptions.builder()
                .pullModelStrategy(PullModelStrategy.NEVER)
                .build();

        return OllamaChatModel.builder()
                .ollamaApi(ollamaApi)
                .defaultOptions(options)
                .modelManagementOptions(managementOptions)
                .build();
    }
}
