package com.dcruver.anchorwatch.config;

import io.micrometer.observation.ObservationRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.ollama.OllamaEmbeddingModel;
import org.springframework.ai.ollama.api.OllamaApi;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.ai.ollama.management.ModelManagementOptions;
import org.springframework.ai.ollama.management.PullModelStrategy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring AI embedding model used when administrators register hypothetical documents.
 * Matching itself never calls the model; it only reads stored vectors.
 */
@Configuration
@Slf4j
public class SpringAIConfiguration {

    @Value("${spring.ai.ollama.base-url:http://localhost:11434}")
    private String ollamaBaseUrl;

    @Value("${spring.ai.ollama.embedding.options.model:nomic-embed-text:latest}")
    private String embeddingModelName;

    @Bean
    public OllamaApi ollamaApi() {
        log.info("Creating OllamaApi with base URL: {}", ollamaBaseUrl);
        return OllamaApi.builder()
                .baseUrl(ollamaBaseUrl)
                .build();
    }

    @Bean
    public EmbeddingModel embeddingModel(OllamaApi ollamaApi) {
        log.info("Creating EmbeddingModel with Ollama model: {}", embeddingModelName);

        var options = OllamaOptions.builder()
                .model(embeddingModelName)
                .build();

        // Models are provisioned with the vector store; never pull at runtime
        var managementOptions = ModelManagementOptions.builder()
                .pullModelStrategy(PullModelStrategy.NEVER)
                .build();

        return new OllamaEmbeddingModel(ollamaApi, options, ObservationRegistry.NOOP, managementOptions);
    }
}
