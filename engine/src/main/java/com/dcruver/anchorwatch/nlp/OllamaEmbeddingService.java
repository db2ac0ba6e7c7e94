package com.dcruver.anchorwatch.nlp;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingResponse;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Generates embeddings for administrator-supplied text via Spring AI.
 */
@Service
@Slf4j
public class OllamaEmbeddingService {

    private final EmbeddingModel embeddingModel;

    public OllamaEmbeddingService(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
        log.info("OllamaEmbeddingService initialized with EmbeddingModel: {}", embeddingModel.getClass().getSimpleName());
    }

    /**
     * Embedding for a single text; empty array when nothing could be generated
     */
    public double[] embed(String text) {
        if (text == null || text.isBlank()) {
            log.warn("Cannot generate embedding for empty text");
            return new double[0];
        }

        try {
            EmbeddingResponse response = embeddingModel.embedForResponse(List.of(text));
            if (response.getResults().isEmpty()) {
                log.warn("No embedding generated for text");
                return new double[0];
            }

            float[] floatArray = response.getResults().get(0).getOutput();
            double[] result = new double[floatArray.length];
            for (int i = 0; i < floatArray.length; i++) {
                result[i] = floatArray[i];
            }
            return result;
        } catch (Exception e) {
            log.error("Failed to generate embedding", e);
            return new double[0];
        }
    }
}
