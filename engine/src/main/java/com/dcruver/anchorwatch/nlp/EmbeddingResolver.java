package com.dcruver.anchorwatch.nlp;

import com.dcruver.anchorwatch.domain.AnchorComponent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Resolves anchor components and documents to stored vectors. Pure lookup: nothing
 * is computed or cached here.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EmbeddingResolver {

    private final VectorStore vectorStore;

    /**
     * Vector of one component, or empty when the store has none for it
     */
    public Optional<double[]> resolve(AnchorComponent component) {
        String id = component.getComponentId();
        return switch (component.getType()) {
            case TAG -> vectorStore.tagVector(id);
            case KB_ITEM -> vectorStore.knowledgeBaseVector(id);
            case HYPOTHETICAL_DOCUMENT -> vectorStore.hypotheticalDocumentVector(id);
            case PROGRAM -> vectorStore.charterLocation(id)
                .flatMap(vectorStore::knowledgeBaseVector);
        };
    }

    public List<double[]> vectorsOf(long documentId) {
        return vectorStore.documentChunkVectors(documentId);
    }
}
