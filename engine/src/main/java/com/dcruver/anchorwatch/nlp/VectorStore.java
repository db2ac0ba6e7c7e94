package com.dcruver.anchorwatch.nlp;

import java.util.List;
import java.util.Optional;

/**
 * Lookup surface over stored embeddings. Vectors are produced by the indexing
 * collaborators; the engine only reads them, apart from hypothetical documents
 * registered by administrators.
 *
 * Implementations throw {@link VectorStoreUnavailableException} when the store
 * itself cannot be reached, and return empty results when a vector is simply missing.
 */
public interface VectorStore {

    Optional<double[]> tagVector(String tagName);

    Optional<double[]> knowledgeBaseVector(String sourceLocation);

    Optional<double[]> hypotheticalDocumentVector(String key);

    /**
     * Source location of the knowledge-base item holding a program's charter
     */
    Optional<String> charterLocation(String programTag);

    /**
     * Chunk vectors of a document in chunk order; empty when it was never indexed
     */
    List<double[]> documentChunkVectors(long documentId);

    void storeTagVector(String tagName, double[] vector);

    void storeKnowledgeBaseVector(String sourceLocation, String programTag, String sourceType, double[] vector);

    void storeHypotheticalDocument(String key, String content, double[] vector);

    void storeDocumentChunks(long documentId, List<double[]> chunkVectors);
}
