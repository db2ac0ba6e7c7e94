package com.dcruver.anchorwatch.nlp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import javax.sql.DataSource;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Stores embeddings as JSON arrays in SQLite.
 */
@Component
@Slf4j
public class JdbcVectorStore implements VectorStore {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final String embedModel;

    public JdbcVectorStore(
        DataSource dataSource,
        @Value("${spring.ai.ollama.embedding.options.model:nomic-embed-text:latest}") String embedModel
    ) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.embedModel = embedModel;
    }

    @PostConstruct
    public void init() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS tag_embeddings (
                tag_name TEXT PRIMARY KEY,
                model TEXT NOT NULL,
                embedding_json TEXT NOT NULL,
                created_at INTEGER NOT NULL
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS knowledge_base (
                source_location TEXT PRIMARY KEY,
                program_tag TEXT,
                source_type TEXT,
                model TEXT NOT NULL,
                embedding_json TEXT NOT NULL,
                created_at INTEGER NOT NULL
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS hypothetical_documents (
                doc_key TEXT PRIMARY KEY,
                content TEXT NOT NULL,
                model TEXT NOT NULL,
                embedding_json TEXT NOT NULL,
                created_at INTEGER NOT NULL
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS document_chunks (
                document_id INTEGER NOT NULL,
                chunk_index INTEGER NOT NULL,
                model TEXT NOT NULL,
                embedding_json TEXT NOT NULL,
                PRIMARY KEY (document_id, chunk_index)
            )
            """);

        log.info("Initialized vector store");
    }

    @Override
    public Optional<double[]> tagVector(String tagName) {
        return single("tag " + tagName, () -> jdbcTemplate.queryForList(
            "SELECT embedding_json FROM tag_embeddings WHERE tag_name = ?", String.class, tagName));
    }

    @Override
    public Optional<double[]> knowledgeBaseVector(String sourceLocation) {
        return single("kb item " + sourceLocation, () -> jdbcTemplate.queryForList(
            "SELECT embedding_json FROM knowledge_base WHERE source_location = ?", String.class, sourceLocation));
    }

    @Override
    public Optional<double[]> hypotheticalDocumentVector(String key) {
        return single("hypothetical document " + key, () -> jdbcTemplate.queryForList(
            "SELECT embedding_json FROM hypothetical_documents WHERE doc_key = ?", String.class, key));
    }

    @Override
    public Optional<String> charterLocation(String programTag) {
        List<String> locations = read("charter of " + programTag, () -> jdbcTemplate.queryForList(
            "SELECT source_location FROM knowledge_base WHERE program_tag = ? AND source_type = 'program_charter' " +
            "ORDER BY source_location LIMIT 1",
            String.class, programTag));
        return locations.stream().findFirst();
    }

    @Override
    public List<double[]> documentChunkVectors(long documentId) {
        List<String> rows = read("chunks of document " + documentId, () -> jdbcTemplate.queryForList(
            "SELECT embedding_json FROM document_chunks WHERE document_id = ? ORDER BY chunk_index",
            String.class, documentId));

        List<double[]> vectors = new ArrayList<>(rows.size());
        for (String json : rows) {
            decode(json, "chunk of document " + documentId).ifPresent(vectors::add);
        }
        return vectors;
    }

    @Override
    public void storeTagVector(String tagName, double[] vector) {
        jdbcTemplate.update(
            "INSERT OR REPLACE INTO tag_embeddings (tag_name, model, embedding_json, created_at) VALUES (?, ?, ?, ?)",
            tagName, embedModel, encode(vector), Instant.now().toEpochMilli());
        log.debug("Stored embedding for tag {}", tagName);
    }

    @Override
    public void storeKnowledgeBaseVector(String sourceLocation, String programTag, String sourceType, double[] vector) {
        jdbcTemplate.update(
            "INSERT OR REPLACE INTO knowledge_base (source_location, program_tag, source_type, model, embedding_json, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?)",
            sourceLocation, programTag, sourceType, embedModel, encode(vector), Instant.now().toEpochMilli());
        log.debug("Stored embedding for kb item {}", sourceLocation);
    }

    @Override
    public void storeHypotheticalDocument(String key, String content, double[] vector) {
        jdbcTemplate.update(
            "INSERT OR REPLACE INTO hypothetical_documents (doc_key, content, model, embedding_json, created_at) " +
            "VALUES (?, ?, ?, ?, ?)",
            key, content, embedModel, encode(vector), Instant.now().toEpochMilli());
        log.debug("Stored embedding for hypothetical document {}", key);
    }

    @Override
    public void storeDocumentChunks(long documentId, List<double[]> chunkVectors) {
        jdbcTemplate.update("DELETE FROM document_chunks WHERE document_id = ?", documentId);
        List<Object[]> rows = new ArrayList<>(chunkVectors.size());
        for (int i = 0; i < chunkVectors.size(); i++) {
            rows.add(new Object[]{documentId, i, embedModel, encode(chunkVectors.get(i))});
        }
        jdbcTemplate.batchUpdate(
            "INSERT INTO document_chunks (document_id, chunk_index, model, embedding_json) VALUES (?, ?, ?, ?)", rows);
        log.debug("Stored {} chunk embeddings for document {}", chunkVectors.size(), documentId);
    }

    private Optional<double[]> single(String what, Supplier<List<String>> query) {
        List<String> rows = read(what, query);
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        return decode(rows.get(0), what);
    }

    private <T> T read(String what, Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessException e) {
            throw new VectorStoreUnavailableException("Vector store lookup failed for " + what, e);
        }
    }

    private Optional<double[]> decode(String json, String what) {
        try {
            return Optional.of(objectMapper.readValue(json, double[].class));
        } catch (JsonProcessingException e) {
            log.error("Corrupt embedding stored for {}", what, e);
            return Optional.empty();
        }
    }

    private String encode(double[] vector) {
        try {
            return objectMapper.writeValueAsString(vector);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize embedding", e);
        }
    }
}
