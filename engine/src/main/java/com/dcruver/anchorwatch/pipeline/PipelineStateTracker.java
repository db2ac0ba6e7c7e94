package com.dcruver.anchorwatch.pipeline;

import com.dcruver.anchorwatch.domain.Document;
import com.dcruver.anchorwatch.domain.PipelineStage;
import com.dcruver.anchorwatch.store.DocumentStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Owns the per-document lifecycle timestamps.
 *
 * Frontiers are plain queries over null markers, so re-running after a crash simply
 * selects the same unfinished work again. Advancing never clears or rewinds a marker;
 * only {@link #reset} does that.
 */
@Component
@Slf4j
public class PipelineStateTracker {

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;
    private final DocumentStore documentStore;

    public PipelineStateTracker(DataSource dataSource, DocumentStore documentStore) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.namedJdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
        this.documentStore = documentStore;
    }

    /**
     * Documents whose previous stage is done but which have not reached {@code stage},
     * in id order after {@code afterId}
     */
    public List<Document> frontierFor(PipelineStage stage, long afterId, int limit) {
        PipelineStage predecessor = requirePredecessor(stage);
        List<Long> ids = jdbcTemplate.queryForList(
            "SELECT id FROM documents WHERE " + predecessor.getColumn() + " IS NOT NULL AND " +
            stage.getColumn() + " IS NULL AND id > ? ORDER BY id LIMIT ?",
            Long.class, afterId, limit);
        return documentStore.findByIds(ids);
    }

    public List<Document> frontierFor(PipelineStage stage, int limit) {
        return frontierFor(stage, 0L, limit);
    }

    public int frontierSize(PipelineStage stage) {
        PipelineStage predecessor = requirePredecessor(stage);
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM documents WHERE " + predecessor.getColumn() + " IS NOT NULL AND " +
            stage.getColumn() + " IS NULL",
            Integer.class);
        return count != null ? count : 0;
    }

    /**
     * Matched documents needing classifier attention: never enriched, or holding a link
     * of an active anchor that has no highlight decision yet. Keyed on the links rather
     * than on enriched_at alone, so links added after a document's first enrichment
     * are still picked up.
     */
    public List<Document> enrichmentFrontier(long afterId, int limit) {
        List<Long> ids = jdbcTemplate.queryForList("""
            SELECT d.id FROM documents d
            WHERE d.matched_at IS NOT NULL
              AND d.id > ?
              AND (d.enriched_at IS NULL OR EXISTS (
                    SELECT 1 FROM anchor_links l
                    JOIN semantic_anchors a ON a.id = l.anchor_id
                    WHERE l.document_id = d.id
                      AND l.anchor_highlight IS NULL
                      AND a.is_active = 1))
            ORDER BY d.id
            LIMIT ?
            """,
            Long.class, afterId, limit);
        return documentStore.findByIds(ids);
    }

    public int enrichmentFrontierSize() {
        Integer count = jdbcTemplate.queryForObject("""
            SELECT COUNT(*) FROM documents d
            WHERE d.matched_at IS NOT NULL
              AND (d.enriched_at IS NULL OR EXISTS (
                    SELECT 1 FROM anchor_links l
                    JOIN semantic_anchors a ON a.id = l.anchor_id
                    WHERE l.document_id = d.id
                      AND l.anchor_highlight IS NULL
                      AND a.is_active = 1))
            """, Integer.class);
        return count != null ? count : 0;
    }

    /**
     * Stamp {@code stage} on the given documents. Documents whose previous stage is not
     * done are left alone, and calling again with the same timestamp changes nothing.
     *
     * @return number of documents whose marker changed
     */
    public int advance(Collection<Long> documentIds, PipelineStage stage, Instant timestamp) {
        if (documentIds == null || documentIds.isEmpty()) {
            return 0;
        }

        String column = stage.getColumn();
        StringBuilder sql = new StringBuilder("UPDATE documents SET ")
            .append(column).append(" = :ts WHERE id IN (:ids)");

        PipelineStage predecessor = stage.predecessor();
        if (predecessor != null) {
            sql.append(" AND ").append(predecessor.getColumn()).append(" IS NOT NULL");
        }

        if (stage.isAdvancesOnRevisit()) {
            sql.append(" AND (").append(column).append(" IS NULL OR ").append(column).append(" < :ts)");
        } else {
            sql.append(" AND ").append(column).append(" IS NULL");
        }

        int updated = namedJdbcTemplate.update(sql.toString(), new MapSqlParameterSource()
            .addValue("ts", timestamp.toEpochMilli())
            .addValue("ids", documentIds));

        if (updated < documentIds.size()) {
            log.debug("Advanced {} of {} documents to {} (others already there or not ready)",
                updated, documentIds.size(), stage);
        }
        return updated;
    }

    public int advance(long documentId, PipelineStage stage, Instant timestamp) {
        return advance(List.of(documentId), stage, timestamp);
    }

    /**
     * Administrative reset: clear {@code fromStage} and every later marker, plus the
     * document-level highlight, so the documents re-enter the matching frontiers.
     */
    public int reset(Collection<Long> documentIds, PipelineStage fromStage) {
        if (documentIds == null || documentIds.isEmpty()) {
            return 0;
        }
        int updated = namedJdbcTemplate.update(
            "UPDATE documents SET " + clearedColumns(fromStage) + " WHERE id IN (:ids)",
            new MapSqlParameterSource("ids", documentIds));
        log.info("Reset {} documents from stage {}", updated, fromStage);
        return updated;
    }

    public int resetAll(PipelineStage fromStage) {
        int updated = jdbcTemplate.update("UPDATE documents SET " + clearedColumns(fromStage) +
            " WHERE " + fromStage.getColumn() + " IS NOT NULL OR org_highlight IS NOT NULL");
        log.info("Reset {} documents from stage {}", updated, fromStage);
        return updated;
    }

    /**
     * Ids of enriched documents in ascending order, for paged enrichment resets
     */
    public List<Long> enrichedDocumentIds(Integer limit, int offset) {
        if (limit == null) {
            return jdbcTemplate.queryForList(
                "SELECT id FROM documents WHERE enriched_at IS NOT NULL ORDER BY id", Long.class);
        }
        return jdbcTemplate.queryForList(
            "SELECT id FROM documents WHERE enriched_at IS NOT NULL ORDER BY id LIMIT ? OFFSET ?",
            Long.class, limit, offset);
    }

    private String clearedColumns(PipelineStage fromStage) {
        if (fromStage.predecessor() == null) {
            throw new IllegalArgumentException("Ingestion timestamps cannot be reset");
        }
        String markers = Arrays.stream(PipelineStage.values())
            .filter(s -> s.ordinal() >= fromStage.ordinal())
            .map(s -> s.getColumn() + " = NULL")
            .collect(Collectors.joining(", "));
        return markers + ", org_highlight = NULL";
    }

    private PipelineStage requirePredecessor(PipelineStage stage) {
        PipelineStage predecessor = stage.predecessor();
        if (predecessor == null) {
            throw new IllegalArgumentException("Stage " + stage + " has no frontier");
        }
        return predecessor;
    }
}
