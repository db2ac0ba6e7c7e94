package com.dcruver.anchorwatch.store;

import com.dcruver.anchorwatch.domain.AnchorLink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Document-anchor links. The (document_id, anchor_id) pair is unique and every write
 * goes through an upsert, so reprocessing a document can never duplicate a link.
 */
@Component
@Slf4j
public class LinkStore {

    private static final RowMapper<AnchorLink> ROW_MAPPER = new LinkRowMapper();

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;

    public LinkStore(DataSource dataSource) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.namedJdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
    }

    @PostConstruct
    public void init() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS anchor_links (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                document_id INTEGER NOT NULL,
                anchor_id INTEGER NOT NULL,
                similarity_score REAL NOT NULL,
                created_at INTEGER NOT NULL,
                anchor_highlight INTEGER,
                org_highlight INTEGER,
                UNIQUE (document_id, anchor_id)
            )
            """);

        jdbcTemplate.execute("""
            CREATE INDEX IF NOT EXISTS idx_links_anchor_created
            ON anchor_links(anchor_id, created_at)
            """);

        jdbcTemplate.execute("""
            CREATE INDEX IF NOT EXISTS idx_links_unresolved
            ON anchor_links(anchor_highlight, document_id)
            """);

        log.info("Initialized link store");
    }

    /**
     * Insert or refresh links. A changed score invalidates earlier highlight decisions,
     * so existing rows get their flags cleared and re-enter the classifier frontier.
     */
    public int upsertAll(List<AnchorLink> links) {
        if (links.isEmpty()) {
            return 0;
        }
        List<Object[]> rows = links.stream()
            .map(l -> new Object[]{l.getDocumentId(), l.getAnchorId(), l.getScore(), JdbcSupport.millis(l.getCreatedAt())})
            .toList();
        jdbcTemplate.batchUpdate("""
            INSERT INTO anchor_links (document_id, anchor_id, similarity_score, created_at)
            VALUES (?, ?, ?, ?)
            ON CONFLICT (document_id, anchor_id) DO UPDATE SET
                similarity_score = excluded.similarity_score,
                anchor_highlight = NULL,
                org_highlight = NULL
            """, rows);
        log.debug("Upserted {} links", links.size());
        return links.size();
    }

    /**
     * Remove stored links for the given document-anchor pairs. Scores and flags are ignored.
     */
    public int deletePairs(List<AnchorLink> pairs) {
        if (pairs.isEmpty()) {
            return 0;
        }
        List<Object[]> rows = pairs.stream()
            .map(l -> new Object[]{l.getDocumentId(), l.getAnchorId()})
            .toList();
        int deleted = 0;
        for (int count : jdbcTemplate.batchUpdate(
                "DELETE FROM anchor_links WHERE document_id = ? AND anchor_id = ?", rows)) {
            deleted += Math.max(count, 0);
        }
        if (deleted > 0) {
            log.debug("Deleted {} links that no longer pass the pre-filter", deleted);
        }
        return deleted;
    }

    public List<AnchorLink> findByDocuments(Collection<Long> documentIds) {
        if (JdbcSupport.isEmpty(documentIds)) {
            return List.of();
        }
        return namedJdbcTemplate.query(
            "SELECT * FROM anchor_links WHERE document_id IN (:ids) ORDER BY document_id, anchor_id",
            new MapSqlParameterSource("ids", documentIds),
            ROW_MAPPER);
    }

    /**
     * Links still awaiting a highlight decision whose anchor is active
     */
    public List<AnchorLink> findUnresolvedForDocuments(Collection<Long> documentIds) {
        if (JdbcSupport.isEmpty(documentIds)) {
            return List.of();
        }
        return namedJdbcTemplate.query("""
            SELECT l.* FROM anchor_links l
            JOIN semantic_anchors a ON a.id = l.anchor_id
            WHERE l.document_id IN (:ids)
              AND l.anchor_highlight IS NULL
              AND a.is_active = 1
            ORDER BY l.document_id, l.anchor_id
            """,
            new MapSqlParameterSource("ids", documentIds),
            ROW_MAPPER);
    }

    public List<AnchorLink> findAll() {
        return jdbcTemplate.query("SELECT * FROM anchor_links ORDER BY document_id, anchor_id", ROW_MAPPER);
    }

    public void updateAnchorHighlights(Map<Long, Boolean> highlightsByLink) {
        if (highlightsByLink.isEmpty()) {
            return;
        }
        List<Object[]> rows = highlightsByLink.entrySet().stream()
            .map(e -> new Object[]{JdbcSupport.flagValue(e.getValue()), e.getKey()})
            .toList();
        jdbcTemplate.batchUpdate("UPDATE anchor_links SET anchor_highlight = ? WHERE id = ?", rows);
    }

    /**
     * Copy the document-level highlight onto every resolved link of each document
     */
    public void updateOrgHighlights(Map<Long, Boolean> highlightsByDocument) {
        if (highlightsByDocument.isEmpty()) {
            return;
        }
        List<Object[]> rows = highlightsByDocument.entrySet().stream()
            .map(e -> new Object[]{JdbcSupport.flagValue(e.getValue()), e.getKey()})
            .toList();
        jdbcTemplate.batchUpdate(
            "UPDATE anchor_links SET org_highlight = ? WHERE document_id = ? AND anchor_highlight IS NOT NULL", rows);
    }

    /**
     * Scores of links created since the given instant, paired with the category of the
     * scored document. Links of inactive anchors are left out.
     */
    public List<ScoreSample> scoreSamplesSince(Instant since) {
        return jdbcTemplate.query("""
            SELECT l.anchor_id, d.category, l.similarity_score
            FROM anchor_links l
            JOIN documents d ON d.id = l.document_id
            JOIN semantic_anchors a ON a.id = l.anchor_id
            WHERE a.is_active = 1 AND l.created_at >= ?
            ORDER BY l.anchor_id, l.id
            """,
            (rs, rowNum) -> new ScoreSample(rs.getLong("anchor_id"), rs.getString("category"), rs.getDouble("similarity_score")),
            since.toEpochMilli());
    }

    public List<Long> documentIdsForAnchor(long anchorId) {
        return jdbcTemplate.queryForList(
            "SELECT DISTINCT document_id FROM anchor_links WHERE anchor_id = ? ORDER BY document_id", Long.class, anchorId);
    }

    public int deleteAll() {
        return jdbcTemplate.update("DELETE FROM anchor_links");
    }

    public int deleteByAnchor(long anchorId) {
        return jdbcTemplate.update("DELETE FROM anchor_links WHERE anchor_id = ?", anchorId);
    }

    public int deleteByDocuments(Collection<Long> documentIds) {
        if (JdbcSupport.isEmpty(documentIds)) {
            return 0;
        }
        return namedJdbcTemplate.update(
            "DELETE FROM anchor_links WHERE document_id IN (:ids)",
            new MapSqlParameterSource("ids", documentIds));
    }

    public int clearFlagsForDocuments(Collection<Long> documentIds) {
        if (JdbcSupport.isEmpty(documentIds)) {
            return 0;
        }
        return namedJdbcTemplate.update(
            "UPDATE anchor_links SET anchor_highlight = NULL, org_highlight = NULL WHERE document_id IN (:ids)",
            new MapSqlParameterSource("ids", documentIds));
    }

    public int count() {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM anchor_links", Integer.class);
        return count != null ? count : 0;
    }

    public int countFor(long documentId, long anchorId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM anchor_links WHERE document_id = ? AND anchor_id = ?",
            Integer.class, documentId, anchorId);
        return count != null ? count : 0;
    }

    /**
     * One historical score used for threshold statistics
     */
    public record ScoreSample(long anchorId, String category, double score) {}

    private static class LinkRowMapper implements RowMapper<AnchorLink> {
        @Override
        public AnchorLink mapRow(ResultSet rs, int rowNum) throws SQLException {
            return AnchorLink.builder()
                .id(rs.getLong("id"))
                .documentId(rs.getLong("document_id"))
                .anchorId(rs.getLong("anchor_id"))
                .score(rs.getDouble("similarity_score"))
                .createdAt(JdbcSupport.instant(rs, "created_at"))
                .anchorHighlight(JdbcSupport.flag(rs, "anchor_highlight"))
                .orgHighlight(JdbcSupport.flag(rs, "org_highlight"))
                .build();
        }
    }
}
