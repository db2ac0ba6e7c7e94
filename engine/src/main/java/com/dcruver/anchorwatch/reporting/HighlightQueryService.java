package com.dcruver.anchorwatch.reporting;

import com.dcruver.anchorwatch.domain.SourceTier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;

/**
 * Read-only view over classified links. Delivery code depends on this and nothing else.
 */
@Service
@Slf4j
public class HighlightQueryService {

    private static final String SELECT_CLASSIFIED = """
        SELECT l.id, l.document_id, l.anchor_id, l.similarity_score, l.created_at,
               l.anchor_highlight, l.org_highlight,
               d.title, d.link, d.source_name, d.category,
               a.name AS anchor_name
        FROM anchor_links l
        JOIN documents d ON d.id = l.document_id
        JOIN semantic_anchors a ON a.id = l.anchor_id
        WHERE l.anchor_highlight IS NOT NULL
          AND l.created_at >= ? AND l.created_at < ?
        """;

    private final JdbcTemplate jdbcTemplate;

    public HighlightQueryService(DataSource dataSource) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
    }

    /**
     * Every classified link created in {@code [from, to)}, highlighted or not,
     * newest first.
     */
    public List<HighlightRecord> highlights(Instant from, Instant to) {
        if (!from.isBefore(to)) {
            throw new IllegalArgumentException("Empty window: " + from + " to " + to);
        }
        List<HighlightRecord> records = jdbcTemplate.query(
            SELECT_CLASSIFIED + " ORDER BY l.created_at DESC, l.id",
            new HighlightRowMapper(), from.toEpochMilli(), to.toEpochMilli());
        log.debug("Found {} classified links between {} and {}", records.size(), from, to);
        return records;
    }

    /**
     * Only the links that passed their anchor threshold
     */
    public List<HighlightRecord> anchorHighlights(Instant from, Instant to) {
        return highlights(from, to).stream()
            .filter(HighlightRecord::isAnchorHighlight)
            .toList();
    }

    private static class HighlightRowMapper implements RowMapper<HighlightRecord> {
        @Override
        public HighlightRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            int orgHighlight = rs.getInt("org_highlight");
            Boolean org = rs.wasNull() ? null : orgHighlight != 0;
            String category = rs.getString("category");

            return HighlightRecord.builder()
                .linkId(rs.getLong("id"))
                .documentId(rs.getLong("document_id"))
                .anchorId(rs.getLong("anchor_id"))
                .anchorName(rs.getString("anchor_name"))
                .title(rs.getString("title"))
                .link(rs.getString("link"))
                .sourceName(rs.getString("source_name"))
                .category(category)
                .tier(SourceTier.forCategory(category))
                .score(rs.getDouble("similarity_score"))
                .createdAt(Instant.ofEpochMilli(rs.getLong("created_at")))
                .anchorHighlight(rs.getInt("anchor_highlight") != 0)
                .orgHighlight(org)
                .build();
        }
    }
}
