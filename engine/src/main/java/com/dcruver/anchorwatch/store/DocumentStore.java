package com.dcruver.anchorwatch.store;

import com.dcruver.anchorwatch.domain.Document;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Document metadata. Lifecycle timestamps are written only through
 * {@code PipelineStateTracker}; this store owns identity, category and the
 * document-level highlight.
 */
@Component
@Slf4j
public class DocumentStore {

    static final RowMapper<Document> ROW_MAPPER = new DocumentRowMapper();

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;

    public DocumentStore(DataSource dataSource) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.namedJdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
    }

    @PostConstruct
    public void init() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS documents (
                id INTEGER PRIMARY KEY,
                source_name TEXT,
                category TEXT,
                title TEXT,
                link TEXT,
                ingested_at INTEGER NOT NULL,
                indexed_at INTEGER,
                matched_at INTEGER,
                enriched_at INTEGER,
                org_highlight INTEGER
            )
            """);

        jdbcTemplate.execute("""
            CREATE INDEX IF NOT EXISTS idx_documents_matched
            ON documents(matched_at, indexed_at)
            """);

        log.info("Initialized document store");
    }

    /**
     * Register a document as the ingestion side would. A zero id lets SQLite assign one.
     */
    public long insert(Document document) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(
                "INSERT INTO documents (id, source_name, category, title, link, ingested_at, indexed_at, matched_at, enriched_at) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                Statement.RETURN_GENERATED_KEYS);
            if (document.getId() > 0) {
                ps.setLong(1, document.getId());
            } else {
                ps.setNull(1, Types.INTEGER);
            }
            ps.setString(2, document.getSourceName());
            ps.setString(3, document.getCategory());
            ps.setString(4, document.getTitle());
            ps.setString(5, document.getLink());
            ps.setObject(6, JdbcSupport.millis(document.getIngestedAt()));
            ps.setObject(7, JdbcSupport.millis(document.getIndexedAt()));
            ps.setObject(8, JdbcSupport.millis(document.getMatchedAt()));
            ps.setObject(9, JdbcSupport.millis(document.getEnrichedAt()));
            return ps;
        }, keyHolder);

        long id = document.getId() > 0 ? document.getId() : keyHolder.getKey().longValue();
        log.debug("Inserted document {} ({})", id, document.getCategory());
        return id;
    }

    public Optional<Document> findById(long id) {
        return jdbcTemplate.query("SELECT * FROM documents WHERE id = ?", ROW_MAPPER, id)
            .stream().findFirst();
    }

    /**
     * Documents with the given ids, in ascending id order
     */
    public List<Document> findByIds(Collection<Long> ids) {
        if (JdbcSupport.isEmpty(ids)) {
            return List.of();
        }
        List<Document> documents = namedJdbcTemplate.query(
            "SELECT * FROM documents WHERE id IN (:ids)",
            new MapSqlParameterSource("ids", ids),
            ROW_MAPPER);
        return documents.stream().sorted(Comparator.comparingLong(Document::getId)).toList();
    }

    public List<Document> findAll() {
        return jdbcTemplate.query("SELECT * FROM documents ORDER BY id", ROW_MAPPER);
    }

    public void updateOrgHighlights(Map<Long, Boolean> highlightsByDocument) {
        if (highlightsByDocument.isEmpty()) {
            return;
        }
        List<Object[]> rows = highlightsByDocument.entrySet().stream()
            .map(e -> new Object[]{JdbcSupport.flagValue(e.getValue()), e.getKey()})
            .toList();
        jdbcTemplate.batchUpdate("UPDATE documents SET org_highlight = ? WHERE id = ?", rows);
    }

    public int countOrgHighlights() {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM documents WHERE org_highlight = 1", Integer.class);
        return count != null ? count : 0;
    }

    private static class DocumentRowMapper implements RowMapper<Document> {
        @Override
        public Document mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Document.builder()
                .id(rs.getLong("id"))
                .sourceName(rs.getString("source_name"))
                .category(rs.getString("category"))
                .title(rs.getString("title"))
                .link(rs.getString("link"))
                .ingestedAt(JdbcSupport.instant(rs, "ingested_at"))
                .indexedAt(JdbcSupport.instant(rs, "indexed_at"))
                .matchedAt(JdbcSupport.instant(rs, "matched_at"))
                .enrichedAt(JdbcSupport.instant(rs, "enriched_at"))
                .orgHighlight(JdbcSupport.flag(rs, "org_highlight"))
                .build();
        }
    }
}
