package com.dcruver.anchorwatch.store;

import com.dcruver.anchorwatch.domain.PipelineRun;
import com.dcruver.anchorwatch.domain.PipelineRun.RunStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.Statement;
import java.time.Instant;
import java.util.List;

/**
 * Durable record of orchestrated pipeline runs and their counters.
 */
@Component
@Slf4j
public class PipelineRunLog {

    private final JdbcTemplate jdbcTemplate;

    public PipelineRunLog(DataSource dataSource) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
    }

    @PostConstruct
    public void init() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS pipeline_runs (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                started_at INTEGER NOT NULL,
                ended_at INTEGER,
                status TEXT NOT NULL,
                documents_matched INTEGER DEFAULT 0,
                links_written INTEGER DEFAULT 0,
                links_classified INTEGER DEFAULT 0,
                highlights_found INTEGER DEFAULT 0
            )
            """);

        log.info("Initialized pipeline run log");
    }

    public long start() {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(
                "INSERT INTO pipeline_runs (started_at, status) VALUES (?, ?)",
                Statement.RETURN_GENERATED_KEYS);
            ps.setLong(1, Instant.now().toEpochMilli());
            ps.setString(2, RunStatus.RUNNING.name());
            return ps;
        }, keyHolder);

        long runId = keyHolder.getKey().longValue();
        log.info("Pipeline run {} started", runId);
        return runId;
    }

    public void finish(long runId, RunStatus status, int documentsMatched, int linksWritten,
                       int linksClassified, int highlightsFound) {
        jdbcTemplate.update("""
            UPDATE pipeline_runs
            SET ended_at = ?, status = ?, documents_matched = ?, links_written = ?,
                links_classified = ?, highlights_found = ?
            WHERE id = ?
            """,
            Instant.now().toEpochMilli(), status.name(), documentsMatched, linksWritten,
            linksClassified, highlightsFound, runId);
        log.info("Pipeline run {} ended with status {}", runId, status);
    }

    public List<PipelineRun> recent(int limit) {
        return jdbcTemplate.query(
            "SELECT * FROM pipeline_runs ORDER BY id DESC LIMIT ?",
            (rs, rowNum) -> PipelineRun.builder()
                .id(rs.getLong("id"))
                .startedAt(JdbcSupport.instant(rs, "started_at"))
                .endedAt(JdbcSupport.instant(rs, "ended_at"))
                .status(RunStatus.valueOf(rs.getString("status")))
                .documentsMatched(rs.getInt("documents_matched"))
                .linksWritten(rs.getInt("links_written"))
                .linksClassified(rs.getInt("links_classified"))
                .highlightsFound(rs.getInt("highlights_found"))
                .build(),
            limit);
    }
}
