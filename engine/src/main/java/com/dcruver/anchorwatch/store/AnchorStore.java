package com.dcruver.anchorwatch.store;

import com.dcruver.anchorwatch.domain.Anchor;
import com.dcruver.anchorwatch.domain.AnchorComponent;
import com.dcruver.anchorwatch.domain.ComponentType;
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
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Semantic anchors and their components.
 */
@Component
@Slf4j
public class AnchorStore {

    private final JdbcTemplate jdbcTemplate;

    public AnchorStore(DataSource dataSource) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
    }

    @PostConstruct
    public void init() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS semantic_anchors (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                name TEXT NOT NULL UNIQUE,
                description TEXT,
                author TEXT,
                is_active INTEGER NOT NULL DEFAULT 1,
                created_at INTEGER NOT NULL
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS anchor_components (
                anchor_id INTEGER NOT NULL,
                component_type TEXT NOT NULL,
                component_id TEXT NOT NULL,
                PRIMARY KEY (anchor_id, component_type, component_id)
            )
            """);

        log.info("Initialized anchor store");
    }

    public List<Anchor> findActive() {
        return load("SELECT * FROM semantic_anchors WHERE is_active = 1 ORDER BY id");
    }

    public List<Anchor> findAll() {
        return load("SELECT * FROM semantic_anchors ORDER BY id");
    }

    public Optional<Anchor> findByName(String name) {
        return load("SELECT * FROM semantic_anchors WHERE name = ?", name).stream().findFirst();
    }

    public Optional<Anchor> findById(long id) {
        return load("SELECT * FROM semantic_anchors WHERE id = ?", id).stream().findFirst();
    }

    /**
     * Insert an anchor and its components. Callers wrap this in a transaction.
     */
    public long insert(String name, String description, String author, List<AnchorComponent> components) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(
                "INSERT INTO semantic_anchors (name, description, author, is_active, created_at) VALUES (?, ?, ?, 1, ?)",
                Statement.RETURN_GENERATED_KEYS);
            ps.setString(1, name);
            ps.setString(2, description);
            ps.setString(3, author);
            ps.setLong(4, Instant.now().toEpochMilli());
            return ps;
        }, keyHolder);

        long anchorId = keyHolder.getKey().longValue();
        for (AnchorComponent component : components) {
            addComponent(anchorId, component);
        }
        log.debug("Inserted anchor {} '{}' with {} components", anchorId, name, components.size());
        return anchorId;
    }

    public void addComponent(long anchorId, AnchorComponent component) {
        jdbcTemplate.update(
            "INSERT OR IGNORE INTO anchor_components (anchor_id, component_type, component_id) VALUES (?, ?, ?)",
            anchorId, component.getType().getCode(), component.getComponentId());
    }

    public int setActive(long anchorId, boolean active) {
        return jdbcTemplate.update("UPDATE semantic_anchors SET is_active = ? WHERE id = ?", active ? 1 : 0, anchorId);
    }

    /**
     * Soft delete of every active anchor
     */
    public int deactivateAll() {
        return jdbcTemplate.update("UPDATE semantic_anchors SET is_active = 0 WHERE is_active = 1");
    }

    private List<Anchor> load(String sql, Object... args) {
        List<Anchor> anchors = jdbcTemplate.query(sql, (rs, rowNum) -> Anchor.builder()
            .id(rs.getLong("id"))
            .name(rs.getString("name"))
            .description(rs.getString("description"))
            .author(rs.getString("author"))
            .active(rs.getInt("is_active") != 0)
            .components(List.of())
            .build(), args);

        if (anchors.isEmpty()) {
            return anchors;
        }

        Map<Long, List<AnchorComponent>> componentsByAnchor = new HashMap<>();
        jdbcTemplate.query(
            "SELECT anchor_id, component_type, component_id FROM anchor_components ORDER BY anchor_id, component_type, component_id",
            rs -> {
                componentsByAnchor.computeIfAbsent(rs.getLong("anchor_id"), k -> new ArrayList<>())
                    .add(AnchorComponent.of(
                        ComponentType.fromCode(rs.getString("component_type")),
                        rs.getString("component_id")));
            });

        return anchors.stream()
            .map(a -> a.withComponents(List.copyOf(componentsByAnchor.getOrDefault(a.getId(), List.of()))))
            .toList();
    }
}
