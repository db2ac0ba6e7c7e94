package com.dcruver.anchorwatch.nlp;

import com.dcruver.anchorwatch.domain.AnchorComponent;
import com.dcruver.anchorwatch.domain.ComponentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class EmbeddingResolverTest {

    @TempDir
    Path tempDir;

    private JdbcVectorStore store;
    private EmbeddingResolver resolver;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource();
        dataSource.setDriverClassName("org.sqlite.JDBC");
        dataSource.setUrl("jdbc:sqlite:" + tempDir.resolve("vectors.db").toAbsolutePath());

        store = new JdbcVectorStore(dataSource, "test-model");
        store.init();
        resolver = new EmbeddingResolver(store);
    }

    @Test
    void testResolvesEachComponentType() {
        store.storeTagVector("ai-policy", new double[]{1, 0});
        store.storeKnowledgeBaseVector("kb/report.pdf", null, "report", new double[]{0, 1});
        store.storeHypotheticalDocument("ideal-article", "An ideal article", new double[]{0.5, 0.5});

        assertArrayEquals(new double[]{1, 0}, resolve(ComponentType.TAG, "ai-policy").orElseThrow());
        assertArrayEquals(new double[]{0, 1}, resolve(ComponentType.KB_ITEM, "kb/report.pdf").orElseThrow());
        assertArrayEquals(new double[]{0.5, 0.5}, resolve(ComponentType.HYPOTHETICAL_DOCUMENT, "ideal-article").orElseThrow());
    }

    @Test
    void testProgramResolvesThroughItsCharter() {
        store.storeKnowledgeBaseVector("kb/digital-id-notes.md", "Digital-ID", "note", new double[]{1, 0});
        store.storeKnowledgeBaseVector("kb/digital-id-charter.md", "Digital-ID", "program_charter", new double[]{0.2, 0.8});

        Optional<double[]> vector = resolve(ComponentType.PROGRAM, "Digital-ID");

        assertTrue(vector.isPresent());
        assertArrayEquals(new double[]{0.2, 0.8}, vector.get());
    }

    @Test
    void testMissingVectorsAreEmpty() {
        assertTrue(resolve(ComponentType.TAG, "unknown").isEmpty());
        assertTrue(resolve(ComponentType.PROGRAM, "No-Charter").isEmpty());
        assertTrue(resolver.vectorsOf(42L).isEmpty());
    }

    @Test
    void testDocumentChunksComeBackInOrder() {
        store.storeDocumentChunks(7L, List.of(new double[]{1, 0}, new double[]{0, 1}, new double[]{1, 1}));

        List<double[]> chunks = resolver.vectorsOf(7L);

        assertEquals(3, chunks.size());
        assertArrayEquals(new double[]{0, 1}, chunks.get(1));
    }

    private Optional<double[]> resolve(ComponentType type, String id) {
        return resolver.resolve(AnchorComponent.of(type, id));
    }
}
