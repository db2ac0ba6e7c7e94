package com.dcruver.anchorwatch.admin;

import com.dcruver.anchorwatch.domain.Anchor;
import com.dcruver.anchorwatch.domain.AnchorComponent;
import com.dcruver.anchorwatch.domain.ComponentType;
import com.dcruver.anchorwatch.nlp.EmbeddingResolver;
import com.dcruver.anchorwatch.nlp.OllamaEmbeddingService;
import com.dcruver.anchorwatch.nlp.VectorStore;
import com.dcruver.anchorwatch.store.AnchorStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Creates and lists semantic anchors.
 *
 * Components are checked against the vector store at creation time. A component
 * whose vector is missing is dropped with a warning rather than failing the whole
 * anchor, but an anchor must keep at least one component.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AnchorAdminService {

    private final AnchorStore anchorStore;
    private final VectorStore vectorStore;
    private final OllamaEmbeddingService embeddingService;
    private final EmbeddingResolver resolver;
    private final TransactionTemplate transactionTemplate;

    public Anchor createAnchor(String name, String description, String author, List<AnchorComponent> components) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Anchor name is required");
        }
        if (components == null || components.isEmpty()) {
            throw new IllegalArgumentException("Anchor '" + name + "' needs at least one component");
        }
        String anchorName = name.strip();
        if (anchorStore.findByName(anchorName).isPresent()) {
            throw new IllegalStateException("An anchor named '" + anchorName + "' already exists");
        }

        List<AnchorComponent> resolvable = new ArrayList<>();
        for (AnchorComponent component : new LinkedHashSet<>(components)) {
            if (resolver.resolve(component).isPresent()) {
                resolvable.add(component);
            } else {
                log.warn("Dropping component {} of anchor '{}': no vector found", component, anchorName);
            }
        }
        if (resolvable.isEmpty()) {
            throw new IllegalArgumentException("None of the components of anchor '" + anchorName + "' could be resolved");
        }

        Long anchorId = transactionTemplate.execute(status ->
            anchorStore.insert(anchorName, description, author, resolvable));
        log.info("Created anchor {} '{}' with {} of {} components", anchorId, anchorName, resolvable.size(), components.size());

        return anchorStore.findById(anchorId)
            .orElseThrow(() -> new IllegalStateException("Anchor " + anchorId + " vanished after insert"));
    }

    /**
     * Embed free text and attach it to an existing anchor as a hypothetical document.
     *
     * @param key identifier of the stored text, unique across anchors
     */
    public Anchor addHypotheticalDocument(String anchorName, String key, String text) {
        Anchor anchor = anchorStore.findByName(anchorName)
            .orElseThrow(() -> new IllegalArgumentException("No anchor named '" + anchorName + "'"));
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Hypothetical document key is required");
        }

        double[] vector = embeddingService.embed(text);
        if (vector.length == 0) {
            throw new IllegalStateException("Could not embed hypothetical document '" + key + "'");
        }

        vectorStore.storeHypotheticalDocument(key, text, vector);
        anchorStore.addComponent(anchor.getId(), AnchorComponent.of(ComponentType.HYPOTHETICAL_DOCUMENT, key));
        log.info("Added hypothetical document '{}' ({} dims) to anchor '{}'", key, vector.length, anchorName);

        return anchorStore.findById(anchor.getId()).orElseThrow();
    }

    public List<Anchor> listAnchors(boolean includeInactive) {
        return includeInactive ? anchorStore.findAll() : anchorStore.findActive();
    }
}
