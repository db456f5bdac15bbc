package com.sectracker.resolver.lookup.graph;

import com.sectracker.resolver.config.LookupProperties;
import com.sectracker.resolver.lookup.model.GraphEntity;
import com.sectracker.resolver.lookup.model.GraphSearchHit;
import com.sectracker.resolver.lookup.model.OwnershipChain;
import com.sectracker.resolver.lookup.model.PublicParent;
import com.sectracker.resolver.lookup.model.SubsidiaryLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Finds the publicly traded owner of a brand or subsidiary by walking ownership edges in the knowledge graph.
 */
@Service
public class KnowledgeGraphService {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeGraphService.class);

    private final LookupProperties properties;
    private final KnowledgeGraphProvider provider;

    public KnowledgeGraphService(LookupProperties properties, KnowledgeGraphProvider provider) {
        this.properties = properties;
        this.provider = provider;
    }

    public List<GraphSearchHit> search(String query, int limit) {
        return provider.search(query, limit);
    }

    public Optional<PublicParent> findPublicParent(String startId) {
        return findPublicParent(startId, properties.getGraph().getMaxDepth());
    }

    /**
     * Follows the first owned-by edge (else the first parent-organization edge) from {@code startId}
     * until a publicly traded entity is reached. Fetches at most {@code maxDepth} entities and gives up
     * on a revisited id, a missing entity or an entity without ownership edges.
     */
    public Optional<PublicParent> findPublicParent(String startId, int maxDepth) {
        Set<String> visited = new HashSet<>();
        List<String> labels = new ArrayList<>();
        String currentId = startId;

        for (int step = 0; step < maxDepth && currentId != null; step++) {
            if (!visited.add(currentId)) {
                log.debug("Ownership cycle at {} starting from {}", currentId, startId);
                return Optional.empty();
            }
            Optional<GraphEntity> fetched = provider.fetchEntity(currentId);
            if (fetched.isEmpty()) {
                log.debug("Entity {} not found while walking from {}", currentId, startId);
                return Optional.empty();
            }
            GraphEntity entity = fetched.get();
            labels.add(entity.label());
            if (entity.publiclyTraded()) {
                return Optional.of(new PublicParent(entity, new OwnershipChain(labels)));
            }
            currentId = entity.nextOwnerId().orElse(null);
        }
        log.debug("No public parent for {} (depth={}, chain={})", startId, maxDepth, labels);
        return Optional.empty();
    }

    /**
     * Searches for {@code query} and returns the first of the top hits, in rank order, that leads to a public parent.
     */
    public Optional<SubsidiaryLookup> lookupSubsidiary(String query) {
        List<GraphSearchHit> hits = provider.search(query, properties.getGraph().getSearchLimit());
        for (GraphSearchHit hit : hits) {
            Optional<PublicParent> parent = findPublicParent(hit.id());
            if (parent.isPresent()) {
                log.debug("'{}' matched {} ({}) -> {}", query, hit.id(), hit.label(), parent.get().chain().labels());
                return Optional.of(SubsidiaryLookup.of(query, hit, parent.get()));
            }
        }
        return Optional.empty();
    }
}
