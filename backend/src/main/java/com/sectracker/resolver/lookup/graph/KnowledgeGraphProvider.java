package com.sectracker.resolver.lookup.graph;

import com.sectracker.resolver.lookup.model.GraphEntity;
import com.sectracker.resolver.lookup.model.GraphSearchHit;

import java.util.List;
import java.util.Optional;

public interface KnowledgeGraphProvider {

    /**
     * Text search over the entity index, best match first.
     */
    List<GraphSearchHit> search(String query, int limit);

    /**
     * Fetches one entity with its ownership edges and trading status, or empty when the id does not exist.
     */
    Optional<GraphEntity> fetchEntity(String id);
}
