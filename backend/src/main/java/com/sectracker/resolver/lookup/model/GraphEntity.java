package com.sectracker.resolver.lookup.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A knowledge-graph node as seen by the ownership walk. Owned-by targets take priority
 * over parent-organization targets when choosing the next hop.
 */
public record GraphEntity(
    String id,
    String label,
    List<String> ownedBy,
    List<String> parentOrganizations,
    boolean publiclyTraded,
    String ticker,
    String securityId
) {
    public GraphEntity {
        ownedBy = ownedBy == null ? List.of() : List.copyOf(ownedBy);
        parentOrganizations = parentOrganizations == null ? List.of() : List.copyOf(parentOrganizations);
    }

    /**
     * Owned-by targets first, then parent-organization targets.
     */
    public List<String> ownershipEdges() {
        List<String> edges = new ArrayList<>(ownedBy.size() + parentOrganizations.size());
        edges.addAll(ownedBy);
        edges.addAll(parentOrganizations);
        return List.copyOf(edges);
    }

    public Optional<String> nextOwnerId() {
        List<String> edges = ownershipEdges();
        return edges.isEmpty() ? Optional.empty() : Optional.of(edges.get(0));
    }
}
