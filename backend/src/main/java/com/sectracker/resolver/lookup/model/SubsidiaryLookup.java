package com.sectracker.resolver.lookup.model;

public record SubsidiaryLookup(
    String query,
    GraphSearchHit matchedEntity,
    String publicParentLabel,
    String ticker,
    String securityId,
    OwnershipChain chain
) {
    public static SubsidiaryLookup of(String query, GraphSearchHit matchedEntity, PublicParent parent) {
        GraphEntity entity = parent.entity();
        return new SubsidiaryLookup(
            query,
            matchedEntity,
            entity.label(),
            entity.ticker(),
            entity.securityId(),
            parent.chain()
        );
    }
}
