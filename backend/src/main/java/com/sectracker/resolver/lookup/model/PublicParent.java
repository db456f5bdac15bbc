package com.sectracker.resolver.lookup.model;

public record PublicParent(GraphEntity entity, OwnershipChain chain) {
}
