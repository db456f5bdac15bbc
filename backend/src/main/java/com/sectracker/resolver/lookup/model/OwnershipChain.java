package com.sectracker.resolver.lookup.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Labels walked from the queried entity up to its public parent, both ends included.
 */
public record OwnershipChain(List<String> labels) {

    public OwnershipChain {
        labels = labels == null ? List.of() : List.copyOf(labels);
    }

    @Override
    @JsonValue
    public List<String> labels() {
        return labels;
    }

    public int size() {
        return labels.size();
    }

    public boolean isEmpty() {
        return labels.isEmpty();
    }

    public String root() {
        return labels.isEmpty() ? null : labels.get(labels.size() - 1);
    }

    public boolean hasIntermediateNodes() {
        return labels.size() > 1;
    }
}
