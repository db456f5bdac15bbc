package com.sectracker.resolver.lookup.service;

import com.sectracker.resolver.lookup.model.MatchCandidate;

import java.util.List;
import java.util.Optional;

/**
 * Per-lookup state shared by the stages. Not thread-safe; one instance per lookup.
 */
public class ResolutionContext {
    private final String query;
    private List<MatchCandidate> directCandidates = List.of();

    public ResolutionContext(String query) {
        this.query = query;
    }

    public String getQuery() {
        return query;
    }

    public List<MatchCandidate> getDirectCandidates() {
        return directCandidates;
    }

    public void setDirectCandidates(List<MatchCandidate> directCandidates) {
        this.directCandidates = directCandidates == null ? List.of() : List.copyOf(directCandidates);
    }

    public Optional<MatchCandidate> bestDirectCandidate() {
        return directCandidates.isEmpty() ? Optional.empty() : Optional.of(directCandidates.get(0));
    }
}
