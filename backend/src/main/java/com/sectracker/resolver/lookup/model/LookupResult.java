package com.sectracker.resolver.lookup.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Outcome of a single resolution. A null ticker always means an unresolved fallback with zero confidence.
 */
public record LookupResult(
    String query,
    String ticker,
    String companyName,
    LookupMethod method,
    double confidence,
    OwnershipChain chain
) {
    public LookupResult {
        if (method == null) {
            throw new IllegalArgumentException("method is required");
        }
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("confidence must be within [0,1]: " + confidence);
        }
        if (ticker == null && (method != LookupMethod.FALLBACK || confidence != 0.0)) {
            throw new IllegalArgumentException("unresolved result must be fallback with zero confidence");
        }
        if (method == LookupMethod.DIRECT && chain != null) {
            throw new IllegalArgumentException("direct result carries no ownership chain");
        }
        if (method == LookupMethod.KNOWLEDGE_GRAPH && (chain == null || chain.isEmpty())) {
            throw new IllegalArgumentException("knowledge graph result requires an ownership chain");
        }
    }

    public static LookupResult direct(String query, MatchCandidate candidate) {
        return new LookupResult(query, candidate.ticker(), candidate.legalName(), LookupMethod.DIRECT, candidate.score(), null);
    }

    public static LookupResult knowledgeGraph(String query, MatchCandidate candidate, double confidence, OwnershipChain chain) {
        return new LookupResult(query, candidate.ticker(), candidate.legalName(), LookupMethod.KNOWLEDGE_GRAPH, confidence, chain);
    }

    public static LookupResult generative(String query, MatchCandidate candidate, double confidence) {
        return new LookupResult(query, candidate.ticker(), candidate.legalName(), LookupMethod.GENERATIVE, confidence, null);
    }

    public static LookupResult fallback(String query, MatchCandidate candidate) {
        return new LookupResult(query, candidate.ticker(), candidate.legalName(), LookupMethod.FALLBACK, candidate.score(), null);
    }

    public static LookupResult unresolved(String query) {
        return new LookupResult(query, null, null, LookupMethod.FALLBACK, 0.0, null);
    }

    @JsonIgnore
    public boolean isResolved() {
        return ticker != null;
    }
}
