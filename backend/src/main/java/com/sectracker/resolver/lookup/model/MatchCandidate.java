package com.sectracker.resolver.lookup.model;

public record MatchCandidate(String ticker, String legalName, String identifier, double score) {

    public MatchCandidate {
        if (score < 0.0 || score > 1.0 || Double.isNaN(score)) {
            throw new IllegalArgumentException("score must be within [0,1]: " + score);
        }
    }

    public static MatchCandidate of(RegistryEntry entry, double score) {
        return new MatchCandidate(entry.ticker(), entry.legalName(), entry.identifier(), score);
    }
}
