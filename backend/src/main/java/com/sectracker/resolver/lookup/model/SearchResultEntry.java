package com.sectracker.resolver.lookup.model;

public record SearchResultEntry(
    String ticker,
    String name,
    String identifier,
    LookupMethod method,
    double score,
    OwnershipChain chain
) {
    public static SearchResultEntry direct(MatchCandidate candidate) {
        return new SearchResultEntry(
            candidate.ticker(),
            candidate.legalName(),
            candidate.identifier(),
            LookupMethod.DIRECT,
            candidate.score(),
            null
        );
    }

    public static SearchResultEntry resolved(LookupResult result, String identifier) {
        return new SearchResultEntry(
            result.ticker(),
            result.companyName(),
            identifier,
            result.method(),
            result.confidence(),
            result.chain()
        );
    }
}
