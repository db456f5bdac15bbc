package com.sectracker.resolver.lookup;

import com.sectracker.resolver.lookup.model.HttpFetchResult;

/**
 * Raised when one of the external providers (ticker directory, knowledge graph, generative model)
 * cannot be reached or returns an unusable response. Never used for "no match".
 */
public class ProviderUnavailableException extends RuntimeException {
    private final String provider;

    public ProviderUnavailableException(String provider, String message) {
        super(message);
        this.provider = provider;
    }

    public ProviderUnavailableException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }

    public static ProviderUnavailableException fromFetch(String provider, HttpFetchResult fetch) {
        return new ProviderUnavailableException(
            provider,
            provider + " request to " + fetch.requestedUrl() + " failed: " + fetch.failureReason()
        );
    }

    public String getProvider() {
        return provider;
    }
}
