package com.sectracker.resolver.lookup.generative;

/**
 * Used when no generative model is configured. Always declines to answer.
 */
public class NoOpCompletionProvider implements CompletionProvider {

    @Override
    public String complete(String prompt) {
        return GenerativeIdentifier.UNKNOWN_ANSWER;
    }
}
