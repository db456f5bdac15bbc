package com.sectracker.resolver.lookup.generative;

/**
 * Single-turn text completion: one prompt in, the model's raw answer out.
 */
public interface CompletionProvider {

    String complete(String prompt);
}
