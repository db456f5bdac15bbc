package com.sectracker.resolver.lookup.generative;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;

/**
 * Asks a language model for the official filing name behind a query. The answer is a name to verify
 * against the registry, never a ticker.
 */
@Service
public class GenerativeIdentifier {
    private static final Logger log = LoggerFactory.getLogger(GenerativeIdentifier.class);
    static final String UNKNOWN_ANSWER = "UNKNOWN";

    private final CompletionProvider completionProvider;

    public GenerativeIdentifier(CompletionProvider completionProvider) {
        this.completionProvider = completionProvider;
    }

    public Optional<String> identify(String query) {
        if (query == null || query.isBlank()) {
            return Optional.empty();
        }
        String answer = completionProvider.complete(buildPrompt(query.trim()));
        Optional<String> name = interpret(answer);
        log.debug("Generative answer for '{}': {}", query, name.orElse(UNKNOWN_ANSWER));
        return name;
    }

    static String buildPrompt(String query) {
        StringBuilder sb = new StringBuilder(768);
        sb.append("You identify US publicly traded companies.\n");
        sb.append("Query: \"").append(query).append("\"\n\n");
        sb.append("Reply with the official company name exactly as it appears in SEC filings ");
        sb.append("(for example \"NVIDIA CORP\" or \"Meta Platforms, Inc.\").\n");
        sb.append("Rules:\n");
        sb.append("1) If the query is a brand, product or subsidiary, answer with its publicly traded parent.\n");
        sb.append("2) Expand abbreviations and correct typos.\n");
        sb.append("3) Only companies listed on a US exchange count.\n");
        sb.append("4) Output the name only, with no explanation.\n");
        sb.append("5) If you are not sure, answer ").append(UNKNOWN_ANSWER).append(".\n");
        return sb.toString();
    }

    static Optional<String> interpret(String answer) {
        if (answer == null) {
            return Optional.empty();
        }
        String line = null;
        for (String candidate : answer.split("\\R")) {
            if (!candidate.isBlank()) {
                line = candidate;
                break;
            }
        }
        if (line == null) {
            return Optional.empty();
        }
        String cleaned = stripWrapping(line.trim());
        if (cleaned.isEmpty()) {
            return Optional.empty();
        }
        String bare = cleaned.endsWith(".") ? cleaned.substring(0, cleaned.length() - 1).trim() : cleaned;
        if (bare.toUpperCase(Locale.ROOT).equals(UNKNOWN_ANSWER)) {
            return Optional.empty();
        }
        return Optional.of(cleaned);
    }

    private static String stripWrapping(String value) {
        String text = value;
        while (!text.isEmpty() && isWrapChar(text.charAt(0))) {
            text = text.substring(1);
        }
        while (!text.isEmpty() && isWrapChar(text.charAt(text.length() - 1))) {
            text = text.substring(0, text.length() - 1);
        }
        return text.trim();
    }

    private static boolean isWrapChar(char ch) {
        return ch == '"' || ch == '\'' || ch == '`' || ch == '\u201C' || ch == '\u201D';
    }
}
