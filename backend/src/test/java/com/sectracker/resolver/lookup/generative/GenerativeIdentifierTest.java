package com.sectracker.resolver.lookup.generative;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class GenerativeIdentifierTest {

    @Test
    void promptCarriesQueryAndUnknownInstruction() {
        String prompt = GenerativeIdentifier.buildPrompt("Insta");

        assertThat(prompt).contains("\"Insta\"");
        assertThat(prompt).contains("SEC filings");
        assertThat(prompt).contains("UNKNOWN");
    }

    @Test
    void interpretsNameAnswers() {
        assertThat(GenerativeIdentifier.interpret("Meta Platforms, Inc.")).contains("Meta Platforms, Inc.");
        assertThat(GenerativeIdentifier.interpret("  \"NVIDIA CORP\"  ")).contains("NVIDIA CORP");
        assertThat(GenerativeIdentifier.interpret("\n`Alphabet Inc.`\nBecause Google is owned by Alphabet."))
            .contains("Alphabet Inc.");
    }

    @Test
    void unknownAndBlankAnswersAreEmpty() {
        assertThat(GenerativeIdentifier.interpret("UNKNOWN")).isEmpty();
        assertThat(GenerativeIdentifier.interpret(" unknown. ")).isEmpty();
        assertThat(GenerativeIdentifier.interpret("\"Unknown\"")).isEmpty();
        assertThat(GenerativeIdentifier.interpret("   ")).isEmpty();
        assertThat(GenerativeIdentifier.interpret(null)).isEmpty();
    }

    @Test
    void identifySendsPromptToProvider() {
        List<String> prompts = new ArrayList<>();
        GenerativeIdentifier identifier = new GenerativeIdentifier(prompt -> {
            prompts.add(prompt);
            return "Alphabet Inc.";
        });

        Optional<String> name = identifier.identify("  Google ");

        assertThat(name).contains("Alphabet Inc.");
        assertThat(prompts).hasSize(1);
        assertThat(prompts.get(0)).contains("\"Google\"");
    }

    @Test
    void noOpProviderNeverIdentifies() {
        GenerativeIdentifier identifier = new GenerativeIdentifier(new NoOpCompletionProvider());

        assertThat(identifier.identify("Google")).isEmpty();
        assertThat(identifier.identify(" ")).isEmpty();
    }
}
