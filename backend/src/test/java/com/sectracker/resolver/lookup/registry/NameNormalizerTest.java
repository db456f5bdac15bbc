package com.sectracker.resolver.lookup.registry;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NameNormalizerTest {

    @Test
    void uppercasesAndStripsPunctuation() {
        assertThat(NameNormalizer.normalize("Meta Platforms, Inc.")).isEqualTo("META PLATFORMS INC");
        assertThat(NameNormalizer.normalize("  McDonald's   Corp ")).isEqualTo("MCDONALDS CORP");
        assertThat(NameNormalizer.normalize("Macy\u2019s Inc")).isEqualTo("MACYS INC");
    }

    @Test
    void nullBecomesEmpty() {
        assertThat(NameNormalizer.normalize(null)).isEmpty();
    }

    @Test
    void tickerTokenRequiresUppercaseSymbol() {
        assertThat(NameNormalizer.tickerToken(" NVDA ")).contains("NVDA");
        assertThat(NameNormalizer.tickerToken("nvda")).isEmpty();
        assertThat(NameNormalizer.tickerToken("Coke")).isEmpty();
        assertThat(NameNormalizer.tickerToken("NVIDIA CORP")).isEmpty();
        assertThat(NameNormalizer.tickerToken("1234")).isEmpty();
        assertThat(NameNormalizer.tickerToken(null)).isEmpty();
    }

    @Test
    void shareClassDotMapsToDash() {
        assertThat(NameNormalizer.tickerToken("BRK.B")).contains("BRK-B");
        assertThat(NameNormalizer.tickerToken("BRK-A")).contains("BRK-A");
    }
}
