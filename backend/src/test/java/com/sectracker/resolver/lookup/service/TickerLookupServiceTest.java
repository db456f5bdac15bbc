package com.sectracker.resolver.lookup.service;

import com.sectracker.resolver.config.LookupProperties;
import com.sectracker.resolver.lookup.ProviderUnavailableException;
import com.sectracker.resolver.lookup.generative.CompletionProvider;
import com.sectracker.resolver.lookup.generative.GenerativeIdentifier;
import com.sectracker.resolver.lookup.graph.KnowledgeGraphService;
import com.sectracker.resolver.lookup.match.FuzzyMatcher;
import com.sectracker.resolver.lookup.model.GraphEntity;
import com.sectracker.resolver.lookup.model.GraphSearchHit;
import com.sectracker.resolver.lookup.model.LookupMethod;
import com.sectracker.resolver.lookup.model.LookupResult;
import com.sectracker.resolver.lookup.model.OwnershipChain;
import com.sectracker.resolver.lookup.model.PublicParent;
import com.sectracker.resolver.lookup.model.RegistryEntry;
import com.sectracker.resolver.lookup.model.SearchResultEntry;
import com.sectracker.resolver.lookup.model.SubsidiaryLookup;
import com.sectracker.resolver.lookup.registry.NameRegistry;
import com.sectracker.resolver.support.RegistryFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TickerLookupServiceTest {

    @Mock
    private KnowledgeGraphService graphService;
    @Mock
    private CompletionProvider completionProvider;

    private LookupProperties properties;
    private NameRegistry registry;
    private TickerLookupService service;

    @BeforeEach
    void setUp() {
        properties = new LookupProperties();
        registry = RegistryFixtures.registry();
        service = serviceOver(registry);
    }

    private TickerLookupService serviceOver(NameRegistry names) {
        FuzzyMatcher matcher = new FuzzyMatcher(names);
        return new TickerLookupService(
            new DirectMatchStage(properties, matcher),
            new KnowledgeGraphStage(properties, graphService, matcher),
            new GenerativeStage(properties, new GenerativeIdentifier(completionProvider), matcher),
            new FallbackStage(properties),
            matcher,
            names
        );
    }

    @Test
    void subsidiaryResolvesThroughPublicParent() {
        when(graphService.lookupSubsidiary("WhatsApp"))
            .thenReturn(Optional.of(subsidiary("WhatsApp", "WhatsApp", "Meta Platforms")));

        LookupResult result = service.lookup("WhatsApp");

        assertThat(result.ticker()).isEqualTo("META");
        assertThat(result.method()).isEqualTo(LookupMethod.KNOWLEDGE_GRAPH);
        assertThat(result.confidence()).isEqualTo(0.90);
        assertThat(result.chain().labels()).containsExactly("WhatsApp", "Meta Platforms");
        verifyNoInteractions(completionProvider);
    }

    @Test
    void tickerQueryResolvesDirectly() {
        LookupResult result = service.lookup("NVDA");

        assertThat(result.ticker()).isEqualTo("NVDA");
        assertThat(result.companyName()).isEqualTo("NVIDIA CORP");
        assertThat(result.method()).isEqualTo(LookupMethod.DIRECT);
        assertThat(result.confidence()).isGreaterThanOrEqualTo(0.85);
        assertThat(result.chain()).isNull();
        verify(graphService, never()).lookupSubsidiary(anyString());
    }

    @Test
    void exactLegalNameResolvesDirectly() {
        LookupResult result = service.lookup("  Meta Platforms, Inc. ");

        assertThat(result.query()).isEqualTo("Meta Platforms, Inc.");
        assertThat(result.ticker()).isEqualTo("META");
        assertThat(result.method()).isEqualTo(LookupMethod.DIRECT);
    }

    @Test
    void unverifiedParentRetriesChainFromRootEnd() {
        when(graphService.lookupSubsidiary("Instagram"))
            .thenReturn(Optional.of(subsidiary("Instagram", "Instagram", "Meta Platforms", "Zuck Holdings Ltd")));

        LookupResult result = service.lookup("Instagram");

        assertThat(result.ticker()).isEqualTo("META");
        assertThat(result.method()).isEqualTo(LookupMethod.KNOWLEDGE_GRAPH);
        assertThat(result.chain().root()).isEqualTo("Zuck Holdings Ltd");
    }

    @Test
    void generativeAnswerIsVerifiedAgainstRegistry() {
        when(completionProvider.complete(anyString())).thenReturn("Alphabet Inc.");

        LookupResult result = service.lookup("Google");

        assertThat(result.ticker()).isEqualTo("GOOGL");
        assertThat(result.companyName()).isEqualTo("Alphabet Inc.");
        assertThat(result.method()).isEqualTo(LookupMethod.GENERATIVE);
        assertThat(result.confidence()).isEqualTo(0.85);
    }

    @Test
    void unverifiableGenerativeAnswerFallsBackToBestCandidate() {
        when(completionProvider.complete(anyString())).thenReturn("Initech Software Holdings");

        LookupResult result = service.lookup("Microsft");

        assertThat(result.ticker()).isEqualTo("MSFT");
        assertThat(result.method()).isEqualTo(LookupMethod.FALLBACK);
        assertThat(result.confidence()).isBetween(0.70, 0.85);
    }

    @Test
    void nonexistentCompanyIsUnresolved() {
        when(completionProvider.complete(anyString())).thenReturn("UNKNOWN");

        LookupResult result = service.lookup("zzzzz-nonexistent-co");

        assertThat(result.query()).isEqualTo("zzzzz-nonexistent-co");
        assertThat(result.ticker()).isNull();
        assertThat(result.companyName()).isNull();
        assertThat(result.method()).isEqualTo(LookupMethod.FALLBACK);
        assertThat(result.confidence()).isEqualTo(0.0);
        assertThat(result.chain()).isNull();
        verify(graphService).lookupSubsidiary("zzzzz-nonexistent-co");
    }

    @Test
    void fallbackFloorIsConfigurable() {
        properties.getMatching().setFallbackMinScore(0.0);
        when(completionProvider.complete(anyString())).thenReturn("UNKNOWN");

        LookupResult result = service.lookup("zzzzz-nonexistent-co");

        assertThat(result.ticker()).isEqualTo("AMZN");
        assertThat(result.method()).isEqualTo(LookupMethod.FALLBACK);
        assertThat(result.confidence()).isLessThan(0.50);
    }

    @Test
    void lowercaseBrandCollidingWithTickerGoesThroughGraph() {
        List<RegistryEntry> entries = new ArrayList<>(RegistryFixtures.ENTRIES);
        entries.add(new RegistryEntry("COKE", "Coca-Cola Consolidated, Inc.", "0000317540"));
        TickerLookupService withCoke = serviceOver(new NameRegistry(() -> entries));
        when(graphService.lookupSubsidiary("coke"))
            .thenReturn(Optional.of(subsidiary("coke", "Coke", "Coca Cola Company")));

        LookupResult result = withCoke.lookup("coke");

        assertThat(result.ticker()).isEqualTo("KO");
        assertThat(result.method()).isEqualTo(LookupMethod.KNOWLEDGE_GRAPH);
        assertThat(result.chain().labels()).containsExactly("Coke", "Coca Cola Company");
    }

    @Test
    void uppercaseTickerStillResolvesDirectlyDespiteBrandCollision() {
        List<RegistryEntry> entries = new ArrayList<>(RegistryFixtures.ENTRIES);
        entries.add(new RegistryEntry("COKE", "Coca-Cola Consolidated, Inc.", "0000317540"));
        TickerLookupService withCoke = serviceOver(new NameRegistry(() -> entries));

        LookupResult result = withCoke.lookup("COKE");

        assertThat(result.ticker()).isEqualTo("COKE");
        assertThat(result.method()).isEqualTo(LookupMethod.DIRECT);
        verify(graphService, never()).lookupSubsidiary(anyString());
    }

    @Test
    void dottedShareClassResolvesDirectly() {
        LookupResult result = service.lookup("BRK.B");

        assertThat(result.ticker()).isEqualTo("BRK-B");
        assertThat(result.method()).isEqualTo(LookupMethod.DIRECT);
        assertThat(result.confidence()).isEqualTo(1.0);
    }

    @Test
    void blankQueryMakesNoProviderCall() {
        LookupResult result = service.lookup("   ");

        assertThat(result.isResolved()).isFalse();
        assertThat(result.method()).isEqualTo(LookupMethod.FALLBACK);
        assertThat(result.confidence()).isEqualTo(0.0);
        verifyNoInteractions(graphService, completionProvider);
        assertThat(registry.isLoaded()).isFalse();
    }

    @Test
    void providerFailurePropagates() {
        when(graphService.lookupSubsidiary("WhatsApp"))
            .thenThrow(new ProviderUnavailableException("wikidata", "wikidata request failed: http_503"));

        assertThatThrownBy(() -> service.lookup("WhatsApp"))
            .isInstanceOf(ProviderUnavailableException.class)
            .hasMessageContaining("http_503");
    }

    @Test
    void searchPutsResolvedAnswerFirstAndDeduplicates() {
        when(completionProvider.complete(anyString())).thenReturn("Alphabet Inc.");

        List<SearchResultEntry> results = service.search("Google", 3);

        assertThat(results).hasSize(3);
        assertThat(results.get(0).ticker()).isEqualTo("GOOGL");
        assertThat(results.get(0).method()).isEqualTo(LookupMethod.GENERATIVE);
        assertThat(results.get(0).identifier()).isEqualTo("0001652044");
        assertThat(results).extracting(SearchResultEntry::ticker).doesNotHaveDuplicates();
        assertThat(results.subList(1, 3)).extracting(SearchResultEntry::method).containsOnly(LookupMethod.DIRECT);
    }

    @Test
    void searchKeepsBelowThresholdCandidates() {
        when(completionProvider.complete(anyString())).thenReturn("UNKNOWN");

        List<SearchResultEntry> results = service.search("Microsft", 10);

        assertThat(results.get(0).ticker()).isEqualTo("MSFT");
        assertThat(results.get(0).score()).isLessThan(0.85);
        assertThat(results.size()).isLessThanOrEqualTo(10);
    }

    @Test
    void searchListsEveryShareClass() {
        List<SearchResultEntry> results = service.search("Berkshire Hathaway", 5);

        assertThat(results).extracting(SearchResultEntry::ticker).contains("BRK-B", "BRK-A");
    }

    @Test
    void blankSearchIsEmpty() {
        assertThat(service.search(" ", 10)).isEmpty();
        verifyNoInteractions(graphService, completionProvider);
    }

    private static SubsidiaryLookup subsidiary(String query, String... chainLabels) {
        String parentLabel = chainLabels[chainLabels.length - 1];
        GraphEntity parent = new GraphEntity("Q-parent", parentLabel, List.of(), List.of(), true, null, null);
        return SubsidiaryLookup.of(
            query,
            new GraphSearchHit("Q-start", chainLabels[0], ""),
            new PublicParent(parent, new OwnershipChain(List.of(chainLabels)))
        );
    }
}
