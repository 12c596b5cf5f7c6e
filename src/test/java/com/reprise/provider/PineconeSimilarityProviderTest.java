package com.reprise.provider;

import com.reprise.config.RepriseProperties;
import com.reprise.exception.UpstreamUnavailableException;
import com.reprise.model.Passage;
import com.reprise.model.RankedCandidate;
import com.reprise.service.embedding.EmbeddingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Tests for PineconeSimilarityProvider.
 */
class PineconeSimilarityProviderTest {

    private RepriseProperties properties;
    private EmbeddingService embeddingService;
    private final List<ClientRequest> requests = new ArrayList<>();

    @BeforeEach
    void setUp() {
        properties = new RepriseProperties();
        properties.getProxy().setMaxRetries(0);
        RepriseProperties.ProviderConfig pinecone = new RepriseProperties.ProviderConfig();
        pinecone.setBaseUrl("https://index.pinecone.test");
        pinecone.setApiKey("pc-key");
        properties.getProviders().put("pinecone", pinecone);

        embeddingService = mock(EmbeddingService.class);
        when(embeddingService.embed(anyString())).thenReturn(Mono.just(List.of(0.1f, 0.2f)));
    }

    @Test
    void testSearchMapsMatchesInOrder() {
        PineconeSimilarityProvider provider = provider("{\"namespace\":\"vid1\",\"matches\":["
                + "{\"id\":\"vid1-3\",\"score\":0.91,\"metadata\":{\"text\":\"leader election\",\"start\":42.0}},"
                + "{\"id\":\"vid1-0\",\"score\":0.55,\"metadata\":{\"text\":\"intro\"}}]}");

        List<RankedCandidate> candidates = provider.similaritySearch("vid1", "who leads?", 2).block();

        assertNotNull(candidates);
        assertEquals(2, candidates.size());
        assertEquals("leader election", candidates.get(0).getPassageText());
        assertEquals("vid1-3", candidates.get(0).getPassage().getId());
        assertEquals(0, candidates.get(0).getRankPosition());
        assertEquals(42.0, candidates.get(0).getPassage().getMetadata().get("start"));
        assertFalse(candidates.get(0).getPassage().getMetadata().containsKey("text"));
        assertEquals(1, candidates.get(1).getRankPosition());

        ClientRequest request = requests.get(0);
        assertEquals("https://index.pinecone.test/query", request.url().toString());
        assertEquals("pc-key", request.headers().getFirst("Api-Key"));
    }

    @Test
    void testMatchesWithoutTextAreSkipped() {
        PineconeSimilarityProvider provider = provider("{\"matches\":["
                + "{\"id\":\"a\",\"score\":0.9,\"metadata\":{\"start\":1}},"
                + "{\"id\":\"b\",\"score\":0.8,\"metadata\":{\"text\":\"kept\"}}]}");

        List<RankedCandidate> candidates = provider.similaritySearch("vid1", "q", 5).block();

        assertNotNull(candidates);
        assertEquals(1, candidates.size());
        assertEquals("kept", candidates.get(0).getPassageText());
        assertEquals(0, candidates.get(0).getRankPosition());
    }

    @Test
    void testUnknownNamespaceIsEmpty() {
        PineconeSimilarityProvider provider = provider("{\"namespace\":\"nobody\",\"matches\":[]}");

        List<RankedCandidate> candidates = provider.similaritySearch("nobody", "q", 5).block();

        assertNotNull(candidates);
        assertTrue(candidates.isEmpty());
    }

    @Test
    void testUpsertBatchesByHundred() {
        List<Passage> passages = new ArrayList<>();
        List<List<Float>> vectors = new ArrayList<>();
        for (int i = 0; i < 150; i++) {
            passages.add(Passage.builder().id("vid1-" + i).text("passage " + i).build());
            vectors.add(List.of((float) i));
        }
        when(embeddingService.embedBatch(anyList())).thenReturn(Mono.just(vectors));
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    requests.add(request);
                    String count = requests.size() == 1 ? "100" : "50";
                    return Mono.just(OpenAIProviderTest.jsonResponse(HttpStatus.OK, "{\"upsertedCount\":" + count + "}"));
                })
                .build();
        PineconeSimilarityProvider provider = new PineconeSimilarityProvider(webClient, properties, embeddingService);

        Integer upserted = provider.upsert("vid1", passages).block();

        assertEquals(150, upserted);
        assertEquals(2, requests.size());
        assertEquals("https://index.pinecone.test/vectors/upsert", requests.get(0).url().toString());
    }

    @Test
    void testShortEmbeddingBatchFailsUpsert() {
        List<Passage> passages = List.of(
                Passage.builder().id("vid1-0").text("first").build(),
                Passage.builder().id("vid1-1").text("second").build());
        when(embeddingService.embedBatch(anyList())).thenReturn(Mono.just(List.of(List.of(0.1f))));
        PineconeSimilarityProvider provider = provider("{\"upsertedCount\":2}");

        UpstreamUnavailableException error = assertThrows(UpstreamUnavailableException.class,
                () -> provider.upsert("vid1", passages).block());

        assertTrue(error.getMessage().contains("got 1"));
        assertTrue(requests.isEmpty());
    }

    @Test
    void testEmbeddingFailurePropagates() {
        when(embeddingService.embed(anyString()))
                .thenReturn(Mono.error(new UpstreamUnavailableException("embeddings down")));
        PineconeSimilarityProvider provider = provider("{\"matches\":[]}");

        assertThrows(UpstreamUnavailableException.class,
                () -> provider.similaritySearch("vid1", "q", 5).block());
        assertTrue(requests.isEmpty());
    }

    private PineconeSimilarityProvider provider(String body) {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(OpenAIProviderTest.jsonResponse(HttpStatus.OK, body));
                })
                .build();
        return new PineconeSimilarityProvider(webClient, properties, embeddingService);
    }
}
