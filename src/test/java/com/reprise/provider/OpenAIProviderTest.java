package com.reprise.provider;

import com.reprise.config.JacksonConfiguration;
import com.reprise.config.RepriseProperties;
import com.reprise.exception.UpstreamUnavailableException;
import com.reprise.model.SummaryLength;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for OpenAIProvider.
 */
class OpenAIProviderTest {

    private static final String COMPLETION = "{\"id\":\"c1\",\"model\":\"gpt-3.5-turbo\",\"choices\":"
            + "[{\"index\":0,\"message\":{\"role\":\"assistant\",\"content\":\"  Raft elects a leader. \\n\"},"
            + "\"finish_reason\":\"stop\"}]}";

    private RepriseProperties properties;
    private final List<ClientRequest> requests = new ArrayList<>();

    @BeforeEach
    void setUp() {
        properties = new RepriseProperties();
        properties.getProxy().setMaxRetries(0);
        RepriseProperties.ProviderConfig openai = new RepriseProperties.ProviderConfig();
        openai.setBaseUrl("https://llm.test/v1");
        openai.setApiKey("sk-test");
        properties.getProviders().put("openai", openai);
    }

    @Test
    void testAnswerPostsToChatCompletions() {
        OpenAIProvider provider = provider(HttpStatus.OK, COMPLETION);

        String answer = provider.answer("How is a leader chosen?", List.of("raft elects a leader"), null).block();

        assertEquals("Raft elects a leader.", answer);
        assertEquals(1, requests.size());
        ClientRequest request = requests.get(0);
        assertEquals("https://llm.test/v1/chat/completions", request.url().toString());
        assertEquals("Bearer sk-test", request.headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void testSummarizeUsesSameEndpoint() {
        OpenAIProvider provider = provider(HttpStatus.OK, COMPLETION);

        String summary = provider.summarize("raft elects a leader", SummaryLength.SHORT).block();

        assertEquals("Raft elects a leader.", summary);
        assertEquals("https://llm.test/v1/chat/completions", requests.get(0).url().toString());
    }

    @Test
    void testEmptyChoicesIsAnError() {
        OpenAIProvider provider = provider(HttpStatus.OK, "{\"id\":\"c1\",\"choices\":[]}");

        assertThrows(UpstreamUnavailableException.class,
                () -> provider.answer("q", List.of("passage"), null).block());
    }

    @Test
    void testServerErrorIsRetriedThenSurfaced() {
        properties.getProxy().setMaxRetries(1);
        AtomicInteger calls = new AtomicInteger();
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    calls.incrementAndGet();
                    return Mono.just(jsonResponse(HttpStatus.SERVICE_UNAVAILABLE, "{}"));
                })
                .build();
        OpenAIProvider provider = new OpenAIProvider(webClient, properties, JacksonConfiguration.createObjectMapper());

        UpstreamUnavailableException error = assertThrows(UpstreamUnavailableException.class,
                () -> provider.answer("q", List.of("passage"), null).block());

        assertEquals(2, calls.get());
        assertTrue(error.getMessage().contains("openai"));
    }

    @Test
    void testClientErrorIsNotRetried() {
        properties.getProxy().setMaxRetries(3);
        AtomicInteger calls = new AtomicInteger();
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    calls.incrementAndGet();
                    return Mono.just(jsonResponse(HttpStatus.UNAUTHORIZED, "{}"));
                })
                .build();
        OpenAIProvider provider = new OpenAIProvider(webClient, properties, JacksonConfiguration.createObjectMapper());

        assertThrows(UpstreamUnavailableException.class,
                () -> provider.answer("q", List.of("passage"), null).block());
        assertEquals(1, calls.get());
    }

    @Test
    void testMissingApiKeyMeansDisabled() {
        properties.getProviders().get("openai").setApiKey("");
        OpenAIProvider provider = provider(HttpStatus.OK, COMPLETION);

        assertFalse(provider.isEnabled());
        assertThrows(UpstreamUnavailableException.class,
                () -> provider.answer("q", List.of("passage"), null).block());
        assertTrue(requests.isEmpty());
    }

    @Test
    void testModelOverrideReplacesConfiguredModel() {
        properties.getProviders().get("openai").setChatModel("gpt-3.5-turbo");
        OpenAIProvider provider = provider(HttpStatus.OK, COMPLETION);

        assertEquals("gpt-4o", provider.answerRequest("q", List.of("passage"), "gpt-4o").getModel());
        assertEquals("gpt-3.5-turbo", provider.answerRequest("q", List.of("passage"), null).getModel());
        assertEquals("gpt-3.5-turbo", provider.answerRequest("q", List.of("passage"), " ").getModel());
    }

    @Test
    void testStreamAnswerEmitsDeltasUntilDone() {
        String body = "data: " + chunk("{\"role\":\"assistant\"}") + "\n\n"
                + "data: " + chunk("{\"content\":\"Raft \"}") + "\n\n"
                + "data: " + chunk("{\"content\":\"elects a leader.\"}") + "\n\n"
                + "data: [DONE]\n\n";
        OpenAIProvider provider = streamingProvider(body);

        List<String> tokens = provider.streamAnswer("How is a leader chosen?", List.of("raft elects a leader"), null)
                .collectList()
                .block();

        assertEquals(List.of("Raft ", "elects a leader."), tokens);
        assertEquals("https://llm.test/v1/chat/completions", requests.get(0).url().toString());
    }

    @Test
    void testUnreadableStreamChunkIsAnError() {
        OpenAIProvider provider = streamingProvider("data: {not json\n\n");

        assertThrows(UpstreamUnavailableException.class,
                () -> provider.streamAnswer("q", List.of("passage"), null).collectList().block());
    }

    @Test
    void testStreamingWhenDisabledFailsWithoutRequest() {
        properties.getProviders().get("openai").setApiKey("");
        OpenAIProvider provider = streamingProvider("data: [DONE]\n\n");

        assertThrows(UpstreamUnavailableException.class,
                () -> provider.streamAnswer("q", List.of("passage"), null).collectList().block());
        assertTrue(requests.isEmpty());
    }

    @Test
    void testRenderKeepsPlaceholdersInValues() {
        String prompt = OpenAIProvider.render("Question: ${question}\n\nTranscript:\n${transcript}",
                Map.of("question", "what does ${transcript} mean?", "transcript", "line one"));

        assertEquals("Question: what does ${transcript} mean?\n\nTranscript:\nline one", prompt);
    }

    private OpenAIProvider provider(HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(jsonResponse(status, body));
                })
                .build();
        return new OpenAIProvider(webClient, properties, JacksonConfiguration.createObjectMapper());
    }

    private OpenAIProvider streamingProvider(String body) {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(ClientResponse.create(HttpStatus.OK)
                            .header(HttpHeaders.CONTENT_TYPE, "text/event-stream")
                            .body(body)
                            .build());
                })
                .build();
        return new OpenAIProvider(webClient, properties, JacksonConfiguration.createObjectMapper());
    }

    private static String chunk(String delta) {
        return "{\"id\":\"c1\",\"model\":\"gpt-3.5-turbo\",\"choices\":[{\"index\":0,\"delta\":" + delta + "}]}";
    }

    static ClientResponse jsonResponse(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, "application/json")
                .body(body)
                .build();
    }
}
