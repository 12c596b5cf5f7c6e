package com.reprise.provider;

import com.reprise.config.RepriseProperties;
import com.reprise.exception.UpstreamUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Abstract base class for remote HTTP providers with common functionality.
 */
@Slf4j
public abstract class AbstractProvider {

    protected final WebClient webClient;
    protected final RepriseProperties properties;
    protected final RepriseProperties.ProviderConfig config;

    protected AbstractProvider(
            WebClient webClient,
            RepriseProperties properties,
            String providerName) {
        this.webClient = webClient;
        this.properties = properties;
        this.config = properties.getProviders().get(providerName);
    }

    /**
     * Get provider name (e.g., "openai", "pinecone").
     */
    public abstract String getName();

    public boolean isEnabled() {
        return config != null && config.isEnabled()
                && StringUtils.isNotBlank(config.getBaseUrl()) && StringUtils.isNotBlank(config.getApiKey());
    }

    /**
     * Execute request with retry logic. Failures surface as {@link UpstreamUnavailableException}.
     */
    protected <T> Mono<T> executeWithRetry(Mono<T> request) {
        if (!isEnabled()) {
            return Mono.error(new UpstreamUnavailableException(getName() + " provider is not configured"));
        }
        return request
                .retryWhen(Retry.backoff(properties.getProxy().getMaxRetries(), Duration.ofSeconds(1))
                        .maxBackoff(Duration.ofSeconds(10))
                        .filter(this::isRetryable))
                .doOnSuccess(response -> log.debug("Request succeeded for provider: {}", getName()))
                .doOnError(error -> log.error("Request failed for provider: {}", getName(), error))
                .onErrorMap(error -> !(error instanceof UpstreamUnavailableException),
                        error -> new UpstreamUnavailableException(getName() + " request failed",
                                Exceptions.isRetryExhausted(error) && error.getCause() != null
                                        ? error.getCause() : error));
    }

    /**
     * Execute a streamed request. Not retried: a retry after the first element would repeat output.
     */
    protected <T> Flux<T> executeStream(Flux<T> request) {
        if (!isEnabled()) {
            return Flux.error(new UpstreamUnavailableException(getName() + " provider is not configured"));
        }
        return request
                .doOnComplete(() -> log.debug("Stream completed for provider: {}", getName()))
                .doOnError(error -> log.error("Stream failed for provider: {}", getName(), error))
                .onErrorMap(error -> !(error instanceof UpstreamUnavailableException),
                        error -> new UpstreamUnavailableException(getName() + " stream failed", error));
    }

    /**
     * Check if an error is retryable: connection failures, timeouts, 429 and 5xx responses.
     */
    protected boolean isRetryable(Throwable throwable) {
        if (throwable instanceof WebClientResponseException) {
            int status = ((WebClientResponseException) throwable).getStatusCode().value();
            return status == 429 || status >= 500;
        }
        return throwable instanceof WebClientRequestException
                || throwable instanceof TimeoutException;
    }

    /**
     * Get provider configuration.
     */
    protected RepriseProperties.ProviderConfig getConfig() {
        return config;
    }
}
