package com.deepansh.kernel.resilience;

import com.deepansh.kernel.llm.LlmDriver;
import com.deepansh.kernel.llm.LlmDriverException;
import com.deepansh.kernel.llm.RateLimitedException;
import com.deepansh.kernel.model.LlmRequest;
import com.deepansh.kernel.model.LlmResponse;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Decorator around the concrete driver that adds retry + circuit breaker.
 *
 * Only {@link RateLimitedException} is retried (see resilience4j.retry.instances.llmDriver);
 * every other driver error fails the turn straight away. When retries run out, or the
 * breaker is open, the caller gets an {@link LlmDriverException} so the loop can end
 * the turn with DRIVER_FAILURE.
 *
 * A stream is only retried while nothing has been emitted yet, so text is never
 * delivered twice.
 */
@Component
@Primary
@Slf4j
public class ResilientLlmDriver implements LlmDriver {

    static final String INSTANCE = "llmDriver";

    private final LlmDriver delegate;
    private final Retry retry;
    private final CircuitBreaker circuitBreaker;

    public ResilientLlmDriver(@Qualifier("openAiCompatibleDriver") LlmDriver delegate,
                              RetryRegistry retryRegistry,
                              CircuitBreakerRegistry circuitBreakerRegistry) {
        this.delegate = delegate;
        this.retry = retryRegistry.retry(INSTANCE);
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(INSTANCE);
        this.retry.getEventPublisher().onRetry(event -> log.warn("LLM call rate limited, retry #{} in {}",
                event.getNumberOfRetryAttempts(), event.getWaitInterval()));
    }

    @Override
    public LlmResponse send(LlmRequest request) {
        return call(() -> delegate.send(request));
    }

    @Override
    public LlmResponse stream(LlmRequest request, Consumer<String> onText) {
        AtomicBoolean emitted = new AtomicBoolean();
        return call(() -> {
            try {
                return delegate.stream(request, text -> {
                    emitted.set(true);
                    onText.accept(text);
                });
            } catch (RateLimitedException e) {
                if (emitted.get()) {
                    throw new LlmDriverException("Stream interrupted after partial output: " + e.getMessage(), e);
                }
                throw e;
            }
        });
    }

    private LlmResponse call(Supplier<LlmResponse> supplier) {
        Supplier<LlmResponse> guarded = CircuitBreaker.decorateSupplier(circuitBreaker, supplier);
        Supplier<LlmResponse> retried = Retry.decorateSupplier(retry, guarded);
        try {
            return retried.get();
        } catch (RateLimitedException e) {
            log.error("LLM call still rate limited after {} attempts", retry.getRetryConfig().getMaxAttempts());
            throw new LlmDriverException("LLM provider rate limited; retries exhausted", e);
        } catch (CallNotPermittedException e) {
            log.error("LLM circuit breaker is OPEN, rejecting call");
            throw new LlmDriverException("LLM circuit breaker is open", e);
        }
    }
}
