package com.deepansh.kernel.llm;

import com.deepansh.kernel.model.LlmRequest;
import com.deepansh.kernel.model.LlmResponse;

import java.util.function.Consumer;

/**
 * The external model. Implementations throw {@link RateLimitedException} for
 * rate-limit and overload responses (retryable) and {@link LlmDriverException}
 * for everything else (turn-fatal).
 */
public interface LlmDriver {

    LlmResponse send(LlmRequest request);

    /**
     * Streaming variant: text deltas go to {@code onText} as they arrive, and the
     * assembled response is returned at the end. Drivers without native streaming
     * deliver the whole text as one delta.
     */
    default LlmResponse stream(LlmRequest request, Consumer<String> onText) {
        LlmResponse response = send(request);
        if (response.getText() != null && !response.getText().isEmpty()) {
            onText.accept(response.getText());
        }
        return response;
    }
}
