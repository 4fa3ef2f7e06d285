package com.deepansh.kernel.llm;

import com.deepansh.kernel.model.ContentBlock;
import com.deepansh.kernel.model.LlmRequest;
import com.deepansh.kernel.model.LlmResponse;
import com.deepansh.kernel.model.Message;
import com.deepansh.kernel.model.StopReason;
import com.deepansh.kernel.model.ToolCall;
import com.deepansh.kernel.tool.ToolDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Consumer;

/**
 * OpenAI-compatible chat-completions driver. Works with Groq, OpenAI, and Gemini's
 * OpenAI endpoint.
 *
 * Error mapping:
 *
 * | Response              | Exception                      |
 * |-----------------------|--------------------------------|
 * | 429, 503, 529         | RateLimitedException (retried) |
 * | any other 4xx / 5xx   | LlmDriverException (fatal)     |
 * | network error         | LlmDriverException (fatal)     |
 *
 * Message mapping: tool_result blocks become separate "tool" role messages placed
 * before any remaining user content; image blocks become data-URL image parts.
 */
@Slf4j
public class OpenAiCompatibleDriver implements LlmDriver {

    private final LlmProviderProperties props;
    private final ObjectMapper objectMapper;
    private final String providerName;
    private final RestClient restClient;

    public OpenAiCompatibleDriver(LlmProviderProperties props,
                                  ObjectMapper objectMapper,
                                  String providerName,
                                  RestClient.Builder restClientBuilder) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.providerName = providerName;
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getApiKey())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public LlmResponse send(LlmRequest request) {
        Map<String, Object> body = buildRequestBody(request, false);
        log.debug("Sending {} messages to {} [model={}]", request.getMessages().size(), providerName, body.get("model"));
        try {
            Map<String, Object> response = restClient.post()
                    .uri("/chat/completions")
                    .body(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> throwForStatus(res))
                    .body(new ParameterizedTypeReference<>() {});
            if (response == null) {
                throw new LlmDriverException(providerName + " returned an empty body");
            }
            return parseResponse(objectMapper.valueToTree(response));
        } catch (RestClientException e) {
            throw new LlmDriverException(providerName + " request failed: " + e.getMessage(), e);
        }
    }

    @Override
    public LlmResponse stream(LlmRequest request, Consumer<String> onText) {
        Map<String, Object> body = buildRequestBody(request, true);
        try {
            return restClient.post()
                    .uri("/chat/completions")
                    .body(body)
                    .exchange((req, res) -> {
                        if (res.getStatusCode().isError()) {
                            throwForStatus(res);
                        }
                        return readStream(res, onText);
                    });
        } catch (RestClientException e) {
            throw new LlmDriverException(providerName + " stream failed: " + e.getMessage(), e);
        }
    }

    private void throwForStatus(ClientHttpResponse res) throws IOException {
        int status = res.getStatusCode().value();
        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
        if (status == 429 || status == 503 || status == 529) {
            log.warn("{} rate limited [{}]", providerName, status);
            throw new RateLimitedException(providerName + " rate limited [" + status + "]",
                    retryAfter(res.getHeaders()));
        }
        log.error("{} error [{}]: {}", providerName, status, body);
        if (status == 401) {
            throw new LlmDriverException(providerName + " API key is invalid. Check your "
                    + providerName.toUpperCase() + "_API_KEY environment variable.");
        }
        throw new LlmDriverException(providerName + " error [" + status + "]: " + body);
    }

    private Duration retryAfter(HttpHeaders headers) {
        String value = headers.getFirst("Retry-After");
        if (value == null) return null;
        try {
            return Duration.ofSeconds(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    Map<String, Object> buildRequestBody(LlmRequest request, boolean stream) {
        List<Map<String, Object>> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(Map.of("role", "system", "content", request.getSystemPrompt()));
        }
        for (Message message : request.getMessages()) {
            messages.addAll(formatMessage(message));
        }

        Map<String, Object> body = new HashMap<>();
        body.put("model", request.getModel() != null ? request.getModel() : props.getModel());
        body.put("max_tokens", request.getMaxTokens());
        body.put("temperature", props.getTemperature());
        body.put("messages", messages);
        if (request.getTools() != null && !request.getTools().isEmpty()) {
            body.put("tools", request.getTools().stream().map(ToolDefinition::toOpenAiSchema).toList());
            body.put("tool_choice", "auto");
        }
        if (stream) {
            body.put("stream", true);
            body.put("stream_options", Map.of("include_usage", true));
        }
        return body;
    }

    private List<Map<String, Object>> formatMessage(Message message) {
        List<Map<String, Object>> out = new ArrayList<>();
        if (message.getRole() == Message.Role.assistant) {
            Map<String, Object> m = new HashMap<>();
            m.put("role", "assistant");
            String text = message.textContent();
            m.put("content", text.isEmpty() ? null : text);
            List<ContentBlock> toolUses = message.toolUses();
            if (!toolUses.isEmpty()) {
                m.put("tool_calls", toolUses.stream().map(this::formatToolCall).toList());
            }
            out.add(m);
            return out;
        }

        List<Object> parts = new ArrayList<>();
        for (ContentBlock block : message.getContent()) {
            switch (block.getType()) {
                case tool_result -> {
                    Map<String, Object> m = new HashMap<>();
                    m.put("role", "tool");
                    m.put("tool_call_id", block.getToolUseId());
                    m.put("content", block.getContent() != null ? block.getContent() : "");
                    out.add(m);
                }
                case text -> parts.add(Map.of("type", "text", "text", block.getText() != null ? block.getText() : ""));
                case image -> parts.add(Map.of("type", "image_url", "image_url",
                        Map.of("url", "data:" + block.getMediaType() + ";base64," + block.getData())));
                case tool_use -> log.warn("Dropping tool_use block found in a user message");
            }
        }
        if (!parts.isEmpty()) {
            boolean textOnly = parts.stream().allMatch(p -> "text".equals(((Map<?, ?>) p).get("type")));
            Object content = textOnly ? message.textContent() : parts;
            out.add(Map.of("role", "user", "content", content));
        }
        return out;
    }

    private Map<String, Object> formatToolCall(ContentBlock toolUse) {
        Map<String, Object> fn = new HashMap<>();
        fn.put("name", toolUse.getName());
        try {
            fn.put("arguments", objectMapper.writeValueAsString(toolUse.getInput()));
        } catch (JsonProcessingException e) {
            fn.put("arguments", "{}");
        }
        return Map.of("id", toolUse.getId(), "type", "function", "function", fn);
    }

    LlmResponse parseResponse(JsonNode response) {
        JsonNode choices = response.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new LlmDriverException(providerName + " returned no choices in response");
        }
        JsonNode choice = choices.get(0);
        JsonNode message = choice.path("message");

        List<ToolCall> toolCalls = new ArrayList<>();
        for (JsonNode call : message.path("tool_calls")) {
            JsonNode function = call.path("function");
            toolCalls.add(ToolCall.builder()
                    .id(call.path("id").asText())
                    .toolName(function.path("name").asText())
                    .arguments(parseArguments(function.path("arguments").asText("{}")))
                    .build());
        }

        JsonNode usage = response.path("usage");
        return LlmResponse.builder()
                .text(message.path("content").isTextual() ? message.path("content").asText() : null)
                .toolCalls(toolCalls)
                .stopReason(stopReason(choice.path("finish_reason").asText(null), !toolCalls.isEmpty()))
                .inputTokens(usage.path("prompt_tokens").asInt(0))
                .outputTokens(usage.path("completion_tokens").asInt(0))
                .build();
    }

    private LlmResponse readStream(ClientHttpResponse res, Consumer<String> onText) throws IOException {
        StringBuilder text = new StringBuilder();
        Map<Integer, StreamedCall> calls = new TreeMap<>();
        String finishReason = null;
        int inputTokens = 0;
        int outputTokens = 0;

        try (BufferedReader reader = new BufferedReader(new InputStreamReader(res.getBody(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.startsWith("data:")) continue;
                String data = line.substring(5).trim();
                if (data.equals("[DONE]")) break;

                JsonNode chunk = objectMapper.readTree(data);
                JsonNode usage = chunk.path("usage");
                if (usage.isObject()) {
                    inputTokens = usage.path("prompt_tokens").asInt(inputTokens);
                    outputTokens = usage.path("completion_tokens").asInt(outputTokens);
                }
                JsonNode choice = chunk.path("choices").path(0);
                if (choice.isMissingNode()) continue;

                JsonNode delta = choice.path("delta");
                if (delta.path("content").isTextual()) {
                    String piece = delta.path("content").asText();
                    text.append(piece);
                    onText.accept(piece);
                }
                for (JsonNode call : delta.path("tool_calls")) {
                    StreamedCall acc = calls.computeIfAbsent(call.path("index").asInt(0), i -> new StreamedCall());
                    if (call.hasNonNull("id")) acc.id = call.path("id").asText();
                    JsonNode function = call.path("function");
                    if (function.hasNonNull("name")) acc.name = function.path("name").asText();
                    if (function.hasNonNull("arguments")) acc.arguments.append(function.path("arguments").asText());
                }
                if (choice.hasNonNull("finish_reason")) {
                    finishReason = choice.path("finish_reason").asText();
                }
            }
        }

        List<ToolCall> toolCalls = new ArrayList<>();
        calls.values().forEach(c -> toolCalls.add(ToolCall.builder()
                .id(c.id)
                .toolName(c.name)
                .arguments(parseArguments(c.arguments.length() == 0 ? "{}" : c.arguments.toString()))
                .build()));

        return LlmResponse.builder()
                .text(text.length() == 0 ? null : text.toString())
                .toolCalls(toolCalls)
                .stopReason(stopReason(finishReason, !toolCalls.isEmpty()))
                .inputTokens(inputTokens)
                .outputTokens(outputTokens)
                .build();
    }

    private Map<String, Object> parseArguments(String json) {
        try {
            Map<String, Object> args = objectMapper.readValue(json, new TypeReference<>() {});
            return args != null ? args : Map.of();
        } catch (JsonProcessingException e) {
            log.warn("{} returned malformed tool arguments: {}", providerName, json);
            return Map.of("_malformed_arguments", json);
        }
    }

    private static StopReason stopReason(String finishReason, boolean hasToolCalls) {
        if ("length".equals(finishReason)) return StopReason.MAX_TOKENS;
        if (hasToolCalls || "tool_calls".equals(finishReason)) return StopReason.TOOL_USE;
        return StopReason.END_TURN;
    }

    private static final class StreamedCall {
        String id;
        String name;
        final StringBuilder arguments = new StringBuilder();
    }
}
