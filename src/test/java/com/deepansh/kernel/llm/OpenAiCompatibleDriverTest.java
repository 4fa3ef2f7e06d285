package com.deepansh.kernel.llm;

import com.deepansh.kernel.model.ContentBlock;
import com.deepansh.kernel.model.LlmRequest;
import com.deepansh.kernel.model.LlmResponse;
import com.deepansh.kernel.model.Message;
import com.deepansh.kernel.model.StopReason;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAiCompatibleDriverTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private OpenAiCompatibleDriver driver;

    @BeforeEach
    void setUp() {
        LlmProviderProperties props = new LlmProviderProperties();
        props.setApiKey("test-key");
        props.setBaseUrl("https://llm.example.com/v1");
        props.setModel("test-model");
        driver = new OpenAiCompatibleDriver(props, objectMapper, "groq", RestClient.builder());
    }

    @Test
    void parseResponse_multipleToolCalls() throws Exception {
        LlmResponse response = driver.parseResponse(objectMapper.readTree("""
                {"choices": [{"finish_reason": "tool_calls", "message": {"content": null, "tool_calls": [
                   {"id": "call_1", "function": {"name": "file_read", "arguments": "{\\"path\\": \\"a.txt\\"}"}},
                   {"id": "call_2", "function": {"name": "web_fetch", "arguments": "{\\"url\\": \\"https://x.io\\"}"}}
                ]}}],
                 "usage": {"prompt_tokens": 120, "completion_tokens": 30}}
                """));

        assertThat(response.getText()).isNull();
        assertThat(response.getStopReason()).isEqualTo(StopReason.TOOL_USE);
        assertThat(response.getToolCalls()).hasSize(2);
        assertThat(response.getToolCalls().get(0).getId()).isEqualTo("call_1");
        assertThat(response.getToolCalls().get(0).getArguments()).containsEntry("path", "a.txt");
        assertThat(response.getToolCalls().get(1).getToolName()).isEqualTo("web_fetch");
        assertThat(response.getInputTokens()).isEqualTo(120);
        assertThat(response.getOutputTokens()).isEqualTo(30);
    }

    @Test
    void parseResponse_lengthFinish_isMaxTokens() throws Exception {
        LlmResponse response = driver.parseResponse(objectMapper.readTree("""
                {"choices": [{"finish_reason": "length", "message": {"content": "partial ans"}}]}
                """));

        assertThat(response.getText()).isEqualTo("partial ans");
        assertThat(response.getStopReason()).isEqualTo(StopReason.MAX_TOKENS);
    }

    @Test
    void parseResponse_malformedArguments_areKeptRaw() throws Exception {
        LlmResponse response = driver.parseResponse(objectMapper.readTree("""
                {"choices": [{"finish_reason": "tool_calls", "message": {"tool_calls": [
                   {"id": "c1", "function": {"name": "echo", "arguments": "{not json"}}]}}]}
                """));

        assertThat(response.getToolCalls().get(0).getArguments()).containsEntry("_malformed_arguments", "{not json");
    }

    @Test
    void parseResponse_noChoices_isDriverFailure() throws Exception {
        assertThatThrownBy(() -> driver.parseResponse(objectMapper.readTree("{\"choices\": []}")))
                .isInstanceOf(LlmDriverException.class);
    }

    @Test
    @SuppressWarnings("unchecked")
    void buildRequestBody_toolResultsBecomeToolRoleMessages() {
        LlmRequest request = LlmRequest.builder()
                .systemPrompt("be brief")
                .messages(List.of(
                        Message.user("read a.txt"),
                        Message.of(Message.Role.assistant,
                                ContentBlock.text("reading"),
                                ContentBlock.toolUse("t1", "file_read", Map.of("path", "a.txt"))),
                        Message.of(Message.Role.user, ContentBlock.toolResult("t1", "contents", false))))
                .tools(List.of())
                .maxTokens(256)
                .build();

        Map<String, Object> body = driver.buildRequestBody(request, false);

        List<Map<String, Object>> messages = (List<Map<String, Object>>) body.get("messages");
        assertThat(body).containsEntry("model", "test-model").containsEntry("max_tokens", 256).doesNotContainKey("tools");
        assertThat(messages).extracting(m -> m.get("role")).containsExactly("system", "user", "assistant", "tool");
        assertThat(messages.get(2)).containsEntry("content", "reading").containsKey("tool_calls");
        assertThat(messages.get(3)).containsEntry("tool_call_id", "t1").containsEntry("content", "contents");
    }

    @Test
    void buildRequestBody_streamingRequestsUsage() {
        LlmRequest request = LlmRequest.builder().messages(List.of(Message.user("hi"))).maxTokens(10).build();

        Map<String, Object> body = driver.buildRequestBody(request, true);

        assertThat(body).containsEntry("stream", true).containsKey("stream_options");
    }
}
