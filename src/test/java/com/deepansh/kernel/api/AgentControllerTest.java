package com.deepansh.kernel.api;

import com.deepansh.kernel.agent.AgentManager;
import com.deepansh.kernel.core.AgentBusyException;
import com.deepansh.kernel.core.TurnService;
import com.deepansh.kernel.model.TurnRequest;
import com.deepansh.kernel.model.TurnResult;
import com.deepansh.kernel.model.TurnStatus;
import com.deepansh.kernel.quota.QuotaScheduler;
import com.deepansh.kernel.resilience.IdempotencyConflictException;
import com.deepansh.kernel.resilience.IdempotencyService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.http.ResponseEntity;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AgentControllerTest {

    private static final String AGENT = "agent-1";
    private static final String KEY = "key-1";

    @Mock private AgentManager agentManager;
    @Mock private TurnService turnService;
    @Mock private QuotaScheduler quotaScheduler;
    @Mock private IdempotencyService idempotencyService;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private AgentController controller;

    @BeforeEach
    void setUp() {
        controller = new AgentController(agentManager, turnService, quotaScheduler,
                idempotencyService, objectMapper, new SimpleAsyncTaskExecutor());
    }

    @Test
    void duplicateWhileFirstInFlight_isRejectedAndLeavesTheKeyAlone() {
        when(idempotencyService.getCachedResponse(AGENT, KEY)).thenReturn(Optional.empty());
        when(idempotencyService.claimKey(AGENT, KEY)).thenReturn(false);

        assertThatThrownBy(() -> controller.runTurn(AGENT, request("hi"), KEY))
                .isInstanceOf(IdempotencyConflictException.class)
                .hasMessageContaining(KEY);

        verify(turnService, never()).run(anyString(), anyString());
        verify(idempotencyService, never()).releaseKey(anyString(), anyString());
    }

    @Test
    void lostClaim_afterOwnerFinished_returnsStoredResult() throws Exception {
        TurnResult stored = TurnResult.builder().agentId(AGENT).status(TurnStatus.COMPLETED).text("done").build();
        when(idempotencyService.getCachedResponse(AGENT, KEY))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(objectMapper.writeValueAsString(stored)));
        when(idempotencyService.claimKey(AGENT, KEY)).thenReturn(false);

        ResponseEntity<TurnResult> response = controller.runTurn(AGENT, request("hi"), KEY);

        assertThat(response.getBody().getText()).isEqualTo("done");
        verify(turnService, never()).run(anyString(), anyString());
        verify(idempotencyService, never()).releaseKey(anyString(), anyString());
    }

    @Test
    void claimedKey_isReleasedWhenTheTurnThrows() {
        when(idempotencyService.getCachedResponse(AGENT, KEY)).thenReturn(Optional.empty());
        when(idempotencyService.claimKey(AGENT, KEY)).thenReturn(true);
        when(turnService.run(AGENT, "hi")).thenThrow(new AgentBusyException(AGENT));

        assertThatThrownBy(() -> controller.runTurn(AGENT, request("hi"), KEY))
                .isInstanceOf(AgentBusyException.class);

        verify(idempotencyService).releaseKey(AGENT, KEY);
    }

    @Test
    void claimedKey_storesCompletedResult() {
        TurnResult result = TurnResult.builder().agentId(AGENT).status(TurnStatus.COMPLETED).text("ok").build();
        when(idempotencyService.getCachedResponse(AGENT, KEY)).thenReturn(Optional.empty());
        when(idempotencyService.claimKey(AGENT, KEY)).thenReturn(true);
        when(turnService.run(AGENT, "hi")).thenReturn(result);

        ResponseEntity<TurnResult> response = controller.runTurn(AGENT, request("hi"), KEY);

        assertThat(response.getBody()).isSameAs(result);
        verify(idempotencyService).storeResponse(eq(AGENT), eq(KEY), contains("\"text\":\"ok\""));
        verify(idempotencyService, never()).releaseKey(anyString(), anyString());
    }

    @Test
    void noKey_skipsIdempotencyEntirely() {
        when(turnService.run(AGENT, "hi"))
                .thenReturn(TurnResult.builder().agentId(AGENT).status(TurnStatus.COMPLETED).build());

        controller.runTurn(AGENT, request("hi"), null);

        verifyNoInteractions(idempotencyService);
    }

    private static TurnRequest request(String input) {
        TurnRequest request = new TurnRequest();
        request.setInput(input);
        return request;
    }
}
