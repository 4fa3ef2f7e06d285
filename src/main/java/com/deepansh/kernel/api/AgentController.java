package com.deepansh.kernel.api;

import com.deepansh.kernel.agent.AgentManager;
import com.deepansh.kernel.agent.AgentManifest;
import com.deepansh.kernel.agent.AgentRecord;
import com.deepansh.kernel.core.TurnService;
import com.deepansh.kernel.model.TurnRequest;
import com.deepansh.kernel.model.TurnResult;
import com.deepansh.kernel.quota.QuotaScheduler;
import com.deepansh.kernel.quota.QuotaUsage;
import com.deepansh.kernel.resilience.IdempotencyConflictException;
import com.deepansh.kernel.resilience.IdempotencyService;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Orchestrator surface of the kernel.
 *
 * POST   /api/v1/agents[?parentId=]         spawn
 * GET    /api/v1/agents                     list
 * GET    /api/v1/agents/{id}                describe
 * DELETE /api/v1/agents/{id}                cancel any running turn, then kill
 * POST   /api/v1/agents/{id}/turns          run one turn (optional Idempotency-Key header)
 * POST   /api/v1/agents/{id}/turns/stream   run one turn, text deltas as server-sent events
 * POST   /api/v1/agents/{id}/cancel         cancel the running turn
 * GET    /api/v1/agents/{id}/usage          token quota window
 */
@RestController
@RequestMapping("/api/v1/agents")
@Slf4j
public class AgentController {

    private final AgentManager agentManager;
    private final TurnService turnService;
    private final QuotaScheduler quotaScheduler;
    private final IdempotencyService idempotencyService;
    private final ObjectMapper objectMapper;
    private final AsyncTaskExecutor streamExecutor;

    public AgentController(AgentManager agentManager,
                           TurnService turnService,
                           QuotaScheduler quotaScheduler,
                           IdempotencyService idempotencyService,
                           ObjectMapper objectMapper,
                           @Qualifier("streamTaskExecutor") AsyncTaskExecutor streamExecutor) {
        this.agentManager = agentManager;
        this.turnService = turnService;
        this.quotaScheduler = quotaScheduler;
        this.idempotencyService = idempotencyService;
        this.objectMapper = objectMapper;
        this.streamExecutor = streamExecutor;
    }

    @PostMapping
    public ResponseEntity<AgentRecord> spawn(@Valid @RequestBody AgentManifest manifest,
                                             @RequestParam(required = false) String parentId) {
        return ResponseEntity.status(HttpStatus.CREATED).body(agentManager.spawn(manifest, parentId));
    }

    @GetMapping
    public ResponseEntity<List<AgentRecord>> list() {
        return ResponseEntity.ok(agentManager.list());
    }

    @GetMapping("/{agentId}")
    public ResponseEntity<AgentRecord> get(@PathVariable String agentId) {
        return ResponseEntity.ok(agentManager.get(agentId));
    }

    @DeleteMapping("/{agentId}")
    public ResponseEntity<Void> kill(@PathVariable String agentId) {
        turnService.cancel(agentId);
        agentManager.kill(agentId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{agentId}/turns")
    public ResponseEntity<TurnResult> runTurn(
            @PathVariable String agentId,
            @Valid @RequestBody TurnRequest request,
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey) {

        log.info("Turn request [agent={}, idempotencyKey={}]", agentId, idempotencyKey);
        agentManager.get(agentId);

        boolean idempotent = idempotencyKey != null && !idempotencyKey.isBlank();
        if (idempotent) {
            Optional<TurnResult> cached = cachedResult(agentId, idempotencyKey);
            if (cached.isPresent()) {
                return ResponseEntity.ok(cached.get());
            }
            if (!idempotencyService.claimKey(agentId, idempotencyKey)) {
                // The owner may have finished between the lookup and the claim
                return cachedResult(agentId, idempotencyKey)
                        .map(ResponseEntity::ok)
                        .orElseThrow(() -> new IdempotencyConflictException(idempotencyKey));
            }
        }

        TurnResult result;
        try {
            result = turnService.run(agentId, request.getInput());
        } catch (RuntimeException e) {
            if (idempotent) {
                idempotencyService.releaseKey(agentId, idempotencyKey);
            }
            throw e;
        }

        if (idempotent) {
            if (result.isCompleted()) {
                try {
                    idempotencyService.storeResponse(agentId, idempotencyKey, objectMapper.writeValueAsString(result));
                } catch (IOException e) {
                    log.warn("Failed to cache idempotent turn result", e);
                }
            } else {
                // Failed turns can be retried with the same key
                idempotencyService.releaseKey(agentId, idempotencyKey);
            }
        }
        return ResponseEntity.ok(result);
    }

    /**
     * Events: "delta" per text chunk, then one "result" with the {@link TurnResult},
     * or one "error" if the turn could not start.
     */
    @PostMapping(value = "/{agentId}/turns/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamTurn(@PathVariable String agentId, @Valid @RequestBody TurnRequest request) {
        agentManager.get(agentId);
        SseEmitter emitter = new SseEmitter(0L);

        streamExecutor.execute(() -> {
            try {
                TurnResult result = turnService.runStreaming(agentId, request.getInput(), delta -> {
                    try {
                        emitter.send(SseEmitter.event().name("delta").data(delta));
                    } catch (IOException e) {
                        log.debug("Stream client went away [agent={}]", agentId);
                        turnService.cancel(agentId);
                    }
                });
                emitter.send(SseEmitter.event().name("result").data(result, MediaType.APPLICATION_JSON));
                emitter.complete();
            } catch (IOException e) {
                emitter.completeWithError(e);
            } catch (RuntimeException e) {
                log.warn("Streaming turn failed to run [agent={}]: {}", agentId, e.getMessage());
                try {
                    emitter.send(SseEmitter.event().name("error").data(Map.of("error", String.valueOf(e.getMessage()))));
                    emitter.complete();
                } catch (IOException sendFailure) {
                    emitter.completeWithError(sendFailure);
                }
            }
        });
        return emitter;
    }

    @PostMapping("/{agentId}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String agentId) {
        agentManager.get(agentId);
        return ResponseEntity.ok(Map.of("agentId", agentId, "cancelled", turnService.cancel(agentId)));
    }

    @GetMapping("/{agentId}/usage")
    public ResponseEntity<QuotaUsage> usage(@PathVariable String agentId) {
        agentManager.get(agentId);
        return ResponseEntity.ok(quotaScheduler.usage(agentId));
    }

    private Optional<TurnResult> cachedResult(String agentId, String idempotencyKey) {
        Optional<String> cached = idempotencyService.getCachedResponse(agentId, idempotencyKey);
        if (cached.isEmpty()) {
            return Optional.empty();
        }
        try {
            log.info("Returning cached turn result for idempotency key={}", idempotencyKey);
            return Optional.of(objectMapper.readValue(cached.get(), TurnResult.class));
        } catch (IOException e) {
            log.warn("Failed to deserialize cached turn result, running fresh", e);
            return Optional.empty();
        }
    }
}
