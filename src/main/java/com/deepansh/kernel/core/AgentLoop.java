package com.deepansh.kernel.core;

import com.deepansh.kernel.agent.AgentManager;
import com.deepansh.kernel.agent.AgentRecord;
import com.deepansh.kernel.capability.CapabilityManager;
import com.deepansh.kernel.config.KernelProperties;
import com.deepansh.kernel.guard.LoopGuard;
import com.deepansh.kernel.guard.LoopGuardFactory;
import com.deepansh.kernel.guard.LoopGuardVerdict;
import com.deepansh.kernel.llm.LlmDriver;
import com.deepansh.kernel.llm.LlmDriverException;
import com.deepansh.kernel.model.ContentBlock;
import com.deepansh.kernel.model.FailureReason;
import com.deepansh.kernel.model.LlmRequest;
import com.deepansh.kernel.model.LlmResponse;
import com.deepansh.kernel.model.Message;
import com.deepansh.kernel.model.StopReason;
import com.deepansh.kernel.model.ToolCall;
import com.deepansh.kernel.model.TurnResult;
import com.deepansh.kernel.model.TurnStatus;
import com.deepansh.kernel.observability.RunContext;
import com.deepansh.kernel.quota.QuotaExceededException;
import com.deepansh.kernel.quota.QuotaScheduler;
import com.deepansh.kernel.session.CompactionResult;
import com.deepansh.kernel.session.ContextCompactor;
import com.deepansh.kernel.session.SessionRepair;
import com.deepansh.kernel.session.SessionStore;
import com.deepansh.kernel.session.TokenEstimator;
import com.deepansh.kernel.tool.ToolContext;
import com.deepansh.kernel.tool.ToolDefinition;
import com.deepansh.kernel.tool.ToolDispatcher;
import com.deepansh.kernel.tool.ToolOutcome;
import com.deepansh.kernel.tool.ToolRegistry;
import com.deepansh.kernel.usage.CostEstimator;
import com.deepansh.kernel.usage.UsageEvent;
import com.deepansh.kernel.usage.UsageSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * One agent turn as a bounded state machine:
 * DRAFTING -> (TOOL_EXECUTING -> DRAFTING)* -> COMPLETED | FAILED.
 *
 * Per iteration:
 * 1. Repair history, build the capability-filtered tool catalogue
 * 2. Reserve the estimated token cost; QuotaExceeded ends the turn
 * 3. Call the driver (retries for rate limits live in the resilient driver)
 * 4. Tool calls go through the loop guard, then the dispatcher; results are appended in issue order
 * 5. No tool calls: finish, after at most max-continuations "continue" re-prompts
 *
 * Every exit path compacts and saves the session. Tool uses left without results by a
 * fatal error or a cancellation get error results first, so stored history is always
 * well-formed.
 */
@Service
@Slf4j
public class AgentLoop {

    static final String CONTINUE_PROMPT = "Continue from where you stopped.";
    static final String MAX_ITERATIONS_TEXT = "I was unable to complete the task within the allowed steps.";

    private final LlmDriver llmDriver;
    private final ToolRegistry toolRegistry;
    private final ToolDispatcher toolDispatcher;
    private final CapabilityManager capabilityManager;
    private final QuotaScheduler quotaScheduler;
    private final LoopGuardFactory loopGuardFactory;
    private final ContextCompactor contextCompactor;
    private final SessionStore sessionStore;
    private final AgentManager agentManager;
    private final UsageSink usageSink;
    private final CostEstimator costEstimator;
    private final KernelProperties properties;

    public AgentLoop(LlmDriver llmDriver,
                     ToolRegistry toolRegistry,
                     ToolDispatcher toolDispatcher,
                     CapabilityManager capabilityManager,
                     QuotaScheduler quotaScheduler,
                     LoopGuardFactory loopGuardFactory,
                     ContextCompactor contextCompactor,
                     SessionStore sessionStore,
                     AgentManager agentManager,
                     UsageSink usageSink,
                     CostEstimator costEstimator,
                     KernelProperties properties) {
        this.llmDriver = llmDriver;
        this.toolRegistry = toolRegistry;
        this.toolDispatcher = toolDispatcher;
        this.capabilityManager = capabilityManager;
        this.quotaScheduler = quotaScheduler;
        this.loopGuardFactory = loopGuardFactory;
        this.contextCompactor = contextCompactor;
        this.sessionStore = sessionStore;
        this.agentManager = agentManager;
        this.usageSink = usageSink;
        this.costEstimator = costEstimator;
        this.properties = properties;
    }

    /**
     * @param onText receives streamed text deltas; null to use the non-streaming driver call
     */
    public TurnResult runTurn(String agentId, String input, int depth,
                              CancellationToken token, Consumer<String> onText) {
        AgentRecord agent = agentManager.get(agentId);
        RunContext run = new RunContext();
        log.info("Turn started [agent={}, depth={}, input='{}']", agentId, depth, abbreviate(input));

        List<Message> history = new ArrayList<>(sessionStore.load(agent.getSessionId()));
        history.add(Message.user(input));

        AgentContext context = AgentContext.builder()
                .agentId(agentId)
                .sessionId(agent.getSessionId())
                .depth(depth)
                .model(agent.getModel())
                .systemPrompt(agent.getSystemPrompt())
                .maxTokens(maxTokens(agentId))
                .maxConcurrentTools(agent.getMaxConcurrentTools())
                .messages(SessionRepair.repair(history))
                .state(TurnState.DRAFTING)
                .build();

        TurnResult result;
        try {
            result = executeLoop(context, run, token, onText);
        } catch (QuotaExceededException e) {
            result = failed(context, run, FailureReason.QUOTA_EXCEEDED, e.getMessage());
            result.setQuotaResetAt(e.getResetAt());
        } catch (LoopCircuitBreakException e) {
            log.warn("Turn aborted by loop guard [agent={}]: {}", agentId, e.getMessage());
            result = failed(context, run, FailureReason.CIRCUIT_BREAK, e.getMessage());
        } catch (LlmDriverException e) {
            log.error("LLM driver failure [agent={}]: {}", agentId, e.getMessage());
            result = failed(context, run, FailureReason.DRIVER_FAILURE, e.getMessage());
        } catch (TurnCancelledException e) {
            log.info("Turn cancelled [agent={}, iteration={}]", agentId, context.getIteration());
            result = failed(context, run, FailureReason.CANCELLED, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Turn failed unexpectedly [agent={}]", agentId, e);
            result = failed(context, run, FailureReason.INTERNAL, e.getMessage());
        }

        if (token.isCancelled()) {
            // Clear the interrupt so session persistence is not disturbed
            Thread.interrupted();
        }
        closeDanglingToolUses(context.getMessages(), result);
        persist(context);
        emitUsage(context, run, result);

        log.info("Turn finished [agent={}, status={}, iterations={}, tokens={}/{}, latency={}ms]",
                agentId, result.getStatus(), result.getIterations(),
                result.getTokensIn(), result.getTokensOut(), run.elapsedMs());
        return result;
    }

    private TurnResult executeLoop(AgentContext context, RunContext run,
                                   CancellationToken token, Consumer<String> onText) {
        LoopGuard guard = loopGuardFactory.newRun();
        int maxIterations = properties.getLoop().getMaxIterations();
        int maxContinuations = properties.getLoop().getMaxContinuations();

        for (int i = 1; i <= maxIterations; i++) {
            token.throwIfCancelled(context.getAgentId());
            context.setIteration(i);
            context.setState(TurnState.DRAFTING);
            log.debug("Iteration {}/{} [agent={}]", i, maxIterations, context.getAgentId());

            compact(context);
            context.setMessages(SessionRepair.repair(context.getMessages()));
            List<ToolDefinition> tools = toolRegistry.definitionsFor(context.getAgentId());

            LlmResponse response = callDriver(context, tools, run, onText);
            token.throwIfCancelled(context.getAgentId());

            if (!response.hasToolCalls()) {
                String text = response.getText();
                boolean empty = text == null || text.isBlank();
                if (!empty) {
                    context.getMessages().add(Message.assistant(text));
                    context.getPartialText().append(text);
                }
                boolean truncated = response.getStopReason() == StopReason.MAX_TOKENS;
                if ((truncated || empty) && context.getContinuations() < maxContinuations) {
                    context.setContinuations(context.getContinuations() + 1);
                    log.info("Re-prompting to continue ({}/{}) [agent={}, reason={}]",
                            context.getContinuations(), maxContinuations, context.getAgentId(),
                            truncated ? "max_tokens" : "empty");
                    context.getMessages().add(Message.user(CONTINUE_PROMPT));
                    continue;
                }
                context.setState(TurnState.COMPLETED);
                return completed(context, run, context.getPartialText().toString(), false);
            }

            executeTools(context, response, guard, run);
        }

        log.warn("Agent hit max iterations ({}) [agent={}]", maxIterations, context.getAgentId());
        context.setState(TurnState.COMPLETED);
        String text = context.getPartialText().length() > 0
                ? context.getPartialText().toString()
                : MAX_ITERATIONS_TEXT;
        return completed(context, run, text, true);
    }

    private LlmResponse callDriver(AgentContext context, List<ToolDefinition> tools,
                                   RunContext run, Consumer<String> onText) {
        LlmRequest request = LlmRequest.builder()
                .model(context.getModel())
                .systemPrompt(context.getSystemPrompt())
                .messages(List.copyOf(context.getMessages()))
                .tools(tools)
                .maxTokens(context.getMaxTokens())
                .build();

        long estimate = TokenEstimator.estimate(context.getSystemPrompt(), context.getMessages(), tools,
                properties.getCompaction().getCharsPerToken()) + context.getMaxTokens();
        quotaScheduler.reserve(context.getAgentId(), estimate);

        LlmResponse response;
        try {
            response = onText != null ? llmDriver.stream(request, onText) : llmDriver.send(request);
        } catch (RuntimeException e) {
            quotaScheduler.settle(context.getAgentId(), estimate, 0);
            throw e;
        }

        long actual = (long) response.getInputTokens() + response.getOutputTokens();
        // Providers that report no usage are charged the estimate
        quotaScheduler.settle(context.getAgentId(), estimate, actual > 0 ? actual : estimate);
        run.addTokens(response.getInputTokens(), response.getOutputTokens());
        return response;
    }

    private void executeTools(AgentContext context, LlmResponse response, LoopGuard guard, RunContext run) {
        List<ToolCall> calls = response.getToolCalls();
        List<ContentBlock> assistantBlocks = new ArrayList<>();
        if (response.getText() != null && !response.getText().isBlank()) {
            assistantBlocks.add(ContentBlock.text(response.getText()));
        }
        for (ToolCall call : calls) {
            if (call.getId() == null || call.getId().isBlank()) {
                call.setId("toolu_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16));
            }
            call.setAgentId(context.getAgentId());
            call.setDepth(context.getDepth());
            assistantBlocks.add(call.toToolUseBlock());
        }
        context.getMessages().add(Message.of(Message.Role.assistant, assistantBlocks));
        context.setState(TurnState.TOOL_EXECUTING);

        ToolOutcome[] outcomes = new ToolOutcome[calls.size()];
        List<Integer> toDispatch = new ArrayList<>();
        Set<Integer> warned = new HashSet<>();

        for (int i = 0; i < calls.size(); i++) {
            ToolCall call = calls.get(i);
            LoopGuardVerdict verdict = guard.check(call.getToolName(), call.getArguments());
            switch (verdict) {
                case CIRCUIT_BREAK -> throw new LoopCircuitBreakException(guard.totalCalls());
                case BLOCK -> outcomes[i] = ToolOutcome.failure(call.getId(), call.getToolName(),
                        "LOOP_GUARD_BLOCKED: identical call to '" + call.getToolName() + "' made "
                                + guard.repetitions(call.getToolName(), call.getArguments())
                                + " times. Change the parameters or try a different approach.");
                case WARN -> {
                    warned.add(i);
                    toDispatch.add(i);
                }
                case ALLOW -> toDispatch.add(i);
            }
        }

        List<ToolCall> batch = toDispatch.stream().map(calls::get).toList();
        List<ToolOutcome> results;
        try {
            results = batch.isEmpty()
                    ? List.of()
                    : toolDispatcher.dispatchAll(batch,
                            new ToolContext(context.getAgentId(), context.getSessionId(), context.getDepth()),
                            context.getMaxConcurrentTools());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TurnCancelledException(context.getAgentId());
        }

        for (int k = 0; k < toDispatch.size(); k++) {
            int index = toDispatch.get(k);
            ToolOutcome outcome = results.get(k);
            if (warned.contains(index)) {
                ToolCall call = calls.get(index);
                outcome = new ToolOutcome(outcome.toolUseId(), outcome.toolName(),
                        outcome.content() + "\n\n[loop guard] This exact call has now been made "
                                + guard.repetitions(call.getToolName(), call.getArguments())
                                + " times. Repeating it again will be blocked.",
                        outcome.error(), outcome.latencyMs());
            }
            outcomes[index] = outcome;
        }

        List<ContentBlock> resultBlocks = new ArrayList<>();
        for (ToolOutcome outcome : outcomes) {
            resultBlocks.add(outcome.toResultBlock());
            run.recordToolCall(outcome.toolName(), outcome.latencyMs(), outcome.error());
        }
        context.getMessages().add(Message.of(Message.Role.user, resultBlocks));
    }

    private void compact(AgentContext context) {
        CompactionResult compaction = contextCompactor.compact(context.getMessages());
        if (compaction.compacted()) {
            context.setMessages(new ArrayList<>(compaction.messages()));
        }
    }

    /**
     * A turn that ended between appending tool uses and appending their results would
     * leave dangling tool_use blocks; give each one an error result.
     */
    static void closeDanglingToolUses(List<Message> messages, TurnResult result) {
        if (messages.isEmpty()) return;
        Message last = messages.get(messages.size() - 1);
        if (last.getRole() != Message.Role.assistant || last.toolUses().isEmpty()) return;

        String reason = "Tool call not completed: turn ended ("
                + (result.getFailureReason() != null ? result.getFailureReason() : result.getStatus()) + ")";
        List<ContentBlock> results = new ArrayList<>();
        for (ContentBlock toolUse : last.toolUses()) {
            results.add(ContentBlock.toolResult(toolUse.getId(), reason, true));
        }
        messages.add(Message.of(Message.Role.user, results));
    }

    private void persist(AgentContext context) {
        try {
            CompactionResult compaction = contextCompactor.compact(SessionRepair.repair(context.getMessages()));
            context.setMessages(new ArrayList<>(compaction.messages()));
            sessionStore.save(context.getSessionId(), context.getMessages());
        } catch (RuntimeException e) {
            log.error("Failed to persist session [agent={}, session={}]",
                    context.getAgentId(), context.getSessionId(), e);
        }
    }

    private void emitUsage(AgentContext context, RunContext run, TurnResult result) {
        usageSink.record(UsageEvent.builder()
                .agentId(context.getAgentId())
                .sessionId(context.getSessionId())
                .model(context.getModel())
                .status(result.getStatus().name())
                .failureReason(result.getFailureReason() != null ? result.getFailureReason().name() : null)
                .tokensIn(run.getInputTokens())
                .tokensOut(run.getOutputTokens())
                .costEstimateUsd(result.getCostUsd())
                .iterations(result.getIterations())
                .toolCalls(run.getToolCallRecords().size())
                .latencyMs(run.elapsedMs())
                .build());
    }

    private int maxTokens(String agentId) {
        int configured = properties.getLoop().getMaxOutputTokens();
        long bound = capabilityManager.maxTokenBound(agentId).orElse(Long.MAX_VALUE);
        return (int) Math.min(configured, bound);
    }

    private TurnResult completed(AgentContext context, RunContext run, String text, boolean maxIterationsReached) {
        return TurnResult.builder()
                .agentId(context.getAgentId())
                .status(TurnStatus.COMPLETED)
                .text(text)
                .tokensIn(run.getInputTokens())
                .tokensOut(run.getOutputTokens())
                .iterations(context.getIteration())
                .costUsd(costEstimator.estimate(context.getModel(), run.getInputTokens(), run.getOutputTokens()))
                .maxIterationsReached(maxIterationsReached)
                .toolCallsExecuted(run.toolNames())
                .build();
    }

    private TurnResult failed(AgentContext context, RunContext run, FailureReason reason, String message) {
        context.setState(TurnState.FAILED);
        return TurnResult.builder()
                .agentId(context.getAgentId())
                .status(TurnStatus.FAILED)
                .failureReason(reason)
                .errorMessage(message)
                .tokensIn(run.getInputTokens())
                .tokensOut(run.getOutputTokens())
                .iterations(context.getIteration())
                .costUsd(costEstimator.estimate(context.getModel(), run.getInputTokens(), run.getOutputTokens()))
                .toolCallsExecuted(run.toolNames())
                .build();
    }

    private static String abbreviate(String s) {
        if (s == null) return "";
        return s.length() <= 120 ? s : s.substring(0, 120) + "...";
    }
}
