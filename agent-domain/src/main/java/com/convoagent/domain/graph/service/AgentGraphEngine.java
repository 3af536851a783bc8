package com.convoagent.domain.graph.service;

import com.convoagent.domain.conversation.adapter.repository.ICheckpointRepository;
import com.convoagent.domain.conversation.model.entity.ConversationThreadEntity;
import com.convoagent.domain.conversation.model.valobj.ConversationMessage;
import com.convoagent.domain.conversation.model.valobj.ToolCallRequest;
import com.convoagent.domain.conversation.service.ConversationDomainService;
import com.convoagent.domain.graph.adapter.gateway.IChatModelGateway;
import com.convoagent.domain.graph.model.valobj.AgentTurnCommand;
import com.convoagent.domain.graph.model.valobj.AgentTurnResult;
import com.convoagent.domain.graph.model.valobj.ChatGeneration;
import com.convoagent.domain.graph.model.valobj.ChatGenerationRequest;
import com.convoagent.domain.graph.model.valobj.Deadline;
import com.convoagent.domain.graph.model.valobj.ExecutionPolicy;
import com.convoagent.domain.graph.model.valobj.NodeOutcome;
import com.convoagent.domain.tool.model.valobj.ToolInvocationResult;
import com.convoagent.domain.tool.model.valobj.ToolResult;
import com.convoagent.domain.tool.model.valobj.ToolSessionContext;
import com.convoagent.domain.tool.service.ToolRegistry;
import com.convoagent.domain.tool.service.ToolRegistryFactory;
import com.convoagent.domain.trace.service.AgentTracer;
import com.convoagent.domain.trace.service.SpanScope;
import com.convoagent.types.enums.GraphStateEnum;
import com.convoagent.types.enums.ResponseCode;
import com.convoagent.types.enums.RunStatusEnum;
import com.convoagent.types.exception.AppException;
import com.convoagent.types.exception.NodeFailureException;
import com.google.common.util.concurrent.Striped;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Lock;

/**
 * 两节点状态图执行引擎。
 * <p>
 * 一轮执行在同一 threadId 的锁内完成完整的 读检查点 - 规划 - 执行 - 写检查点；检查点仓储的版本比较作为跨进程的第二道保护。
 * 模型生成与工具调用提交到工作线程池并按剩余预算等待，超时即放弃该调用，本轮以 timeout 结束且不写检查点。
 * 只有 success 的轮次会写入检查点。
 * </p>
 */
@Slf4j
public class AgentGraphEngine {

    static final String NODE_PLANNER = "planner";
    static final String NODE_EXECUTOR = "executor";
    private static final String NODE_TOOL = "tool";

    private final ICheckpointRepository checkpointRepository;
    private final IChatModelGateway chatModelGateway;
    private final ToolRegistryFactory toolRegistryFactory;
    private final ConversationDomainService conversationDomainService;
    private final GraphTransitionDomainService transitionDomainService;
    private final AgentPromptDomainService promptDomainService;
    private final AgentTracer tracer;
    private final ExecutorService nodeWorker;
    private final ExecutionPolicy policy;
    private final Striped<Lock> threadLocks;

    public AgentGraphEngine(ICheckpointRepository checkpointRepository,
                            IChatModelGateway chatModelGateway,
                            ToolRegistryFactory toolRegistryFactory,
                            ConversationDomainService conversationDomainService,
                            GraphTransitionDomainService transitionDomainService,
                            AgentPromptDomainService promptDomainService,
                            AgentTracer tracer,
                            ExecutorService nodeWorker,
                            ExecutionPolicy policy,
                            int lockStripes) {
        this.checkpointRepository = checkpointRepository;
        this.chatModelGateway = chatModelGateway;
        this.toolRegistryFactory = toolRegistryFactory;
        this.conversationDomainService = conversationDomainService;
        this.transitionDomainService = transitionDomainService;
        this.promptDomainService = promptDomainService;
        this.tracer = tracer;
        this.nodeWorker = nodeWorker;
        this.policy = policy;
        this.threadLocks = Striped.lazyWeakLock(Math.max(lockStripes, 1));
    }

    public AgentTurnResult execute(AgentTurnCommand command) {
        String message = conversationDomainService.normalizeMessage(command.message());
        String threadId = conversationDomainService.resolveThreadId(command.threadId());
        Deadline deadline = Deadline.after(resolveBudget(command.budget()));
        TurnState turn = new TurnState(threadId);

        Lock lock = threadLocks.get(threadId);
        boolean locked;
        try {
            locked = lock.tryLock(deadline.remainingNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            turn.errorMessage = "interrupted while waiting for thread lock";
            return finish(turn, NodeOutcome.NODE_FAILED);
        }
        if (!locked) {
            turn.errorMessage = "budget exceeded while waiting for thread lock";
            return finish(turn, NodeOutcome.TIMED_OUT);
        }
        try {
            return executeLocked(command, message, deadline, turn);
        } finally {
            lock.unlock();
        }
    }

    public String modelName() {
        return chatModelGateway.modelName();
    }

    private AgentTurnResult executeLocked(AgentTurnCommand command, String message, Deadline deadline, TurnState turn) {
        ConversationThreadEntity thread;
        try (SpanScope span = tracer.span("checkpoint.load")) {
            try {
                thread = checkpointRepository.load(turn.threadId);
                span.attribute("messages", thread.history().size());
            } catch (RuntimeException ex) {
                span.markError(ex);
                log.warn("CHECKPOINT_LOAD_FAILED threadId={}, error={}", turn.threadId, ex.getMessage());
                turn.errorMessage = "checkpoint unavailable: " + conversationDomainService.resolveErrorMessage(ex);
                return finish(turn, NodeOutcome.NODE_FAILED);
            }
        }
        if (!conversationDomainService.isThreadAccessible(thread, command.userId())) {
            log.warn("THREAD_OWNER_MISMATCH threadId={}, owner={}, caller={}", turn.threadId, thread.getUserId(), command.userId());
            throw new AppException(ResponseCode.FORBIDDEN.getCode(), "Not enough permissions to access this thread");
        }

        List<ConversationMessage> transcript = new ArrayList<>(thread.history());
        ConversationMessage userMessage = ConversationMessage.user(message, command.attachments());
        transcript.add(userMessage);
        ToolRegistry registry = toolRegistryFactory.compose(new ToolSessionContext(command.userId(), turn.threadId));

        GraphStateEnum state = GraphStateEnum.PLANNING;
        NodeOutcome outcome = null;
        while (!state.isTerminal()) {
            if (deadline.expired()) {
                outcome = NodeOutcome.TIMED_OUT;
            } else if (state == GraphStateEnum.PLANNING) {
                outcome = runPlanner(turn, transcript, registry, deadline);
            } else {
                outcome = runExecutorStep(turn, transcript, registry, deadline);
            }
            GraphStateEnum next = transitionDomainService.next(state, outcome);
            log.debug("GRAPH_TRANSITION threadId={}, from={}, outcome={}, to={}", turn.threadId, state, outcome, next);
            state = next;
        }

        if (transitionDomainService.resolveStatus(outcome) != RunStatusEnum.SUCCESS) {
            return finish(turn, outcome);
        }
        if (deadline.expired()) {
            turn.errorMessage = "budget exceeded before checkpoint write";
            return finish(turn, NodeOutcome.TIMED_OUT);
        }
        try (SpanScope span = tracer.span("checkpoint.save")) {
            try {
                thread.appendTurn(command.userId(), userMessage,
                        ConversationMessage.agent(turn.finalText, turn.agentAttachments()), turn.plan);
                checkpointRepository.save(thread);
                span.attribute("messages", thread.history().size());
            } catch (RuntimeException ex) {
                span.markError(ex);
                log.warn("CHECKPOINT_SAVE_FAILED threadId={}, error={}", turn.threadId, ex.getMessage());
                turn.errorMessage = "checkpoint unavailable: " + conversationDomainService.resolveErrorMessage(ex);
                return finish(turn, NodeOutcome.NODE_FAILED);
            }
        }
        return finish(turn, NodeOutcome.FINAL_RESPONSE);
    }

    private NodeOutcome runPlanner(TurnState turn,
                                   List<ConversationMessage> transcript,
                                   ToolRegistry registry,
                                   Deadline deadline) {
        try (SpanScope span = tracer.span("node." + NODE_PLANNER)) {
            ChatGenerationRequest request = new ChatGenerationRequest(
                    NODE_PLANNER,
                    promptDomainService.plannerPrompt(registry.names()),
                    new ArrayList<>(transcript),
                    List.of());
            ChatGeneration generation;
            try {
                generation = generate(request, deadline);
            } catch (TimeoutException ex) {
                span.markError("timeout");
                return NodeOutcome.TIMED_OUT;
            } catch (NodeFailureException ex) {
                span.markError(ex);
                turn.errorMessage = "planner failed: " + ex.getMessage();
                return NodeOutcome.PLAN_FAILED;
            }
            turn.addUsage(generation);
            if (!generation.hasText()) {
                span.markError("empty plan");
                turn.errorMessage = "planner returned an empty plan";
                return NodeOutcome.PLAN_FAILED;
            }
            turn.plan = generation.text().trim();
            return NodeOutcome.PLAN_READY;
        }
    }

    private NodeOutcome runExecutorStep(TurnState turn,
                                        List<ConversationMessage> transcript,
                                        ToolRegistry registry,
                                        Deadline deadline) {
        if (turn.steps >= policy.maxSteps()) {
            turn.truncated = true;
            turn.errorMessage = "executor step budget exhausted after " + turn.steps + " steps";
            return NodeOutcome.STEP_BUDGET_EXHAUSTED;
        }
        boolean toolsEnabled = !registry.isEmpty()
                && turn.consecutiveToolFailures < policy.maxConsecutiveToolFailures();
        try (SpanScope span = tracer.span("node." + NODE_EXECUTOR)) {
            span.attribute("step", turn.steps + 1).attribute("tools_enabled", toolsEnabled);
            ChatGenerationRequest request = new ChatGenerationRequest(
                    NODE_EXECUTOR,
                    promptDomainService.executorPrompt(turn.plan, toolsEnabled),
                    new ArrayList<>(transcript),
                    toolsEnabled ? registry.specs() : List.of());
            ChatGeneration generation;
            try {
                generation = generate(request, deadline);
            } catch (TimeoutException ex) {
                span.markError("timeout");
                return NodeOutcome.TIMED_OUT;
            } catch (NodeFailureException ex) {
                span.markError(ex);
                turn.errorMessage = "executor failed: " + ex.getMessage();
                return NodeOutcome.NODE_FAILED;
            }
            turn.steps++;
            turn.addUsage(generation);
            if (generation.hasText()) {
                turn.lastText = generation.text().trim();
            }

            if (generation.hasToolCalls() && toolsEnabled) {
                transcript.add(ConversationMessage.agentToolCalls(generation.text(), generation.toolCalls()));
                for (ToolCallRequest call : generation.toolCalls()) {
                    ToolInvocationResult result;
                    try {
                        result = invokeTool(registry, call, deadline);
                    } catch (TimeoutException ex) {
                        span.markError("timeout in tool " + call.name());
                        return NodeOutcome.TIMED_OUT;
                    }
                    transcript.add(ConversationMessage.toolResult(call.id(), call.name(), result.content()));
                    turn.toolCalls.add(call.name());
                    turn.consecutiveToolFailures = result.failed() ? turn.consecutiveToolFailures + 1 : 0;
                }
                return NodeOutcome.TOOL_CALLS_REQUESTED;
            }

            if (!generation.hasText()) {
                span.markError("empty response");
                turn.errorMessage = generation.hasToolCalls()
                        ? "executor requested tools after tool use was disabled"
                        : "executor returned an empty response";
                return NodeOutcome.NODE_FAILED;
            }
            turn.finalText = generation.text().trim();
            return NodeOutcome.FINAL_RESPONSE;
        }
    }

    private ChatGeneration generate(ChatGenerationRequest request, Deadline deadline) throws TimeoutException {
        Callable<ChatGeneration> task = tracer.wrap(() -> {
            try (SpanScope span = tracer.span("llm." + request.node())) {
                span.attribute("model", chatModelGateway.modelName())
                        .attribute("messages", request.messages().size())
                        .attribute("tools", request.tools().size());
                try {
                    ChatGeneration generation = chatModelGateway.generate(request);
                    if (generation == null) {
                        throw new NodeFailureException(request.node(), "model returned no generation");
                    }
                    span.attribute("prompt_tokens", generation.promptTokens())
                            .attribute("completion_tokens", generation.completionTokens())
                            .attribute("tool_calls", generation.hasToolCalls() ? generation.toolCalls().size() : 0);
                    return generation;
                } catch (RuntimeException ex) {
                    span.markError(ex);
                    throw ex;
                }
            }
        });
        return callWithDeadline(task, deadline, request.node());
    }

    private ToolInvocationResult invokeTool(ToolRegistry registry, ToolCallRequest call, Deadline deadline) throws TimeoutException {
        Callable<ToolInvocationResult> task = tracer.wrap(() -> {
            try (SpanScope span = tracer.span("tool." + call.name())) {
                span.attribute("call_id", call.id());
                ToolInvocationResult result = registry.invoke(call);
                if (result.failed()) {
                    span.markError(result.result() == null ? "no result" : result.result().getError());
                }
                return result;
            }
        });
        try {
            return callWithDeadline(task, deadline, NODE_TOOL);
        } catch (NodeFailureException ex) {
            ToolResult failure = ToolResult.failure("Tool " + call.name() + " failed: " + ex.getMessage());
            return new ToolInvocationResult(call.id(), call.name(), failure, registry.render(failure));
        }
    }

    private <T> T callWithDeadline(Callable<T> task, Deadline deadline, String node) throws TimeoutException {
        Future<T> future;
        try {
            future = nodeWorker.submit(task);
        } catch (RejectedExecutionException ex) {
            throw new NodeFailureException(node, "node worker pool is saturated", ex);
        }
        try {
            return future.get(deadline.remainingNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("NODE_CALL_TIMEOUT node={}, budgetMs={}", node, deadline.budgetMillis());
            throw ex;
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new NodeFailureException(node, "interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            throw new NodeFailureException(node, conversationDomainService.resolveErrorMessage(cause), cause);
        }
    }

    private AgentTurnResult finish(TurnState turn, NodeOutcome terminalOutcome) {
        RunStatusEnum status = transitionDomainService.resolveStatus(terminalOutcome);
        String response;
        if (status == RunStatusEnum.SUCCESS) {
            response = turn.finalText;
        } else if (status == RunStatusEnum.TIMEOUT) {
            response = conversationDomainService.timeoutMessage();
            if (turn.errorMessage == null) {
                turn.errorMessage = "invocation budget exceeded";
            }
        } else {
            String bestEffort = terminalOutcome == NodeOutcome.STEP_BUDGET_EXHAUSTED ? turn.lastText : null;
            response = conversationDomainService.failureMessage(bestEffort);
        }
        log.info("AGENT_TURN_DONE threadId={}, outcome={}, status={}, steps={}, toolCalls={}, truncated={}, error={}",
                turn.threadId, terminalOutcome, status.getCode(), turn.steps, turn.toolCalls.size(), turn.truncated,
                turn.errorMessage);
        return AgentTurnResult.builder()
                .threadId(turn.threadId)
                .response(response)
                .plan(turn.plan)
                .status(status)
                .truncated(turn.truncated)
                .promptTokens(turn.promptTokens)
                .completionTokens(turn.completionTokens)
                .steps(turn.steps)
                .toolCalls(new ArrayList<>(turn.toolCalls))
                .errorMessage(status == RunStatusEnum.SUCCESS ? null : turn.errorMessage)
                .build();
    }

    private Duration resolveBudget(Duration requested) {
        if (requested == null || requested.isZero() || requested.isNegative()) {
            return policy.defaultBudget();
        }
        return requested;
    }

    /**
     * 单轮在途状态，仅由持锁的调用线程修改。
     */
    private static final class TurnState {

        private final String threadId;
        private final List<String> toolCalls = new ArrayList<>();
        private String plan;
        private String finalText;
        private String lastText;
        private String errorMessage;
        private int steps;
        private int consecutiveToolFailures;
        private boolean truncated;
        private int promptTokens;
        private int completionTokens;

        private TurnState(String threadId) {
            this.threadId = threadId;
        }

        private void addUsage(ChatGeneration generation) {
            if (generation.promptTokens() != null) {
                promptTokens += generation.promptTokens();
            }
            if (generation.completionTokens() != null) {
                completionTokens += generation.completionTokens();
            }
        }

        private Map<String, Object> agentAttachments() {
            Map<String, Object> attachments = new LinkedHashMap<>();
            attachments.put("steps", steps);
            if (!toolCalls.isEmpty()) {
                attachments.put("tool_calls", new ArrayList<>(toolCalls));
            }
            return attachments;
        }
    }
}
