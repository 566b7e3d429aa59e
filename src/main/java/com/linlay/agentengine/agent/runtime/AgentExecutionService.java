package com.linlay.agentengine.agent.runtime;

import com.linlay.agentengine.agent.Agent;
import com.linlay.agentengine.agent.AgentNotFoundException;
import com.linlay.agentengine.agent.AgentRepository;
import com.linlay.agentengine.agent.AgentVersioning;
import com.linlay.agentengine.config.ExecutionProperties;
import com.linlay.agentengine.error.AgentEngineException;
import com.linlay.agentengine.error.ModelException;
import com.linlay.agentengine.error.UnauthorizedToolException;
import com.linlay.agentengine.error.ValidationException;
import com.linlay.agentengine.memory.MessageWindowingService;
import com.linlay.agentengine.memory.StructuredMemoryService;
import com.linlay.agentengine.model.GenerateRequest;
import com.linlay.agentengine.model.GenerateResponse;
import com.linlay.agentengine.model.Message;
import com.linlay.agentengine.model.ModelAdapter;
import com.linlay.agentengine.model.ModelInfo;
import com.linlay.agentengine.model.ModelNotFoundException;
import com.linlay.agentengine.model.ModelRegistryService;
import com.linlay.agentengine.model.ModelSettings;
import com.linlay.agentengine.model.TokenUsage;
import com.linlay.agentengine.model.ToolCall;
import com.linlay.agentengine.model.ToolDefinition;
import com.linlay.agentengine.model.adapter.ModelAdapterFactory;
import com.linlay.agentengine.stream.model.StreamChunk;
import com.linlay.agentengine.stream.model.StreamEvent;
import com.linlay.agentengine.stream.service.StreamSession;
import com.linlay.agentengine.stream.service.StreamSessionManager;
import com.linlay.agentengine.tool.ToolRegistry;
import com.linlay.agentengine.tool.ToolResult;
import com.linlay.agentengine.trace.Run;
import com.linlay.agentengine.trace.RunNotFoundException;
import com.linlay.agentengine.trace.RunStatus;
import com.linlay.agentengine.trace.RunVersion;
import com.linlay.agentengine.trace.ToolExecution;
import com.linlay.agentengine.trace.TraceStore;
import com.linlay.agentengine.trace.Turn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Drives the reason/act/observe loop of one agent run: call the model, dispatch the tool
 * calls it asks for, feed the observations back, repeat until the model answers without tool
 * calls or the turn limit is hit. Every tool execution and every turn is persisted as soon as
 * it completes.
 */
@Service
public class AgentExecutionService {

    private static final Logger log = LoggerFactory.getLogger(AgentExecutionService.class);

    static final String TOOL_RESULTS_PLACEHOLDER = "[Tool results]";
    static final String MEMORY_PREFIX = "Structured memory from previous conversations:\n\n";

    private final AgentRepository agentRepository;
    private final ModelRegistryService modelRegistry;
    private final ModelAdapterFactory adapterFactory;
    private final ToolRegistry toolRegistry;
    private final TraceStore traceStore;
    private final StreamSessionManager sessionManager;
    private final MessageWindowingService windowingService;
    private final StructuredMemoryService memoryService;
    private final ExecutionProperties executionProperties;

    public AgentExecutionService(
            AgentRepository agentRepository,
            ModelRegistryService modelRegistry,
            ModelAdapterFactory adapterFactory,
            ToolRegistry toolRegistry,
            TraceStore traceStore,
            StreamSessionManager sessionManager,
            MessageWindowingService windowingService,
            StructuredMemoryService memoryService,
            ExecutionProperties executionProperties
    ) {
        this.agentRepository = agentRepository;
        this.modelRegistry = modelRegistry;
        this.adapterFactory = adapterFactory;
        this.toolRegistry = toolRegistry;
        this.traceStore = traceStore;
        this.sessionManager = sessionManager;
        this.windowingService = windowingService;
        this.memoryService = memoryService;
        this.executionProperties = executionProperties;
    }

    /**
     * Runs a new conversation to completion.
     *
     * @return id of the created run
     */
    public String execute(String agentId, String userMessage, ExecutionOptions options) {
        ExecutionOptions opts = options == null ? ExecutionOptions.defaults() : options;
        try {
            requireText(agentId, "agentId");
            requireText(userMessage, "userMessage");
            Agent agent = agentRepository.findById(agentId).orElseThrow(() -> new AgentNotFoundException(agentId));
            ModelInfo model = resolveModel(StringUtils.hasText(opts.modelOverride())
                    ? opts.modelOverride()
                    : agent.defaultModel());
            ModelAdapter adapter = adapterFactory.create(model.id());
            ModelSettings settings = agent.settings().merge(opts.settings());

            Run run = traceStore.createRun(agent.id(), model.id(), settings, agent.promptVersion());
            log.info("[run:{}] started agent={} model={} maxTurns={} streaming={}",
                    run.id(), agent.id(), model.id(), maxTurns(opts), opts.streamSessionId() != null);
            if (opts.streamSessionId() != null) {
                sessionManager.send(opts.streamSessionId(), StreamEvent.RUN_CREATED, Map.of("runId", run.id()));
            }

            runToCompletion(new RunContext(agent, run.id(), model, adapter, settings, 1, List.of(), userMessage, opts));
            return run.id();
        } catch (RuntimeException ex) {
            failSession(opts.streamSessionId(), ex);
            throw ex;
        }
    }

    /**
     * Starts {@link #execute} on a background worker and returns the session that receives its
     * events. Failures are delivered as an {@code error} event.
     */
    public StreamSession executeStreaming(String agentId, String userMessage, ExecutionOptions options) {
        ExecutionOptions opts = options == null ? ExecutionOptions.defaults() : options;
        StreamSession session = sessionManager.createSession();
        submit(session.sessionId(), () -> execute(agentId, userMessage, opts.withStreamSessionId(session.sessionId())));
        return session;
    }

    /**
     * Appends a new user message to an existing run: replays its finalized turns into the
     * buffer and resumes the loop with the next turn number.
     */
    public void continueConversation(String runId, String userMessage, ExecutionOptions options) {
        ExecutionOptions opts = options == null ? ExecutionOptions.defaults() : options;
        try {
            requireText(runId, "runId");
            requireText(userMessage, "userMessage");
            Run run = traceStore.getRun(runId).orElseThrow(() -> new RunNotFoundException(runId));
            Agent agent = agentRepository.findById(run.agentId())
                    .orElseThrow(() -> new AgentNotFoundException(run.agentId()));
            ModelInfo model = resolveModel(StringUtils.hasText(opts.modelOverride())
                    ? opts.modelOverride()
                    : run.modelUsed());
            ModelAdapter adapter = adapterFactory.create(model.id());
            ModelSettings base = run.modelSettings() == null ? agent.settings() : run.modelSettings();
            ModelSettings settings = base.merge(opts.settings());
            List<Message> history = buildConversationHistory(run);

            traceStore.reopenRun(runId);
            if (opts.streamSessionId() != null) {
                sessionManager.send(opts.streamSessionId(), StreamEvent.RUN_CREATED, Map.of("runId", runId));
            }
            log.info("[run:{}] continuing agent={} model={} replayedMessages={} nextTurn={}",
                    runId, agent.id(), model.id(), history.size(), run.lastFinalizedTurnNumber() + 1);

            runToCompletion(new RunContext(agent, runId, model, adapter, settings,
                    run.lastFinalizedTurnNumber() + 1, history, userMessage, opts));
        } catch (RuntimeException ex) {
            failSession(opts.streamSessionId(), ex);
            throw ex;
        }
    }

    public StreamSession continueConversationStreaming(String runId, String userMessage, ExecutionOptions options) {
        ExecutionOptions opts = options == null ? ExecutionOptions.defaults() : options;
        StreamSession session = sessionManager.createSession();
        submit(session.sessionId(),
                () -> continueConversation(runId, userMessage, opts.withStreamSessionId(session.sessionId())));
        return session;
    }

    /**
     * Rebuilds the model buffer from persisted turns. Tool executions become the assistant's
     * tool calls followed by one tool message per result; placeholder user messages of
     * follow-up turns are not replayed.
     */
    List<Message> buildConversationHistory(Run run) {
        List<Message> messages = new ArrayList<>();
        for (Turn turn : run.finalizedTurns()) {
            if (StringUtils.hasText(turn.userMessage()) && !TOOL_RESULTS_PLACEHOLDER.equals(turn.userMessage())) {
                messages.add(Message.user(turn.userMessage()));
            }
            List<ToolCall> calls = turn.toolExecutions().stream()
                    .map(execution -> new ToolCall(execution.id(), execution.toolName(), execution.parameters()))
                    .toList();
            if (StringUtils.hasText(turn.assistantMessage()) || !calls.isEmpty()) {
                messages.add(Message.assistant(turn.assistantMessage(), calls));
            }
            for (ToolExecution execution : turn.toolExecutions()) {
                messages.add(Message.tool(execution.id(), execution.result().observation()));
            }
        }
        return messages;
    }

    private void runToCompletion(RunContext ctx) {
        long startNanos = System.nanoTime();
        LoopOutcome outcome;
        try {
            outcome = runLoop(ctx);
        } catch (RuntimeException ex) {
            long elapsedMs = elapsedMs(startNanos);
            log.warn("[run:{}] failed after {}ms: {}", ctx.runId(), elapsedMs, ex.getMessage());
            markError(ctx.runId(), ex, elapsedMs);
            throw ex;
        }

        long elapsedMs = elapsedMs(startNanos);
        traceStore.updateRunStatus(ctx.runId(), RunStatus.COMPLETED, null, elapsedMs);
        if (outcome.maxTurnsReached()) {
            log.warn("[run:{}] Max turns ({}) reached, completing with partial content", ctx.runId(), outcome.iterations());
        } else if (outcome.cancelled()) {
            log.info("[run:{}] stream consumer disconnected, stopped after {} turn(s)", ctx.runId(), outcome.iterations());
        } else {
            log.info("[run:{}] completed after {} turn(s) in {}ms", ctx.runId(), outcome.iterations(), elapsedMs);
        }

        recordVersion(ctx, outcome);
        if (ctx.agent().structuredMemoryEnabled() && !outcome.cancelled()) {
            memoryService.updateMemory(ctx.agent().id(), ctx.runId(), outcome.buffer(), ctx.adapter());
        }
        modelRegistry.recordUsage(ctx.model().id(), tokensPerSecond(outcome.usage(), elapsedMs));

        if (ctx.sessionId() != null) {
            sessionManager.complete(ctx.sessionId());
        }
    }

    private LoopOutcome runLoop(RunContext ctx) {
        List<Message> buffer = buildBuffer(ctx);
        List<ToolDefinition> tools = toolRegistry.toDefinitions(toolRegistry.listByNames(ctx.agent().allowedTools()));
        Set<String> allowedTools = ctx.agent().allowedTools().stream()
                .map(ToolRegistry::normalizeName)
                .collect(Collectors.toSet());
        int maxTurns = maxTurns(ctx.options());

        boolean streaming = ctx.sessionId() != null && sessionManager.isOpen(ctx.sessionId());
        if (ctx.sessionId() != null && !streaming) {
            log.warn("[run:{}] stream session {} is not open, running without streaming", ctx.runId(), ctx.sessionId());
        }

        int turnNumber = ctx.firstTurnNumber();
        int iterations = 0;
        TokenUsage usage = TokenUsage.ZERO;
        String lastContent = "";
        boolean finished = false;
        boolean cancelled = false;

        while (iterations < maxTurns) {
            if (streaming && !sessionManager.isOpen(ctx.sessionId())) {
                cancelled = true;
                break;
            }
            Instant turnStartedAt = Instant.now();
            long turnStartNanos = System.nanoTime();

            GenerateRequest request = new GenerateRequest(ctx.agent().systemPrompt(), buffer, tools, ctx.settings());
            log.debug("[run:{}] turn {} calling model, messages={} tools={}",
                    ctx.runId(), turnNumber, buffer.size(), tools.size());
            GenerateResponse response = streaming
                    ? generateStreaming(ctx.adapter(), request, ctx.sessionId())
                    : ctx.adapter().generate(request);
            buffer.add(Message.assistant(response.content(), response.toolCalls()));

            String turnUserMessage = iterations == 0 ? ctx.userMessage() : TOOL_RESULTS_PLACEHOLDER;
            List<ToolExecution> executions = new ArrayList<>();
            try {
                for (ToolCall call : response.toolCalls()) {
                    if (!allowedTools.contains(ToolRegistry.normalizeName(call.name()))) {
                        throw new UnauthorizedToolException(call.name(), ctx.agent().id());
                    }
                    ToolResult result = toolRegistry.execute(call.name(), call.parameters());
                    log.debug("[run:{}] tool {} success={} {}ms",
                            ctx.runId(), call.name(), result.success(), result.executionTimeMs());
                    ToolExecution logged = traceStore.logToolExecution(ctx.runId(),
                            ToolExecution.draft(call.id(), turnNumber, call.name(), call.parameters(), result));
                    executions.add(logged);
                    buffer.add(Message.tool(call.id(), result.observation()));
                    if (streaming) {
                        sessionManager.send(ctx.sessionId(), StreamEvent.TOOL_RESULT, toolResultPayload(logged));
                    }
                }
            } catch (RuntimeException ex) {
                closeFailedTurn(ctx.runId(), Turn.draft(turnNumber, turnUserMessage, response.content(),
                        executions, response.usage(), turnStartedAt, elapsedMs(turnStartNanos)));
                throw ex;
            }

            traceStore.appendTurn(ctx.runId(), Turn.draft(turnNumber, turnUserMessage, response.content(),
                    executions, response.usage(), turnStartedAt, elapsedMs(turnStartNanos)));

            usage = usage.plus(response.usage());
            lastContent = response.content();
            iterations++;
            turnNumber++;
            if (!response.hasToolCalls()) {
                finished = true;
                break;
            }
        }

        return new LoopOutcome(buffer, lastContent, usage, iterations, !finished && !cancelled, cancelled);
    }

    private List<Message> buildBuffer(RunContext ctx) {
        List<Message> buffer = new ArrayList<>(ctx.history());
        buffer.add(Message.user(ctx.userMessage()));

        Agent agent = ctx.agent();
        if (agent.hasMessageWindow() && buffer.size() > agent.messageWindowSize()) {
            buffer = new ArrayList<>(windowingService.compressMessages(buffer, agent.messageWindowSize(), ctx.adapter()));
        }
        if (agent.structuredMemoryEnabled()) {
            try {
                List<Message> target = buffer;
                memoryService.readMemory(agent.id())
                        .ifPresent(memory -> target.add(0, Message.system(MEMORY_PREFIX + memory)));
            } catch (RuntimeException ex) {
                log.warn("[run:{}] cannot read structured memory of agent {}: {}", ctx.runId(), agent.id(), ex.getMessage());
            }
        }
        return buffer;
    }

    /**
     * Collects a streamed response while forwarding it to the session. An {@code ERROR} chunk
     * becomes a {@link ModelException} once the stream has ended.
     */
    private GenerateResponse generateStreaming(ModelAdapter adapter, GenerateRequest request, String sessionId) {
        StringBuilder content = new StringBuilder();
        List<ToolCall> toolCalls = new ArrayList<>();
        AtomicReference<TokenUsage> usage = new AtomicReference<>(TokenUsage.ZERO);
        AtomicReference<String> error = new AtomicReference<>();
        long timeoutMs = executionProperties.getStreamTimeoutMs();

        try {
            adapter.generateStream(request)
                    .doOnNext(chunk -> {
                        switch (chunk.type()) {
                            case CONTENT -> {
                                String text = chunk.text() == null ? "" : chunk.text();
                                content.append(text);
                                sessionManager.send(sessionId, StreamEvent.CONTENT, Map.of("text", text));
                            }
                            case TOOL_CALL -> {
                                toolCalls.add(chunk.toolCall());
                                sessionManager.send(sessionId, StreamEvent.TOOL_CALL,
                                        Map.of("toolCall", toolCallPayload(chunk.toolCall())));
                            }
                            case DONE -> {
                                usage.set(chunk.usage() == null ? TokenUsage.ZERO : chunk.usage());
                                sessionManager.send(sessionId, StreamEvent.DONE, Map.of("usage", usagePayload(usage.get())));
                            }
                            case ERROR -> error.compareAndSet(null, chunk.error());
                        }
                    })
                    .takeUntil(chunk -> chunk.type() == StreamChunk.Type.ERROR)
                    .timeout(Duration.ofMillis(timeoutMs))
                    .blockLast();
        } catch (AgentEngineException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            Throwable cause = Exceptions.unwrap(ex);
            if (cause instanceof TimeoutException) {
                throw new ModelException(adapter.provider(), "No stream data received for " + timeoutMs + "ms", cause);
            }
            throw new ModelException(adapter.provider(), cause.getMessage() == null
                    ? cause.getClass().getSimpleName()
                    : cause.getMessage(), cause);
        }

        if (error.get() != null) {
            throw new ModelException(adapter.provider(), error.get());
        }
        return new GenerateResponse(content.toString(), toolCalls, usage.get(),
                toolCalls.isEmpty() ? "stop" : "tool_calls", Map.of("streamed", true));
    }

    /**
     * Finalizes a turn that failed after some of its tool calls ran, so the executions already
     * logged keep the input that produced them.
     */
    private void closeFailedTurn(String runId, Turn partial) {
        if (partial.toolExecutions().isEmpty()) {
            return;
        }
        try {
            traceStore.appendTurn(runId, partial);
        } catch (RuntimeException ex) {
            log.warn("[run:{}] cannot finalize failed turn {}: {}", runId, partial.turnNumber(), ex.getMessage());
        }
    }

    private void recordVersion(RunContext ctx, LoopOutcome outcome) {
        try {
            String memoryHash = AgentVersioning.memoryHash(ctx.userMessage(), outcome.lastContent());
            int memoryNumber = traceStore.countRunsWithMemory(ctx.agent().id()) + 1;
            int promptVersion = ctx.agent().promptVersion();
            traceStore.updateRunVersion(ctx.runId(), new RunVersion(promptVersion, memoryNumber, memoryHash,
                    AgentVersioning.version(promptVersion, memoryNumber, memoryHash)));
        } catch (RuntimeException ex) {
            log.warn("[run:{}] cannot record version metadata: {}", ctx.runId(), ex.getMessage());
        }
    }

    private void markError(String runId, RuntimeException cause, long elapsedMs) {
        try {
            traceStore.updateRunStatus(runId, RunStatus.ERROR, describe(cause), elapsedMs);
        } catch (RuntimeException ex) {
            log.error("[run:{}] cannot mark run as failed", runId, ex);
        }
    }

    private void submit(String sessionId, Runnable work) {
        Mono.fromRunnable(work)
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe(
                        ignored -> {
                        },
                        ex -> {
                            log.warn("Background execution for session {} failed: {}", sessionId, ex.getMessage());
                            sessionManager.error(sessionId, describe(ex));
                        });
    }

    private void failSession(String sessionId, RuntimeException ex) {
        if (sessionId != null) {
            sessionManager.error(sessionId, describe(ex));
        }
    }

    private ModelInfo resolveModel(String modelId) {
        requireText(modelId, "model");
        return modelRegistry.find(modelId).orElseThrow(() -> new ModelNotFoundException(modelId));
    }

    private int maxTurns(ExecutionOptions options) {
        Integer requested = options.maxTurns();
        return requested != null && requested > 0 ? requested : executionProperties.getMaxTurns();
    }

    private static void requireText(String value, String field) {
        if (!StringUtils.hasText(value)) {
            throw new ValidationException(field + " is required");
        }
    }

    private static Double tokensPerSecond(TokenUsage usage, long elapsedMs) {
        if (usage.outputTokens() <= 0 || elapsedMs <= 0) {
            return null;
        }
        return usage.outputTokens() * 1000d / elapsedMs;
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    private static String describe(Throwable ex) {
        return ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
    }

    private static Map<String, Object> toolCallPayload(ToolCall call) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", call.id());
        payload.put("name", call.name());
        payload.put("parameters", call.parameters());
        return payload;
    }

    private static Map<String, Object> toolResultPayload(ToolExecution execution) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("toolCallId", execution.id());
        payload.put("name", execution.toolName());
        payload.put("success", execution.result().success());
        payload.put("output", execution.result().output());
        if (execution.result().error() != null) {
            payload.put("error", execution.result().error());
        }
        payload.put("executionTimeMs", execution.result().executionTimeMs());
        return payload;
    }

    private static Map<String, Object> usagePayload(TokenUsage usage) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("inputTokens", usage.inputTokens());
        payload.put("outputTokens", usage.outputTokens());
        payload.put("totalTokens", usage.totalTokens());
        return payload;
    }

    private record RunContext(
            Agent agent,
            String runId,
            ModelInfo model,
            ModelAdapter adapter,
            ModelSettings settings,
            int firstTurnNumber,
            List<Message> history,
            String userMessage,
            ExecutionOptions options
    ) {
        String sessionId() {
            return options.streamSessionId();
        }
    }

    private record LoopOutcome(
            List<Message> buffer,
            String lastContent,
            TokenUsage usage,
            int iterations,
            boolean maxTurnsReached,
            boolean cancelled
    ) {
    }
}
