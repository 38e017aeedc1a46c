package com.teenagi.agent.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.teenagi.agent.capability.CapabilityRegistry;
import com.teenagi.agent.exception.AgentException;
import com.teenagi.agent.exception.ArgumentValidationException;
import com.teenagi.agent.exception.FunctionNotFoundException;
import com.teenagi.agent.exception.MalformedDecisionException;
import com.teenagi.agent.function.ArgumentValidator;
import com.teenagi.agent.function.FunctionRegistry;
import com.teenagi.agent.function.RegisteredFunction;
import com.teenagi.agent.function.TypedArguments;
import com.teenagi.agent.llm.DecisionRequest;
import com.teenagi.agent.llm.ProviderAdapter;
import com.teenagi.agent.model.AgentResponse;
import com.teenagi.agent.model.ConversationTurn;
import com.teenagi.agent.model.Decision;
import com.teenagi.agent.model.FunctionCall;
import com.teenagi.agent.observability.RunContext;
import com.teenagi.agent.resilience.TimeLimitedExecutor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Core tool-use loop (decide -> execute -> observe -> repeat).
 *
 * Per-run flow:
 * 1. Record the request as the first turn
 * 2. Ask the provider for a decision, with capabilities, functions and the full history
 * 3. Final answer: done. Call proposal: run each call in the proposed order,
 *    appending the call and its result before the next one starts
 * 4. Stop after maxIterations round-trips, reporting what was gathered
 *
 * Unknown functions, bad arguments and function failures become ERROR results
 * the model can react to. Only provider failures, and malformed responses that
 * re-prompting cannot fix, escape to the caller.
 *
 * Stateless between runs; concurrent runs share only the registries.
 */
@Slf4j
public class AgentLoop {

    static final String NO_CAPABILITIES_ANSWER = "I'm %s, but I don't have any capabilities yet.";

    private final String agentName;
    private final ProviderAdapter providerAdapter;
    private final CapabilityRegistry capabilityRegistry;
    private final FunctionRegistry functionRegistry;
    private final ArgumentValidator argumentValidator;
    private final PromptBuilder promptBuilder;
    private final TimeLimitedExecutor functionExecutor;
    private final ObjectMapper objectMapper;
    private final LoopSettings settings;

    public AgentLoop(String agentName,
                     ProviderAdapter providerAdapter,
                     CapabilityRegistry capabilityRegistry,
                     FunctionRegistry functionRegistry,
                     ArgumentValidator argumentValidator,
                     PromptBuilder promptBuilder,
                     TimeLimitedExecutor functionExecutor,
                     ObjectMapper objectMapper,
                     LoopSettings settings) {
        if (settings.getMaxIterations() < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1");
        }
        this.agentName = agentName;
        this.providerAdapter = providerAdapter;
        this.capabilityRegistry = capabilityRegistry;
        this.functionRegistry = functionRegistry;
        this.argumentValidator = argumentValidator;
        this.promptBuilder = promptBuilder;
        this.functionExecutor = functionExecutor;
        this.objectMapper = objectMapper;
        this.settings = settings;
    }

    public AgentResponse run(String input) {
        log.info("Agent run started [agent={}, provider={}, inputLength={}]",
                agentName, providerAdapter.providerName(), input.length());
        log.debug("Agent input: {}", input);

        RunContext runCtx = new RunContext();
        AgentContext context = AgentContext.start(input);

        if (capabilityRegistry.isEmpty()) {
            log.warn("No capabilities defined [agent={}]", agentName);
            return complete(context, String.format(NO_CAPABILITIES_ANSWER, agentName));
        }

        AgentResponse response = executeLoop(context, runCtx);

        log.info("Agent run complete [agent={}, outcome={}, iterations={}, calls={}, failedCalls={}, latency={}ms, tokens={}]",
                agentName, response.getOutcome(), response.getIterationsUsed(),
                runCtx.getFunctionCallRecords().size(), runCtx.failedCalls(),
                runCtx.elapsedMs(), runCtx.totalTokens());
        return response;
    }

    private AgentResponse executeLoop(AgentContext context, RunContext runCtx) {
        int maxIterations = settings.getMaxIterations();
        int malformedRetriesLeft = settings.getMalformedDecisionRetries();

        while (context.getCurrentIteration() < maxIterations) {
            int iteration = context.nextIteration();
            log.info("Agent iteration {}/{} [agent={}]", iteration, maxIterations, agentName);

            Decision decision;
            try {
                decision = providerAdapter.decide(buildRequest(context));
                if (!decision.isFinalAnswer() && decision.getCalls().isEmpty()) {
                    throw new MalformedDecisionException("Call proposal without any function call");
                }
            } catch (MalformedDecisionException e) {
                if (e.isSalvageable()) {
                    log.warn("Unusable function calls proposed, reporting back to the model: {}", e.getMessage());
                    decision = e.getSalvageableDecision();
                } else if (malformedRetriesLeft > 0 && iteration < maxIterations) {
                    malformedRetriesLeft--;
                    log.warn("Malformed decision, re-prompting ({} retries left): {}",
                            malformedRetriesLeft, e.getMessage());
                    continue;
                } else {
                    log.error("Malformed decision, giving up [agent={}]: {}", agentName, e.getMessage());
                    throw e;
                }
            }

            runCtx.addTokens(decision.getPromptTokens(), decision.getCompletionTokens());

            if (decision.isFinalAnswer()) {
                return complete(context, decision.getContent());
            }

            // Strictly sequential, in proposal order: each result lands in history
            // before the next call starts.
            for (FunctionCall call : decision.getCalls()) {
                executeCall(call, context, runCtx);
            }
        }

        log.warn("Agent hit max iterations ({}) [agent={}]", maxIterations, agentName);
        return AgentResponse.builder()
                .finalAnswer(summarizePartialResults(context, maxIterations))
                .outcome(AgentResponse.Outcome.MAX_ITERATIONS_EXCEEDED)
                .functionCallsExecuted(List.copyOf(context.getExecutedCalls()))
                .turns(context.snapshot())
                .iterationsUsed(context.getCurrentIteration())
                .build();
    }

    private DecisionRequest buildRequest(AgentContext context) {
        var functions = functionRegistry.descriptors();
        return DecisionRequest.builder()
                .systemPrompt(promptBuilder.build(agentName, capabilityRegistry.statements(), functions))
                .functions(functions)
                .turns(context.snapshot())
                .build();
    }

    private void executeCall(FunctionCall call, AgentContext context, RunContext runCtx) {
        log.info("Model requested function: [{}] [agent={}]", call.getFunctionName(), agentName);
        context.append(ConversationTurn.functionCall(call));
        context.getExecutedCalls().add(call);

        long start = System.currentTimeMillis();
        ConversationTurn result = invoke(call);
        runCtx.recordFunctionCall(call.getFunctionName(), System.currentTimeMillis() - start, result.isError());

        context.append(result);
    }

    /**
     * Produces exactly one FUNCTION_RESULT turn for the call. Never throws for
     * anything the model can recover from.
     */
    private ConversationTurn invoke(FunctionCall call) {
        if (call.isMalformed()) {
            return error(call, call.getParseError());
        }

        RegisteredFunction function;
        try {
            function = functionRegistry.resolve(call.getFunctionName());
        } catch (FunctionNotFoundException e) {
            return error(call, String.format("Function '%s' is not available. Available functions: %s",
                    call.getFunctionName(), functionRegistry.names()));
        }

        TypedArguments arguments;
        try {
            arguments = argumentValidator.validate(function.descriptor(), call.getArguments());
        } catch (ArgumentValidationException e) {
            return error(call, e.getMessage());
        }

        log.info("Executing function: [{}] with args: {}", function.name(), arguments);
        try {
            Object value = functionExecutor.call(() -> function.invoker().invoke(arguments));
            String rendered = render(value);
            log.debug("Function [{}] returned: {}", function.name(), rendered);
            return ConversationTurn.functionResult(call, rendered);
        } catch (TimeoutException e) {
            return error(call, String.format("Function '%s' did not finish within %dms",
                    function.name(), functionExecutor.getTimeout().toMillis()));
        } catch (InterruptedException e) {
            throw new AgentException("Interrupted while executing function '" + function.name() + "'", e);
        } catch (Exception e) {
            log.error("Function [{}] failed", function.name(), e);
            return error(call, "Function execution failed: " + describe(e));
        }
    }

    private ConversationTurn error(FunctionCall call, String description) {
        log.warn("Function call [{}] rejected: {}", call.getFunctionName(), description);
        return ConversationTurn.functionError(call, "ERROR: " + description);
    }

    /** Strings go to the model verbatim; everything else as JSON. */
    private String render(Object value) {
        if (value == null) {
            return "(no result)";
        }
        if (value instanceof CharSequence) {
            return value.toString();
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.debug("Result of type {} is not JSON-serializable, using toString()", value.getClass().getName());
            return String.valueOf(value);
        }
    }

    private AgentResponse complete(AgentContext context, String answer) {
        context.append(ConversationTurn.finalAnswer(answer));
        return AgentResponse.builder()
                .finalAnswer(answer)
                .outcome(AgentResponse.Outcome.COMPLETED)
                .functionCallsExecuted(List.copyOf(context.getExecutedCalls()))
                .turns(context.snapshot())
                .iterationsUsed(context.getCurrentIteration())
                .build();
    }

    private static String summarizePartialResults(AgentContext context, int maxIterations) {
        StringBuilder answer = new StringBuilder("I could not complete the request within ")
                .append(maxIterations).append(maxIterations == 1 ? " step." : " steps.");

        List<ConversationTurn> results = context.getTurns().stream()
                .filter(t -> t.getType() == ConversationTurn.Type.FUNCTION_RESULT)
                .toList();
        if (results.isEmpty()) {
            return answer.append(" No function results were obtained.").toString();
        }

        answer.append(" Results gathered so far:");
        for (ConversationTurn result : results) {
            answer.append("\n- ").append(result.getFunctionName()).append(": ").append(result.getContent());
        }
        return answer.toString();
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
